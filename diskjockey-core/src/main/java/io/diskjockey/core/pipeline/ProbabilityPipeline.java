package io.diskjockey.core.pipeline;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.diskjockey.core.DiskJockeyException;
import io.diskjockey.core.gridding.GriddingCorrection;
import io.diskjockey.core.image.RadmcImageReader;
import io.diskjockey.core.image.SkyImage;
import io.diskjockey.core.image.SynthesizedImage;
import io.diskjockey.core.model.DiskParameters;
import io.diskjockey.core.model.ImageSize;
import io.diskjockey.core.visibility.ModelVisibilities;
import io.diskjockey.core.visibility.VisibilityChannel;
import io.diskjockey.core.visibility.VisibilityDataset;
import io.diskjockey.core.velocity.VelocityMapper;
import io.diskjockey.core.workspace.ImagingArguments;
import io.diskjockey.core.workspace.RadmcInputs;
import io.diskjockey.core.workspace.Workspace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/// Maps a free-parameter vector to its log-probability.
///
/// ## Stages
///
/// ```text
///   acquire workspace
///     → convert vector          ModelException → REJECTED
///     → log-prior, image size   ModelException → REJECTED
///     → stage inputs, write structure and shifted wavelengths
///     → run simulator           IOException    → FATAL
///     → read image.out          ImageException → REJECTED
///     → to sky, gridding correction, FFT, interpolate, phase shift, χ²
///   release workspace           (always, before the result is returned)
/// ```
///
/// Every outcome is reported as an [EvaluationResult]; [#evaluate(double[])]
/// never throws for a failed evaluation. The workspace is closed by
/// try-with-resources before any result, including `FATAL`, leaves this class.
/// Instances hold only the immutable [EvaluationContext] and may be called
/// from many threads at once.
public final class ProbabilityPipeline implements ToDoubleFunction<double[]> {

    private static final Logger logger = LogManager.getLogger(ProbabilityPipeline.class);

    private final EvaluationContext context;

    public ProbabilityPipeline(EvaluationContext context) {
        this.context = context;
    }

    public EvaluationContext context() {
        return context;
    }

    /// Number of free parameters.
    public int dimensions() {
        return context.converter().dimensions();
    }

    /// Evaluates one vector.
    ///
    /// @param vector free parameter values
    /// @return the outcome
    public EvaluationResult evaluate(double[] vector) {
        DiskParameters parameters = null;
        try (Workspace workspace = Workspace.acquire(context.scratch())) {
            parameters = context.converter().convert(vector);
            double lnPrior = context.prior().lnPrior(parameters, context.grid());
            if (Double.isNaN(lnPrior) || lnPrior == Double.NEGATIVE_INFINITY) {
                logger.debug("zero prior density for {}", context.converter().describe(vector));
                return EvaluationResult.rejected("zero prior density");
            }
            SkyImage sky = render(workspace, parameters);
            double lnL = context.likelihood().lnLikelihood(sky, parameters.muRa(), parameters.muDec());
            EvaluationResult result = EvaluationResult.ok(lnL + lnPrior);
            if (result.outcome() != EvaluationResult.Outcome.OK) {
                logger.info("rejecting {}: {}", context.converter().describe(vector), result.reason());
            }
            return result;
        } catch (DiskJockeyException e) {
            logger.debug("rejecting {}: {}", context.converter().describe(vector), e.getMessage());
            return EvaluationResult.rejected(e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Unforeseen error with parameter vector {}", context.converter().describe(vector));
            logger.error("Unforeseen error with parameters {}", parameters, e);
            return EvaluationResult.fatal(e);
        }
    }

    /// The log-probability of a vector, `-∞` for rejected vectors.
    ///
    /// @param vector free parameter values
    /// @return the log-probability
    /// @throws FatalEvaluationException if the evaluation hit an infrastructure fault
    public double lnProbability(double[] vector) {
        EvaluationResult result = evaluate(vector);
        if (result.isFatal()) {
            throw new FatalEvaluationException(vector, result.cause());
        }
        return result.lnProbability();
    }

    @Override
    public double applyAsDouble(double[] vector) {
        return lnProbability(vector);
    }

    /// Runs the forward model for fixed parameters and returns the model visibilities
    /// on the data's (u,v) coverage, carrying the data weights.
    ///
    /// @param parameters model parameters
    /// @return one model channel per data channel, in the data's conjugation convention
    /// @throws DiskJockeyException if the parameters are out of domain or the image is unreadable
    /// @throws IOException if the simulator cannot be run
    public VisibilityDataset synthesize(DiskParameters parameters) throws DiskJockeyException, IOException {
        try (Workspace workspace = Workspace.acquire(context.scratch())) {
            SkyImage sky = render(workspace, parameters);
            List<ModelVisibilities> models =
                context.likelihood().modelVisibilities(sky, parameters.muRa(), parameters.muDec());
            VisibilityDataset data = context.likelihood().data();
            List<VisibilityChannel> channels = new ArrayList<>(models.size());
            for (int c = 0; c < models.size(); c++) {
                VisibilityChannel observed = data.get(c);
                channels.add(models.get(c).toChannel(observed.lam(), observed.weight()));
            }
            return new VisibilityDataset(channels);
        }
    }

    private SkyImage render(Workspace workspace, DiskParameters parameters)
        throws DiskJockeyException, IOException {
        ImageSize size = ImageSize.of(context.sizeArcsec(), parameters.dpc(), context.grid());

        workspace.stage(context.home(), RadmcInputs.staticFiles(context.species()));
        context.structureWriter().write(workspace.path(), parameters, context.grid(), context.species());

        double[] lams = VelocityMapper.dopplerShift(parameters.vel(), context.likelihood().data().wavelengths());
        workspace.writeCameraWavelengths(lams);

        context.simulator().image(workspace.path(),
            new ImagingArguments(parameters.incl(), parameters.pa(), context.npix(), size.command()));

        SynthesizedImage image =
            RadmcImageReader.readFrom(workspace.path(), context.npix(), context.likelihood().data().size());
        SkyImage sky = image.toSky(parameters.dpc());
        GriddingCorrection.apply(sky);
        return sky;
    }
}
