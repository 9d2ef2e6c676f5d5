package io.diskjockey.run;

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

import io.diskjockey.config.ConfigurationException;
import io.diskjockey.config.RunConfig;
import io.diskjockey.core.constants.PhysicalConstants;
import io.diskjockey.core.likelihood.LikelihoodEvaluator;
import io.diskjockey.core.model.GeometricPrior;
import io.diskjockey.core.model.ParameterConverter;
import io.diskjockey.core.model.RadmcStructureWriter;
import io.diskjockey.core.pipeline.EvaluationContext;
import io.diskjockey.core.pipeline.ProbabilityPipeline;
import io.diskjockey.core.velocity.VelocityMapper;
import io.diskjockey.core.visibility.VisibilityDataset;
import io.diskjockey.core.visibility.VisibilityReader;
import io.diskjockey.core.workspace.Simulator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Everything a run shares read-only across its workers: the configuration,
/// the active conjugated channels, the interpolation plans and the pipeline
/// built on them. Built once at startup.
public final class RunContext {

    private static final Logger logger = LogManager.getLogger(RunContext.class);

    private final RunConfig config;
    private final double[] velocities;
    private final boolean[] mask;
    private final ProbabilityPipeline pipeline;

    private RunContext(RunConfig config, double[] velocities, boolean[] mask, ProbabilityPipeline pipeline) {
        this.config = config;
        this.velocities = velocities;
        this.mask = mask;
        this.pipeline = pipeline;
    }

    /// Loads the data and assembles the pipeline.
    ///
    /// @param simulator the forward-model simulator
    /// @param scratch parent for evaluation workspaces, `null` for the system temp directory
    /// @throws ConfigurationException if the configuration does not fit the data or model
    /// @throws IOException if the data file cannot be read
    public static RunContext build(RunConfig config, Simulator simulator, Path scratch) throws IOException {
        double lam0;
        try {
            lam0 = PhysicalConstants.restWavelength(config.species(), config.transition());
            PhysicalConstants.moleculeName(config.species());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        if (!Files.exists(config.dataFile())) {
            throw new ConfigurationException("data file not found: " + config.dataFile());
        }

        VisibilityDataset all = VisibilityReader.forPath(config.dataFile()).read(config.dataFile());
        double[] vels = VelocityMapper.velocities(lam0, all.wavelengths());
        boolean[] mask = VelocityMapper.channelMask(config.exclude(), vels);
        VisibilityDataset data = all.select(mask).conjugate();
        if (data.size() == 0) {
            throw new ConfigurationException("every channel of " + config.dataFile() + " is excluded");
        }
        logger.info("Using the following channels (velocities in km/s): {}", activeVelocities(vels, mask));

        ParameterConverter converter;
        GeometricPrior prior;
        try {
            converter = ParameterConverter.of(config.model(), config.fixParams(), config.parameters());
            prior = new GeometricPrior(config.priorBounds());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        logger.info("Model {} with {} free parameters {}", config.model().tag(), converter.dimensions(),
            converter.freeNames());

        LikelihoodEvaluator likelihood;
        try {
            likelihood = LikelihoodEvaluator.plan(data, config.npix(), config.sizeArcsec());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("npix " + config.npix() + " and size_arcsec " + config.sizeArcsec()
                + " do not cover the data: " + e.getMessage(), e);
        }
        EvaluationContext context = new EvaluationContext(config.home(), scratch, config.species(),
            config.sizeArcsec(), config.grid(), converter, prior, new RadmcStructureWriter(), simulator,
            likelihood);
        return new RunContext(config, vels, mask, new ProbabilityPipeline(context));
    }

    private static List<Double> activeVelocities(double[] vels, boolean[] mask) {
        List<Double> active = new ArrayList<>();
        for (int i = 0; i < vels.length; i++) {
            if (mask[i]) {
                active.add(vels[i]);
            }
        }
        return active;
    }

    public RunConfig config() {
        return config;
    }

    /// Velocity of every channel in the data file, active or not.
    public double[] velocities() {
        return velocities.clone();
    }

    /// Active-channel mask over the data file's channels.
    public boolean[] mask() {
        return mask.clone();
    }

    public ProbabilityPipeline pipeline() {
        return pipeline;
    }

    public ParameterConverter converter() {
        return pipeline.context().converter();
    }
}
