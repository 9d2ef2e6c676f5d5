package io.diskjockey.sampler.optimize;

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

import io.diskjockey.core.json.DiskJockeyGsonConfig;
import io.diskjockey.core.pipeline.EvaluationResult;
import io.diskjockey.core.pipeline.FatalEvaluationException;
import io.diskjockey.sampler.LogPosterior;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.CMAESOptimizer;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Bounded CMA-ES search for the maximum of a log-posterior.
///
/// The objective is `-lnp`. A rejected point scores [#PENALTY] so the search
/// is steered away from it; a fatal evaluation stops the search with
/// [FatalEvaluationException]. When the evaluation budget runs out the best
/// point seen so far is returned.
public final class GlobalOptimizer {

    private static final Logger logger = LogManager.getLogger(GlobalOptimizer.class);

    /// Objective value for points with zero posterior density.
    public static final double PENALTY = 1.0e30;

    /// Result file name inside a run directory.
    public static final String RESULT_FILE = "optimum.json";

    private final LogPosterior posterior;
    private final List<String> names;
    private final double[] lower;
    private final double[] upper;
    private final int maxEvaluations;
    private final long seed;

    /// @param names free-parameter names, in vector order
    /// @param lower lower search bound per parameter
    /// @param upper upper search bound per parameter
    public GlobalOptimizer(LogPosterior posterior, List<String> names, double[] lower, double[] upper,
                           int maxEvaluations, long seed) {
        this.posterior = Objects.requireNonNull(posterior, "posterior");
        this.names = List.copyOf(names);
        if (lower.length != names.size() || upper.length != names.size()) {
            throw new IllegalArgumentException("bounds must cover each of the " + names.size() + " parameters");
        }
        for (int i = 0; i < lower.length; i++) {
            if (!(lower[i] < upper[i])) {
                throw new IllegalArgumentException(
                    "search range for " + names.get(i) + " is empty: [" + lower[i] + ", " + upper[i] + "]");
            }
        }
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("evaluation budget must be positive, got " + maxEvaluations);
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.maxEvaluations = maxEvaluations;
        this.seed = seed;
    }

    /// Runs the search from the given start point.
    public OptimizationResult optimize(double[] start) {
        if (start.length != lower.length) {
            throw new IllegalArgumentException(
                "start point has " + start.length + " values, expected " + lower.length);
        }
        double[] guess = new double[start.length];
        double[] sigma = new double[start.length];
        for (int i = 0; i < start.length; i++) {
            guess[i] = Math.min(Math.max(start[i], lower[i]), upper[i]);
            sigma[i] = (upper[i] - lower[i]) / 4.0;
        }
        int dims = start.length;
        int population = 4 + (int) Math.floor(3.0 * Math.log(dims));

        BestTracker best = new BestTracker();
        CMAESOptimizer optimizer = new CMAESOptimizer(
            maxEvaluations, 0.0, true, 0, 0, new MersenneTwister(seed), false,
            new SimpleValueChecker(1e-10, 1e-12));

        boolean converged;
        try {
            optimizer.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(point -> objective(point, best)),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new SimpleBounds(lower, upper),
                new CMAESOptimizer.Sigma(sigma),
                new CMAESOptimizer.PopulationSize(population));
            converged = true;
        } catch (TooManyEvaluationsException e) {
            logger.info("Evaluation budget of {} exhausted", maxEvaluations);
            converged = false;
        }

        double lnp = best.point == null ? Double.NEGATIVE_INFINITY : -best.value;
        double[] point = best.point == null ? guess : best.point;
        logger.info("Best lnp {} after {} evaluations", lnp, best.evaluations);
        return new OptimizationResult(names, point, lnp, best.evaluations, converged);
    }

    private double objective(double[] point, BestTracker best) {
        EvaluationResult result = posterior.evaluate(point);
        if (result.isFatal()) {
            throw new FatalEvaluationException(point, result.cause());
        }
        best.evaluations++;
        double lnp = result.lnProbability();
        if (!Double.isFinite(lnp)) {
            return PENALTY;
        }
        double value = -lnp;
        if (best.point == null || value < best.value) {
            best.point = point.clone();
            best.value = value;
            logger.debug("New best lnp {} at {}", lnp, Arrays.toString(point));
        }
        return value;
    }

    /// Writes a result as pretty JSON.
    public static void write(Path path, OptimizationResult result) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            DiskJockeyGsonConfig.gson().toJson(result, writer);
        }
    }

    private static final class BestTracker {
        private double[] point;
        private double value = Double.POSITIVE_INFINITY;
        private int evaluations;
    }
}
