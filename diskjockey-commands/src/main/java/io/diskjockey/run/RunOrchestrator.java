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
import io.diskjockey.core.model.ParameterConverter;
import io.diskjockey.sampler.EnsembleSampler;
import io.diskjockey.sampler.EvaluationPool;
import io.diskjockey.sampler.LogPosterior;
import io.diskjockey.sampler.RunSchedule;
import io.diskjockey.sampler.checkpoint.ChainWriter;
import io.diskjockey.sampler.checkpoint.CheckpointManager;
import io.diskjockey.sampler.checkpoint.CheckpointState;
import io.diskjockey.sampler.checkpoint.RunRecorder;
import io.diskjockey.sampler.optimize.GlobalOptimizer;
import io.diskjockey.sampler.optimize.OptimizationResult;
import io.diskjockey.sampler.random.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/// Drives one run in its directory: either the ensemble sampler, fresh or
/// resumed from the directory's checkpoint, or the global optimizer. Both
/// paths evaluate through the same [io.diskjockey.core.pipeline.ProbabilityPipeline].
public final class RunOrchestrator {

    private static final Logger logger = LogManager.getLogger(RunOrchestrator.class);

    private final RunContext context;
    private final RunDirectory directory;
    private final EvaluationPool pool;
    private final long seed;
    private final boolean testMode;

    public RunOrchestrator(RunContext context, RunDirectory directory, EvaluationPool pool, long seed,
                           boolean testMode) {
        this.context = context;
        this.directory = directory;
        this.pool = pool;
        this.seed = seed;
        this.testMode = testMode;
    }

    /// Runs the sampler until every configured loop is complete.
    ///
    /// @return the sampler in its final state
    /// @throws ConfigurationException if positions or checkpoint do not fit the model
    /// @throws CheckpointManager.CheckpointException if the checkpoint cannot be read
    public EnsembleSampler sample() throws IOException, InterruptedException, CheckpointManager.CheckpointException {
        RunConfig config = context.config();
        RunSchedule schedule = new RunSchedule(config.loops(), config.samples());
        ParameterConverter converter = context.converter();
        LogPosterior posterior = context.pipeline()::evaluate;
        EnsembleSampler sampler = new EnsembleSampler(posterior, pool, RandomGenerators.create(seed),
            config.stretchScale(), testMode);

        Path checkpoint = directory.resolve(CheckpointManager.CHECKPOINT_FILE);
        Path chainFile = directory.resolve(ChainWriter.CHAIN_FILE);
        int loopsCompleted;
        if (directory.resumed() && Files.exists(checkpoint)) {
            CheckpointState state = CheckpointManager.load(checkpoint);
            if (state.dimensions() != converter.dimensions()) {
                throw new ConfigurationException("checkpoint " + checkpoint + " has " + state.dimensions()
                    + " dimensions, the model has " + converter.dimensions() + " free parameters");
            }
            if (!converter.kind().tag().equals(state.model())
                || !converter.freeNames().equals(state.parameterNames())) {
                throw new ConfigurationException("checkpoint " + checkpoint + " was written for model "
                    + state.model() + " with free parameters " + state.parameterNames() + ", the config has model "
                    + converter.kind().tag() + " with free parameters " + converter.freeNames());
            }
            if (state.loopsCompleted() > schedule.loops()) {
                throw new ConfigurationException("checkpoint " + checkpoint + " has completed "
                    + state.loopsCompleted() + " loops, the config asks for " + schedule.loops());
            }
            CheckpointManager.restore(sampler, state);
            ChainWriter.truncate(chainFile, state.iterationsCompleted());
            loopsCompleted = state.loopsCompleted();
            logger.info("Resuming {} from loop {} of {} ({} walkers)", directory.path(), loopsCompleted,
                schedule.loops(), state.walkers());
        } else {
            if (directory.resumed()) {
                logger.warn("{} has no checkpoint, starting from {}", directory.path(), config.pos0());
            }
            double[][] start = StartingPositions.readWalkers(config.pos0());
            if (start[0].length != converter.dimensions()) {
                throw new ConfigurationException("starting positions have " + start[0].length
                    + " rows, the model has " + converter.dimensions() + " free parameters "
                    + converter.freeNames());
            }
            try {
                EnsembleSampler.checkPopulation(start.length, start[0].length, testMode);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
            ChainWriter.truncate(chainFile, 0);
            logger.info("Starting {} walkers in {} dimensions with seed {} on {} workers", start.length,
                start[0].length, seed, pool.parallelism());
            sampler.initialize(start);
            loopsCompleted = 0;
        }

        try (ChainWriter chain = new ChainWriter(chainFile)) {
            RunRecorder recorder = new RunRecorder(chain, checkpoint, converter.kind().tag(), converter.freeNames());
            schedule.run(sampler, loopsCompleted, recorder);
        }
        logger.info("Sampling complete: {} iterations, acceptance fraction {}", sampler.iterations(),
            String.format("%.3f", sampler.acceptanceFraction()));
        return sampler;
    }

    /// Searches the configured parameter ranges for the posterior maximum and
    /// writes `optimum.json` into the run directory.
    ///
    /// @throws ConfigurationException if a free parameter has no search range
    public OptimizationResult optimize() throws IOException {
        RunConfig config = context.config();
        ParameterConverter converter = context.converter();
        List<String> names = converter.freeNames();
        Map<String, double[]> ranges = config.parameterRanges();
        double[] lower = new double[names.size()];
        double[] upper = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            double[] range = ranges.get(names.get(i));
            if (range == null) {
                throw new ConfigurationException("parameter_ranges has no range for free parameter " + names.get(i));
            }
            lower[i] = range[0];
            upper[i] = range[1];
        }
        double[] start;
        GlobalOptimizer optimizer;
        try {
            start = converter.vectorOf(config.parameters());
            optimizer = new GlobalOptimizer(context.pipeline()::evaluate, names, lower, upper,
                config.maxFuncEvals(), seed);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        logger.info("Optimizing {} over {} evaluations with seed {}", names, config.maxFuncEvals(), seed);
        OptimizationResult result = optimizer.optimize(start);
        Path out = directory.resolve(GlobalOptimizer.RESULT_FILE);
        GlobalOptimizer.write(out, result);
        logger.info("Best {} with lnp {} written to {}", converter.describe(result.position()),
            result.lnProbability(), out);
        return result;
    }
}
