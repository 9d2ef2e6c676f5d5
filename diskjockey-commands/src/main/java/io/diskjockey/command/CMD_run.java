package io.diskjockey.command;

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
import io.diskjockey.core.pipeline.FatalEvaluationException;
import io.diskjockey.core.workspace.RadmcSimulator;
import io.diskjockey.core.workspace.Simulator;
import io.diskjockey.run.RunContext;
import io.diskjockey.run.RunDirectory;
import io.diskjockey.run.RunOrchestrator;
import io.diskjockey.sampler.EvaluationPool;
import io.diskjockey.sampler.ExecutorEvaluationPool;
import io.diskjockey.sampler.SerialEvaluationPool;
import io.diskjockey.sampler.checkpoint.CheckpointManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/// Runs the ensemble sampler, or with `--optim` the CMA-ES optimizer, for
/// one configuration.
///
/// ## Usage
///
/// ```bash
/// diskjockey run --config config.yaml --workers 8
/// diskjockey run --config config.yaml --run-index 2   # resume run02
/// diskjockey run --config config.yaml --optim
/// ```
///
/// Output goes to `<out_base>runNN/` beside the configuration file:
/// `chain.ndjson` and the `pos0.json` checkpoint for sampling runs,
/// `optimum.json` for optimizer runs.
@CommandLine.Command(
    name = "run",
    header = "Sample or optimize the model posterior",
    description = "Starts a fresh run or resumes an existing run directory.",
    exitCodeList = {
        "0: Success",
        "1: Configuration or checkpoint error",
        "2: Fatal evaluation error, I/O error or interrupted"
    }
)
public class CMD_run implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_run.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG = 1;
    public static final int EXIT_FATAL = 2;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Run configuration (default: ${DEFAULT-VALUE})",
        defaultValue = "config.yaml"
    )
    private Path config;

    @CommandLine.Option(
        names = {"-r", "--run-index"},
        description = "Run directory index; an existing directory is resumed"
    )
    private Integer runIndex;

    @CommandLine.Option(
        names = {"--optim"},
        description = "Run the global optimizer instead of the sampler"
    )
    private boolean optimize = false;

    @CommandLine.Option(
        names = {"--test"},
        description = "Allow fewer than twice as many walkers as free parameters"
    )
    private boolean testMode = false;

    @CommandLine.Option(
        names = {"-w", "--workers"},
        description = "Concurrent model evaluations (default: available processors)"
    )
    private int workers = Runtime.getRuntime().availableProcessors();

    @CommandLine.Option(
        names = {"--scratch"},
        description = "Parent directory for evaluation workspaces (default: system temp)"
    )
    private Path scratch;

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    Function<String, Simulator> simulatorFactory = RadmcSimulator::new;

    @Override
    public Integer call() {
        try {
            RunConfig runConfig = RunConfig.load(config);
            long seed = seedOption.resolve(runConfig.seed());
            RunContext context = RunContext.build(runConfig, simulatorFactory.apply(runConfig.simulator()), scratch);
            RunDirectory directory =
                RunDirectory.prepare(runConfig.home(), runConfig.outBase(), runIndex, config.toAbsolutePath());

            try (EvaluationPool pool = workers > 1 ? new ExecutorEvaluationPool(workers) : new SerialEvaluationPool()) {
                RunOrchestrator orchestrator = new RunOrchestrator(context, directory, pool, seed, testMode);
                if (optimize) {
                    orchestrator.optimize();
                } else {
                    orchestrator.sample();
                }
            }
            return EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        } catch (CheckpointManager.CheckpointException e) {
            logger.error("Cannot resume: {}", e.getMessage());
            return EXIT_CONFIG;
        } catch (FatalEvaluationException e) {
            logger.error("Run aborted. {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted, the last completed loop is checkpointed");
            return EXIT_FATAL;
        }
    }
}
