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
import io.diskjockey.core.DiskJockeyException;
import io.diskjockey.core.model.DiskParameters;
import io.diskjockey.core.model.ModelException;
import io.diskjockey.core.visibility.Hdf5VisibilityWriter;
import io.diskjockey.core.visibility.VisibilityDataset;
import io.diskjockey.core.workspace.RadmcSimulator;
import io.diskjockey.core.workspace.Simulator;
import io.diskjockey.run.RunContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/// Runs the forward model once at the configured `parameters` and writes the
/// model visibilities, sampled on the data's (u,v) coverage and carrying its
/// weights, as an HDF5 data file.
@CommandLine.Command(
    name = "synthesize",
    header = "Write model visibilities for the configured parameters",
    description = "Simulates the configured model on the data's (u,v) coverage and writes HDF5.",
    exitCodeList = {
        "0: Success",
        "1: Configuration error",
        "2: Simulator or I/O error"
    }
)
public class CMD_synthesize implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_synthesize.class);

    public static final String DEFAULT_OUTPUT = "model.hdf5";

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Run configuration (default: ${DEFAULT-VALUE})",
        defaultValue = "config.yaml"
    )
    private Path config;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output file (default: " + DEFAULT_OUTPUT + " beside the configuration)"
    )
    private Path output;

    @CommandLine.Option(
        names = {"--scratch"},
        description = "Parent directory for the workspace (default: system temp)"
    )
    private Path scratch;

    Function<String, Simulator> simulatorFactory = RadmcSimulator::new;

    @Override
    public Integer call() {
        try {
            RunConfig runConfig = RunConfig.load(config);
            RunContext context = RunContext.build(runConfig, simulatorFactory.apply(runConfig.simulator()), scratch);
            DiskParameters parameters = runConfig.model().build(runConfig.parameters());

            VisibilityDataset model = context.pipeline().synthesize(parameters).conjugate();
            Path out = output != null ? output : runConfig.home().resolve(DEFAULT_OUTPUT);
            Hdf5VisibilityWriter.write(out, model);
            logger.info("Wrote {} channels of model visibilities to {}", model.size(), out);
            return CMD_run.EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return CMD_run.EXIT_CONFIG;
        } catch (ModelException e) {
            logger.error("The configured parameters are not a valid model: {}", e.getMessage());
            return CMD_run.EXIT_CONFIG;
        } catch (IllegalArgumentException e) {
            logger.error("Cannot write model visibilities: {}", e.getMessage());
            return CMD_run.EXIT_CONFIG;
        } catch (DiskJockeyException | IOException e) {
            logger.error("Synthesis failed: {}", e.getMessage(), e);
            return CMD_run.EXIT_FATAL;
        }
    }
}
