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
import io.diskjockey.core.constants.PhysicalConstants;
import io.diskjockey.core.velocity.VelocityMapper;
import io.diskjockey.core.visibility.VisibilityDataset;
import io.diskjockey.core.visibility.VisibilityReader;
import io.diskjockey.core.workspace.RadmcInputs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Writes the simulator inputs that every evaluation copies from the home
/// directory: `radmc3d.inp`, `lines.inp` and `wavelength_micron.inp` for the
/// active channels. The molecule data file is not generated and must be
/// supplied alongside them.
@CommandLine.Command(
    name = "init",
    header = "Write the static simulator inputs",
    description = "Writes radmc3d.inp, lines.inp and wavelength_micron.inp beside the configuration.",
    exitCodeList = {
        "0: Success",
        "1: Configuration error",
        "2: I/O error"
    }
)
public class CMD_init implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_init.class);

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Run configuration (default: ${DEFAULT-VALUE})",
        defaultValue = "config.yaml"
    )
    private Path config;

    @Override
    public Integer call() {
        try {
            RunConfig runConfig = RunConfig.load(config);
            Path home = runConfig.home();
            double lam0;
            String moleculeFile;
            try {
                lam0 = PhysicalConstants.restWavelength(runConfig.species(), runConfig.transition());
                moleculeFile = RadmcInputs.moleculeFile(runConfig.species());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
            if (!Files.exists(runConfig.dataFile())) {
                throw new ConfigurationException("data file not found: " + runConfig.dataFile());
            }

            VisibilityDataset all = VisibilityReader.forPath(runConfig.dataFile()).read(runConfig.dataFile());
            boolean[] mask = VelocityMapper.channelMask(runConfig.exclude(),
                VelocityMapper.velocities(lam0, all.wavelengths()));
            double[] lams = all.select(mask).wavelengths();

            RadmcInputs.writeControl(home);
            RadmcInputs.writeLines(home, runConfig.species());
            RadmcInputs.writeWavelengths(home, lams);
            logger.info("Wrote {}, {} and {} ({} channels) to {}", RadmcInputs.CONTROL_FILE,
                RadmcInputs.LINES_FILE, RadmcInputs.WAVELENGTH_FILE, lams.length, home);
            if (!Files.exists(home.resolve(moleculeFile))) {
                logger.warn("{} is missing from {}; copy it there before running", moleculeFile, home);
            }
            return CMD_run.EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return CMD_run.EXIT_CONFIG;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return CMD_run.EXIT_FATAL;
        }
    }
}
