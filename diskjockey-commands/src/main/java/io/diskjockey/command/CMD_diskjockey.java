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

import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Fits RADMC-3D disk models to interferometric visibilities.
///
/// This is the top level command which serves as an entry point for all sub-commands.
@CommandLine.Command(
    name = "diskjockey",
    header = "Bayesian disk-model fitting for interferometric line data",
    description = "Samples or optimizes disk-model parameters against channelized visibilities.",
    subcommands = {CMD_run.class, CMD_init.class, CMD_synthesize.class, CommandLine.HelpCommand.class}
)
public class CMD_diskjockey implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// run a diskjockey command
    /// @param args command line args
    public static void main(String[] args) {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
        CommandLine commandLine = new CommandLine(new CMD_diskjockey()).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }
}
