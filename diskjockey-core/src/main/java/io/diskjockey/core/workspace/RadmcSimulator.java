package io.diskjockey.core.workspace;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Runs RADMC-3D as a child process rooted at the workspace.
///
/// Standard output is discarded. Standard error goes to a file in the
/// workspace and is only read back into the [SimulatorException] when the
/// process exits non-zero. No timeout is applied: a hung simulator blocks the
/// calling worker until the run is terminated.
public final class RadmcSimulator implements Simulator {

    private static final Logger logger = LogManager.getLogger(RadmcSimulator.class);

    public static final String DEFAULT_EXECUTABLE = "radmc3d";
    static final String STDERR_FILE = "simulator.err";

    private final String executable;

    public RadmcSimulator() {
        this(DEFAULT_EXECUTABLE);
    }

    public RadmcSimulator(String executable) {
        this.executable = executable;
    }

    public String executable() {
        return executable;
    }

    @Override
    public void image(Path workspace, ImagingArguments arguments) throws IOException {
        List<String> command = arguments.command(executable);
        Path stderr = workspace.resolve(STDERR_FILE);
        ProcessBuilder pb = new ProcessBuilder(command)
            .directory(workspace.toFile())
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .redirectError(stderr.toFile());
        logger.debug("running {} in {}", command, workspace);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SimulatorException("Could not start " + executable + ": " + e.getMessage(), e);
        }
        int exit;
        try {
            exit = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException iio = new InterruptedIOException("Interrupted waiting for " + executable);
            iio.initCause(e);
            throw iio;
        }
        if (exit != 0) {
            String err = Files.exists(stderr) ? new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).strip() : "";
            throw new SimulatorException(executable + " exited with " + exit
                + (err.isEmpty() ? "" : ": " + err), exit);
        }
    }

    @Override
    public String toString() {
        return "RadmcSimulator{" + executable + "}";
    }
}
