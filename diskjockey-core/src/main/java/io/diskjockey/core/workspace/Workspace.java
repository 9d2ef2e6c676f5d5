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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/// A private scratch directory for one model evaluation.
///
/// Every evaluation acquires its own uniquely named directory, writes the
/// simulator inputs into it, runs the simulator with it as the process working
/// directory and reads the image back. Closing the workspace deletes the
/// directory and everything in it, so a try-with-resources block guarantees
/// cleanup on every exit path:
///
/// ```java
/// try (Workspace ws = Workspace.acquire(scratchRoot)) {
///     ws.stage(home, RadmcInputs.staticFiles(species));
///     ...
/// }
/// ```
///
/// The JVM's own working directory is never changed; all files are resolved
/// against [#path()].
public final class Workspace implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Workspace.class);

    static final String PREFIX = "dj-eval-";

    private final Path path;
    private boolean closed;

    private Workspace(Path path) {
        this.path = path;
    }

    /// Creates a new, empty, uniquely named workspace.
    ///
    /// @param parent the directory to create it under, or `null` for the system temp directory
    /// @return the workspace
    /// @throws IOException if the directory cannot be created
    public static Workspace acquire(Path parent) throws IOException {
        Path dir = parent == null
            ? Files.createTempDirectory(PREFIX)
            : Files.createTempDirectory(parent, PREFIX);
        logger.trace("acquired workspace {}", dir);
        return new Workspace(dir);
    }

    /// The workspace directory.
    public Path path() {
        return path;
    }

    /// Resolves a file name inside the workspace.
    public Path resolve(String name) {
        return path.resolve(name);
    }

    /// Copies static simulator inputs from the home directory.
    ///
    /// @param home the directory holding the static files
    /// @param fileNames names of the files to copy
    /// @throws IOException if a file is missing or cannot be copied
    public void stage(Path home, List<String> fileNames) throws IOException {
        for (String name : fileNames) {
            Files.copy(home.resolve(name), path.resolve(name), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /// Writes the camera wavelength list the simulator images at.
    ///
    /// @param lams wavelengths in microns
    /// @throws IOException if the file cannot be written
    public void writeCameraWavelengths(double[] lams) throws IOException {
        RadmcInputs.writeWavelengthList(path.resolve(RadmcInputs.CAMERA_WAVELENGTH_FILE), lams);
    }

    public boolean isClosed() {
        return closed;
    }

    /// Deletes the workspace directory recursively. Calling this more than once has no effect.
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Could not delete: {}", p, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Could not walk workspace " + path, e);
        }
        logger.trace("released workspace {}", path);
    }

    @Override
    public String toString() {
        return "Workspace{" + path + (closed ? ", closed" : "") + "}";
    }

    static void writeLines(Path file, List<String> lines) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
            for (String line : lines) {
                out.write(line);
                out.write('\n');
            }
        }
    }
}
