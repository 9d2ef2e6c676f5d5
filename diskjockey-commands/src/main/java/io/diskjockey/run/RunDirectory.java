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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// A numbered output directory `<out_base>runNN`.
///
/// | `--run-index` | directory exists | result                         |
/// |---------------|------------------|--------------------------------|
/// | absent        | n/a              | first missing index, fresh     |
/// | given         | no               | that index, fresh              |
/// | given         | yes              | that index, resumed            |
///
/// A fresh directory is created and receives a copy of the config file.
public record RunDirectory(Path path, int index, boolean resumed) {

    private static final Logger logger = LogManager.getLogger(RunDirectory.class);

    /// Formats the directory for an index, e.g. `output/run03`.
    public static Path pathFor(Path home, String outBase, int index) {
        return home.resolve(outBase + String.format("run%02d", index));
    }

    /// Picks and prepares the run directory.
    ///
    /// @param requestedIndex the index to use, or `null` to take the first unused one
    /// @param configFile copied into a fresh directory, may be `null`
    public static RunDirectory prepare(Path home, String outBase, Integer requestedIndex, Path configFile)
        throws IOException {
        int index;
        Path path;
        if (requestedIndex == null) {
            index = 0;
            path = pathFor(home, outBase, index);
            while (Files.exists(path)) {
                logger.debug("{} exists", path);
                index++;
                path = pathFor(home, outBase, index);
            }
        } else {
            if (requestedIndex < 0) {
                throw new ConfigurationException("run index must be non-negative, got " + requestedIndex);
            }
            index = requestedIndex;
            path = pathFor(home, outBase, index);
            if (Files.isDirectory(path)) {
                logger.info("{} exists, resuming", path);
                return new RunDirectory(path, index, true);
            }
        }

        logger.info("Creating {}", path);
        Files.createDirectories(path);
        if (configFile != null) {
            Files.copy(configFile, path.resolve(configFile.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        }
        return new RunDirectory(path, index, false);
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }
}
