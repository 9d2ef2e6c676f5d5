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

import com.google.gson.JsonParseException;
import io.diskjockey.config.ConfigurationException;
import io.diskjockey.core.json.DiskJockeyGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Reads and writes starting-position files: a JSON array of `ndim` rows,
/// each holding one value per walker.
///
/// ```json
/// [[1.01, 0.98, 1.02, 0.99],
///  [45.2, 44.8, 45.5, 45.0]]
/// ```
public final class StartingPositions {

    private StartingPositions() {
    }

    /// Reads a position file and returns one row per walker.
    ///
    /// @throws ConfigurationException if the file is not a rectangular numeric array
    public static double[][] readWalkers(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new ConfigurationException("starting position file not found: " + path);
        }
        double[][] columns;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            columns = DiskJockeyGsonConfig.gson().fromJson(reader, double[][].class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("invalid starting positions in " + path + ": " + e.getMessage(), e);
        }
        if (columns == null || columns.length == 0 || columns[0] == null || columns[0].length == 0) {
            throw new ConfigurationException("no starting positions in " + path);
        }
        int walkers = columns[0].length;
        for (double[] row : columns) {
            if (row == null || row.length != walkers) {
                throw new ConfigurationException("starting positions in " + path + " are not rectangular");
            }
        }
        double[][] rows = new double[walkers][columns.length];
        for (int d = 0; d < columns.length; d++) {
            for (int k = 0; k < walkers; k++) {
                rows[k][d] = columns[d][k];
            }
        }
        return rows;
    }

    /// Writes one row per walker in the file layout.
    public static void writeWalkers(Path path, double[][] walkers) throws IOException {
        int dims = walkers.length == 0 ? 0 : walkers[0].length;
        double[][] columns = new double[dims][walkers.length];
        for (int k = 0; k < walkers.length; k++) {
            for (int d = 0; d < dims; d++) {
                columns[d][k] = walkers[k][d];
            }
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            DiskJockeyGsonConfig.gson().toJson(columns, writer);
        }
    }
}
