package io.diskjockey.core.visibility;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads the whitespace-delimited text visibility format.
///
/// ## Format
///
/// ```text
/// # wavelength[um]  u[kλ]  v[kλ]  Re[Jy]  Im[Jy]  weight
/// 1300.3912  12.5  -40.1  0.132  -0.004  2500.0
/// 1300.3912  -8.0   33.7  0.120   0.010  2500.0
/// 1300.3959  12.5  -40.1  0.151  -0.002  2500.0
/// ```
///
/// Consecutive rows sharing a wavelength form one channel. Blank lines and
/// lines starting with `#` are ignored.
public final class TextVisibilityReader implements VisibilityReader {

    private static final int COLUMNS = 6;

    @Override
    public VisibilityDataset read(Path path) throws IOException {
        List<VisibilityChannel> channels = new ArrayList<>();
        ChannelBuilder current = null;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] fields = trimmed.split("\\s+");
                if (fields.length != COLUMNS) {
                    throw new IOException(path + ":" + lineNumber + ": expected " + COLUMNS
                        + " columns but found " + fields.length);
                }
                double[] row = new double[COLUMNS];
                try {
                    for (int c = 0; c < COLUMNS; c++) {
                        row[c] = Double.parseDouble(fields[c]);
                    }
                } catch (NumberFormatException e) {
                    throw new IOException(path + ":" + lineNumber + ": " + e.getMessage(), e);
                }
                if (current == null || Double.compare(current.lam, row[0]) != 0) {
                    if (current != null) {
                        channels.add(current.build());
                    }
                    current = new ChannelBuilder(row[0]);
                }
                current.add(row);
            }
        }
        if (current != null) {
            channels.add(current.build());
        }
        return new VisibilityDataset(channels);
    }

    private static final class ChannelBuilder {
        private final double lam;
        private final List<double[]> rows = new ArrayList<>();

        ChannelBuilder(double lam) {
            this.lam = lam;
        }

        void add(double[] row) {
            rows.add(row);
        }

        VisibilityChannel build() {
            int n = rows.size();
            double[] uu = new double[n];
            double[] vv = new double[n];
            double[] re = new double[n];
            double[] im = new double[n];
            double[] weight = new double[n];
            for (int k = 0; k < n; k++) {
                double[] row = rows.get(k);
                uu[k] = row[1];
                vv[k] = row[2];
                re[k] = row[3];
                im[k] = row[4];
                weight[k] = row[5];
            }
            return new VisibilityChannel(lam, uu, vv, re, im, weight);
        }
    }
}
