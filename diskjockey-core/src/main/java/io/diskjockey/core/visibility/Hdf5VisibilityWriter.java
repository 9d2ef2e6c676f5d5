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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;

import java.nio.file.Path;

/// Writes a [VisibilityDataset] in the layout read by [Hdf5VisibilityReader].
///
/// Every channel must hold the same number of samples.
public final class Hdf5VisibilityWriter {

    private Hdf5VisibilityWriter() {
    }

    /// @param path the file to create, replaced if present
    /// @param dataset the channels to write
    public static void write(Path path, VisibilityDataset dataset) {
        int nchan = dataset.size();
        int nvis = nchan == 0 ? 0 : dataset.get(0).size();
        double[][] uu = new double[nchan][];
        double[][] vv = new double[nchan][];
        double[][] re = new double[nchan][];
        double[][] im = new double[nchan][];
        double[][] invsig = new double[nchan][];
        for (int i = 0; i < nchan; i++) {
            VisibilityChannel channel = dataset.get(i);
            if (channel.size() != nvis) {
                throw new IllegalArgumentException("channel " + i + " has " + channel.size()
                    + " samples, expected " + nvis);
            }
            uu[i] = channel.uu();
            vv[i] = channel.vv();
            re[i] = channel.re();
            im[i] = channel.im();
            double[] weight = channel.weight();
            invsig[i] = new double[nvis];
            for (int k = 0; k < nvis; k++) {
                invsig[i][k] = Math.sqrt(weight[k]);
            }
        }

        try (WritableHdfFile hdf = HdfFile.write(path)) {
            hdf.putDataset("lams", dataset.wavelengths());
            hdf.putDataset("uu", uu);
            hdf.putDataset("vv", vv);
            hdf.putDataset("real", re);
            hdf.putDataset("imag", im);
            hdf.putDataset("invsig", invsig);
        }
    }
}
