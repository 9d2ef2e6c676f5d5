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
import io.jhdf.api.Dataset;
import io.jhdf.exceptions.HdfException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads channelized visibilities from an HDF5 file.
///
/// ## Layout
///
/// | dataset  | shape          | units              |
/// |----------|----------------|--------------------|
/// | `lams`   | `[nchan]`      | microns            |
/// | `uu`     | `[nchan][nvis]`| kλ                 |
/// | `vv`     | `[nchan][nvis]`| kλ                 |
/// | `real`   | `[nchan][nvis]`| Jy                 |
/// | `imag`   | `[nchan][nvis]`| Jy                 |
/// | `invsig` | `[nchan][nvis]`| 1/Jy, weight = invsig² |
///
/// Datasets may be stored as 32- or 64-bit floats.
public final class Hdf5VisibilityReader implements VisibilityReader {

    @Override
    public VisibilityDataset read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        try (HdfFile hdf = new HdfFile(path)) {
            double[] lams = vector(hdf, "lams");
            double[][] uu = matrix(hdf, "uu");
            double[][] vv = matrix(hdf, "vv");
            double[][] re = matrix(hdf, "real");
            double[][] im = matrix(hdf, "imag");
            double[][] invsig = matrix(hdf, "invsig");

            int nchan = lams.length;
            for (double[][] m : List.of(uu, vv, re, im, invsig)) {
                if (m.length != nchan) {
                    throw new IOException(path + ": expected " + nchan + " channels in every dataset");
                }
            }

            List<VisibilityChannel> channels = new ArrayList<>(nchan);
            for (int i = 0; i < nchan; i++) {
                double[] weight = new double[invsig[i].length];
                for (int k = 0; k < weight.length; k++) {
                    weight[k] = invsig[i][k] * invsig[i][k];
                }
                channels.add(new VisibilityChannel(lams[i], uu[i], vv[i], re[i], im[i], weight));
            }
            return new VisibilityDataset(channels);
        } catch (HdfException e) {
            throw new IOException("Failed to read HDF5 visibilities from " + path + ": " + e.getMessage(), e);
        }
    }

    private static double[] vector(HdfFile hdf, String name) throws IOException {
        Object data = dataset(hdf, name).getData();
        if (data instanceof double[] d) {
            return d;
        }
        if (data instanceof float[] f) {
            double[] d = new double[f.length];
            for (int i = 0; i < f.length; i++) {
                d[i] = f[i];
            }
            return d;
        }
        throw new IOException("dataset '" + name + "' is not a 1-D floating point array");
    }

    private static double[][] matrix(HdfFile hdf, String name) throws IOException {
        Object data = dataset(hdf, name).getData();
        if (data instanceof double[][] d) {
            return d;
        }
        if (data instanceof float[][] f) {
            double[][] d = new double[f.length][];
            for (int i = 0; i < f.length; i++) {
                d[i] = new double[f[i].length];
                for (int k = 0; k < f[i].length; k++) {
                    d[i][k] = f[i][k];
                }
            }
            return d;
        }
        throw new IOException("dataset '" + name + "' is not a 2-D floating point array");
    }

    private static Dataset dataset(HdfFile hdf, String name) throws IOException {
        try {
            return hdf.getDatasetByPath(name);
        } catch (HdfException e) {
            throw new IOException("missing dataset '" + name + "'", e);
        }
    }
}
