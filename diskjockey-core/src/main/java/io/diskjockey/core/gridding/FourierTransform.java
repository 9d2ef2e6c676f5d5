package io.diskjockey.core.gridding;

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

import io.diskjockey.core.image.SkyImage;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/// Two-dimensional discrete Fourier transform of a sky image channel.
///
/// ## Steps
///
/// ```text
///   image[j][i] (Jy/sr)
///        │ shift center pixel (n/2, n/2) to the origin
///        ▼
///   row FFTs, then column FFTs      (commons-math3, forward, standard normalization)
///        │ shift zero frequency back to index n/2
///        ▼
///   × dl·dm                         Jy/sr → Jy
/// ```
///
/// Both image dimensions must be powers of two. The transform is a pure
/// function of its input, so identical images give bit-identical grids.
public final class FourierTransform {

    private FourierTransform() {
    }

    /// Transforms one channel of a (gridding-corrected) sky image.
    ///
    /// @param image the sky image
    /// @param channel the channel index
    /// @return the centered Fourier grid
    /// @throws IllegalArgumentException if a dimension is not a power of two
    public static FourierGrid transform(SkyImage image, int channel) {
        int nx = image.nx();
        int ny = image.ny();
        requirePowerOfTwo(nx);
        requirePowerOfTwo(ny);
        double[][] pixels = image.data()[channel];

        double[][] re = new double[ny][nx];
        double[][] im = new double[ny][nx];
        for (int j = 0; j < ny; j++) {
            int sj = (j + ny / 2) % ny;
            for (int i = 0; i < nx; i++) {
                re[j][i] = pixels[sj][(i + nx / 2) % nx];
            }
        }

        for (int j = 0; j < ny; j++) {
            FastFourierTransformer.transformInPlace(new double[][]{re[j], im[j]},
                DftNormalization.STANDARD, TransformType.FORWARD);
        }
        double[] colRe = new double[ny];
        double[] colIm = new double[ny];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                colRe[j] = re[j][i];
                colIm[j] = im[j][i];
            }
            FastFourierTransformer.transformInPlace(new double[][]{colRe, colIm},
                DftNormalization.STANDARD, TransformType.FORWARD);
            for (int j = 0; j < ny; j++) {
                re[j][i] = colRe[j];
                im[j][i] = colIm[j];
            }
        }

        double area = image.dl() * image.dm();
        double[][] outRe = new double[ny][nx];
        double[][] outIm = new double[ny][nx];
        for (int j = 0; j < ny; j++) {
            int sj = (j + ny / 2) % ny;
            for (int i = 0; i < nx; i++) {
                int si = (i + nx / 2) % nx;
                outRe[j][i] = re[sj][si] * area;
                outIm[j][i] = im[sj][si] * area;
            }
        }

        return new FourierGrid(outRe, outIm,
            FourierGrid.shiftedFrequencies(nx, image.dl()),
            FourierGrid.shiftedFrequencies(ny, image.dm()));
    }

    static void requirePowerOfTwo(int n) {
        if (n < 2 || (n & (n - 1)) != 0) {
            throw new IllegalArgumentException("image dimension must be a power of two: " + n);
        }
    }
}
