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

/// Applies the image-plane gridding correction in place.
///
/// Each pixel is divided by `corrfun(η_x) corrfun(η_y)`, where η is the pixel
/// offset normalized by half the field of view. Pixels with `|η| > 1` are zeroed.
/// Apply exactly once per image, before the Fourier transform; no shift is applied
/// here since the translation is corrected on the resampled visibilities.
public final class GriddingCorrection {

    private GriddingCorrection() {
    }

    public static void apply(SkyImage image) {
        int nx = image.nx();
        int ny = image.ny();
        double[] ra = image.ra();
        double[] dec = image.dec();
        double maxRa = Math.abs(ra[1] - ra[0]) * nx / 2.0;
        double maxDec = Math.abs(dec[1] - dec[0]) * ny / 2.0;

        double[] corrX = new double[nx];
        for (int i = 0; i < nx; i++) {
            corrX[i] = factor(ra[i] / maxRa);
        }
        double[] corrY = new double[ny];
        for (int j = 0; j < ny; j++) {
            corrY[j] = factor(dec[j] / maxDec);
        }

        for (double[][] channel : image.data()) {
            for (int j = 0; j < ny; j++) {
                for (int i = 0; i < nx; i++) {
                    channel[j][i] *= corrX[i] * corrY[j];
                }
            }
        }
    }

    private static double factor(double eta) {
        if (Math.abs(eta) > 1.0) {
            return 0.0;
        }
        return 1.0 / Spheroidal.corrfun(eta);
    }
}
