package io.diskjockey.core.image;

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

import io.diskjockey.core.constants.PhysicalConstants;

/// A multi-channel image as emitted by the simulator.
///
/// Pixel values are specific intensities in erg s⁻¹ cm⁻² Hz⁻¹ sr⁻¹, indexed
/// `data[channel][y][x]`. Pixel sizes are physical lengths in cm at the source;
/// the x axis increases toward the west, as the simulator renders it.
///
/// @param data intensities, `[nlam][ny][nx]`
/// @param pixsizeX physical pixel width in cm
/// @param pixsizeY physical pixel height in cm
/// @param lams channel wavelengths in microns
public record SynthesizedImage(double[][][] data, double pixsizeX, double pixsizeY, double[] lams) {

    public SynthesizedImage {
        if (data.length != lams.length) {
            throw new IllegalArgumentException(
                "image has " + data.length + " channels but " + lams.length + " wavelengths");
        }
    }

    public int nlam() {
        return lams.length;
    }

    public int ny() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public int nx() {
        return data.length == 0 || data[0].length == 0 ? 0 : data[0][0].length;
    }

    /// Converts this image to sky coordinates for a source at the given distance.
    ///
    /// The pixel scale becomes an angle, intensities become Jy/sr and the x axis
    /// is mirrored so that right ascension increases with column index.
    ///
    /// @param dpc distance to the source in parsecs
    /// @return the sky image
    public SkyImage toSky(double dpc) {
        if (!(dpc > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + dpc);
        }
        int nx = nx();
        int ny = ny();
        double dl = pixsizeX / (dpc * PhysicalConstants.PC); // [radians]
        double dm = pixsizeY / (dpc * PhysicalConstants.PC);

        double[][][] sky = new double[nlam()][ny][nx];
        for (int c = 0; c < nlam(); c++) {
            for (int j = 0; j < ny; j++) {
                for (int i = 0; i < nx; i++) {
                    // erg/s/cm²/Hz/sr → Jy/sr
                    sky[c][j][i] = data[c][j][nx - 1 - i] * 1e23;
                }
            }
        }

        double[] ra = new double[nx];
        for (int i = 0; i < nx; i++) {
            ra[i] = (i - nx / 2) * dl / PhysicalConstants.ARCSEC;
        }
        double[] dec = new double[ny];
        for (int j = 0; j < ny; j++) {
            dec[j] = (j - ny / 2) * dm / PhysicalConstants.ARCSEC;
        }
        return new SkyImage(sky, ra, dec, lams.clone(), dl, dm);
    }
}
