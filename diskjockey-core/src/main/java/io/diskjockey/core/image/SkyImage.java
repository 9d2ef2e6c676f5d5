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

/// A multi-channel image on the sky.
///
/// `data[channel][j][i]` is in Jy/sr at offset `(ra[i], dec[j])` arcsec from
/// the image center. The center pixel sits at index `n/2` on both axes.
/// The pixel array is mutable so the gridding correction can be applied in place.
///
/// @param data surface brightness, `[nlam][ny][nx]`
/// @param ra right-ascension offsets in arcsec, ascending
/// @param dec declination offsets in arcsec, ascending
/// @param lams channel wavelengths in microns
/// @param dl angular pixel width in radians
/// @param dm angular pixel height in radians
public record SkyImage(double[][][] data, double[] ra, double[] dec, double[] lams, double dl, double dm) {

    public int nlam() {
        return lams.length;
    }

    public int nx() {
        return ra.length;
    }

    public int ny() {
        return dec.length;
    }
}
