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

/// The Fourier transform of one image channel on a centered frequency grid.
///
/// `re[j][i] + i·im[j][i]` is the visibility in Jy at `(uu[i], vv[j])` kλ.
/// The zero-frequency term sits at index `n/2`.
///
/// @param re real parts, `[nv][nu]`
/// @param im imaginary parts, `[nv][nu]`
/// @param uu u axis in kλ, ascending
/// @param vv v axis in kλ, ascending
public record FourierGrid(double[][] re, double[][] im, double[] uu, double[] vv) {

    /// Frequencies of an `n`-point transform with sample spacing `d`, with the
    /// zero-frequency term shifted to index `n/2`.
    ///
    /// @param n number of samples, even
    /// @param d sample spacing in radians
    /// @return frequencies in kλ, ascending
    public static double[] shiftedFrequencies(int n, double d) {
        double[] freqs = new double[n];
        for (int k = 0; k < n; k++) {
            freqs[k] = (k - n / 2) / (n * d) * 1e-3;
        }
        return freqs;
    }
}
