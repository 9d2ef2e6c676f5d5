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

import io.diskjockey.core.visibility.ModelVisibilities;
import io.diskjockey.core.visibility.VisibilityChannel;

/// Resamples a [FourierGrid] onto one channel's observed (u,v) coordinates.
///
/// ## Planning
///
/// The grid axes depend only on the pixel count and angular pixel size, both
/// fixed for a run, so the grid cells and convolution weights for every sample
/// are computed once here and reused for every simulator call:
///
/// ```text
///   for each sample k:
///     u-cells  i0-2 .. i0+3   weights gcffun((u - uu[i]) / 3du), normalized
///     v-cells  j0-2 .. j0+3   weights gcffun((v - vv[j]) / 3dv), normalized
///
///   V(u,v) = Σ_m Σ_n  wu[m] wv[n] F[j0-2+n][i0-2+m]
/// ```
///
/// Plans are immutable and safe to share between threads.
public final class InterpolationPlan {

    private static final int HALF = Spheroidal.SUPPORT / 2;

    private final int nu;
    private final int nv;
    private final double[] uu;
    private final double[] vv;
    private final int[] uStart;
    private final int[] vStart;
    private final double[][] uWeights;
    private final double[][] vWeights;

    private InterpolationPlan(int nu, int nv, double[] uu, double[] vv, int[] uStart, int[] vStart,
                              double[][] uWeights, double[][] vWeights) {
        this.nu = nu;
        this.nv = nv;
        this.uu = uu;
        this.vv = vv;
        this.uStart = uStart;
        this.vStart = vStart;
        this.uWeights = uWeights;
        this.vWeights = vWeights;
    }

    /// Plans the interpolation for a channel.
    ///
    /// @param channel the observed channel whose coordinates are targeted
    /// @param gridU the u axis of the Fourier grid, kλ, ascending and uniform
    /// @param gridV the v axis of the Fourier grid, kλ, ascending and uniform
    /// @return the plan
    /// @throws IllegalArgumentException if a sample lies too close to the grid edge
    public static InterpolationPlan plan(VisibilityChannel channel, double[] gridU, double[] gridV) {
        double[] u = channel.uu();
        double[] v = channel.vv();
        int n = u.length;
        int[] uStart = new int[n];
        int[] vStart = new int[n];
        double[][] uWeights = new double[n][];
        double[][] vWeights = new double[n][];
        for (int k = 0; k < n; k++) {
            uStart[k] = startIndex(u[k], gridU, "u");
            vStart[k] = startIndex(v[k], gridV, "v");
            uWeights[k] = weights(u[k], gridU, uStart[k]);
            vWeights[k] = weights(v[k], gridV, vStart[k]);
        }
        return new InterpolationPlan(gridU.length, gridV.length, u, v, uStart, vStart, uWeights, vWeights);
    }

    /// Number of samples this plan produces.
    public int size() {
        return uStart.length;
    }

    /// Interpolates a Fourier grid at the planned coordinates.
    ///
    /// @param grid a grid with the same axes the plan was built for
    /// @return model visibilities for the channel
    public ModelVisibilities interpolate(FourierGrid grid) {
        if (grid.uu().length != nu || grid.vv().length != nv) {
            throw new IllegalArgumentException("grid is " + grid.uu().length + "x" + grid.vv().length
                + " but plan was built for " + nu + "x" + nv);
        }
        double[][] fre = grid.re();
        double[][] fim = grid.im();
        int n = uStart.length;
        double[] re = new double[n];
        double[] im = new double[n];
        for (int k = 0; k < n; k++) {
            double sumRe = 0.0;
            double sumIm = 0.0;
            double[] wu = uWeights[k];
            double[] wv = vWeights[k];
            int i0 = uStart[k];
            int j0 = vStart[k];
            for (int b = 0; b < Spheroidal.SUPPORT; b++) {
                double[] rowRe = fre[j0 + b];
                double[] rowIm = fim[j0 + b];
                double rowSumRe = 0.0;
                double rowSumIm = 0.0;
                for (int a = 0; a < Spheroidal.SUPPORT; a++) {
                    rowSumRe += wu[a] * rowRe[i0 + a];
                    rowSumIm += wu[a] * rowIm[i0 + a];
                }
                sumRe += wv[b] * rowSumRe;
                sumIm += wv[b] * rowSumIm;
            }
            re[k] = sumRe;
            im[k] = sumIm;
        }
        return new ModelVisibilities(uu, vv, re, im);
    }

    private static int startIndex(double x, double[] axis, String name) {
        double dx = axis[1] - axis[0];
        int left = (int) Math.floor((x - axis[0]) / dx);
        int start = left - (HALF - 1);
        if (start < 0 || start + Spheroidal.SUPPORT > axis.length) {
            throw new IllegalArgumentException(String.format(
                "%s=%.3f kλ lies outside the interpolable Fourier grid [%.3f, %.3f]; "
                    + "increase npix or reduce the field of view",
                name, x, axis[HALF - 1], axis[axis.length - HALF]));
        }
        return start;
    }

    private static double[] weights(double x, double[] axis, int start) {
        double dx = axis[1] - axis[0];
        double[] w = new double[Spheroidal.SUPPORT];
        double total = 0.0;
        for (int a = 0; a < Spheroidal.SUPPORT; a++) {
            double eta = (x - axis[start + a]) / (HALF * dx);
            w[a] = Spheroidal.gcffun(eta);
            total += w[a];
        }
        for (int a = 0; a < w.length; a++) {
            w[a] /= total;
        }
        return w;
    }
}
