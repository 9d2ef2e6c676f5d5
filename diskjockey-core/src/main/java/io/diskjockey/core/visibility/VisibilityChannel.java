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

import java.util.Arrays;

/// Observed visibilities for one spectral channel.
///
/// ## Layout
///
/// Samples are held column-wise: `uu[k], vv[k], re[k], im[k], weight[k]`
/// describe sample `k`. Spatial frequencies are in kλ, visibilities in Jy and
/// weights are `1/σ²`.
///
/// ## Immutability
///
/// Arrays are copied on construction and on every accessor, so a channel can
/// be shared across worker threads without synchronization.
public final class VisibilityChannel {

    private final double lam;
    private final double[] uu;
    private final double[] vv;
    private final double[] re;
    private final double[] im;
    private final double[] weight;

    /// Creates a channel.
    ///
    /// @param lam the channel wavelength in microns
    /// @param uu u coordinates in kλ
    /// @param vv v coordinates in kλ
    /// @param re real parts in Jy
    /// @param im imaginary parts in Jy
    /// @param weight statistical weights, `1/σ²`
    /// @throws IllegalArgumentException if the arrays differ in length or a weight is negative
    public VisibilityChannel(double lam, double[] uu, double[] vv, double[] re, double[] im, double[] weight) {
        int n = uu.length;
        if (vv.length != n || re.length != n || im.length != n || weight.length != n) {
            throw new IllegalArgumentException(String.format(
                "sample arrays differ in length: uu=%d vv=%d re=%d im=%d weight=%d",
                uu.length, vv.length, re.length, im.length, weight.length));
        }
        for (double w : weight) {
            if (!(w >= 0.0)) {
                throw new IllegalArgumentException("weights must be non-negative: " + w);
            }
        }
        this.lam = lam;
        this.uu = uu.clone();
        this.vv = vv.clone();
        this.re = re.clone();
        this.im = im.clone();
        this.weight = weight.clone();
    }

    public double lam() {
        return lam;
    }

    public int size() {
        return uu.length;
    }

    public double[] uu() {
        return uu.clone();
    }

    public double[] vv() {
        return vv.clone();
    }

    public double[] re() {
        return re.clone();
    }

    public double[] im() {
        return im.clone();
    }

    public double[] weight() {
        return weight.clone();
    }

    double u(int k) {
        return uu[k];
    }

    double v(int k) {
        return vv[k];
    }

    double re(int k) {
        return re[k];
    }

    double im(int k) {
        return im[k];
    }

    double weight(int k) {
        return weight[k];
    }

    /// Returns the complex conjugate of this channel.
    ///
    /// Visibilities are Hermitian, so conjugation only flips the sign
    /// convention of the imaginary part to match the forward transform.
    public VisibilityChannel conjugate() {
        double[] conj = new double[im.length];
        for (int k = 0; k < conj.length; k++) {
            conj[k] = -im[k];
        }
        return new VisibilityChannel(lam, uu, vv, re, conj, weight);
    }

    /// Log-likelihood of a set of model visibilities sampled at this channel's
    /// coordinates: `-0.5 Σ w |V_data - V_model|²`.
    ///
    /// @param model model visibilities planned for this channel
    /// @return the channel log-likelihood
    /// @throws IllegalArgumentException if the model has a different sample count
    public double lnLikelihood(ModelVisibilities model) {
        if (model.size() != size()) {
            throw new IllegalArgumentException(
                "model has " + model.size() + " samples, channel has " + size());
        }
        double chi2 = 0.0;
        for (int k = 0; k < uu.length; k++) {
            double dr = re[k] - model.re(k);
            double di = im[k] - model.im(k);
            chi2 += weight[k] * (dr * dr + di * di);
        }
        return -0.5 * chi2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VisibilityChannel that)) {
            return false;
        }
        return Double.compare(lam, that.lam) == 0
            && Arrays.equals(uu, that.uu)
            && Arrays.equals(vv, that.vv)
            && Arrays.equals(re, that.re)
            && Arrays.equals(im, that.im)
            && Arrays.equals(weight, that.weight);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(lam);
        result = 31 * result + Arrays.hashCode(uu);
        result = 31 * result + Arrays.hashCode(vv);
        return result;
    }

    @Override
    public String toString() {
        return String.format("VisibilityChannel[lam=%.6f, samples=%d]", lam, size());
    }
}
