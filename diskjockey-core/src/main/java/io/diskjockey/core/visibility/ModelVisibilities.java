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

import io.diskjockey.core.constants.PhysicalConstants;

/// Model visibilities resampled onto one channel's (u,v) coordinates.
///
/// Mutable: the phase shift is applied in place. Instances live only for the
/// duration of a single probability evaluation.
public final class ModelVisibilities {

    private final double[] uu;
    private final double[] vv;
    private final double[] re;
    private final double[] im;

    /// @param uu u coordinates in kλ, shared with the planning channel
    /// @param vv v coordinates in kλ
    /// @param re real parts, owned by this instance
    /// @param im imaginary parts, owned by this instance
    public ModelVisibilities(double[] uu, double[] vv, double[] re, double[] im) {
        if (vv.length != uu.length || re.length != uu.length || im.length != uu.length) {
            throw new IllegalArgumentException("sample arrays differ in length");
        }
        this.uu = uu;
        this.vv = vv;
        this.re = re;
        this.im = im;
    }

    public int size() {
        return re.length;
    }

    public double re(int k) {
        return re[k];
    }

    public double im(int k) {
        return im[k];
    }

    public double[] re() {
        return re.clone();
    }

    public double[] im() {
        return im.clone();
    }

    /// Multiplies every sample by `exp(-2πi (u Δα + v Δδ))`, the Fourier
    /// equivalent of translating the sky image by `(Δα, Δδ)`.
    ///
    /// @param offsetRa right-ascension offset in arcsec
    /// @param offsetDec declination offset in arcsec
    public void phaseShift(double offsetRa, double offsetDec) {
        double ra = offsetRa * PhysicalConstants.ARCSEC;
        double dec = offsetDec * PhysicalConstants.ARCSEC;
        for (int k = 0; k < re.length; k++) {
            // kλ → λ
            double phase = -2.0 * Math.PI * (uu[k] * 1e3 * ra + vv[k] * 1e3 * dec);
            double c = Math.cos(phase);
            double s = Math.sin(phase);
            double r = re[k];
            double i = im[k];
            re[k] = r * c - i * s;
            im[k] = r * s + i * c;
        }
    }

    /// Builds a data channel carrying these model values as observations.
    ///
    /// @param lam the channel wavelength
    /// @param weight per-sample weights
    public VisibilityChannel toChannel(double lam, double[] weight) {
        return new VisibilityChannel(lam, uu, vv, re, im, weight);
    }
}
