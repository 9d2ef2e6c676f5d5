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

/// Prolate spheroidal wave functions for convolutional gridding.
///
/// Rational approximation of Schwab (1984) for support width `m = 6` and
/// weighting exponent `α = 1`:
///
/// - [#spheroid(double)] ψ(η), the image-plane taper
/// - [#gcffun(double)] `|1 - η²| ψ(η)`, the Fourier-plane convolution kernel
/// - [#corrfun(double)] the image-plane correction that undoes the kernel
///
/// η is the offset normalized to the kernel half-width and is defined on `[-1, 1]`.
public final class Spheroidal {

    /// Kernel support in grid cells.
    public static final int SUPPORT = 6;

    private static final double[] P_INNER = {8.203343e-2, -3.644705e-1, 6.278660e-1, -5.335581e-1, 2.312756e-1};
    private static final double[] Q_INNER = {1.0, 8.212018e-1, 2.078043e-1};
    private static final double[] P_OUTER = {4.028559e-3, -3.697768e-2, 1.021332e-1, -1.201436e-1, 6.412774e-2};
    private static final double[] Q_OUTER = {1.0, 9.599102e-1, 2.918724e-1};

    private Spheroidal() {
    }

    public static double spheroid(double eta) {
        double nu = Math.abs(eta);
        if (nu > 1.0) {
            return 0.0;
        }
        double[] p;
        double[] q;
        double nuEnd;
        if (nu <= 0.75) {
            p = P_INNER;
            q = Q_INNER;
            nuEnd = 0.75;
        } else {
            p = P_OUTER;
            q = Q_OUTER;
            nuEnd = 1.0;
        }
        double delnusq = nu * nu - nuEnd * nuEnd;
        return polyval(p, delnusq) / polyval(q, delnusq);
    }

    public static double gcffun(double eta) {
        return Math.abs(1.0 - eta * eta) * spheroid(eta);
    }

    public static double corrfun(double eta) {
        return spheroid(eta);
    }

    private static double polyval(double[] coeffs, double x) {
        double sum = 0.0;
        double pow = 1.0;
        for (double c : coeffs) {
            sum += c * pow;
            pow *= x;
        }
        return sum;
    }
}
