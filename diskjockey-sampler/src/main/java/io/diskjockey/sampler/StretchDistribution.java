package io.diskjockey.sampler;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;

/// Samples the stretch scale `z` with density `g(z) ∝ 1/√z` on `[1/a, a]`.
///
/// Inverse-CDF: `z = ((a - 1)u + 1)² / a` for `u` uniform on `[0, 1)`.
public final class StretchDistribution implements ContinuousSampler {

    /// The customary scale parameter.
    public static final double DEFAULT_SCALE = 2.0;

    private final UniformRandomProvider rng;
    private final double a;

    public StretchDistribution(UniformRandomProvider rng, double a) {
        if (!(a > 1.0) || !Double.isFinite(a)) {
            throw new IllegalArgumentException("stretch scale must be a finite value greater than 1, got " + a);
        }
        this.rng = rng;
        this.a = a;
    }

    public double scale() {
        return a;
    }

    @Override
    public double sample() {
        return inverseCdf(rng.nextDouble(), a);
    }

    /// Maps a uniform draw to a stretch scale.
    public static double inverseCdf(double u, double a) {
        double t = (a - 1.0) * u + 1.0;
        return t * t / a;
    }
}
