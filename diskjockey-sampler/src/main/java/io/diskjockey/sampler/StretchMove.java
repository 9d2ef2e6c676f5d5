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

/// The affine-invariant stretch move.
///
/// A walker at `x` with partner `y` moves to `y + z (x - y)`. The proposal is
/// accepted with probability `min(1, z^(n-1) p(x') / p(x))`, where `n` is the
/// number of dimensions.
public final class StretchMove {

    private StretchMove() {
    }

    public static double[] propose(double[] current, double[] partner, double z) {
        if (current.length != partner.length) {
            throw new IllegalArgumentException(
                "walker has " + current.length + " dimensions, partner has " + partner.length);
        }
        double[] proposal = new double[current.length];
        for (int i = 0; i < current.length; i++) {
            proposal[i] = partner[i] + z * (current[i] - partner[i]);
        }
        return proposal;
    }

    /// Log acceptance ratio. `+∞` when leaving a zero-density position for a
    /// positive one, `-∞` when the proposal has zero density, NaN when both do.
    public static double lnAcceptance(int dimensions, double z, double lnpProposed, double lnpCurrent) {
        return (dimensions - 1) * Math.log(z) + lnpProposed - lnpCurrent;
    }

    /// Metropolis decision for uniform draw `u`. A NaN ratio always rejects.
    public static boolean accept(double lnRatio, double u) {
        if (Double.isNaN(lnRatio)) {
            return false;
        }
        return Math.log(u) < lnRatio;
    }
}
