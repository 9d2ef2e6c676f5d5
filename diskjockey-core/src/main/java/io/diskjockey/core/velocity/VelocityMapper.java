package io.diskjockey.core.velocity;

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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Conversions between channel wavelengths and line-of-sight velocities.
///
/// ## Conventions
///
/// - Wavelength to velocity is the non-relativistic Doppler relation
///   `v = c (λ - λ0) / λ0`.
/// - The systemic-velocity shift applied to channel wavelengths before each
///   simulation is relativistic: `λ' = λ sqrt((1 - β) / (1 + β))`, `β = v / c`.
/// - Velocities are km/s, wavelengths microns.
///
/// All methods are pure.
public final class VelocityMapper {

    private VelocityMapper() {
    }

    /// Converts observed wavelengths to velocities relative to a rest wavelength.
    ///
    /// @param lam0 the rest wavelength
    /// @param lams the observed channel wavelengths
    /// @return one velocity per channel
    public static double[] velocities(double lam0, double[] lams) {
        requirePositive(lam0);
        double[] vels = new double[lams.length];
        for (int i = 0; i < lams.length; i++) {
            vels[i] = PhysicalConstants.C_KMS * (lams[i] - lam0) / lam0;
        }
        return vels;
    }

    /// Inverse of [#velocities(double, double[])].
    ///
    /// @param lam0 the rest wavelength
    /// @param vels channel velocities
    /// @return one wavelength per velocity
    public static double[] wavelengths(double lam0, double[] vels) {
        requirePositive(lam0);
        double[] lams = new double[vels.length];
        for (int i = 0; i < vels.length; i++) {
            lams[i] = lam0 * (vels[i] / PhysicalConstants.C_KMS + 1.0);
        }
        return lams;
    }

    /// Doppler-shifts channel wavelengths by a systemic velocity.
    ///
    /// @param systemicVelocity the systemic velocity in km/s
    /// @param lams the wavelengths to shift
    /// @return the shifted wavelengths
    public static double[] dopplerShift(double systemicVelocity, double[] lams) {
        double beta = systemicVelocity / PhysicalConstants.C_KMS;
        double factor = Math.sqrt((1.0 - beta) / (1.0 + beta));
        double[] shifted = new double[lams.length];
        for (int i = 0; i < lams.length; i++) {
            shifted[i] = lams[i] * factor;
        }
        return shifted;
    }

    /// Builds the active-channel mask.
    ///
    /// A channel is active when its velocity lies outside every excluded range.
    /// Ranges are closed, so a velocity equal to either bound is excluded.
    /// A null or empty exclusion list activates every channel.
    ///
    /// @param excluded velocity ranges to exclude, may be null
    /// @param vels channel velocities
    /// @return `true` for each active channel
    public static boolean[] channelMask(List<VelocityRange> excluded, double[] vels) {
        Objects.requireNonNull(vels, "vels cannot be null");
        boolean[] mask = new boolean[vels.length];
        Arrays.fill(mask, true);
        if (excluded == null) {
            return mask;
        }
        for (int i = 0; i < vels.length; i++) {
            for (VelocityRange range : excluded) {
                if (range.contains(vels[i])) {
                    mask[i] = false;
                    break;
                }
            }
        }
        return mask;
    }

    private static void requirePositive(double lam0) {
        if (!(lam0 > 0.0)) {
            throw new IllegalArgumentException("rest wavelength must be positive: " + lam0);
        }
    }
}
