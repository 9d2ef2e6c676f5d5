package io.diskjockey.core.model;

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

import java.util.Map;

/// Fully resolved parameters driving one simulator invocation.
///
/// ## Model kinds
///
/// Each implementation is one variant of a closed set selected by [ModelKind]:
///
/// ```text
/// ┌───────────────────────────────────────────────────────────────┐
/// │                        DiskParameters                         │
/// ├───────────────────────────────────────────────────────────────┤
/// │ geometry:  dpc, incl, PA, vel, mu_RA, mu_DEC                  │
/// │ star:      M_star                                             │
/// │ gas:       logM_gas, ksi, T_10, q                             │
/// ├───────────────┬──────────────────────┬────────────────────────┤
/// │ standard      │ truncated            │ cavity                 │
/// │ r_c, gamma    │ r_c, gamma, gamma_e  │ r_c, r_cav, gamma,     │
/// │               │                      │ gamma_cav              │
/// └───────────────┴──────────────────────┴────────────────────────┘
/// ```
///
/// Units: masses in M_sun (gas mass as log10), radii in AU, temperatures in K,
/// velocities in km/s, angles in degrees, offsets in arcsec, distance in pc.
public interface DiskParameters {

    /// The model kind this variant belongs to.
    ModelKind kind();

    double mStar();

    double rc();

    double t10();

    double q();

    double logMGas();

    double ksi();

    double dpc();

    double incl();

    double pa();

    double vel();

    double muRa();

    double muDec();

    /// Parameter values keyed by their configuration names, in the kind's order.
    Map<String, Double> values();

    /// Gas surface density at a cylindrical radius.
    ///
    /// @param radius cylindrical radius in cm
    /// @return surface density in g cm⁻²
    double surfaceDensity(double radius);

    /// Gas temperature at a cylindrical radius, `T_10 (r / 10 AU)^-q`.
    ///
    /// @param radius cylindrical radius in cm
    /// @return temperature in K
    default double temperature(double radius) {
        return t10() * Math.pow(radius / (10.0 * PhysicalConstants.AU), -q());
    }

    /// Total gas mass in grams.
    default double gasMass() {
        return Math.pow(10.0, logMGas()) * PhysicalConstants.M_SUN;
    }
}
