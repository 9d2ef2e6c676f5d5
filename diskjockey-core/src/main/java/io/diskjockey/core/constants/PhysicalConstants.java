package io.diskjockey.core.constants;

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

import java.util.Map;

/// Physical constants (CGS unless noted) and the molecular line catalogue.
///
/// ## Line catalogue
///
/// Rest wavelengths are keyed by species concatenated with the transition,
/// e.g. `"12CO" + "2-1"` → `"12CO2-1"`. Values are in microns.
///
/// | key       | frequency [GHz] |
/// |-----------|-----------------|
/// | 12CO2-1   | 230.538         |
/// | 12CO3-2   | 345.79599       |
/// | 13CO2-1   | 220.39868       |
/// | 13CO3-2   | 330.58797       |
/// | C18O2-1   | 219.56036       |
public final class PhysicalConstants {

    public static final double M_SUN = 1.99e33; // [g]
    public static final double M_EARTH = 5.97219e27; // [g]
    public static final double AU = 1.4959787066e13; // [cm]
    public static final double PC = 3.0856776e18; // [cm]
    public static final double G = 6.67259e-8; // [cm3 g-1 s-2]
    public static final double K_B = 1.380658e-16; // [erg K^-1]
    public static final double CC = 2.99792458e10; // [cm s^-1]
    public static final double C_KMS = 2.99792458e5; // [km s^-1]

    public static final double DEG = Math.PI / 180.0; // [radians]
    public static final double ARCSEC = Math.PI / (180.0 * 3600.0); // [radians]

    public static final double AMU = 1.6605402e-24; // [g]
    public static final double MU_GAS = 2.37;
    public static final double M_H = 1.6733e-24; // [g]

    /// molecular hydrogen number ratio to gas
    public static final double X_H2 = 0.8;

    private static final double X_12CO = 2 * 7.5e-5;
    private static final double X_13CO = X_12CO / 69.0;
    private static final double X_C18O = X_12CO / 557.0;

    /// Multiply against gas density to obtain the number density of a species.
    public static final Map<String, Double> NUMBER_DENSITIES = Map.of(
        "12CO", X_H2 * X_12CO / (MU_GAS * AMU),
        "13CO", X_H2 * X_13CO / (MU_GAS * AMU),
        "C18O", X_H2 * X_C18O / (MU_GAS * AMU));

    /// Species to RADMC-3D molecule file stem (`molecule_<stem>.inp`).
    public static final Map<String, String> MOLECULE_NAMES = Map.of(
        "12CO", "co",
        "13CO", "13co",
        "C18O", "c18o");

    /// Rest-frame wavelengths in microns, keyed by species + transition.
    public static final Map<String, Double> REST_WAVELENGTHS = Map.of(
        "12CO2-1", CC / 230.538e9 * 1e4,
        "12CO3-2", CC / 345.79599e9 * 1e4,
        "13CO2-1", CC / 220.39868e9 * 1e4,
        "13CO3-2", CC / 330.58797e9 * 1e4,
        "C18O2-1", CC / 219.56036e9 * 1e4);

    /// Fractional amount by which RADMC-3D synthesizes an image larger than commanded.
    public static final double RADMC_SIZEAU_SHIFT = 1.4233758746704833e-5;

    private PhysicalConstants() {
    }

    /// Looks up the rest wavelength for a species and transition.
    ///
    /// @param species e.g. `12CO`
    /// @param transition e.g. `2-1`
    /// @return the rest wavelength in microns
    /// @throws IllegalArgumentException if the line is not catalogued
    public static double restWavelength(String species, String transition) {
        Double lam0 = REST_WAVELENGTHS.get(species + transition);
        if (lam0 == null) {
            throw new IllegalArgumentException("Unknown line: " + species + " " + transition
                + " (known: " + REST_WAVELENGTHS.keySet() + ")");
        }
        return lam0;
    }

    /// Looks up the molecule file stem for a species.
    ///
    /// @param species e.g. `13CO`
    /// @return the file stem, e.g. `13co`
    /// @throws IllegalArgumentException if the species is unknown
    public static String moleculeName(String species) {
        String name = MOLECULE_NAMES.get(species);
        if (name == null) {
            throw new IllegalArgumentException("Unknown species: " + species);
        }
        return name;
    }

    /// Looks up the number-density conversion factor for a species.
    public static double numberDensity(String species) {
        Double factor = NUMBER_DENSITIES.get(species);
        if (factor == null) {
            throw new IllegalArgumentException("Unknown species: " + species);
        }
        return factor;
    }
}
