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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Writes RADMC-3D structure files for a vertically isothermal, Keplerian disk.
///
/// ## Files
///
/// | file                     | content                                  |
/// |--------------------------|------------------------------------------|
/// | `amr_grid.inp`           | spherical grid walls                     |
/// | `gas_density.inp`        | gas mass density, g cm⁻³                 |
/// | `gas_temperature.inp`    | gas temperature, K                       |
/// | `numberdens_<mol>.inp`   | molecule number density, cm⁻³            |
/// | `gas_velocity.inp`       | `vr vθ vφ`, cm s⁻¹                       |
/// | `microturbulence.inp`    | turbulent line width, cm s⁻¹             |
///
/// Cell values are written with the radial index varying fastest. At cylindrical
/// radius `R` and height `z` the density is
///
/// ```text
///   ρ(R, z) = Σ(R) / (√(2π) H) · exp(-z² / 2H²),   H = √(k T R³ / (μ m_H G M*))
/// ```
public final class RadmcStructureWriter implements DiskStructureWriter {

    public static final String GRID_FILE = "amr_grid.inp";
    public static final String DENSITY_FILE = "gas_density.inp";
    public static final String TEMPERATURE_FILE = "gas_temperature.inp";
    public static final String VELOCITY_FILE = "gas_velocity.inp";
    public static final String TURBULENCE_FILE = "microturbulence.inp";

    /// The number-density file name for a species.
    public static String numberDensityFile(String species) {
        return "numberdens_" + PhysicalConstants.moleculeName(species) + ".inp";
    }

    @Override
    public void write(Path directory, DiskParameters parameters, Grid grid, String species) throws IOException {
        double numberFactor = PhysicalConstants.numberDensity(species);
        writeGrid(directory, grid);

        double[] r = grid.radialCenters();
        double[] theta = grid.polarCenters();
        int cells = r.length * theta.length;
        double mStar = parameters.mStar() * PhysicalConstants.M_SUN;
        double turbulence = parameters.ksi() * 1e5;

        try (BufferedWriter rho = open(directory.resolve(DENSITY_FILE), cells);
             BufferedWriter temp = open(directory.resolve(TEMPERATURE_FILE), cells);
             BufferedWriter nden = open(directory.resolve(numberDensityFile(species)), cells);
             BufferedWriter vel = open(directory.resolve(VELOCITY_FILE), cells);
             BufferedWriter turb = open(directory.resolve(TURBULENCE_FILE), cells)) {
            for (double th : theta) {
                double sin = Math.sin(th);
                double cos = Math.cos(th);
                for (double radius : r) {
                    double cylR = radius * sin;
                    double z = radius * cos;
                    double t = parameters.temperature(cylR);
                    double density = density(parameters, mStar, cylR, z, t);
                    double vPhi = Math.sqrt(PhysicalConstants.G * mStar / (radius * radius * radius)) * cylR;

                    line(rho, density);
                    line(temp, t);
                    line(nden, density * numberFactor);
                    vel.write("0.0 0.0 ");
                    vel.write(Double.toString(vPhi));
                    vel.write('\n');
                    line(turb, turbulence);
                }
            }
        }
    }

    /// Writes `amr_grid.inp` for a regular spherical grid with one azimuthal cell.
    ///
    /// @param directory the directory to write into
    /// @param grid the grid
    /// @throws IOException if the file cannot be written
    public static void writeGrid(Path directory, Grid grid) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(directory.resolve(GRID_FILE), StandardCharsets.US_ASCII)) {
            out.write("1\n");           // iformat
            out.write("0\n");           // regular grid
            out.write("100\n");         // spherical
            out.write("0\n");           // gridinfo
            out.write("1 1 0\n");       // active r, theta; phi collapsed
            out.write(grid.nr() + " " + grid.ntheta() + " 1\n");
            for (double wall : grid.radialWalls()) {
                line(out, wall);
            }
            for (double wall : grid.polarWalls()) {
                line(out, wall);
            }
            out.write("0 0\n");
        }
    }

    static double density(DiskParameters parameters, double mStar, double cylR, double z, double t) {
        double h = Math.sqrt(PhysicalConstants.K_B * t * cylR * cylR * cylR
            / (PhysicalConstants.MU_GAS * PhysicalConstants.M_H * PhysicalConstants.G * mStar));
        double sigma = parameters.surfaceDensity(cylR);
        double rho = sigma / (Math.sqrt(2.0 * Math.PI) * h) * Math.exp(-z * z / (2.0 * h * h));
        return Double.isFinite(rho) ? rho : 0.0;
    }

    private static BufferedWriter open(Path path, int cells) throws IOException {
        BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.US_ASCII);
        out.write("1\n");
        out.write(cells + "\n");
        return out;
    }

    private static void line(BufferedWriter out, double value) throws IOException {
        out.write(Double.toString(value));
        out.write('\n');
    }
}
