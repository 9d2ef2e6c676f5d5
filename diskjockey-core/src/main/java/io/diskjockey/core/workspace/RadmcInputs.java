package io.diskjockey.core.workspace;

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
import java.util.List;

/// Names and writers for the simulator's run-wide input files.
///
/// The static files are written once into the run's home directory (see the
/// `init` command) and copied into each workspace. Only the camera wavelength
/// list changes between evaluations.
public final class RadmcInputs {

    public static final String CONTROL_FILE = "radmc3d.inp";
    public static final String WAVELENGTH_FILE = "wavelength_micron.inp";
    public static final String LINES_FILE = "lines.inp";
    public static final String CAMERA_WAVELENGTH_FILE = "camera_wavelength_micron.inp";

    private RadmcInputs() {
    }

    /// The molecule data file for a species, e.g. `molecule_co.inp`.
    public static String moleculeFile(String species) {
        return "molecule_" + PhysicalConstants.moleculeName(species) + ".inp";
    }

    /// The files copied into every workspace before simulation.
    public static List<String> staticFiles(String species) {
        return List.of(CONTROL_FILE, WAVELENGTH_FILE, LINES_FILE, moleculeFile(species));
    }

    /// Writes `radmc3d.inp` for gas-line imaging without dust or photon transport.
    public static void writeControl(Path directory) throws IOException {
        Workspace.writeLines(directory.resolve(CONTROL_FILE), List.of(
            "incl_dust = 0",
            "incl_lines = 1",
            "incl_freefree = 0",
            "nphot = 0",
            "modified_random_walk = 1",
            "istar_sphere = 1",
            "tgas_eq_tdust = 0",
            "writeimage_unformatted = 0",
            "scattering_mode_max = 0",
            "lines_mode = 1"));
    }

    /// Writes `lines.inp` naming the species' molecule file in LAMDA format.
    public static void writeLines(Path directory, String species) throws IOException {
        Workspace.writeLines(directory.resolve(LINES_FILE), List.of(
            "2",
            "1",
            PhysicalConstants.moleculeName(species) + "    leiden    0    0    0"));
    }

    /// Writes the global `wavelength_micron.inp`.
    ///
    /// @param directory the home directory
    /// @param lams wavelengths in microns covering the observed band
    public static void writeWavelengths(Path directory, double[] lams) throws IOException {
        writeWavelengthList(directory.resolve(WAVELENGTH_FILE), lams);
    }

    /// Writes a count-prefixed wavelength list.
    static void writeWavelengthList(Path file, double[] lams) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
            out.write(Integer.toString(lams.length));
            out.write('\n');
            for (double lam : lams) {
                out.write(Double.toString(lam));
                out.write('\n');
            }
        }
    }
}
