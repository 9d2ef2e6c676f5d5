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

/// Spherical simulation grid: `nr` log-spaced radial cells between `rIn` and
/// `rOut` and `ntheta` polar cells covering one hemisphere (the simulator
/// mirrors the other).
///
/// @param nr radial cell count
/// @param ntheta polar cell count
/// @param rIn inner radius in AU
/// @param rOut outer radius in AU
public record Grid(int nr, int ntheta, double rIn, double rOut) {

    public Grid {
        if (nr < 1 || ntheta < 1) {
            throw new IllegalArgumentException("Grid needs at least one cell per axis, got nr="
                + nr + ", ntheta=" + ntheta);
        }
        if (!(rIn > 0.0) || !(rOut > rIn)) {
            throw new IllegalArgumentException("Grid radii must satisfy 0 < r_in < r_out, got "
                + rIn + ", " + rOut);
        }
    }

    /// Radial cell walls in cm, `nr + 1` entries.
    public double[] radialWalls() {
        double[] walls = new double[nr + 1];
        double lo = Math.log10(rIn * PhysicalConstants.AU);
        double hi = Math.log10(rOut * PhysicalConstants.AU);
        for (int i = 0; i <= nr; i++) {
            walls[i] = Math.pow(10.0, lo + (hi - lo) * i / nr);
        }
        return walls;
    }

    /// Polar cell walls in radians from the pole to the midplane, `ntheta + 1` entries.
    public double[] polarWalls() {
        double[] walls = new double[ntheta + 1];
        for (int i = 0; i <= ntheta; i++) {
            walls[i] = Math.PI / 2.0 * i / ntheta;
        }
        return walls;
    }

    /// Radial cell centers in cm, the geometric mean of adjacent walls.
    public double[] radialCenters() {
        double[] walls = radialWalls();
        double[] centers = new double[nr];
        for (int i = 0; i < nr; i++) {
            centers[i] = Math.sqrt(walls[i] * walls[i + 1]);
        }
        return centers;
    }

    /// Polar cell centers in radians.
    public double[] polarCenters() {
        double[] walls = polarWalls();
        double[] centers = new double[ntheta];
        for (int i = 0; i < ntheta; i++) {
            centers[i] = 0.5 * (walls[i] + walls[i + 1]);
        }
        return centers;
    }
}
