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

import java.util.LinkedHashMap;
import java.util.Map;

/// Default prior: uniform in every parameter except inclination, which is
/// isotropic, `p(i) = sin(i) / 2`.
///
/// The characteristic radius must lie inside the grid. Optional bounds, keyed
/// by parameter name as `{lo, hi}`, restrict the uniform support further.
public final class GeometricPrior implements DiskPrior {

    private final Map<String, double[]> bounds;

    public GeometricPrior() {
        this(Map.of());
    }

    /// @param bounds closed bounds per parameter name
    /// @throws IllegalArgumentException if a bound is not an ordered pair
    public GeometricPrior(Map<String, double[]> bounds) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : bounds.entrySet()) {
            double[] b = e.getValue();
            if (b == null || b.length != 2 || !(b[0] <= b[1])) {
                throw new IllegalArgumentException("Bounds for " + e.getKey() + " must be [lo, hi]");
            }
            copy.put(e.getKey(), b.clone());
        }
        this.bounds = copy;
    }

    @Override
    public double lnPrior(DiskParameters parameters, Grid grid) throws ModelException {
        if (!(parameters.rc() < grid.rOut())) {
            throw new ModelException("r_c " + parameters.rc() + " AU lies outside the grid (r_out "
                + grid.rOut() + " AU)");
        }
        Map<String, Double> values = parameters.values();
        for (Map.Entry<String, double[]> e : bounds.entrySet()) {
            Double value = values.get(e.getKey());
            if (value == null) {
                continue;
            }
            double[] b = e.getValue();
            if (value < b[0] || value > b[1]) {
                throw new ModelException(e.getKey() + " = " + value + " outside prior bounds ["
                    + b[0] + ", " + b[1] + "]");
            }
        }
        return Math.log(Math.sin(parameters.incl() * PhysicalConstants.DEG) / 2.0);
    }
}
