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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class GeometricPriorTest {

    private static final Grid GRID = new Grid(64, 32, 0.1, 700.0);

    private static DiskParameters params(double rc, double incl) throws ModelException {
        Map<String, Double> v = ParameterConverterTest.standardValues();
        v.put("r_c", rc);
        v.put("incl", incl);
        return ModelKind.STANDARD.build(v);
    }

    @Test
    void inclinationPriorIsIsotropic() throws ModelException {
        double lnp = new GeometricPrior().lnPrior(params(45.0, 30.0), GRID);
        assertEquals(Math.log(0.25), lnp, 1e-12);
        assertThat(new GeometricPrior().lnPrior(params(45.0, 0.0), GRID)).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void characteristicRadiusMustLieInsideGrid() {
        assertThatThrownBy(() -> new GeometricPrior().lnPrior(params(700.0, 30.0), GRID))
            .isInstanceOf(ModelException.class)
            .hasMessageContaining("r_c");
    }

    @Test
    void configuredBoundsRestrictSupport() throws ModelException {
        GeometricPrior prior = new GeometricPrior(Map.of("incl", new double[]{10.0, 80.0}));
        assertThat(prior.lnPrior(params(45.0, 80.0), GRID)).isFinite();
        assertThatThrownBy(() -> prior.lnPrior(params(45.0, 81.0), GRID)).isInstanceOf(ModelException.class);
        assertThatThrownBy(() -> new GeometricPrior(Map.of("incl", new double[]{5.0, 1.0})))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void imageMustContainTheGrid() throws ModelException {
        ImageSize size = ImageSize.of(12.0, 140.0, GRID);
        assertEquals(1680.0, size.desired(), 1e-9);
        assertEquals(1680.0 * (1.0 - PhysicalConstants.RADMC_SIZEAU_SHIFT), size.command(), 1e-9);

        assertThatThrownBy(() -> ImageSize.of(8.0, 140.0, GRID))
            .isInstanceOf(ModelException.class)
            .hasMessageContaining("field of view");
    }

    @Test
    void gridWallsSpanRadiiAndHemisphere() {
        Grid grid = new Grid(4, 3, 1.0, 100.0);
        double[] r = grid.radialWalls();
        assertThat(r).hasSize(5);
        assertEquals(PhysicalConstants.AU, r[0], PhysicalConstants.AU * 1e-12);
        assertEquals(100.0 * PhysicalConstants.AU, r[4], 100.0 * PhysicalConstants.AU * 1e-12);
        assertEquals(10.0 * PhysicalConstants.AU, r[2], 10.0 * PhysicalConstants.AU * 1e-12);
        assertThat(grid.polarWalls()).hasSize(4);
        assertEquals(Math.PI / 2.0, grid.polarWalls()[3], 1e-15);
        assertThatThrownBy(() -> new Grid(4, 3, 10.0, 5.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
