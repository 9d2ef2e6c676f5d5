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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class RadmcStructureWriterTest {

    @Test
    void writesEveryStructureFile(@TempDir Path dir) throws Exception {
        Grid grid = new Grid(8, 4, 1.0, 200.0);
        DiskParameters p = ModelKind.STANDARD.build(ParameterConverterTest.standardValues());

        new RadmcStructureWriter().write(dir, p, grid, "13CO");

        List<String> amr = Files.readAllLines(dir.resolve(RadmcStructureWriter.GRID_FILE));
        assertThat(amr.subList(0, 6)).containsExactly("1", "0", "100", "0", "1 1 0", "8 4 1");
        assertThat(amr).hasSize(6 + 9 + 5 + 1);
        assertThat(amr.get(amr.size() - 1)).isEqualTo("0 0");

        for (String name : List.of(RadmcStructureWriter.DENSITY_FILE, RadmcStructureWriter.TEMPERATURE_FILE,
            "numberdens_13co.inp", RadmcStructureWriter.VELOCITY_FILE, RadmcStructureWriter.TURBULENCE_FILE)) {
            List<String> lines = Files.readAllLines(dir.resolve(name));
            assertThat(lines).as(name).hasSize(2 + 32);
            assertThat(lines.get(0)).isEqualTo("1");
            assertThat(lines.get(1)).isEqualTo("32");
        }

        List<String> turbulence = Files.readAllLines(dir.resolve(RadmcStructureWriter.TURBULENCE_FILE));
        assertEquals(0.14e5, Double.parseDouble(turbulence.get(2)), 1e-6);

        for (String line : Files.readAllLines(dir.resolve(RadmcStructureWriter.DENSITY_FILE)).subList(2, 34)) {
            double rho = Double.parseDouble(line);
            assertThat(rho).isFinite().isGreaterThanOrEqualTo(0.0);
        }
        String[] velocity = Files.readAllLines(dir.resolve(RadmcStructureWriter.VELOCITY_FILE)).get(2).split(" ");
        assertThat(velocity).hasSize(3);
        assertThat(Double.parseDouble(velocity[2])).isPositive();
    }
}
