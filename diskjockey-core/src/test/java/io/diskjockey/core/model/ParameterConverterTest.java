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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@Tag("unit")
class ParameterConverterTest {

    static Map<String, Double> standardValues() {
        Map<String, Double> v = new LinkedHashMap<>();
        v.put("M_star", 1.75);
        v.put("r_c", 45.0);
        v.put("T_10", 115.0);
        v.put("q", 0.63);
        v.put("gamma", 1.0);
        v.put("logM_gas", -3.5);
        v.put("ksi", 0.14);
        v.put("dpc", 73.0);
        v.put("incl", 147.0);
        v.put("PA", 151.0);
        v.put("vel", 1.2);
        v.put("mu_RA", 0.0);
        v.put("mu_DEC", 0.0);
        return v;
    }

    @Test
    void freeParametersFollowCanonicalOrder() throws ModelException {
        ParameterConverter converter = ParameterConverter.of(ModelKind.STANDARD,
            List.of("T_10", "q", "dpc", "mu_RA", "mu_DEC"), standardValues());

        assertThat(converter.freeNames())
            .containsExactly("M_star", "r_c", "gamma", "logM_gas", "ksi", "incl", "PA", "vel");
        assertThat(converter.dimensions()).isEqualTo(8);

        DiskParameters p = converter.convert(converter.vectorOf(standardValues()));
        assertInstanceOf(StandardParameters.class, p);
        assertThat(p.values()).isEqualTo(standardValues());
    }

    @Test
    void freeAndFixedMustCoverTheModel() {
        Map<String, Double> fixed = new HashMap<>(standardValues());
        fixed.remove("M_star");
        fixed.remove("r_c");
        assertThatThrownBy(() -> new ParameterConverter(ModelKind.STANDARD, List.of("M_star"), fixed))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("r_c");

        assertThatThrownBy(() -> new ParameterConverter(ModelKind.STANDARD, List.of("M_star", "r_c", "gamma_e"), fixed))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gamma_e");

        assertThatThrownBy(() -> ParameterConverter.of(ModelKind.STANDARD, List.of("bogus"), standardValues()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outOfDomainVectorsAreModelExceptions() {
        ParameterConverter converter = ParameterConverter.of(ModelKind.STANDARD, List.of(), standardValues());
        double[] good = converter.vectorOf(standardValues());

        assertThatThrownBy(() -> converter.convert(new double[3])).isInstanceOf(ModelException.class);

        for (String name : List.of("M_star", "r_c", "T_10", "ksi", "dpc")) {
            double[] bad = good.clone();
            bad[converter.freeNames().indexOf(name)] = 0.0;
            assertThatThrownBy(() -> converter.convert(bad)).as(name)
                .isInstanceOf(ModelException.class)
                .hasMessageContaining(name);
        }

        double[] steep = good.clone();
        steep[converter.freeNames().indexOf("gamma")] = 2.0;
        assertThatThrownBy(() -> converter.convert(steep)).isInstanceOf(ModelException.class);

        double[] flipped = good.clone();
        flipped[converter.freeNames().indexOf("incl")] = 181.0;
        assertThatThrownBy(() -> converter.convert(flipped)).isInstanceOf(ModelException.class);

        double[] nan = good.clone();
        nan[0] = Double.NaN;
        assertThatThrownBy(() -> converter.convert(nan)).isInstanceOf(ModelException.class);
    }

    @Test
    void truncatedAndCavityKindsValidateTheirExtras() throws ModelException {
        Map<String, Double> truncated = new LinkedHashMap<>(standardValues());
        truncated.put("gamma_e", 3.0);
        DiskParameters t = ModelKind.TRUNCATED.build(truncated);
        assertThat(t.kind()).isEqualTo(ModelKind.TRUNCATED);
        truncated.put("gamma_e", 1.5);
        assertThatThrownBy(() -> ModelKind.TRUNCATED.build(truncated)).isInstanceOf(ModelException.class);

        Map<String, Double> cavity = new LinkedHashMap<>(standardValues());
        cavity.put("r_cav", 10.0);
        cavity.put("gamma_cav", 2.0);
        assertThat(ModelKind.fromTag("cavity").build(cavity)).isInstanceOf(CavityParameters.class);
        cavity.put("r_cav", 60.0);
        assertThatThrownBy(() -> ModelKind.CAVITY.build(cavity)).isInstanceOf(ModelException.class);

        assertThatThrownBy(() -> ModelKind.fromTag("flared")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void surfaceDensityIntegratesToGasMass() throws ModelException {
        DiskParameters p = ModelKind.STANDARD.build(standardValues());
        double lo = Math.log(0.01 * PhysicalConstants.AU);
        double hi = Math.log(5000.0 * PhysicalConstants.AU);
        int steps = 20000;
        double h = (hi - lo) / steps;
        double mass = 0.0;
        for (int i = 0; i < steps; i++) {
            double r = Math.exp(lo + (i + 0.5) * h);
            mass += 2.0 * Math.PI * r * p.surfaceDensity(r) * r * h;
        }
        assertEquals(p.gasMass(), mass, p.gasMass() * 1e-3);
    }

    @Test
    void describeNamesEachValue() {
        ParameterConverter converter = ParameterConverter.of(ModelKind.STANDARD,
            List.of("T_10", "q", "gamma", "logM_gas", "ksi", "dpc", "PA", "vel", "mu_RA", "mu_DEC"), standardValues());
        assertThat(converter.describe(new double[]{1.0, 2.0, 3.0})).isEqualTo("{M_star=1.0, r_c=2.0, incl=3.0}");
    }
}
