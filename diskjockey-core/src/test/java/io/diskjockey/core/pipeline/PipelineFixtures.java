package io.diskjockey.core.pipeline;

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
import io.diskjockey.core.likelihood.LikelihoodEvaluator;
import io.diskjockey.core.model.GeometricPrior;
import io.diskjockey.core.model.Grid;
import io.diskjockey.core.model.ModelKind;
import io.diskjockey.core.model.ParameterConverter;
import io.diskjockey.core.model.RadmcStructureWriter;
import io.diskjockey.core.visibility.VisibilityChannel;
import io.diskjockey.core.visibility.VisibilityDataset;
import io.diskjockey.core.workspace.RadmcInputs;
import io.diskjockey.core.workspace.Simulator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A small, fast forward-model setup: 32 pixels over 8 arcsec, a coarse grid
/// and two 12CO 2-1 channels.
public final class PipelineFixtures {

    public static final int NPIX = 32;
    public static final double SIZE_ARCSEC = 8.0;
    public static final Grid GRID = new Grid(12, 6, 1.0, 400.0);
    public static final String SPECIES = "12CO";

    /// Free parameters of the fixture converter.
    public static final List<String> FREE = List.of("M_star", "r_c", "incl", "PA", "mu_RA", "mu_DEC");

    private PipelineFixtures() {
    }

    public static Map<String, Double> values() {
        Map<String, Double> v = new LinkedHashMap<>();
        v.put("M_star", 1.0);
        v.put("r_c", 50.0);
        v.put("T_10", 40.0);
        v.put("q", 0.5);
        v.put("gamma", 1.0);
        v.put("logM_gas", -3.0);
        v.put("ksi", 0.2);
        v.put("dpc", 140.0);
        v.put("incl", 40.0);
        v.put("PA", 30.0);
        v.put("vel", 1.5);
        v.put("mu_RA", 0.1);
        v.put("mu_DEC", -0.05);
        return v;
    }

    /// The fixture's reference vector, in [#FREE] order.
    public static double[] truth() {
        return converter().vectorOf(values());
    }

    public static ParameterConverter converter() {
        Map<String, Double> fixed = new LinkedHashMap<>(values());
        FREE.forEach(fixed::remove);
        return new ParameterConverter(ModelKind.STANDARD, FREE, fixed);
    }

    /// Two channels of deterministic (u,v) samples inside the Fourier grid, all data zero.
    public static VisibilityDataset emptyData() {
        double lam0 = PhysicalConstants.restWavelength(SPECIES, "2-1");
        double[] lams = {lam0 * (1.0 - 0.5 / PhysicalConstants.C_KMS), lam0 * (1.0 + 0.5 / PhysicalConstants.C_KMS)};
        int n = 40;
        List<VisibilityChannel> channels = new ArrayList<>();
        for (int c = 0; c < lams.length; c++) {
            double[] uu = new double[n];
            double[] vv = new double[n];
            double[] w = new double[n];
            for (int k = 0; k < n; k++) {
                double angle = 2.0 * Math.PI * k / n + c;
                double radius = 10.0 + 150.0 * k / n;
                uu[k] = radius * Math.cos(angle);
                vv[k] = radius * Math.sin(angle);
                w[k] = 4.0;
            }
            channels.add(new VisibilityChannel(lams[c], uu, vv, new double[n], new double[n], w));
        }
        return new VisibilityDataset(channels);
    }

    /// Writes the static simulator inputs into a home directory.
    public static Path home(Path dir) throws IOException {
        Files.createDirectories(dir);
        RadmcInputs.writeControl(dir);
        RadmcInputs.writeLines(dir, SPECIES);
        RadmcInputs.writeWavelengths(dir, emptyData().wavelengths());
        Files.writeString(dir.resolve(RadmcInputs.moleculeFile(SPECIES)), "! molecule data\n");
        return dir;
    }

    public static EvaluationContext context(Path home, Path scratch, Simulator simulator, VisibilityDataset data) {
        return new EvaluationContext(home, scratch, SPECIES, SIZE_ARCSEC, GRID, converter(),
            new GeometricPrior(), new RadmcStructureWriter(), simulator,
            LikelihoodEvaluator.plan(data, NPIX, SIZE_ARCSEC));
    }
}
