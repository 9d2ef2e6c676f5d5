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

import static io.diskjockey.core.model.ParameterChecks.get;

/// Standard disk with an inner cavity: the similarity profile is depleted by
/// `exp[-(r_cav/r)^γ_cav]`. The normalization ignores the depletion, so
/// `logM_gas` is the mass the disk would hold without a cavity.
public record CavityParameters(
    double mStar, double rc, double rCav, double t10, double q, double gamma, double gammaCav,
    double logMGas, double ksi, double dpc, double incl, double pa, double vel, double muRa,
    double muDec) implements DiskParameters {

    static CavityParameters fromValues(Map<String, Double> v) throws ModelException {
        CavityParameters p = new CavityParameters(
            get(v, "M_star"), get(v, "r_c"), get(v, "r_cav"), get(v, "T_10"), get(v, "q"),
            get(v, "gamma"), get(v, "gamma_cav"), get(v, "logM_gas"), get(v, "ksi"), get(v, "dpc"),
            get(v, "incl"), get(v, "PA"), get(v, "vel"), get(v, "mu_RA"), get(v, "mu_DEC"));
        ParameterChecks.common(p);
        ParameterChecks.below("gamma", p.gamma, 2.0);
        ParameterChecks.positive("r_cav", p.rCav);
        ParameterChecks.below("r_cav", p.rCav, p.rc);
        ParameterChecks.positive("gamma_cav", p.gammaCav);
        return p;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.CAVITY;
    }

    @Override
    public Map<String, Double> values() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("M_star", mStar);
        m.put("r_c", rc);
        m.put("r_cav", rCav);
        m.put("T_10", t10);
        m.put("q", q);
        m.put("gamma", gamma);
        m.put("gamma_cav", gammaCav);
        m.put("logM_gas", logMGas);
        m.put("ksi", ksi);
        m.put("dpc", dpc);
        m.put("incl", incl);
        m.put("PA", pa);
        m.put("vel", vel);
        m.put("mu_RA", muRa);
        m.put("mu_DEC", muDec);
        return m;
    }

    @Override
    public double surfaceDensity(double radius) {
        double rcCm = rc * PhysicalConstants.AU;
        double sigmaC = gasMass() * (2.0 - gamma) / (2.0 * Math.PI * rcCm * rcCm);
        double x = radius / rcCm;
        double depletion = Math.exp(-Math.pow(rCav * PhysicalConstants.AU / radius, gammaCav));
        return sigmaC * Math.pow(x, -gamma) * Math.exp(-Math.pow(x, 2.0 - gamma)) * depletion;
    }
}
