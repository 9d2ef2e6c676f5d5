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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/// The supported disk model kinds, each with its registered parameter list and
/// the factory that builds and validates its [DiskParameters] variant.
public enum ModelKind {

    STANDARD("standard", List.of(
        "M_star", "r_c", "T_10", "q", "gamma", "logM_gas", "ksi",
        "dpc", "incl", "PA", "vel", "mu_RA", "mu_DEC"),
        StandardParameters::fromValues),

    TRUNCATED("truncated", List.of(
        "M_star", "r_c", "T_10", "q", "gamma", "gamma_e", "logM_gas", "ksi",
        "dpc", "incl", "PA", "vel", "mu_RA", "mu_DEC"),
        TruncatedParameters::fromValues),

    CAVITY("cavity", List.of(
        "M_star", "r_c", "r_cav", "T_10", "q", "gamma", "gamma_cav", "logM_gas", "ksi",
        "dpc", "incl", "PA", "vel", "mu_RA", "mu_DEC"),
        CavityParameters::fromValues);

    /// Builds a variant from a complete name → value map.
    @FunctionalInterface
    interface Factory {
        DiskParameters create(Map<String, Double> values) throws ModelException;
    }

    private final String tag;
    private final List<String> parameterNames;
    private final Factory factory;

    ModelKind(String tag, List<String> parameterNames, Factory factory) {
        this.tag = tag;
        this.parameterNames = parameterNames;
        this.factory = factory;
    }

    /// The configuration name of this kind.
    public String tag() {
        return tag;
    }

    /// Every parameter of this kind, in canonical order.
    public List<String> parameterNames() {
        return parameterNames;
    }

    /// Builds and validates the variant from a complete name → value map.
    ///
    /// @param values a value for every parameter of this kind
    /// @return the parameters
    /// @throws ModelException if a value is missing, not finite or out of domain
    public DiskParameters build(Map<String, Double> values) throws ModelException {
        return factory.create(values);
    }

    /// Resolves a configuration tag.
    ///
    /// @throws IllegalArgumentException if no kind has this tag
    public static ModelKind fromTag(String tag) {
        for (ModelKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown model '" + tag + "', expected one of "
            + Arrays.stream(values()).map(ModelKind::tag).toList());
    }
}
