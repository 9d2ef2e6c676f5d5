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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Converts a free-parameter vector into a validated [DiskParameters] variant.
///
/// A converter is built once per run from the model kind, the ordered free
/// parameter names and the fixed values. Construction checks that free and
/// fixed names together cover exactly the kind's registered parameters, so a
/// misconfigured run fails before sampling starts. Instances are immutable and
/// safe to share between worker threads.
public final class ParameterConverter {

    private final ModelKind kind;
    private final List<String> freeNames;
    private final Map<String, Double> fixed;

    /// @param kind the model kind
    /// @param freeNames names of the sampled parameters, in vector order
    /// @param fixed values of the parameters held fixed
    /// @throws IllegalArgumentException if the names do not cover the kind's parameters exactly
    public ParameterConverter(ModelKind kind, List<String> freeNames, Map<String, Double> fixed) {
        this.kind = kind;
        this.freeNames = List.copyOf(freeNames);
        this.fixed = Map.copyOf(fixed);

        Set<String> registered = new LinkedHashSet<>(kind.parameterNames());
        Set<String> seen = new LinkedHashSet<>();
        for (String name : this.freeNames) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Parameter " + name + " listed twice");
            }
        }
        for (String name : this.fixed.keySet()) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Parameter " + name + " is both free and fixed");
            }
        }
        if (!seen.equals(registered)) {
            Set<String> missing = new LinkedHashSet<>(registered);
            missing.removeAll(seen);
            Set<String> unknown = new LinkedHashSet<>(seen);
            unknown.removeAll(registered);
            throw new IllegalArgumentException("Model " + kind.tag() + " parameters mismatch; missing "
                + missing + ", unknown " + unknown);
        }
    }

    /// Builds a converter whose free parameters are every registered parameter
    /// not named in `fixedNames`, in the kind's canonical order.
    ///
    /// @param kind the model kind
    /// @param fixedNames parameters held fixed
    /// @param values values for at least the fixed parameters
    /// @return the converter
    public static ParameterConverter of(ModelKind kind, List<String> fixedNames, Map<String, Double> values) {
        List<String> free = new ArrayList<>();
        Map<String, Double> fixed = new LinkedHashMap<>();
        for (String name : kind.parameterNames()) {
            if (fixedNames.contains(name)) {
                Double value = values.get(name);
                if (value == null) {
                    throw new IllegalArgumentException("Fixed parameter " + name + " has no value");
                }
                fixed.put(name, value);
            } else {
                free.add(name);
            }
        }
        for (String name : fixedNames) {
            if (!kind.parameterNames().contains(name)) {
                throw new IllegalArgumentException("Unknown parameter " + name + " for model " + kind.tag());
            }
        }
        return new ParameterConverter(kind, free, fixed);
    }

    public ModelKind kind() {
        return kind;
    }

    /// The free parameter names, in vector order.
    public List<String> freeNames() {
        return freeNames;
    }

    /// The dimensionality of the sampled vector.
    public int dimensions() {
        return freeNames.size();
    }

    /// Merges the vector with the fixed values and builds the model variant.
    ///
    /// @param vector the free parameter values, in [#freeNames()] order
    /// @return the validated parameters
    /// @throws ModelException if the vector has the wrong length or any value is out of domain
    public DiskParameters convert(double[] vector) throws ModelException {
        if (vector == null || vector.length != freeNames.size()) {
            throw new ModelException("Expected " + freeNames.size() + " free parameters, got "
                + (vector == null ? "null" : vector.length));
        }
        Map<String, Double> values = new LinkedHashMap<>(fixed);
        for (int i = 0; i < vector.length; i++) {
            values.put(freeNames.get(i), vector[i]);
        }
        return kind.build(values);
    }

    /// The free-parameter vector corresponding to a full value map.
    ///
    /// @param values values keyed by parameter name
    /// @return the vector in [#freeNames()] order
    /// @throws IllegalArgumentException if a free parameter has no value
    public double[] vectorOf(Map<String, Double> values) {
        double[] vector = new double[freeNames.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = values.get(freeNames.get(i));
            if (value == null) {
                throw new IllegalArgumentException("No value for free parameter " + freeNames.get(i));
            }
            vector[i] = value;
        }
        return vector;
    }

    @Override
    public String toString() {
        return "ParameterConverter{" + kind.tag() + ", free=" + freeNames + ", fixed=" + fixed + "}";
    }

    /// Formats a vector with its parameter names for log messages.
    public String describe(double[] vector) {
        if (vector == null || vector.length != freeNames.size()) {
            return Arrays.toString(vector);
        }
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(freeNames.get(i)).append('=').append(vector[i]);
        }
        return sb.append('}').toString();
    }
}
