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

import java.util.Map;

/// Shared domain checks for the parameter variants.
final class ParameterChecks {

    private ParameterChecks() {
    }

    static double get(Map<String, Double> values, String name) throws ModelException {
        Double value = values.get(name);
        if (value == null) {
            throw new ModelException("missing parameter " + name);
        }
        if (!Double.isFinite(value)) {
            throw new ModelException(name + " must be finite, got " + value);
        }
        return value;
    }

    static void positive(String name, double value) throws ModelException {
        if (!(value > 0.0)) {
            throw new ModelException(name + " must be positive, got " + value);
        }
    }

    static void below(String name, double value, double limit) throws ModelException {
        if (!(value < limit)) {
            throw new ModelException(name + " must be less than " + limit + ", got " + value);
        }
    }

    static void above(String name, double value, double limit) throws ModelException {
        if (!(value > limit)) {
            throw new ModelException(name + " must be greater than " + limit + ", got " + value);
        }
    }

    static void within(String name, double value, double lo, double hi) throws ModelException {
        if (!(value >= lo && value <= hi)) {
            throw new ModelException(name + " must lie in [" + lo + ", " + hi + "], got " + value);
        }
    }

    /// Checks shared by every kind: star, gas and viewing geometry.
    static void common(DiskParameters p) throws ModelException {
        positive("M_star", p.mStar());
        positive("r_c", p.rc());
        positive("T_10", p.t10());
        positive("ksi", p.ksi());
        positive("dpc", p.dpc());
        within("incl", p.incl(), 0.0, 180.0);
    }
}
