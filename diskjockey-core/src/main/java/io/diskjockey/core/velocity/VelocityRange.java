package io.diskjockey.core.velocity;

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

/// A closed velocity interval `[lower, upper]` in km/s.
///
/// @param lower the lower bound, inclusive
/// @param upper the upper bound, inclusive
public record VelocityRange(double lower, double upper) {

    public VelocityRange {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("velocity range bounds must not be NaN");
        }
        if (lower > upper) {
            throw new IllegalArgumentException(
                "velocity range lower bound " + lower + " exceeds upper bound " + upper);
        }
    }

    /// Returns true if the velocity lies within this range, endpoints included.
    public boolean contains(double velocity) {
        return velocity >= lower && velocity <= upper;
    }
}
