package io.diskjockey.sampler;

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

/// One walker: its position and the log-probability last evaluated there.
public record WalkerState(double[] position, double lnProbability) {

    public WalkerState {
        position = position.clone();
    }

    @Override
    public double[] position() {
        return position.clone();
    }

    public int dimensions() {
        return position.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WalkerState other)) {
            return false;
        }
        return Arrays.equals(position, other.position)
            && Double.compare(lnProbability, other.lnProbability) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(position) + Double.hashCode(lnProbability);
    }

    @Override
    public String toString() {
        return "WalkerState{position=" + Arrays.toString(position) + ", lnProbability=" + lnProbability + "}";
    }
}
