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

import java.io.IOException;
import java.util.List;

/// Receives sampler progress from a [RunSchedule].
public interface SamplerObserver {

    /// Does nothing.
    SamplerObserver NOOP = new SamplerObserver() {
        @Override
        public void onIteration(int loop, long iteration, List<WalkerState> walkers) {
        }

        @Override
        public void onLoopComplete(int loop, EnsembleSampler sampler) {
        }
    };

    /// Called after each iteration with the updated population.
    void onIteration(int loop, long iteration, List<WalkerState> walkers) throws IOException;

    /// Called once every iteration of a loop has been reported.
    void onLoopComplete(int loop, EnsembleSampler sampler) throws IOException;
}
