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

import io.diskjockey.core.pipeline.EvaluationResult;

import java.util.List;

/// Fans a batch of positions out to workers and blocks until every result
/// is in. Results are returned in the order of the positions.
///
/// A posterior that throws produces a `FATAL` result for that position
/// rather than an exception from the pool.
public interface EvaluationPool extends AutoCloseable {

    List<EvaluationResult> evaluateAll(LogPosterior posterior, List<double[]> positions)
        throws InterruptedException;

    /// Number of evaluations that may run at once.
    int parallelism();

    @Override
    void close();
}
