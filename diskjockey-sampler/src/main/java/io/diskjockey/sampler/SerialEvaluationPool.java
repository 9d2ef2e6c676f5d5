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

import java.util.ArrayList;
import java.util.List;

/// Evaluates on the calling thread, one position after another.
public final class SerialEvaluationPool implements EvaluationPool {

    @Override
    public List<EvaluationResult> evaluateAll(LogPosterior posterior, List<double[]> positions)
        throws InterruptedException {
        List<EvaluationResult> results = new ArrayList<>(positions.size());
        for (double[] position : positions) {
            if (Thread.interrupted()) {
                throw new InterruptedException("evaluation batch interrupted");
            }
            results.add(evaluateOne(posterior, position));
        }
        return results;
    }

    static EvaluationResult evaluateOne(LogPosterior posterior, double[] position) {
        try {
            EvaluationResult result = posterior.evaluate(position);
            return result != null ? result : EvaluationResult.fatal(
                new IllegalStateException("posterior returned no result"));
        } catch (RuntimeException e) {
            return EvaluationResult.fatal(e);
        }
    }

    @Override
    public int parallelism() {
        return 1;
    }

    @Override
    public void close() {
    }
}
