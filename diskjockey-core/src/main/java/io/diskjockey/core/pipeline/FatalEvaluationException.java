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

import java.util.Arrays;

/// An evaluation failed for a reason other than a bad parameter vector.
///
/// Carries the offending vector so the run can report it before stopping.
public class FatalEvaluationException extends RuntimeException {

    private final double[] vector;

    public FatalEvaluationException(double[] vector, Throwable cause) {
        super("Fatal error evaluating " + Arrays.toString(vector) + ": " + cause, cause);
        this.vector = vector.clone();
    }

    public double[] vector() {
        return vector.clone();
    }
}
