package io.diskjockey.sampler.optimize;

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

import com.google.gson.annotations.SerializedName;

import java.util.List;

/// Best point found by a [GlobalOptimizer] run.
///
/// `lnprob` is `-Infinity` when no evaluated point had positive density.
public record OptimizationResult(
    @SerializedName("names") List<String> names,
    @SerializedName("position") double[] position,
    @SerializedName("lnprob") double lnProbability,
    @SerializedName("evaluations") int evaluations,
    @SerializedName("converged") boolean converged) {
}
