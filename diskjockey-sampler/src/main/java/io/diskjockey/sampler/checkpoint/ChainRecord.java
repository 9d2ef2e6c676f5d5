package io.diskjockey.sampler.checkpoint;

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

/// One walker sample in the chain history.
///
/// `iteration` counts from 1 across the whole chain, so it keeps increasing
/// across a resume.
public record ChainRecord(
    @SerializedName("loop") int loop,
    @SerializedName("iteration") long iteration,
    @SerializedName("walker") int walker,
    @SerializedName("position") double[] position,
    @SerializedName("lnprob") double lnProbability) {
}
