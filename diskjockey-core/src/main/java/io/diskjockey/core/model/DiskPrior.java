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

/// Log-prior density over model parameters.
///
/// Implementations may reject parameters outright with a [ModelException];
/// the pipeline treats that the same as a `-∞` density.
@FunctionalInterface
public interface DiskPrior {

    /// @param parameters the converted parameters
    /// @param grid the simulation grid
    /// @return the natural-log prior density
    /// @throws ModelException if the parameters lie outside the prior's support
    double lnPrior(DiskParameters parameters, Grid grid) throws ModelException;
}
