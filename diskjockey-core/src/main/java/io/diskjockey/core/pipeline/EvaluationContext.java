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

import io.diskjockey.core.likelihood.LikelihoodEvaluator;
import io.diskjockey.core.model.DiskPrior;
import io.diskjockey.core.model.DiskStructureWriter;
import io.diskjockey.core.model.Grid;
import io.diskjockey.core.model.ParameterConverter;
import io.diskjockey.core.workspace.Simulator;

import java.nio.file.Path;
import java.util.Objects;

/// Everything an evaluation needs, fixed for the whole run and shared read-only
/// by every worker.
///
/// @param home directory holding the static simulator inputs
/// @param scratch parent for evaluation workspaces, `null` for the system temp directory
/// @param species emitting species, e.g. `12CO`
/// @param sizeArcsec full field of view in arcsec
/// @param grid the simulation grid
/// @param converter vector to parameters conversion
/// @param prior the log-prior
/// @param structureWriter writes the disk structure files
/// @param simulator produces the synthetic image
/// @param likelihood scores images against the active channels
public record EvaluationContext(
    Path home,
    Path scratch,
    String species,
    double sizeArcsec,
    Grid grid,
    ParameterConverter converter,
    DiskPrior prior,
    DiskStructureWriter structureWriter,
    Simulator simulator,
    LikelihoodEvaluator likelihood) {

    public EvaluationContext {
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(species, "species");
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(converter, "converter");
        Objects.requireNonNull(prior, "prior");
        Objects.requireNonNull(structureWriter, "structureWriter");
        Objects.requireNonNull(simulator, "simulator");
        Objects.requireNonNull(likelihood, "likelihood");
    }

    public int npix() {
        return likelihood.npix();
    }
}
