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

import java.io.IOException;
import java.nio.file.Path;

/// Writes the simulator-readable disk structure for one set of parameters.
@FunctionalInterface
public interface DiskStructureWriter {

    /// @param directory the workspace to write into
    /// @param parameters the model parameters
    /// @param grid the simulation grid
    /// @param species the emitting species, e.g. `12CO`
    /// @throws IOException if a file cannot be written
    void write(Path directory, DiskParameters parameters, Grid grid, String species) throws IOException;
}
