package io.diskjockey.core.workspace;

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

/// Produces a synthetic image inside a workspace.
///
/// On return the workspace holds `image.out`. Any failure to run the simulator
/// is an infrastructure fault and surfaces as an [IOException]; a simulator
/// that exits cleanly but leaves an unreadable image is detected later, when
/// the image is read.
@FunctionalInterface
public interface Simulator {

    /// @param workspace the directory holding the simulator inputs
    /// @param arguments the imaging arguments
    /// @throws IOException if the simulator cannot be run or fails
    void image(Path workspace, ImagingArguments arguments) throws IOException;
}
