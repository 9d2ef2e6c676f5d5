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

import java.util.List;

/// Arguments for one simulator imaging call.
///
/// @param incl inclination in degrees
/// @param posang position angle in degrees
/// @param npix pixels per image side
/// @param sizeAu commanded physical image size in AU
public record ImagingArguments(double incl, double posang, int npix, double sizeAu) {

    /// The full command line, imaging at the wavelengths of the camera wavelength file.
    ///
    /// @param executable the simulator executable
    /// @return the command and its arguments
    public List<String> command(String executable) {
        return List.of(executable, "image",
            "incl", Double.toString(incl),
            "posang", Double.toString(posang),
            "npix", Integer.toString(npix),
            "loadlambda",
            "sizeau", Double.toString(sizeAu));
    }
}
