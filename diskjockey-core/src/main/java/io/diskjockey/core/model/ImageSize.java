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

import io.diskjockey.core.constants.PhysicalConstants;

/// Physical image extent for a given field of view and distance.
///
/// The simulator renders an image slightly larger than the `sizeau` it is
/// given, so the commanded size is shrunk by
/// [PhysicalConstants#RADMC_SIZEAU_SHIFT] to land on the desired size.
///
/// @param desired the physical width of the field of view in AU
/// @param command the value to pass as `sizeau`
public record ImageSize(double desired, double command) {

    /// Computes the image size and checks the grid fits inside it.
    ///
    /// @param sizeArcsec full field of view in arcsec
    /// @param dpc distance in parsecs
    /// @param grid the simulation grid
    /// @return the desired and commanded sizes
    /// @throws ModelException if the disk's outer diameter exceeds the field of view
    public static ImageSize of(double sizeArcsec, double dpc, Grid grid) throws ModelException {
        double desired = sizeArcsec * dpc;
        if (2.0 * grid.rOut() > desired) {
            throw new ModelException("Grid outer diameter " + 2.0 * grid.rOut()
                + " AU exceeds the field of view " + desired + " AU at " + dpc + " pc");
        }
        return new ImageSize(desired, desired * (1.0 - PhysicalConstants.RADMC_SIZEAU_SHIFT));
    }
}
