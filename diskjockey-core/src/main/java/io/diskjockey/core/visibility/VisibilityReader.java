package io.diskjockey.core.visibility;

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
import java.util.Locale;

/// Loads a [VisibilityDataset] from a data file.
public interface VisibilityReader {

    /// Reads every channel in the file.
    VisibilityDataset read(Path path) throws IOException;

    /// Reads only the channels whose mask entry is true.
    default VisibilityDataset read(Path path, boolean[] mask) throws IOException {
        return read(path).select(mask);
    }

    /// Chooses a reader from the file extension: `.hdf5`/`.h5` are HDF5,
    /// anything else is the whitespace-delimited text format.
    static VisibilityReader forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".hdf5") || name.endsWith(".h5")) {
            return new Hdf5VisibilityReader();
        }
        return new TextVisibilityReader();
    }
}
