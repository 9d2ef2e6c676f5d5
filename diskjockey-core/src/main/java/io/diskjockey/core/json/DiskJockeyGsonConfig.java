package io.diskjockey.core.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.diskjockey.core.model.DiskParameters;

/// Shared Gson configuration for checkpoints, chain records and result files.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | [#gson()] only |
/// | HTML escaping | Disabled |
/// | Special floats | Serialized (`-Infinity` log-probabilities) |
/// | [DiskParameters] | `{"model": tag, name: value, ...}` |
///
/// Gson instances are thread-safe and may be shared.
public final class DiskJockeyGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private DiskJockeyGsonConfig() {
    }

    /// The pretty-printing instance, for files people read.
    public static Gson gson() {
        return INSTANCE;
    }

    /// A single-line instance for NDJSON records.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// A builder with the project's adapters registered.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeHierarchyAdapter(DiskParameters.class, new DiskParametersTypeAdapter().nullSafe());
    }
}
