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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.diskjockey.core.model.DiskParameters;
import io.diskjockey.core.model.ModelException;
import io.diskjockey.core.model.ModelKind;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/// Writes [DiskParameters] as a flat object tagged by model kind:
///
/// ```json
/// {"model": "standard", "M_star": 1.2, "r_c": 45.0, ...}
/// ```
///
/// Reading validates the values through the kind's factory, so an
/// out-of-domain document fails with a [JsonParseException].
final class DiskParametersTypeAdapter extends TypeAdapter<DiskParameters> {

    static final String MODEL_FIELD = "model";

    @Override
    public void write(JsonWriter out, DiskParameters value) throws IOException {
        out.beginObject();
        out.name(MODEL_FIELD).value(value.kind().tag());
        for (Map.Entry<String, Double> e : value.values().entrySet()) {
            out.name(e.getKey()).value(e.getValue());
        }
        out.endObject();
    }

    @Override
    public DiskParameters read(JsonReader in) throws IOException {
        String tag = null;
        Map<String, Double> values = new LinkedHashMap<>();
        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            if (MODEL_FIELD.equals(name)) {
                tag = in.nextString();
            } else {
                values.put(name, in.nextDouble());
            }
        }
        in.endObject();
        if (tag == null) {
            throw new JsonParseException("Missing '" + MODEL_FIELD + "' field in model parameters");
        }
        try {
            return ModelKind.fromTag(tag).build(values);
        } catch (ModelException | IllegalArgumentException e) {
            throw new JsonParseException("Invalid " + tag + " parameters: " + e.getMessage(), e);
        }
    }
}
