package io.mbtools.config;

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
import io.mbtools.model.geometry.CollisionGeometryTypeAdapterFactory;

/// Shared Gson configuration for plant and export bundle files.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | CollisionGeometry adapter | Registered, keyed by `type` |
///
/// ```java
/// Gson gson = MbtoolsGsonConfig.gson();
/// CollisionGeometry box = gson.fromJson(
///     "{\"type\":\"box\",\"half_lengths\":{\"x\":0.05,\"y\":0.05,\"z\":0.05}}",
///     CollisionGeometry.class);
/// ```
///
/// @see CollisionGeometryTypeAdapterFactory
public final class MbtoolsGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private MbtoolsGsonConfig() {
    }

    /// @return the shared, thread-safe Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new builder carrying the mbtools type adapters
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(CollisionGeometryTypeAdapterFactory.create());
    }
}
