package io.mbtools.model.topology;

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

import java.util.Objects;

/// A rigid body as enumerated by the plant.
///
/// @param index the plant-wide body index
/// @param name the body name, unique within its model instance
/// @param modelInstance the owning model instance
public record Body(int index, String name, ModelInstance modelInstance) {

    public Body {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(modelInstance, "modelInstance cannot be null");
    }
}
