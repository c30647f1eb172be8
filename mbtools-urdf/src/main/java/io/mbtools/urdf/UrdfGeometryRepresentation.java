package io.mbtools.urdf;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// URDF encoding of a collision geometry: the shape element type and its attributes.
///
/// @param type the shape element, e.g. [UrdfElementType#BOX]
/// @param attributes the shape attributes, in insertion order
public record UrdfGeometryRepresentation(UrdfElementType type, Map<String, String> attributes) {
    public UrdfGeometryRepresentation {
        Objects.requireNonNull(type, "type cannot be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
