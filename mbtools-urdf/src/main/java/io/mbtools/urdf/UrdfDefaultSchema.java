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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.mbtools.urdf.UrdfAttributes.*;

/// Static schema of default URDF subtrees.
///
/// ```text
///  type       │ default attributes                   │ required children
/// ────────────┼──────────────────────────────────────┼─────────────────────────
///  origin     │ xyz="0. 0. 0." rpy="0. 0. 0."        │
///  mass       │ value="0."                           │
///  inertia    │ ixx iyy izz ixy ixz iyz = "0."       │
///  inertial   │                                      │ origin, mass, inertia
///  collision  │                                      │ geometry, origin
///  geometry   │                                      │
///  box        │ size="0. 0. 0."                      │
///  sphere     │ radius="0."                          │
///  cylinder   │ radius="0." length="0."              │
/// ```
///
/// The table is filled by an exhaustive switch over [UrdfElementType], so a
/// new element type does not compile until it has an entry here.
public final class UrdfDefaultSchema {

    /// Defaults for one element type.
    ///
    /// @param attributes default attributes, in insertion order
    /// @param children required child types, in insertion order
    public record ElementDefaults(Map<String, String> attributes, List<UrdfElementType> children) {
        public ElementDefaults {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }
    }

    private static final Map<UrdfElementType, ElementDefaults> SCHEMA = new EnumMap<>(UrdfElementType.class);

    static {
        for (UrdfElementType type : UrdfElementType.values()) {
            SCHEMA.put(type, defaultsFor(type));
        }
    }

    private UrdfDefaultSchema() {
    }

    /// @param type an element type
    /// @return the defaults for that type
    public static ElementDefaults get(UrdfElementType type) {
        return SCHEMA.get(type);
    }

    private static ElementDefaults defaultsFor(UrdfElementType type) {
        return switch (type) {
            case ORIGIN -> new ElementDefaults(attributes(XYZ, ZERO_FLOAT_3, RPY, ZERO_FLOAT_3), List.of());
            case MASS -> new ElementDefaults(attributes(VALUE, ZERO_FLOAT), List.of());
            case INERTIA -> new ElementDefaults(attributes(
                IXX, ZERO_FLOAT, IYY, ZERO_FLOAT, IZZ, ZERO_FLOAT,
                IXY, ZERO_FLOAT, IXZ, ZERO_FLOAT, IYZ, ZERO_FLOAT), List.of());
            case INERTIAL -> new ElementDefaults(Map.of(),
                List.of(UrdfElementType.ORIGIN, UrdfElementType.MASS, UrdfElementType.INERTIA));
            case COLLISION -> new ElementDefaults(Map.of(),
                List.of(UrdfElementType.GEOMETRY, UrdfElementType.ORIGIN));
            case GEOMETRY -> new ElementDefaults(Map.of(), List.of());
            case BOX -> new ElementDefaults(attributes(SIZE, ZERO_FLOAT_3), List.of());
            case SPHERE -> new ElementDefaults(attributes(RADIUS, ZERO_FLOAT), List.of());
            case CYLINDER -> new ElementDefaults(attributes(RADIUS, ZERO_FLOAT, LENGTH, ZERO_FLOAT), List.of());
        };
    }

    private static Map<String, String> attributes(String... namesAndValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return map;
    }
}
