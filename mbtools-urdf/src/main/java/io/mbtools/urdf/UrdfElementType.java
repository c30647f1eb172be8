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

/// URDF element types that can be synthesized from [UrdfDefaultSchema].
public enum UrdfElementType {
    ORIGIN("origin"),
    MASS("mass"),
    INERTIA("inertia"),
    INERTIAL("inertial"),
    COLLISION("collision"),
    GEOMETRY("geometry"),
    BOX("box"),
    SPHERE("sphere"),
    CYLINDER("cylinder");

    private final String tag;

    UrdfElementType(String tag) {
        this.tag = tag;
    }

    /// @return the XML tag name
    public String tag() {
        return tag;
    }
}
