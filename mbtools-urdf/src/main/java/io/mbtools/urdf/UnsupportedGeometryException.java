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

/// Thrown when a geometry variant has no URDF encoding.
public class UnsupportedGeometryException extends RuntimeException {

    private final String geometryType;

    /// @param geometryType the variant name, e.g. "half_space"
    public UnsupportedGeometryException(String geometryType) {
        super("Geometry type '" + geometryType + "' cannot be represented in URDF");
        this.geometryType = geometryType;
    }

    /// @return the variant name that could not be represented
    public String getGeometryType() {
        return geometryType;
    }
}
