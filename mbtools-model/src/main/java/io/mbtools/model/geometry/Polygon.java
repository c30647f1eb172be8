package io.mbtools.model.geometry;

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

import io.mbtools.model.Vec3;

import java.util.List;

/// Convex polygon given by its vertices in body coordinates.
///
/// Polygons take part in contact computation only. There is no URDF
/// encoding for them yet.
///
/// @param vertices the vertices, in no particular winding
@GeometryType("polygon")
public record Polygon(List<Vec3> vertices) implements CollisionGeometry {

    public Polygon {
        vertices = vertices == null ? List.of() : List.copyOf(vertices);
    }

    @Override
    public <R> R accept(GeometryVisitor<R> visitor) {
        return visitor.visitPolygon(this);
    }
}
