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

import io.mbtools.model.geometry.Box;
import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.geometry.GeometryVisitor;
import io.mbtools.model.geometry.HalfSpace;
import io.mbtools.model.geometry.Polygon;
import io.mbtools.model.geometry.Sphere;

import java.util.Map;

/// Maps collision geometries to their URDF shape elements.
///
/// | Geometry | Element | Attributes |
/// |----------|---------|------------|
/// | Box | `box` | `size` = full edge lengths, x y z |
/// | Sphere | `sphere` | `radius` |
/// | Polygon | n/a | [UnsupportedOperationException] |
/// | HalfSpace | n/a | [UnsupportedGeometryException] |
public final class UrdfGeometryRepresentationFactory implements GeometryVisitor<UrdfGeometryRepresentation> {

    private static final UrdfGeometryRepresentationFactory INSTANCE = new UrdfGeometryRepresentationFactory();

    private UrdfGeometryRepresentationFactory() {
    }

    /// @param geometry a collision geometry
    /// @return its URDF representation
    /// @throws UnsupportedGeometryException if the variant has no URDF encoding
    /// @throws UnsupportedOperationException for polygons
    public static UrdfGeometryRepresentation representation(CollisionGeometry geometry) {
        return geometry.accept(INSTANCE);
    }

    @Override
    public UrdfGeometryRepresentation visitBox(Box box) {
        double[] full = box.fullLengths().toArray();
        return new UrdfGeometryRepresentation(UrdfElementType.BOX, Map.of(UrdfAttributes.SIZE, UrdfNumbers.vector(full)));
    }

    @Override
    public UrdfGeometryRepresentation visitSphere(Sphere sphere) {
        return new UrdfGeometryRepresentation(UrdfElementType.SPHERE,
            Map.of(UrdfAttributes.RADIUS, UrdfNumbers.scalar(sphere.radius())));
    }

    @Override
    public UrdfGeometryRepresentation visitPolygon(Polygon polygon) {
        throw new UnsupportedOperationException("Polygon geometry export to URDF is not implemented");
    }

    @Override
    public UrdfGeometryRepresentation visitHalfSpace(HalfSpace halfSpace) {
        throw new UnsupportedGeometryException(halfSpace.getGeometryType());
    }
}
