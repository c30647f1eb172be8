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

/// Sphere centered on the body frame.
///
/// @param radius the sphere radius
@GeometryType("sphere")
public record Sphere(double radius) implements CollisionGeometry {

    public Sphere {
        if (radius < 0 || Double.isNaN(radius)) {
            throw new IllegalArgumentException("Sphere radius must be non-negative: " + radius);
        }
    }

    @Override
    public <R> R accept(GeometryVisitor<R> visitor) {
        return visitor.visitSphere(this);
    }
}
