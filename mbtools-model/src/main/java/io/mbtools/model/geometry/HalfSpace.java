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

/// Infinite half space below the plane `z = 0` of its frame.
///
/// The simulator registers one on the world body as the ground plane.
@GeometryType("half_space")
public record HalfSpace() implements CollisionGeometry {

    @Override
    public <R> R accept(GeometryVisitor<R> visitor) {
        return visitor.visitHalfSpace(this);
    }
}
