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

import com.google.gson.annotations.SerializedName;
import io.mbtools.model.Vec3;

import java.util.Objects;

/// Axis-aligned box centered on the body frame.
///
/// @param halfLengths half of the edge length along each axis
@GeometryType("box")
public record Box(@SerializedName("half_lengths") Vec3 halfLengths) implements CollisionGeometry {

    public Box {
        Objects.requireNonNull(halfLengths, "halfLengths cannot be null");
        if (halfLengths.x() < 0 || halfLengths.y() < 0 || halfLengths.z() < 0) {
            throw new IllegalArgumentException("Box half lengths must be non-negative: " + halfLengths);
        }
    }

    /// Creates a box from half lengths.
    ///
    /// @param hx half length along x
    /// @param hy half length along y
    /// @param hz half length along z
    /// @return a new box
    public static Box ofHalfLengths(double hx, double hy, double hz) {
        return new Box(new Vec3(hx, hy, hz));
    }

    /// @return the full edge lengths, twice the half lengths
    public Vec3 fullLengths() {
        return halfLengths.scale(2.0);
    }

    @Override
    public <R> R accept(GeometryVisitor<R> visitor) {
        return visitor.visitBox(this);
    }
}
