package io.mbtools.model;

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

/// An immutable 3-vector in body coordinates, ordered x, y, z.
///
/// @param x the x component
/// @param y the y component
/// @param z the z component
public record Vec3(double x, double y, double z) {

    /// The zero vector
    public static final Vec3 ZERO = new Vec3(0.0, 0.0, 0.0);

    /// Creates a vector from the first three entries of an array.
    ///
    /// @param values at least three values, x first
    /// @return a new vector
    /// @throws IllegalArgumentException if fewer than three values are given
    public static Vec3 of(double... values) {
        if (values == null || values.length != 3) {
            throw new IllegalArgumentException(
                "Expected exactly 3 components, got " + (values == null ? "null" : values.length));
        }
        return new Vec3(values[0], values[1], values[2]);
    }

    /// @param factor scale factor
    /// @return this vector scaled by `factor`
    public Vec3 scale(double factor) {
        return new Vec3(x * factor, y * factor, z * factor);
    }

    /// @param other the other vector
    /// @return the dot product of this vector and `other`
    public double dot(Vec3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    /// @return the components as a new array, x first
    public double[] toArray() {
        return new double[]{x, y, z};
    }
}
