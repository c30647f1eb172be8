package io.mbtools.model.inertia;

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

/// The six independent entries of a symmetric rotational inertia tensor.
///
/// Entries follow the URDF attribute order: ixx, iyy, izz, ixy, ixz, iyz.
///
/// @param ixx moment about x
/// @param iyy moment about y
/// @param izz moment about z
/// @param ixy product of inertia xy
/// @param ixz product of inertia xz
/// @param iyz product of inertia yz
public record InertiaTensor(double ixx, double iyy, double izz, double ixy, double ixz, double iyz) {

    /// Number of independent entries
    public static final int ENTRY_COUNT = 6;

    /// Creates a tensor from six entries in URDF attribute order.
    ///
    /// @param entries ixx, iyy, izz, ixy, ixz, iyz
    /// @return a new tensor
    public static InertiaTensor of(double... entries) {
        if (entries == null || entries.length != ENTRY_COUNT) {
            throw new IllegalArgumentException(
                "Expected " + ENTRY_COUNT + " inertia entries, got " + (entries == null ? "null" : entries.length));
        }
        return new InertiaTensor(entries[0], entries[1], entries[2], entries[3], entries[4], entries[5]);
    }

    /// @return the entries in URDF attribute order
    public double[] toArray() {
        return new double[]{ixx, iyy, izz, ixy, ixz, iyz};
    }
}
