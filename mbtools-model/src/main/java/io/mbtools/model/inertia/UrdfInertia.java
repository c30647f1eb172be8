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

import io.mbtools.model.Vec3;

import java.util.Objects;

/// Inertial properties of one body in URDF form.
///
/// @param mass the body mass
/// @param centerOfMass position of the center of mass in the body frame
/// @param inertia rotational inertia about the center of mass, in body axes
public record UrdfInertia(double mass, Vec3 centerOfMass, InertiaTensor inertia) {

    public UrdfInertia {
        Objects.requireNonNull(centerOfMass, "centerOfMass cannot be null");
        Objects.requireNonNull(inertia, "inertia cannot be null");
    }
}
