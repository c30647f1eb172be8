package io.mbtools.model.topology;

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

import java.util.List;
import java.util.Objects;

/// Declarative description of one model instance, as read from JSON.
///
/// ```json
/// {
///   "name": "elbow",
///   "bodies": ["base", "forearm"],
///   "free_base_bodies": ["base"],
///   "rotation": "quaternion",
///   "velocities": 7
/// }
/// ```
///
/// @param name the model instance name
/// @param bodies body names in intrinsic order
/// @param freeBaseBodies names of bodies attached to the world by a free joint
/// @param rotation orientation parameterization of the free bodies
/// @param velocities number of generalized velocities of the instance
/// @param positions number of generalized positions, or null to derive it
///                  from the velocities and the free bodies' rotation
public record ModelDescription(
    String name,
    List<String> bodies,
    @SerializedName("free_base_bodies") List<String> freeBaseBodies,
    RotationRepresentation rotation,
    int velocities,
    Integer positions
) {

    public ModelDescription {
        Objects.requireNonNull(name, "model name cannot be null");
        bodies = bodies == null ? List.of() : List.copyOf(bodies);
        freeBaseBodies = freeBaseBodies == null ? List.of() : List.copyOf(freeBaseBodies);
        if (rotation == null) {
            rotation = RotationRepresentation.QUATERNION;
        }
        if (velocities < 0) {
            throw new IllegalArgumentException("Model '" + name + "' has negative velocity count " + velocities);
        }
        for (String free : freeBaseBodies) {
            if (!bodies.contains(free)) {
                throw new IllegalArgumentException(
                    "Model '" + name + "' lists free base body '" + free + "' which is not one of its bodies");
            }
        }
    }

    /// A chain floating on a quaternion free joint.
    ///
    /// @param name model name
    /// @param nJoints joint degrees of freedom below the base
    /// @param bodies body names, base first
    /// @return the description
    public static ModelDescription floating(String name, int nJoints, String... bodies) {
        return new ModelDescription(name, List.of(bodies), List.of(bodies[0]),
            RotationRepresentation.QUATERNION, nJoints + 6, null);
    }

    /// A chain welded to the world.
    ///
    /// @param name model name
    /// @param nJoints joint degrees of freedom
    /// @param bodies body names
    /// @return the description
    public static ModelDescription fixed(String name, int nJoints, String... bodies) {
        return new ModelDescription(name, List.of(bodies), List.of(),
            RotationRepresentation.QUATERNION, nJoints, null);
    }

    /// @return the position count, derived when not given explicitly
    public int positionCount() {
        if (positions != null) {
            return positions;
        }
        int quaternionBodies = rotation == RotationRepresentation.QUATERNION ? freeBaseBodies.size() : 0;
        return velocities + quaternionBodies;
    }
}
