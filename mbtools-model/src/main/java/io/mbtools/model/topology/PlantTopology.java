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

import java.util.List;

/// Read-only view of a multibody plant's topology.
///
/// This is the seam to the physics simulator. Implementations must return
/// model instances and bodies in the simulator's own order, since state
/// vectors and parameter rows are aligned to it positionally.
///
/// @see StaticPlantTopology
public interface PlantTopology {

    /// Name of the world pseudo-instance, always first
    String WORLD_MODEL_INSTANCE_NAME = "WorldModelInstance";
    /// Name of the world body
    String WORLD_BODY_NAME = "world";

    /// @return every model instance in state-vector order, world first
    List<ModelInstance> modelInstances();

    /// @return the world pseudo-instance
    ModelInstance worldModelInstance();

    /// @param instance a model instance of this plant
    /// @return the instance's bodies in intrinsic plant order
    List<Body> bodies(ModelInstance instance);

    /// @param instance a model instance of this plant
    /// @return the bodies of the instance attached to the world by a free joint
    List<Body> freeBaseBodies(ModelInstance instance);

    /// @param body a free base body
    /// @return how the body's orientation is parameterized
    RotationRepresentation rotationRepresentation(Body body);

    /// @param instance a model instance of this plant
    /// @return the number of generalized velocities owned by the instance
    int velocityCount(ModelInstance instance);

    /// @return the plant's total number of generalized positions
    int totalPositionCount();

    /// @return the plant's total number of generalized velocities
    int totalVelocityCount();

    /// Finds a model instance by exact name.
    ///
    /// @param name the model instance name
    /// @return the model instance
    /// @throws ModelLookupException if no instance has that name
    ModelInstance modelInstanceByName(String name);
}
