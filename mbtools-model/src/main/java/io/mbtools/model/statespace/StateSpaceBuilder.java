package io.mbtools.model.statespace;

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

import io.mbtools.model.ConfigurationException;
import io.mbtools.model.topology.Body;
import io.mbtools.model.topology.BodyIdentity;
import io.mbtools.model.topology.ModelInstance;
import io.mbtools.model.topology.PlantTopology;
import io.mbtools.model.topology.RotationRepresentation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Infers a [ProductSpace] from plant topology.
///
/// ## One Chain Per Model Instance
///
/// Every model instance is assumed to hold exactly one rigid chain, either
/// floating or welded to the world:
///
/// ```text
///  for each instance, in state-vector order:
///    free base candidates = topology.freeBaseBodies(instance)
///      none       → FixedBaseSpace(nv)
///      exactly 1  → rotation must be QUATERNION
///                   FloatingBaseSpace(nv - 6)
///      more       → ConfigurationException
/// ```
///
/// The caller must pass instances in exactly the order the simulator lays
/// out its state vector. [#build(PlantTopology)] takes that order from the
/// topology itself and additionally checks the result against the plant's
/// reported totals.
public final class StateSpaceBuilder {

    private static final Logger logger = LogManager.getLogger(StateSpaceBuilder.class);

    private StateSpaceBuilder() {
    }

    /// Builds the state space of the whole plant.
    ///
    /// @param topology the plant
    /// @return the product space, world factor first
    /// @throws ConfigurationException if an instance is not a supported chain, or
    ///         the product space disagrees with the plant's position or velocity totals
    public static ProductSpace build(PlantTopology topology) {
        Objects.requireNonNull(topology, "topology cannot be null");
        ProductSpace space = build(topology, topology.modelInstances());

        if (space.positionDimension() != topology.totalPositionCount()
            || space.velocityDimension() != topology.totalVelocityCount()) {
            throw new ConfigurationException(
                "Inferred state space has " + space.positionDimension() + " positions and "
                    + space.velocityDimension() + " velocities, but the plant reports "
                    + topology.totalPositionCount() + " and " + topology.totalVelocityCount());
        }
        logger.info("Plant state space: {} factors, nq={}, nv={}",
            space.factorCount(), space.positionDimension(), space.velocityDimension());
        return space;
    }

    /// Builds the state space of the given instances, in the given order.
    ///
    /// @param topology the plant
    /// @param instances model instances in state-vector order
    /// @return the product space
    /// @throws ConfigurationException if an instance is not a supported chain
    public static ProductSpace build(PlantTopology topology, List<ModelInstance> instances) {
        Objects.requireNonNull(topology, "topology cannot be null");
        Objects.requireNonNull(instances, "instances cannot be null");
        List<StateSpace> spaces = new ArrayList<>(instances.size());
        for (ModelInstance instance : instances) {
            spaces.add(spaceFor(topology, instance));
        }
        return new ProductSpace(spaces);
    }

    /// Infers the state space of one model instance.
    ///
    /// @param topology the plant
    /// @param instance the model instance
    /// @return a floating or fixed base space
    /// @throws ConfigurationException if the instance has several free base bodies, a
    ///         non-quaternion free joint, or fewer velocities than a free body needs
    public static StateSpace spaceFor(PlantTopology topology, ModelInstance instance) {
        List<Body> candidates = topology.freeBaseBodies(instance);
        int velocities = topology.velocityCount(instance);

        if (candidates.isEmpty()) {
            logger.debug("Model instance '{}' is fixed base with {} joints", instance.name(), velocities);
            return new FixedBaseSpace(velocities);
        }

        Body freeBody = uniqueFreeBaseBody(instance, candidates);
        RotationRepresentation rotation = topology.rotationRepresentation(freeBody);
        if (rotation != RotationRepresentation.QUATERNION) {
            throw new ConfigurationException(
                "Free base body '" + BodyIdentity.of(freeBody) + "' uses " + rotation
                    + " rotation; floating bases must be quaternion parameterized");
        }

        int nJoints = velocities - FloatingBaseSpace.BASE_VELOCITY_DIMENSION;
        if (nJoints < 0) {
            throw new ConfigurationException(
                "Model instance '" + instance.name() + "' has a free base body but only "
                    + velocities + " velocities");
        }
        logger.debug("Model instance '{}' floats on '{}' with {} joints", instance.name(), freeBody.name(), nJoints);
        return new FloatingBaseSpace(nJoints);
    }

    private static Body uniqueFreeBaseBody(ModelInstance instance, List<Body> candidates) {
        if (candidates.size() != 1) {
            throw new ConfigurationException(
                "Model instance '" + instance.name() + "' must have exactly one free base body, found "
                    + candidates.size() + ": " + candidates.stream().map(Body::name).toList());
        }
        return candidates.get(0);
    }
}
