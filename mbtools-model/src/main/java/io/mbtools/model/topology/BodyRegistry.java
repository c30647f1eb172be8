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

import io.mbtools.model.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Deterministic enumeration of plant bodies with their identities.
///
/// ## Ordering Contract
///
/// Bodies are listed model instance by model instance, in the order the
/// caller passes the instances, and within an instance in the plant's
/// intrinsic body order. Parameter rows are aligned to this order by
/// position, so it has to match the simulator's internal indexing exactly.
///
/// ```text
///  instances: [World, cube, elbow]
///  bodies:    WorldModelInstance_world | cube_body | elbow_base, elbow_forearm
///             └──── excluded from the inertial list ────┘ (world only)
/// ```
public final class BodyRegistry {

    private static final Logger logger = LogManager.getLogger(BodyRegistry.class);

    private BodyRegistry() {
    }

    /// Lists every body of the given instances with its identity.
    ///
    /// @param topology the plant
    /// @param instances model instances in state-vector order
    /// @return bodies in instance order, then intrinsic order
    /// @throws ConfigurationException if two bodies share an identifier
    public static List<IdentifiedBody> enumerateBodies(PlantTopology topology, List<ModelInstance> instances) {
        Objects.requireNonNull(topology, "topology cannot be null");
        Objects.requireNonNull(instances, "instances cannot be null");

        List<IdentifiedBody> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ModelInstance instance : instances) {
            for (Body body : topology.bodies(instance)) {
                IdentifiedBody identified = new IdentifiedBody(body, BodyIdentity.of(body));
                if (!seen.add(identified.key())) {
                    throw new ConfigurationException(
                        "Body identifier '" + identified.key() + "' is not unique across model instances");
                }
                result.add(identified);
            }
        }
        logger.debug("Enumerated {} bodies over {} model instances", result.size(), instances.size());
        return List.copyOf(result);
    }

    /// Lists every body of the plant.
    ///
    /// @param topology the plant
    /// @return all bodies, world body first
    public static List<IdentifiedBody> enumerateBodies(PlantTopology topology) {
        return enumerateBodies(topology, topology.modelInstances());
    }

    /// Lists the bodies that carry inertial parameters, i.e. all bodies
    /// outside the world pseudo-instance.
    ///
    /// @param topology the plant
    /// @param instances model instances in state-vector order
    /// @return inertial bodies in enumeration order
    public static List<IdentifiedBody> enumerateInertialBodies(PlantTopology topology, List<ModelInstance> instances) {
        ModelInstance world = topology.worldModelInstance();
        List<ModelInstance> inertial = instances.stream()
            .filter(instance -> !instance.equals(world))
            .toList();
        return enumerateBodies(topology, inertial);
    }

    /// @param topology the plant
    /// @return the plant's inertial bodies in enumeration order
    public static List<IdentifiedBody> enumerateInertialBodies(PlantTopology topology) {
        return enumerateInertialBodies(topology, topology.modelInstances());
    }

    /// @param topology the plant
    /// @return the row index for the plant's inertial parameter matrix
    public static BodyIndex inertialBodyIndex(PlantTopology topology) {
        return BodyIndex.of(enumerateInertialBodies(topology));
    }
}
