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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// In-memory [PlantTopology] built from a [PlantDescription].
///
/// The world pseudo-instance is always instance 0 with the single body
/// `world`, no free bodies and no velocities. Described models follow as
/// instances 1..n, and bodies are numbered plant-wide in the same order.
///
/// Useful wherever the real simulator is not available: tests, and the
/// command line tools, which read plant descriptions from JSON.
public final class StaticPlantTopology implements PlantTopology {

    private final ModelInstance world;
    private final List<ModelInstance> instances;
    private final Map<String, ModelInstance> byName;
    private final Map<ModelInstance, List<Body>> bodies;
    private final Map<ModelInstance, List<Body>> freeBodies;
    private final Map<ModelInstance, ModelDescription> descriptions;

    private StaticPlantTopology(PlantDescription description) {
        this.world = new ModelInstance(0, WORLD_MODEL_INSTANCE_NAME);
        this.byName = new LinkedHashMap<>();
        this.bodies = new HashMap<>();
        this.freeBodies = new HashMap<>();
        this.descriptions = new HashMap<>();

        List<ModelInstance> ordered = new ArrayList<>();
        ordered.add(world);
        byName.put(world.name(), world);
        bodies.put(world, List.of(new Body(0, WORLD_BODY_NAME, world)));
        freeBodies.put(world, List.of());

        int bodyIndex = 1;
        int instanceIndex = 1;
        for (ModelDescription model : description.models()) {
            if (byName.containsKey(model.name())) {
                throw new ConfigurationException("Duplicate model instance name '" + model.name() + "'");
            }
            ModelInstance instance = new ModelInstance(instanceIndex++, model.name());
            List<Body> instanceBodies = new ArrayList<>();
            List<Body> instanceFree = new ArrayList<>();
            for (String bodyName : model.bodies()) {
                Body body = new Body(bodyIndex++, bodyName, instance);
                instanceBodies.add(body);
                if (model.freeBaseBodies().contains(bodyName)) {
                    instanceFree.add(body);
                }
            }
            ordered.add(instance);
            byName.put(instance.name(), instance);
            bodies.put(instance, List.copyOf(instanceBodies));
            freeBodies.put(instance, List.copyOf(instanceFree));
            descriptions.put(instance, model);
        }
        this.instances = List.copyOf(ordered);
    }

    /// @param description the plant description
    /// @return the topology
    /// @throws ConfigurationException if two models share a name
    public static StaticPlantTopology of(PlantDescription description) {
        Objects.requireNonNull(description, "description cannot be null");
        return new StaticPlantTopology(description);
    }

    /// @param models the model descriptions in state-vector order
    /// @return the topology
    public static StaticPlantTopology of(ModelDescription... models) {
        return of(PlantDescription.of(models));
    }

    @Override
    public List<ModelInstance> modelInstances() {
        return instances;
    }

    @Override
    public ModelInstance worldModelInstance() {
        return world;
    }

    @Override
    public List<Body> bodies(ModelInstance instance) {
        return require(bodies, instance);
    }

    @Override
    public List<Body> freeBaseBodies(ModelInstance instance) {
        return require(freeBodies, instance);
    }

    @Override
    public RotationRepresentation rotationRepresentation(Body body) {
        ModelDescription model = descriptions.get(body.modelInstance());
        if (model == null || !model.freeBaseBodies().contains(body.name())) {
            throw new IllegalArgumentException("Body '" + BodyIdentity.of(body) + "' is not a free base body");
        }
        return model.rotation();
    }

    @Override
    public int velocityCount(ModelInstance instance) {
        require(bodies, instance);
        ModelDescription model = descriptions.get(instance);
        return model == null ? 0 : model.velocities();
    }

    @Override
    public int totalPositionCount() {
        return descriptions.values().stream().mapToInt(ModelDescription::positionCount).sum();
    }

    @Override
    public int totalVelocityCount() {
        return descriptions.values().stream().mapToInt(ModelDescription::velocities).sum();
    }

    @Override
    public ModelInstance modelInstanceByName(String name) {
        ModelInstance instance = byName.get(name);
        if (instance == null) {
            throw new ModelLookupException(name,
                "No model instance named '" + name + "' in plant; known instances: " + byName.keySet());
        }
        return instance;
    }

    private static <T> T require(Map<ModelInstance, T> map, ModelInstance instance) {
        T value = map.get(instance);
        if (value == null) {
            throw new ModelLookupException(instance.name(),
                "Model instance '" + instance.name() + "' (index " + instance.index() + ") is not part of this plant");
        }
        return value;
    }
}
