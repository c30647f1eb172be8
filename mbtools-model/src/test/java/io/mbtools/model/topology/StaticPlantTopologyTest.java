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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class StaticPlantTopologyTest {

    @Test
    void worldInstanceIsFirst() {
        StaticPlantTopology plant = StaticPlantTopology.of(ModelDescription.floating("cube", 0, "body"));

        assertThat(plant.modelInstances()).extracting(ModelInstance::name)
            .containsExactly(PlantTopology.WORLD_MODEL_INSTANCE_NAME, "cube");
        assertThat(plant.worldModelInstance().index()).isZero();
        assertThat(plant.bodies(plant.worldModelInstance())).extracting(Body::name).containsExactly("world");
        assertThat(plant.velocityCount(plant.worldModelInstance())).isZero();
    }

    @Test
    void lookupByExactName() {
        StaticPlantTopology plant = StaticPlantTopology.of(ModelDescription.floating("cube", 0, "body"));

        assertThat(plant.modelInstanceByName("cube").index()).isEqualTo(1);
        assertThatThrownBy(() -> plant.modelInstanceByName("Cube"))
            .isInstanceOf(ModelLookupException.class)
            .hasMessageContaining("'Cube'")
            .extracting(e -> ((ModelLookupException) e).getModelName()).isEqualTo("Cube");
    }

    @Test
    void duplicateModelNamesRejected() {
        assertThatThrownBy(() -> StaticPlantTopology.of(
            ModelDescription.fixed("arm", 1, "a"), ModelDescription.fixed("arm", 1, "b")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("arm");
    }

    @Test
    void freeBaseMustBeOneOfTheBodies() {
        assertThatThrownBy(() -> new ModelDescription(
            "cube", List.of("body"), List.of("ghost"), RotationRepresentation.QUATERNION, 6, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void positionsDerivedFromQuaternionFreeBodies() {
        assertThat(ModelDescription.floating("elbow", 1, "base", "forearm").positionCount()).isEqualTo(8);
        assertThat(ModelDescription.fixed("arm", 3, "a").positionCount()).isEqualTo(3);
        assertThat(new ModelDescription("drone", List.of("f"), List.of("f"),
            RotationRepresentation.ROLL_PITCH_YAW, 6, null).positionCount()).isEqualTo(6);
    }

    @Test
    void foreignInstanceIsRejected() {
        StaticPlantTopology plant = StaticPlantTopology.of(ModelDescription.floating("cube", 0, "body"));

        assertThatThrownBy(() -> plant.bodies(new ModelInstance(9, "elsewhere")))
            .isInstanceOf(ModelLookupException.class)
            .hasMessageContaining("elsewhere");
    }
}
