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
public class BodyIndexTest {

    @Test
    void positionIsIdentity() {
        BodyIndex index = BodyIndex.ofKeys(List.of("cube_body", "elbow_base", "elbow_forearm"));

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.indexOf("elbow_base")).hasValue(1);
        assertThat(index.indexOf("WorldModelInstance_world")).isEmpty();
        assertThat(index.contains("cube_body")).isTrue();
        assertThat(index.key(2)).isEqualTo("elbow_forearm");
    }

    @Test
    void duplicateKeysRejected() {
        assertThatThrownBy(() -> BodyIndex.ofKeys(List.of("a", "b", "a")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("'a'");
    }

    @Test
    void verifySameOrderReportsFirstDivergence() {
        BodyIndex expected = BodyIndex.ofKeys(List.of("x_a", "x_b", "y_c"));
        BodyIndex swapped = BodyIndex.ofKeys(List.of("x_a", "y_c", "x_b"));

        assertThatThrownBy(() -> swapped.verifySameOrder(expected))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("position 1")
            .hasMessageContaining("y_c");
    }

    @Test
    void verifySameOrderReportsLengthMismatch() {
        BodyIndex expected = BodyIndex.ofKeys(List.of("x_a", "x_b"));
        BodyIndex shorter = BodyIndex.ofKeys(List.of("x_a"));

        assertThatThrownBy(() -> shorter.verifySameOrder(expected))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("1 entries");
    }
}
