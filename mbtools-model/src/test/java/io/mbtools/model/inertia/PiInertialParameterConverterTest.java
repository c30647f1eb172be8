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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class PiInertialParameterConverterTest {

    private static final double TOLERANCE = 1e-12;

    private final InertialParameterConverter converter = PiInertialParameterConverter.instance();

    @Test
    void centeredBodyKeepsItsInertia() {
        double[] pi = {0.37, 0, 0, 0, 0.0006, 0.0007, 0.0008, 0, 0, 0};

        UrdfInertia urdf = converter.piToUrdf(pi);

        assertThat(urdf.mass()).isEqualTo(0.37);
        assertThat(urdf.centerOfMass()).isEqualTo(Vec3.ZERO);
        assertThat(urdf.inertia().toArray()).containsExactly(new double[]{0.0006, 0.0007, 0.0008, 0, 0, 0},
            within(TOLERANCE));
    }

    @Test
    void offsetCenterOfMassShiftsInertia() {
        // unit point mass at (1, 2, 0): origin inertia is m((p.p)E - ppT)
        double[] pi = {1.0, 1.0, 2.0, 0.0, 4.0, 1.0, 5.0, -2.0, 0.0, 0.0};

        UrdfInertia urdf = converter.piToUrdf(pi);

        assertThat(urdf.centerOfMass()).isEqualTo(new Vec3(1.0, 2.0, 0.0));
        assertThat(urdf.inertia().toArray()).containsExactly(new double[]{0, 0, 0, 0, 0, 0}, within(TOLERANCE));
    }

    @Test
    void roundTripReproducesRow() {
        double[] pi = {2.5, 0.125, -0.25, 0.075, 0.31, 0.27, 0.19, 0.013, -0.021, 0.008};

        double[] restored = converter.urdfToPi(converter.piToUrdf(pi));

        for (int i = 0; i < pi.length; i++) {
            assertThat(restored[i]).isCloseTo(pi[i], within(1e-9 * Math.max(1.0, Math.abs(pi[i]))));
        }
    }

    @Test
    void nonPositiveMassRejected() {
        assertThatThrownBy(() -> converter.piToUrdf(new double[]{0, 0, 0, 0, 1, 1, 1, 0, 0, 0}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Mass");
    }

    @Test
    void wrongRowLengthRejected() {
        assertThatThrownBy(() -> converter.piToUrdf(new double[]{1, 2, 3}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("10");
    }
}
