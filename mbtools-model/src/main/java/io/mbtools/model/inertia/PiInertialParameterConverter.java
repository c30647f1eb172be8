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

/// Standard pi parameterization of rigid-body inertia.
///
/// ## Row Layout
///
/// ```text
///  index │ 0 │ 1     │ 2     │ 3     │ 4   │ 5   │ 6   │ 7   │ 8   │ 9
///  ──────┼───┼───────┼───────┼───────┼─────┼─────┼─────┼─────┼─────┼─────
///  entry │ m │ m·px  │ m·py  │ m·pz  │ Ixx │ Iyy │ Izz │ Ixy │ Ixz │ Iyz
/// ```
///
/// `p` is the center of mass in the body frame. The six inertia entries are
/// taken about the body origin. URDF wants them about the center of mass, so
/// conversion applies the parallel axis theorem:
///
/// ```text
///   I_cm = I_o - m · ((p·p) E - p pᵀ)
/// ```
///
/// where E is the identity. The inverse adds the same term back.
public final class PiInertialParameterConverter implements InertialParameterConverter {

    private static final PiInertialParameterConverter INSTANCE = new PiInertialParameterConverter();

    private PiInertialParameterConverter() {
    }

    /// @return the shared converter
    public static PiInertialParameterConverter instance() {
        return INSTANCE;
    }

    @Override
    public UrdfInertia piToUrdf(double[] pi) {
        Objects.requireNonNull(pi, "pi cannot be null");
        if (pi.length != PI_LENGTH) {
            throw new IllegalArgumentException("Expected " + PI_LENGTH + " pi entries, got " + pi.length);
        }
        double mass = pi[0];
        if (!(mass > 0.0)) {
            throw new IllegalArgumentException("Mass must be positive to locate the center of mass, got " + mass);
        }

        Vec3 com = new Vec3(pi[1] / mass, pi[2] / mass, pi[3] / mass);
        InertiaTensor origin = new InertiaTensor(pi[4], pi[5], pi[6], pi[7], pi[8], pi[9]);
        return new UrdfInertia(mass, com, shift(origin, mass, com, -1.0));
    }

    @Override
    public double[] urdfToPi(UrdfInertia inertia) {
        Objects.requireNonNull(inertia, "inertia cannot be null");
        double mass = inertia.mass();
        Vec3 com = inertia.centerOfMass();
        InertiaTensor origin = shift(inertia.inertia(), mass, com, 1.0);
        return new double[]{
            mass,
            mass * com.x(), mass * com.y(), mass * com.z(),
            origin.ixx(), origin.iyy(), origin.izz(),
            origin.ixy(), origin.ixz(), origin.iyz()
        };
    }

    /// Parallel axis shift. `sign` +1 moves from the center of mass to the
    /// origin, -1 moves back.
    private static InertiaTensor shift(InertiaTensor tensor, double mass, Vec3 p, double sign) {
        double s = sign * mass;
        return new InertiaTensor(
            tensor.ixx() + s * (p.y() * p.y() + p.z() * p.z()),
            tensor.iyy() + s * (p.x() * p.x() + p.z() * p.z()),
            tensor.izz() + s * (p.x() * p.x() + p.y() * p.y()),
            tensor.ixy() - s * p.x() * p.y(),
            tensor.ixz() - s * p.x() * p.z(),
            tensor.iyz() - s * p.y() * p.z()
        );
    }
}
