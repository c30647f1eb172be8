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

/// State space of a chain whose base body floats freely.
///
/// The base pose is a unit quaternion plus a translation, followed by the
/// joint positions. The base twist is angular then linear velocity,
/// followed by the joint velocities.
///
/// @param nJoints number of joint degrees of freedom below the base
public record FloatingBaseSpace(int nJoints) implements StateSpace {

    /// Quaternion entries in the base pose
    public static final int QUATERNION_DIMENSION = 4;
    /// Translation entries in the base pose
    public static final int TRANSLATION_DIMENSION = 3;
    /// Velocity entries of a free body: 3 angular, 3 linear
    public static final int BASE_VELOCITY_DIMENSION = 6;

    public FloatingBaseSpace {
        if (nJoints < 0) {
            throw new IllegalArgumentException("Joint count must be non-negative, got " + nJoints);
        }
    }

    @Override
    public int positionDimension() {
        return nJoints + QUATERNION_DIMENSION + TRANSLATION_DIMENSION;
    }

    @Override
    public int velocityDimension() {
        return nJoints + BASE_VELOCITY_DIMENSION;
    }
}
