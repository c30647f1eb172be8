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

/// State space of a chain welded to the world. The world pseudo-instance is
/// a `FixedBaseSpace(0)`.
///
/// @param nJoints number of joint degrees of freedom
public record FixedBaseSpace(int nJoints) implements StateSpace {

    public FixedBaseSpace {
        if (nJoints < 0) {
            throw new IllegalArgumentException("Joint count must be non-negative, got " + nJoints);
        }
    }

    @Override
    public int positionDimension() {
        return nJoints;
    }

    @Override
    public int velocityDimension() {
        return nJoints;
    }
}
