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

import java.util.List;
import java.util.Objects;

/// Concatenation of per-model-instance state spaces.
///
/// Factor order is load-bearing: it mirrors the order in which the simulator
/// lays out its state vector, world pseudo-instance first. The full state is
///
/// ```text
///   x = [ q_0 q_1 ... q_k | v_0 v_1 ... v_k ]
/// ```
///
/// so factor `i` owns positions starting at [#positionOffset(int)] and
/// velocities starting at [#velocityOffset(int)] within their halves.
///
/// @param spaces the ordered factor spaces
public record ProductSpace(List<StateSpace> spaces) implements StateSpace {

    public ProductSpace {
        Objects.requireNonNull(spaces, "spaces cannot be null");
        spaces = List.copyOf(spaces);
    }

    @Override
    public int positionDimension() {
        return spaces.stream().mapToInt(StateSpace::positionDimension).sum();
    }

    @Override
    public int velocityDimension() {
        return spaces.stream().mapToInt(StateSpace::velocityDimension).sum();
    }

    /// @return number of factors
    public int factorCount() {
        return spaces.size();
    }

    /// @param factor factor index
    /// @return the factor space
    public StateSpace factor(int factor) {
        return spaces.get(factor);
    }

    /// @param factor factor index
    /// @return offset of the factor's first position entry within q
    public int positionOffset(int factor) {
        Objects.checkIndex(factor, spaces.size());
        int offset = 0;
        for (int i = 0; i < factor; i++) {
            offset += spaces.get(i).positionDimension();
        }
        return offset;
    }

    /// @param factor factor index
    /// @return offset of the factor's first velocity entry within v
    public int velocityOffset(int factor) {
        Objects.checkIndex(factor, spaces.size());
        int offset = 0;
        for (int i = 0; i < factor; i++) {
            offset += spaces.get(i).velocityDimension();
        }
        return offset;
    }
}
