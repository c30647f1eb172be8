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

/// Dimension description of a multibody state `x = [q; v]`.
///
/// ## Variants
///
/// ```text
/// ┌──────────────────────┬────────────────────┬──────────────────┐
/// │ variant              │ position dim (nq)  │ velocity dim (nv)│
/// ├──────────────────────┼────────────────────┼──────────────────┤
/// │ FloatingBaseSpace(n) │ n + 7              │ n + 6            │
/// │                      │ (4 quat + 3 trans) │ (3 ang + 3 lin)  │
/// │ FixedBaseSpace(n)    │ n                  │ n                │
/// │ ProductSpace(f...)   │ Σ nq(f)            │ Σ nv(f)          │
/// └──────────────────────┴────────────────────┴──────────────────┘
/// ```
///
/// State spaces are immutable value objects, built once when the plant
/// topology is known.
///
/// @see StateSpaceBuilder
public sealed interface StateSpace permits FloatingBaseSpace, FixedBaseSpace, ProductSpace {

    /// @return the dimension of the generalized position vector q
    int positionDimension();

    /// @return the dimension of the generalized velocity vector v
    int velocityDimension();

    /// @return the dimension of the full state, positions then velocities
    default int stateDimension() {
        return positionDimension() + velocityDimension();
    }
}
