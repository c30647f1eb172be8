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

import java.util.Objects;

/// System-wide identity of a body: `{model_instance_name}_{body_name}`.
///
/// The key is what parameter rows and geometry assignments are indexed by.
/// Keys are not guaranteed unique by construction (an instance named `a_b`
/// with body `c` collides with instance `a` and body `b_c`), so
/// [BodyRegistry] checks uniqueness when it enumerates.
///
/// @param modelInstanceName the owning model instance name
/// @param bodyName the body name
public record BodyIdentity(String modelInstanceName, String bodyName) {

    public BodyIdentity {
        Objects.requireNonNull(modelInstanceName, "modelInstanceName cannot be null");
        Objects.requireNonNull(bodyName, "bodyName cannot be null");
    }

    /// @param body a plant body
    /// @return the identity of the body
    public static BodyIdentity of(Body body) {
        return new BodyIdentity(body.modelInstance().name(), body.name());
    }

    /// @return the identifier string
    public String key() {
        return modelInstanceName + "_" + bodyName;
    }

    @Override
    public String toString() {
        return key();
    }
}
