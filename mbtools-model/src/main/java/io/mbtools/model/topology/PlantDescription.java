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

import java.util.List;

/// Declarative description of a plant: its model instances in state-vector
/// order, not counting the world pseudo-instance, which is implicit.
///
/// @param models the model instances
public record PlantDescription(List<ModelDescription> models) {

    public PlantDescription {
        models = models == null ? List.of() : List.copyOf(models);
    }

    /// @param models the model instances
    /// @return the description
    public static PlantDescription of(ModelDescription... models) {
        return new PlantDescription(List.of(models));
    }
}
