package io.mbtools.urdf;

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

import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.inertia.ParameterMatrix;
import io.mbtools.model.topology.BodyIndex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Everything needed to export a set of model instances to URDF.
///
/// @param templates model instance name to template, in export order
/// @param inertialBodies body identifiers in parameter-row order
/// @param geometryAssignment body identifier to indices into `geometries`
/// @param geometries all collision geometries of the plant
/// @param parameters one 10-entry row per indexed body
public record UrdfExportRequest(
    Map<String, UrdfTemplateSource> templates,
    BodyIndex inertialBodies,
    Map<String, List<Integer>> geometryAssignment,
    List<CollisionGeometry> geometries,
    ParameterMatrix parameters
) {
    public UrdfExportRequest {
        Objects.requireNonNull(templates, "templates cannot be null");
        Objects.requireNonNull(inertialBodies, "inertialBodies cannot be null");
        Objects.requireNonNull(parameters, "parameters cannot be null");
        templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        geometryAssignment = geometryAssignment == null ? Map.of() : Map.copyOf(geometryAssignment);
        geometries = geometries == null ? List.of() : List.copyOf(geometries);
        if (parameters.rowCount() != inertialBodies.size()) {
            throw new IllegalArgumentException("Parameter matrix has " + parameters.rowCount()
                + " rows but the body index has " + inertialBodies.size() + " bodies");
        }
    }

    /// Resolves the geometries assigned to a body.
    ///
    /// @param bodyId a body identifier
    /// @return the body's geometries, empty if it has no assignment
    /// @throws IllegalArgumentException if an assigned index is out of range
    public List<CollisionGeometry> geometriesFor(String bodyId) {
        List<Integer> indices = geometryAssignment.getOrDefault(bodyId, List.of());
        return indices.stream().map(index -> {
            if (index == null || index < 0 || index >= geometries.size()) {
                throw new IllegalArgumentException("Body '" + bodyId + "' refers to geometry index " + index
                    + " but only " + geometries.size() + " geometries exist");
            }
            return geometries.get(index);
        }).toList();
    }
}
