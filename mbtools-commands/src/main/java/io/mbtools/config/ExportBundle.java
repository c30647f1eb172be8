package io.mbtools.config;

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

import com.google.gson.annotations.SerializedName;
import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.topology.PlantDescription;

import java.util.List;
import java.util.Map;

/// Everything `mbtools urdf export` reads from one JSON file.
///
/// ```json
/// {
///   "plant": { "models": [ { "name": "cube", "bodies": ["body"],
///                            "free_base_bodies": ["body"], "velocities": 6 } ] },
///   "templates": { "cube": "cube.urdf" },
///   "bodies": ["cube_body"],
///   "parameters": [[0.37, 0, 0, 0, 0.0006, 0.0006, 0.0006, 0, 0, 0]],
///   "geometries": [ { "type": "box", "half_lengths": {"x": 0.05, "y": 0.05, "z": 0.05} } ],
///   "geometry_assignment": { "cube_body": [0] }
/// }
/// ```
///
/// Template paths are resolved against the bundle file's directory. When
/// `bodies` is omitted the parameter rows follow the plant's own body order.
///
/// @param plant the plant description
/// @param templates model instance name to URDF template path, in export order
/// @param bodies body identifiers in parameter-row order, or null
/// @param parameters one 10-entry pi row per body
/// @param geometries all collision geometries
/// @param geometryAssignment body identifier to geometry indices
public record ExportBundle(
    PlantDescription plant,
    Map<String, String> templates,
    List<String> bodies,
    double[][] parameters,
    List<CollisionGeometry> geometries,
    @SerializedName("geometry_assignment") Map<String, List<Integer>> geometryAssignment
) {
}
