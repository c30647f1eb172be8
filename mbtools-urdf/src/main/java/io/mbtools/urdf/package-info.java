/// URDF export of multibody inertial parameters and collision geometry.
///
/// Templates are parsed into dom4j trees, edited in place and written back
/// with a plain `<?xml version="1.0"?>` declaration. Attribute order and
/// whitespace of the template survive the round trip.
///
/// ## Key Components
///
/// - {@link io.mbtools.urdf.MultibodyUrdfSerializer}: walks the links of each template
/// - {@link io.mbtools.urdf.UrdfLinkParameterizer}: writes one link's inertial and collision blocks
/// - {@link io.mbtools.urdf.UrdfFindOrDefault}: child lookup with default subtree synthesis
/// - {@link io.mbtools.urdf.UrdfDefaultSchema}: default attributes and children per element type
/// - {@link io.mbtools.urdf.UrdfGeometryRepresentationFactory}: geometry to shape element mapping
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
