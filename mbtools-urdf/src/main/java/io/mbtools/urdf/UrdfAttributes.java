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

import java.util.List;

/// URDF attribute names and default values.
public final class UrdfAttributes {

    public static final String NAME = "name";
    public static final String VALUE = "value";
    public static final String SIZE = "size";
    public static final String RADIUS = "radius";
    public static final String LENGTH = "length";
    public static final String XYZ = "xyz";
    public static final String RPY = "rpy";

    public static final String IXX = "ixx";
    public static final String IYY = "iyy";
    public static final String IZZ = "izz";
    public static final String IXY = "ixy";
    public static final String IXZ = "ixz";
    public static final String IYZ = "iyz";

    /// Inertia attribute names in the order of
    /// [io.mbtools.model.inertia.InertiaTensor#toArray()]
    public static final List<String> INERTIA_ATTRIBUTES = List.of(IXX, IYY, IZZ, IXY, IXZ, IYZ);

    public static final String ZERO_FLOAT = "0.";
    public static final String ZERO_FLOAT_3 = "0. 0. 0.";

    private UrdfAttributes() {
    }
}
