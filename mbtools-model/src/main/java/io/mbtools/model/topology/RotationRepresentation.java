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

import com.google.gson.annotations.SerializedName;

/// How the plant parameterizes the orientation of a free body.
public enum RotationRepresentation {
    /// Unit quaternion, 4 position entries for 3 rotational velocities
    @SerializedName("quaternion")
    QUATERNION,
    /// Roll-pitch-yaw angles, 3 position entries
    @SerializedName("roll_pitch_yaw")
    ROLL_PITCH_YAW
}
