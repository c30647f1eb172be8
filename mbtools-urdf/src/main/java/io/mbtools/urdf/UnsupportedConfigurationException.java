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

/// Thrown when a body's configuration cannot be written to a single URDF link,
/// such as a body carrying more than one collision geometry.
public class UnsupportedConfigurationException extends RuntimeException {

    private final String bodyId;

    public UnsupportedConfigurationException(String bodyId, String message) {
        super(message);
        this.bodyId = bodyId;
    }

    public String getBodyId() {
        return bodyId;
    }
}
