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

/// Thrown when a model instance cannot be found by name in the live plant.
public class ModelLookupException extends RuntimeException {

    private final String modelName;

    public ModelLookupException(String modelName) {
        super("No model instance named '" + modelName + "' in plant");
        this.modelName = modelName;
    }

    public ModelLookupException(String modelName, String message) {
        super(message);
        this.modelName = modelName;
    }

    /// @return the name that was looked up
    public String getModelName() {
        return modelName;
    }
}
