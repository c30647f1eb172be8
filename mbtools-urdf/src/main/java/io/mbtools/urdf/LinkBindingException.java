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
import java.util.Map;

/// Thrown when the links of a template and the bodies of a model instance are
/// not in one-to-one correspondence.
public class LinkBindingException extends RuntimeException {

    private final String modelName;
    private final List<String> unmatchedBodies;
    private final Map<String, Integer> duplicateBodies;

    /// @param modelName the model instance being exported
    /// @param unmatchedBodies body identifiers with no matching link
    /// @param duplicateBodies body identifiers claimed by more than one link, with the link count
    public LinkBindingException(String modelName, List<String> unmatchedBodies, Map<String, Integer> duplicateBodies) {
        super(buildMessage(modelName, unmatchedBodies, duplicateBodies));
        this.modelName = modelName;
        this.unmatchedBodies = List.copyOf(unmatchedBodies);
        this.duplicateBodies = Map.copyOf(duplicateBodies);
    }

    private static String buildMessage(String modelName, List<String> unmatched, Map<String, Integer> duplicates) {
        StringBuilder sb = new StringBuilder("Links of model '").append(modelName)
            .append("' do not bind one-to-one to its bodies");
        if (!unmatched.isEmpty()) {
            sb.append("; bodies without a link: ").append(unmatched);
        }
        if (!duplicates.isEmpty()) {
            sb.append("; bodies claimed by several links: ").append(duplicates);
        }
        return sb.toString();
    }

    public String getModelName() {
        return modelName;
    }

    public List<String> getUnmatchedBodies() {
        return unmatchedBodies;
    }

    public Map<String, Integer> getDuplicateBodies() {
        return duplicateBodies;
    }
}
