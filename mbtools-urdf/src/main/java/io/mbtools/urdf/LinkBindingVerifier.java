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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Checks that the links visited in one template bind one-to-one to the bodies
/// of its model instance.
final class LinkBindingVerifier {

    private LinkBindingVerifier() {
    }

    /// @param modelName the model instance
    /// @param expectedBodies identifiers of the instance's indexed bodies
    /// @param linkCounts number of links matched per body identifier
    /// @throws LinkBindingException if a body has no link or more than one
    static void verify(String modelName, Collection<String> expectedBodies, Map<String, Integer> linkCounts) {
        List<String> unmatched = new ArrayList<>();
        Map<String, Integer> duplicates = new LinkedHashMap<>();
        for (String body : expectedBodies) {
            int count = linkCounts.getOrDefault(body, 0);
            if (count == 0) {
                unmatched.add(body);
            } else if (count > 1) {
                duplicates.put(body, count);
            }
        }
        if (!unmatched.isEmpty() || !duplicates.isEmpty()) {
            throw new LinkBindingException(modelName, unmatched, duplicates);
        }
    }
}
