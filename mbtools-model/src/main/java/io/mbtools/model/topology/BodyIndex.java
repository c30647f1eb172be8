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

import io.mbtools.model.ConfigurationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/// Ordered list of body identifiers where position is identity.
///
/// Parameter row `i` belongs to `key(i)`. The index is built once from the
/// plant enumeration (see [BodyRegistry#inertialBodyIndex(PlantTopology)])
/// or supplied by the caller, and can be checked against a fresh
/// enumeration with [#verifySameOrder(BodyIndex)].
public final class BodyIndex {

    private final List<String> keys;
    private final Map<String, Integer> positions;

    private BodyIndex(List<String> keys) {
        this.keys = List.copyOf(keys);
        this.positions = new HashMap<>(keys.size() * 2);
        for (int i = 0; i < this.keys.size(); i++) {
            Integer previous = positions.putIfAbsent(this.keys.get(i), i);
            if (previous != null) {
                throw new ConfigurationException(
                    "Duplicate body identifier '" + this.keys.get(i) + "' at positions " + previous + " and " + i);
            }
        }
    }

    /// @param keys body identifiers in row order
    /// @return the index
    /// @throws ConfigurationException if an identifier repeats
    public static BodyIndex ofKeys(List<String> keys) {
        Objects.requireNonNull(keys, "keys cannot be null");
        return new BodyIndex(keys);
    }

    /// @param bodies identified bodies in row order
    /// @return the index
    /// @throws ConfigurationException if an identifier repeats
    public static BodyIndex of(List<IdentifiedBody> bodies) {
        Objects.requireNonNull(bodies, "bodies cannot be null");
        return new BodyIndex(bodies.stream().map(IdentifiedBody::key).toList());
    }

    /// @return number of bodies
    public int size() {
        return keys.size();
    }

    /// @param position row position
    /// @return the identifier at that position
    public String key(int position) {
        return keys.get(position);
    }

    /// @return all identifiers in row order
    public List<String> keys() {
        return keys;
    }

    /// @param key a body identifier
    /// @return whether the identifier is indexed
    public boolean contains(String key) {
        return positions.containsKey(key);
    }

    /// @param key a body identifier
    /// @return the row position of the identifier, or empty if it is not indexed
    public OptionalInt indexOf(String key) {
        Integer position = positions.get(key);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /// Checks that this index lists the same identifiers in the same order as `expected`.
    ///
    /// @param expected the reference order, usually a fresh plant enumeration
    /// @throws ConfigurationException naming the first divergent position
    public void verifySameOrder(BodyIndex expected) {
        Objects.requireNonNull(expected, "expected cannot be null");
        int common = Math.min(size(), expected.size());
        for (int i = 0; i < common; i++) {
            if (!keys.get(i).equals(expected.keys.get(i))) {
                throw new ConfigurationException(
                    "Body order diverges at position " + i + ": found '" + keys.get(i)
                        + "' where the plant has '" + expected.keys.get(i) + "'");
            }
        }
        if (size() != expected.size()) {
            throw new ConfigurationException(
                "Body index has " + size() + " entries but the plant enumerates " + expected.size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BodyIndex)) return false;
        return keys.equals(((BodyIndex) o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "BodyIndex" + keys;
    }
}
