package io.mbtools.model.inertia;

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

import java.util.Arrays;
import java.util.Objects;

/// Immutable snapshot of the per-body pi parameter rows.
///
/// Row `i` belongs to the body at position `i` of the inertial
/// [io.mbtools.model.topology.BodyIndex]. The matrix never aliases the
/// caller's arrays: rows are copied on construction and on access, so a
/// learning process may keep mutating its own buffers while an export reads
/// this snapshot.
public final class ParameterMatrix {

    private final double[][] rows;

    private ParameterMatrix(double[][] rows) {
        this.rows = rows;
    }

    /// Copies the given rows into a new matrix.
    ///
    /// @param rows one 10-entry row per inertial body
    /// @return the snapshot
    /// @throws IllegalArgumentException if any row does not have 10 entries
    public static ParameterMatrix of(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = Objects.requireNonNull(rows[i], "row " + i + " is null");
            if (row.length != InertialParameterConverter.PI_LENGTH) {
                throw new IllegalArgumentException(
                    "Row " + i + " has " + row.length + " entries, expected " + InertialParameterConverter.PI_LENGTH);
            }
            copy[i] = row.clone();
        }
        return new ParameterMatrix(copy);
    }

    /// @return the number of rows
    public int rowCount() {
        return rows.length;
    }

    /// @param index row index
    /// @return a copy of the row
    /// @throws IndexOutOfBoundsException if the index is out of range
    public double[] row(int index) {
        Objects.checkIndex(index, rows.length);
        return rows[index].clone();
    }

    /// @return a deep copy of all rows
    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterMatrix)) return false;
        return Arrays.deepEquals(rows, ((ParameterMatrix) o).rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "ParameterMatrix{rows=" + rows.length + "}";
    }
}
