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

import java.util.Arrays;
import java.util.stream.Collectors;

/// Number formatting for URDF attribute values.
final class UrdfNumbers {

    private UrdfNumbers() {
    }

    /// @param value a scalar
    /// @return the shortest decimal that round-trips to `value`
    static String scalar(double value) {
        return Double.toString(value);
    }

    /// @param values vector components, x first
    /// @return the components space-joined
    static String vector(double... values) {
        return Arrays.stream(values).mapToObj(Double::toString).collect(Collectors.joining(" "));
    }

    /// Parses a space-separated vector attribute.
    ///
    /// @param text attribute text, e.g. "0. 0. 1.5"
    /// @param expected expected component count
    /// @param context description of the attribute for error messages
    /// @return the parsed components
    /// @throws UrdfFormatException if the text does not hold `expected` numbers
    static double[] parseVector(String text, int expected, String context) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length != expected) {
            throw new UrdfFormatException(
                context + " has " + parts.length + " components, expected " + expected + ": '" + text + "'");
        }
        double[] values = new double[expected];
        for (int i = 0; i < expected; i++) {
            values[i] = parseScalar(parts[i], context);
        }
        return values;
    }

    static double parseScalar(String text, String context) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new UrdfFormatException(context + " is not a number: '" + text + "'", e);
        }
    }
}
