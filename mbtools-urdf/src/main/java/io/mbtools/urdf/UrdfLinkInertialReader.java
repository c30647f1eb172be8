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

import io.mbtools.model.Vec3;
import io.mbtools.model.inertia.InertiaTensor;
import io.mbtools.model.inertia.UrdfInertia;
import org.dom4j.Element;

import java.util.Optional;

/// Reads the inertial block of a URDF link back into a [UrdfInertia].
///
/// Absent `origin` and `inertia` elements and absent attributes read as zero,
/// matching the values [UrdfDefaultSchema] would synthesize.
public final class UrdfLinkInertialReader {

    private UrdfLinkInertialReader() {
    }

    /// @param link a `link` element
    /// @return the link's inertial properties, or empty if it has no `inertial` element
    /// @throws UrdfFormatException if an attribute is not numeric
    public static Optional<UrdfInertia> read(Element link) {
        UrdfFindOrDefault.Resolution inertial = UrdfFindOrDefault.resolve(link, UrdfElementType.INERTIAL);
        if (inertial.synthesized()) {
            return Optional.empty();
        }
        String linkName = link.attributeValue(UrdfAttributes.NAME, "");
        Element inertialElement = inertial.element();

        Element mass = UrdfFindOrDefault.resolve(inertialElement, UrdfElementType.MASS).element();
        double massValue = UrdfNumbers.parseScalar(attributeOrZero(mass, UrdfAttributes.VALUE),
            "mass of link '" + linkName + "'");

        Element origin = UrdfFindOrDefault.resolve(inertialElement, UrdfElementType.ORIGIN).element();
        String xyz = origin.attributeValue(UrdfAttributes.XYZ, UrdfAttributes.ZERO_FLOAT_3);
        Vec3 centerOfMass = Vec3.of(UrdfNumbers.parseVector(xyz, 3, "inertial origin of link '" + linkName + "'"));

        Element inertia = UrdfFindOrDefault.resolve(inertialElement, UrdfElementType.INERTIA).element();
        double[] entries = new double[InertiaTensor.ENTRY_COUNT];
        for (int i = 0; i < entries.length; i++) {
            String name = UrdfAttributes.INERTIA_ATTRIBUTES.get(i);
            entries[i] = UrdfNumbers.parseScalar(attributeOrZero(inertia, name),
                name + " of link '" + linkName + "'");
        }
        return Optional.of(new UrdfInertia(massValue, centerOfMass, InertiaTensor.of(entries)));
    }

    private static String attributeOrZero(Element element, String name) {
        return element.attributeValue(name, UrdfAttributes.ZERO_FLOAT);
    }
}
