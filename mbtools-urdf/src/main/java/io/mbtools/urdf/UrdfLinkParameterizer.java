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

import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.inertia.InertialParameterConverter;
import io.mbtools.model.inertia.PiInertialParameterConverter;
import io.mbtools.model.inertia.UrdfInertia;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dom4j.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Writes one body's inertial parameters and collision geometry into its URDF link.
///
/// ```text
/// <link name="...">
///   <inertial>
///     <origin xyz="com" rpy="..."/>      xyz written, rpy kept
///     <mass value="m"/>
///     <inertia ixx iyy izz ixy ixz iyz/> replaced wholesale
///   </inertial>
///   <collision>
///     <geometry>
///       <box size="..."/>                replaced wholesale
///     </geometry>
///   </collision>
/// </link>
/// ```
///
/// Missing elements are synthesized with [UrdfFindOrDefault]; existing
/// elements are edited in place and keep their attribute order.
public class UrdfLinkParameterizer {

    private static final Logger logger = LogManager.getLogger(UrdfLinkParameterizer.class);

    private final InertialParameterConverter converter;

    public UrdfLinkParameterizer() {
        this(PiInertialParameterConverter.instance());
    }

    public UrdfLinkParameterizer(InertialParameterConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter cannot be null");
    }

    /// Fills a link element.
    ///
    /// @param link the `link` element to modify
    /// @param bodyId the body identifier, used in error messages
    /// @param pi the body's 10 inertial parameters
    /// @param geometries the body's collision geometries, at most one
    /// @throws UnsupportedConfigurationException if more than one geometry is given
    /// @throws IllegalArgumentException if the parameters have non-positive mass
    public void parameterize(Element link, String bodyId, double[] pi, List<CollisionGeometry> geometries) {
        Objects.requireNonNull(link, "link cannot be null");
        if (geometries.size() > 1) {
            throw new UnsupportedConfigurationException(bodyId,
                "Body '" + bodyId + "' has " + geometries.size()
                    + " collision geometries; URDF export supports at most one per link");
        }

        UrdfInertia inertia;
        try {
            inertia = converter.piToUrdf(pi);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Body '" + bodyId + "': " + e.getMessage(), e);
        }

        Element inertial = UrdfFindOrDefault.findOrDefault(link, UrdfElementType.INERTIAL);
        Element mass = UrdfFindOrDefault.findOrDefault(inertial, UrdfElementType.MASS);
        Element origin = UrdfFindOrDefault.findOrDefault(inertial, UrdfElementType.ORIGIN);
        Element inertiaElement = UrdfFindOrDefault.findOrDefault(inertial, UrdfElementType.INERTIA);

        mass.addAttribute(UrdfAttributes.VALUE, UrdfNumbers.scalar(inertia.mass()));
        origin.addAttribute(UrdfAttributes.XYZ, UrdfNumbers.vector(inertia.centerOfMass().toArray()));

        double[] entries = inertia.inertia().toArray();
        Map<String, String> inertiaAttributes = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i++) {
            inertiaAttributes.put(UrdfAttributes.INERTIA_ATTRIBUTES.get(i), UrdfNumbers.scalar(entries[i]));
        }
        UrdfFindOrDefault.replaceAttributes(inertiaElement, inertiaAttributes);

        for (CollisionGeometry geometry : geometries) {
            UrdfGeometryRepresentation representation = UrdfGeometryRepresentationFactory.representation(geometry);
            Element collision = UrdfFindOrDefault.findOrDefault(link, UrdfElementType.COLLISION);
            Element geometryElement = UrdfFindOrDefault.findOrDefault(collision, UrdfElementType.GEOMETRY);
            Element shape = UrdfFindOrDefault.findOrDefault(geometryElement, representation.type());
            UrdfFindOrDefault.replaceAttributes(shape, representation.attributes());
        }
        logger.debug("Parameterized link for body {} with mass {} and {} geometries",
            bodyId, inertia.mass(), geometries.size());
    }
}
