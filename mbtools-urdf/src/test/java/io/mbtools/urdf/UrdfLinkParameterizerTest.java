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

import io.mbtools.model.geometry.Box;
import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.geometry.Sphere;
import io.mbtools.model.inertia.PiInertialParameterConverter;
import io.mbtools.model.inertia.UrdfInertia;
import org.dom4j.Attribute;
import org.dom4j.Element;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class UrdfLinkParameterizerTest {

    private static final double[] PI = {2.5, 0.125, -0.25, 0.075, 0.31, 0.27, 0.19, 0.013, -0.021, 0.008};

    private final UrdfLinkParameterizer parameterizer = new UrdfLinkParameterizer();

    private static Element link(String xml) {
        return UrdfDocuments.parse(UrdfTemplateSource.ofString("inline", xml)).getRootElement().element("link");
    }

    private static Element first(Element link, String name) {
        return UrdfDocuments.elementsNamed(link, name).get(0);
    }

    private static List<String> attributeNames(Element element) {
        return element.attributes().stream().map(Attribute::getName).toList();
    }

    @Test
    void emptyLinkReceivesFullInertialBlock() {
        Element link = link("<robot name=\"r\"><link name=\"body\"/></robot>");

        parameterizer.parameterize(link, "m_body", PI, List.of());

        UrdfInertia read = UrdfLinkInertialReader.read(link).orElseThrow();
        double[] back = PiInertialParameterConverter.instance().urdfToPi(read);
        assertThat(back).containsExactly(PI, within(1e-9));
        assertThat(UrdfDocuments.elementsNamed(link, "collision").size()).isZero();
    }

    @Test
    void existingOrientationIsKept() {
        Element link = link("<robot name=\"r\"><link name=\"body\"><inertial>"
            + "<origin xyz=\"1 1 1\" rpy=\"0 0 1.5\"/><mass value=\"9\"/></inertial></link></robot>");

        parameterizer.parameterize(link, "m_body", PI, List.of());

        Element origin = first(link, "origin");
        assertThat(attributeNames(origin)).containsExactly("xyz", "rpy");
        assertThat(origin.attributeValue("rpy")).isEqualTo("0 0 1.5");
        assertThat(origin.attributeValue("xyz")).startsWith("0.05 -0.1 ");
        Element mass = first(link, "mass");
        assertThat(mass.attributeValue("value")).isEqualTo("2.5");
        assertThat(UrdfDocuments.elementsNamed(link, "inertial").size()).isEqualTo(1);
    }

    @Test
    void existingInertiaIsRewrittenInCanonicalOrder() {
        Element link = link("<robot name=\"r\"><link name=\"body\"><inertial>"
            + "<inertia iyz=\"0\" ixz=\"0\" ixy=\"0\" izz=\"1\" iyy=\"1\" ixx=\"1\"/></inertial></link></robot>");

        parameterizer.parameterize(link, "m_body", PI, List.of());

        assertThat(attributeNames(first(link, "inertia"))).containsExactly("ixx", "iyy", "izz", "ixy", "ixz", "iyz");
    }

    @Test
    void boxGeometryIsWrittenIntoCollision() {
        Element link = link("<robot name=\"r\"><link name=\"body\"/></robot>");

        parameterizer.parameterize(link, "m_body", PI, List.of(Box.ofHalfLengths(0.05, 0.05, 0.05)));

        Element box = first(link, "box");
        assertThat(box.attributeValue("size")).isEqualTo("0.1 0.1 0.1");
        Element collisionOrigin = first(link, "collision").element("origin");
        assertThat(collisionOrigin.attributeValue("xyz")).isEqualTo("0. 0. 0.");
    }

    @Test
    void shapeAttributesAreReplacedWholesale() {
        Element link = link("<robot name=\"r\"><link name=\"body\"><collision><geometry>"
            + "<sphere radius=\"1\" note=\"stale\"/></geometry></collision></link></robot>");

        parameterizer.parameterize(link, "m_body", PI, List.of(new Sphere(0.25)));

        Element sphere = first(link, "sphere");
        assertThat(sphere.attributeValue("radius")).isEqualTo("0.25");
        assertThat(sphere.attribute("note")).isNull();
        assertThat(UrdfDocuments.elementsNamed(link, "sphere").size()).isEqualTo(1);
    }

    @Test
    void moreThanOneGeometryIsRejected() {
        Element link = link("<robot name=\"r\"><link name=\"body\"/></robot>");
        List<CollisionGeometry> two = List.of(new Sphere(0.1), new Sphere(0.2));

        assertThatThrownBy(() -> parameterizer.parameterize(link, "m_body", PI, two))
            .isInstanceOf(UnsupportedConfigurationException.class)
            .hasMessageContaining("m_body")
            .hasMessageContaining("2");
    }

    @Test
    void nonPositiveMassNamesTheBody() {
        Element link = link("<robot name=\"r\"><link name=\"body\"/></robot>");
        double[] massless = new double[10];

        assertThatThrownBy(() -> parameterizer.parameterize(link, "m_body", massless, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("m_body");
    }

    @Test
    void readerReportsLinksWithoutInertial() {
        assertThat(UrdfLinkInertialReader.read(link("<robot name=\"r\"><link name=\"body\"/></robot>"))).isEmpty();
    }

    @Test
    void readerRejectsNonNumericMass() {
        Element link = link("<robot name=\"r\"><link name=\"body\"><inertial><mass value=\"heavy\"/>"
            + "</inertial></link></robot>");

        assertThatThrownBy(() -> UrdfLinkInertialReader.read(link))
            .isInstanceOf(UrdfFormatException.class)
            .hasMessageContaining("body");
    }
}
