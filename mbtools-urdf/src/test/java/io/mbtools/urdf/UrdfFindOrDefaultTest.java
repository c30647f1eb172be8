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

import org.dom4j.Attribute;
import org.dom4j.Document;
import org.dom4j.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class UrdfFindOrDefaultTest {

    private Document document;
    private Element link;

    @BeforeEach
    void setUp() {
        document = UrdfDocuments.parse(UrdfTemplateSource.ofString("inline",
            "<robot name=\"r\"><link name=\"a\"/><link name=\"b\"><collision/><collision/></link></robot>"));
        link = document.getRootElement().elements("link").get(0);
    }

    @Test
    void resolveDoesNotModifyParent() {
        UrdfFindOrDefault.Resolution resolution = UrdfFindOrDefault.resolve(link, UrdfElementType.INERTIAL);

        assertThat(resolution.synthesized()).isTrue();
        assertThat(resolution.matchCount()).isZero();
        assertThat(resolution.element().getParent()).isNull();
        assertThat(link.nodeCount()).isZero();
    }

    @Test
    void synthesizedInertialHasDefaultChildrenInSchemaOrder() {
        Element inertial = UrdfFindOrDefault.findOrDefault(link, UrdfElementType.INERTIAL);

        assertThat(childTags(inertial)).containsExactly("origin", "mass", "inertia");
        Element origin = inertial.element("origin");
        assertThat(origin.attributeValue("xyz")).isEqualTo("0. 0. 0.");
        assertThat(origin.attributeValue("rpy")).isEqualTo("0. 0. 0.");
        Element inertia = inertial.element("inertia");
        assertThat(attributeNames(inertia)).containsExactlyElementsOf(UrdfAttributes.INERTIA_ATTRIBUTES);
        for (String name : UrdfAttributes.INERTIA_ATTRIBUTES) {
            assertThat(inertia.attributeValue(name)).isEqualTo("0.");
        }
    }

    @Test
    void synthesizedCollisionHasGeometryThenOrigin() {
        Element collision = UrdfFindOrDefault.generateDefault(UrdfElementType.COLLISION);

        assertThat(childTags(collision)).containsExactly("geometry", "origin");
    }

    @Test
    void findOrDefaultIsIdempotent() {
        Element first = UrdfFindOrDefault.findOrDefault(link, UrdfElementType.INERTIAL);
        Element second = UrdfFindOrDefault.findOrDefault(link, UrdfElementType.INERTIAL);

        assertThat(second).isSameAs(first);
        assertThat(childTags(link)).containsExactly("inertial");
    }

    @Test
    void firstOfSeveralMatchesWins() {
        Element b = document.getRootElement().elements("link").get(1);

        UrdfFindOrDefault.Resolution resolution = UrdfFindOrDefault.resolve(b, UrdfElementType.COLLISION);

        assertThat(resolution.synthesized()).isFalse();
        assertThat(resolution.matchCount()).isEqualTo(2);
        assertThat(resolution.element()).isSameAs(b.elements().get(0));
    }

    @Test
    void replaceAttributesDropsOldAttributes() {
        Element box = UrdfFindOrDefault.generateDefault(UrdfElementType.BOX);
        box.addAttribute("extra", "1");

        UrdfFindOrDefault.replaceAttributes(box, Map.of("size", "1.0 2.0 3.0"));

        assertThat(box.attributeCount()).isEqualTo(1);
        assertThat(box.attributeValue("size")).isEqualTo("1.0 2.0 3.0");
    }

    @Test
    void replaceAttributesWritesInMapOrder() {
        Element inertia = UrdfDocuments.parse(UrdfTemplateSource.ofString("inline",
            "<inertia iyz=\"6\" ixx=\"1\" izz=\"3\"/>")).getRootElement();
        Map<String, String> replacement = new LinkedHashMap<>();
        for (String name : UrdfAttributes.INERTIA_ATTRIBUTES) {
            replacement.put(name, "0.5");
        }

        UrdfFindOrDefault.replaceAttributes(inertia, replacement);

        assertThat(attributeNames(inertia)).containsExactly("ixx", "iyy", "izz", "ixy", "ixz", "iyz");
    }

    @Test
    void schemaCoversEveryElementType() {
        for (UrdfElementType type : UrdfElementType.values()) {
            assertThat(UrdfDefaultSchema.get(type)).as(type.tag()).isNotNull();
            assertThat(UrdfFindOrDefault.generateDefault(type).getName()).isEqualTo(type.tag());
        }
    }

    private static List<String> childTags(Element element) {
        return element.elements().stream().map(Element::getName).toList();
    }

    private static List<String> attributeNames(Element element) {
        return element.attributes().stream().map(Attribute::getName).toList();
    }
}
