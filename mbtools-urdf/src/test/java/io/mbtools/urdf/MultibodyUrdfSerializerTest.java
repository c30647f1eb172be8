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

import io.mbtools.model.ConfigurationException;
import io.mbtools.model.geometry.Box;
import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.geometry.HalfSpace;
import io.mbtools.model.geometry.Sphere;
import io.mbtools.model.inertia.ParameterMatrix;
import io.mbtools.model.inertia.PiInertialParameterConverter;
import io.mbtools.model.inertia.UrdfInertia;
import io.mbtools.model.topology.BodyIndex;
import io.mbtools.model.topology.BodyRegistry;
import io.mbtools.model.topology.ModelDescription;
import io.mbtools.model.topology.ModelLookupException;
import io.mbtools.model.topology.StaticPlantTopology;
import org.dom4j.Attribute;
import org.dom4j.Document;
import org.dom4j.Element;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class MultibodyUrdfSerializerTest {

    private static final StaticPlantTopology PLANT = StaticPlantTopology.of(
        ModelDescription.floating("cube", 0, "body"),
        ModelDescription.floating("elbow", 1, "elbow_1", "elbow_2"),
        ModelDescription.fixed("arm", 1, "link_1", "link_2"));

    private static final BodyIndex INDEX = BodyRegistry.inertialBodyIndex(PLANT);

    // rows follow INDEX: cube_body, elbow_elbow_1, elbow_elbow_2, arm_link_1, arm_link_2
    private static final double[][] ROWS = {
        {0.37, 0, 0, 0, 0.0006, 0.0007, 0.0008, 0, 0, 0},
        {0.2, 0.01, 0, 0, 0.001, 0.003, 0.003, 0, 0, 0},
        {0.3, 0.015, 0.003, 0, 0.002, 0.004, 0.005, -0.0001, 0, 0},
        {1.2, 0, 0, 0.12, 0.02, 0.02, 0.002, 0, 0, 0},
        {0.8, 0, 0, 0.16, 0.05, 0.05, 0.001, 0, 0, 0.0002},
    };

    private static final List<CollisionGeometry> GEOMETRIES = List.of(
        new HalfSpace(), Box.ofHalfLengths(0.05, 0.05, 0.05), new Sphere(0.02), new Sphere(0.03));

    private static Path fixturePath(String name) {
        try {
            return Path.of(MultibodyUrdfSerializerTest.class.getResource("/urdf/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static UrdfTemplateSource fixture(String name) {
        return UrdfTemplateSource.ofPath(fixturePath(name));
    }

    private static String fixtureText(String name) {
        try {
            return Files.readString(fixturePath(name));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String between(String text, String start, String end) {
        int from = text.indexOf(start);
        assertThat(from).as("position of " + start).isNotNegative();
        return text.substring(from, text.indexOf(end, from) + end.length());
    }

    private static UrdfExportRequest request(Map<String, UrdfTemplateSource> templates) {
        return new UrdfExportRequest(templates, INDEX,
            Map.of("WorldModelInstance_world", List.of(0),
                "cube_body", List.of(1),
                "elbow_elbow_2", List.of(2)),
            GEOMETRIES, ParameterMatrix.of(ROWS));
    }

    private static Map<String, UrdfTemplateSource> allTemplates() {
        Map<String, UrdfTemplateSource> templates = new LinkedHashMap<>();
        templates.put("elbow", fixture("elbow.urdf"));
        templates.put("cube", fixture("cube.urdf"));
        templates.put("arm", fixture("arm.urdf"));
        return templates;
    }

    private static Element link(Document document, String name) {
        for (Element link : UrdfDocuments.elementsNamed(document.getRootElement(), "link")) {
            if (name.equals(link.attributeValue("name"))) {
                return link;
            }
        }
        throw new AssertionError("no link " + name);
    }

    private static Document reparse(String urdf) {
        return UrdfDocuments.parse(UrdfTemplateSource.ofString("output", urdf));
    }

    @Test
    void resultFollowsRequestOrderAndCarriesDeclaration() {
        Map<String, String> result = new MultibodyUrdfSerializer(PLANT).represent(request(allTemplates()));

        assertThat(result.keySet()).containsExactly("elbow", "cube", "arm");
        assertThat(result.values()).allSatisfy(urdf -> assertThat(urdf).startsWith("<?xml version=\"1.0\"?>\n<robot"));
    }

    @Test
    void everyIndexedLinkRoundTripsItsParameters() {
        Map<String, String> result = new MultibodyUrdfSerializer(PLANT).represent(request(allTemplates()));

        for (int row = 0; row < INDEX.size(); row++) {
            String key = INDEX.key(row);
            String model = key.substring(0, key.indexOf('_'));
            String linkName = key.substring(key.indexOf('_') + 1);
            UrdfInertia inertia = UrdfLinkInertialReader.read(link(reparse(result.get(model)), linkName))
                .orElseThrow();

            assertThat(PiInertialParameterConverter.instance().urdfToPi(inertia)).as(key)
                .containsExactly(ROWS[row], within(1e-9));
        }
    }

    @Test
    void geometriesFollowTheAssignment() {
        Map<String, String> result = new MultibodyUrdfSerializer(PLANT).represent(request(allTemplates()));

        Element body = link(reparse(result.get("cube")), "body");
        Element box = body.element("collision").element("geometry").element("box");
        assertThat(box.attributeValue("size")).isEqualTo("0.1 0.1 0.1");

        Element elbow2 = link(reparse(result.get("elbow")), "elbow_2");
        assertThat(UrdfDocuments.elementsNamed(elbow2, "sphere").get(0).attributeValue("radius")).isEqualTo("0.02");

        Element elbow1 = link(reparse(result.get("elbow")), "elbow_1");
        assertThat(elbow1.elements("collision")).isEmpty();
    }

    @Test
    void unindexedLinksAreLeftUntouched() {
        String source = fixtureText("arm.urdf");
        String urdf = new MultibodyUrdfSerializer(PLANT).represent(request(Map.of("arm", fixture("arm.urdf")))).get("arm");

        String world = between(source, "<link name=\"world\">", "</link>");
        assertThat(world).contains("xyz=\"0 0 0.05\" rpy=", "radius=\"0.2\" length=", "<!-- pedestal -->");
        assertThat(urdf).contains(world);
        assertThat(urdf).contains(between(source, "<joint name=\"shoulder\"", "</joint>"));
    }

    @Test
    void rewrittenInertiaUsesCanonicalAttributeOrder() {
        String urdf = new MultibodyUrdfSerializer(PLANT).represent(request(Map.of("arm", fixture("arm.urdf")))).get("arm");

        assertThat(between(fixtureText("arm.urdf"), "<inertia ", "/>")).matches("<inertia ixx=\\S+ ixy=.*");
        Element inertia = link(reparse(urdf), "link_1").element("inertial").element("inertia");
        assertThat(inertia.attributes()).extracting(Attribute::getName)
            .containsExactly("ixx", "iyy", "izz", "ixy", "ixz", "iyz");
        assertThat(between(urdf, "<link name=\"link_1\">", "</link>"))
            .containsPattern("<inertia ixx=\"[^\"]*\" iyy=\"[^\"]*\" izz=\"[^\"]*\" ixy=\"[^\"]*\" ixz=\"[^\"]*\" iyz=\"[^\"]*\"/>")
            .containsPattern("<origin xyz=\"0\\.0 0\\.0 [^\"]+\" rpy=\"0 0 0\"/>");
    }

    @Test
    void templatesAreReparsedOnEveryExport() {
        MultibodyUrdfSerializer serializer = new MultibodyUrdfSerializer(PLANT);
        UrdfExportRequest request = request(allTemplates());

        assertThat(serializer.represent(request)).isEqualTo(serializer.represent(request));
    }

    @Test
    void unknownModelNameFailsLookup() {
        UrdfExportRequest request = request(Map.of("gripper", fixture("cube.urdf")));

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT).represent(request))
            .isInstanceOf(ModelLookupException.class)
            .hasMessageContaining("gripper");
    }

    @Test
    void divergentBodyOrderIsRejected() {
        List<String> swapped = new ArrayList<>(INDEX.keys());
        Collections.swap(swapped, 0, 1);
        UrdfExportRequest request = new UrdfExportRequest(Map.of("cube", fixture("cube.urdf")),
            BodyIndex.ofKeys(swapped), Map.of(), GEOMETRIES, ParameterMatrix.of(ROWS));

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT).represent(request))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("position 0");

        ExportOptions lenient = ExportOptions.builder().verifyBodyOrder(false).build();
        assertThat(new MultibodyUrdfSerializer(PLANT, lenient).represent(request)).containsOnlyKeys("cube");
    }

    @Test
    void missingLinkFailsBindingVerification() {
        UrdfTemplateSource partial = UrdfTemplateSource.ofString("partial",
            "<robot name=\"elbow\"><link name=\"elbow_1\"/></robot>");
        UrdfExportRequest request = request(Map.of("elbow", partial));
        ExportOptions strict = ExportOptions.builder().verifyLinkBinding(true).build();

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT, strict).represent(request))
            .isInstanceOf(LinkBindingException.class)
            .hasMessageContaining("elbow_elbow_2");

        assertThat(new MultibodyUrdfSerializer(PLANT).represent(request)).containsOnlyKeys("elbow");
    }

    @Test
    void duplicateLinkFailsBindingVerification() {
        UrdfTemplateSource doubled = UrdfTemplateSource.ofString("doubled",
            "<robot name=\"cube\"><link name=\"body\"/><link name=\"body\"/></robot>");
        UrdfExportRequest request = request(Map.of("cube", doubled));
        ExportOptions strict = ExportOptions.builder().verifyLinkBinding(true).build();

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT, strict).represent(request))
            .isInstanceOf(LinkBindingException.class)
            .satisfies(e -> assertThat(((LinkBindingException) e).getDuplicateBodies()).containsEntry("cube_body", 2));
    }

    @Test
    void outOfRangeGeometryIndexNamesTheBody() {
        UrdfExportRequest request = new UrdfExportRequest(Map.of("cube", fixture("cube.urdf")), INDEX,
            Map.of("cube_body", List.of(7)), GEOMETRIES, ParameterMatrix.of(ROWS));

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT).represent(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cube_body");
    }

    @Test
    void halfSpaceOnAnExportedLinkIsUnsupported() {
        UrdfExportRequest request = new UrdfExportRequest(Map.of("cube", fixture("cube.urdf")), INDEX,
            Map.of("cube_body", List.of(0)), GEOMETRIES, ParameterMatrix.of(ROWS));

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT).represent(request))
            .isInstanceOf(UnsupportedGeometryException.class);
    }

    @Test
    void rowCountMustMatchIndex() {
        assertThatThrownBy(() -> new UrdfExportRequest(Map.of(), INDEX, Map.of(), GEOMETRIES,
            ParameterMatrix.of(new double[][]{ROWS[0]})))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1 rows");
    }

    @Test
    void malformedTemplateIsReported() {
        UrdfExportRequest request = request(Map.of("cube", UrdfTemplateSource.ofString("broken", "<robot><link")));

        assertThatThrownBy(() -> new MultibodyUrdfSerializer(PLANT).represent(request))
            .isInstanceOf(UrdfFormatException.class)
            .hasMessageContaining("broken");
    }
}
