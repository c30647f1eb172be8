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

import io.mbtools.model.topology.BodyIdentity;
import io.mbtools.model.topology.BodyIndex;
import io.mbtools.model.topology.BodyRegistry;
import io.mbtools.model.topology.ModelInstance;
import io.mbtools.model.topology.PlantTopology;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dom4j.Document;
import org.dom4j.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/// Exports learned inertial parameters and collision geometry into URDF templates.
///
/// ## Flow
///
/// ```text
///  request.templates ─┬─► parse template ─► lookup model instance by name
///                     │                         │
///                     │   for each <link> in document order
///                     │     id = instance + "_" + link name
///                     │     id not indexed ─► untouched
///                     │     else ─► UrdfLinkParameterizer.parameterize(row, geometries)
///                     │
///                     └─► serialize ─► result[model name]
/// ```
///
/// Each template is parsed fresh, so exports never share a tree. A failure
/// aborts the whole call; no partial result is returned.
public class MultibodyUrdfSerializer {

    private static final Logger logger = LogManager.getLogger(MultibodyUrdfSerializer.class);

    private static final String LINK_TAG = "link";

    private final PlantTopology topology;
    private final UrdfLinkParameterizer parameterizer;
    private final ExportOptions options;

    public MultibodyUrdfSerializer(PlantTopology topology) {
        this(topology, new UrdfLinkParameterizer(), ExportOptions.defaults());
    }

    public MultibodyUrdfSerializer(PlantTopology topology, ExportOptions options) {
        this(topology, new UrdfLinkParameterizer(), options);
    }

    public MultibodyUrdfSerializer(PlantTopology topology, UrdfLinkParameterizer parameterizer, ExportOptions options) {
        this.topology = Objects.requireNonNull(topology, "topology cannot be null");
        this.parameterizer = Objects.requireNonNull(parameterizer, "parameterizer cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /// Exports every template of the request.
    ///
    /// @param request the export request
    /// @return model instance name to URDF text, in request order
    public Map<String, String> represent(UrdfExportRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        if (options.verifyBodyOrder()) {
            request.inertialBodies().verifySameOrder(BodyRegistry.inertialBodyIndex(topology));
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, UrdfTemplateSource> entry : request.templates().entrySet()) {
            result.put(entry.getKey(), representModel(entry.getKey(), entry.getValue(), request));
        }
        logger.info("Exported {} URDF model(s)", result.size());
        return result;
    }

    /// Exports a single model instance.
    ///
    /// @param modelName the exact model instance name
    /// @param template the URDF template of that instance
    /// @param request parameters and geometry of the whole plant
    /// @return the URDF text
    public String representModel(String modelName, UrdfTemplateSource template, UrdfExportRequest request) {
        ModelInstance instance = topology.modelInstanceByName(modelName);
        Document document = UrdfDocuments.parse(template);
        BodyIndex index = request.inertialBodies();

        Map<String, Integer> linkCounts = new LinkedHashMap<>();
        for (Element link : UrdfDocuments.elementsNamed(document.getRootElement(), LINK_TAG)) {
            String linkName = link.attributeValue(UrdfAttributes.NAME, "");
            String bodyId = new BodyIdentity(instance.name(), linkName).key();
            OptionalInt row = index.indexOf(bodyId);
            if (row.isEmpty()) {
                logger.debug("Link {} of {} is not an indexed body, leaving it untouched", linkName, modelName);
                continue;
            }
            linkCounts.merge(bodyId, 1, Integer::sum);
            parameterizer.parameterize(link, bodyId, request.parameters().row(row.getAsInt()),
                request.geometriesFor(bodyId));
        }

        if (options.verifyLinkBinding()) {
            List<String> expected = topology.bodies(instance).stream()
                .map(body -> BodyIdentity.of(body).key())
                .filter(index::contains)
                .toList();
            LinkBindingVerifier.verify(modelName, expected, linkCounts);
        }

        logger.info("Parameterized {} link(s) of model {} from {}",
            linkCounts.values().stream().mapToInt(Integer::intValue).sum(), modelName, template.description());
        return UrdfDocuments.serialize(document);
    }
}
