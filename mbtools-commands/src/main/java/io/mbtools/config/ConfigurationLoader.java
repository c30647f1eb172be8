package io.mbtools.config;

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

import com.google.gson.JsonParseException;
import io.mbtools.model.ConfigurationException;
import io.mbtools.model.geometry.CollisionGeometry;
import io.mbtools.model.inertia.ParameterMatrix;
import io.mbtools.model.topology.BodyIndex;
import io.mbtools.model.topology.BodyRegistry;
import io.mbtools.model.topology.PlantDescription;
import io.mbtools.model.topology.StaticPlantTopology;
import io.mbtools.urdf.UrdfExportRequest;
import io.mbtools.urdf.UrdfTemplateSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Loads plant descriptions and export bundles from JSON files.
///
/// ```text
///  plant.json ──► PlantDescription ──► StaticPlantTopology
///
///  bundle.json ──► ExportBundle ──┬─► StaticPlantTopology
///                                 └─► UrdfExportRequest
///                                       templates resolved beside bundle.json
/// ```
public final class ConfigurationLoader {

    private static final Logger logger = LogManager.getLogger(ConfigurationLoader.class);

    private ConfigurationLoader() {
    }

    /// A bundle turned into the objects the serializer works on.
    ///
    /// @param topology the plant topology
    /// @param request the export request
    public record LoadedBundle(StaticPlantTopology topology, UrdfExportRequest request) {
    }

    /// @param path a plant JSON file
    /// @return the plant description
    /// @throws ConfigurationLoadException if the file is missing, unreadable or invalid
    public static PlantDescription loadPlant(Path path) throws ConfigurationLoadException {
        PlantDescription plant = read(path, PlantDescription.class);
        logger.debug("Loaded plant with {} model(s) from {}", plant.models().size(), path);
        return plant;
    }

    /// @param path a bundle JSON file
    /// @return the raw bundle
    /// @throws ConfigurationLoadException if the file is missing, unreadable or invalid
    public static ExportBundle loadBundle(Path path) throws ConfigurationLoadException {
        ExportBundle bundle = read(path, ExportBundle.class);
        if (bundle.plant() == null) {
            throw new ConfigurationLoadException("Bundle " + path + " has no 'plant' section");
        }
        if (bundle.parameters() == null) {
            throw new ConfigurationLoadException("Bundle " + path + " has no 'parameters' section");
        }
        if (bundle.templates() == null || bundle.templates().isEmpty()) {
            throw new ConfigurationLoadException("Bundle " + path + " lists no templates");
        }
        return bundle;
    }

    /// Loads a bundle and builds the topology and export request from it.
    ///
    /// @param path a bundle JSON file
    /// @return the topology and request
    /// @throws ConfigurationLoadException if the bundle is invalid or inconsistent
    public static LoadedBundle loadExport(Path path) throws ConfigurationLoadException {
        ExportBundle bundle = loadBundle(path);
        Path baseDir = path.toAbsolutePath().getParent();
        try {
            StaticPlantTopology topology = StaticPlantTopology.of(bundle.plant());
            BodyIndex index = bundle.bodies() == null
                ? BodyRegistry.inertialBodyIndex(topology)
                : BodyIndex.ofKeys(bundle.bodies());

            Map<String, UrdfTemplateSource> templates = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : bundle.templates().entrySet()) {
                templates.put(entry.getKey(), UrdfTemplateSource.ofPath(baseDir.resolve(entry.getValue())));
            }
            List<CollisionGeometry> geometries = bundle.geometries() == null ? List.of() : bundle.geometries();
            UrdfExportRequest request = new UrdfExportRequest(templates, index, bundle.geometryAssignment(),
                geometries, ParameterMatrix.of(bundle.parameters()));
            logger.debug("Loaded bundle {}: {} template(s), {} bodies, {} geometries",
                path, templates.size(), index.size(), geometries.size());
            return new LoadedBundle(topology, request);
        } catch (IllegalArgumentException | ConfigurationException e) {
            throw new ConfigurationLoadException("Invalid bundle " + path + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(Path path, Class<T> type) throws ConfigurationLoadException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new ConfigurationLoadException("File not found: " + path);
        }
        T value;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            value = MbtoolsGsonConfig.gson().fromJson(reader, type);
        } catch (IOException e) {
            throw new ConfigurationLoadException("Cannot read " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigurationLoadException("Invalid JSON in " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConfigurationLoadException("Invalid content in " + path + ": " + cause.getMessage(), e);
        }
        if (value == null) {
            throw new ConfigurationLoadException("File is empty: " + path);
        }
        return value;
    }
}
