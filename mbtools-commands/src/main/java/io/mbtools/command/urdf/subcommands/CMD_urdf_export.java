package io.mbtools.command.urdf.subcommands;

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

import io.mbtools.command.common.OutputDirectoryOption;
import io.mbtools.command.common.VerbosityOption;
import io.mbtools.config.ConfigurationLoadException;
import io.mbtools.config.ConfigurationLoader;
import io.mbtools.urdf.ExportOptions;
import io.mbtools.urdf.MultibodyUrdfSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Export learned parameters and collision geometry into URDF files
///
/// Reads an export bundle (plant, templates, parameter rows and geometry),
/// writes one `<model>.urdf` per template into the output directory. Nothing
/// is written unless every model exports successfully.
@CommandLine.Command(name = "export",
    description = "Write parameterized URDF files for the templates of an export bundle")
public class CMD_urdf_export implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_urdf_export.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    /// File extension of written models
    public static final String URDF_EXTENSION = ".urdf";

    @CommandLine.Option(names = {"-b", "--bundle"}, required = true,
        description = "Export bundle JSON file")
    private Path bundlePath;

    @CommandLine.Option(names = {"--verify-links"},
        description = "Fail unless every body of a model binds to exactly one link")
    private boolean verifyLinks = false;

    @CommandLine.Option(names = {"--no-verify-order"},
        description = "Skip checking the bundle's body order against the plant")
    private boolean noVerifyOrder = false;

    @CommandLine.Mixin
    private OutputDirectoryOption outputDirectoryOption = new OutputDirectoryOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            logger.debug("Output level {}", verbosityOption.level());
            ConfigurationLoader.LoadedBundle bundle = ConfigurationLoader.loadExport(bundlePath);
            ExportOptions options = ExportOptions.builder()
                .verifyBodyOrder(!noVerifyOrder)
                .verifyLinkBinding(verifyLinks)
                .build();

            List<String> fileNames = bundle.request().templates().keySet().stream()
                .map(model -> model + URDF_EXTENSION).toList();
            outputDirectoryOption.validate(fileNames);

            Map<String, String> urdfs = new MultibodyUrdfSerializer(bundle.topology(), options)
                .represent(bundle.request());

            outputDirectoryOption.createDirectories();
            for (Map.Entry<String, String> entry : urdfs.entrySet()) {
                Path target = outputDirectoryOption.resolve(entry.getKey() + URDF_EXTENSION);
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
                verbosityOption.detail("Wrote " + target + " (" + entry.getValue().length() + " chars)");
            }
            verbosityOption.summary("Exported " + urdfs.size() + " model(s) to " + outputDirectoryOption.getOutputDir());
            return EXIT_SUCCESS;
        } catch (ConfigurationLoadException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("Failed to load bundle {}", bundlePath, e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("Error writing URDF files: " + e.getMessage());
            logger.error("Failed to write URDF files to {}", outputDirectoryOption.getOutputDir(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            logger.error("URDF export failed", e);
            return EXIT_ERROR;
        }
    }
}
