package io.mbtools.command.common;

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

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Shared output directory option with a force overwrite flag.
 */
public class OutputDirectoryOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output directory",
        required = true
    )
    private Path outputDir;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Overwrite output files that already exist"
    )
    private boolean force = false;

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * @param fileName a file name inside the output directory
     * @return the resolved output path
     */
    public Path resolve(String fileName) {
        return outputDir.resolve(fileName);
    }

    /**
     * Checks that none of the given files exist unless force is set.
     *
     * @param fileNames file names inside the output directory
     * @throws IllegalStateException listing the existing files
     */
    public void validate(Collection<String> fileNames) {
        if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            throw new IllegalStateException("Output path is not a directory: " + outputDir);
        }
        if (force) {
            return;
        }
        List<Path> existing = fileNames.stream().map(this::resolve).filter(Files::exists).toList();
        if (!existing.isEmpty()) {
            throw new IllegalStateException(
                "Output files already exist: " + existing + ". Use --force to overwrite.");
        }
    }

    /**
     * Creates the output directory and its parents if needed.
     *
     * @throws IOException if the directory cannot be created
     */
    public void createDirectories() throws IOException {
        Files.createDirectories(outputDir);
    }

    @Override
    public String toString() {
        return force ? outputDir + " (force)" : String.valueOf(outputDir);
    }
}
