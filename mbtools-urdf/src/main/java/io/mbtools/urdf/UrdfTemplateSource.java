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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// A URDF template that can be opened any number of times.
///
/// Each export opens the source again, so a template is never shared as a
/// parsed tree between exports.
public interface UrdfTemplateSource {

    /// @return a description of the source for log and error messages
    String description();

    /// @return a new stream over the template bytes; the caller closes it
    /// @throws IOException if the template cannot be read
    InputStream open() throws IOException;

    /// @param path a URDF file
    /// @return a source reading that file on every open
    static UrdfTemplateSource ofPath(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        return new UrdfTemplateSource() {
            @Override
            public String description() {
                return path.toString();
            }

            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(path);
            }
        };
    }

    /// @param label description used in messages
    /// @param xml template text
    /// @return an in-memory source
    static UrdfTemplateSource ofString(String label, String xml) {
        Objects.requireNonNull(xml, "xml cannot be null");
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);
        return new UrdfTemplateSource() {
            @Override
            public String description() {
                return label;
            }

            @Override
            public InputStream open() {
                return new ByteArrayInputStream(bytes);
            }
        };
    }
}
