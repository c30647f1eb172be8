package io.mbtools.command.statespace;

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

import io.mbtools.command.CMD_mbtools;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CMD_statespaceTest {

    @TempDir
    Path tempDir;

    @Test
    void printsFactorsAndTotals() throws URISyntaxException {
        Path plant = Path.of(getClass().getResource("/bundle/plant.json").toURI());
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_mbtools()).execute("statespace", "--plant", plant.toString());

            assertThat(exitCode).isZero();
            String output = outContent.toString(StandardCharsets.UTF_8);
            assertThat(output).containsPattern("cube\\s+floating\\s+nq=7\\s+nv=6\\s+q@0\\s+v@0");
            assertThat(output).containsPattern("elbow\\s+floating\\s+nq=8\\s+nv=7\\s+q@7\\s+v@6");
            assertThat(output).containsPattern("arm\\s+fixed\\s+nq=2\\s+nv=2\\s+q@15\\s+v@13");
            assertThat(output).containsPattern("total\\s+nq=17\\s+nv=15");
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    void ambiguousFreeBaseFails() throws IOException {
        Path plant = tempDir.resolve("plant.json");
        Files.writeString(plant, "{\"models\":[{\"name\":\"twins\",\"bodies\":[\"a\",\"b\"],"
            + "\"free_base_bodies\":[\"a\",\"b\"],\"velocities\":12}]}");
        ByteArrayOutputStream errContent = new ByteArrayOutputStream();
        PrintStream originalErr = System.err;
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_statespace()).execute("-p", plant.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(errContent.toString(StandardCharsets.UTF_8)).contains("twins");
        } finally {
            System.setErr(originalErr);
        }
    }
}
