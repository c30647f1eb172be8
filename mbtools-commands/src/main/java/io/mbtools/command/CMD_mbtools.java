package io.mbtools.command;

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

import io.mbtools.command.statespace.CMD_statespace;
import io.mbtools.command.urdf.CMD_urdf;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Tools for multibody state spaces and URDF export
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "mbtools",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_mbtools.VersionProvider.class,
    subcommands = {
        CMD_urdf.class,
        CMD_statespace.class
    })
public class CMD_mbtools implements Callable<Integer> {

    /// run an mbtools command
    /// @param args command line args
    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CMD_mbtools())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        System.exit(commandLine.execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /// Reads the version from the jar manifest
    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_mbtools.class.getPackage().getImplementationVersion();
            return new String[]{"mbtools " + (version == null ? "development build" : version)};
        }
    }
}
