package io.mbtools.command.urdf;

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

import io.mbtools.command.urdf.subcommands.CMD_urdf_export;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Umbrella command for URDF tools
@CommandLine.Command(name = "urdf",
    header = "Work with URDF model files",
    description = "Contains subcommands for exporting multibody parameters to URDF",
    subcommands = {
        CMD_urdf_export.class
    })
public class CMD_urdf implements Callable<Integer> {

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
