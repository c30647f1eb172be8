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

/// `-v` and `-q` switches for commands that report progress on stdout.
///
/// Errors always go to stderr and are not affected by these switches.
public class VerbosityOption {

    /// How much a command prints on stdout
    public enum Level {
        /// nothing
        QUIET,
        /// a one-line summary
        NORMAL,
        /// the summary plus one line per file written
        VERBOSE
    }

    @CommandLine.Option(names = {"-v", "--verbose"},
        description = "Also report each file as it is written")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-q", "--quiet"},
        description = "Print nothing on stdout")
    private boolean quiet = false;

    /// @return the selected level
    /// @throws IllegalArgumentException if both `--verbose` and `--quiet` were given
    public Level level() {
        if (verbose && quiet) {
            throw new IllegalArgumentException("--verbose and --quiet cannot be combined");
        }
        return quiet ? Level.QUIET : verbose ? Level.VERBOSE : Level.NORMAL;
    }

    /// Prints a summary line unless quiet.
    public void summary(String message) {
        if (level() != Level.QUIET) {
            System.out.println(message);
        }
    }

    /// Prints a per-item line when verbose.
    public void detail(String message) {
        if (level() == Level.VERBOSE) {
            System.out.println(message);
        }
    }
}
