package io.nosqlbench.nbpivot.command.common;

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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags, which raise or lower the
 * root log level of the command.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log progress and load details"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Only log errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * @return the root log level these flags select
     */
    public Level logLevel() {
        if (quiet) {
            return Level.ERROR;
        }
        return verbose ? Level.INFO : Level.WARN;
    }

    /**
     * Validates the flags and applies the selected level to the root logger.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void apply() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
        Configurator.setRootLevel(logLevel());
    }
}
