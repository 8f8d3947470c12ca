package io.nosqlbench.nbpivot.command;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Pivot tables for delimited text data
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "nbpivot",
    mixinStandardHelpOptions = true,
    subcommands = {CMD_pivot.class, CMD_aggregators.class, CommandLine.HelpCommand.class})
public class CMD_nbpivot implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// run an nbpivot command
    /// @param args command line args
    public static void main(String[] args) {
        Logger logger = LogManager.getLogger(CMD_nbpivot.class);
        logger.debug("nbpivot {}", String.join(" ", args));

        CMD_nbpivot command = new CMD_nbpivot();
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /// Without a subcommand, show usage.
    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }
}
