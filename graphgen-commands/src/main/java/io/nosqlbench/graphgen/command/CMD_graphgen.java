package io.nosqlbench.graphgen.command;

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

import io.nosqlbench.graphgen.command.generate.CMD_generate;
import io.nosqlbench.graphgen.command.inspect.CMD_inspect;
import io.nosqlbench.graphgen.command.plan.CMD_plan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Entry point of the graph generation tools
///
/// - `generate`: write one graph of a given topology
/// - `plan`: write a tiered corpus of graphs
/// - `inspect`: summarize an existing edge-list file
@CommandLine.Command(name = "graphgen",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    optionListHeading = "%nOptions:%n",
    header = "Synthetic directed graphs for graph algorithm benchmarks",
    description = "Generates edge-list files (one 'src dst' pair per line) for random,\n" +
        "scale-free, grid and chain topologies, alone or as a tiered corpus.",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_graphgen.VersionProvider.class,
    subcommands = {CMD_generate.class, CMD_plan.class, CMD_inspect.class, CommandLine.HelpCommand.class})
public class CMD_graphgen implements Runnable {
  private static final Logger logger = LogManager.getLogger(CMD_graphgen.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// Run the graphgen command line
  /// @param args command line arguments
  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }

  /// @return a configured command line for the whole command tree
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_graphgen())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true)
        .setSubcommandsCaseInsensitive(true);
  }

  /// A subcommand is required.
  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(),
        "Missing required subcommand: generate, plan or inspect");
  }

  /// Reports the implementation version from the jar manifest.
  public static class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
      String version = CMD_graphgen.class.getPackage().getImplementationVersion();
      return new String[]{"graphgen " + (version != null ? version : "development build")};
    }
  }
}
