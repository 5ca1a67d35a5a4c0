package io.nosqlbench.graphgen.command.generate;

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

import io.nosqlbench.graphgen.command.generate.subcommands.CMD_generate_chain;
import io.nosqlbench.graphgen.command.generate.subcommands.CMD_generate_grid;
import io.nosqlbench.graphgen.command.generate.subcommands.CMD_generate_random;
import io.nosqlbench.graphgen.command.generate.subcommands.CMD_generate_scalefree;
import io.nosqlbench.graphgen.command.generate.subcommands.CMD_generate_streaming;
import picocli.CommandLine;

/// Generate a single graph as a plain-text edge list
///
/// - `random`: uniform random, unique edges, no self-loops
/// - `streaming`: random in constant memory, duplicates allowed
/// - `scale-free`: hub-heavy approximation of a power-law graph
/// - `grid`: 2D lattice
/// - `chain`: linear path
///
/// Random topologies are reproducible with `--seed`.
@CommandLine.Command(name = "generate",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    optionListHeading = "%nOptions:%n",
    header = "Generate a synthetic directed graph as an edge-list file",
    description = "Each subcommand writes one graph: a '//' header line, then one\n" +
        "'src dst' line per edge. Random topologies (random, streaming,\n" +
        "scale-free) are reproducible with --seed; grid and chain are deterministic.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:warning", "2:error"},
    subcommands = {CMD_generate_random.class, CMD_generate_streaming.class, CMD_generate_scalefree.class,
        CMD_generate_grid.class, CMD_generate_chain.class, CommandLine.HelpCommand.class})
public class CMD_generate implements Runnable {

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// Create the generate command
  public CMD_generate() {
  }

  /// A topology subcommand is required.
  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(),
        "Missing required subcommand: random, streaming, scale-free, grid or chain");
  }
}
