package io.nosqlbench.graphgen.command.generate.subcommands;

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

import io.nosqlbench.graphgen.command.generate.GraphGenerationCommand;
import io.nosqlbench.graphgen.generators.ChainGenerator;
import io.nosqlbench.graphgen.generators.GraphGenerator;
import picocli.CommandLine;

/// Generate the path 0 -> 1 -> ... -> n-1.
@CommandLine.Command(name = "chain", description = "Generate a linear chain graph")
public class CMD_generate_chain extends GraphGenerationCommand {

  @CommandLine.Option(names = {"-n", "--nodes"}, description = "Number of nodes", required = true)
  private int nodes;

  @Override
  protected GraphGenerator createGenerator() {
    return new ChainGenerator(nodes);
  }
}
