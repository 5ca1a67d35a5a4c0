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
import io.nosqlbench.graphgen.generators.GraphGenerator;
import io.nosqlbench.graphgen.generators.GridGenerator;
import picocli.CommandLine;

/// Generate a 2D lattice with edges to the right and bottom neighbours.
@CommandLine.Command(name = "grid", description = "Generate a rows x cols grid graph")
public class CMD_generate_grid extends GraphGenerationCommand {

  @CommandLine.Option(names = {"-r", "--rows"}, description = "Number of rows", required = true)
  private int rows;

  @CommandLine.Option(names = {"-c", "--cols"}, description = "Number of columns", required = true)
  private int cols;

  @Override
  protected GraphGenerator createGenerator() {
    return new GridGenerator(rows, cols);
  }
}
