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

import io.nosqlbench.graphgen.command.common.RandomAlgorithmOption;
import io.nosqlbench.graphgen.command.common.RandomSeedOption;
import io.nosqlbench.graphgen.command.generate.GraphGenerationCommand;
import io.nosqlbench.graphgen.generators.GraphGenerator;
import io.nosqlbench.graphgen.generators.StreamingRandomGenerator;
import io.nosqlbench.graphgen.random.RandomNodeSource;
import picocli.CommandLine;

/// Generate a random graph in constant memory. Duplicate edges are possible; self-loops
/// are skipped, or redrawn with `--strict`.
@CommandLine.Command(name = "streaming",
    description = {"Generate a random graph in constant memory, for very large graphs.",
        "Duplicate edges may occur. Self-loops are skipped, so fewer edges may be written,",
        "unless --strict redraws them to write exactly the requested count."})
public class CMD_generate_streaming extends GraphGenerationCommand {

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private RandomAlgorithmOption algorithmOption = new RandomAlgorithmOption();

  @CommandLine.Option(names = {"-n", "--nodes"}, description = "Number of nodes, at least 2", required = true)
  private int nodes;

  @CommandLine.Option(names = {"-e", "--edges"}, description = "Number of edge draws", required = true)
  private long edges;

  @CommandLine.Option(names = {"--strict"}, description = "Redraw self-loops so exactly --edges edges are written")
  private boolean strict;

  @Override
  protected GraphGenerator createGenerator() {
    return new StreamingRandomGenerator(nodes, edges, strict);
  }

  @Override
  protected RandomNodeSource createRandomSource() {
    return algorithmOption.createSource(randomSeedOption);
  }

  @Override
  protected boolean isRandomized() {
    return true;
  }
}
