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
import io.nosqlbench.graphgen.generators.ScaleFreeApproxGenerator;
import io.nosqlbench.graphgen.random.RandomNodeSource;
import picocli.CommandLine;

/// Generate a hub-heavy graph which approximates a power-law in-degree distribution.
@CommandLine.Command(name = "scale-free",
    description = {"Generate an approximate scale-free graph.",
        "Every node links to one of the first n/20 hub nodes, then to about --degree random nodes."})
public class CMD_generate_scalefree extends GraphGenerationCommand {

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private RandomAlgorithmOption algorithmOption = new RandomAlgorithmOption();

  @CommandLine.Option(names = {"-n", "--nodes"}, description = "Number of nodes", required = true)
  private int nodes;

  @CommandLine.Option(names = {"-d", "--degree"},
      description = "Random links per node (default: ${DEFAULT-VALUE})", defaultValue = "5")
  private int degree = 5;

  @Override
  protected GraphGenerator createGenerator() {
    return new ScaleFreeApproxGenerator(nodes, degree);
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
