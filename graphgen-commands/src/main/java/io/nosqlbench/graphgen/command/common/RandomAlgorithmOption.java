package io.nosqlbench.graphgen.command.common;

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

import io.nosqlbench.graphgen.random.RandomGenerators;
import io.nosqlbench.graphgen.random.RandomNodeSource;
import picocli.CommandLine;

/// Shared PRNG algorithm option.
public class RandomAlgorithmOption {

  @CommandLine.Option(names = {"-a", "--algorithm"},
      description = "PRNG algorithm to use (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
      defaultValue = "XO_SHI_RO_256_PP")
  private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

  /// @return the selected algorithm
  public RandomGenerators.Algorithm getAlgorithm() {
    return algorithm;
  }

  /// @param seedOption the seed to combine with this algorithm
  /// @return a node source for one generation run
  public RandomNodeSource createSource(RandomSeedOption seedOption) {
    return RandomNodeSource.of(algorithm, seedOption.getSeedRecord().asOptional());
  }
}
