package io.nosqlbench.graphgen.generators;

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

import io.nosqlbench.graphgen.api.CancellationToken;
import io.nosqlbench.graphgen.random.RandomNodeSource;

import java.util.Objects;

/// Per-run inputs which are not part of the topology parameters.
///
/// @param random the random source; deterministic topologies ignore it
/// @param cancellation checked between edge attempts
public record GenerationOptions(RandomNodeSource random, CancellationToken cancellation) {

  /// Validate components.
  public GenerationOptions {
    Objects.requireNonNull(random, "random source must not be null");
    Objects.requireNonNull(cancellation, "cancellation token must not be null");
  }

  /// @param seed the seed for a reproducible run
  /// @return options with a seeded default source and no cancellation
  public static GenerationOptions seeded(long seed) {
    return new GenerationOptions(RandomNodeSource.seeded(seed), CancellationToken.none());
  }

  /// @return options with a non-reproducible source and no cancellation
  public static GenerationOptions unseeded() {
    return new GenerationOptions(RandomNodeSource.unseeded(), CancellationToken.none());
  }

  /// @param token the token to use instead
  /// @return a copy with a different cancellation token
  public GenerationOptions withCancellation(CancellationToken token) {
    return new GenerationOptions(random, token);
  }
}
