package io.nosqlbench.graphgen.random;

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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.OptionalLong;

/// Seedable uniform integer source used by every random topology generator.
///
/// Each generator run receives its own instance; there is no shared or global random state.
/// Two sources built with the same algorithm and seed produce the same sequence, which is
/// what makes generated files byte-identical across runs.
public final class RandomNodeSource {

  private final UniformRandomProvider rng;
  private final RandomGenerators.Algorithm algorithm;
  private final Long seed;

  private RandomNodeSource(UniformRandomProvider rng, RandomGenerators.Algorithm algorithm, Long seed) {
    this.rng = rng;
    this.algorithm = algorithm;
    this.seed = seed;
  }

  /// @param seed the seed for a reproducible sequence
  /// @return a source using the default algorithm
  public static RandomNodeSource seeded(long seed) {
    return seeded(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
  }

  /// @param algorithm the PRNG algorithm
  /// @param seed the seed for a reproducible sequence
  /// @return a reproducible source
  public static RandomNodeSource seeded(RandomGenerators.Algorithm algorithm, long seed) {
    return new RandomNodeSource(RandomGenerators.create(algorithm, seed), algorithm, seed);
  }

  /// @param algorithm the PRNG algorithm
  /// @return a non-reproducible source
  public static RandomNodeSource unseeded(RandomGenerators.Algorithm algorithm) {
    return new RandomNodeSource(RandomGenerators.createUnseeded(algorithm), algorithm, null);
  }

  /// @return a non-reproducible source using the default algorithm
  public static RandomNodeSource unseeded() {
    return unseeded(RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
  }

  /// Build a source from an optional seed.
  /// @param algorithm the PRNG algorithm
  /// @param seed the seed, or empty for a non-reproducible source
  /// @return a new source
  public static RandomNodeSource of(RandomGenerators.Algorithm algorithm, OptionalLong seed) {
    return seed.isPresent() ? seeded(algorithm, seed.getAsLong()) : unseeded(algorithm);
  }

  /// @param n the exclusive upper bound, at least 1
  /// @return an integer uniformly distributed over `[0, n)`
  /// @throws IllegalArgumentException if n is not positive
  public int nextInRange(int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("range bound must be positive, but was " + n);
    }
    return rng.nextInt(n);
  }

  /// @return the seed, if this source is reproducible
  public OptionalLong seed() {
    return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
  }

  /// @return the PRNG algorithm
  public RandomGenerators.Algorithm algorithm() {
    return algorithm;
  }

  @Override
  public String toString() {
    return algorithm + "(seed=" + (seed == null ? "auto" : seed) + ")";
  }
}
