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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/// Commons RNG providers for node sampling.
///
/// Every algorithm here is seedable from a single `long`, so a graph is reproducible from
/// `(algorithm, seed)` alone. Unseeded providers draw their seed from the library's own
/// entropy source.
public final class RandomGenerators {

  private RandomGenerators() {
  }

  /// PRNG algorithms offered on the command line.
  public enum Algorithm {
    /// xoshiro256++, the default: fast with a 2^256 period
    XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
    /// xoshiro128++, half the state of the default
    XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
    /// SplitMix64, a single 64-bit word of state
    SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
    /// Mersenne Twister, for comparison with other tools that use it
    MT(RandomSource.MT),
    /// Marsaglia's KISS
    KISS(RandomSource.KISS);

    private final RandomSource source;

    Algorithm(RandomSource source) {
      this.source = source;
    }

    RandomSource source() {
      return source;
    }
  }

  /// @param algorithm the algorithm
  /// @param seed the seed
  /// @return a provider whose sequence is fixed by the two arguments
  public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
    return algorithm.source().create(seed);
  }

  /// @param algorithm the algorithm
  /// @return a provider seeded from system entropy
  public static RestorableUniformRandomProvider createUnseeded(Algorithm algorithm) {
    return algorithm.source().create();
  }

  /// Seed for the `index`-th graph of a batch started from `baseSeed`.
  ///
  /// Consecutive indexes give consecutive seeds, so any single entry can be regenerated
  /// on its own with `--seed baseSeed+index`.
  /// @param baseSeed the batch seed
  /// @param index zero-based position in the batch
  /// @return the entry seed
  public static long entrySeed(long baseSeed, int index) {
    return baseSeed + index;
  }
}
