package io.nosqlbench.graphgen.dedup;

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

/// Remembers which ordered `(src, dst)` pairs have already been emitted in a run.
///
/// Memory grows with the number of recorded pairs, so only generators that guarantee
/// uniqueness use a guard. Streaming generators must not.
public interface DedupGuard {

  /// Record a pair if it has not been seen yet.
  /// @param src source node id
  /// @param dst destination node id
  /// @return true on first occurrence of the ordered pair, false if it was already recorded
  boolean tryInsert(int src, int dst);

  /// @return the number of distinct pairs recorded
  long size();

  /// @param expectedPairs a sizing hint
  /// @return a guard for single-threaded use
  static DedupGuard create(long expectedPairs) {
    return new HashDedupGuard(expectedPairs);
  }

  /// @return a guard whose insertions are safe from multiple threads, with exactly one
  ///     caller winning for each pair
  static DedupGuard concurrent() {
    return new ConcurrentDedupGuard();
  }

  /// Pack an ordered pair into a single key. `(a, b)` and `(b, a)` give different keys.
  /// @param src source node id
  /// @param dst destination node id
  /// @return the packed key
  static long key(int src, int dst) {
    return ((long) src << 32) | (dst & 0xFFFF_FFFFL);
  }
}
