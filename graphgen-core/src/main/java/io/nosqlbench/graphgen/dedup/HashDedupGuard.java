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

import java.util.HashSet;
import java.util.Set;

/// {@link DedupGuard} backed by a plain hash set of packed pair keys.
public class HashDedupGuard implements DedupGuard {

  // Cap the initial capacity so a huge request does not allocate its whole table up front.
  private static final int MAX_INITIAL_CAPACITY = 1 << 24;

  private final Set<Long> seen;

  /// @param expectedPairs a sizing hint, usually the requested edge count
  public HashDedupGuard(long expectedPairs) {
    long capacity = Math.max(16L, Math.min(MAX_INITIAL_CAPACITY, (long) (expectedPairs / 0.75f) + 1));
    this.seen = new HashSet<>((int) capacity);
  }

  @Override
  public boolean tryInsert(int src, int dst) {
    return seen.add(DedupGuard.key(src, dst));
  }

  @Override
  public long size() {
    return seen.size();
  }
}
