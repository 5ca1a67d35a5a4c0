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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// {@link DedupGuard} safe for concurrent insertion. For each pair exactly one
/// {@link #tryInsert(int, int)} call returns true, regardless of interleaving.
public class ConcurrentDedupGuard implements DedupGuard {

  private final Set<Long> seen = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryInsert(int src, int dst) {
    return seen.add(DedupGuard.key(src, dst));
  }

  @Override
  public long size() {
    return seen.size();
  }
}
