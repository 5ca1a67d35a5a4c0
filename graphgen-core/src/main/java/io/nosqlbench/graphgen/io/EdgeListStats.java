package io.nosqlbench.graphgen.io;

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

import io.nosqlbench.graphgen.dedup.DedupGuard;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/// Summary of an edge-list file.
///
/// @param path the file that was read
/// @param header the leading comment line, if present
/// @param edges number of edge lines
/// @param nodes node count implied by the largest id seen (max id + 1), 0 for an empty graph
/// @param selfLoops number of edges with `src == dst`
/// @param duplicates number of repeated ordered pairs, when duplicate checking was requested
public record EdgeListStats(
    Path path,
    Optional<String> header,
    long edges,
    long nodes,
    long selfLoops,
    OptionalLong duplicates
) {

  /// @return edges per node, or 0 for an empty graph
  public double averageOutDegree() {
    return nodes == 0 ? 0.0d : (double) edges / nodes;
  }

  /// Read a whole edge-list file and summarize it.
  /// @param path the file to read
  /// @param checkDuplicates whether to count repeated pairs, which holds every pair in memory
  /// @return the summary
  public static EdgeListStats of(Path path, boolean checkDuplicates) {
    DedupGuard guard = checkDuplicates ? DedupGuard.create(1024) : null;
    long[] maxId = {-1L};
    long[] selfLoops = {0L};
    long[] duplicates = {0L};
    try (EdgeListReader reader = new EdgeListReader(path)) {
      long edges = reader.forEach((src, dst) -> {
        maxId[0] = Math.max(maxId[0], Math.max(src, dst));
        if (src == dst) {
          selfLoops[0]++;
        }
        if (guard != null && !guard.tryInsert(src, dst)) {
          duplicates[0]++;
        }
      });
      return new EdgeListStats(
          path,
          reader.header(),
          edges,
          maxId[0] + 1,
          selfLoops[0],
          checkDuplicates ? OptionalLong.of(duplicates[0]) : OptionalLong.empty());
    }
  }
}
