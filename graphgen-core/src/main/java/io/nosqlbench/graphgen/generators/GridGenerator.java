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
import io.nosqlbench.graphgen.api.EdgeSink;
import io.nosqlbench.graphgen.api.InvalidGraphParameterException;

/// Two-dimensional lattice. Node `(i, j)` has id `i * cols + j` and links to its right
/// neighbour and its bottom neighbour when they exist. Deterministic, no randomness.
public class GridGenerator implements GraphGenerator {

  private final int rows;
  private final int cols;

  /// @param rows number of rows, at least 1
  /// @param cols number of columns, at least 1
  public GridGenerator(int rows, int cols) {
    InvalidGraphParameterException.requireAtLeast("rows", rows, 1);
    InvalidGraphParameterException.requireAtLeast("cols", cols, 1);
    if ((long) rows * cols > Integer.MAX_VALUE) {
      throw new InvalidGraphParameterException(
          "grid " + rows + "x" + cols + " exceeds the node id range of " + Integer.MAX_VALUE);
    }
    this.rows = rows;
    this.cols = cols;
  }

  @Override
  public Topology topology() {
    return Topology.GRID;
  }

  @Override
  public String header() {
    return "// Grid graph: " + rows + "x" + cols;
  }

  /// @return exactly `rows * (cols - 1) + cols * (rows - 1)`
  @Override
  public long requestedEdges() {
    return (long) rows * (cols - 1) + (long) cols * (rows - 1);
  }

  @Override
  public GenerationOutcome generate(EdgeSink sink, GenerationOptions options) {
    CancellationToken cancellation = options.cancellation();
    long steps = 0;
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < cols; j++) {
        cancellation.throwIfCancelled(sink.edgesWritten());
        int node = i * cols + j;
        if (j < cols - 1) {
          sink.writeEdge(node, node + 1);
        }
        if (i < rows - 1) {
          sink.writeEdge(node, node + cols);
        }
        steps++;
      }
    }
    return GenerationOutcome.completed(steps);
  }

  @Override
  public String toString() {
    return "grid(" + rows + "x" + cols + ")";
  }
}
