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

/// A single directed path `0 -> 1 -> ... -> n-1`: maximal depth and no branching, the worst
/// case for parallel traversal.
public class ChainGenerator implements GraphGenerator {

  private final int numNodes;

  /// @param numNodes number of nodes, at least 1
  public ChainGenerator(int numNodes) {
    InvalidGraphParameterException.requireAtLeast("nodes", numNodes, 1);
    this.numNodes = numNodes;
  }

  @Override
  public Topology topology() {
    return Topology.CHAIN;
  }

  @Override
  public String header() {
    return "// Chain graph: " + numNodes + " nodes";
  }

  @Override
  public long requestedEdges() {
    return numNodes - 1L;
  }

  @Override
  public GenerationOutcome generate(EdgeSink sink, GenerationOptions options) {
    CancellationToken cancellation = options.cancellation();
    for (int i = 0; i < numNodes - 1; i++) {
      cancellation.throwIfCancelled(i);
      sink.writeEdge(i, i + 1);
    }
    return GenerationOutcome.completed(numNodes - 1L);
  }

  @Override
  public String toString() {
    return "chain(nodes=" + numNodes + ")";
  }
}
