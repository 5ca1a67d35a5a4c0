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
import io.nosqlbench.graphgen.random.RandomNodeSource;

/// Degree-skewed graph built by hub attachment.
///
/// The first `numNodes / 20` nodes (at least one) are hubs. Every node links to one hub
/// chosen uniformly, then to `avgDegree` uniformly chosen targets. Hubs end up with an
/// in-degree around `numNodes / numHubs`, which gives the heavy-tailed shape benchmarks
/// need without true preferential attachment. Self-loops are skipped, duplicates are kept.
public class ScaleFreeApproxGenerator implements GraphGenerator {

  private static final int NODES_PER_HUB = 20;

  private final int numNodes;
  private final int avgDegree;
  private final int numHubs;

  /// @param numNodes number of nodes, at least 1
  /// @param avgDegree random out-links per node in addition to the hub link, at least 0
  public ScaleFreeApproxGenerator(int numNodes, int avgDegree) {
    InvalidGraphParameterException.requireAtLeast("nodes", numNodes, 1);
    InvalidGraphParameterException.requireAtLeast("degree", avgDegree, 0);
    this.numNodes = numNodes;
    this.avgDegree = avgDegree;
    this.numHubs = hubCount(numNodes);
  }

  /// @param numNodes number of nodes
  /// @return `clamp(numNodes / 20, 1, numNodes)`
  public static int hubCount(int numNodes) {
    return Math.min(Math.max(1, numNodes / NODES_PER_HUB), numNodes);
  }

  @Override
  public Topology topology() {
    return Topology.SCALE_FREE;
  }

  @Override
  public String header() {
    return "// Approximate scale-free graph: " + numNodes + " nodes";
  }

  @Override
  public long requestedEdges() {
    return -1;
  }

  /// @return the number of hub nodes, which are node ids `0..numHubs-1`
  public int hubs() {
    return numHubs;
  }

  @Override
  public GenerationOutcome generate(EdgeSink sink, GenerationOptions options) {
    RandomNodeSource random = options.random();
    CancellationToken cancellation = options.cancellation();

    long attempts = 0;
    for (int node = 0; node < numNodes; node++) {
      cancellation.throwIfCancelled(sink.edgesWritten());
      int hub = random.nextInRange(numHubs);
      attempts++;
      if (node != hub) {
        sink.writeEdge(node, hub);
      }
      for (int k = 0; k < avgDegree; k++) {
        int target = random.nextInRange(numNodes);
        attempts++;
        if (target != node) {
          sink.writeEdge(node, target);
        }
      }
    }
    return GenerationOutcome.completed(attempts);
  }

  @Override
  public String toString() {
    return "scale-free(nodes=" + numNodes + ", degree=" + avgDegree + ", hubs=" + numHubs + ")";
  }
}
