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

/// Random directed graph written in constant memory, for graphs too large to deduplicate.
///
/// In the default lenient mode there are exactly `numEdges` iterations. An iteration which
/// draws a self-loop writes nothing and is not retried, so the file holds slightly fewer
/// lines than requested, about `numEdges / numNodes` fewer on average. Duplicate edges are
/// possible and are kept.
///
/// In strict mode an iteration redraws until it gets a non-self-loop pair, so exactly
/// `numEdges` lines are written at the cost of the extra draws.
public class StreamingRandomGenerator implements GraphGenerator {

  private final int numNodes;
  private final long numEdges;
  private final boolean strict;

  /// @param numNodes number of nodes, at least 2
  /// @param numEdges number of iterations, at least 0
  public StreamingRandomGenerator(int numNodes, long numEdges) {
    this(numNodes, numEdges, false);
  }

  /// @param numNodes number of nodes, at least 2
  /// @param numEdges number of iterations, at least 0
  /// @param strict whether to redraw self-loops so that exactly numEdges lines are written
  public StreamingRandomGenerator(int numNodes, long numEdges, boolean strict) {
    InvalidGraphParameterException.requireAtLeast("nodes", numNodes, 2);
    InvalidGraphParameterException.requireAtLeast("edges", numEdges, 0);
    this.numNodes = numNodes;
    this.numEdges = numEdges;
    this.strict = strict;
  }

  @Override
  public Topology topology() {
    return Topology.STREAMING;
  }

  @Override
  public String header() {
    return "// Random graph (streaming): " + numNodes + " nodes, " + numEdges + " edges";
  }

  @Override
  public long requestedEdges() {
    return numEdges;
  }

  /// @return true if self-loop draws are retried
  public boolean isStrict() {
    return strict;
  }

  @Override
  public GenerationOutcome generate(EdgeSink sink, GenerationOptions options) {
    RandomNodeSource random = options.random();
    CancellationToken cancellation = options.cancellation();

    long attempts = 0;
    for (long i = 0; i < numEdges; i++) {
      cancellation.throwIfCancelled(sink.edgesWritten());
      int src = random.nextInRange(numNodes);
      int dst = random.nextInRange(numNodes);
      attempts++;
      while (strict && src == dst) {
        src = random.nextInRange(numNodes);
        dst = random.nextInRange(numNodes);
        attempts++;
      }
      if (src != dst) {
        sink.writeEdge(src, dst);
      }
    }
    return GenerationOutcome.completed(attempts);
  }

  @Override
  public String toString() {
    return "streaming(nodes=" + numNodes + ", edges=" + numEdges + (strict ? ", strict" : "") + ")";
  }
}
