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
import io.nosqlbench.graphgen.dedup.DedupGuard;
import io.nosqlbench.graphgen.random.RandomNodeSource;

/// Random directed graph with unique edges and no self-loops.
///
/// Each attempt draws a source and then a destination uniformly from `[0, numNodes)`. A pair
/// is kept only when it is not a self-loop and has not been emitted before. Attempts are
/// capped at `attemptFactor * numEdges`, so dense requests terminate with fewer edges than
/// asked for instead of sampling forever. That case is reported as budget exhaustion,
/// not as an error.
public class UniformRandomGenerator implements GraphGenerator {

  /// The attempt budget multiplier used when none is given.
  public static final int DEFAULT_ATTEMPT_FACTOR = 3;

  private final int numNodes;
  private final long numEdges;
  private final int attemptFactor;
  private final long attemptBudget;

  /// @param numNodes number of nodes, at least 2
  /// @param numEdges number of unique edges to aim for, at least 0
  public UniformRandomGenerator(int numNodes, long numEdges) {
    this(numNodes, numEdges, DEFAULT_ATTEMPT_FACTOR);
  }

  /// @param numNodes number of nodes, at least 2
  /// @param numEdges number of unique edges to aim for, at least 0
  /// @param attemptFactor attempt budget as a multiple of numEdges, at least 1
  public UniformRandomGenerator(int numNodes, long numEdges, int attemptFactor) {
    InvalidGraphParameterException.requireAtLeast("nodes", numNodes, 2);
    InvalidGraphParameterException.requireAtLeast("edges", numEdges, 0);
    InvalidGraphParameterException.requireAtLeast("attempt factor", attemptFactor, 1);
    this.numNodes = numNodes;
    this.numEdges = numEdges;
    this.attemptFactor = attemptFactor;
    try {
      this.attemptBudget = Math.multiplyExact(numEdges, (long) attemptFactor);
    } catch (ArithmeticException e) {
      throw new InvalidGraphParameterException(
          "attempt budget overflows for " + numEdges + " edges x " + attemptFactor, e);
    }
  }

  @Override
  public Topology topology() {
    return Topology.RANDOM;
  }

  @Override
  public String header() {
    return "// Random graph: " + numNodes + " nodes, " + numEdges + " edges";
  }

  @Override
  public long requestedEdges() {
    return numEdges;
  }

  /// @return the maximum number of draws before accepting a shortfall
  public long attemptBudget() {
    return attemptBudget;
  }

  /// @return the attempt budget multiplier
  public int attemptFactor() {
    return attemptFactor;
  }

  @Override
  public GenerationOutcome generate(EdgeSink sink, GenerationOptions options) {
    RandomNodeSource random = options.random();
    CancellationToken cancellation = options.cancellation();
    DedupGuard guard = DedupGuard.create(numEdges);

    long written = 0;
    long attempts = 0;
    while (written < numEdges && attempts < attemptBudget) {
      cancellation.throwIfCancelled(written);
      int src = random.nextInRange(numNodes);
      int dst = random.nextInRange(numNodes);
      attempts++;
      if (src != dst && guard.tryInsert(src, dst)) {
        sink.writeEdge(src, dst);
        written++;
      }
    }
    return new GenerationOutcome(attempts, written < numEdges);
  }

  @Override
  public String toString() {
    return "random(nodes=" + numNodes + ", edges=" + numEdges + ", attemptFactor=" + attemptFactor + ")";
  }
}
