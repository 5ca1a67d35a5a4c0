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

import io.nosqlbench.graphgen.api.EdgeSink;

/// A parameterized topology that can write its edges to a sink.
///
/// Implementations validate their parameters at construction, so a generator instance is
/// always runnable. They never open or close the sink; {@link GenerationRunner} owns the
/// sink lifecycle and failure cleanup.
public interface GraphGenerator {

  /// @return the topology this generator produces
  Topology topology();

  /// @return the single-line `//` header describing topology and nominal size
  String header();

  /// @return the edge count this generator aims for, or -1 when the topology is not
  ///     driven by a target count
  long requestedEdges();

  /// Write every edge of the graph.
  /// @param sink an open sink
  /// @param options the random source and cancellation token for this run
  /// @return what the run did
  /// @throws io.nosqlbench.graphgen.api.GenerationCancelledException when cancelled
  GenerationOutcome generate(EdgeSink sink, GenerationOptions options);
}
