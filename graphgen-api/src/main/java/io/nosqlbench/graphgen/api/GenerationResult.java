package io.nosqlbench.graphgen.api;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/// Summary of one generation run.
///
/// @param name
///     the name of the generated graph
/// @param output
///     the edge-list file that was written
/// @param description
///     the header line describing topology and nominal size
/// @param requestedEdges
///     the edge count that was asked for, or -1 when the topology is not driven by an edge count
/// @param edgesWritten
///     the number of edge lines actually written
/// @param attempts
///     the number of random draws or deterministic steps taken
/// @param elapsed
///     wall-clock time of the run
/// @param status
///     the outcome
/// @param failure
///     the cause, only when status is {@link GenerationStatus#FAILED}
public record GenerationResult(
    String name,
    Path output,
    String description,
    long requestedEdges,
    long edgesWritten,
    long attempts,
    Duration elapsed,
    GenerationStatus status,
    Throwable failure
) {

  /// @return the requested edge count, if the topology has one
  public OptionalLong requested() {
    return requestedEdges < 0 ? OptionalLong.empty() : OptionalLong.of(requestedEdges);
  }

  /// @return how many requested edges were not written, or 0 when nothing was requested
  public long shortfall() {
    return requestedEdges < 0 ? 0L : Math.max(0L, requestedEdges - edgesWritten);
  }

  /// @return the failure cause, if any
  public Optional<Throwable> failureCause() {
    return Optional.ofNullable(failure);
  }

  /// Create a failed result for a run that did not produce a usable file.
  /// @param name the graph name
  /// @param output the intended output
  /// @param description the header that was or would have been written
  /// @param elapsed time spent before the failure
  /// @param failure the cause
  /// @return a result with status FAILED
  public static GenerationResult failed(
      String name, Path output, String description, Duration elapsed, Throwable failure)
  {
    return new GenerationResult(
        name, output, description, -1, 0, 0, elapsed, GenerationStatus.FAILED, failure);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(name).append(" [").append(status).append("] ").append(String.format("%,d", edgesWritten))
        .append(" edges");
    if (requestedEdges >= 0) {
      sb.append(String.format(" of %,d requested", requestedEdges));
    }
    sb.append(" -> ").append(output).append(" in ").append(elapsed.toMillis()).append("ms");
    if (failure != null) {
      sb.append(" (").append(failure.getMessage()).append(")");
    }
    return sb.toString();
  }
}
