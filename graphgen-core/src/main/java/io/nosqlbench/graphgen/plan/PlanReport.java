package io.nosqlbench.graphgen.plan;

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

import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.api.GenerationStatus;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/// What a plan run produced.
///
/// @param results one result per entry that was started, in plan order
/// @param skipped names of entries that were not started because the plan aborted or was cancelled
/// @param files the edge-list files found under the plan base directory afterwards
/// @param elapsed wall-clock time of the whole plan
public record PlanReport(
    List<GenerationResult> results,
    List<String> skipped,
    List<OutputFileSize> files,
    Duration elapsed
) {

  /// Copy the lists.
  public PlanReport {
    results = List.copyOf(results);
    skipped = List.copyOf(skipped);
    files = List.copyOf(files);
  }

  /// @return results with status FAILED
  public List<GenerationResult> failures() {
    return withStatus(GenerationStatus.FAILED);
  }

  /// @param status the status to select
  /// @return results with that status
  public List<GenerationResult> withStatus(GenerationStatus status) {
    return results.stream().filter(r -> r.status() == status).collect(Collectors.toList());
  }

  /// @return true if every entry ran and produced a usable file
  public boolean allUsable() {
    return skipped.isEmpty() && results.stream().allMatch(r -> r.status().isUsable());
  }

  /// @return total bytes across the scanned files
  public long totalBytes() {
    return files.stream().mapToLong(OutputFileSize::bytes).sum();
  }
}
