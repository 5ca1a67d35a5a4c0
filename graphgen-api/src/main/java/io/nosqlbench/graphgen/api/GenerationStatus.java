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

/// Outcome of a single generation run.
public enum GenerationStatus {
  /// All requested edges were produced, or the topology has no requested count to miss.
  COMPLETE,
  /// The attempt budget ran out before the requested edge count was reached.
  /// The file is complete and valid, just smaller than requested.
  SHORTFALL,
  /// The run was cancelled. Every line in the file is complete, but the graph is partial.
  CANCELLED,
  /// The run failed and its partial output was removed.
  FAILED;

  /// @return true if the output file can be used as-is
  public boolean isUsable() {
    return this == COMPLETE || this == SHORTFALL;
  }
}
