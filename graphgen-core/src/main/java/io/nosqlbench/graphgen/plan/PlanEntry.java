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

import io.nosqlbench.graphgen.generators.GenerationRequest;

import java.util.Objects;

/// A generation request placed in a tier of a {@link DatasetPlan}.
///
/// @param tier the size class
/// @param request the graph to generate
public record PlanEntry(DatasetTier tier, GenerationRequest request) {

  /// Validate components.
  public PlanEntry {
    Objects.requireNonNull(tier, "tier must not be null");
    Objects.requireNonNull(request, "request must not be null");
  }

  /// @return the request name
  public String name() {
    return request.name();
  }
}
