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

import java.nio.file.Path;
import java.util.Objects;

/// One graph to generate: a name, a parameterized generator and where to write it.
///
/// @param name a short identifier such as `random_1k`
/// @param generator the topology and its parameters
/// @param output the edge-list file to create
public record GenerationRequest(String name, GraphGenerator generator, Path output) {

  /// Validate components.
  public GenerationRequest {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(generator, "generator must not be null");
    Objects.requireNonNull(output, "output must not be null");
  }
}
