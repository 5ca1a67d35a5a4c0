/// Graph topology generators and the runner which drives them into edge-list files.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.graphgen.generators.GraphGenerator}: one topology with fixed parameters
/// - {@link io.nosqlbench.graphgen.generators.GenerationRunner}: opens the sink, runs a generator, builds the result
/// - {@link io.nosqlbench.graphgen.generators.GenerationOptions}: the random source and cancellation for a run
///
/// ## Usage Example
///
/// ```java
/// GraphGenerator grid = new GridGenerator(316, 316);
/// GenerationResult result = new GenerationRunner().run(
///     new GenerationRequest("grid_100k", grid, Path.of("data/medium/grid_100k.txt")),
///     GenerationOptions.seeded(42L));
/// ```
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
