/// Contracts shared by the graph generators, the dataset plan runner and the command line.
///
/// - {@link io.nosqlbench.graphgen.api.EdgeSink}: append-only edge-list output
/// - {@link io.nosqlbench.graphgen.api.GenerationResult}: what a single run produced
/// - {@link io.nosqlbench.graphgen.api.CancellationToken}: cooperative cancellation between edge attempts
/// - {@link io.nosqlbench.graphgen.api.InvalidGraphParameterException}: parameter validation failures
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
