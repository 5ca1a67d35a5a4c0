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

/// What a generator reports back after writing its edges.
///
/// @param attempts number of random draws, or deterministic steps, taken
/// @param budgetExhausted true when the attempt budget ran out before the target count
public record GenerationOutcome(long attempts, boolean budgetExhausted) {

  /// @param attempts number of steps taken
  /// @return an outcome which reached its target
  public static GenerationOutcome completed(long attempts) {
    return new GenerationOutcome(attempts, false);
  }
}
