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

/// Raised from inside a generator when its {@link CancellationToken} has been cancelled.
/// The generation driver catches this and reports a {@link GenerationStatus#CANCELLED} result.
public class GenerationCancelledException extends RuntimeException {

  private final long edgesWritten;

  /// @param edgesWritten the number of complete edge lines written before cancellation
  public GenerationCancelledException(long edgesWritten) {
    super("generation cancelled after " + edgesWritten + " edges");
    this.edgesWritten = edgesWritten;
  }

  /// @return the number of complete edge lines written before cancellation
  public long getEdgesWritten() {
    return edgesWritten;
  }
}
