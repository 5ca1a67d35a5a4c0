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

/// Raised when a generation run cannot complete because of invalid state or an I/O failure.
/// The partial output has already been removed when this is thrown.
public class GenerationFailedException extends RuntimeException {

  private final GenerationResult result;

  /// @param result the failed result, with status {@link GenerationStatus#FAILED}
  /// @param cause the underlying failure
  public GenerationFailedException(GenerationResult result, Throwable cause) {
    super("generation of '" + result.name() + "' failed: " + cause.getMessage(), cause);
    this.result = result;
  }

  /// @return the failed result
  public GenerationResult getResult() {
    return result;
  }
}
