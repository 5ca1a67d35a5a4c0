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

/// Thrown when a generator or plan entry is configured with parameters that cannot
/// produce a valid graph, such as fewer than two nodes for a random topology.
///
/// This is always raised before any output file is touched.
public class InvalidGraphParameterException extends IllegalArgumentException {

  /// @param message which parameter was invalid and why
  public InvalidGraphParameterException(String message) {
    super(message);
  }

  /// @param message which parameter was invalid and why
  /// @param cause the underlying parse or conversion error
  public InvalidGraphParameterException(String message, Throwable cause) {
    super(message, cause);
  }

  /// Require that a value is at least a minimum.
  /// @param name the parameter name used in the message
  /// @param value the value to check
  /// @param min the inclusive lower bound
  /// @return the value, when valid
  /// @throws InvalidGraphParameterException when value is below min
  public static long requireAtLeast(String name, long value, long min) {
    if (value < min) {
      throw new InvalidGraphParameterException(name + " must be >= " + min + ", but was " + value);
    }
    return value;
  }
}
