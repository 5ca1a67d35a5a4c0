package io.nosqlbench.graphgen.io;

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

/// Thrown when an edge-list file contains a line that is not `"{src} {dst}"`.
public class EdgeListFormatException extends RuntimeException {

  private final Path path;
  private final long lineNumber;

  /// @param path the file being read
  /// @param lineNumber the 1-based line number of the offending line
  /// @param message what was wrong with it
  public EdgeListFormatException(Path path, long lineNumber, String message) {
    super(path + ":" + lineNumber + ": " + message);
    this.path = path;
    this.lineNumber = lineNumber;
  }

  /// @return the file being read
  public Path getPath() {
    return path;
  }

  /// @return the 1-based line number of the offending line
  public long getLineNumber() {
    return lineNumber;
  }
}
