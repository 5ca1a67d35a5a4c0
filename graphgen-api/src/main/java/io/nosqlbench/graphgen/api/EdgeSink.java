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

import java.nio.file.Path;

/// A way to store a sequence of directed edges in an edge-list file.
///
/// A sink is opened once with a header line, receives edges one at a time, and is closed
/// at the end of its lifecycle. Implementations buffer their output, so callers should use
/// try-with-resources to guarantee that buffered lines reach the file and the handle is
/// released on every exit path.
public interface EdgeSink extends AutoCloseable {

  /// Initialize the sink with a path and a header line.
  ///
  /// Missing parent directories are created. An existing file is truncated.
  /// @param path
  ///     The path of the edge-list file
  /// @param header
  ///     A human-readable description written as the first line, as a `//` comment
  /// @throws java.io.UncheckedIOException
  ///     if the directories or the file cannot be created
  void open(Path path, String header);

  /// Append one edge as a `"{src} {dst}"` line.
  /// @param src
  ///     the source node id
  /// @param dst
  ///     the destination node id, never equal to src
  void writeEdge(int src, int dst);

  /// @return the number of edge lines written since {@link #open(Path, String)}
  long edgesWritten();

  /// @return the path this sink was opened with, or null if it has not been opened
  Path path();

  /// Flush any buffered lines to the underlying file.
  default void flush() {}

  /// Flush and release the file handle. Closing twice has no further effect.
  /// @throws java.io.UncheckedIOException if the final flush or close fails
  @Override
  void close();
}
