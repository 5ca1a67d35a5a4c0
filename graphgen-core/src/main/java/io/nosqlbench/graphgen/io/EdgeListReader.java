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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/// Streams the edges of an edge-list file the way downstream benchmark loaders read them.
///
/// Lines starting with `//` and blank lines are skipped. Every other line must hold exactly
/// two non-negative decimal integers separated by whitespace.
public class EdgeListReader implements AutoCloseable {

  /// Receives each parsed edge.
  @FunctionalInterface
  public interface EdgeVisitor {
    /// @param src source node id
    /// @param dst destination node id
    void edge(int src, int dst);
  }

  private final Path path;
  private final BufferedReader reader;
  private String header;
  private long lineNumber;

  /// @param path the edge-list file
  /// @throws UncheckedIOException if the file cannot be opened
  public EdgeListReader(Path path) {
    this.path = path;
    try {
      this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open edge list: " + path, e);
    }
  }

  /// Read every edge, calling the visitor for each.
  /// @param visitor the edge callback
  /// @return the number of edges read
  /// @throws EdgeListFormatException on a malformed line
  public long forEach(EdgeVisitor visitor) {
    long edges = 0;
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        if (trimmed.startsWith(EdgeListWriter.COMMENT_PREFIX)) {
          if (header == null) {
            header = trimmed;
          }
          continue;
        }
        parseLine(trimmed, visitor);
        edges++;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read edge list: " + path, e);
    }
    return edges;
  }

  private void parseLine(String line, EdgeVisitor visitor) {
    String[] parts = line.split("\\s+");
    if (parts.length != 2) {
      throw new EdgeListFormatException(path, lineNumber,
          "expected two node ids, found " + parts.length + " fields");
    }
    int src = parseNode(parts[0]);
    int dst = parseNode(parts[1]);
    visitor.edge(src, dst);
  }

  private int parseNode(String field) {
    try {
      int id = Integer.parseInt(field);
      if (id < 0) {
        throw new EdgeListFormatException(path, lineNumber, "negative node id " + id);
      }
      return id;
    } catch (NumberFormatException e) {
      throw new EdgeListFormatException(path, lineNumber, "not a node id: '" + field + "'");
    }
  }

  /// @return the first comment line seen so far
  public Optional<String> header() {
    return Optional.ofNullable(header);
  }

  @Override
  public void close() {
    try {
      reader.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close edge list: " + path, e);
    }
  }
}
