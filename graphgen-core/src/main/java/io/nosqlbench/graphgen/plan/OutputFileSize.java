package io.nosqlbench.graphgen.plan;

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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Size of one generated edge-list file.
///
/// @param path the file
/// @param bytes its size in bytes
public record OutputFileSize(Path path, long bytes) {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  /// @return the size in mebibytes
  public double megabytes() {
    return bytes / BYTES_PER_MB;
  }

  /// Walk a directory tree and list every `.txt` file, sorted by path.
  /// @param baseDir the root to walk; a missing directory gives an empty list
  /// @return the files and their sizes
  public static List<OutputFileSize> scan(Path baseDir) {
    if (!Files.isDirectory(baseDir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(baseDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(".txt"))
          .sorted(Comparator.comparing(Path::toString))
          .map(OutputFileSize::of)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + baseDir, e);
    }
  }

  private static OutputFileSize of(Path path) {
    try {
      return new OutputFileSize(path, Files.size(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read size of " + path, e);
    }
  }

  @Override
  public String toString() {
    return String.format("%-45s %8.2f MB", path, megabytes());
  }
}
