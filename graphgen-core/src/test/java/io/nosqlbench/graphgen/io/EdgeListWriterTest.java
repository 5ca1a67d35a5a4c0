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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeListWriterTest {

  @TempDir
  Path tempDir;

  @Test
  void writesHeaderAndEdgeLines() throws IOException {
    Path out = tempDir.resolve("a/b/c/edges.txt");
    try (EdgeListWriter writer = EdgeListWriter.openFor(out, "Custom graph")) {
      writer.writeEdge(0, 1);
      writer.writeEdge(7, 3);
      assertThat(writer.edgesWritten()).isEqualTo(2L);
      assertThat(writer.path()).isEqualTo(out);
    }
    assertThat(Files.readString(out)).isEqualTo("// Custom graph\n0 1\n7 3\n");
  }

  @Test
  void keepsAnExistingCommentPrefix() throws IOException {
    Path out = tempDir.resolve("edges.txt");
    try (EdgeListWriter writer = EdgeListWriter.openFor(out, "// Chain graph: 2 nodes")) {
      writer.writeEdge(0, 1);
    }
    assertThat(Files.readAllLines(out)).containsExactly("// Chain graph: 2 nodes", "0 1");
  }

  @Test
  void flushMakesLinesVisibleBeforeClose() throws IOException {
    Path out = tempDir.resolve("edges.txt");
    try (EdgeListWriter writer = EdgeListWriter.openFor(out, "flush")) {
      writer.writeEdge(1, 2);
      writer.flush();
      assertThat(Files.readAllLines(out)).containsExactly("// flush", "1 2");
    }
  }

  @Test
  void rejectsSelfLoopsAndNegativeIds() {
    try (EdgeListWriter writer = EdgeListWriter.openFor(tempDir.resolve("bad.txt"), "bad")) {
      assertThatThrownBy(() -> writer.writeEdge(3, 3)).isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("Self-loop");
      assertThatThrownBy(() -> writer.writeEdge(-1, 3)).isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("non-negative");
      assertThat(writer.edgesWritten()).isZero();
    }
  }

  @Test
  void rejectsUnusableHeaders() {
    assertThatThrownBy(() -> EdgeListWriter.formatHeader(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> EdgeListWriter.formatHeader("two\nlines")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void writingRequiresAnOpenWriter() {
    EdgeListWriter writer = new EdgeListWriter();
    assertThatThrownBy(() -> writer.writeEdge(0, 1)).isInstanceOf(IllegalStateException.class);
    writer.open(tempDir.resolve("x.txt"), "x");
    writer.close();
    assertThatThrownBy(() -> writer.writeEdge(0, 1)).isInstanceOf(IllegalStateException.class);
    writer.close();
  }
}
