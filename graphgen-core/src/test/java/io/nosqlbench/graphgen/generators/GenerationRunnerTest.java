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

import io.nosqlbench.graphgen.api.CancellationToken;
import io.nosqlbench.graphgen.api.GenerationFailedException;
import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.api.GenerationStatus;
import io.nosqlbench.graphgen.io.EdgeListWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationRunnerTest {

  @TempDir
  Path tempDir;

  @Test
  void completedRunReportsCounts() {
    Path out = tempDir.resolve("small/chain_10k.txt");
    GenerationResult result = new GenerationRunner().run(
        new GenerationRequest("chain_10k", new ChainGenerator(10_000), out), GenerationOptions.unseeded());

    assertThat(result.status()).isEqualTo(GenerationStatus.COMPLETE);
    assertThat(result.name()).isEqualTo("chain_10k");
    assertThat(result.output()).isEqualTo(out);
    assertThat(result.edgesWritten()).isEqualTo(9_999L);
    assertThat(result.requested()).hasValue(9_999L);
    assertThat(result.description()).isEqualTo("// Chain graph: 10000 nodes");
    assertThat(result.failureCause()).isEmpty();
  }

  @Test
  void replacesAnExistingFile() throws IOException {
    Path out = tempDir.resolve("chain.txt");
    Files.writeString(out, "stale content that is longer than the new graph\n".repeat(10));
    new GenerationRunner().run(new GenerationRequest("chain", new ChainGenerator(3), out), GenerationOptions.unseeded());

    assertThat(Files.readAllLines(out)).containsExactly("// Chain graph: 3 nodes", "0 1", "1 2");
  }

  @Nested
  @DisplayName("cancellation")
  class Cancellation {

    @Test
    void cancelledBeforeStartKeepsHeaderOnly() throws IOException {
      Path out = tempDir.resolve("cancelled.txt");
      CancellationToken token = CancellationToken.create();
      token.cancel();
      GenerationResult result = new GenerationRunner().run(
          new GenerationRequest("cancelled", new UniformRandomGenerator(100, 500), out),
          GenerationOptions.seeded(1L).withCancellation(token));

      assertThat(result.status()).isEqualTo(GenerationStatus.CANCELLED);
      assertThat(result.edgesWritten()).isZero();
      assertThat(Files.readAllLines(out)).containsExactly("// Random graph: 100 nodes, 500 edges");
    }

    @Test
    void cancelledMidRunKeepsCompleteLines() throws IOException {
      Path out = tempDir.resolve("partial.txt");
      CancellationToken token = CancellationToken.create();
      GenerationRunner runner = new GenerationRunner(() -> new CancellingWriter(token, 100));
      GenerationResult result = runner.run(
          new GenerationRequest("partial", new ChainGenerator(1_000), out),
          GenerationOptions.seeded(1L).withCancellation(token));

      assertThat(result.status()).isEqualTo(GenerationStatus.CANCELLED);
      assertThat(result.edgesWritten()).isEqualTo(100L);
      List<String> lines = Files.readAllLines(out);
      assertThat(lines).hasSize(101);
      assertThat(lines.get(100)).isEqualTo("99 100");
    }

    @Test
    void parentTokenCancelsChildren() {
      CancellationToken parent = CancellationToken.create();
      CancellationToken child = parent.child();
      assertThat(child.isCancelled()).isFalse();
      parent.cancel();
      assertThat(child.isCancelled()).isTrue();
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    void writeFailureRemovesThePartialFile() {
      Path out = tempDir.resolve("broken.txt");
      GenerationRunner runner = new GenerationRunner(() -> new FailingWriter(10));

      assertThatThrownBy(() -> runner.run(
          new GenerationRequest("broken", new ChainGenerator(1_000), out), GenerationOptions.unseeded()))
          .isInstanceOfSatisfying(GenerationFailedException.class, e -> {
            assertThat(e.getResult().status()).isEqualTo(GenerationStatus.FAILED);
            assertThat(e.getResult().name()).isEqualTo("broken");
            assertThat(e.getCause()).isInstanceOf(UncheckedIOException.class);
          });
      assertThat(Files.exists(out)).isFalse();
    }

    @Test
    void openFailureLeavesExistingPathsAlone() {
      Path directory = tempDir.resolve("occupied");
      GenerationRunner runner = new GenerationRunner();

      assertThatThrownBy(() -> {
        Files.createDirectories(directory);
        runner.run(new GenerationRequest("occupied", new ChainGenerator(10), directory), GenerationOptions.unseeded());
      }).isInstanceOf(GenerationFailedException.class);
      assertThat(Files.isDirectory(directory)).isTrue();
    }
  }

  private static class CancellingWriter extends EdgeListWriter {
    private final CancellationToken token;
    private final long after;

    CancellingWriter(CancellationToken token, long after) {
      this.token = token;
      this.after = after;
    }

    @Override
    public void writeEdge(int src, int dst) {
      super.writeEdge(src, dst);
      if (edgesWritten() == after) {
        token.cancel();
      }
    }
  }

  private static class FailingWriter extends EdgeListWriter {
    private final long failAfter;

    FailingWriter(long failAfter) {
      this.failAfter = failAfter;
    }

    @Override
    public void writeEdge(int src, int dst) {
      if (edgesWritten() == failAfter) {
        throw new UncheckedIOException(new IOException("disk full"));
      }
      super.writeEdge(src, dst);
    }
  }
}
