package io.nosqlbench.graphgen.command.generate;

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

import io.nosqlbench.graphgen.command.CommandRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_generateTest {

  @TempDir
  Path tempDir;

  @Test
  void requiresATopology() {
    CommandRun run = CommandRun.of("generate");
    assertThat(run.exitCode()).isEqualTo(2);
    assertThat(run.err()).contains("Missing required subcommand");
  }

  @Nested
  @DisplayName("generate random")
  class Random {

    @Test
    void seededRunsAreReproducible() throws IOException {
      Path a = tempDir.resolve("a.txt");
      Path b = tempDir.resolve("b.txt");
      assertThat(CommandRun.of("generate", "random", "-n", "500", "-e", "2000", "-s", "42", "-o", a.toString())
          .exitCode()).isZero();
      CommandRun second = CommandRun.of("generate", "random", "-n", "500", "-e", "2000", "-s", "42",
          "-o", b.toString());

      assertThat(second.exitCode()).isZero();
      assertThat(second.out()).contains("[COMPLETE]", "Seed: 42", "XO_SHI_RO_256_PP");
      assertThat(Files.readAllBytes(a)).isEqualTo(Files.readAllBytes(b));
      assertThat(Files.readAllLines(a)).hasSize(2001).first().isEqualTo("// Random graph: 500 nodes, 2000 edges");
    }

    @Test
    void seedLineReportsWhetherTheRunIsReproducible() {
      CommandRun unseeded = CommandRun.of("generate", "random", "-n", "100", "-e", "50",
          "-o", tempDir.resolve("u.txt").toString());
      CommandRun seeded = CommandRun.of("generate", "random", "-n", "100", "-e", "50", "-s", "1_000",
          "-o", tempDir.resolve("s.txt").toString());

      assertThat(unseeded.exitCode()).isZero();
      assertThat(unseeded.out()).contains("Seed: auto (entropy)");
      assertThat(seeded.exitCode()).isZero();
      assertThat(seeded.out()).contains("Seed: 1000,");
    }

    @Test
    void algorithmChoiceChangesTheOutput() throws IOException {
      Path a = tempDir.resolve("a.txt");
      Path b = tempDir.resolve("b.txt");
      CommandRun.of("generate", "random", "-n", "500", "-e", "2000", "-s", "1", "-o", a.toString());
      CommandRun run = CommandRun.of("generate", "random", "-n", "500", "-e", "2000", "-s", "1",
          "-a", "split_mix_64", "-o", b.toString());

      assertThat(run.exitCode()).isZero();
      assertThat(Files.readAllBytes(a)).isNotEqualTo(Files.readAllBytes(b));
    }

    @Test
    void overDenseRequestIsAWarning() {
      Path out = tempDir.resolve("dense.txt");
      CommandRun run = CommandRun.of("generate", "random", "-n", "3", "-e", "10", "-s", "3", "-o", out.toString());

      assertThat(run.exitCode()).isEqualTo(1);
      assertThat(run.out()).contains("[SHORTFALL]");
      assertThat(out).exists();
    }

    @Test
    void invalidParametersCreateNoFile() {
      Path out = tempDir.resolve("nested/invalid.txt");
      CommandRun run = CommandRun.of("generate", "random", "-n", "1", "-e", "5", "-o", out.toString());

      assertThat(run.exitCode()).isEqualTo(2);
      assertThat(run.err()).contains("nodes must be >= 2");
      assertThat(out).doesNotExist();
      assertThat(out.getParent()).doesNotExist();
    }
  }

  @Test
  void streamingStrictWritesEveryEdge() throws IOException {
    Path out = tempDir.resolve("stream.txt");
    CommandRun run = CommandRun.of("generate", "streaming", "-n", "2", "-e", "300", "--strict", "-s", "5",
        "-o", out.toString());

    assertThat(run.exitCode()).isZero();
    List<String> lines = Files.readAllLines(out);
    assertThat(lines).hasSize(301);
    assertThat(lines.subList(1, lines.size())).containsOnly("0 1", "1 0");
  }

  @Test
  void scaleFreeUsesTheDegreeOption() throws IOException {
    Path out = tempDir.resolve("sf.txt");
    CommandRun run = CommandRun.of("generate", "scale-free", "-n", "100", "-d", "2", "-s", "9", "-o", out.toString());

    assertThat(run.exitCode()).isZero();
    List<String> lines = Files.readAllLines(out);
    assertThat(lines.get(0)).isEqualTo("// Approximate scale-free graph: 100 nodes");
    assertThat(lines.size() - 1).isBetween(250, 300);
  }

  @Nested
  @DisplayName("existing output")
  class ExistingOutput {

    @Test
    void isRefusedWithoutForce() throws IOException {
      Path out = tempDir.resolve("grid.txt");
      Files.writeString(out, "keep me\n");
      CommandRun run = CommandRun.of("generate", "grid", "-r", "2", "-c", "2", "-o", out.toString());

      assertThat(run.exitCode()).isEqualTo(1);
      assertThat(run.err()).contains("already exists");
      assertThat(Files.readString(out)).isEqualTo("keep me\n");
    }

    @Test
    void isReplacedWithForce() throws IOException {
      Path out = tempDir.resolve("grid.txt");
      Files.writeString(out, "replace me\n");
      CommandRun run = CommandRun.of("generate", "grid", "-r", "2", "-c", "2", "-f", "-o", out.toString());

      assertThat(run.exitCode()).isZero();
      assertThat(Files.readString(out)).isEqualTo("// Grid graph: 2x2\n0 1\n0 2\n1 3\n2 3\n");
      assertThat(run.out()).doesNotContain("Seed:");
    }
  }

  @Test
  void quietSuppressesTheSummary() {
    Path out = tempDir.resolve("chain.txt");
    CommandRun run = CommandRun.of("generate", "chain", "-n", "10", "-q", "-o", out.toString());

    assertThat(run.exitCode()).isZero();
    assertThat(run.out()).isEmpty();
    assertThat(out).exists();
  }

  @Test
  void verboseAndQuietConflict() {
    CommandRun run = CommandRun.of("generate", "chain", "-n", "10", "-v", "-q",
        "-o", tempDir.resolve("x.txt").toString());
    assertThat(run.exitCode()).isEqualTo(2);
  }
}
