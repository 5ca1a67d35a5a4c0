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

import io.nosqlbench.graphgen.api.InvalidGraphParameterException;
import io.nosqlbench.graphgen.generators.GridGenerator;
import io.nosqlbench.graphgen.generators.ScaleFreeApproxGenerator;
import io.nosqlbench.graphgen.generators.StreamingRandomGenerator;
import io.nosqlbench.graphgen.generators.UniformRandomGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanLoaderTest {

  @TempDir
  Path tempDir;

  private static final String PLAN = String.join("\n",
      "base_dir: graphs",
      "entries:",
      "  - tier: small",
      "    name: random_1k",
      "    topology: random",
      "    nodes: 1000",
      "    edges: 5000",
      "    attempt_factor: 4",
      "  - tier: heavy",
      "    name: stream",
      "    topology: streaming",
      "    nodes: \"100_000_000\"",
      "    edges: 500_000_000",
      "    strict: true",
      "  - tier: medium",
      "    name: sf",
      "    topology: scale_free",
      "    nodes: 100",
      "    degree: 3",
      "  - tier: medium",
      "    name: grid",
      "    topology: grid",
      "    rows: 4",
      "    cols: 5",
      "    path: custom/grid.el",
      "");

  @Test
  void loadsEveryTopology() {
    DatasetPlan plan = PlanLoader.loadFromString(PLAN, null);

    assertThat(plan.baseDir()).isEqualTo(Path.of("graphs"));
    assertThat(plan.entries()).extracting(PlanEntry::name).containsExactly("random_1k", "stream", "sf", "grid");

    UniformRandomGenerator random = (UniformRandomGenerator) plan.entries().get(0).request().generator();
    assertThat(random.requestedEdges()).isEqualTo(5000L);
    assertThat(random.attemptFactor()).isEqualTo(4);

    StreamingRandomGenerator stream = (StreamingRandomGenerator) plan.entries().get(1).request().generator();
    assertThat(stream.isStrict()).isTrue();
    assertThat(stream.requestedEdges()).isEqualTo(500_000_000L);
    assertThat(stream.header()).contains("100000000 nodes");

    assertThat(plan.entries().get(2).request().generator()).isInstanceOf(ScaleFreeApproxGenerator.class);
    assertThat(plan.entries().get(3).request().generator()).isInstanceOf(GridGenerator.class);
    assertThat(plan.entries().get(3).request().output()).isEqualTo(Path.of("graphs/custom/grid.el"));
    assertThat(plan.entries().get(0).request().output()).isEqualTo(Path.of("graphs/small/random_1k.txt"));
  }

  @Test
  void baseDirOverrideWins() throws IOException {
    Path file = tempDir.resolve("plan.yaml");
    Files.writeString(file, PLAN);
    DatasetPlan plan = PlanLoader.load(file, tempDir.resolve("out"));

    assertThat(plan.baseDir()).isEqualTo(tempDir.resolve("out"));
    assertThat(plan.entries().get(0).request().output()).isEqualTo(tempDir.resolve("out/small/random_1k.txt"));
  }

  @Test
  void missingBaseDirDefaultsToData() {
    DatasetPlan plan = PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: c, topology: chain, nodes: 10}\n", null);
    assertThat(plan.baseDir()).isEqualTo(Path.of("data"));
  }

  @Test
  void unknownTopologyNamesTheEntry() {
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: odd, topology: torus, nodes: 10}\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'odd'")
        .hasMessageContaining("torus");
  }

  @Test
  void missingKeyNamesTheEntry() {
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: g, topology: grid, rows: 3}\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'g'")
        .hasMessageContaining("cols");
  }

  @Test
  void invalidParametersNameTheEntry() {
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: tiny, topology: random, nodes: 1, edges: 5}\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'tiny'")
        .hasMessageContaining("nodes");
  }

  @Test
  void fractionalCountsAreRejected() {
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: r, topology: random, nodes: 10.9, edges: 5}\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'r'")
        .hasMessageContaining("'nodes' must be an integer")
        .hasMessageContaining("10.9");
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: s, topology: streaming, nodes: 10, edges: 5.0}\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'edges' must be an integer");
  }

  @Test
  void countsBeyondLongRangeAreRejected() {
    assertThatThrownBy(() -> PlanLoader.loadFromString(
        "entries:\n  - {tier: small, name: s, topology: streaming, nodes: 10, edges: 99999999999999999999}\n",
        null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("'edges' is out of range");
  }

  @Test
  void rejectsDocumentsWithoutEntries() {
    assertThatThrownBy(() -> PlanLoader.loadFromString("base_dir: x\n", null))
        .isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("entries");
    assertThatThrownBy(() -> PlanLoader.loadFromString("- just\n- a list\n", null))
        .isInstanceOf(InvalidGraphParameterException.class);
  }
}
