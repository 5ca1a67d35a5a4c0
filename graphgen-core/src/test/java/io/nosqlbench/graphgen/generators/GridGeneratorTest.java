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

import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.api.GenerationStatus;
import io.nosqlbench.graphgen.api.InvalidGraphParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridGeneratorTest {

  @TempDir
  Path tempDir;

  @Test
  void twoByTwoGridFile() throws IOException {
    Path out = tempDir.resolve("grid.txt");
    GenerationResult result = new GenerationRunner().run(
        new GenerationRequest("grid", new GridGenerator(2, 2), out), GenerationOptions.unseeded());

    assertThat(result.status()).isEqualTo(GenerationStatus.COMPLETE);
    assertThat(Files.readString(out)).isEqualTo("// Grid graph: 2x2\n0 1\n0 2\n1 3\n2 3\n");
  }

  @ParameterizedTest
  @CsvSource({"1, 1, 0", "1, 5, 4", "5, 1, 4", "3, 4, 17", "316, 316, 199080"})
  void edgeCountIsRightPlusDownLinks(int rows, int cols, long edges) {
    RecordingSink sink = new RecordingSink();
    GridGenerator generator = new GridGenerator(rows, cols);
    generator.generate(sink, GenerationOptions.unseeded());

    assertThat(generator.requestedEdges()).isEqualTo(edges);
    assertThat(sink.edges).hasSize((int) edges);
    assertThat(sink.edges).allSatisfy(e ->
        assertThat(e[1] - e[0]).isIn(1, cols));
  }

  @Test
  void ignoresTheRandomSource() {
    RecordingSink first = new RecordingSink();
    RecordingSink second = new RecordingSink();
    new GridGenerator(10, 7).generate(first, GenerationOptions.seeded(1L));
    new GridGenerator(10, 7).generate(second, GenerationOptions.seeded(2L));

    assertThat(first.edges).hasSize(second.edges.size());
    for (int i = 0; i < first.edges.size(); i++) {
      assertThat(first.edges.get(i)).containsExactly(second.edges.get(i));
    }
  }

  @Test
  void rejectsInvalidDimensions() {
    assertThatThrownBy(() -> new GridGenerator(0, 5)).isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("rows");
    assertThatThrownBy(() -> new GridGenerator(5, 0)).isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("cols");
    assertThatThrownBy(() -> new GridGenerator(100_000, 100_000)).isInstanceOf(InvalidGraphParameterException.class)
        .hasMessageContaining("exceeds");
  }
}
