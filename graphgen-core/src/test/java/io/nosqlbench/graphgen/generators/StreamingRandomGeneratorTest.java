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

import io.nosqlbench.graphgen.api.InvalidGraphParameterException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingRandomGeneratorTest {

  @Test
  void lenientModeSkipsSelfLoopsWithoutRedrawing() {
    RecordingSink sink = new RecordingSink();
    GenerationOutcome outcome = new StreamingRandomGenerator(2, 1000)
        .generate(sink, GenerationOptions.seeded(11L));

    assertThat(outcome.attempts()).isEqualTo(1000L);
    assertThat(outcome.budgetExhausted()).isFalse();
    assertThat(sink.edges.size()).isLessThan(1000).isGreaterThan(0);
    assertThat(sink.edges).allSatisfy(e -> assertThat(e[0]).isNotEqualTo(e[1]));
  }

  @Test
  void strictModeWritesExactlyTheRequestedCount() {
    RecordingSink sink = new RecordingSink();
    GenerationOutcome outcome = new StreamingRandomGenerator(2, 1000, true)
        .generate(sink, GenerationOptions.seeded(11L));

    assertThat(sink.edges).hasSize(1000);
    assertThat(outcome.attempts()).isGreaterThan(1000L);
    assertThat(sink.edges).allSatisfy(e -> assertThat(e[0]).isNotEqualTo(e[1]));
  }

  @Test
  void duplicatesAreAllowed() {
    RecordingSink sink = new RecordingSink();
    new StreamingRandomGenerator(3, 100, true).generate(sink, GenerationOptions.seeded(2L));

    assertThat(sink.edges).hasSize(100);
    assertThat(sink.distinctPairs()).isLessThanOrEqualTo(6L);
  }

  @Test
  void idsStayInRange() {
    RecordingSink sink = new RecordingSink();
    new StreamingRandomGenerator(50, 2000).generate(sink, GenerationOptions.seeded(9L));

    assertThat(sink.edges).allSatisfy(e -> {
      assertThat(e[0]).isBetween(0, 49);
      assertThat(e[1]).isBetween(0, 49);
    });
  }

  @Test
  void headerMarksStreamingGraphs() {
    StreamingRandomGenerator generator = new StreamingRandomGenerator(100_000_000, 500_000_000L);
    assertThat(generator.header()).isEqualTo("// Random graph (streaming): 100000000 nodes, 500000000 edges");
    assertThat(generator.requestedEdges()).isEqualTo(500_000_000L);
  }

  @Test
  void rejectsInvalidParameters() {
    assertThatThrownBy(() -> new StreamingRandomGenerator(1, 10))
        .isInstanceOf(InvalidGraphParameterException.class);
    assertThatThrownBy(() -> new StreamingRandomGenerator(10, -5))
        .isInstanceOf(InvalidGraphParameterException.class);
  }
}
