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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

  @Test
  void cancelIsSticky() {
    CancellationToken token = CancellationToken.create();
    assertThat(token.isCancelled()).isFalse();
    token.cancel();
    token.cancel();
    assertThat(token.isCancelled()).isTrue();
  }

  @Test
  void throwsWithTheEdgeCount() {
    CancellationToken token = CancellationToken.create();
    assertThatCode(() -> token.throwIfCancelled(3)).doesNotThrowAnyException();
    token.cancel();
    assertThatThrownBy(() -> token.throwIfCancelled(42))
        .isInstanceOfSatisfying(GenerationCancelledException.class,
            e -> assertThat(e.getEdgesWritten()).isEqualTo(42L));
  }

  @Test
  void childCancellationDoesNotReachTheParent() {
    CancellationToken parent = CancellationToken.create();
    CancellationToken child = parent.child();
    child.cancel();
    assertThat(child.isCancelled()).isTrue();
    assertThat(parent.isCancelled()).isFalse();
  }

  @Test
  void interruptCancelsOrdinaryTokens() {
    CancellationToken token = CancellationToken.create();
    Thread.currentThread().interrupt();
    try {
      assertThat(token.isCancelled()).isTrue();
      assertThat(CancellationToken.none().isCancelled()).isFalse();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void noneCannotBeCancelled() {
    CancellationToken.none().cancel();
    assertThat(CancellationToken.none().isCancelled()).isFalse();
  }
}
