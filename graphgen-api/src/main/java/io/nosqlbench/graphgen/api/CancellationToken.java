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

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag, checked by generators between edge attempts.
///
/// Tokens can be chained: a child token reports cancellation when either it or its
/// parent has been cancelled. This lets a plan cancel every in-flight run at once.
public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken(null);

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CancellationToken parent;

  private CancellationToken(CancellationToken parent) {
    this.parent = parent;
  }

  /// @return a fresh token which is not cancelled
  public static CancellationToken create() {
    return new CancellationToken(null);
  }

  /// @return a shared token which is never cancelled
  public static CancellationToken none() {
    return NONE;
  }

  /// @return a new token which is also cancelled when this one is
  public CancellationToken child() {
    return new CancellationToken(this);
  }

  /// Request cancellation. Has no effect on {@link #none()}.
  public void cancel() {
    if (this != NONE) {
      cancelled.set(true);
    }
  }

  /// @return true if this token or any ancestor has been cancelled, or the current thread
  ///     has been interrupted
  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    if (parent != null && parent.isCancelled()) {
      return true;
    }
    return this != NONE && Thread.currentThread().isInterrupted();
  }

  /// @param edgesWritten the number of edge lines written so far, for the exception message
  /// @throws GenerationCancelledException if cancellation was requested
  public void throwIfCancelled(long edgesWritten) {
    if (isCancelled()) {
      throw new GenerationCancelledException(edgesWritten);
    }
  }
}
