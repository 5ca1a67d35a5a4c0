package io.nosqlbench.graphgen.command.common;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Cancels a {@link CancellationToken} when the JVM is asked to stop, for example on Ctrl-C,
/// and holds shutdown until the running work has flushed and closed its files.
///
/// ```java
/// try (ShutdownCancellation onExit = ShutdownCancellation.register(token)) {
///   runner.run(request, options);
/// }
/// ```
public final class ShutdownCancellation implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(ShutdownCancellation.class);
  private static final long DRAIN_TIMEOUT_SECONDS = 30;

  private final CountDownLatch finished = new CountDownLatch(1);
  private final Thread hook;

  private ShutdownCancellation(CancellationToken token) {
    this.hook = new Thread(() -> {
      logger.warn("Shutdown requested, cancelling generation");
      token.cancel();
      try {
        if (!finished.await(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          logger.error("Generation did not stop within {}s, output may end mid-line", DRAIN_TIMEOUT_SECONDS);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "graphgen-shutdown");
  }

  /// @param token the token to cancel on shutdown
  /// @return a registration to close when the work is done
  public static ShutdownCancellation register(CancellationToken token) {
    ShutdownCancellation registration = new ShutdownCancellation(token);
    Runtime.getRuntime().addShutdownHook(registration.hook);
    return registration;
  }

  @Override
  public void close() {
    finished.countDown();
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      logger.debug("JVM already shutting down, leaving hook in place");
    }
  }
}
