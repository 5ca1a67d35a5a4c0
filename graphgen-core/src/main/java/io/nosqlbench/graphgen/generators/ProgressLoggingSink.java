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

import io.nosqlbench.graphgen.api.EdgeSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/// Decorates a sink with debug-level progress lines, roughly every 10% of the expected
/// edge count, or every {@value #UNBOUNDED_INTERVAL} edges when no count is known.
class ProgressLoggingSink implements EdgeSink {
  private static final Logger logger = LogManager.getLogger(ProgressLoggingSink.class);

  static final long UNBOUNDED_INTERVAL = 10_000_000L;
  private static final long MIN_INTERVAL = 1_000L;

  private final EdgeSink delegate;
  private final String name;
  private final long expected;
  private final long interval;

  ProgressLoggingSink(EdgeSink delegate, String name, long expected) {
    this.delegate = delegate;
    this.name = name;
    this.expected = expected;
    this.interval = expected > 0 ? Math.max(expected / 10, MIN_INTERVAL) : UNBOUNDED_INTERVAL;
  }

  @Override
  public void open(Path path, String header) {
    delegate.open(path, header);
  }

  @Override
  public void writeEdge(int src, int dst) {
    delegate.writeEdge(src, dst);
    long written = delegate.edgesWritten();
    if (written % interval == 0 && logger.isDebugEnabled()) {
      if (expected > 0) {
        logger.debug("{}: wrote {} of {} edges ({}%)", name, String.format("%,d", written),
            String.format("%,d", expected), String.format("%.1f", (double) written / expected * 100));
      } else {
        logger.debug("{}: wrote {} edges", name, String.format("%,d", written));
      }
    }
  }

  @Override
  public long edgesWritten() {
    return delegate.edgesWritten();
  }

  @Override
  public Path path() {
    return delegate.path();
  }

  @Override
  public void flush() {
    delegate.flush();
  }

  @Override
  public void close() {
    delegate.close();
  }
}
