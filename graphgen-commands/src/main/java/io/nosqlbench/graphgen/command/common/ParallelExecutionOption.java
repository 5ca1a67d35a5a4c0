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

import picocli.CommandLine;

/// How many independent work items, such as plan entries, run at once.
///
/// Sequential unless `--parallel` or `--threads` is given. Auto-sizing keeps one core
/// free for the writer threads' I/O and the rest of the system.
public class ParallelExecutionOption {

  @CommandLine.Option(names = {"-p", "--parallel"},
      description = "Run entries in parallel on all but one CPU core")
  private boolean parallel = false;

  @CommandLine.Option(names = {"--threads"},
      description = "Run this many entries at once (overrides --parallel)")
  private Integer threads;

  /// @return the number of work items to run at once, at least 1
  public int threadCount() {
    if (threads != null) {
      return Math.max(1, threads);
    }
    return parallel ? Math.max(1, Runtime.getRuntime().availableProcessors() - 1) : 1;
  }

  /// @return true if an explicit `--threads` asks for more threads than there are cores
  public boolean oversubscribed() {
    return threads != null && threads > Runtime.getRuntime().availableProcessors();
  }
}
