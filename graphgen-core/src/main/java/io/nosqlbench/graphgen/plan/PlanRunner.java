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

import io.nosqlbench.graphgen.api.CancellationToken;
import io.nosqlbench.graphgen.api.GenerationFailedException;
import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.generators.GenerationOptions;
import io.nosqlbench.graphgen.generators.GenerationRunner;
import io.nosqlbench.graphgen.random.RandomGenerators;
import io.nosqlbench.graphgen.random.RandomNodeSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/// Executes a {@link DatasetPlan} entry by entry and reports the files it produced.
///
/// Entries run sequentially unless more than one thread is configured. Entries share no
/// state and write disjoint files, so running them on a pool only changes scheduling.
/// Each entry gets its own random source; with a base seed `s`, entry `i` is seeded with
/// `s + i`, so outputs do not depend on the thread count.
public class PlanRunner {
  private static final Logger logger = LogManager.getLogger(PlanRunner.class);

  private final FailurePolicy failurePolicy;
  private GenerationRunner generationRunner = new GenerationRunner();
  private int threads = 1;
  private OptionalLong seed = OptionalLong.empty();
  private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;
  private CancellationToken cancellation = CancellationToken.create();

  /// @param failurePolicy what to do when an entry fails
  public PlanRunner(FailurePolicy failurePolicy) {
    this.failurePolicy = Objects.requireNonNull(failurePolicy, "failure policy must be chosen explicitly");
  }

  /// @param threads number of entries to run at once, at least 1
  /// @return this runner
  public PlanRunner threads(int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, but was " + threads);
    }
    this.threads = threads;
    return this;
  }

  /// @param seed base seed for reproducible plans
  /// @return this runner
  public PlanRunner seed(long seed) {
    this.seed = OptionalLong.of(seed);
    return this;
  }

  /// @param algorithm the PRNG algorithm for every entry
  /// @return this runner
  public PlanRunner algorithm(RandomGenerators.Algorithm algorithm) {
    this.algorithm = Objects.requireNonNull(algorithm);
    return this;
  }

  /// @param cancellation a token which cancels the whole plan
  /// @return this runner
  public PlanRunner cancellation(CancellationToken cancellation) {
    this.cancellation = Objects.requireNonNull(cancellation);
    return this;
  }

  /// @param generationRunner the runner used for each entry
  /// @return this runner
  public PlanRunner generationRunner(GenerationRunner generationRunner) {
    this.generationRunner = Objects.requireNonNull(generationRunner);
    return this;
  }

  /// Run every entry of the plan, then scan its base directory.
  /// @param plan the plan
  /// @return the report
  /// @throws PlanExecutionException with policy ABORT, when an entry fails
  public PlanReport run(DatasetPlan plan) {
    long start = System.nanoTime();
    List<PlanEntry> entries = plan.entries();
    logger.info("Running dataset plan with {} entries under {} ({} thread{}, on failure: {})",
        entries.size(), plan.baseDir(), threads, threads == 1 ? "" : "s", failurePolicy);

    RunState state = new RunState(cancellation.child());
    GenerationResult[] results = new GenerationResult[entries.size()];

    if (threads == 1) {
      for (int i = 0; i < entries.size(); i++) {
        if (state.stopped()) {
          break;
        }
        results[i] = runEntry(i, entries.get(i), state);
      }
    } else {
      runParallel(entries, results, state);
    }

    List<GenerationResult> completed = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (int i = 0; i < results.length; i++) {
      if (results[i] != null) {
        completed.add(results[i]);
      } else {
        skipped.add(entries.get(i).name());
      }
    }

    PlanReport report = new PlanReport(completed, skipped, OutputFileSize.scan(plan.baseDir()),
        Duration.ofNanos(System.nanoTime() - start));
    logReport(report);

    if (state.firstFailure.get() != null) {
      throw new PlanExecutionException(report, state.firstFailure.get());
    }
    return report;
  }

  private void runParallel(List<PlanEntry> entries, GenerationResult[] results, RunState state) {
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<GenerationResult>> futures = new ArrayList<>();
      for (int i = 0; i < entries.size(); i++) {
        final int index = i;
        futures.add(executor.submit(() -> state.stopped()
            ? null
            : runEntry(index, entries.get(index), state)));
      }
      for (int i = 0; i < futures.size(); i++) {
        try {
          results[i] = futures.get(i).get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          state.token.cancel();
          state.firstFailure.compareAndSet(null, e);
          break;
        } catch (ExecutionException e) {
          state.firstFailure.compareAndSet(null, e.getCause());
          state.token.cancel();
        }
      }
    } finally {
      executor.shutdownNow();
    }
  }

  private GenerationResult runEntry(int index, PlanEntry entry, RunState state) {
    RandomNodeSource random = seed.isPresent()
        ? RandomNodeSource.seeded(algorithm, RandomGenerators.entrySeed(seed.getAsLong(), index))
        : RandomNodeSource.unseeded(algorithm);
    GenerationOptions options = new GenerationOptions(random, state.token.child());
    try {
      return generationRunner.run(entry.request(), options);
    } catch (GenerationFailedException e) {
      if (failurePolicy == FailurePolicy.ABORT) {
        if (state.firstFailure.compareAndSet(null, e)) {
          logger.error("Aborting plan after failure of {} ({})", entry.name(), entry.tier());
          state.token.cancel();
        }
      } else {
        logger.warn("Entry {} ({}) failed, continuing with remaining entries", entry.name(), entry.tier());
      }
      return e.getResult();
    }
  }

  private void logReport(PlanReport report) {
    logger.info("Plan finished in {}ms: {} generated, {} failed, {} skipped",
        report.elapsed().toMillis(), report.results().size() - report.failures().size(),
        report.failures().size(), report.skipped().size());
    for (OutputFileSize file : report.files()) {
      logger.info("  {}", file);
    }
  }

  /// Shared by the entries of one run. Aborting cancels this run's token only, so the
  /// runner can be used again.
  private static final class RunState {
    private final CancellationToken token;
    private final AtomicReference<Throwable> firstFailure = new AtomicReference<>();

    private RunState(CancellationToken token) {
      this.token = token;
    }

    /// Entries not yet started are skipped after an abort or a cancellation.
    private boolean stopped() {
      return firstFailure.get() != null || token.isCancelled();
    }
  }
}
