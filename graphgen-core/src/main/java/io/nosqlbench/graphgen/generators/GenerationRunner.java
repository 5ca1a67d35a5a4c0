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
import io.nosqlbench.graphgen.api.GenerationCancelledException;
import io.nosqlbench.graphgen.api.GenerationFailedException;
import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.api.GenerationStatus;
import io.nosqlbench.graphgen.io.EdgeListWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Supplier;

/// Runs one {@link GenerationRequest}: opens the sink, drives the generator and turns the
/// way it ended into a {@link GenerationResult}.
///
/// - completed runs are `COMPLETE`, or `SHORTFALL` when the generator ran out of attempts
/// - cancelled runs keep their file, flushed up to the last complete line, as `CANCELLED`
/// - any other failure deletes the partial file and raises {@link GenerationFailedException}
public class GenerationRunner {
  private static final Logger logger = LogManager.getLogger(GenerationRunner.class);

  private final Supplier<EdgeSink> sinkFactory;

  /// Create a runner which writes plain-text edge lists.
  public GenerationRunner() {
    this(EdgeListWriter::new);
  }

  /// @param sinkFactory supplies a fresh, unopened sink for each run
  public GenerationRunner(Supplier<EdgeSink> sinkFactory) {
    this.sinkFactory = sinkFactory;
  }

  /// Generate one graph.
  /// @param request what to generate and where
  /// @param options random source and cancellation for this run
  /// @return the result, with status COMPLETE, SHORTFALL or CANCELLED
  /// @throws GenerationFailedException when the run fails; the partial file has been removed
  public GenerationResult run(GenerationRequest request, GenerationOptions options) {
    GraphGenerator generator = request.generator();
    Path output = request.output();
    logger.info("Generating {} ({}) -> {}", request.name(), generator, output);

    long start = System.nanoTime();
    EdgeSink sink = new ProgressLoggingSink(sinkFactory.get(), request.name(), generator.requestedEdges());
    GenerationOutcome outcome;
    try (sink) {
      sink.open(output, generator.header());
      outcome = generator.generate(sink, options);
    } catch (GenerationCancelledException e) {
      if (e.getSuppressed().length > 0) {
        throw fail(request, start, e.getSuppressed()[0], sink.path() != null);
      }
      GenerationResult result = new GenerationResult(
          request.name(), output, generator.header(), generator.requestedEdges(),
          e.getEdgesWritten(), 0, elapsedSince(start), GenerationStatus.CANCELLED, null);
      logger.warn("Cancelled {} after {} edges; {} holds a partial graph", request.name(),
          String.format("%,d", e.getEdgesWritten()), output);
      return result;
    } catch (RuntimeException e) {
      throw fail(request, start, e, sink.path() != null);
    }

    GenerationStatus status = outcome.budgetExhausted() ? GenerationStatus.SHORTFALL : GenerationStatus.COMPLETE;
    GenerationResult result = new GenerationResult(
        request.name(), output, generator.header(), generator.requestedEdges(),
        sink.edgesWritten(), outcome.attempts(), elapsedSince(start), status, null);

    if (status == GenerationStatus.SHORTFALL) {
      logger.warn("{}: wrote only {} of {} edges after {} attempts, graph may be too dense",
          request.name(), String.format("%,d", result.edgesWritten()),
          String.format("%,d", result.requestedEdges()), String.format("%,d", result.attempts()));
    }
    logger.info("Generated {}: {} edges in {}ms -> {}", request.name(),
        String.format("%,d", result.edgesWritten()), result.elapsed().toMillis(), output);
    return result;
  }

  private GenerationFailedException fail(GenerationRequest request, long start, Throwable cause, boolean opened) {
    Path output = request.output();
    try {
      if (opened && Files.deleteIfExists(output)) {
        logger.debug("Removed partial output {}", output);
      }
    } catch (IOException deleteError) {
      cause.addSuppressed(deleteError);
      logger.error("Could not remove partial output {}: {}", output, deleteError.getMessage());
    }
    GenerationResult failed = GenerationResult.failed(
        request.name(), output, request.generator().header(), elapsedSince(start), cause);
    logger.error("Failed to generate {}: {}", request.name(), cause.getMessage());
    return new GenerationFailedException(failed, cause);
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
