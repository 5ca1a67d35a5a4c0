package io.nosqlbench.graphgen.command.generate;

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
import io.nosqlbench.graphgen.api.GenerationStatus;
import io.nosqlbench.graphgen.api.InvalidGraphParameterException;
import io.nosqlbench.graphgen.command.common.OutputFileOption;
import io.nosqlbench.graphgen.command.common.ShutdownCancellation;
import io.nosqlbench.graphgen.command.common.VerbosityOption;
import io.nosqlbench.graphgen.generators.GenerationOptions;
import io.nosqlbench.graphgen.generators.GenerationRequest;
import io.nosqlbench.graphgen.generators.GenerationRunner;
import io.nosqlbench.graphgen.generators.GraphGenerator;
import io.nosqlbench.graphgen.random.RandomNodeSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

/// Shared flow of the `generate` subcommands: refuse existing output without `--force`,
/// build the generator, run it and map the result to an exit code.
///
/// Subclasses contribute the topology options and {@link #createGenerator()}; random
/// topologies also override {@link #createRandomSource()}.
public abstract class GraphGenerationCommand implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(GraphGenerationCommand.class);

  /// Generation completed
  public static final int EXIT_SUCCESS = 0;
  /// Output exists without `--force`, or the graph is short or was cancelled
  public static final int EXIT_WARNING = 1;
  /// Invalid parameters or a failed run
  public static final int EXIT_ERROR = 2;

  @CommandLine.Mixin
  private OutputFileOption outputFileOption = new OutputFileOption();

  @CommandLine.Mixin
  private VerbosityOption verbosityOption = new VerbosityOption();

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// @return the generator for the parsed options
  /// @throws InvalidGraphParameterException when the options are out of range
  protected abstract GraphGenerator createGenerator();

  /// Deterministic topologies never draw from this source.
  /// @return the random source for this run
  protected RandomNodeSource createRandomSource() {
    return RandomNodeSource.seeded(0L);
  }

  /// @return true if the topology draws from the random source
  protected boolean isRandomized() {
    return false;
  }

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    try {
      verbosityOption.apply();
    } catch (IllegalStateException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }

    if (outputFileOption.outputExistsWithoutForce()) {
      err.println("Error: Output file already exists: " + outputFileOption.getNormalizedOutputPath()
          + ". Use --force to overwrite.");
      return EXIT_WARNING;
    }

    GraphGenerator generator;
    try {
      generator = createGenerator();
    } catch (InvalidGraphParameterException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }

    Path output = outputFileOption.getNormalizedOutputPath();
    String name = graphName(output);
    logger.debug("{}: {} -> {}", spec.qualifiedName(), generator, output);

    CancellationToken cancellation = CancellationToken.create();
    GenerationOptions options = new GenerationOptions(createRandomSource(), cancellation);
    GenerationResult result;
    try (ShutdownCancellation onExit = ShutdownCancellation.register(cancellation)) {
      result = new GenerationRunner().run(new GenerationRequest(name, generator, output), options);
    } catch (GenerationFailedException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }

    if (verbosityOption.showNormalOutput()) {
      out.println(result);
      if (isRandomized()) {
        OptionalLong seed = options.random().seed();
        out.println("Seed: " + (seed.isPresent() ? String.valueOf(seed.getAsLong()) : "auto (entropy)")
            + ", Algorithm: " + options.random().algorithm());
      }
    }
    return result.status() == GenerationStatus.COMPLETE ? EXIT_SUCCESS : EXIT_WARNING;
  }

  private static String graphName(Path output) {
    String fileName = output.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
