package io.nosqlbench.graphgen.command.plan;

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
import io.nosqlbench.graphgen.api.GenerationResult;
import io.nosqlbench.graphgen.api.GenerationStatus;
import io.nosqlbench.graphgen.api.InvalidGraphParameterException;
import io.nosqlbench.graphgen.command.common.ParallelExecutionOption;
import io.nosqlbench.graphgen.command.common.RandomAlgorithmOption;
import io.nosqlbench.graphgen.command.common.RandomSeedOption;
import io.nosqlbench.graphgen.command.common.ShutdownCancellation;
import io.nosqlbench.graphgen.command.common.VerbosityOption;
import io.nosqlbench.graphgen.plan.DatasetPlan;
import io.nosqlbench.graphgen.plan.DatasetTier;
import io.nosqlbench.graphgen.plan.FailurePolicy;
import io.nosqlbench.graphgen.plan.OutputFileSize;
import io.nosqlbench.graphgen.plan.PlanEntry;
import io.nosqlbench.graphgen.plan.PlanExecutionException;
import io.nosqlbench.graphgen.plan.PlanLoader;
import io.nosqlbench.graphgen.plan.PlanReport;
import io.nosqlbench.graphgen.plan.PlanRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Generate a tiered corpus of graphs, either the standard benchmark corpus or one
/// described by a YAML plan file, and report the size of every file produced.
@CommandLine.Command(name = "plan",
    header = "Generate a tiered corpus of benchmark graphs",
    description = {"Without --plan-file, generates the standard corpus:",
        "  small:  random_1k, random_10k, chain_10k",
        "  medium: random_100k, scale_free_100k, grid_100k, chain_100k",
        "  large:  random_1m, scale_free_1m",
        "  heavy:  random_100m, scale_free_100m, chain_100m, grid_100m (several GB each)",
        "Each graph is written to {base-dir}/{tier}/{name}.txt. Existing files are replaced."},
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:warning (short or cancelled graphs)", "2:error"})
public class CMD_plan implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_plan.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Option(names = {"--base-dir"},
      description = "Root directory for generated files (default: the plan file's base_dir, or data)")
  private Path baseDir;

  @CommandLine.Option(names = {"--tiers"}, split = ",", converter = TierConverter.class,
      description = "Comma-separated tiers to generate: small, medium, large, heavy (default: all)")
  private List<DatasetTier> tiers;

  @CommandLine.Option(names = {"--plan-file"}, description = "YAML plan to run instead of the standard corpus")
  private Path planFile;

  @CommandLine.Option(names = {"--on-failure"}, converter = FailurePolicyConverter.class,
      description = "abort: stop at the first failed graph, continue: record it and go on (default: ${DEFAULT-VALUE})",
      defaultValue = "abort")
  private FailurePolicy failurePolicy = FailurePolicy.ABORT;

  @CommandLine.Option(names = {"--dry-run"}, description = "List the graphs which would be generated and exit")
  private boolean dryRun;

  @CommandLine.Mixin
  private ParallelExecutionOption parallelOption = new ParallelExecutionOption();

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private RandomAlgorithmOption algorithmOption = new RandomAlgorithmOption();

  @CommandLine.Mixin
  private VerbosityOption verbosityOption = new VerbosityOption();

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// Picocli converter for tier names.
  public static class TierConverter implements CommandLine.ITypeConverter<DatasetTier> {
    @Override
    public DatasetTier convert(String value) {
      try {
        return DatasetTier.fromName(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(e.getMessage());
      }
    }
  }

  /// Picocli converter for failure policies, case-insensitive.
  public static class FailurePolicyConverter implements CommandLine.ITypeConverter<FailurePolicy> {
    @Override
    public FailurePolicy convert(String value) {
      try {
        return FailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(
            "unknown failure policy '" + value + "', expected abort or continue");
      }
    }
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

    DatasetPlan plan;
    try {
      plan = planFile != null
          ? PlanLoader.load(planFile, baseDir)
          : DatasetPlan.standard(baseDir != null ? baseDir : DatasetPlan.DEFAULT_BASE_DIR);
    } catch (InvalidGraphParameterException | UncheckedIOException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }
    if (tiers != null && !tiers.isEmpty()) {
      plan = plan.onlyTiers(tiers);
    }

    if (dryRun) {
      for (PlanEntry entry : plan.entries()) {
        out.printf("%-7s %-18s %s -> %s%n", entry.tier().label(), entry.name(),
            entry.request().generator(), entry.request().output());
      }
      return EXIT_SUCCESS;
    }
    if (plan.isEmpty()) {
      err.println("Nothing to generate: the plan has no entries for the selected tiers");
      return EXIT_SUCCESS;
    }

    int threads = parallelOption.threadCount();
    if (parallelOption.oversubscribed()) {
      logger.warn("{} threads exceeds the {} available cores", threads, Runtime.getRuntime().availableProcessors());
    }

    CancellationToken cancellation = CancellationToken.create();
    PlanRunner runner = new PlanRunner(failurePolicy)
        .threads(threads)
        .algorithm(algorithmOption.getAlgorithm())
        .cancellation(cancellation);
    randomSeedOption.getSeedRecord().asOptional().ifPresent(runner::seed);

    PlanReport report;
    try (ShutdownCancellation onExit = ShutdownCancellation.register(cancellation)) {
      report = runner.run(plan);
    } catch (PlanExecutionException e) {
      printReport(out, e.getReport());
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }

    printReport(out, report);
    if (!report.failures().isEmpty()) {
      return EXIT_ERROR;
    }
    return report.allUsable() && report.withStatus(GenerationStatus.COMPLETE).size() == report.results().size()
        ? EXIT_SUCCESS : EXIT_WARNING;
  }

  private void printReport(PrintWriter out, PlanReport report) {
    if (!verbosityOption.showNormalOutput()) {
      return;
    }
    for (GenerationResult result : report.results()) {
      if (result.status() != GenerationStatus.COMPLETE) {
        out.println(result);
      }
    }
    for (String skipped : report.skipped()) {
      out.println(skipped + " [SKIPPED]");
    }
    out.println("Generated files:");
    for (OutputFileSize file : report.files()) {
      out.println("  " + file);
    }
    out.printf("Total: %.2f MB in %ds%n", report.totalBytes() / (1024.0 * 1024.0), report.elapsed().toSeconds());
  }
}
