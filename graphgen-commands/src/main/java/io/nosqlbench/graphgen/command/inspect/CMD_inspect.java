package io.nosqlbench.graphgen.command.inspect;

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

import io.nosqlbench.graphgen.io.EdgeListFormatException;
import io.nosqlbench.graphgen.io.EdgeListStats;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Summarize an edge-list file the way downstream loaders read it.
@CommandLine.Command(name = "inspect",
    description = "Print the header, edge count, node count and degree of an edge-list file",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:self-loops or duplicates found", "2:error"})
public class CMD_inspect implements Callable<Integer> {
  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Parameters(index = "0", description = "The edge-list file to inspect")
  private Path file;

  @CommandLine.Option(names = {"--check-duplicates"},
      description = "Also count repeated edges (holds every edge in memory)")
  private boolean checkDuplicates;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    if (!Files.isRegularFile(file)) {
      err.println("Error: Not a file: " + file);
      return EXIT_ERROR;
    }

    EdgeListStats stats;
    try {
      stats = EdgeListStats.of(file, checkDuplicates);
    } catch (EdgeListFormatException | UncheckedIOException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }

    out.println("File:       " + stats.path());
    out.println("Header:     " + stats.header().orElse("(none)"));
    out.printf("Edges:      %,d%n", stats.edges());
    out.printf("Nodes:      %,d%n", stats.nodes());
    out.printf("Avg degree: %.2f%n", stats.averageOutDegree());
    out.printf("Self-loops: %,d%n", stats.selfLoops());
    stats.duplicates().ifPresent(d -> out.printf("Duplicates: %,d%n", d));

    boolean clean = stats.selfLoops() == 0 && stats.duplicates().orElse(0L) == 0;
    return clean ? EXIT_SUCCESS : EXIT_WARNING;
  }
}
