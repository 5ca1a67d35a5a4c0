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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/// `-v` and `-q` flags, applied to the root log level.
///
/// Verbose shows DEBUG progress lines from long generations; quiet hides everything
/// below ERROR and suppresses the command's own summary output.
public class VerbosityOption {

  @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log progress and debug detail")
  private boolean verbose = false;

  @CommandLine.Option(names = {"-q", "--quiet"}, description = "Only report errors")
  private boolean quiet = false;

  /// @return true unless `--quiet` was given
  public boolean showNormalOutput() {
    return !quiet;
  }

  /// Set the root log level for this run.
  /// @throws IllegalStateException if both flags are given
  public void apply() {
    if (verbose && quiet) {
      throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
    }
    if (verbose) {
      Configurator.setRootLevel(Level.DEBUG);
    } else if (quiet) {
      Configurator.setRootLevel(Level.ERROR);
    }
  }
}
