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

import java.nio.file.Files;
import java.nio.file.Path;

/// The `-o` edge-list file of a generate command, with `-f` to replace an existing one.
public class OutputFileOption {

  @CommandLine.Option(names = {"-o", "--output"}, description = "The edge-list file to write", required = true)
  private Path outputPath;

  @CommandLine.Option(names = {"-f", "--force"}, description = "Force overwrite if output file already exists")
  private boolean force = false;

  /// @return the normalized output path; missing parent directories are created on write
  public Path getNormalizedOutputPath() {
    return outputPath.normalize();
  }

  /// @return true if the output exists and would be replaced without `--force`
  public boolean outputExistsWithoutForce() {
    return !force && Files.exists(outputPath);
  }

  @Override
  public String toString() {
    return force ? outputPath + " (force)" : String.valueOf(outputPath);
  }
}
