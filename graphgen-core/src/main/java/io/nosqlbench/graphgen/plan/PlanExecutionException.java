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

/// Raised by a {@link PlanRunner} using {@link FailurePolicy#ABORT} when an entry fails.
/// The report holds every result gathered up to that point.
public class PlanExecutionException extends RuntimeException {

  private final PlanReport report;

  /// @param report results so far, including the failed entry
  /// @param cause the failure of the first failed entry
  public PlanExecutionException(PlanReport report, Throwable cause) {
    super("dataset plan aborted: " + cause.getMessage(), cause);
    this.report = report;
  }

  /// @return results so far
  public PlanReport getReport() {
    return report;
  }
}
