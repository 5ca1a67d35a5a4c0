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

/// What a {@link PlanRunner} does when an entry fails. There is deliberately no default;
/// every runner is constructed with an explicit policy.
public enum FailurePolicy {
  /// Stop at the first failed entry, cancel in-flight entries and skip the rest
  ABORT,
  /// Record the failure and carry on with the remaining entries
  CONTINUE
}
