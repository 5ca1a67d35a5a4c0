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

import io.nosqlbench.graphgen.api.InvalidGraphParameterException;

import java.util.Locale;

/// Size classes of the benchmark corpus. Each tier is written to its own sub-directory.
public enum DatasetTier {
  SMALL,
  MEDIUM,
  LARGE,
  HEAVY;

  /// @return the lower-case name used for directories and on the command line
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /// @param name a tier name in any case
  /// @return the tier
  /// @throws InvalidGraphParameterException for an unknown name
  public static DatasetTier fromName(String name) {
    if (name != null) {
      for (DatasetTier tier : values()) {
        if (tier.name().equalsIgnoreCase(name.trim())) {
          return tier;
        }
      }
    }
    throw new InvalidGraphParameterException("unknown tier '" + name + "', expected small, medium, large or heavy");
  }

  @Override
  public String toString() {
    return label();
  }
}
