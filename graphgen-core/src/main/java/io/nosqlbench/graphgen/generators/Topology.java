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

import io.nosqlbench.graphgen.api.InvalidGraphParameterException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// The graph shapes this project can synthesize.
public enum Topology {
  /// Uniform random pairs with duplicate rejection and a bounded attempt budget
  RANDOM("random"),
  /// Uniform random pairs written immediately, without duplicate tracking
  STREAMING("streaming"),
  /// Every node links to one hub plus a fixed number of random targets
  SCALE_FREE("scale-free"),
  /// Row-major lattice with right and bottom neighbour edges
  GRID("grid"),
  /// A single path `0 -> 1 -> ... -> n-1`
  CHAIN("chain");

  private final String label;

  Topology(String label) {
    this.label = label;
  }

  /// @return the name used on the command line and in plan files
  public String label() {
    return label;
  }

  /// Look up a topology by its label or enum name, case-insensitively.
  /// @param name the label, such as `scale-free`, or the enum name, such as `SCALE_FREE`
  /// @return the topology
  /// @throws InvalidGraphParameterException for an unknown name
  public static Topology fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (Topology topology : values()) {
        if (topology.label.equals(normalized)) {
          return topology;
        }
      }
    }
    throw new InvalidGraphParameterException("unknown topology '" + name + "', expected one of "
        + Arrays.stream(values()).map(Topology::label).collect(Collectors.joining(", ")));
  }

  @Override
  public String toString() {
    return label;
  }
}
