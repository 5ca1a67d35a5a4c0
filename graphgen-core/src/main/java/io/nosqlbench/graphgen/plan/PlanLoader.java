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
import io.nosqlbench.graphgen.generators.ChainGenerator;
import io.nosqlbench.graphgen.generators.GraphGenerator;
import io.nosqlbench.graphgen.generators.GridGenerator;
import io.nosqlbench.graphgen.generators.ScaleFreeApproxGenerator;
import io.nosqlbench.graphgen.generators.StreamingRandomGenerator;
import io.nosqlbench.graphgen.generators.Topology;
import io.nosqlbench.graphgen.generators.UniformRandomGenerator;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/// Reads a {@link DatasetPlan} from YAML.
///
/// ```yaml
/// base_dir: data
/// entries:
///   - tier: small
///     name: random_1k
///     topology: random
///     nodes: 1000
///     edges: 5000
/// ```
///
/// Numbers may be YAML integers or strings with `_` separators, such as `"100_000_000"`.
/// A relative `path` on an entry is resolved against the base directory.
public class PlanLoader {
  private final static LoadSettings loadSettings = LoadSettings.builder().setLabel("graphgen plan").build();

  /// Load a plan file.
  /// @param planFile the YAML file
  /// @param baseDirOverride when non-null, replaces the file's `base_dir`
  /// @return the plan
  public static DatasetPlan load(Path planFile, Path baseDirOverride) {
    String yaml;
    try {
      yaml = Files.readString(planFile);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read plan file " + planFile, e);
    }
    return loadFromString(yaml, baseDirOverride);
  }

  /// Load a plan from YAML text.
  /// @param yaml the plan document
  /// @param baseDirOverride when non-null, replaces the document's `base_dir`
  /// @return the plan
  public static DatasetPlan loadFromString(String yaml, Path baseDirOverride) {
    Object document = new Load(loadSettings).loadFromString(yaml);
    if (!(document instanceof Map<?, ?> root)) {
      throw new InvalidGraphParameterException("plan document must be a map with an 'entries' list");
    }

    Path baseDir = baseDirOverride != null ? baseDirOverride
        : root.get("base_dir") != null ? Path.of(root.get("base_dir").toString())
        : DatasetPlan.DEFAULT_BASE_DIR;

    Object entries = root.get("entries");
    if (!(entries instanceof List<?> list)) {
      throw new InvalidGraphParameterException("plan must have an 'entries' list");
    }

    DatasetPlan.Builder builder = new DatasetPlan.Builder(baseDir);
    for (int i = 0; i < list.size(); i++) {
      if (!(list.get(i) instanceof Map<?, ?> entry)) {
        throw new InvalidGraphParameterException("plan entry #" + (i + 1) + " must be a map");
      }
      addEntry(builder, baseDir, new EntryFields(i + 1, entry));
    }
    return builder.build();
  }

  private static void addEntry(DatasetPlan.Builder builder, Path baseDir, EntryFields fields) {
    String name = fields.string("name");
    DatasetTier tier;
    Topology topology;
    try {
      tier = DatasetTier.fromName(fields.string("tier"));
      topology = Topology.fromName(fields.string("topology"));
    } catch (IllegalArgumentException e) {
      throw fields.invalid(e.getMessage());
    }

    GraphGenerator generator;
    try {
      generator = switch (topology) {
        case RANDOM -> new UniformRandomGenerator(fields.integer("nodes"), fields.number("edges"),
            fields.has("attempt_factor") ? fields.integer("attempt_factor")
                : UniformRandomGenerator.DEFAULT_ATTEMPT_FACTOR);
        case STREAMING -> new StreamingRandomGenerator(fields.integer("nodes"), fields.number("edges"),
            fields.has("strict") && fields.bool("strict"));
        case SCALE_FREE -> new ScaleFreeApproxGenerator(fields.integer("nodes"), fields.integer("degree"));
        case GRID -> new GridGenerator(fields.integer("rows"), fields.integer("cols"));
        case CHAIN -> new ChainGenerator(fields.integer("nodes"));
      };
    } catch (InvalidGraphParameterException e) {
      if (e.getMessage().startsWith("plan entry")) {
        throw e;
      }
      throw fields.invalid(e.getMessage());
    }

    if (fields.has("path")) {
      builder.add(tier, name, generator, baseDir.resolve(fields.string("path")));
    } else {
      builder.add(tier, name, generator);
    }
  }

  private static final class EntryFields {
    private final int position;
    private final Map<?, ?> values;

    private EntryFields(int position, Map<?, ?> values) {
      this.position = position;
      this.values = values;
    }

    boolean has(String key) {
      return values.get(key) != null;
    }

    String string(String key) {
      return require(key).toString();
    }

    long number(String key) {
      Object value = require(key);
      if (value instanceof Integer || value instanceof Long) {
        return ((Number) value).longValue();
      }
      if (value instanceof BigInteger big) {
        try {
          return big.longValueExact();
        } catch (ArithmeticException e) {
          throw invalid("'" + key + "' is out of range: " + value);
        }
      }
      if (value instanceof Number) {
        throw invalid("'" + key + "' must be an integer, but was '" + value + "'");
      }
      try {
        return Long.parseLong(value.toString().replace("_", "").trim());
      } catch (NumberFormatException e) {
        throw invalid("'" + key + "' must be an integer, but was '" + value + "'");
      }
    }

    int integer(String key) {
      long value = number(key);
      if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
        throw invalid("'" + key + "' is out of range: " + value);
      }
      return (int) value;
    }

    boolean bool(String key) {
      Object value = require(key);
      if (value instanceof Boolean b) {
        return b;
      }
      return Boolean.parseBoolean(value.toString());
    }

    Object require(String key) {
      Object value = values.get(key);
      if (value == null) {
        throw invalid("missing required key '" + key + "'");
      }
      return value;
    }

    InvalidGraphParameterException invalid(String message) {
      Object name = values.get("name");
      String label = name != null ? "'" + name + "'" : "#" + position;
      return new InvalidGraphParameterException("plan entry " + label + ": " + message);
    }
  }
}
