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

import io.nosqlbench.graphgen.generators.ChainGenerator;
import io.nosqlbench.graphgen.generators.GenerationRequest;
import io.nosqlbench.graphgen.generators.GraphGenerator;
import io.nosqlbench.graphgen.generators.GridGenerator;
import io.nosqlbench.graphgen.generators.ScaleFreeApproxGenerator;
import io.nosqlbench.graphgen.generators.StreamingRandomGenerator;
import io.nosqlbench.graphgen.generators.UniformRandomGenerator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// An ordered catalogue of graphs to generate, grouped into tiers, rooted at a base directory.
///
/// {@link #standard(Path)} builds the benchmark corpus used by the graph algorithm suites.
/// {@link PlanLoader} builds plans from YAML.
public final class DatasetPlan {

  /// Default root for generated files.
  public static final Path DEFAULT_BASE_DIR = Path.of("data");

  private final Path baseDir;
  private final List<PlanEntry> entries;

  /// @param baseDir the directory the plan writes under
  /// @param entries the entries, in execution order
  public DatasetPlan(Path baseDir, List<PlanEntry> entries) {
    this.baseDir = baseDir;
    this.entries = List.copyOf(entries);
  }

  /// The standard small/medium/large/heavy corpus.
  ///
  /// The heavy tier holds 100M-node graphs, several GB each; its random graph uses the
  /// streaming generator because deduplicating 500M edges in memory is not practical.
  /// @param baseDir where to write, usually {@link #DEFAULT_BASE_DIR}
  /// @return the plan
  public static DatasetPlan standard(Path baseDir) {
    Builder b = new Builder(baseDir);

    b.add(DatasetTier.SMALL, "random_1k", new UniformRandomGenerator(1_000, 5_000));
    b.add(DatasetTier.SMALL, "random_10k", new UniformRandomGenerator(10_000, 50_000));
    b.add(DatasetTier.SMALL, "chain_10k", new ChainGenerator(10_000));

    b.add(DatasetTier.MEDIUM, "random_100k", new UniformRandomGenerator(100_000, 500_000));
    b.add(DatasetTier.MEDIUM, "scale_free_100k", new ScaleFreeApproxGenerator(100_000, 5));
    b.add(DatasetTier.MEDIUM, "grid_100k", new GridGenerator(316, 316));
    b.add(DatasetTier.MEDIUM, "chain_100k", new ChainGenerator(100_000));

    b.add(DatasetTier.LARGE, "random_1m", new UniformRandomGenerator(1_000_000, 5_000_000));
    b.add(DatasetTier.LARGE, "scale_free_1m", new ScaleFreeApproxGenerator(1_000_000, 5));

    b.add(DatasetTier.HEAVY, "random_100m", new StreamingRandomGenerator(100_000_000, 500_000_000L));
    b.add(DatasetTier.HEAVY, "scale_free_100m", new ScaleFreeApproxGenerator(100_000_000, 5));
    b.add(DatasetTier.HEAVY, "chain_100m", new ChainGenerator(100_000_000));
    b.add(DatasetTier.HEAVY, "grid_100m", new GridGenerator(10_000, 10_000));

    return b.build();
  }

  /// @return the standard corpus under {@link #DEFAULT_BASE_DIR}
  public static DatasetPlan standard() {
    return standard(DEFAULT_BASE_DIR);
  }

  /// Default location of an entry: `{baseDir}/{tier}/{name}.txt`.
  /// @param baseDir the plan root
  /// @param tier the entry tier
  /// @param name the entry name
  /// @return the output path
  public static Path defaultOutput(Path baseDir, DatasetTier tier, String name) {
    return baseDir.resolve(tier.label()).resolve(name + ".txt");
  }

  /// @param tiers the tiers to keep
  /// @return a plan with only the entries in the given tiers, in the original order
  public DatasetPlan onlyTiers(Collection<DatasetTier> tiers) {
    Set<DatasetTier> keep = tiers.isEmpty() ? EnumSet.noneOf(DatasetTier.class) : EnumSet.copyOf(tiers);
    return new DatasetPlan(baseDir,
        entries.stream().filter(e -> keep.contains(e.tier())).collect(Collectors.toList()));
  }

  /// @return the directory the plan writes under
  public Path baseDir() {
    return baseDir;
  }

  /// @return the entries, in execution order
  public List<PlanEntry> entries() {
    return entries;
  }

  /// @return true if there is nothing to generate
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return "DatasetPlan{" + baseDir + ", " + entries.size() + " entries}";
  }

  /// Accumulates entries which default to `{baseDir}/{tier}/{name}.txt`.
  public static final class Builder {
    private final Path baseDir;
    private final List<PlanEntry> entries = new ArrayList<>();

    /// @param baseDir the plan root
    public Builder(Path baseDir) {
      this.baseDir = baseDir;
    }

    /// @param tier the size class
    /// @param name the graph name, also the file stem
    /// @param generator the topology and parameters
    /// @return this builder
    public Builder add(DatasetTier tier, String name, GraphGenerator generator) {
      return add(tier, name, generator, defaultOutput(baseDir, tier, name));
    }

    /// @param tier the size class
    /// @param name the graph name
    /// @param generator the topology and parameters
    /// @param output an explicit output path
    /// @return this builder
    public Builder add(DatasetTier tier, String name, GraphGenerator generator, Path output) {
      entries.add(new PlanEntry(tier, new GenerationRequest(name, generator, output)));
      return this;
    }

    /// @return the plan
    public DatasetPlan build() {
      return new DatasetPlan(baseDir, entries);
    }
  }
}
