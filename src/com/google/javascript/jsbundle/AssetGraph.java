/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.jsbundle;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The graph of assets and the dependencies between them. Entry dependencies hang off an implicit
 * root; every other dependency belongs to the asset that declared it and resolves to zero or more
 * assets. Cycles are allowed.
 *
 * <p>The graph owns one {@link CommittedAsset} per asset id, which holds the memoized content of
 * that asset.
 */
public final class AssetGraph {
  private static final Logger logger = Logger.getLogger(AssetGraph.class.getName());

  static final DiagnosticType DEPENDENCY_NOT_RESOLVED =
      DiagnosticType.error(
          "JSB_DEPENDENCY_NOT_RESOLVED", "Failed to resolve ''{0}'' from ''{1}'': {2}");

  static final DiagnosticType OPTIONAL_DEPENDENCY_NOT_RESOLVED =
      DiagnosticType.warning(
          "JSB_OPTIONAL_DEPENDENCY_NOT_RESOLVED",
          "Optional dependency ''{0}'' from ''{1}'' was not resolved: {2}");

  private final BuildOptions options;
  private final ErrorManager errorManager;

  private final Map<String, Asset> assets = new LinkedHashMap<>();
  private final Map<String, Dependency> dependencies = new LinkedHashMap<>();
  private final Set<String> entryDependencyIds = new LinkedHashSet<>();
  private final Map<String, DependencyResolution> resolutions = new HashMap<>();
  // Asset id to the ids of the dependencies resolving to it.
  private final SetMultimap<String, String> incoming = LinkedHashMultimap.create();
  private final ConcurrentMap<String, CommittedAsset> committed = new ConcurrentHashMap<>();

  public AssetGraph(BuildOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public BuildOptions getOptions() {
    return options;
  }

  /** Adds a dependency hanging off the root of the graph. */
  public void addEntryDependency(Dependency dependency) {
    checkArgument(
        dependency.getSourceAssetId() == null,
        "Entry dependency %s must not belong to an asset",
        dependency);
    entryDependencyIds.add(dependency.getId());
    registerDependency(dependency);
  }

  /**
   * Integrates the result of transforming the target of {@code requestedBy}: commits the assets
   * and resolves {@code requestedBy} to them.
   *
   * @return the dependencies of the new assets that still need resolving
   */
  public ImmutableList<Dependency> addAssets(Dependency requestedBy, List<Asset> produced) {
    checkArgument(!produced.isEmpty(), "No assets produced for %s", requestedBy);
    ImmutableList<Dependency> added = commitAssets(produced);
    resolve(requestedBy, produced);
    return added;
  }

  /**
   * Registers assets, replacing any asset with the same id, and creates their dependencies.
   * Dependencies that already existed keep their resolution.
   *
   * @return the dependencies of these assets that are unresolved
   */
  public ImmutableList<Dependency> commitAssets(Iterable<Asset> produced) {
    ImmutableList.Builder<Dependency> unresolved = ImmutableList.builder();
    for (Asset asset : produced) {
      Asset previous = assets.put(asset.getId(), asset);
      if (previous != null) {
        committed.remove(asset.getId());
        Set<String> kept = new HashSet<>();
        for (Dependency dep : asset.getDependencies()) {
          kept.add(dep.getId());
        }
        for (Dependency old : previous.getDependencies()) {
          if (!kept.contains(old.getId())) {
            removeDependency(old.getId());
          }
        }
      }
      for (Dependency dep : asset.getDependencies()) {
        registerDependency(dep);
        if (resolutions.get(dep.getId()).getState() == DependencyResolution.State.UNRESOLVED) {
          unresolved.add(dep);
        }
      }
      logger.fine(() -> "Committed " + asset);
    }
    return unresolved.build();
  }

  private void registerDependency(Dependency dependency) {
    dependencies.put(dependency.getId(), dependency);
    resolutions.putIfAbsent(dependency.getId(), DependencyResolution.unresolved());
  }

  private void removeDependency(String dependencyId) {
    dependencies.remove(dependencyId);
    entryDependencyIds.remove(dependencyId);
    DependencyResolution resolution = resolutions.remove(dependencyId);
    if (resolution != null) {
      for (String assetId : resolution.getAssetIds()) {
        incoming.remove(assetId, dependencyId);
      }
    }
  }

  /** Binds {@code dependency} to {@code group}; the first asset is the primary one. */
  public void resolve(Dependency dependency, Iterable<Asset> group) {
    checkRegistered(dependency);
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (Asset asset : group) {
      checkArgument(assets.containsKey(asset.getId()), "Asset %s is not in the graph", asset);
      ids.add(asset.getId());
    }
    setResolution(dependency, DependencyResolution.resolved(ids.build()));
  }

  public void resolve(Dependency dependency, Asset asset) {
    resolve(dependency, ImmutableList.of(asset));
  }

  /** Marks {@code dependency} as deliberately left out of the build. */
  public void exclude(Dependency dependency) {
    checkRegistered(dependency);
    setResolution(dependency, DependencyResolution.excluded());
  }

  /**
   * Records that no resolver could resolve {@code dependency}. An optional dependency is treated
   * as excluded and reported as a warning.
   *
   * @throws UnresolvedDependencyException if the dependency is required
   */
  public void recordResolutionFailure(Dependency dependency, String reason)
      throws UnresolvedDependencyException {
    checkRegistered(dependency);
    String from = dependency.getSourcePath() == null ? "<entry>" : dependency.getSourcePath();
    if (!dependency.isOptional()) {
      Diagnostic error =
          Diagnostic.make(
              dependency.getLoc(),
              DEPENDENCY_NOT_RESOLVED,
              dependency.getSpecifier(),
              from,
              reason);
      errorManager.report(error);
      throw new UnresolvedDependencyException(dependency, error);
    }
    Diagnostic warning =
        Diagnostic.make(
            dependency.getLoc(),
            OPTIONAL_DEPENDENCY_NOT_RESOLVED,
            dependency.getSpecifier(),
            from,
            reason);
    errorManager.report(warning);
    setResolution(dependency, DependencyResolution.optionalFailed(warning));
  }

  private void setResolution(Dependency dependency, DependencyResolution resolution) {
    DependencyResolution previous = resolutions.put(dependency.getId(), resolution);
    if (previous != null) {
      for (String assetId : previous.getAssetIds()) {
        incoming.remove(assetId, dependency.getId());
      }
    }
    for (String assetId : resolution.getAssetIds()) {
      incoming.put(assetId, dependency.getId());
    }
  }

  private void checkRegistered(Dependency dependency) {
    checkArgument(
        dependencies.containsKey(dependency.getId()),
        "Dependency %s is not in the graph",
        dependency);
  }

  public @Nullable Asset getAsset(String id) {
    return assets.get(id);
  }

  public boolean hasAsset(Asset asset) {
    return assets.containsKey(asset.getId());
  }

  /** Every asset, in commit order. */
  public ImmutableList<Asset> getAssets() {
    return ImmutableList.copyOf(assets.values());
  }

  public @Nullable Dependency getDependency(String id) {
    return dependencies.get(id);
  }

  public ImmutableList<Dependency> getAllDependencies() {
    return ImmutableList.copyOf(dependencies.values());
  }

  public ImmutableList<Dependency> getEntryDependencies() {
    ImmutableList.Builder<Dependency> entries = ImmutableList.builder();
    for (String id : entryDependencyIds) {
      entries.add(dependencies.get(id));
    }
    return entries.build();
  }

  /** The dependencies declared by {@code asset}, in declaration order. */
  public ImmutableList<Dependency> getDependencies(Asset asset) {
    Asset committedAsset = assets.get(asset.getId());
    return committedAsset == null ? ImmutableList.of() : committedAsset.getDependencies();
  }

  /** The dependencies resolving to {@code asset}. */
  public ImmutableList<Dependency> getIncomingDependencies(Asset asset) {
    ImmutableList.Builder<Dependency> result = ImmutableList.builder();
    for (String id : incoming.get(asset.getId())) {
      result.add(dependencies.get(id));
    }
    return result.build();
  }

  public DependencyResolution getDependencyResolution(Dependency dependency) {
    DependencyResolution resolution = resolutions.get(dependency.getId());
    return resolution == null ? DependencyResolution.unresolved() : resolution;
  }

  /** The primary asset {@code dependency} resolved to, or null if it is not resolved. */
  public @Nullable Asset getResolvedAsset(Dependency dependency) {
    DependencyResolution resolution = getDependencyResolution(dependency);
    return resolution.isResolved() ? assets.get(resolution.getAssetIds().get(0)) : null;
  }

  /** Every asset {@code dependency} resolved to, primary first. */
  public ImmutableList<Asset> getDependencyAssets(Dependency dependency) {
    ImmutableList.Builder<Asset> result = ImmutableList.builder();
    for (String id : getDependencyResolution(dependency).getAssetIds()) {
      Asset asset = assets.get(id);
      if (asset != null) {
        result.add(asset);
      }
    }
    return result.build();
  }

  public boolean isDependencyExcluded(Dependency dependency) {
    return getDependencyResolution(dependency).isExcluded();
  }

  public ImmutableList<Dependency> getUnresolvedDependencies() {
    ImmutableList.Builder<Dependency> result = ImmutableList.builder();
    for (Dependency dep : dependencies.values()) {
      if (getDependencyResolution(dep).getState() == DependencyResolution.State.UNRESOLVED) {
        result.add(dep);
      }
    }
    return result.build();
  }

  /** Returns the content store of {@code asset}, creating it on first use. */
  public CommittedAsset getContent(Asset asset) {
    Asset committedAsset = assets.get(asset.getId());
    checkArgument(committedAsset != null, "Asset %s is not in the graph", asset);
    return committed.computeIfAbsent(
        committedAsset.getId(), id -> new CommittedAsset(committedAsset, options));
  }

  /**
   * Walks the graph depth-first from the entry dependencies. Dependencies lead to the assets they
   * resolved to; excluded and unresolved dependencies are leaves.
   */
  public <C> @Nullable C traverse(GraphVisitor<GraphNode, C> visitor) {
    ImmutableList.Builder<GraphNode> roots = ImmutableList.builder();
    for (Dependency entry : getEntryDependencies()) {
      roots.add(GraphNode.of(entry));
    }
    return GraphTraversal.traverse(
        roots.build(), this::getChildren, GraphNode::getKey, visitor, null);
  }

  /** Walks the part of the graph reachable from {@code start}. */
  public <C> @Nullable C traverse(GraphVisitor<GraphNode, C> visitor, Asset start) {
    return GraphTraversal.traverse(
        ImmutableList.of(GraphNode.of(start)), this::getChildren, GraphNode::getKey, visitor, null);
  }

  private ImmutableList<GraphNode> getChildren(GraphNode node) {
    ImmutableList.Builder<GraphNode> children = ImmutableList.builder();
    if (node.isAsset()) {
      for (Dependency dep : getDependencies(node.getAsset())) {
        children.add(GraphNode.of(dep));
      }
    } else {
      for (Asset asset : getDependencyAssets(node.getDependency())) {
        children.add(GraphNode.of(asset));
      }
    }
    return children.build();
  }

  /**
   * Returns the assets whose recorded inputs changed: a changed source file, a watched file,
   * environment variable or option, or a startup invalidation when {@code isStartup}.
   */
  public ImmutableSet<Asset> getInvalidatedAssets(
      Set<String> changedFiles,
      Set<String> changedEnvVars,
      Set<String> changedOptions,
      boolean isStartup) {
    ImmutableSet.Builder<Asset> result = ImmutableSet.builder();
    for (Asset asset : assets.values()) {
      if (changedFiles.contains(asset.getFilePath())
          || asset
              .getInvalidations()
              .isInvalidatedBy(changedFiles, changedEnvVars, changedOptions, isStartup)) {
        result.add(asset);
      }
    }
    return result.build();
  }

  /**
   * Removes an asset and the dependencies it declared. Dependencies that resolved to it go back to
   * the unresolved state.
   *
   * @return the dependencies that need resolving again
   */
  public ImmutableList<Dependency> removeAsset(String assetId) {
    Asset asset = assets.remove(assetId);
    if (asset == null) {
      return ImmutableList.of();
    }
    committed.remove(assetId);
    for (Dependency dep : asset.getDependencies()) {
      removeDependency(dep.getId());
    }
    ImmutableList.Builder<Dependency> orphaned = ImmutableList.builder();
    for (String depId : ImmutableList.copyOf(incoming.get(assetId))) {
      Dependency dep = dependencies.get(depId);
      setResolution(dep, DependencyResolution.unresolved());
      orphaned.add(dep);
    }
    logger.fine(() -> "Removed " + asset);
    return orphaned.build();
  }

  public int getAssetCount() {
    return assets.size();
  }

  public int getDependencyCount() {
    return dependencies.size();
  }
}
