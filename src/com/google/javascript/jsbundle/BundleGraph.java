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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The bundles of a build and the assets each of them contains, layered over the {@link
 * AssetGraph}. Nodes of the asset graph are referred to by id only.
 *
 * <p>This class answers queries. Bundlers change the graph through {@link MutableBundleGraph}.
 * Within the bundle graph each dependency resolves to an asset reachable without crossing a bundle
 * boundary, to a set of bundles, or to nothing when it is excluded.
 */
public class BundleGraph {

  final AssetGraph assetGraph;
  final Map<String, Bundle> bundles = new LinkedHashMap<>();
  // Bundle id to the ids of the assets it contains.
  final SetMultimap<String, String> bundleAssets = LinkedHashMultimap.create();
  // Bundle id to the ids of the dependencies it contains.
  final SetMultimap<String, String> bundleDependencies = LinkedHashMultimap.create();
  // Bundle id to the ids of the assets its contents were grown from.
  final SetMultimap<String, String> bundleRoots = LinkedHashMultimap.create();
  // Dependency id to the ids of the bundles it loads.
  final SetMultimap<String, String> dependencyBundles = LinkedHashMultimap.create();
  // Bundle id to the ids of the async dependencies resolved inside it.
  final SetMultimap<String, String> internalizedDependencies = LinkedHashMultimap.create();
  // Bundle id to the ids of the bundles it loads alongside itself.
  final SetMultimap<String, String> bundleReferences = LinkedHashMultimap.create();
  // Dependency id to the assets it refers to as separately loaded assets.
  final ListMultimap<String, AssetReference> assetReferences = ArrayListMultimap.create();

  private final SymbolResolver symbolResolver = new SymbolResolver(this);
  private final Map<String, String> publicIds = new HashMap<>();

  /** A reference from a dependency to an asset, optionally limited to one bundle. */
  record AssetReference(String assetId, @Nullable String bundleId) {}

  BundleGraph(AssetGraph assetGraph) {
    this.assetGraph = checkNotNull(assetGraph);
  }

  public AssetGraph getAssetGraph() {
    return assetGraph;
  }

  /** Every bundle, in creation order. */
  public ImmutableList<Bundle> getBundles() {
    return ImmutableList.copyOf(bundles.values());
  }

  public @Nullable Bundle getBundleById(String id) {
    return bundles.get(id);
  }

  public @Nullable Asset getAssetById(String id) {
    return assetGraph.getAsset(id);
  }

  /** The content store of {@code asset}. */
  public CommittedAsset getContent(Asset asset) {
    return assetGraph.getContent(asset);
  }

  public boolean hasAsset(Bundle bundle, Asset asset) {
    return bundleAssets.containsEntry(bundle.getId(), asset.getId());
  }

  public boolean hasDependency(Bundle bundle, Dependency dependency) {
    return bundleDependencies.containsEntry(bundle.getId(), dependency.getId());
  }

  /** The assets of {@code bundle}, in the order they were added. */
  public ImmutableList<Asset> getAssets(Bundle bundle) {
    return assetsById(bundleAssets.get(bundle.getId()));
  }

  public ImmutableList<Asset> getEntryAssets(Bundle bundle) {
    return assetsById(bundle.getEntryAssetIds());
  }

  public @Nullable Asset getMainEntry(Bundle bundle) {
    String id = bundle.getMainEntryId();
    return id == null ? null : assetGraph.getAsset(id);
  }

  private ImmutableList<Asset> assetsById(Iterable<String> ids) {
    ImmutableList.Builder<Asset> result = ImmutableList.builder();
    for (String id : ids) {
      Asset asset = assetGraph.getAsset(id);
      if (asset != null) {
        result.add(asset);
      }
    }
    return result.build();
  }

  public ImmutableList<Bundle> getBundlesWithAsset(Asset asset) {
    return bundlesMatching(bundle -> hasAsset(bundle, asset));
  }

  public ImmutableList<Bundle> getBundlesWithDependency(Dependency dependency) {
    return bundlesMatching(bundle -> hasDependency(bundle, dependency));
  }

  private ImmutableList<Bundle> bundlesMatching(Predicate<Bundle> predicate) {
    ImmutableList.Builder<Bundle> result = ImmutableList.builder();
    for (Bundle bundle : bundles.values()) {
      if (predicate.test(bundle)) {
        result.add(bundle);
      }
    }
    return result.build();
  }

  public ImmutableList<Dependency> getDependencies(Asset asset) {
    return assetGraph.getDependencies(asset);
  }

  public ImmutableList<Dependency> getIncomingDependencies(Asset asset) {
    return assetGraph.getIncomingDependencies(asset);
  }

  public boolean isDependencyExcluded(Dependency dependency) {
    return assetGraph.isDependencyExcluded(dependency);
  }

  public ImmutableList<Asset> getDependencyAssets(Dependency dependency) {
    return assetGraph.getDependencyAssets(dependency);
  }

  /**
   * Returns the asset {@code dependency} resolves to as seen from {@code bundle}: the target of an
   * asset reference made in that bundle if there is one, otherwise the asset it resolved to in the
   * asset graph.
   */
  public @Nullable Asset getResolvedAsset(Dependency dependency, @Nullable Bundle bundle) {
    for (AssetReference reference : assetReferences.get(dependency.getId())) {
      if (reference.bundleId() == null
          || (bundle != null && reference.bundleId().equals(bundle.getId()))) {
        return assetGraph.getAsset(reference.assetId());
      }
    }
    return assetGraph.getResolvedAsset(dependency);
  }

  /** The bundles loaded by {@code dependency}, empty if it resolves within its bundle. */
  public ImmutableList<Bundle> getResolvedBundles(Dependency dependency) {
    ImmutableList.Builder<Bundle> result = ImmutableList.builder();
    for (String id : dependencyBundles.get(dependency.getId())) {
      result.add(bundles.get(id));
    }
    return result.build();
  }

  /**
   * The bundles {@code dependency} loads when it is reached from {@code bundle}. Empty if the
   * dependency is excluded or was internalized into {@code bundle}.
   */
  public ImmutableList<Bundle> getResolvedBundles(Dependency dependency, Bundle bundle) {
    if (isDependencyExcluded(dependency) || isInternalized(bundle, dependency)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Bundle> result = ImmutableList.builder();
    for (String id : dependencyBundles.get(dependency.getId())) {
      if (!id.equals(bundle.getId())) {
        result.add(bundles.get(id));
      }
    }
    return result.build();
  }

  /**
   * The bundle {@code dependency} refers to from {@code bundle}, or null if it loads none. A bundle
   * written to its own file is preferred over an inline one.
   */
  public @Nullable Bundle getReferencedBundle(Dependency dependency, Bundle bundle) {
    ImmutableList<Bundle> resolved = getResolvedBundles(dependency, bundle);
    for (Bundle candidate : resolved) {
      if (!candidate.isInline()) {
        return candidate;
      }
    }
    return Iterables.getFirst(resolved, null);
  }

  /**
   * Returns the entry bundles and the lazily loaded bundles that load {@code bundle}, following
   * synchronous references upwards. A bundle that is itself an entry or lazily loaded is its own
   * answer.
   */
  public ImmutableList<Bundle> getReferencingEntryOrAsyncBundles(Bundle bundle) {
    Set<Bundle> result = new LinkedHashSet<>();
    Set<Bundle> seen = new HashSet<>();
    Deque<Bundle> queue = new ArrayDeque<>();
    queue.add(bundle);
    while (!queue.isEmpty()) {
      Bundle current = queue.remove();
      if (!seen.add(current)) {
        continue;
      }
      if (current.isEntry() || !getReferencingBundles(current, ReferenceType.ASYNC).isEmpty()) {
        result.add(current);
        continue;
      }
      queue.addAll(getReferencingBundles(current, ReferenceType.SYNC));
    }
    return ImmutableList.copyOf(result);
  }

  public boolean isInternalized(Bundle bundle, Dependency dependency) {
    return internalizedDependencies.containsEntry(bundle.getId(), dependency.getId());
  }

  /**
   * Returns the bundles {@code bundle} loads, through its dependencies or through explicit bundle
   * references, in insertion order. Lazy dependencies make {@link ReferenceType#ASYNC}
   * references; everything else is {@link ReferenceType#SYNC}.
   *
   * @param type only return references of this type, or all if null
   */
  public ImmutableList<Bundle> getReferencedBundles(Bundle bundle, @Nullable ReferenceType type) {
    Set<Bundle> result = new LinkedHashSet<>();
    for (String depId : bundleDependencies.get(bundle.getId())) {
      Dependency dep = assetGraph.getDependency(depId);
      if (dep == null || isInternalized(bundle, dep) || isDependencyExcluded(dep)) {
        continue;
      }
      ReferenceType referenceType = dep.isAsync() ? ReferenceType.ASYNC : ReferenceType.SYNC;
      if (type != null && type != referenceType) {
        continue;
      }
      for (String id : dependencyBundles.get(depId)) {
        if (!id.equals(bundle.getId())) {
          result.add(bundles.get(id));
        }
      }
    }
    if (type == null || type == ReferenceType.SYNC) {
      for (String id : bundleReferences.get(bundle.getId())) {
        result.add(bundles.get(id));
      }
    }
    return ImmutableList.copyOf(result);
  }

  /** Returns the bundles that load {@code bundle}, in bundle creation order. */
  public ImmutableList<Bundle> getReferencingBundles(Bundle bundle, @Nullable ReferenceType type) {
    return bundlesMatching(
        candidate ->
            candidate != bundle && getReferencedBundles(candidate, type).contains(bundle));
  }

  /**
   * Whether {@code asset} is guaranteed to be loaded whenever {@code bundle} is: every bundle that
   * loads {@code bundle} has the same environment context and either contains the asset or has
   * it reachable in turn. A bundle nothing loads, or one running in an isolated context, reaches
   * nothing.
   */
  public boolean isAssetReachableFromBundle(Asset asset, Bundle bundle) {
    return isReachable(asset, bundle, new HashSet<>());
  }

  private boolean isReachable(Asset asset, Bundle bundle, Set<String> path) {
    if (isIsolated(bundle)) {
      return false;
    }
    ImmutableList<Bundle> parents = getReferencingBundles(bundle, null);
    if (parents.isEmpty()) {
      return false;
    }
    path.add(bundle.getId());
    try {
      for (Bundle parent : parents) {
        if (parent.getEnv().getContext() != bundle.getEnv().getContext()) {
          return false;
        }
        if (hasAsset(parent, asset)) {
          continue;
        }
        if (path.contains(parent.getId()) || !isReachable(asset, parent, path)) {
          return false;
        }
      }
      return true;
    } finally {
      path.remove(bundle.getId());
    }
  }

  private boolean isIsolated(Bundle bundle) {
    if (bundle.getEnv().isIsolated()) {
      return true;
    }
    Asset main = getMainEntry(bundle);
    return main != null && main.getBundleBehavior() == BundleBehavior.ISOLATED;
  }

  /**
   * Returns the nearest bundle loading {@code bundle}, directly or transitively, that contains
   * {@code asset} and runs in the same context, or null.
   */
  public @Nullable Bundle getReachableBundleWithAsset(Bundle bundle, Asset asset) {
    Set<String> seen = new HashSet<>();
    seen.add(bundle.getId());
    Deque<Bundle> queue = new ArrayDeque<>(getReferencingBundles(bundle, null));
    while (!queue.isEmpty()) {
      Bundle candidate = queue.remove();
      if (!seen.add(candidate.getId())
          || candidate.getEnv().getContext() != bundle.getEnv().getContext()) {
        continue;
      }
      if (hasAsset(candidate, asset)) {
        return candidate;
      }
      queue.addAll(getReferencingBundles(candidate, null));
    }
    return null;
  }

  /**
   * Whether code outside {@code bundle} uses {@code asset}: another bundle of the same target also
   * contains it, an asset reference made outside the bundle points to it, or a dependency
   * contained in another bundle that lacks the asset resolves to it.
   */
  public boolean isAssetReferenced(Bundle bundle, Asset asset) {
    for (Bundle other : getBundlesWithAsset(asset)) {
      if (other != bundle
          && other.getTarget().getDistDir().equals(bundle.getTarget().getDistDir())) {
        return true;
      }
    }
    for (Map.Entry<String, AssetReference> entry : assetReferences.entries()) {
      AssetReference reference = entry.getValue();
      if (!reference.assetId().equals(asset.getId())) {
        continue;
      }
      String scope = reference.bundleId();
      if (scope != null
          ? !scope.equals(bundle.getId())
          : !bundleDependencies.containsEntry(bundle.getId(), entry.getKey())) {
        return true;
      }
    }
    for (Dependency dep : getIncomingDependencies(asset)) {
      if (isDependencyExcluded(dep)) {
        continue;
      }
      for (Bundle other : getBundlesWithDependency(dep)) {
        if (other != bundle && !hasAsset(other, asset)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Walks the whole asset graph from its entry dependencies. */
  public <C> @Nullable C traverse(GraphVisitor<GraphNode, C> visitor) {
    return assetGraph.traverse(visitor);
  }

  /**
   * Walks the contents of {@code bundle} from the assets it was grown from. Dependencies
   * contained in the bundle are visited; only those resolving inside the bundle lead on.
   */
  public <C> @Nullable C traverse(Bundle bundle, GraphVisitor<GraphNode, C> visitor) {
    Set<String> rootIds = new LinkedHashSet<>(bundle.getEntryAssetIds());
    rootIds.addAll(bundleRoots.get(bundle.getId()));
    List<GraphNode> roots = new ArrayList<>();
    for (Asset asset : assetsById(rootIds)) {
      if (hasAsset(bundle, asset)) {
        roots.add(GraphNode.of(asset));
      }
    }
    return GraphTraversal.traverse(
        roots, node -> getChildrenInBundle(bundle, node), GraphNode::getKey, visitor, null);
  }

  private ImmutableList<GraphNode> getChildrenInBundle(Bundle bundle, GraphNode node) {
    ImmutableList.Builder<GraphNode> children = ImmutableList.builder();
    if (node.isAsset()) {
      for (Dependency dep : getDependencies(node.getAsset())) {
        if (hasDependency(bundle, dep)) {
          children.add(GraphNode.of(dep));
        }
      }
      return children.build();
    }
    Dependency dep = node.getDependency();
    if (dep.crossesBundleBoundary() && !isInternalized(bundle, dep)) {
      return ImmutableList.of();
    }
    for (Asset asset : getDependencyAssets(dep)) {
      if (hasAsset(bundle, asset)) {
        children.add(GraphNode.of(asset));
      }
    }
    return children.build();
  }

  /** Like {@link #traverse(Bundle, GraphVisitor)}, calling the visitor for assets only. */
  public <C> @Nullable C traverseAssets(Bundle bundle, GraphVisitor<Asset, C> visitor) {
    return traverse(
        bundle,
        new GraphVisitor<GraphNode, C>() {
          @Override
          public @Nullable C enter(GraphNode node, @Nullable C context, TraversalActions actions) {
            return node.isAsset() ? visitor.enter(node.getAsset(), context, actions) : null;
          }

          @Override
          public @Nullable C exit(GraphNode node, @Nullable C context, TraversalActions actions) {
            return node.isAsset() ? visitor.exit(node.getAsset(), context, actions) : null;
          }
        });
  }

  /**
   * Walks bundles along their references. Starts at {@code start}, or at the bundles nothing
   * loads followed by every other bundle not reached from them.
   */
  public <C> @Nullable C traverseBundles(GraphVisitor<Bundle, C> visitor, @Nullable Bundle start) {
    Iterable<Bundle> roots;
    if (start != null) {
      roots = ImmutableList.of(start);
    } else {
      List<Bundle> unreferenced = new ArrayList<>();
      for (Bundle bundle : bundles.values()) {
        if (getReferencingBundles(bundle, null).isEmpty()) {
          unreferenced.add(bundle);
        }
      }
      roots = Iterables.concat(unreferenced, ImmutableList.copyOf(bundles.values()));
    }
    return GraphTraversal.traverse(
        roots, bundle -> getReferencedBundles(bundle, null), Bundle::getId, visitor, null);
  }

  public <C> @Nullable C traverseBundles(GraphVisitor<Bundle, C> visitor) {
    return traverseBundles(visitor, null);
  }

  /**
   * The assets and dependencies that adding {@code asset} to a bundle pulls in: the closure over
   * dependencies that are neither excluded, skipped, nor crossing a bundle boundary, stopping at
   * assets that get their own bundle.
   */
  AssetSubgraph collectAssetGraph(Asset asset, Predicate<Dependency> skipDependency) {
    List<Asset> assets = new ArrayList<>();
    List<Dependency> dependencies = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    Deque<Asset> stack = new ArrayDeque<>();
    stack.push(asset);
    while (!stack.isEmpty()) {
      Asset current = stack.pop();
      if (!visited.add(current.getId())) {
        continue;
      }
      assets.add(current);
      List<Asset> children = new ArrayList<>();
      for (Dependency dep : getDependencies(current)) {
        if (isDependencyExcluded(dep) || skipDependency.test(dep)) {
          continue;
        }
        dependencies.add(dep);
        if (dep.crossesBundleBoundary()) {
          continue;
        }
        for (Asset child : getDependencyAssets(dep)) {
          if (child.getBundleBehavior() == BundleBehavior.NONE) {
            children.add(child);
          }
        }
      }
      // Reversed so that children are popped in declaration order.
      for (Asset child : ImmutableList.copyOf(children).reverse()) {
        stack.push(child);
      }
    }
    return new AssetSubgraph(ImmutableList.copyOf(assets), ImmutableList.copyOf(dependencies));
  }

  /** The assets and dependencies reachable from an asset within one bundle. */
  record AssetSubgraph(ImmutableList<Asset> assets, ImmutableList<Dependency> dependencies) {}

  /** The total size of the assets that adding {@code asset} to a bundle would pull in. */
  public long getSizeOfAssetGraph(Asset asset) {
    long size = 0;
    for (Asset member : collectAssetGraph(asset, dep -> false).assets()) {
      size += member.getStats().size();
    }
    return size;
  }

  public long getTotalSize(Bundle bundle) {
    long size = 0;
    for (Asset asset : getAssets(bundle)) {
      size += asset.getStats().size();
    }
    return size;
  }

  /**
   * Returns the shortest prefix of the asset's id, at least five characters long, that no other
   * asset id in the graph starts with. Used to name assets in packaged code.
   */
  public String getAssetPublicId(Asset asset) {
    return publicIds.computeIfAbsent(asset.getId(), this::computePublicId);
  }

  private String computePublicId(String id) {
    List<String> others = new ArrayList<>();
    for (Asset other : assetGraph.getAssets()) {
      if (!other.getId().equals(id)) {
        others.add(other.getId());
      }
    }
    for (int length = Math.min(5, id.length()); length < id.length(); length++) {
      String prefix = id.substring(0, length);
      if (others.stream().noneMatch(other -> other.startsWith(prefix))) {
        return prefix;
      }
    }
    return id;
  }

  /**
   * Resolves {@code exportSymbol} of {@code asset} through re-exports to the asset defining it.
   *
   * @param boundary if not null, resolution does not leave this bundle
   */
  public SymbolResolution getSymbolResolution(
      Asset asset, String exportSymbol, @Nullable Bundle boundary) {
    return symbolResolver.resolve(asset, exportSymbol, boundary);
  }

  public SymbolResolution getSymbolResolution(Asset asset, String exportSymbol) {
    return getSymbolResolution(asset, exportSymbol, null);
  }

  /**
   * Resolves a name imported through {@code dependency}.
   *
   * @return null if the dependency does not resolve to an asset
   */
  public @Nullable SymbolResolution resolveImportedSymbol(
      Dependency dependency, String exportSymbol, @Nullable Bundle boundary) {
    Asset resolved = getResolvedAsset(dependency, boundary);
    return resolved == null ? null : getSymbolResolution(resolved, exportSymbol, boundary);
  }

  /** Every name {@code asset} exports, including through {@code export *}, with its resolution. */
  public ImmutableList<ExportSymbolResolution> getExportedSymbols(
      Asset asset, @Nullable Bundle boundary) {
    return symbolResolver.getExportedSymbols(asset, boundary);
  }

  public ImmutableList<ExportSymbolResolution> getExportedSymbols(Asset asset) {
    return getExportedSymbols(asset, null);
  }

  /** Describes the bundles and their contents, for debugging and build reports. */
  public JsonArray toJson() {
    JsonArray result = new JsonArray();
    for (Bundle bundle : bundles.values()) {
      JsonObject node = new JsonObject();
      node.add("id", new JsonPrimitive(bundle.getId()));
      node.add("type", new JsonPrimitive(bundle.getType()));
      if (bundle.getFilePath() != null) {
        node.add("filePath", new JsonPrimitive(bundle.getFilePath()));
      }
      JsonArray entries = new JsonArray();
      node.add("entries", entries);
      for (Asset asset : getEntryAssets(bundle)) {
        entries.add(new JsonPrimitive(asset.getFilePath()));
      }
      JsonArray assets = new JsonArray();
      node.add("assets", assets);
      for (Asset asset : getAssets(bundle)) {
        assets.add(new JsonPrimitive(asset.getFilePath()));
      }
      JsonArray referenced = new JsonArray();
      node.add("referencedBundles", referenced);
      for (Bundle other : getReferencedBundles(bundle, null)) {
        referenced.add(new JsonPrimitive(other.getId()));
      }
      result.add(node);
    }
    return result;
  }
}
