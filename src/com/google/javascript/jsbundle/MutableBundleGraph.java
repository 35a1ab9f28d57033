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
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Predicate;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The view of a {@link BundleGraph} a {@link Bundler} works on. Once the bundling phase is over
 * the graph is sealed and every mutator throws {@link IllegalStateException}.
 */
public final class MutableBundleGraph extends BundleGraph {
  private static final Logger logger = Logger.getLogger(MutableBundleGraph.class.getName());

  private boolean sealed = false;

  private MutableBundleGraph(AssetGraph assetGraph) {
    super(assetGraph);
  }

  /** Creates an empty bundle graph over {@code assetGraph}. */
  public static MutableBundleGraph fromAssetGraph(AssetGraph assetGraph) {
    return new MutableBundleGraph(assetGraph);
  }

  /**
   * Creates a bundle with no assets, or returns the bundle previously created with the same
   * identity.
   *
   * @throws IllegalArgumentException if no entry asset is given and the unique key, type or
   *     environment is missing
   */
  @CanIgnoreReturnValue
  public Bundle createBundle(CreateBundleOptions options) {
    checkMutable();
    Asset entry = options.getEntryAsset();
    String type = options.getType();
    Environment env = options.getEnv();
    String key = options.getUniqueKey();
    boolean splittable;
    if (entry != null) {
      checkArgument(assetGraph.hasAsset(entry), "Unknown entry asset %s", entry);
      type = type != null ? type : entry.getType();
      env = env != null ? env : entry.getEnv();
      key = key != null ? key : entry.getId();
      splittable =
          options.getSplittable() != null ? options.getSplittable() : entry.isBundleSplittable();
    } else {
      checkArgument(key != null, "A bundle without an entry asset needs a unique key");
      checkArgument(type != null, "A bundle without an entry asset needs a type");
      checkArgument(env != null, "A bundle without an entry asset needs an environment");
      splittable = options.getSplittable() == null || options.getSplittable();
    }

    String id =
        Ids.digest(key, options.getTarget().getDistDir(), options.isInline() ? "inline" : "");
    Bundle existing = bundles.get(id);
    if (existing != null) {
      return existing;
    }
    String pipeline = options.getPipeline();
    if (pipeline == null && entry != null) {
      pipeline = entry.getPipeline();
    }
    Bundle bundle =
        new Bundle(
            id,
            type,
            env,
            options.getTarget(),
            options.isEntry(),
            options.isInline(),
            splittable,
            pipeline);
    if (entry != null) {
      bundle.addEntryAssetId(entry.getId());
    }
    bundles.put(id, bundle);
    logger.fine("Created bundle " + bundle);
    return bundle;
  }

  /** Removes {@code bundle} and everything recorded about it. */
  public void removeBundle(Bundle bundle) {
    checkMutable();
    checkBundle(bundle);
    String id = bundle.getId();
    bundles.remove(id);
    bundleAssets.removeAll(id);
    bundleDependencies.removeAll(id);
    bundleRoots.removeAll(id);
    internalizedDependencies.removeAll(id);
    bundleReferences.removeAll(id);
    bundleReferences.values().removeIf(id::equals);
    dependencyBundles.values().removeIf(id::equals);
    assetReferences.values().removeIf(reference -> id.equals(reference.bundleId()));
  }

  /**
   * Adds {@code asset} and everything it pulls in to {@code bundle}: assets reached through
   * dependencies that are not excluded and do not cross a bundle boundary, stopping at isolated
   * and inline assets. Adding an asset twice has no further effect.
   */
  public void addAssetGraphToBundle(Asset asset, Bundle bundle) {
    addAssetGraphToBundle(asset, bundle, dep -> false);
  }

  /**
   * Like {@link #addAssetGraphToBundle(Asset, Bundle)}, leaving out dependencies matching {@code
   * skipDependency} and what only they lead to.
   */
  public void addAssetGraphToBundle(
      Asset asset, Bundle bundle, Predicate<Dependency> skipDependency) {
    checkMutable();
    checkBundle(bundle);
    checkArgument(assetGraph.hasAsset(asset), "Unknown asset %s", asset);
    bundleRoots.put(bundle.getId(), asset.getId());
    AssetSubgraph subgraph = collectAssetGraph(asset, skipDependency);
    for (Asset member : subgraph.assets()) {
      bundleAssets.put(bundle.getId(), member.getId());
    }
    for (Dependency dep : subgraph.dependencies()) {
      bundleDependencies.put(bundle.getId(), dep.getId());
    }
  }

  /**
   * Removes {@code asset} and what it pulls in from {@code bundle}, even assets that other assets
   * of the bundle also pull in. Bundlers use this to move shared assets into a bundle of their
   * own.
   */
  public void removeAssetGraphFromBundle(Asset asset, Bundle bundle) {
    checkMutable();
    checkBundle(bundle);
    String id = bundle.getId();
    AssetSubgraph removed = collectAssetGraph(asset, dep -> false);
    for (Asset member : removed.assets()) {
      bundleAssets.remove(id, member.getId());
      bundleRoots.remove(id, member.getId());
      bundle.removeEntryAssetId(member.getId());
    }
    for (Dependency dep : removed.dependencies()) {
      bundleDependencies.remove(id, dep.getId());
      internalizedDependencies.remove(id, dep.getId());
    }
  }

  /** Makes {@code asset} an entry of {@code bundle} and adds its asset graph. */
  public void addEntryToBundle(Asset asset, Bundle bundle) {
    checkMutable();
    checkBundle(bundle);
    bundle.addEntryAssetId(asset.getId());
    addAssetGraphToBundle(asset, bundle);
  }

  /** Records that {@code dependency} loads {@code bundle}. */
  public void addBundleReference(Dependency dependency, Bundle bundle) {
    checkMutable();
    checkBundle(bundle);
    checkArgument(
        assetGraph.getDependency(dependency.getId()) != null, "Unknown dependency %s", dependency);
    dependencyBundles.put(dependency.getId(), bundle.getId());
  }

  /** Records that {@code to} must be loaded together with {@code from}. */
  public void createBundleReference(Bundle from, Bundle to) {
    checkMutable();
    checkBundle(from);
    checkBundle(to);
    checkArgument(from != to, "A bundle cannot reference itself: %s", from);
    bundleReferences.put(from.getId(), to.getId());
  }

  /**
   * Records that the dependency refers to an asset that is loaded separately, such as a URL
   * dependency. The bundle the reference is made from may be given as {@code ofBundle} or {@code
   * inBundle}; without one the reference holds in every bundle.
   *
   * @throws ReferenceConflictException if both bundles are given and differ
   * @throws IllegalArgumentException if the bundle does not contain the dependency
   */
  public void createAssetReference(ReferenceOptions options) {
    checkMutable();
    Bundle ofBundle = options.getOfBundle();
    Bundle inBundle = options.getInBundle();
    if (ofBundle != null && inBundle != null && ofBundle != inBundle) {
      throw new ReferenceConflictException(ofBundle, inBundle);
    }
    Bundle scope = ofBundle != null ? ofBundle : inBundle;
    Dependency dependency = options.getFromDependency();
    Asset asset = options.getToAsset();
    checkArgument(assetGraph.hasAsset(asset), "Unknown asset %s", asset);
    if (scope != null) {
      checkBundle(scope);
      checkArgument(
          hasDependency(scope, dependency), "Bundle %s does not contain %s", scope, dependency);
    }
    String scopeId = scope == null ? null : scope.getId();
    assetReferences.put(dependency.getId(), new AssetReference(asset.getId(), scopeId));
  }

  /**
   * Resolves the async {@code dependency} inside {@code bundle} instead of loading another
   * bundle. The asset it resolves to must already be in the bundle or reachable from it.
   */
  public void internalizeAsyncDependency(Bundle bundle, Dependency dependency) {
    checkMutable();
    checkBundle(bundle);
    checkArgument(dependency.isAsync(), "Expected an async dependency: %s", dependency);
    checkArgument(
        hasDependency(bundle, dependency), "Bundle %s does not contain %s", bundle, dependency);
    Asset resolved = assetGraph.getResolvedAsset(dependency);
    checkState(resolved != null, "%s is not resolved", dependency);
    checkState(
        hasAsset(bundle, resolved) || isAssetReachableFromBundle(resolved, bundle),
        "%s is not available in %s",
        resolved,
        bundle);
    internalizedDependencies.put(bundle.getId(), dependency.getId());
  }

  /** Ends the bundling phase. */
  public void seal() {
    sealed = true;
  }

  public boolean isSealed() {
    return sealed;
  }

  private void checkMutable() {
    checkState(!sealed, "The bundle graph is sealed");
  }

  private void checkBundle(@Nullable Bundle bundle) {
    checkArgument(
        bundle != null && bundles.get(bundle.getId()) == bundle, "Unknown bundle %s", bundle);
  }
}
