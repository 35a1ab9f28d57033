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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds an {@link AssetGraph} by resolving dependencies and transforming the files they resolve
 * to, until no unresolved dependency is left.
 *
 * <p>Resolvers are asked in order and the first one returning a result wins. Transformers are
 * picked in order by {@link Transformer#canTransform}. A file requested twice with the same
 * environment and pipeline is transformed once. Work is done in a fixed order, so two builds of
 * the same inputs produce the same graph.
 */
public final class AssetGraphBuilder {
  private static final Logger logger = Logger.getLogger(AssetGraphBuilder.class.getName());

  static final DiagnosticType TRANSFORM_FAILED =
      DiagnosticType.error("JSB_TRANSFORM_FAILED", "Failed to transform {0}: {1}");

  static final DiagnosticType NO_TRANSFORMER =
      DiagnosticType.error("JSB_NO_TRANSFORMER", "No transformer accepts {0}");

  static final DiagnosticType NO_ASSETS =
      DiagnosticType.error("JSB_NO_ASSETS", "Transforming {0} produced no assets");

  private final BuildOptions options;
  private final PluginConfig plugins;
  private final ErrorManager errorManager;
  // Transform request key to the assets it produced.
  private final Map<String, ImmutableList<Asset>> transformed = new HashMap<>();
  private @Nullable AssetGraph graph;

  public AssetGraphBuilder(BuildOptions options, PluginConfig plugins, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.plugins = checkNotNull(plugins);
    this.errorManager = checkNotNull(errorManager);
  }

  /**
   * Builds the graph of everything reachable from {@code entries}.
   *
   * @throws UnresolvedDependencyException if a required dependency cannot be resolved
   * @throws BuildException if a transformer fails
   */
  public AssetGraph build(Iterable<Dependency> entries) throws BuildException {
    checkState(graph == null, "build() was already called");
    AssetGraph assetGraph = new AssetGraph(options, errorManager);
    graph = assetGraph;
    for (Dependency entry : entries) {
      assetGraph.addEntryDependency(entry);
    }
    process(assetGraph, new ArrayDeque<>(assetGraph.getEntryDependencies()));
    logger.info(
        () ->
            "Built asset graph with "
                + assetGraph.getAssetCount()
                + " assets and "
                + assetGraph.getDependencyCount()
                + " dependencies");
    return assetGraph;
  }

  /**
   * Redoes the assets whose recorded inputs changed and everything they newly depend on.
   *
   * @return the assets that were removed to be transformed again
   */
  public ImmutableSet<Asset> update(
      Set<String> changedFiles, Set<String> changedEnvVars, Set<String> changedOptions)
      throws BuildException {
    checkState(graph != null, "build() must be called first");
    AssetGraph assetGraph = graph;
    ImmutableSet<Asset> invalidated =
        assetGraph.getInvalidatedAssets(changedFiles, changedEnvVars, changedOptions, false);
    Set<Dependency> orphaned = new LinkedHashSet<>();
    for (Asset asset : invalidated) {
      forgetTransformsOf(asset);
      orphaned.addAll(assetGraph.removeAsset(asset.getId()));
    }
    // Removing an asset drops the dependencies it declared, including ones orphaned earlier.
    Deque<Dependency> queue = new ArrayDeque<>();
    for (Dependency dependency : orphaned) {
      if (assetGraph.getDependency(dependency.getId()) != null) {
        queue.add(dependency);
      }
    }
    logger.fine(() -> "Rebuilding " + invalidated.size() + " invalidated assets");
    process(assetGraph, queue);
    return invalidated;
  }

  private void forgetTransformsOf(Asset asset) {
    Iterator<ImmutableList<Asset>> it = transformed.values().iterator();
    while (it.hasNext()) {
      for (Asset produced : it.next()) {
        if (produced.getId().equals(asset.getId())) {
          it.remove();
          break;
        }
      }
    }
  }

  private void process(AssetGraph assetGraph, Deque<Dependency> queue) throws BuildException {
    while (!queue.isEmpty()) {
      Dependency dependency = queue.remove();
      ResolveResult result = resolve(assetGraph, dependency);
      if (result == null) {
        continue;
      }
      if (result.isExcluded()) {
        assetGraph.exclude(dependency);
        continue;
      }
      TransformRequest request =
          TransformRequest.create(
              result.getFilePath(),
              dependency.getEnv(),
              result.getPipeline() != null ? result.getPipeline() : dependency.getPipeline(),
              result.getSideEffects() == null || result.getSideEffects(),
              result.getCode());
      ImmutableList<Asset> produced = transformed.get(request.getKey());
      if (produced != null && produced.stream().allMatch(assetGraph::hasAsset)) {
        assetGraph.resolve(dependency, produced);
        continue;
      }
      produced = transform(request);
      transformed.put(request.getKey(), produced);
      queue.addAll(assetGraph.addAssets(dependency, produced));
    }
  }

  /**
   * Runs the resolvers for {@code dependency}.
   *
   * @return the result of the first resolver that handled it, or null if resolution failed for an
   *     optional dependency
   */
  private @Nullable ResolveResult resolve(AssetGraph assetGraph, Dependency dependency)
      throws UnresolvedDependencyException {
    String reason = "no resolver handled it";
    for (Resolver resolver : plugins.getResolvers()) {
      ResolveResult result;
      try {
        result = resolver.resolve(dependency, options);
      } catch (IOException e) {
        reason = e.getMessage() != null ? e.getMessage() : e.toString();
        break;
      }
      if (result == null) {
        continue;
      }
      for (Diagnostic diagnostic : result.getDiagnostics()) {
        errorManager.report(diagnostic);
      }
      if (result.isExcluded() || result.getFilePath() != null) {
        return result;
      }
    }
    assetGraph.recordResolutionFailure(dependency, reason);
    return null;
  }

  private ImmutableList<Asset> transform(TransformRequest request) throws BuildException {
    for (Transformer transformer : plugins.getTransformers()) {
      if (!transformer.canTransform(request)) {
        continue;
      }
      ImmutableList<Asset> produced;
      try {
        produced = transformer.transform(request, options);
      } catch (IOException | RuntimeException e) {
        throw fail(
            Diagnostic.make(TRANSFORM_FAILED, request.getFilePath(), describe(e)), e);
      }
      if (produced.isEmpty()) {
        throw fail(Diagnostic.make(NO_ASSETS, request.getFilePath()), null);
      }
      return produced;
    }
    throw fail(Diagnostic.make(NO_TRANSFORMER, request.getFilePath()), null);
  }

  private BuildException fail(Diagnostic diagnostic, @Nullable Throwable cause) {
    errorManager.report(diagnostic);
    return cause == null ? new BuildException(diagnostic) : new BuildException(diagnostic, cause);
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : Throwables.getStackTraceAsString(e);
  }
}
