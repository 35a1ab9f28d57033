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

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Runs one build: builds the asset graph, validates it, lets the bundler partition it, then
 * names, packages and optimizes the bundles. {@link Reporter}s are told about each phase.
 *
 * <p>The asset graph is read-only once validation starts and the bundle graph is sealed before
 * naming, so later phases only read them.
 */
public final class Build {
  private static final Logger logger = Logger.getLogger(Build.class.getName());

  static final DiagnosticType VALIDATION_FAILED =
      DiagnosticType.error("JSB_VALIDATION_FAILED", "Failed to validate {0}: {1}");

  static final DiagnosticType VALIDATION_INTERRUPTED =
      DiagnosticType.error("JSB_VALIDATION_INTERRUPTED", "Validation was interrupted");

  static final DiagnosticType BUNDLER_FAILED =
      DiagnosticType.error("JSB_BUNDLER_FAILED", "The bundler failed: {0}");

  private final BuildOptions options;
  private final PluginConfig plugins;
  private final ErrorManager errorManager;

  public Build(BuildOptions options, PluginConfig plugins, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.plugins = checkNotNull(plugins);
    // Validators report from several threads.
    this.errorManager = new ThreadSafeDelegatingErrorManager(checkNotNull(errorManager));
  }

  /**
   * Builds everything reachable from {@code entries}.
   *
   * @throws BuildException if any phase reports an error
   */
  public BuildResult run(Iterable<Dependency> entries) throws BuildException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    report(BuildEvent.buildStart());
    try {
      report(BuildEvent.progress(BuildEvent.Phase.TRANSFORMING, "Building the asset graph"));
      AssetGraph assetGraph = new AssetGraphBuilder(options, plugins, errorManager).build(entries);

      report(BuildEvent.progress(BuildEvent.Phase.VALIDATING, "Validating assets"));
      validate(assetGraph);

      report(BuildEvent.progress(BuildEvent.Phase.BUNDLING, "Bundling"));
      MutableBundleGraph bundleGraph = bundle(assetGraph);

      report(BuildEvent.progress(BuildEvent.Phase.NAMING, "Naming bundles"));
      new BundleNaming(options, plugins.getNamers(), errorManager).nameAll(bundleGraph);

      report(BuildEvent.progress(BuildEvent.Phase.PACKAGING, "Packaging bundles"));
      ImmutableList<PackagedBundle> packaged =
          new BundlePackager(options, plugins, errorManager).packageAll(bundleGraph);

      if (errorManager.hasHaltingErrors()) {
        throw new BuildException(errorManager.getErrors());
      }
      Duration buildTime = stopwatch.elapsed();
      logger.info(() -> "Built " + packaged.size() + " bundles in " + buildTime.toMillis() + "ms");
      report(BuildEvent.success(bundleGraph, buildTime, errorManager.getWarnings()));
      return new BuildResult(assetGraph, bundleGraph, packaged, buildTime);
    } catch (BuildException e) {
      report(BuildEvent.failure(e.getDiagnostics()));
      throw e;
    } finally {
      errorManager.generateReport();
    }
  }

  private MutableBundleGraph bundle(AssetGraph assetGraph) throws BuildException {
    MutableBundleGraph bundleGraph = MutableBundleGraph.fromAssetGraph(assetGraph);
    Bundler bundler = plugins.getBundler();
    try {
      bundler.bundle(bundleGraph, options);
      bundler.optimize(bundleGraph, options);
    } catch (RuntimeException e) {
      Diagnostic diagnostic = Diagnostic.make(BUNDLER_FAILED, describe(e));
      errorManager.report(diagnostic);
      throw new BuildException(diagnostic, e);
    }
    bundleGraph.seal();
    logger.fine(() -> "Created " + bundleGraph.getBundles().size() + " bundles");
    return bundleGraph;
  }

  /** Runs every validator on every asset, in parallel across assets. */
  private void validate(AssetGraph assetGraph) throws BuildException {
    if (plugins.getValidators().isEmpty()) {
      return;
    }
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(options.getPrefetchThreadCount()));
    List<ListenableFuture<ImmutableList<Diagnostic>>> results = new ArrayList<>();
    List<Diagnostic> errors = new ArrayList<>();
    try {
      for (Asset asset : assetGraph.getAssets()) {
        CommittedAsset content = assetGraph.getContent(asset);
        results.add(executor.submit(() -> runValidators(asset, content)));
      }
      for (ImmutableList<Diagnostic> found : Futures.allAsList(results).get()) {
        errors.addAll(found);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BuildException(Diagnostic.make(VALIDATION_INTERRUPTED), e);
    } catch (ExecutionException e) {
      Diagnostic diagnostic = Diagnostic.make(VALIDATION_FAILED, "assets", describe(e.getCause()));
      errorManager.report(diagnostic);
      throw new BuildException(diagnostic, e.getCause());
    } finally {
      executor.shutdown();
    }
    if (!errors.isEmpty()) {
      throw new BuildException(errors);
    }
  }

  /** Reports what the validators found and returns the errors among it. */
  private ImmutableList<Diagnostic> runValidators(Asset asset, CommittedAsset content) {
    ImmutableList.Builder<Diagnostic> errors = ImmutableList.builder();
    for (Validator validator : plugins.getValidators()) {
      ImmutableList<Diagnostic> found;
      try {
        found = validator.validate(asset, content, options);
      } catch (IOException e) {
        found =
            ImmutableList.of(Diagnostic.make(VALIDATION_FAILED, asset.getFilePath(), describe(e)));
      }
      for (Diagnostic diagnostic : found) {
        errorManager.report(diagnostic);
        if (diagnostic.defaultLevel() == CheckLevel.ERROR) {
          errors.add(diagnostic);
        }
      }
    }
    return errors.build();
  }

  private void report(BuildEvent event) {
    for (Reporter reporter : plugins.getReporters()) {
      reporter.report(event);
    }
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : Throwables.getStackTraceAsString(e);
  }
}
