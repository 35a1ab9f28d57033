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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteSource;
import com.google.common.primitives.Bytes;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Turns named bundles into bytes: loads asset content ahead of time, runs the packager registered
 * for each bundle type followed by every optimizer, then replaces hash references with content
 * hashes in output paths and contents.
 */
final class BundlePackager {
  private static final Logger logger = Logger.getLogger(BundlePackager.class.getName());

  static final DiagnosticType NO_PACKAGER =
      DiagnosticType.error("JSB_NO_PACKAGER", "No packager for bundles of type {0} ({1})");

  static final DiagnosticType PACKAGING_FAILED =
      DiagnosticType.error("JSB_PACKAGING_FAILED", "Failed to package {0}: {1}");

  static final DiagnosticType CONTENT_UNAVAILABLE =
      DiagnosticType.error("JSB_CONTENT_UNAVAILABLE", "Failed to load asset content: {0}");

  private static final int HASH_LENGTH = 8;
  private static final byte[] HASH_REF_MARKER = "HASH_REF_".getBytes(UTF_8);

  private final BuildOptions options;
  private final PluginConfig plugins;
  private final ErrorManager errorManager;

  BundlePackager(BuildOptions options, PluginConfig plugins, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.plugins = checkNotNull(plugins);
    this.errorManager = checkNotNull(errorManager);
  }

  ImmutableList<PackagedBundle> packageAll(BundleGraph bundleGraph) throws BuildException {
    prefetch(bundleGraph);

    Map<Bundle, BundleResult> results = new LinkedHashMap<>();
    Map<String, String> hashes = new LinkedHashMap<>();
    for (Bundle bundle : bundleGraph.getBundles()) {
      BundleResult result = packageBundle(bundle, bundleGraph);
      results.put(bundle, result);
      hashes.put(bundle.getHashReference(), hashOf(bundle, result));
    }

    ImmutableList.Builder<PackagedBundle> packaged = ImmutableList.builder();
    for (Map.Entry<Bundle, BundleResult> entry : results.entrySet()) {
      Bundle bundle = entry.getKey();
      BundleResult result = entry.getValue();
      String rawPath = bundle.getFilePath();
      checkState(rawPath != null, "Bundle %s was not named", bundle);
      String filePath = replaceHashReferences(rawPath, hashes);
      bundle.setFilePath(filePath);
      packaged.add(
          new PackagedBundle(
              bundle,
              filePath,
              hashes.get(bundle.getHashReference()),
              replaceHashReferences(bundle, result.contents(), hashes),
              result.map()));
    }
    return packaged.build();
  }

  private void prefetch(BundleGraph bundleGraph) throws BuildException {
    Set<CommittedAsset> contents = new LinkedHashSet<>();
    for (Bundle bundle : bundleGraph.getBundles()) {
      for (Asset asset : bundleGraph.getAssets(bundle)) {
        if (asset.getContentKey() != null || asset.getAstKey() != null) {
          contents.add(bundleGraph.getContent(asset));
        }
      }
    }
    try {
      new ContentPrefetcher(options.getPrefetchThreadCount()).prefetch(contents);
    } catch (RuntimeException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw fail(Diagnostic.make(CONTENT_UNAVAILABLE, String.valueOf(cause.getMessage())), cause);
    }
  }

  private BundleResult packageBundle(Bundle bundle, BundleGraph bundleGraph)
      throws BuildException {
    Packager packager = plugins.getPackager(bundle.getType());
    if (packager == null) {
      throw fail(Diagnostic.make(NO_PACKAGER, bundle.getType(), bundle.getFilePath()), null);
    }
    try {
      BundleResult result = packager.packageBundle(bundle, bundleGraph, options);
      for (Optimizer optimizer : plugins.getOptimizers()) {
        result = optimizer.optimize(bundle, result, options);
      }
      logger.fine(() -> "Packaged " + bundle.getFilePath());
      return result;
    } catch (IOException | RuntimeException e) {
      String message =
          e.getMessage() != null ? e.getMessage() : Throwables.getStackTraceAsString(e);
      throw fail(Diagnostic.make(PACKAGING_FAILED, bundle.getFilePath(), message), e);
    }
  }

  /**
   * The first characters of the SHA-256 of the contents when content hashing is on, otherwise of
   * the bundle id, which keeps development output paths stable across edits.
   */
  private String hashOf(Bundle bundle, BundleResult result) throws BuildException {
    if (!options.isContentHashEnabled()) {
      return bundle.getId().substring(0, Math.min(HASH_LENGTH, bundle.getId().length()));
    }
    try {
      return result.contents().hash(Hashing.sha256()).toString().substring(0, HASH_LENGTH);
    } catch (IOException e) {
      throw fail(Diagnostic.make(PACKAGING_FAILED, bundle.getFilePath(), e.getMessage()), e);
    }
  }

  private static String replaceHashReferences(String text, Map<String, String> hashes) {
    String result = text;
    for (Map.Entry<String, String> hash : hashes.entrySet()) {
      result = result.replace(hash.getKey(), hash.getValue());
    }
    return result;
  }

  private ByteSource replaceHashReferences(
      Bundle bundle, ByteSource contents, Map<String, String> hashes) throws BuildException {
    byte[] bytes;
    try {
      bytes = contents.read();
    } catch (IOException e) {
      throw fail(Diagnostic.make(PACKAGING_FAILED, bundle.getFilePath(), e.getMessage()), e);
    }
    if (Bytes.indexOf(bytes, HASH_REF_MARKER) < 0) {
      return ByteSource.wrap(bytes);
    }
    String replaced = replaceHashReferences(new String(bytes, UTF_8), hashes);
    return ByteSource.wrap(replaced.getBytes(UTF_8));
  }

  private BuildException fail(Diagnostic diagnostic, @Nullable Throwable cause) {
    errorManager.report(diagnostic);
    return cause == null ? new BuildException(diagnostic) : new BuildException(diagnostic, cause);
  }
}
