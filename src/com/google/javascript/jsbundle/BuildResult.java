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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of a successful {@link Build}.
 *
 * @param assetGraph the asset graph the bundles were made from
 * @param bundleGraph the sealed bundle graph
 * @param bundles the packaged bundles, in bundle creation order
 * @param buildTime how long the build took
 */
public record BuildResult(
    AssetGraph assetGraph,
    BundleGraph bundleGraph,
    ImmutableList<PackagedBundle> bundles,
    Duration buildTime) {
  public BuildResult {
    requireNonNull(assetGraph, "assetGraph");
    requireNonNull(bundleGraph, "bundleGraph");
    requireNonNull(bundles, "bundles");
    requireNonNull(buildTime, "buildTime");
  }

  /** Returns the packaged bundle written to {@code filePath}, or null. */
  public @Nullable PackagedBundle getBundle(String filePath) {
    for (PackagedBundle bundle : bundles) {
      if (bundle.filePath().equals(filePath)) {
        return bundle;
      }
    }
    return null;
  }
}
