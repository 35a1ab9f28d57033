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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Gives every bundle of a sealed bundle graph a name and an output path. The first namer that
 * returns a name wins. Inline bundles nobody named are named after their id.
 */
final class BundleNaming {
  private static final Logger logger = Logger.getLogger(BundleNaming.class.getName());

  static final DiagnosticType UNNAMED_BUNDLE =
      DiagnosticType.error("JSB_UNNAMED_BUNDLE", "No namer named bundle {0} of type {1}");

  static final DiagnosticType DUPLICATE_BUNDLE_NAME =
      DiagnosticType.error("JSB_DUPLICATE_BUNDLE_NAME", "Bundles {0} and {1} both write {2}");

  private final BuildOptions options;
  private final ImmutableList<Namer> namers;
  private final ErrorManager errorManager;

  BundleNaming(BuildOptions options, ImmutableList<Namer> namers, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.namers = checkNotNull(namers);
    this.errorManager = checkNotNull(errorManager);
  }

  void nameAll(BundleGraph bundleGraph) throws BuildException {
    List<Diagnostic> failures = new ArrayList<>();
    Map<String, Bundle> byPath = new HashMap<>();
    for (Bundle bundle : bundleGraph.getBundles()) {
      String name = nameOf(bundle, bundleGraph);
      if (name == null) {
        failures.add(Diagnostic.make(UNNAMED_BUNDLE, bundle.getId(), bundle.getType()));
        continue;
      }
      String filePath = join(bundle.getTarget().getDistDir(), name);
      Bundle previous = byPath.putIfAbsent(filePath, bundle);
      if (previous != null && !bundle.isInline()) {
        failures.add(
            Diagnostic.make(DUPLICATE_BUNDLE_NAME, previous.getId(), bundle.getId(), filePath));
        continue;
      }
      bundle.setName(name);
      bundle.setFilePath(filePath);
      logger.fine(() -> "Named " + bundle.getId() + " " + filePath);
    }
    for (Diagnostic failure : failures) {
      errorManager.report(failure);
    }
    if (!failures.isEmpty()) {
      throw new BuildException(failures);
    }
  }

  private @Nullable String nameOf(Bundle bundle, BundleGraph bundleGraph) {
    for (Namer namer : namers) {
      String name = namer.name(bundle, bundleGraph, options);
      if (name != null) {
        return name;
      }
    }
    return bundle.isInline() ? bundle.getId() + "." + bundle.getType() : null;
  }

  private static String join(String distDir, String name) {
    return distDir.endsWith("/") ? distDir + name : distDir + "/" + name;
  }
}
