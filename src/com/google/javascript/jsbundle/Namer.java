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

import org.jspecify.annotations.Nullable;

/** Chooses the file name of a bundle. */
@FunctionalInterface
public interface Namer {

  /**
   * Returns a file name relative to the target's dist dir, or null to let the next namer decide.
   * The name may contain {@link Bundle#getHashReference()}, replaced by a content hash once the
   * bundle is packaged.
   */
  @Nullable String name(Bundle bundle, BundleGraph bundleGraph, BuildOptions options);
}
