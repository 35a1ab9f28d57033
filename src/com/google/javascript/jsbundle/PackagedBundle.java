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

import com.google.common.io.ByteSource;
import com.google.javascript.jsbundle.sourcemap.SourceMap;
import org.jspecify.annotations.Nullable;

/**
 * A bundle after packaging and optimization.
 *
 * @param bundle the bundle that was packaged
 * @param filePath where the contents go, with the hash reference replaced
 * @param hash the hash substituted for the bundle's hash reference
 * @param contents the final bytes
 * @param map the source map of the contents, if any
 */
public record PackagedBundle(
    Bundle bundle, String filePath, String hash, ByteSource contents, @Nullable SourceMap map) {
  public PackagedBundle {
    requireNonNull(bundle, "bundle");
    requireNonNull(filePath, "filePath");
    requireNonNull(hash, "hash");
    requireNonNull(contents, "contents");
  }

  public long size() {
    return contents.sizeIfKnown().or(-1L);
  }
}
