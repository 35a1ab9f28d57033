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

import com.google.common.collect.ImmutableList;
import java.io.IOException;

/**
 * Turns a resolved file into committed assets, storing their content, AST and source map in the
 * build cache.
 */
public interface Transformer {

  /** Whether this transformer handles {@code request}; the first one that does is used. */
  boolean canTransform(TransformRequest request);

  /** Returns at least one asset; the first is the one the requesting dependency resolves to. */
  ImmutableList<Asset> transform(TransformRequest request, BuildOptions options)
      throws IOException;
}
