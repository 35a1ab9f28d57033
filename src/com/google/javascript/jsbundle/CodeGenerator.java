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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

/** Prints an asset's AST back to code. */
@FunctionalInterface
public interface CodeGenerator {

  ListenableFuture<GenerateResult> generate(Asset asset, AssetAst ast);

  /** A generator for builds whose assets always carry content. */
  static CodeGenerator unsupported() {
    return (asset, ast) ->
        Futures.immediateFailedFuture(
            new UnsupportedOperationException(
                "No code generator for " + ast.getType() + " AST of " + asset.getFilePath()));
  }
}
