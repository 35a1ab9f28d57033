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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * A symbol table mapping exported names to local bindings.
 *
 * <p>On an asset the keys are the names the module exports. On a dependency the keys are the names
 * the importer uses from the imported module, and the bindings are the importer's locals. A
 * cleared table means analysis bailed out: nothing is known about the names involved.
 */
public interface Symbols {
  /** The name standing for the whole module namespace, as in {@code export * from}. */
  String WILDCARD = "*";

  String DEFAULT = "default";

  @Nullable SymbolBinding get(String exportSymbol);

  boolean hasExportSymbol(String exportSymbol);

  boolean hasLocalSymbol(String local);

  /** Returns the first exported name bound to {@code local}, in insertion order. */
  @Nullable String getExportSymbolForLocal(String local);

  boolean isCleared();

  ImmutableSet<String> exportSymbols();

  ImmutableMap<String, SymbolBinding> asMap();
}
