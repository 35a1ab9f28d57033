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
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A frozen {@link Symbols} table, as held by committed assets. */
@Immutable
public final class ImmutableSymbols implements Symbols, Serializable {
  private static final long serialVersionUID = 1L;

  private static final ImmutableSymbols EMPTY = new ImmutableSymbols(ImmutableMap.of(), false);
  private static final ImmutableSymbols CLEARED = new ImmutableSymbols(ImmutableMap.of(), true);

  private final ImmutableMap<String, SymbolBinding> bindings;
  private final boolean cleared;

  private ImmutableSymbols(ImmutableMap<String, SymbolBinding> bindings, boolean cleared) {
    this.bindings = bindings;
    this.cleared = cleared;
  }

  public static ImmutableSymbols empty() {
    return EMPTY;
  }

  public static ImmutableSymbols cleared() {
    return CLEARED;
  }

  public static ImmutableSymbols copyOf(Symbols symbols) {
    if (symbols instanceof ImmutableSymbols) {
      return (ImmutableSymbols) symbols;
    }
    if (symbols.isCleared()) {
      return CLEARED;
    }
    return symbols.asMap().isEmpty() ? EMPTY : new ImmutableSymbols(symbols.asMap(), false);
  }

  @Override
  public @Nullable SymbolBinding get(String exportSymbol) {
    return bindings.get(exportSymbol);
  }

  @Override
  public boolean hasExportSymbol(String exportSymbol) {
    return bindings.containsKey(exportSymbol);
  }

  @Override
  public boolean hasLocalSymbol(String local) {
    return getExportSymbolForLocal(local) != null;
  }

  @Override
  public @Nullable String getExportSymbolForLocal(String local) {
    for (Map.Entry<String, SymbolBinding> entry : bindings.entrySet()) {
      if (entry.getValue().local().equals(local)) {
        return entry.getKey();
      }
    }
    return null;
  }

  @Override
  public boolean isCleared() {
    return cleared;
  }

  @Override
  public ImmutableSet<String> exportSymbols() {
    return bindings.keySet();
  }

  @Override
  public ImmutableMap<String, SymbolBinding> asMap() {
    return bindings;
  }

  @Override
  public String toString() {
    return cleared ? "Symbols{cleared}" : "Symbols" + bindings;
  }
}
