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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Symbols} table owned by a single dependency or by an asset under construction. It is
 * changed only through {@link #set}, {@link #clear} and {@link #merge}.
 */
public final class MutableSymbols implements Symbols, Serializable {
  private static final long serialVersionUID = 1L;

  private final LinkedHashMap<String, SymbolBinding> bindings = new LinkedHashMap<>();
  private boolean cleared = false;

  public MutableSymbols() {}

  /**
   * Binds {@code exportSymbol} to {@code local}. Setting a name on a cleared table makes it known
   * again.
   */
  public void set(String exportSymbol, String local, @Nullable SourceLocation loc) {
    checkNotNull(exportSymbol);
    bindings.put(exportSymbol, new SymbolBinding(local, loc));
    cleared = false;
  }

  public void set(String exportSymbol, String local) {
    set(exportSymbol, local, null);
  }

  /** Forgets every binding and marks the table as unknown. */
  public void clear() {
    bindings.clear();
    cleared = true;
  }

  /** Adds every binding of {@code other}. Merging a cleared table clears this one. */
  public void merge(Symbols other) {
    if (other.isCleared()) {
      clear();
      return;
    }
    for (Map.Entry<String, SymbolBinding> entry : other.asMap().entrySet()) {
      set(entry.getKey(), entry.getValue().local(), entry.getValue().loc());
    }
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
    return ImmutableSet.copyOf(bindings.keySet());
  }

  @Override
  public ImmutableMap<String, SymbolBinding> asMap() {
    return ImmutableMap.copyOf(bindings);
  }

  @Override
  public String toString() {
    return cleared ? "Symbols{cleared}" : "Symbols" + bindings;
  }
}
