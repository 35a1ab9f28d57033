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

import org.jspecify.annotations.Nullable;

/**
 * Where an exported name is finally defined.
 *
 * @param asset The asset the resolution ended at.
 * @param exportSymbol The name as exported by {@code asset}.
 * @param symbol The local binding in {@code asset}; null unless {@code status} is {@link
 *     Status#RESOLVED}.
 * @param loc The location of the last export statement followed, if known.
 * @param status How the resolution ended.
 */
public record SymbolResolution(
    Asset asset,
    String exportSymbol,
    @Nullable String symbol,
    @Nullable SourceLocation loc,
    Status status) {

  /** How a symbol resolution ended. */
  public enum Status {
    /** Found the local binding. */
    RESOLVED,
    /** The asset's exports are not statically known; read the binding off the asset. */
    DYNAMIC,
    /** The asset does not export the name. */
    NOT_FOUND,
    /** The next step left the boundary bundle. */
    BOUNDARY,
    /** The re-export chain loops. */
    CIRCULAR
  }

  public SymbolResolution {
    requireNonNull(asset, "asset");
    requireNonNull(exportSymbol, "exportSymbol");
    requireNonNull(status, "status");
  }

  static SymbolResolution resolved(
      Asset asset, String exportSymbol, String symbol, @Nullable SourceLocation loc) {
    return new SymbolResolution(asset, exportSymbol, symbol, loc, Status.RESOLVED);
  }

  static SymbolResolution unresolved(
      Asset asset, String exportSymbol, @Nullable SourceLocation loc, Status status) {
    return new SymbolResolution(asset, exportSymbol, null, loc, status);
  }

  public boolean isResolved() {
    return status == Status.RESOLVED;
  }

  /** Whether the binding exists at runtime but is unknown statically. */
  public boolean isDynamic() {
    return status == Status.DYNAMIC;
  }

  /** Whether the symbol is absent: not found, stopped at a boundary, or circular. */
  public boolean isUndefined() {
    return status != Status.RESOLVED && status != Status.DYNAMIC;
  }
}
