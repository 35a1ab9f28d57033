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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Follows export symbols through re-exports. A name exported by an asset either is bound to a
 * local declared there, or is bound to a local the asset imported through one of its dependencies,
 * in which case resolution continues at the dependency's target.
 */
final class SymbolResolver {
  private final BundleGraph bundleGraph;

  SymbolResolver(BundleGraph bundleGraph) {
    this.bundleGraph = bundleGraph;
  }

  SymbolResolution resolve(Asset asset, String exportSymbol, @Nullable Bundle boundary) {
    return resolve(asset, exportSymbol, boundary, new HashSet<>());
  }

  private SymbolResolution resolve(
      Asset start, String startSymbol, @Nullable Bundle boundary, Set<String> visited) {
    Asset asset = start;
    String exportSymbol = startSymbol;
    SourceLocation loc = null;
    while (true) {
      if (!visited.add(asset.getId() + '\0' + exportSymbol)) {
        return SymbolResolution.unresolved(
            asset, exportSymbol, loc, SymbolResolution.Status.CIRCULAR);
      }
      Symbols symbols = asset.getSymbols();
      SymbolBinding binding = symbols.get(exportSymbol);
      if (binding == null) {
        if (symbols.isCleared()) {
          return SymbolResolution.unresolved(
              asset, exportSymbol, loc, SymbolResolution.Status.DYNAMIC);
        }
        if (exportSymbol.equals(Symbols.WILDCARD)) {
          return SymbolResolution.unresolved(
              asset, exportSymbol, loc, SymbolResolution.Status.DYNAMIC);
        }
        return resolveThroughWildcards(asset, exportSymbol, loc, boundary, visited);
      }
      if (binding.loc() != null) {
        loc = binding.loc();
      }
      String local = binding.local();

      Asset next = null;
      String nextSymbol = null;
      for (Dependency dep : bundleGraph.getDependencies(asset)) {
        if (bundleGraph.isDependencyExcluded(dep)) {
          continue;
        }
        String imported = dep.getSymbols().getExportSymbolForLocal(local);
        if (imported == null) {
          continue;
        }
        Asset target = bundleGraph.getResolvedAsset(dep, boundary);
        if (target == null || target == asset) {
          continue;
        }
        next = target;
        nextSymbol = imported;
        break;
      }
      if (next == null) {
        return SymbolResolution.resolved(asset, exportSymbol, local, loc);
      }
      if (boundary != null && !bundleGraph.hasAsset(boundary, next)) {
        return SymbolResolution.unresolved(
            asset, exportSymbol, loc, SymbolResolution.Status.BOUNDARY);
      }
      asset = next;
      exportSymbol = nextSymbol;
    }
  }

  /**
   * Looks for {@code exportSymbol} in the targets of the {@code export *} dependencies of {@code
   * asset}. {@code default} is never re-exported this way.
   */
  private SymbolResolution resolveThroughWildcards(
      Asset asset,
      String exportSymbol,
      @Nullable SourceLocation loc,
      @Nullable Bundle boundary,
      Set<String> visited) {
    if (exportSymbol.equals(Symbols.DEFAULT)) {
      return SymbolResolution.unresolved(
          asset, exportSymbol, loc, SymbolResolution.Status.NOT_FOUND);
    }
    boolean stoppedAtBoundary = false;
    for (Dependency dep : bundleGraph.getDependencies(asset)) {
      if (bundleGraph.isDependencyExcluded(dep)
          || !dep.getSymbols().hasExportSymbol(Symbols.WILDCARD)) {
        continue;
      }
      Asset target = bundleGraph.getResolvedAsset(dep, boundary);
      if (target == null || target == asset) {
        continue;
      }
      if (boundary != null && !bundleGraph.hasAsset(boundary, target)) {
        stoppedAtBoundary = true;
        continue;
      }
      SymbolResolution result = resolve(target, exportSymbol, boundary, visited);
      switch (result.status()) {
        case RESOLVED:
        case DYNAMIC:
        case BOUNDARY:
          return result;
        case NOT_FOUND:
        case CIRCULAR:
          break;
      }
    }
    return SymbolResolution.unresolved(
        asset,
        exportSymbol,
        loc,
        stoppedAtBoundary
            ? SymbolResolution.Status.BOUNDARY
            : SymbolResolution.Status.NOT_FOUND);
  }

  /**
   * Lists the names {@code asset} exports. Its own export symbols come first, in declaration
   * order, followed by names reached through {@code export *} that are neither {@code default} nor
   * already listed.
   */
  ImmutableList<ExportSymbolResolution> getExportedSymbols(
      Asset asset, @Nullable Bundle boundary) {
    Map<String, ExportSymbolResolution> result = new LinkedHashMap<>();
    collectExportedSymbols(asset, boundary, result, new HashSet<>());
    return ImmutableList.copyOf(result.values());
  }

  private void collectExportedSymbols(
      Asset asset,
      @Nullable Bundle boundary,
      Map<String, ExportSymbolResolution> result,
      Set<String> visitedAssets) {
    if (!visitedAssets.add(asset.getId())) {
      return;
    }
    for (String exportSymbol : asset.getSymbols().exportSymbols()) {
      if (exportSymbol.equals(Symbols.WILDCARD) || result.containsKey(exportSymbol)) {
        continue;
      }
      result.put(
          exportSymbol,
          new ExportSymbolResolution(resolve(asset, exportSymbol, boundary), exportSymbol));
    }
    for (Dependency dep : bundleGraph.getDependencies(asset)) {
      if (bundleGraph.isDependencyExcluded(dep)
          || !dep.getSymbols().hasExportSymbol(Symbols.WILDCARD)) {
        continue;
      }
      Asset target = bundleGraph.getResolvedAsset(dep, boundary);
      if (target == null || (boundary != null && !bundleGraph.hasAsset(boundary, target))) {
        continue;
      }
      Map<String, ExportSymbolResolution> reexported = new LinkedHashMap<>();
      collectExportedSymbols(target, boundary, reexported, visitedAssets);
      for (ExportSymbolResolution symbol : reexported.values()) {
        if (!symbol.exportAs().equals(Symbols.DEFAULT)) {
          result.putIfAbsent(symbol.exportAs(), symbol);
        }
      }
    }
  }
}
