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
 * A name exported by an asset together with where it resolves to.
 *
 * @param resolution The resolution of the name.
 * @param exportAs The name under which the queried asset exports it.
 */
public record ExportSymbolResolution(SymbolResolution resolution, String exportAs) {
  public ExportSymbolResolution {
    requireNonNull(resolution, "resolution");
    requireNonNull(exportAs, "exportAs");
  }

  public Asset asset() {
    return resolution.asset();
  }

  public String exportSymbol() {
    return resolution.exportSymbol();
  }

  public @Nullable String symbol() {
    return resolution.symbol();
  }

  public @Nullable SourceLocation loc() {
    return resolution.loc();
  }
}
