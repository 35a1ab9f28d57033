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

import java.io.IOException;
import org.jspecify.annotations.Nullable;

/** Finds the file a dependency specifier refers to. */
@FunctionalInterface
public interface Resolver {

  /**
   * Resolves {@code dependency}.
   *
   * @return the result, or null if this resolver does not handle the dependency and the next one
   *     should be asked
   * @throws IOException if the dependency cannot be found
   */
  @Nullable ResolveResult resolve(Dependency dependency, BuildOptions options) throws IOException;
}
