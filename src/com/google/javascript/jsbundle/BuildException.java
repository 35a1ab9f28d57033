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
import org.jspecify.annotations.Nullable;

/** Thrown when a build cannot continue. Carries the diagnostics that stopped it. */
public class BuildException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<Diagnostic> diagnostics;

  public BuildException(Diagnostic diagnostic) {
    this(ImmutableList.of(diagnostic), null);
  }

  public BuildException(Diagnostic diagnostic, Throwable cause) {
    this(ImmutableList.of(diagnostic), cause);
  }

  public BuildException(Iterable<Diagnostic> diagnostics) {
    this(ImmutableList.copyOf(diagnostics), null);
  }

  private BuildException(ImmutableList<Diagnostic> diagnostics, @Nullable Throwable cause) {
    super(describe(diagnostics), cause);
    this.diagnostics = diagnostics;
  }

  private static String describe(ImmutableList<Diagnostic> diagnostics) {
    if (diagnostics.size() == 1) {
      return diagnostics.get(0).toString();
    }
    if (diagnostics.isEmpty()) {
      return "Build failed";
    }
    return diagnostics.size() + " errors, first: " + diagnostics.get(0);
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }
}
