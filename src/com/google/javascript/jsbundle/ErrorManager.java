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

/** The error handling strategy used by a build. */
public interface ErrorManager {

  /**
   * Reports a diagnostic. The level determines whether the build halts.
   *
   * @param level the reporting level
   * @param diagnostic the diagnostic to report
   */
  void report(CheckLevel level, Diagnostic diagnostic);

  /** Reports a diagnostic at its own level. */
  default void report(Diagnostic diagnostic) {
    report(diagnostic.defaultLevel(), diagnostic);
  }

  /** Writes a report once all diagnostics of a build have been collected. */
  void generateReport();

  /** Whether an error with an original level of ERROR was reported. */
  boolean hasHaltingErrors();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<Diagnostic> getErrors();

  ImmutableList<Diagnostic> getWarnings();
}
