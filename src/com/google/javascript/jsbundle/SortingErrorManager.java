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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * An error manager that sorts and de-duplicates every diagnostic reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<DiagnosticWithLevel> messages =
      new TreeSet<>(new LeveledDiagnosticComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  @Override
  public void report(CheckLevel level, Diagnostic diagnostic) {
    if (messages.add(new DiagnosticWithLevel(diagnostic, level))) {
      if (level == CheckLevel.ERROR) {
        if (diagnostic.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<Diagnostic> getErrors() {
    return atLevel(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<Diagnostic> getWarnings() {
    return atLevel(CheckLevel.WARNING);
  }

  Iterable<DiagnosticWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<Diagnostic> atLevel(CheckLevel level) {
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    for (DiagnosticWithLevel d : messages) {
      if (d.level == level) {
        diagnostics.add(d.diagnostic);
      }
    }
    return diagnostics.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level (errors first), then source name, line, column and description.
   * Diagnostics without a location sort before located ones.
   */
  static final class LeveledDiagnosticComparator implements Comparator<DiagnosticWithLevel> {
    private static final Comparator<Diagnostic> BY_POSITION =
        Comparator.comparing(
                Diagnostic::sourceName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingInt(Diagnostic::lineNumber)
            .thenComparingInt(Diagnostic::column)
            .thenComparing(Diagnostic::description)
            .thenComparing(Diagnostic::type);

    @Override
    public int compare(DiagnosticWithLevel p1, DiagnosticWithLevel p2) {
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      return BY_POSITION.compare(p1.diagnostic, p2.diagnostic);
    }
  }

  static final class DiagnosticWithLevel {
    final Diagnostic diagnostic;
    final CheckLevel level;

    DiagnosticWithLevel(Diagnostic diagnostic, CheckLevel level) {
      this.diagnostic = diagnostic;
      this.level = level;
    }
  }
}
