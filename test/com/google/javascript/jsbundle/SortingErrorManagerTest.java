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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SortingErrorManager} and the managers built on it. */
@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {
  private static final DiagnosticType ERROR = DiagnosticType.error("TEST_ERROR", "Error: {0}");
  private static final DiagnosticType WARNING =
      DiagnosticType.warning("TEST_WARNING", "Warning: {0}");

  private static SourceLocation at(String file, int line) {
    return SourceLocation.at(file, line, 1);
  }

  @Test
  public void testCountsErrorsAndWarnings() {
    SortingErrorManager manager = new SortingErrorManager();

    manager.report(Diagnostic.make(ERROR, "one"));
    manager.report(Diagnostic.make(WARNING, "two"));
    manager.report(Diagnostic.make(WARNING, "three"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(2);
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testDuplicatesAreReportedOnce() {
    SortingErrorManager manager = new SortingErrorManager();

    manager.report(Diagnostic.make(at("a.js", 1), ERROR, "x"));
    manager.report(Diagnostic.make(at("a.js", 1), ERROR, "x"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getErrors()).hasSize(1);
  }

  @Test
  public void testPromotedWarningsDoNotHalt() {
    SortingErrorManager manager = new SortingErrorManager();

    manager.report(CheckLevel.ERROR, Diagnostic.make(WARNING, "promoted"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testDiagnosticsOffAreNotCounted() {
    SortingErrorManager manager = new SortingErrorManager();

    manager.report(CheckLevel.OFF, Diagnostic.make(ERROR, "quiet"));

    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.getErrors()).isEmpty();
  }

  @Test
  public void testDiagnosticsAreSortedByPosition() {
    SortingErrorManager manager = new SortingErrorManager();
    Diagnostic late = Diagnostic.make(at("b.js", 1), ERROR, "late");
    Diagnostic second = Diagnostic.make(at("a.js", 10), ERROR, "second");
    Diagnostic first = Diagnostic.make(at("a.js", 2), ERROR, "first");
    Diagnostic global = Diagnostic.make(ERROR, "global");

    manager.report(late);
    manager.report(second);
    manager.report(first);
    manager.report(global);

    assertThat(manager.getErrors()).containsExactly(global, first, second, late).inOrder();
  }

  @Test
  public void testReportGeneratorsRun() {
    List<Integer> counts = new ArrayList<>();
    SortingErrorManager manager =
        new SortingErrorManager(ImmutableSet.of(m -> counts.add(m.getErrorCount())));
    manager.report(Diagnostic.make(ERROR, "x"));

    manager.generateReport();

    assertThat(counts).containsExactly(1);
  }

  @Test
  public void testLoggerErrorManager() {
    Logger logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    List<LogRecord> records = new ArrayList<>();
    logger.addHandler(
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        });
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(Diagnostic.make(at("a.js", 3), ERROR, "broken"));
    manager.report(Diagnostic.make(WARNING, "odd"));

    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage())
        .isEqualTo("TEST_ERROR. Error: broken at a.js line 3 : 1");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage()).isEqualTo("TEST_WARNING. Warning: odd");
    assertThat(records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testThreadSafeDelegation() {
    SortingErrorManager delegate = new SortingErrorManager();
    ErrorManager manager = new ThreadSafeDelegatingErrorManager(delegate);

    manager.report(Diagnostic.make(WARNING, "w"));
    manager.report(CheckLevel.ERROR, Diagnostic.make(ERROR, "e"));

    assertThat(delegate.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrors()).isEqualTo(delegate.getErrors());
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testDiagnostic() {
    Diagnostic diagnostic =
        Diagnostic.builder(WARNING, "x")
            .setLocation(at("a.js", 4))
            .setLevel(CheckLevel.ERROR)
            .build();

    assertThat(diagnostic.description()).isEqualTo("Warning: x");
    assertThat(diagnostic.defaultLevel()).isEqualTo(CheckLevel.ERROR);
    assertThat(diagnostic.sourceName()).isEqualTo("a.js");
    assertThat(diagnostic.lineNumber()).isEqualTo(4);
    assertThat(diagnostic.withLevel(CheckLevel.OFF).defaultLevel()).isEqualTo(CheckLevel.OFF);
    assertThat(Diagnostic.make(ERROR, "y").lineNumber()).isEqualTo(-1);
    assertThat(Diagnostic.make(ERROR, "y").sourceName()).isNull();
  }

  @Test
  public void testBuildExceptionMessage() {
    Diagnostic one = Diagnostic.make(ERROR, "one");
    Diagnostic two = Diagnostic.make(ERROR, "two");

    assertThat(new BuildException(one)).hasMessageThat().isEqualTo("TEST_ERROR. Error: one");
    assertThat(new BuildException(ImmutableList.of(one, two)))
        .hasMessageThat()
        .isEqualTo("2 errors, first: TEST_ERROR. Error: one");
  }
}
