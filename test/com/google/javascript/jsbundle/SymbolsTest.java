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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link MutableSymbols} and {@link ImmutableSymbols}. */
@RunWith(JUnit4.class)
public final class SymbolsTest {
  private static final SourceLocation LOC = SourceLocation.at("src/a.js", 3, 8);

  @Test
  public void testSetAndGet() {
    MutableSymbols symbols = new MutableSymbols();
    symbols.set("foo", "$foo", LOC);
    symbols.set("bar", "$bar");

    assertThat(symbols.get("foo")).isEqualTo(new SymbolBinding("$foo", LOC));
    assertThat(symbols.get("bar").loc()).isNull();
    assertThat(symbols.get("baz")).isNull();
    assertThat(symbols.hasExportSymbol("foo")).isTrue();
    assertThat(symbols.hasLocalSymbol("$bar")).isTrue();
    assertThat(symbols.exportSymbols()).containsExactly("foo", "bar").inOrder();
  }

  @Test
  public void testExportSymbolForLocalPrefersTheFirstName() {
    MutableSymbols symbols = new MutableSymbols();
    symbols.set("default", "x");
    symbols.set("x", "x");

    assertThat(symbols.getExportSymbolForLocal("x")).isEqualTo("default");
    assertThat(symbols.getExportSymbolForLocal("y")).isNull();
  }

  @Test
  public void testClear() {
    MutableSymbols symbols = new MutableSymbols();
    symbols.set("foo", "foo");

    symbols.clear();

    assertThat(symbols.isCleared()).isTrue();
    assertThat(symbols.exportSymbols()).isEmpty();

    symbols.set("bar", "bar");
    assertThat(symbols.isCleared()).isFalse();
  }

  @Test
  public void testMerge() {
    MutableSymbols target = new MutableSymbols();
    target.set("a", "a");
    MutableSymbols other = new MutableSymbols();
    other.set("a", "a2");
    other.set("b", "b");

    target.merge(other);

    assertThat(target.get("a").local()).isEqualTo("a2");
    assertThat(target.exportSymbols()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testMergingClearedSymbolsClears() {
    MutableSymbols target = new MutableSymbols();
    target.set("a", "a");
    MutableSymbols cleared = new MutableSymbols();
    cleared.clear();

    target.merge(cleared);

    assertThat(target.isCleared()).isTrue();
  }

  @Test
  public void testImmutableCopy() {
    MutableSymbols symbols = new MutableSymbols();
    symbols.set("foo", "$foo", LOC);

    ImmutableSymbols copy = ImmutableSymbols.copyOf(symbols);
    symbols.set("bar", "$bar");

    assertThat(copy.exportSymbols()).containsExactly("foo");
    assertThat(copy.get("foo").loc()).isEqualTo(LOC);
    assertThat(ImmutableSymbols.copyOf(copy)).isSameInstanceAs(copy);
  }

  @Test
  public void testImmutableCopyOfEmptyAndCleared() {
    MutableSymbols cleared = new MutableSymbols();
    cleared.clear();

    assertThat(ImmutableSymbols.copyOf(new MutableSymbols()))
        .isSameInstanceAs(ImmutableSymbols.empty());
    assertThat(ImmutableSymbols.copyOf(cleared)).isSameInstanceAs(ImmutableSymbols.cleared());
    assertThat(ImmutableSymbols.cleared().isCleared()).isTrue();
  }
}
