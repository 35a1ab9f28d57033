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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * A region of a source file.
 *
 * @param filePath The file the region belongs to.
 * @param startLine One-indexed, inclusive.
 * @param startColumn One-indexed, inclusive.
 * @param endLine One-indexed, inclusive.
 * @param endColumn One-indexed, exclusive.
 */
public record SourceLocation(
    String filePath, int startLine, int startColumn, int endLine, int endColumn)
    implements Serializable {
  public SourceLocation {
    requireNonNull(filePath, "filePath");
    checkArgument(startLine >= 1 && startColumn >= 1, "start must be one-indexed");
    checkArgument(
        endLine > startLine || (endLine == startLine && endColumn >= startColumn),
        "end %s:%s precedes start %s:%s",
        endLine,
        endColumn,
        startLine,
        startColumn);
  }

  /** A location covering a single position. */
  public static SourceLocation at(String filePath, int line, int column) {
    return new SourceLocation(filePath, line, column, line, column);
  }

  @Override
  public String toString() {
    return filePath + ":" + startLine + ":" + startColumn;
  }
}
