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

package com.google.javascript.jsbundle.sourcemap;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * One segment of a source map: a generated position and, optionally, the original position and
 * name it came from. Lines and columns are zero-indexed, as in the encoded form.
 */
public record Mapping(
    int generatedLine,
    int generatedColumn,
    @Nullable String source,
    int originalLine,
    int originalColumn,
    @Nullable String name)
    implements Serializable {

  /** A generated position that does not map to any source. */
  public static Mapping unmapped(int generatedLine, int generatedColumn) {
    return new Mapping(generatedLine, generatedColumn, null, -1, -1, null);
  }

  public boolean hasSource() {
    return source != null;
  }
}
