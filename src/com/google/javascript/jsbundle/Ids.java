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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Strings;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/** Digests used as stable identifiers of graph nodes. */
final class Ids {

  private static final int ID_LENGTH = 16;

  // This is a utility class
  private Ids() {}

  /**
   * Returns a hex digest over {@code parts}. Null parts hash like the empty string, and parts are
   * separated so that {@code ("ab", "c")} and {@code ("a", "bc")} differ.
   */
  static String digest(String... parts) {
    Hasher hasher = Hashing.sha256().newHasher();
    for (String part : parts) {
      hasher.putString(Strings.nullToEmpty(part), UTF_8).putByte((byte) 0);
    }
    return hasher.hash().toString().substring(0, ID_LENGTH);
  }
}
