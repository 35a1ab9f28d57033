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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/** Conversion between six bit values and base64 digits. */
final class Base64 {

  // This is a utility class
  private Base64() {}

  /** Maps values in the range 0-63 to their base64 digit. */
  private static final String BASE64_MAP =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZ" + "abcdefghijklmnopqrstuvwxyz" + "0123456789+/";

  /** Maps base64 digits back to their value, -1 for characters outside the alphabet. */
  private static final int[] BASE64_DECODE_MAP = new int[128];

  static {
    Arrays.fill(BASE64_DECODE_MAP, -1);
    for (int i = 0; i < BASE64_MAP.length(); i++) {
      BASE64_DECODE_MAP[BASE64_MAP.charAt(i)] = i;
    }
  }

  /**
   * @param value A value in the range of 0-63.
   * @return a base64 digit.
   */
  static char toBase64(int value) {
    checkArgument(value <= 63 && value >= 0, "value out of range: %s", value);
    return BASE64_MAP.charAt(value);
  }

  /**
   * @param c A base64 digit.
   * @return A value in the range of 0-63.
   * @throws IllegalArgumentException if {@code c} is not a base64 digit
   */
  static int fromBase64(char c) {
    int result = c < BASE64_DECODE_MAP.length ? BASE64_DECODE_MAP[c] : -1;
    checkArgument(result != -1, "invalid base64 digit: '%s'", c);
    return result;
  }
}
