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

/**
 * Variable length numbers encoded as base64 strings with the least significant digit first. Each
 * digit holds five bits of the value and a continuation bit. The sign is kept in the least
 * significant bit of the value.
 */
final class Base64VLQ {
  // Utility class.
  private Base64VLQ() {}

  // A Base64 VLQ digit can represent 5 bits, so it is base-32.
  private static final int VLQ_BASE_SHIFT = 5;
  private static final int VLQ_BASE = 1 << VLQ_BASE_SHIFT;

  // A mask of bits for a VLQ digit (11111), 31 decimal.
  private static final int VLQ_BASE_MASK = VLQ_BASE - 1;

  // The continuation bit is the 6th bit.
  private static final int VLQ_CONTINUATION_BIT = VLQ_BASE;

  /** 1 becomes 2 (10 binary), -1 becomes 3 (11 binary). */
  private static int toVLQSigned(int value) {
    return value < 0 ? ((-value) << 1) + 1 : value << 1;
  }

  /** 2 (10 binary) becomes 1, 3 (11 binary) becomes -1. */
  private static int fromVLQSigned(int value) {
    boolean negate = (value & 1) == 1;
    value = value >>> 1;
    return negate ? -value : value;
  }

  static void encode(StringBuilder out, int value) {
    value = toVLQSigned(value);
    do {
      int digit = value & VLQ_BASE_MASK;
      value >>>= VLQ_BASE_SHIFT;
      if (value > 0) {
        digit |= VLQ_CONTINUATION_BIT;
      }
      out.append(Base64.toBase64(digit));
    } while (value > 0);
  }

  /** Advances through a sequence of characters, reporting the advance back to the source. */
  interface CharIterator {
    boolean hasNext();

    char next();
  }

  /** Decodes the next value from {@code in}. */
  static int decode(CharIterator in) {
    int result = 0;
    boolean continuation;
    int shift = 0;
    do {
      checkArgument(in.hasNext(), "truncated VLQ value");
      int digit = Base64.fromBase64(in.next());
      continuation = (digit & VLQ_CONTINUATION_BIT) != 0;
      digit &= VLQ_BASE_MASK;
      result = result + (digit << shift);
      shift = shift + VLQ_BASE_SHIFT;
    } while (continuation);

    return fromVLQSigned(result);
  }
}
