/*
 * Copyright 2011 The Closure Compiler Authors.
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

package com.google.debugging.sourcemap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Variable length quantities as used by the "mappings" field of a source map. Each base64 digit
 * carries five bits of the value and a continuation bit, least significant group first. The sign
 * is kept in the lowest bit of the first group.
 */
final class Base64VLQ {
  private Base64VLQ() {}

  private static final String BASE64_ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

  private static final int[] BASE64_DECODE = new int[128];

  static {
    java.util.Arrays.fill(BASE64_DECODE, -1);
    for (int i = 0; i < BASE64_ALPHABET.length(); i++) {
      BASE64_DECODE[BASE64_ALPHABET.charAt(i)] = i;
    }
  }

  private static final int SHIFT = 5;
  private static final int CONTINUATION_BIT = 1 << SHIFT;
  private static final int MASK = CONTINUATION_BIT - 1;

  /** Appends the encoding of {@code value} to {@code out}. */
  static void encode(StringBuilder out, int value) {
    int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
    do {
      int digit = vlq & MASK;
      vlq >>>= SHIFT;
      if (vlq != 0) {
        digit |= CONTINUATION_BIT;
      }
      out.append(BASE64_ALPHABET.charAt(digit));
    } while (vlq != 0);
  }

  static String encode(int value) {
    StringBuilder sb = new StringBuilder();
    encode(sb, value);
    return sb.toString();
  }

  /** A read position within an encoded mapping string. */
  static final class Cursor {
    private final String text;
    private int pos;

    Cursor(String text, int pos) {
      this.text = text;
      this.pos = pos;
    }

    int position() {
      return pos;
    }

    boolean atSegmentEnd() {
      return pos >= text.length() || text.charAt(pos) == ',' || text.charAt(pos) == ';';
    }

    /** Reads one value. */
    int decode() {
      int result = 0;
      int shift = 0;
      boolean continuation;
      do {
        checkArgument(pos < text.length(), "truncated VLQ value in %s", text);
        char c = text.charAt(pos++);
        int digit = c < 128 ? BASE64_DECODE[c] : -1;
        checkArgument(digit >= 0, "not a base64 digit: %s", c);
        continuation = (digit & CONTINUATION_BIT) != 0;
        result += (digit & MASK) << shift;
        shift += SHIFT;
      } while (continuation);
      boolean negate = (result & 1) == 1;
      result >>>= 1;
      return negate ? -result : result;
    }
  }
}
