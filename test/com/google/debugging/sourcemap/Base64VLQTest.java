/*
 * Copyright 2026 The Closure Compiler Authors.
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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class Base64VLQTest {

  @Test
  public void testEncode() {
    assertThat(Base64VLQ.encode(0)).isEqualTo("A");
    assertThat(Base64VLQ.encode(1)).isEqualTo("C");
    assertThat(Base64VLQ.encode(-1)).isEqualTo("D");
    assertThat(Base64VLQ.encode(15)).isEqualTo("e");
    assertThat(Base64VLQ.encode(16)).isEqualTo("gB");
    assertThat(Base64VLQ.encode(-16)).isEqualTo("hB");
  }

  @Test
  public void testDecodeSegment() {
    Base64VLQ.Cursor cursor = new Base64VLQ.Cursor("AgBhB,C", 0);
    assertThat(cursor.decode()).isEqualTo(0);
    assertThat(cursor.decode()).isEqualTo(16);
    assertThat(cursor.decode()).isEqualTo(-16);
    assertThat(cursor.atSegmentEnd()).isTrue();
    assertThat(cursor.position()).isEqualTo(5);
  }

  @Test
  public void testDecodeLargeValues() {
    for (int value : new int[] {1000, -123456, Integer.MAX_VALUE >> 1}) {
      String encoded = Base64VLQ.encode(value);
      assertThat(new Base64VLQ.Cursor(encoded, 0).decode()).isEqualTo(value);
    }
  }

  @Test
  public void testDecodeRejectsBadInput() {
    assertThrows(IllegalArgumentException.class, () -> new Base64VLQ.Cursor("g", 0).decode());
    assertThrows(IllegalArgumentException.class, () -> new Base64VLQ.Cursor("*", 0).decode());
  }
}
