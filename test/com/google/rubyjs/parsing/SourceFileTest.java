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

package com.google.rubyjs.parsing;

import static com.google.common.truth.Truth.assertThat;

import com.google.rubyjs.ast.SourceRange;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceFileTest {
  private final SourceFile file = SourceFile.fromCode("a.rb", "ab\ncd\n\nef");

  @Test
  public void testLines() {
    assertThat(file.getLineCount()).isEqualTo(4);
    assertThat(file.getLine(1)).isEqualTo("ab");
    assertThat(file.getLine(3)).isEmpty();
    assertThat(file.getLine(4)).isEqualTo("ef");
    assertThat(file.getLine(5)).isNull();
    assertThat(file.getLine(0)).isNull();
  }

  @Test
  public void testOffsets() {
    assertThat(file.getLineOfOffset(0)).isEqualTo(1);
    assertThat(file.getColumnOfOffset(1)).isEqualTo(1);
    assertThat(file.getLineOfOffset(3)).isEqualTo(2);
    assertThat(file.getColumnOfOffset(3)).isEqualTo(0);
    assertThat(file.getLineOfOffset(8)).isEqualTo(4);
    assertThat(file.getColumnOfOffset(8)).isEqualTo(1);
  }

  @Test
  public void testRange() {
    SourceRange range = file.rangeOf(1, 5);
    assertThat(range.line()).isEqualTo(1);
    assertThat(range.column()).isEqualTo(1);
    assertThat(range.endLine()).isEqualTo(2);
    assertThat(range.hasParens()).isFalse();
  }
}
