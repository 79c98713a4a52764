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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.min;

import com.google.rubyjs.ast.SourceRange;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/** An in-memory source file: its name, its text and a table of line start offsets. */
public final class SourceFile {
  private final String name;
  private final String code;
  private final int[] lineOffsets;

  private SourceFile(String name, String code) {
    this.name = checkNotNull(name);
    this.code = checkNotNull(code);
    this.lineOffsets = findLineOffsets(code);
  }

  public static SourceFile fromCode(String name, String code) {
    return new SourceFile(name, code);
  }

  private static int[] findLineOffsets(String code) {
    int numLines = 1;
    for (int i = 0; i < code.length(); i++) {
      if (code.charAt(i) == '\n') {
        numLines++;
      }
    }
    int[] offsets = new int[numLines];
    int index = 1; // the offset of the first line is always 0
    int offset = 0;
    while ((offset = code.indexOf('\n', offset)) != -1) {
      offset++;
      offsets[index++] = offset;
    }
    return offsets;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public int getLineCount() {
    return lineOffsets.length;
  }

  /** Returns the 1-based line containing {@code offset}. */
  public int getLineOfOffset(int offset) {
    int search = Arrays.binarySearch(lineOffsets, offset);
    if (search >= 0) {
      return search + 1;
    }
    int insertionPoint = -1 * (search + 1);
    return min(insertionPoint - 1, lineOffsets.length - 1) + 1;
  }

  /** Returns the 0-based column of {@code offset} on its line. */
  public int getColumnOfOffset(int offset) {
    int line = getLineOfOffset(offset);
    return offset - lineOffsets[line - 1];
  }

  /**
   * Gets the source line for the indicated line number, without the trailing newline.
   *
   * @param lineNumber the line number, 1 being the first line of the file.
   */
  public @Nullable String getLine(int lineNumber) {
    if (lineNumber < 1 || lineNumber > lineOffsets.length) {
      return null;
    }
    int pos = lineOffsets[lineNumber - 1];
    int end = code.indexOf('\n', pos);
    return end == -1 ? code.substring(pos) : code.substring(pos, end);
  }

  /** Builds the range covering {@code [start, end)}. */
  public SourceRange rangeOf(int start, int end) {
    int endLine = getLineOfOffset(Math.max(start, end - 1));
    return SourceRange.create(
        start, end, getLineOfOffset(start), getColumnOfOffset(start), endLine);
  }

  @Override
  public String toString() {
    return name;
  }
}
