/*
 * Copyright 2009 The Closure Compiler Authors.
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

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A zero-based line and column in a generated or original file. */
@Immutable
public final class FilePosition implements Comparable<FilePosition> {
  private final int line;
  private final int column;

  public FilePosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** The line, with the first line being 0. */
  public int getLine() {
    return line;
  }

  /** The character index on the line, with the first column being 0. */
  public int getColumn() {
    return column;
  }

  @Override
  public int compareTo(FilePosition other) {
    return line != other.line
        ? Integer.compare(line, other.line)
        : Integer.compare(column, other.column);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof FilePosition
        && ((FilePosition) o).line == line
        && ((FilePosition) o).column == column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
