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

package com.google.rubyjs.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * The region of source text a node was parsed from.
 *
 * <p>Lines are 1-based and columns are 0-based, matching the conventions of source maps once the
 * line is decremented.
 */
@AutoValue
@Immutable
public abstract class SourceRange {

  public abstract int startOffset();

  public abstract int endOffset();

  public abstract int line();

  public abstract int column();

  public abstract int endLine();

  /**
   * Whether the node's selector (method name, or def name) was immediately followed by an opening
   * parenthesis in the source.
   */
  public abstract boolean hasParens();

  public static SourceRange create(
      int startOffset, int endOffset, int line, int column, int endLine) {
    checkArgument(startOffset <= endOffset, "range ends before it starts: %s", startOffset);
    checkArgument(line >= 1 && endLine >= line, "bad line numbers %s-%s", line, endLine);
    return new AutoValue_SourceRange(startOffset, endOffset, line, column, endLine, false);
  }

  public SourceRange withParens(boolean hasParens) {
    return new AutoValue_SourceRange(
        startOffset(), endOffset(), line(), column(), endLine(), hasParens);
  }

  /** Returns a range that starts where this one starts and ends where {@code end} ends. */
  public SourceRange extendTo(SourceRange end) {
    if (end.endOffset() <= endOffset()) {
      return this;
    }
    return new AutoValue_SourceRange(
        startOffset(), end.endOffset(), line(), column(), end.endLine(), hasParens());
  }

  @Override
  public final String toString() {
    return line() + ":" + column();
  }
}
