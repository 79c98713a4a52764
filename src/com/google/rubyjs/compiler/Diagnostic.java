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

package com.google.rubyjs.compiler;

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * A conversion error or warning.
 *
 * @param type The type of the diagnostic.
 * @param description The formatted message.
 * @param sourceName Name of the source file, if known.
 * @param line One-indexed line number, or -1 if unknown.
 * @param column Zero-indexed column, or -1 if unknown.
 * @param level The level the diagnostic was reported at.
 */
public record Diagnostic(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int line,
    int column,
    CheckLevel level) {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(level, "level");
  }

  private static final int DEFAULT_LINE = -1;
  private static final int DEFAULT_COLUMN = -1;

  /** Creates a diagnostic with no source information. */
  public static Diagnostic make(DiagnosticType type, Object... arguments) {
    return builder(type, arguments).build();
  }

  /** Creates a diagnostic at a given source location. */
  public static Diagnostic make(
      @Nullable String sourceName, int line, int column, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setSourceLocation(sourceName, line, column).build();
  }

  /**
   * Creates a diagnostic at the position of a node. Synthetic nodes have no position, so the
   * diagnostic only names the file.
   */
  public static Diagnostic make(
      @Nullable String sourceName, Node n, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setNode(sourceName, n).build();
  }

  /** Returns a copy reported at a different level. */
  public Diagnostic withLevel(CheckLevel newLevel) {
    return new Diagnostic(type, description, sourceName, line, column, newLevel);
  }

  public boolean hasPosition() {
    return line != DEFAULT_LINE;
  }

  static final class Builder {
    private final DiagnosticType type;
    private final Object[] args;

    private CheckLevel level;
    private @Nullable String sourceName;
    private int line = DEFAULT_LINE;
    private int column = DEFAULT_COLUMN;

    private Builder(DiagnosticType type, Object... args) {
      this.type = type;
      this.args = args;
      this.level = type.level;
    }

    @CanIgnoreReturnValue
    Builder setNode(@Nullable String sourceName, Node n) {
      this.sourceName = sourceName;
      SourceRange range = n.getSourceRange();
      if (range != null) {
        this.line = range.line();
        this.column = range.column();
      }
      return this;
    }

    @CanIgnoreReturnValue
    Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    @CanIgnoreReturnValue
    Builder setSourceLocation(@Nullable String sourceName, int line, int column) {
      this.sourceName = sourceName;
      this.line = line;
      this.column = column;
      return this;
    }

    Diagnostic build() {
      return new Diagnostic(type, type.format(args), sourceName, line, column, level);
    }
  }

  static Builder builder(DiagnosticType type, Object... arguments) {
    return new Builder(type, arguments);
  }

  /**
   * Renders the diagnostic as {@code file:line:column: LEVEL - [key] message}. Unknown parts are
   * left out.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    String name = emptyToNull(sourceName);
    sb.append(name != null ? name : "(unknown source)");
    if (line != DEFAULT_LINE) {
      sb.append(':').append(line);
      if (column != DEFAULT_COLUMN) {
        sb.append(':').append(column);
      }
    }
    return sb.append(": ")
        .append(level)
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description)
        .toString();
  }
}
