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

import com.google.rubyjs.compiler.ConversionException;
import com.google.rubyjs.compiler.Diagnostic;
import com.google.rubyjs.compiler.DiagnosticType;

/** Malformed source. Always carries the file, line and column where parsing stopped. */
public final class ParseException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("RBJS_PARSE_ERROR", "Parse error. {0}");

  private final int line;
  private final int column;

  public ParseException(SourceFile file, int offset, String message) {
    this(file.getName(), file.getLineOfOffset(offset), file.getColumnOfOffset(offset), message);
  }

  public ParseException(String sourceName, int line, int column, String message) {
    super(Diagnostic.make(sourceName, line, column, PARSE_ERROR, message));
    this.line = line;
    this.column = column;
  }

  /** One-indexed line. */
  public int getLine() {
    return line;
  }

  /** Zero-indexed column. */
  public int getColumn() {
    return column;
  }
}
