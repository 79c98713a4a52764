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

import com.google.rubyjs.ast.Node;

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {
  /** Whether nothing has been printed since the current statement started. */
  boolean atStatementStart = true;

  /** Whether statements end with an explicit semicolon. */
  boolean semicolons = true;

  /**
   * Starts the source mapping for the given
   * node at the current position.
   */
  void startSourceMapping(Node node) {
  }

  /**
   * Finishes the source mapping for the given
   * node at the current position.
   */
  void endSourceMapping(Node node) {
  }

  /**
   * Retrieve the last character of the last string sent to append.
   */
  abstract char getLastChar();

  /**
   * Appends a string to the code, keeping track of the current line length.
   *
   * NOTE: the string must be a complete token--partial strings or
   * partial regexes will run the risk of being split across lines.
   *
   * Do not directly append newlines with this method. Instead use
   * {@link #startNewLine}.
   */
  abstract void append(String str);

  void appendBlockStart() {
    append("{");
  }

  void appendBlockEnd() {
    append("}");
  }

  void startNewLine() {
  }

  /** Whether the layout puts statements on lines of their own. */
  boolean breaksLines() {
    return false;
  }

  /** Leaves an empty line, where the layout has lines at all. */
  void blankLine() {
  }

  void maybeCutLine() {
  }

  void endLine() {
  }

  void beginBlock() {
    appendBlockStart();
    endLine();
  }

  void endBlock() {
    appendBlockEnd();
  }

  void listSeparator() {
    add(",");
    maybeCutLine();
  }

  /** Marks the start of a statement. */
  void beginStatement() {
    atStatementStart = true;
  }

  /**
   * Ends a statement that does not end with a block. A semicolon is printed unless the
   * consumer was asked to leave them out.
   */
  void endStatement() {
    if (semicolons) {
      append(";");
    }
  }

  void beginCaseBody() {
    append(":");
  }

  void endCaseBody() {
  }

  void add(String newcode) {
    if (newcode.isEmpty()) {
      return;
    }

    char c = newcode.charAt(0);
    if (atStatementStart) {
      startStatementText(c);
    } else if ((isWordChar(c) || c == '\\') && isWordChar(getLastChar())) {
      append(" ");
    }

    append(newcode);
  }

  private void startStatementText(char first) {
    atStatementStart = false;
    // Without semicolons, a statement that opens with one of these would continue the
    // previous one.
    if (!semicolons && (first == '(' || first == '[' || first == '`')) {
      append(";");
    }
  }

  void appendOp(String op, boolean binOp) {
    append(op);
  }

  void addOp(String op, boolean binOp) {
    char first = op.charAt(0);
    char prev = getLastChar();

    if (atStatementStart) {
      startStatementText(first);
    }
    if ((first == '+' || first == '-') && prev == first) {
      append(" ");
    } else if (Character.isLetter(first) && isWordChar(prev)) {
      append(" ");
    }

    appendOp(op, binOp);

    if (binOp) {
      maybeCutLine();
    }
  }

  void addNumber(long x) {
    if (x < 0 && getLastChar() == '-') {
      append(" ");
    }
    add(Long.toString(x));
  }

  void addNumber(double x) {
    if (x < 0 && getLastChar() == '-') {
      append(" ");
    }
    if (Double.isNaN(x)) {
      add("NaN");
    } else if (Double.isInfinite(x)) {
      add(x > 0 ? "Infinity" : "-Infinity");
    } else {
      add(String.valueOf(x));
    }
  }

  /** Prints a comment on a line of its own. */
  abstract void addComment(String text);

  /** Prints a comment after the code on the current line. */
  abstract void addTrailingComment(String text);

  static boolean isWordChar(char ch) {
    return (ch == '_' ||
            ch == '$' ||
            Character.isLetterOrDigit(ch));
  }

  /** Called when we're at the end of a file. */
  void endFile() {}
}
