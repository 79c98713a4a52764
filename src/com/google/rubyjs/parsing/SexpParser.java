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

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads a tree written as an s-expression, in the format printed by {@link Node#toStringTree}.
 *
 * <p>Symbols ({@code :name}) and quoted strings become string children, {@code nil} becomes a null
 * child, and numbers become {@code Long} or {@code Double} children. Source ranges point into the
 * s-expression text and never carry parentheses, so a zero-argument {@code send} converts as a
 * property read, just as it does when parsed from Ruby without parentheses.
 */
public final class SexpParser implements SourceParser {

  @Override
  public ParseResult parse(SourceFile file) {
    Reader reader = new Reader(file);
    reader.skipSpace();
    Node root;
    if (reader.atEnd()) {
      root = Node.make(Token.BEGIN).withSourceRange(file.rangeOf(0, 0));
    } else {
      root = reader.readNode();
      reader.skipSpace();
      if (!reader.atEnd()) {
        throw new ParseException(file, reader.pos, "unexpected text after the tree");
      }
    }
    return ParseResult.create(root, ImmutableList.of(), file);
  }

  private static final class Reader {
    private final SourceFile file;
    private final String text;
    private int pos;

    Reader(SourceFile file) {
      this.file = file;
      this.text = file.getCode();
    }

    boolean atEnd() {
      return pos >= text.length();
    }

    void skipSpace() {
      while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    Node readNode() {
      int start = pos;
      expect('(');
      int tagStart = pos;
      while (!atEnd() && (Character.isLowerCase(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      String tag = text.substring(tagStart, pos);
      // "defined?" is accepted as a spelling of "defined".
      if (!atEnd() && text.charAt(pos) == '?') {
        pos++;
      }
      Token token = Token.fromTag(tag);
      if (token == null) {
        throw new ParseException(file, tagStart, "unknown node type '" + tag + "'");
      }
      List<@Nullable Object> children = new ArrayList<>();
      while (true) {
        skipSpace();
        if (atEnd()) {
          throw new ParseException(file, start, "unterminated node meets end of file");
        }
        if (text.charAt(pos) == ')') {
          pos++;
          break;
        }
        children.add(readValue());
      }
      return Node.make(token, children).withSourceRange(file.rangeOf(start, pos));
    }

    private @Nullable Object readValue() {
      char c = text.charAt(pos);
      switch (c) {
        case '(':
          return readNode();
        case '"':
          return readQuoted();
        case ':':
          {
            pos++;
            String symbol = readAtom();
            if (symbol.isEmpty()) {
              throw new ParseException(file, pos - 1, "empty symbol");
            }
            return symbol;
          }
        default:
          int start = pos;
          String atom = readAtom();
          if (atom.equals("nil")) {
            return null;
          }
          return parseNumber(atom, start);
      }
    }

    private Object parseNumber(String atom, int start) {
      try {
        if (atom.contains(".") || atom.contains("E") || atom.endsWith("Infinity")
            || atom.equals("NaN")) {
          return Double.parseDouble(atom);
        }
        return Long.parseLong(atom);
      } catch (NumberFormatException e) {
        throw new ParseException(file, start, "unexpected '" + atom + "'");
      }
    }

    private String readAtom() {
      int start = pos;
      while (!atEnd()) {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') {
          break;
        }
        pos++;
      }
      return text.substring(start, pos);
    }

    private String readQuoted() {
      int start = pos;
      pos++;
      StringBuilder sb = new StringBuilder();
      while (true) {
        if (atEnd()) {
          throw new ParseException(file, start, "unterminated string meets end of file");
        }
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c == '\\' && !atEnd()) {
          char escaped = text.charAt(pos++);
          switch (escaped) {
            case 'n':
              sb.append('\n');
              break;
            case 't':
              sb.append('\t');
              break;
            default:
              sb.append(escaped);
          }
        } else {
          sb.append(c);
        }
      }
    }

    private void expect(char c) {
      if (atEnd() || text.charAt(pos) != c) {
        throw new ParseException(file, pos, "expected '" + c + "'");
      }
      pos++;
    }
  }
}
