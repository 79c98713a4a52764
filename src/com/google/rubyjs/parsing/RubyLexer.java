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
import com.google.common.collect.ImmutableSet;
import com.google.rubyjs.ast.Comment;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Splits Ruby source into lexemes.
 *
 * <p>The whole range is tokenized up front. Ruby's few context dependent decisions (whether a
 * slash starts a regular expression, whether a line break ends a statement) are made from the
 * previous lexeme and the surrounding whitespace. Comments are not returned as lexemes; they are
 * appended to the comment list handed to the constructor.
 */
final class RubyLexer {

  enum Kind {
    IDENTIFIER,
    CONSTANT,
    IVAR,
    GVAR,
    CVAR,
    KEYWORD,
    /** {@code name:} in a hash or argument list; the text excludes the colon. */
    LABEL,
    INTEGER,
    FLOAT,
    STRING,
    SYMBOL,
    /** {@code :"..."}; parts as for STRING. */
    DSYMBOL,
    REGEXP,
    /** {@code %w[]}. */
    WORDS,
    /** {@code %i[]}. */
    SYMBOLS,
    OPERATOR,
    NEWLINE,
    EOF
  }

  /** A piece of a string literal: either literal text or the source of an interpolation. */
  record Part(boolean code, String text, int start, int end) {}

  static final class Lexeme {
    final Kind kind;
    final String text;
    final int start;
    final int end;
    final boolean spaceBefore;
    final ImmutableList<Part> parts;
    final String flags;

    Lexeme(
        Kind kind,
        String text,
        int start,
        int end,
        boolean spaceBefore,
        ImmutableList<Part> parts,
        String flags) {
      this.kind = kind;
      this.text = text;
      this.start = start;
      this.end = end;
      this.spaceBefore = spaceBefore;
      this.parts = parts;
      this.flags = flags;
    }

    boolean is(Kind k, String t) {
      return kind == k && text.equals(t);
    }

    boolean isOperator(String t) {
      return is(Kind.OPERATOR, t);
    }

    boolean isKeyword(String t) {
      return is(Kind.KEYWORD, t);
    }

    @Override
    public String toString() {
      if (kind == Kind.EOF) {
        return "end of input";
      }
      return kind == Kind.NEWLINE ? "newline" : "'" + text + "'";
    }
  }

  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "alias", "and", "begin", "break", "case", "class", "def", "defined?", "do", "else",
          "elsif", "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not",
          "or", "redo", "rescue", "retry", "return", "self", "super", "then", "true", "undef",
          "unless", "until", "when", "while", "yield");

  /** Operators, longest first so the first match wins. */
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "<=>", "===", "...", "<<=", ">>=", "&&=", "||=", "**", "==", "!=", ">=", "<=",
          "&&", "||", "<<", ">>", "=~", "!~", "+=", "-=", "*=", "/=", "%=", "|=", "&=", "^=",
          "::", "..", "->", "=>", "&.", "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|",
          "^", "~", "?", ":", ",", ".", "(", ")", "[", "]", "{", "}");

  private static final ImmutableSet<String> VALUE_KEYWORDS =
      ImmutableSet.of("end", "self", "nil", "true", "false");

  private final SourceFile file;
  private final String src;
  private final int limit;
  private final List<Comment> comments;
  private final List<Lexeme> lexemes = new ArrayList<>();
  private int pos;
  private boolean sawSpace = true;

  RubyLexer(SourceFile file, int start, int end, List<Comment> comments) {
    this.file = file;
    this.src = file.getCode();
    this.pos = start;
    this.limit = end;
    this.comments = comments;
  }

  List<Lexeme> tokenize() {
    while (true) {
      skipSpaceAndComments();
      if (pos >= limit) {
        add(Kind.EOF, "", pos, pos);
        return lexemes;
      }
      char c = src.charAt(pos);
      if (c == '\n' || c == ';') {
        pos++;
        if (c == ';' || !continuesOnNextLine()) {
          addNewline(pos - 1);
        }
        sawSpace = true;
        continue;
      }
      lexToken(c);
      sawSpace = false;
    }
  }

  private void skipSpaceAndComments() {
    while (pos < limit) {
      char c = src.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\r') {
        pos++;
        sawSpace = true;
      } else if (c == '\\' && pos + 1 < limit && src.charAt(pos + 1) == '\n') {
        pos += 2;
        sawSpace = true;
      } else if (c == '#') {
        readLineComment();
      } else if (c == '=' && atLineStart(pos) && src.startsWith("=begin", pos)) {
        readBlockComment();
      } else {
        return;
      }
    }
  }

  private boolean atLineStart(int offset) {
    return offset == 0 || src.charAt(offset - 1) == '\n';
  }

  private void readLineComment() {
    int start = pos;
    int end = src.indexOf('\n', pos);
    if (end == -1 || end > limit) {
      end = limit;
    }
    pos = end;
    String text = src.substring(start + 1, end).strip();
    Comment.Placement placement =
        onlySpaceBefore(start) ? Comment.Placement.OWN_LINE : Comment.Placement.END_OF_LINE;
    comments.add(Comment.create(text, file.rangeOf(start, end), placement));
  }

  private void readBlockComment() {
    int start = pos;
    int close = src.indexOf("\n=end", pos);
    if (close == -1) {
      throw new ParseException(file, start, "embedded document meets end of file");
    }
    int end = src.indexOf('\n', close + 1);
    end = end == -1 ? limit : end;
    String body = src.substring(src.indexOf('\n', start) + 1, close + 1).stripTrailing();
    comments.add(Comment.create(body, file.rangeOf(start, end), Comment.Placement.OWN_LINE));
    pos = end;
  }

  private boolean onlySpaceBefore(int offset) {
    for (int i = offset - 1; i >= 0 && src.charAt(i) != '\n'; i--) {
      if (!Character.isWhitespace(src.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** A line starting with {@code .foo} or {@code &.foo} continues the previous expression. */
  private boolean continuesOnNextLine() {
    int i = pos;
    while (i < limit && Character.isWhitespace(src.charAt(i))) {
      i++;
    }
    if (i + 1 >= limit) {
      return false;
    }
    if (src.charAt(i) == '&' && src.charAt(i + 1) == '.') {
      return true;
    }
    return src.charAt(i) == '.' && src.charAt(i + 1) != '.';
  }

  private void addNewline(int at) {
    Lexeme last = lexemes.isEmpty() ? null : lexemes.get(lexemes.size() - 1);
    if (last != null && last.kind != Kind.NEWLINE) {
      add(Kind.NEWLINE, src.substring(at, at + 1), at, at + 1);
    }
  }

  private void add(Kind kind, String text, int start, int end) {
    lexemes.add(new Lexeme(kind, text, start, end, sawSpace, ImmutableList.of(), ""));
  }

  private void add(Kind kind, String text, int start, ImmutableList<Part> parts, String flags) {
    lexemes.add(new Lexeme(kind, text, start, pos, sawSpace, parts, flags));
  }

  private @Nullable Lexeme previous() {
    return lexemes.isEmpty() ? null : lexemes.get(lexemes.size() - 1);
  }

  private char peek(int ahead) {
    int i = pos + ahead;
    return i < limit ? src.charAt(i) : '\0';
  }

  private void lexToken(char c) {
    int start = pos;
    if (Character.isDigit(c)) {
      lexNumber();
    } else if (isIdentifierStart(c)) {
      lexIdentifier();
    } else if (c == '@') {
      boolean classVar = peek(1) == '@';
      pos += classVar ? 2 : 1;
      if (!isIdentifierStart(peek(0))) {
        throw new ParseException(file, start, "'@' without identifiers is not allowed");
      }
      readWord();
      add(classVar ? Kind.CVAR : Kind.IVAR, src.substring(start, pos), start, pos);
    } else if (c == '$') {
      pos++;
      if (isIdentifierStart(peek(0))) {
        readWord();
      } else {
        pos++;
      }
      add(Kind.GVAR, src.substring(start, pos), start, pos);
    } else if (c == '"' || c == '`') {
      pos++;
      ImmutableList<Part> parts = readInterpolated(c, start);
      add(Kind.STRING, src.substring(start, pos), start, parts, "");
    } else if (c == '\'') {
      pos++;
      ImmutableList<Part> parts = readSingleQuoted('\'', start);
      add(Kind.STRING, src.substring(start, pos), start, parts, "");
    } else if (c == ':' && peek(1) == '"') {
      pos += 2;
      ImmutableList<Part> parts = readInterpolated('"', start);
      add(Kind.DSYMBOL, src.substring(start, pos), start, parts, "");
    } else if (c == ':' && peek(1) != ':' && startsSymbol(peek(1))) {
      lexSymbol();
    } else if (c == '/' && regexAllowed()) {
      pos++;
      ImmutableList<Part> parts = readInterpolated('/', start);
      int flagStart = pos;
      while (pos < limit && "imxuo".indexOf(src.charAt(pos)) >= 0) {
        pos++;
      }
      add(Kind.REGEXP, src.substring(start, pos), start, parts, src.substring(flagStart, pos));
    } else if (c == '%' && (peek(1) == 'w' || peek(1) == 'i') && isOpenDelimiter(peek(2))
        && regexAllowed()) {
      lexWords();
    } else if (c == '<' && peek(1) == '<' && (peek(2) == '~' || peek(2) == '-')
        && (isIdentifierStart(peek(3)) || peek(3) == '\'' || peek(3) == '"')) {
      throw new ParseException(file, start, "heredocs are not supported");
    } else {
      lexOperator();
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isOpenDelimiter(char c) {
    return c == '[' || c == '(' || c == '{' || c == '<';
  }

  private void readWord() {
    while (pos < limit && isIdentifierPart(src.charAt(pos))) {
      pos++;
    }
  }

  private void lexNumber() {
    int start = pos;
    boolean isFloat = false;
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      pos += 2;
      while (pos < limit && (Character.digit(src.charAt(pos), 16) >= 0 || peek(0) == '_')) {
        pos++;
      }
      String digits = src.substring(start + 2, pos).replace("_", "");
      add(Kind.INTEGER, Long.toString(Long.parseLong(digits, 16)), start, pos);
      return;
    }
    readDigits();
    if (peek(0) == '.' && Character.isDigit(peek(1))) {
      isFloat = true;
      pos++;
      readDigits();
    }
    if ((peek(0) == 'e' || peek(0) == 'E')
        && (Character.isDigit(peek(1))
            || ((peek(1) == '-' || peek(1) == '+') && Character.isDigit(peek(2))))) {
      isFloat = true;
      pos += 2;
      readDigits();
    }
    if (isIdentifierStart(peek(0))) {
      throw new ParseException(file, pos, "unexpected character after number");
    }
    add(isFloat ? Kind.FLOAT : Kind.INTEGER, src.substring(start, pos).replace("_", ""), start,
        pos);
  }

  private void readDigits() {
    while (pos < limit && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
      pos++;
    }
  }

  private void lexIdentifier() {
    int start = pos;
    readWord();
    char next = peek(0);
    if ((next == '?' || next == '!') && peek(1) != '='
        && !Character.isUpperCase(src.charAt(start))) {
      pos++;
    }
    String word = src.substring(start, pos);
    if (peek(0) == ':' && peek(1) != ':' && !word.endsWith("?") && notKeywordLabel(word)) {
      Lexeme prev = previous();
      boolean afterDot = prev != null && (prev.isOperator(".") || prev.isOperator("&."));
      if (!afterDot) {
        pos++;
        add(Kind.LABEL, word, start, pos);
        return;
      }
    }
    Lexeme prev = previous();
    boolean afterDot =
        prev != null && (prev.isOperator(".") || prev.isOperator("&.") || prev.isKeyword("def"));
    if (KEYWORDS.contains(word) && !afterDot) {
      add(Kind.KEYWORD, word, start, pos);
    } else if (Character.isUpperCase(word.charAt(0))) {
      add(Kind.CONSTANT, word, start, pos);
    } else {
      add(Kind.IDENTIFIER, word, start, pos);
    }
  }

  private boolean notKeywordLabel(String word) {
    // "a ? b : c" keeps its spaces; "if x then :y" needs the keyword.
    return !KEYWORDS.contains(word) || peek(1) == ' ';
  }

  private static boolean startsSymbol(char c) {
    return isIdentifierStart(c) || c == '@' || c == '$' || "+-*/%<>=!~^&|[".indexOf(c) >= 0;
  }

  private void lexSymbol() {
    int start = pos;
    pos++;
    char c = peek(0);
    if (isIdentifierStart(c) || c == '@' || c == '$') {
      while (peek(0) == '@' || peek(0) == '$') {
        pos++;
      }
      readWord();
      if ((peek(0) == '?' || peek(0) == '!' || peek(0) == '=') && peek(1) != '=' && peek(1) != '>'
          && peek(1) != '~') {
        pos++;
      }
    } else {
      String rest = src.substring(pos, Math.min(limit, pos + 3));
      String op = null;
      for (String candidate :
          ImmutableList.of("[]=", "[]", "<=>", "===", "==", "=~", "!=", "!~", "**", "<<", ">>",
              "<=", ">=", "+@", "-@", "+", "-", "*", "/", "%", "<", ">", "!", "~", "^", "&", "|")) {
        if (rest.startsWith(candidate)) {
          op = candidate;
          break;
        }
      }
      if (op == null) {
        throw new ParseException(file, start, "invalid symbol");
      }
      pos += op.length();
    }
    add(Kind.SYMBOL, src.substring(start + 1, pos), start, pos);
  }

  private boolean regexAllowed() {
    Lexeme prev = previous();
    if (prev == null) {
      return true;
    }
    switch (prev.kind) {
      case NEWLINE:
      case LABEL:
        return true;
      case OPERATOR:
        return !prev.text.equals(")") && !prev.text.equals("]") && !prev.text.equals("}");
      case KEYWORD:
        return !VALUE_KEYWORDS.contains(prev.text);
      case IDENTIFIER:
        return sawSpace && peek(1) != ' ' && peek(1) != '=';
      default:
        return false;
    }
  }

  private void lexWords() {
    int start = pos;
    boolean symbols = peek(1) == 'i';
    char open = peek(2);
    char close = open == '[' ? ']' : open == '(' ? ')' : open == '{' ? '}' : '>';
    pos += 3;
    ImmutableList.Builder<Part> words = ImmutableList.builder();
    while (true) {
      while (pos < limit && Character.isWhitespace(src.charAt(pos))) {
        pos++;
      }
      if (pos >= limit) {
        throw new ParseException(file, start, "unterminated list meets end of file");
      }
      if (src.charAt(pos) == close) {
        pos++;
        break;
      }
      int wordStart = pos;
      while (pos < limit && !Character.isWhitespace(src.charAt(pos)) && src.charAt(pos) != close) {
        pos++;
      }
      words.add(new Part(false, src.substring(wordStart, pos), wordStart, pos));
    }
    add(symbols ? Kind.SYMBOLS : Kind.WORDS, src.substring(start, pos), start, words.build(), "");
  }

  private void lexOperator() {
    int start = pos;
    for (String op : OPERATORS) {
      if (src.startsWith(op, pos) && pos + op.length() <= limit) {
        pos += op.length();
        add(Kind.OPERATOR, op, start, pos);
        return;
      }
    }
    throw new ParseException(file, start, "unexpected character '" + src.charAt(pos) + "'");
  }

  private ImmutableList<Part> readSingleQuoted(char quote, int start) {
    StringBuilder sb = new StringBuilder();
    int partStart = pos;
    while (true) {
      if (pos >= limit) {
        throw new ParseException(file, start, "unterminated string meets end of file");
      }
      char c = src.charAt(pos);
      if (c == quote) {
        pos++;
        return ImmutableList.of(new Part(false, sb.toString(), partStart, pos - 1));
      }
      if (c == '\\' && pos + 1 < limit && (peek(1) == quote || peek(1) == '\\')) {
        sb.append(peek(1));
        pos += 2;
      } else {
        sb.append(c);
        pos++;
      }
    }
  }

  /**
   * Reads the body of a double quoted string, backtick string or regular expression up to the
   * closing delimiter. Escapes are decoded for strings; regular expression bodies are kept as
   * written apart from an escaped delimiter.
   */
  private ImmutableList<Part> readInterpolated(char close, int start) {
    ImmutableList.Builder<Part> parts = ImmutableList.builder();
    StringBuilder sb = new StringBuilder();
    int partStart = pos;
    boolean regex = close == '/';
    boolean empty = true;
    while (true) {
      if (pos >= limit) {
        throw new ParseException(
            file, start, regex ? "unterminated regexp meets end of file"
                : "unterminated string meets end of file");
      }
      char c = src.charAt(pos);
      if (c == close) {
        if (sb.length() > 0 || empty) {
          parts.add(new Part(false, sb.toString(), partStart, pos));
        }
        pos++;
        return parts.build();
      }
      if (c == '#' && peek(1) == '{') {
        if (sb.length() > 0) {
          parts.add(new Part(false, sb.toString(), partStart, pos));
          sb.setLength(0);
        }
        empty = false;
        int codeStart = pos + 2;
        int codeEnd = findInterpolationEnd(codeStart, start);
        parts.add(new Part(true, src.substring(codeStart, codeEnd), codeStart, codeEnd));
        pos = codeEnd + 1;
        partStart = pos;
        continue;
      }
      if (c == '\\' && pos + 1 < limit) {
        if (regex) {
          char next = peek(1);
          if (next != '/') {
            sb.append('\\');
          }
          sb.append(next);
          pos += 2;
        } else {
          pos++;
          readEscape(sb);
        }
        continue;
      }
      sb.append(c);
      pos++;
    }
  }

  private int findInterpolationEnd(int from, int literalStart) {
    int depth = 0;
    int i = from;
    while (i < limit) {
      char c = src.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        if (depth == 0) {
          return i;
        }
        depth--;
      } else if (c == '"' || c == '\'') {
        int close = src.indexOf(c, i + 1);
        i = close == -1 ? limit : close;
      }
      i++;
    }
    throw new ParseException(file, literalStart, "unterminated string interpolation");
  }

  private void readEscape(StringBuilder sb) {
    char c = src.charAt(pos++);
    switch (c) {
      case 'n' -> sb.append('\n');
      case 't' -> sb.append('\t');
      case 'r' -> sb.append('\r');
      case 's' -> sb.append(' ');
      case '0' -> sb.append('\0');
      case 'e' -> sb.append('\u001b');
      case 'a' -> sb.append('\u0007');
      case 'b' -> sb.append('\b');
      case 'f' -> sb.append('\f');
      case 'v' -> sb.append('\u000b');
      case '\n' -> {}
      case 'u' -> readUnicodeEscape(sb);
      default -> sb.append(c);
    }
  }

  private void readUnicodeEscape(StringBuilder sb) {
    int start = pos;
    try {
      if (peek(0) == '{') {
        int close = src.indexOf('}', pos);
        if (close == -1) {
          throw new ParseException(file, pos, "unterminated Unicode escape");
        }
        for (String hex : src.substring(pos + 1, close).trim().split("\\s+")) {
          sb.appendCodePoint(Integer.parseInt(hex, 16));
        }
        pos = close + 1;
      } else {
        if (pos + 4 > limit) {
          throw new ParseException(file, pos, "invalid Unicode escape");
        }
        sb.append((char) Integer.parseInt(src.substring(pos, pos + 4), 16));
        pos += 4;
      }
    } catch (IllegalArgumentException e) {
      throw new ParseException(file, start, "invalid Unicode escape");
    }
  }
}
