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
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import com.google.rubyjs.ast.Token;
import com.google.rubyjs.compiler.ScopeTracker;
import com.google.rubyjs.parsing.RubyLexer.Kind;
import com.google.rubyjs.parsing.RubyLexer.Lexeme;
import com.google.rubyjs.parsing.RubyLexer.Part;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * A recursive descent parser for the subset of Ruby the converter understands.
 *
 * <p>The tree uses the node shapes of the whitequark parser. Local variables are tracked while
 * parsing, so a bare identifier that names a local in scope becomes {@code (lvar x)} and anything
 * else becomes a receiverless {@code send}. Heredocs, {@code BEGIN}/{@code END} blocks and pattern
 * matching are rejected with a {@link ParseException}.
 */
public final class RubyParser implements SourceParser {

  @Override
  public ParseResult parse(SourceFile file) {
    List<Comment> comments = new ArrayList<>();
    Parsing parsing =
        new Parsing(file, 0, file.getCode().length(), comments, new ScopeTracker());
    Node root = parsing.parseProgram();
    comments.sort(Comparator.comparingInt(c -> c.range().startOffset()));
    return ParseResult.create(root, ImmutableList.copyOf(comments), file);
  }

  /** Keywords and operators that end a statement list. */
  private static final ImmutableSet<String> CLOSING_KEYWORDS =
      ImmutableSet.of("end", "else", "elsif", "when", "in", "rescue", "ensure", "then");

  private static final ImmutableSet<String> CLOSING_OPERATORS = ImmutableSet.of("}", ")", "]");

  /** Binary operators from loosest to tightest. Unary minus and {@code **} bind tighter still. */
  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("||"),
          ImmutableSet.of("&&"),
          ImmutableSet.of("<=>", "==", "===", "!=", "=~", "!~"),
          ImmutableSet.of("<", "<=", ">", ">="),
          ImmutableSet.of("|", "^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "%"));

  private static final ImmutableSet<String> OP_ASSIGN =
      ImmutableSet.of(
          "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", "|=", "&=", "^=", "||=", "&&=");

  /** Keywords that can start an argument of a command call such as {@code puts nil}. */
  private static final ImmutableSet<String> ARGUMENT_KEYWORDS =
      ImmutableSet.of("nil", "true", "false", "self", "not", "defined?", "super", "yield");

  /** Keywords after which a {@code return}, {@code break} or {@code next} carries no value. */
  private static final ImmutableSet<String> VALUELESS_FOLLOWERS =
      ImmutableSet.of(
          "if", "unless", "while", "until", "end", "rescue", "and", "or", "then", "do", "else",
          "elsif", "when", "ensure");

  private static final ImmutableSet<String> UNSUPPORTED_KEYWORDS =
      ImmutableSet.of("redo", "retry", "undef");

  /** Parser state for one token stream. Interpolated code gets its own instance. */
  private static final class Parsing {
    private final SourceFile file;
    private final List<Comment> comments;
    private final ScopeTracker scope;
    private final List<Lexeme> tokens;
    private int index;
    private int lastEnd;
    /** While positive, {@code do} belongs to an enclosing construct, not to a call. */
    private int noDo;
    /** While positive, a comma separates arguments rather than building an array. */
    private int argumentDepth;

    Parsing(SourceFile file, int start, int end, List<Comment> comments, ScopeTracker scope) {
      this.file = file;
      this.comments = comments;
      this.scope = scope;
      this.tokens = new RubyLexer(file, start, end, comments).tokenize();
      this.lastEnd = start;
    }

    Node parseProgram() {
      int start = peek().start;
      List<Node> statements = parseStatements();
      if (peek().kind != Kind.EOF) {
        throw unexpected(peek());
      }
      if (statements.size() == 1) {
        return statements.get(0);
      }
      return finish(Node.make(Token.BEGIN, statements), start);
    }

    // Token stream helpers.

    private Lexeme peek() {
      return tokens.get(index);
    }

    private Lexeme peekAt(int ahead) {
      return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Lexeme next() {
      Lexeme t = tokens.get(index);
      if (t.kind != Kind.EOF) {
        index++;
        lastEnd = t.end;
      }
      return t;
    }

    private boolean atOperator(String op) {
      return peek().isOperator(op);
    }

    private boolean atKeyword(String keyword) {
      return peek().isKeyword(keyword);
    }

    private boolean acceptOperator(String op) {
      if (atOperator(op)) {
        next();
        return true;
      }
      return false;
    }

    private boolean acceptKeyword(String keyword) {
      if (atKeyword(keyword)) {
        next();
        return true;
      }
      return false;
    }

    private Lexeme expectOperator(String op) {
      if (!atOperator(op)) {
        throw error(peek(), "unexpected " + peek() + ", expecting '" + op + "'");
      }
      return next();
    }

    private Lexeme expectKeyword(String keyword) {
      if (!atKeyword(keyword)) {
        throw error(peek(), "unexpected " + peek() + ", expecting '" + keyword + "'");
      }
      return next();
    }

    private Lexeme expectKind(Kind kind, String what) {
      if (peek().kind != kind) {
        throw error(peek(), "unexpected " + peek() + ", expecting " + what);
      }
      return next();
    }

    private void skipNewlines() {
      while (peek().kind == Kind.NEWLINE) {
        next();
      }
    }

    /** Skips {@code then}, a line break, or both. */
    private void acceptThen() {
      skipNewlines();
      acceptKeyword("then");
      skipNewlines();
    }

    private ParseException error(Lexeme at, String message) {
      return new ParseException(file, at.start, message);
    }

    private ParseException unexpected(Lexeme at) {
      return error(at, "unexpected " + at);
    }

    private Node finish(Node n, int start) {
      return n.withSourceRange(file.rangeOf(start, Math.max(start, lastEnd)));
    }

    private Node make(Token token, int start, @Nullable Object... children) {
      return finish(Node.make(token, children), start);
    }

    private static int startOf(Node n) {
      SourceRange range = n.getSourceRange();
      return range == null ? 0 : range.startOffset();
    }

    private Node withParens(Node n) {
      return n.withSourceRange(n.getSourceRange().withParens(true));
    }

    /** Parses a construct that starts a fresh statement context inside any enclosing one. */
    private <T> T nested(Supplier<T> parse) {
      int savedNoDo = noDo;
      int savedArgumentDepth = argumentDepth;
      noDo = 0;
      argumentDepth = 0;
      try {
        return parse.get();
      } finally {
        noDo = savedNoDo;
        argumentDepth = savedArgumentDepth;
      }
    }

    private @Nullable Node body(List<Node> statements) {
      if (statements.isEmpty()) {
        return null;
      }
      if (statements.size() == 1) {
        return statements.get(0);
      }
      return finish(Node.make(Token.BEGIN, statements), startOf(statements.get(0)));
    }

    // Statements.

    private boolean atStatementsEnd() {
      Lexeme t = peek();
      return t.kind == Kind.EOF
          || (t.kind == Kind.KEYWORD && CLOSING_KEYWORDS.contains(t.text))
          || (t.kind == Kind.OPERATOR && CLOSING_OPERATORS.contains(t.text));
    }

    private List<Node> parseStatements() {
      List<Node> statements = new ArrayList<>();
      skipNewlines();
      while (!atStatementsEnd()) {
        statements.add(parseStatement());
        if (!atStatementsEnd() && peek().kind != Kind.NEWLINE) {
          throw error(peek(), "unexpected " + peek() + ", expecting end of statement");
        }
        skipNewlines();
      }
      return statements;
    }

    private Node parseStatement() {
      Node statement =
          looksLikeMultipleAssignment() ? parseMultipleAssignment() : parseExpressionStatement();
      while (true) {
        int start = startOf(statement);
        if (acceptKeyword("if")) {
          Node condition = parseExpressionStatement();
          statement = make(Token.IF, start, condition, statement, null);
        } else if (acceptKeyword("unless")) {
          Node condition = parseExpressionStatement();
          statement = make(Token.IF, start, condition, null, statement);
        } else if (atKeyword("while") || atKeyword("until")) {
          boolean isWhile = next().text.equals("while");
          Node condition = parseExpressionStatement();
          Token token;
          if (statement.isToken(Token.KWBEGIN)) {
            token = isWhile ? Token.WHILE_POST : Token.UNTIL_POST;
          } else {
            token = isWhile ? Token.WHILE : Token.UNTIL;
          }
          statement = make(token, start, condition, statement);
        } else if (atKeyword("rescue")) {
          Lexeme rescue = next();
          Node fallback = parseExpressionStatement();
          Node resbody = make(Token.RESBODY, rescue.start, null, null, fallback);
          statement = make(Token.RESCUE, start, statement, resbody, null);
        } else {
          return statement;
        }
      }
    }

    /** {@code a, b = ...}: simple targets separated by commas, then a single {@code =}. */
    private boolean looksLikeMultipleAssignment() {
      int i = index;
      boolean sawComma = false;
      while (true) {
        Lexeme t = tokens.get(i);
        if (t.isOperator("*")) {
          t = tokens.get(++i);
        }
        if (t.kind != Kind.IDENTIFIER
            && t.kind != Kind.IVAR
            && t.kind != Kind.GVAR
            && t.kind != Kind.CVAR) {
          return false;
        }
        Lexeme after = tokens.get(++i);
        if (after.isOperator(",")) {
          sawComma = true;
          i++;
        } else {
          return sawComma && after.isOperator("=");
        }
      }
    }

    private Node parseMultipleAssignment() {
      int start = peek().start;
      List<Node> targets = new ArrayList<>();
      do {
        Lexeme star = atOperator("*") ? next() : null;
        Lexeme name = next();
        Node target = make(assignmentToken(name), name.start, name.text);
        if (name.kind == Kind.IDENTIFIER) {
          scope.declareLocal(name.text);
        }
        targets.add(star == null ? target : make(Token.SPLAT, star.start, target));
      } while (acceptOperator(","));
      Node mlhs = finish(Node.make(Token.MLHS, targets), start);
      expectOperator("=");
      skipNewlines();
      int valueStart = peek().start;
      List<Node> values = new ArrayList<>();
      do {
        skipNewlines();
        values.add(parseArgument());
      } while (acceptOperator(","));
      Node value =
          values.size() == 1 && !values.get(0).isToken(Token.SPLAT)
              ? values.get(0)
              : finish(Node.make(Token.ARRAY, values), valueStart);
      return make(Token.MASGN, start, mlhs, value);
    }

    private static Token assignmentToken(Lexeme name) {
      switch (name.kind) {
        case IVAR:
          return Token.IVASGN;
        case GVAR:
          return Token.GVASGN;
        case CVAR:
          return Token.CVASGN;
        default:
          return Token.LVASGN;
      }
    }

    /** {@code not}, {@code and} and {@code or}: the loosest operators. */
    private Node parseExpressionStatement() {
      Node left = parseNotExpression();
      while (atKeyword("and") || atKeyword("or")) {
        Token token = next().text.equals("and") ? Token.AND : Token.OR;
        skipNewlines();
        Node right = parseNotExpression();
        left = make(token, startOf(left), left, right);
      }
      return left;
    }

    private Node parseNotExpression() {
      if (atKeyword("not")) {
        Lexeme not = next();
        Node operand = parseNotExpression();
        return make(Token.SEND, not.start, operand, "!");
      }
      return parseExpression();
    }

    // Expressions.

    /** Assignment and everything tighter. */
    private Node parseExpression() {
      Node left = parseTernary();
      Lexeme t = peek();
      if (t.isOperator("=")) {
        next();
        Node target = assignmentTarget(left, false);
        skipNewlines();
        Node value = parseAssignedValue();
        List<@Nullable Object> children = new ArrayList<>(target.getChildren());
        children.add(value);
        return finish(Node.make(target.getToken(), children), startOf(left));
      }
      if (t.kind == Kind.OPERATOR && OP_ASSIGN.contains(t.text)) {
        next();
        Node target = assignmentTarget(left, true);
        skipNewlines();
        Node value = parseAssignedValue();
        switch (t.text) {
          case "||=":
            return make(Token.OR_ASGN, startOf(left), target, value);
          case "&&=":
            return make(Token.AND_ASGN, startOf(left), target, value);
          default:
            String op = t.text.substring(0, t.text.length() - 1);
            return make(Token.OP_ASGN, startOf(left), target, op, value);
        }
      }
      return left;
    }

    /** The right side of an assignment, where {@code a = b, c} builds an array. */
    private Node parseAssignedValue() {
      int start = peek().start;
      Node value = parseExpression();
      if (!atOperator(",") || argumentDepth > 0) {
        return value;
      }
      List<Node> values = new ArrayList<>();
      values.add(value);
      while (acceptOperator(",")) {
        skipNewlines();
        values.add(parseArgument());
      }
      return finish(Node.make(Token.ARRAY, values), start);
    }

    /**
     * Turns the already parsed left side of an assignment into an assignment target without a
     * value. Locals are declared here, before the right side is parsed.
     */
    private Node assignmentTarget(Node left, boolean compound) {
      int start = startOf(left);
      switch (left.getToken()) {
        case LVAR:
          return make(Token.LVASGN, start, left.getString(0));
        case IVAR:
          return make(Token.IVASGN, start, left.getString(0));
        case GVAR:
          return make(Token.GVASGN, start, left.getString(0));
        case CVAR:
          return make(Token.CVASGN, start, left.getString(0));
        case CONST:
          scope.declareConstant(left.getString(1));
          return make(Token.CASGN, start, left.getChild(0), left.getString(1));
        case SEND:
        case CSEND:
          {
            String selector = left.getString(1);
            if (left.getChild(0) == null && left.getChildCount() == 2) {
              if (!isLocalName(selector) || left.getSourceRange().hasParens()) {
                break;
              }
              scope.declareLocal(selector);
              return make(Token.LVASGN, start, selector);
            }
            if (compound) {
              return left;
            }
            if (selector.equals("[]")) {
              return finish(left.updated(null, replaceSelector(left, "[]=")), start);
            }
            if (left.getChildCount() == 2 && isLocalName(selector)) {
              return finish(left.updated(null, replaceSelector(left, selector + "=")), start);
            }
            break;
          }
        default:
          break;
      }
      throw new ParseException(
          file, start, "cannot assign to " + left.getToken().tag() + " expression");
    }

    private List<@Nullable Object> replaceSelector(Node send, String selector) {
      List<@Nullable Object> children = new ArrayList<>(send.getChildren());
      children.set(1, selector);
      return children;
    }

    private static boolean isLocalName(String name) {
      char first = name.charAt(0);
      return (first == '_' || Character.isLowerCase(first))
          && !name.endsWith("?")
          && !name.endsWith("!");
    }

    private Node parseTernary() {
      Node condition = parseRange();
      if (!atOperator("?")) {
        return condition;
      }
      next();
      skipNewlines();
      Node whenTrue = parseTernary();
      skipNewlines();
      expectOperator(":");
      skipNewlines();
      Node whenFalse = parseTernary();
      return make(Token.IF, startOf(condition), condition, whenTrue, whenFalse);
    }

    private Node parseRange() {
      Node left = parseBinary(0);
      if (atOperator("..") || atOperator("...")) {
        Token token = next().text.equals("..") ? Token.IRANGE : Token.ERANGE;
        Node right = startsExpression(peek()) ? parseBinary(0) : null;
        return make(token, startOf(left), left, right);
      }
      return left;
    }

    private Node parseBinary(int level) {
      if (level == BINARY_LEVELS.size()) {
        return parseUnaryMinus();
      }
      Node left = parseBinary(level + 1);
      while (peek().kind == Kind.OPERATOR && BINARY_LEVELS.get(level).contains(peek().text)) {
        String op = next().text;
        skipNewlines();
        Node right = parseBinary(level + 1);
        switch (op) {
          case "||":
            left = make(Token.OR, startOf(left), left, right);
            break;
          case "&&":
            left = make(Token.AND, startOf(left), left, right);
            break;
          default:
            left = make(Token.SEND, startOf(left), left, op, right);
        }
      }
      return left;
    }

    private Node parseUnaryMinus() {
      if (!atOperator("-")) {
        return parsePower();
      }
      Lexeme minus = next();
      Lexeme operandStart = peek();
      boolean literal =
          !operandStart.spaceBefore
              && (operandStart.kind == Kind.INTEGER || operandStart.kind == Kind.FLOAT);
      Node operand = parsePower();
      if (literal && operand.isToken(Token.INT)) {
        return make(Token.INT, minus.start, -((Long) operand.getChild(0)));
      }
      if (literal && operand.isToken(Token.FLOAT)) {
        return make(Token.FLOAT, minus.start, -((Double) operand.getChild(0)));
      }
      return make(Token.SEND, minus.start, operand, "-@");
    }

    private Node parsePower() {
      Node base = parseUnary();
      if (atOperator("**")) {
        next();
        skipNewlines();
        Node exponent = parseUnaryMinus();
        return make(Token.SEND, startOf(base), base, "**", exponent);
      }
      return base;
    }

    private Node parseUnary() {
      Lexeme t = peek();
      if (t.isOperator("!") || t.isOperator("~")) {
        next();
        Node operand = parseUnary();
        return make(Token.SEND, t.start, operand, t.text);
      }
      if (t.isOperator("+")) {
        next();
        Node operand = parseUnary();
        if (operand.isToken(Token.INT) || operand.isToken(Token.FLOAT)) {
          return finish(operand, t.start);
        }
        return make(Token.SEND, t.start, operand, "+@");
      }
      return parsePostfix(parsePrimary());
    }

    private Node parsePostfix(Node n) {
      while (true) {
        Lexeme t = peek();
        if (t.isOperator(".") || t.isOperator("&.")) {
          next();
          skipNewlines();
          Token token = t.isOperator("&.") ? Token.CSEND : Token.SEND;
          if (atOperator("(")) {
            n = parseCallRest(n, "call", token, startOf(n));
            continue;
          }
          Lexeme name = next();
          if (name.kind != Kind.IDENTIFIER
              && name.kind != Kind.CONSTANT
              && name.kind != Kind.KEYWORD) {
            throw error(name, "unexpected " + name + ", expecting method name");
          }
          n = parseCallRest(n, name.text, token, startOf(n));
        } else if (t.isOperator("::")) {
          next();
          Lexeme name = next();
          if (name.kind == Kind.CONSTANT && !(atOperator("(") && !peek().spaceBefore)) {
            n = make(Token.CONST, startOf(n), n, name.text);
          } else if (name.kind == Kind.IDENTIFIER || name.kind == Kind.CONSTANT) {
            n = parseCallRest(n, name.text, Token.SEND, startOf(n));
          } else {
            throw error(name, "unexpected " + name + ", expecting constant name");
          }
        } else if (t.isOperator("[") && (!t.spaceBefore || !isCommandCandidate(n))) {
          next();
          List<Node> args = parseArgumentsUntil("]");
          expectOperator("]");
          List<@Nullable Object> children = new ArrayList<>();
          children.add(n);
          children.add("[]");
          children.addAll(args);
          n = finish(Node.make(Token.SEND, children), startOf(n));
        } else if (t.isOperator("{") && takesBlock(n)) {
          n = parseBlock(n, "}");
        } else if (t.isKeyword("do") && noDo == 0 && takesBlock(n)) {
          n = parseBlock(n, "end");
        } else {
          return n;
        }
      }
    }

    private static boolean isCommandCandidate(Node n) {
      return n.isToken(Token.SEND) && n.getChild(0) == null && n.getChildCount() == 2
          && !n.getSourceRange().hasParens();
    }

    private static boolean takesBlock(Node n) {
      switch (n.getToken()) {
        case SEND:
        case CSEND:
          {
            String selector = n.getString(1);
            return Character.isLetter(selector.charAt(0)) || selector.charAt(0) == '_'
                || selector.equals("[]");
          }
        case SUPER:
        case ZSUPER:
          return true;
        default:
          return false;
      }
    }

    /** Parses the arguments, if any, following a method name. */
    private Node parseCallRest(@Nullable Node receiver, String selector, Token token, int start) {
      Lexeme t = peek();
      List<@Nullable Object> children = new ArrayList<>();
      children.add(receiver);
      children.add(selector);
      if (t.isOperator("(") && !t.spaceBefore) {
        next();
        children.addAll(parseArgumentsUntil(")"));
        expectOperator(")");
        return withParens(finish(Node.make(token, children), start));
      }
      if (startsCommandArgument(t)) {
        children.addAll(parseCommandArguments());
      }
      return finish(Node.make(token, children), start);
    }

    /** Whether {@code t}, following a method name, starts an unparenthesized argument. */
    private boolean startsCommandArgument(Lexeme t) {
      if (!t.spaceBefore) {
        return false;
      }
      switch (t.kind) {
        case IDENTIFIER:
        case CONSTANT:
        case IVAR:
        case GVAR:
        case CVAR:
        case INTEGER:
        case FLOAT:
        case STRING:
        case SYMBOL:
        case DSYMBOL:
        case REGEXP:
        case WORDS:
        case SYMBOLS:
        case LABEL:
          return true;
        case KEYWORD:
          return ARGUMENT_KEYWORDS.contains(t.text);
        case OPERATOR:
          switch (t.text) {
            case "(":
            case "[":
            case "->":
            case "~":
              return true;
            case "-":
            case "*":
            case "**":
            case "&":
            case "!":
            case "::":
              return !peekAt(1).spaceBefore;
            default:
              return false;
          }
        default:
          return false;
      }
    }

    private boolean startsExpression(Lexeme t) {
      switch (t.kind) {
        case NEWLINE:
        case EOF:
          return false;
        case KEYWORD:
          return !VALUELESS_FOLLOWERS.contains(t.text);
        case OPERATOR:
          switch (t.text) {
            case "(":
            case "[":
            case "{":
            case "->":
            case "-":
            case "!":
            case "~":
            case "::":
            case "*":
              return true;
            default:
              return false;
          }
        default:
          return true;
      }
    }

    /** Arguments without parentheses; a trailing {@code do} belongs to the call, not to them. */
    private List<Node> parseCommandArguments() {
      noDo++;
      try {
        return parseArgumentList(null);
      } finally {
        noDo--;
      }
    }

    /** Arguments inside brackets, where {@code do} binds normally again. */
    private List<Node> parseArgumentsUntil(String close) {
      int saved = noDo;
      noDo = 0;
      try {
        skipNewlines();
        if (atOperator(close)) {
          return ImmutableList.of();
        }
        List<Node> args = parseArgumentList(close);
        skipNewlines();
        return args;
      } finally {
        noDo = saved;
      }
    }

    /**
     * Comma separated arguments. Trailing {@code key: value} and {@code key => value} pairs are
     * collected into one hash.
     */
    private List<Node> parseArgumentList(@Nullable String close) {
      argumentDepth++;
      try {
        return parseArgumentListItems(close);
      } finally {
        argumentDepth--;
      }
    }

    private List<Node> parseArgumentListItems(@Nullable String close) {
      List<Node> args = new ArrayList<>();
      List<Node> pairs = new ArrayList<>();
      int hashStart = -1;
      boolean first = true;
      do {
        if (close != null || !first) {
          skipNewlines();
        }
        first = false;
        if (close != null && atOperator(close)) {
          break;
        }
        int start = peek().start;
        Node pair = parsePairIfPresent();
        if (pair == null) {
          Node arg = parseArgument();
          if (atOperator("=>")) {
            next();
            skipNewlines();
            Node value = parseArgument();
            pair = make(Token.PAIR, start, arg, value);
          } else {
            args.add(arg);
          }
        }
        if (pair != null) {
          if (pairs.isEmpty()) {
            hashStart = start;
          }
          pairs.add(pair);
        }
      } while (acceptOperator(","));
      if (!pairs.isEmpty()) {
        args.add(finish(Node.make(Token.HASH, pairs), hashStart));
      }
      return args;
    }

    /** Parses {@code key: value} or {@code **splat}, or returns null. */
    private @Nullable Node parsePairIfPresent() {
      Lexeme t = peek();
      if (t.kind == Kind.LABEL) {
        next();
        Node key = make(Token.SYM, t.start, t.text);
        skipNewlines();
        Node value = parseArgument();
        return make(Token.PAIR, t.start, key, value);
      }
      if (t.kind == Kind.STRING && peekAt(1).isOperator(":") && !peekAt(1).spaceBefore) {
        Node key = parseString(next(), Token.SYM, Token.DSYM);
        next();
        skipNewlines();
        Node value = parseArgument();
        return make(Token.PAIR, t.start, key, value);
      }
      if (t.isOperator("**")) {
        next();
        Node value = parseTernary();
        return make(Token.KWSPLAT, t.start, value);
      }
      return null;
    }

    /** One argument: an expression, {@code *splat} or {@code &block}. */
    private Node parseArgument() {
      Lexeme t = peek();
      if (t.isOperator("*")) {
        next();
        Node value = parseTernary();
        return make(Token.SPLAT, t.start, value);
      }
      if (t.isOperator("&")) {
        next();
        Node value = parseTernary();
        return make(Token.BLOCK_PASS, t.start, value);
      }
      return parseNotArgument();
    }

    private Node parseNotArgument() {
      if (atKeyword("not")) {
        Lexeme not = next();
        Node operand = parseExpression();
        return make(Token.SEND, not.start, operand, "!");
      }
      return parseExpression();
    }

    // Primaries.

    private Node parsePrimary() {
      Lexeme t = peek();
      switch (t.kind) {
        case INTEGER:
          next();
          try {
            return make(Token.INT, t.start, Long.parseLong(t.text));
          } catch (NumberFormatException e) {
            throw error(t, "integer literal out of range");
          }
        case FLOAT:
          next();
          return make(Token.FLOAT, t.start, Double.parseDouble(t.text));
        case STRING:
          next();
          if (t.text.startsWith("`")) {
            throw error(t, "command strings are not supported");
          }
          return parseString(t, Token.STR, Token.DSTR);
        case SYMBOL:
          next();
          return make(Token.SYM, t.start, t.text);
        case DSYMBOL:
          next();
          return parseString(t, Token.SYM, Token.DSYM);
        case REGEXP:
          next();
          return parseRegexp(t);
        case WORDS:
        case SYMBOLS:
          next();
          return parseWords(t);
        case IVAR:
          next();
          return make(Token.IVAR, t.start, t.text);
        case GVAR:
          next();
          return make(Token.GVAR, t.start, t.text);
        case CVAR:
          next();
          return make(Token.CVAR, t.start, t.text);
        case CONSTANT:
          next();
          if (atOperator("(") && !peek().spaceBefore) {
            return parseCallRest(null, t.text, Token.SEND, t.start);
          }
          return make(Token.CONST, t.start, null, t.text);
        case IDENTIFIER:
          next();
          return parseIdentifier(t);
        case KEYWORD:
          return parseKeyword(t);
        case OPERATOR:
          return parseOperatorPrimary(t);
        default:
          throw unexpected(t);
      }
    }

    private Node parseIdentifier(Lexeme t) {
      Lexeme after = peek();
      boolean parenthesized = after.isOperator("(") && !after.spaceBefore;
      if (!parenthesized && scope.isLocal(t.text)) {
        return make(Token.LVAR, t.start, t.text);
      }
      return parseCallRest(null, t.text, Token.SEND, t.start);
    }

    private Node parseString(Lexeme t, Token plain, Token interpolated) {
      ImmutableList<Part> parts = t.parts;
      if (parts.size() == 1 && !parts.get(0).code()) {
        return make(plain, t.start, parts.get(0).text());
      }
      List<Node> children = new ArrayList<>();
      for (Part part : parts) {
        children.add(parsePart(part));
      }
      return finish(Node.make(interpolated, children), t.start);
    }

    private Node parsePart(Part part) {
      SourceRange range = file.rangeOf(part.start(), part.end());
      if (!part.code()) {
        return Node.make(Token.STR, part.text()).withSourceRange(range);
      }
      Parsing inner = new Parsing(file, part.start(), part.end(), comments, scope);
      List<Node> statements = inner.parseStatements();
      if (inner.peek().kind != Kind.EOF) {
        throw inner.unexpected(inner.peek());
      }
      return Node.make(Token.BEGIN, statements).withSourceRange(range);
    }

    private Node parseRegexp(Lexeme t) {
      List<@Nullable Object> children = new ArrayList<>();
      for (Part part : t.parts) {
        children.add(parsePart(part));
      }
      List<Object> flags = new ArrayList<>();
      for (char c : t.flags.toCharArray()) {
        flags.add(String.valueOf(c));
      }
      int flagStart = t.end - t.flags.length();
      children.add(
          Node.make(Token.REGOPT, flags).withSourceRange(file.rangeOf(flagStart, t.end)));
      return finish(Node.make(Token.REGEXP, children), t.start);
    }

    private Node parseWords(Lexeme t) {
      Token element = t.kind == Kind.WORDS ? Token.STR : Token.SYM;
      List<Node> children = new ArrayList<>();
      for (Part part : t.parts) {
        children.add(
            Node.make(element, part.text())
                .withSourceRange(file.rangeOf(part.start(), part.end())));
      }
      return finish(Node.make(Token.ARRAY, children), t.start);
    }

    private Node parseOperatorPrimary(Lexeme t) {
      switch (t.text) {
        case "(":
          {
            next();
            List<Node> statements = nested(this::parseStatements);
            expectOperator(")");
            return withParens(finish(Node.make(Token.BEGIN, statements), t.start));
          }
        case "[":
          {
            next();
            List<Node> elements = parseArgumentsUntil("]");
            expectOperator("]");
            return finish(Node.make(Token.ARRAY, elements), t.start);
          }
        case "{":
          return parseHash();
        case "->":
          return parseLambda();
        case "::":
          {
            next();
            Lexeme name = expectKind(Kind.CONSTANT, "constant name");
            Node base = make(Token.CBASE, t.start);
            return make(Token.CONST, t.start, base, name.text);
          }
        case "..":
        case "...":
          {
            next();
            Node end = parseBinary(0);
            return make(t.text.equals("..") ? Token.IRANGE : Token.ERANGE, t.start, null, end);
          }
        default:
          throw unexpected(t);
      }
    }

    private Node parseHash() {
      Lexeme open = next();
      int savedNoDo = noDo;
      noDo = 0;
      argumentDepth++;
      List<Node> pairs = new ArrayList<>();
      try {
        skipNewlines();
        while (!atOperator("}")) {
          int start = peek().start;
          Node pair = parsePairIfPresent();
          if (pair == null) {
            Node key = parseArgument();
            skipNewlines();
            expectOperator("=>");
            skipNewlines();
            Node value = parseArgument();
            pair = make(Token.PAIR, start, key, value);
          }
          pairs.add(pair);
          skipNewlines();
          if (!acceptOperator(",")) {
            break;
          }
          skipNewlines();
        }
      } finally {
        noDo = savedNoDo;
        argumentDepth--;
      }
      skipNewlines();
      expectOperator("}");
      return finish(Node.make(Token.HASH, pairs), open.start);
    }

    private Node parseLambda() {
      return nested(this::parseLambdaLiteral);
    }

    private Node parseLambdaLiteral() {
      Lexeme arrow = next();
      Node call = make(Token.SEND, arrow.start, null, "lambda");
      scope.enterScope(ScopeTracker.Kind.BLOCK);
      try {
        Node args;
        if (atOperator("(")) {
          Lexeme open = next();
          args = parseParameters(")", open.start);
          expectOperator(")");
          args = finish(args, open.start);
        } else if (peek().kind == Kind.IDENTIFIER) {
          args = parseParameters("{", peek().start);
        } else {
          args = make(Token.ARGS, peek().start);
        }
        String close;
        if (acceptOperator("{")) {
          close = "}";
        } else {
          expectKeyword("do");
          close = "end";
        }
        Node body = body(parseStatements());
        if (close.equals("}")) {
          expectOperator("}");
        } else {
          expectKeyword("end");
        }
        return make(Token.BLOCK, arrow.start, call, args, body);
      } finally {
        scope.exitScope();
      }
    }

    private Node parseBlock(Node call, String close) {
      return nested(() -> parseBlockLiteral(call, close));
    }

    private Node parseBlockLiteral(Node call, String close) {
      next();
      scope.enterScope(ScopeTracker.Kind.BLOCK);
      try {
        Node args;
        int argsStart = peek().start;
        if (atOperator("||")) {
          next();
          args = make(Token.ARGS, argsStart);
        } else if (acceptOperator("|")) {
          args = parseParameters("|", argsStart);
          expectOperator("|");
          args = finish(args, argsStart);
        } else {
          args = make(Token.ARGS, argsStart);
        }
        Node body;
        if (close.equals("end")) {
          body = parseBodyWithRescue();
          expectKeyword("end");
        } else {
          body = body(parseStatements());
          expectOperator("}");
        }
        return make(Token.BLOCK, startOf(call), call, args, body);
      } finally {
        scope.exitScope();
      }
    }

    /**
     * Parses parameters up to (not including) {@code close}, declaring each one in the current
     * scope. Defaults inside {@code |...|} are restricted to unary expressions, since a binary
     * {@code |} would end the list.
     */
    private Node parseParameters(String close, int start) {
      List<Node> params = new ArrayList<>();
      boolean pipes = close.equals("|");
      while (!atOperator(close) && peek().kind != Kind.NEWLINE && !atKeyword("do")) {
        params.add(parseParameter(pipes));
        if (!acceptOperator(",")) {
          break;
        }
        skipNewlines();
      }
      return finish(Node.make(Token.ARGS, params), start);
    }

    private Node parseParameter(boolean pipes) {
      Lexeme t = next();
      if (t.isOperator("*") || t.isOperator("**") || t.isOperator("&")) {
        Token token;
        if (t.isOperator("*")) {
          token = Token.RESTARG;
        } else {
          token = t.isOperator("**") ? Token.KWRESTARG : Token.BLOCKARG;
        }
        if (peek().kind == Kind.IDENTIFIER && !peek().spaceBefore) {
          Lexeme name = next();
          scope.declareLocal(name.text);
          return make(token, t.start, name.text);
        }
        return make(token, t.start);
      }
      if (t.isOperator("(")) {
        List<Node> inner = new ArrayList<>();
        do {
          inner.add(parseParameter(pipes));
        } while (acceptOperator(","));
        expectOperator(")");
        return finish(Node.make(Token.MLHS, inner), t.start);
      }
      if (t.kind == Kind.LABEL) {
        scope.declareLocal(t.text);
        if (atOperator(",") || atOperator(")") || atOperator("|") || peek().kind == Kind.NEWLINE) {
          return make(Token.KWARG, t.start, t.text);
        }
        Node value = pipes ? parseUnary() : parseTernary();
        return make(Token.KWOPTARG, t.start, t.text, value);
      }
      if (t.kind != Kind.IDENTIFIER) {
        throw error(t, "unexpected " + t + ", expecting parameter name");
      }
      scope.declareLocal(t.text);
      if (acceptOperator("=")) {
        Node value = pipes ? parseUnary() : parseTernary();
        return make(Token.OPTARG, t.start, t.text, value);
      }
      return make(Token.ARG, t.start, t.text);
    }

    // Keywords.

    private Node parseKeyword(Lexeme t) {
      switch (t.text) {
        case "nil":
          next();
          return make(Token.NIL, t.start);
        case "true":
          next();
          return make(Token.TRUE, t.start);
        case "false":
          next();
          return make(Token.FALSE, t.start);
        case "self":
          next();
          return make(Token.SELF, t.start);
        case "if":
        case "unless":
        case "while":
        case "until":
        case "case":
        case "for":
        case "def":
        case "class":
        case "module":
        case "begin":
          next();
          return nested(() -> parseCompound(t));
        case "return":
          next();
          return parseJump(Token.RETURN, t);
        case "break":
          next();
          return parseJump(Token.BREAK, t);
        case "next":
          next();
          return parseJump(Token.NEXT, t);
        case "yield":
          next();
          return parseYieldOrSuper(Token.YIELD, t);
        case "super":
          next();
          return parseYieldOrSuper(Token.SUPER, t);
        case "alias":
          next();
          return parseAlias(t);
        case "defined?":
          {
            next();
            boolean parens = acceptOperator("(");
            Node operand = parens ? parseExpressionStatement() : parseUnary();
            if (parens) {
              expectOperator(")");
            }
            return make(Token.DEFINED, t.start, operand);
          }
        case "not":
          next();
          return make(Token.SEND, t.start, parseExpression(), "!");
        default:
          if (UNSUPPORTED_KEYWORDS.contains(t.text)) {
            throw error(t, "'" + t.text + "' is not supported");
          }
          throw unexpected(t);
      }
    }

    private Node parseCompound(Lexeme keyword) {
      switch (keyword.text) {
        case "if":
        case "unless":
          return parseIf(keyword);
        case "while":
        case "until":
          return parseWhile(keyword);
        case "case":
          return parseCase(keyword);
        case "for":
          return parseFor(keyword);
        case "def":
          return parseDef(keyword);
        case "class":
          return parseClass(keyword);
        case "module":
          return parseModule(keyword);
        default:
          return parseBegin(keyword);
      }
    }

    private Node parseIf(Lexeme keyword) {
      Node condition = parseExpressionStatement();
      acceptThen();
      Node thenBody = body(parseStatements());
      Node elseBody = null;
      if (atKeyword("elsif")) {
        Lexeme elsif = next();
        elseBody = parseIf(elsif);
      } else if (acceptKeyword("else")) {
        elseBody = body(parseStatements());
      }
      if (!keyword.text.equals("elsif")) {
        expectKeyword("end");
      }
      if (keyword.text.equals("unless")) {
        return make(Token.IF, keyword.start, condition, elseBody, thenBody);
      }
      return make(Token.IF, keyword.start, condition, thenBody, elseBody);
    }

    private Node parseWhile(Lexeme keyword) {
      noDo++;
      Node condition;
      try {
        condition = parseExpressionStatement();
      } finally {
        noDo--;
      }
      skipNewlines();
      acceptKeyword("do");
      Node loopBody = body(parseStatements());
      expectKeyword("end");
      Token token = keyword.text.equals("while") ? Token.WHILE : Token.UNTIL;
      return make(token, keyword.start, condition, loopBody);
    }

    private Node parseCase(Lexeme keyword) {
      Node subject = peek().kind == Kind.NEWLINE ? null : parseExpressionStatement();
      skipNewlines();
      if (atKeyword("in")) {
        throw error(peek(), "pattern matching is not supported");
      }
      List<@Nullable Object> children = new ArrayList<>();
      children.add(subject);
      while (atKeyword("when")) {
        Lexeme when = next();
        List<@Nullable Object> whenChildren = new ArrayList<>();
        do {
          skipNewlines();
          whenChildren.add(parseArgument());
        } while (acceptOperator(","));
        acceptThen();
        whenChildren.add(body(parseStatements()));
        children.add(finish(Node.make(Token.WHEN, whenChildren), when.start));
      }
      if (children.size() == 1) {
        throw error(peek(), "unexpected " + peek() + ", expecting 'when'");
      }
      children.add(acceptKeyword("else") ? body(parseStatements()) : null);
      expectKeyword("end");
      return finish(Node.make(Token.CASE, children), keyword.start);
    }

    private Node parseFor(Lexeme keyword) {
      Node variable;
      Lexeme name = expectKind(Kind.IDENTIFIER, "loop variable");
      scope.declareLocal(name.text);
      variable = make(Token.LVASGN, name.start, name.text);
      if (atOperator(",")) {
        List<Node> targets = new ArrayList<>();
        targets.add(variable);
        while (acceptOperator(",")) {
          Lexeme other = expectKind(Kind.IDENTIFIER, "loop variable");
          scope.declareLocal(other.text);
          targets.add(make(Token.LVASGN, other.start, other.text));
        }
        variable = finish(Node.make(Token.MLHS, targets), name.start);
      }
      expectKeyword("in");
      noDo++;
      Node iterable;
      try {
        iterable = parseExpressionStatement();
      } finally {
        noDo--;
      }
      skipNewlines();
      acceptKeyword("do");
      Node loopBody = body(parseStatements());
      expectKeyword("end");
      return make(Token.FOR, keyword.start, variable, iterable, loopBody);
    }

    private Node parseDef(Lexeme keyword) {
      Node singleton = null;
      Lexeme nameToken = next();
      if ((nameToken.is(Kind.IDENTIFIER, "self") || nameToken.kind == Kind.CONSTANT)
          && atOperator(".")) {
        singleton =
            nameToken.kind == Kind.CONSTANT
                ? make(Token.CONST, nameToken.start, null, nameToken.text)
                : make(Token.SELF, nameToken.start);
        next();
        nameToken = next();
      }
      String name = methodName(nameToken);

      scope.enterScope(ScopeTracker.Kind.METHOD);
      try {
        Node args;
        boolean parens = false;
        if (atOperator("(") && !peek().spaceBefore) {
          Lexeme open = next();
          parens = true;
          skipNewlines();
          args = parseParameters(")", open.start);
          skipNewlines();
          expectOperator(")");
          args = finish(args, open.start);
        } else if (peek().kind != Kind.NEWLINE && !atOperator("=")) {
          args = parseParameters("\n", peek().start);
        } else {
          args = make(Token.ARGS, peek().start);
        }

        Node methodBody;
        if (acceptOperator("=")) {
          skipNewlines();
          methodBody = parseStatement();
        } else {
          methodBody = parseBodyWithRescue();
          expectKeyword("end");
        }
        Node def =
            singleton == null
                ? make(Token.DEF, keyword.start, name, args, methodBody)
                : make(Token.DEFS, keyword.start, singleton, name, args, methodBody);
        return parens ? withParens(def) : def;
      } finally {
        scope.exitScope();
      }
    }

    private String methodName(Lexeme t) {
      String name;
      switch (t.kind) {
        case IDENTIFIER:
        case CONSTANT:
        case KEYWORD:
          name = t.text;
          // "def name=(value)"
          if (atOperator("=") && !peek().spaceBefore && peekAt(1).isOperator("(")
              && !peekAt(1).spaceBefore) {
            next();
            name += "=";
          }
          return name;
        case OPERATOR:
          if (t.isOperator("[")) {
            expectOperator("]");
            name = "[]";
            if (atOperator("=") && !peek().spaceBefore) {
              next();
              name = "[]=";
            }
            return name;
          }
          if (t.text.equals("(") || t.text.equals(")") || t.text.equals(",")) {
            break;
          }
          return t.text;
        default:
          break;
      }
      throw error(t, "unexpected " + t + ", expecting method name");
    }

    private Node parseClass(Lexeme keyword) {
      if (acceptOperator("<<")) {
        Node target = parseExpression();
        scope.enterScope(ScopeTracker.Kind.CLASS);
        try {
          Node classBody = body(parseStatements());
          expectKeyword("end");
          return make(Token.SCLASS, keyword.start, target, classBody);
        } finally {
          scope.exitScope();
        }
      }
      Node name = parseConstantPath();
      Node superclass = null;
      if (acceptOperator("<")) {
        superclass = parseExpression();
      }
      scope.enterScope(ScopeTracker.Kind.CLASS, qualifiedName(name));
      try {
        Node classBody = parseBodyWithRescue();
        expectKeyword("end");
        return make(Token.CLASS, keyword.start, name, superclass, classBody);
      } finally {
        scope.exitScope();
      }
    }

    private Node parseModule(Lexeme keyword) {
      Node name = parseConstantPath();
      scope.enterScope(ScopeTracker.Kind.MODULE, qualifiedName(name));
      try {
        Node moduleBody = body(parseStatements());
        expectKeyword("end");
        return make(Token.MODULE, keyword.start, name, moduleBody);
      } finally {
        scope.exitScope();
      }
    }

    private Node parseConstantPath() {
      int start = peek().start;
      Node path;
      if (atOperator("::")) {
        next();
        path = make(Token.CBASE, start);
        path = make(Token.CONST, start, path, expectKind(Kind.CONSTANT, "constant name").text);
      } else {
        path = make(Token.CONST, start, null, expectKind(Kind.CONSTANT, "constant name").text);
      }
      while (acceptOperator("::")) {
        path = make(Token.CONST, start, path, expectKind(Kind.CONSTANT, "constant name").text);
      }
      return path;
    }

    private static String qualifiedName(Node constant) {
      Node scopeNode = constant.getNode(0);
      String name = constant.getString(1);
      if (scopeNode == null || !scopeNode.isToken(Token.CONST)) {
        return name;
      }
      return qualifiedName(scopeNode) + "::" + name;
    }

    private Node parseBegin(Lexeme keyword) {
      int bodyStart = peek().start;
      List<Node> statements = parseStatements();
      Node rescued = parseRescueClauses(body(statements), bodyStart);
      expectKeyword("end");
      if (rescued != null && (rescued.isToken(Token.RESCUE) || rescued.isToken(Token.ENSURE))) {
        return make(Token.KWBEGIN, keyword.start, rescued);
      }
      return finish(Node.make(Token.KWBEGIN, statements), keyword.start);
    }

    /** A body that may be followed by {@code rescue}, {@code else} and {@code ensure} clauses. */
    private @Nullable Node parseBodyWithRescue() {
      int start = peek().start;
      Node statements = body(parseStatements());
      return parseRescueClauses(statements, start);
    }

    private @Nullable Node parseRescueClauses(@Nullable Node protectedBody, int start) {
      List<@Nullable Object> rescue = new ArrayList<>();
      rescue.add(protectedBody);
      while (atKeyword("rescue")) {
        Lexeme keyword = next();
        Node classes = null;
        if (peek().kind != Kind.NEWLINE && !atOperator("=>") && !atKeyword("then")) {
          int classesStart = peek().start;
          List<Node> list = new ArrayList<>();
          do {
            list.add(parseTernary());
          } while (acceptOperator(","));
          classes = finish(Node.make(Token.ARRAY, list), classesStart);
        }
        Node variable = null;
        if (acceptOperator("=>")) {
          Lexeme name = next();
          if (name.kind == Kind.IDENTIFIER) {
            scope.declareLocal(name.text);
          } else if (name.kind != Kind.IVAR) {
            throw error(name, "unexpected " + name + ", expecting variable name");
          }
          variable = make(assignmentToken(name), name.start, name.text);
        }
        acceptThen();
        Node handler = body(parseStatements());
        rescue.add(make(Token.RESBODY, keyword.start, classes, variable, handler));
      }
      Node result = protectedBody;
      if (rescue.size() > 1) {
        rescue.add(acceptKeyword("else") ? body(parseStatements()) : null);
        result = finish(Node.make(Token.RESCUE, rescue), start);
      }
      if (acceptKeyword("ensure")) {
        Node cleanup = body(parseStatements());
        result = make(Token.ENSURE, start, result, cleanup);
      }
      return result;
    }

    private Node parseJump(Token token, Lexeme keyword) {
      if (!startsExpression(peek()) || atOperator("{")) {
        return make(token, keyword.start);
      }
      int start = peek().start;
      List<Node> values = parseCommandArguments();
      if (values.size() == 1 && !values.get(0).isToken(Token.SPLAT)) {
        return make(token, keyword.start, values.get(0));
      }
      Node array = finish(Node.make(Token.ARRAY, values), start);
      return make(token, keyword.start, array);
    }

    private Node parseYieldOrSuper(Token token, Lexeme keyword) {
      Lexeme t = peek();
      if (t.isOperator("(") && !t.spaceBefore) {
        next();
        List<Node> args = parseArgumentsUntil(")");
        expectOperator(")");
        return withParens(finish(Node.make(token, args), keyword.start));
      }
      if (startsCommandArgument(t)) {
        return finish(Node.make(token, parseCommandArguments()), keyword.start);
      }
      return make(token == Token.SUPER ? Token.ZSUPER : token, keyword.start);
    }

    private Node parseAlias(Lexeme keyword) {
      Node newName = aliasName(next());
      Node oldName = aliasName(next());
      return make(Token.ALIAS, keyword.start, newName, oldName);
    }

    private Node aliasName(Lexeme t) {
      switch (t.kind) {
        case IDENTIFIER:
        case CONSTANT:
        case KEYWORD:
        case SYMBOL:
          return make(Token.SYM, t.start, t.text);
        default:
          throw error(t, "unexpected " + t + ", expecting method name");
      }
    }
  }
}
