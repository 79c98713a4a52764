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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Static helpers for reasoning about nodes as the JavaScript they print as. */
final class NodeUtil {

  // JavaScript operator precedence, lowest first.
  static final int COMMA = 0;
  static final int ASSIGN = 1;
  static final int HOOK = 3;
  static final int OR = 4;
  static final int AND = 5;
  static final int COALESCE = 6;
  static final int BITOR = 7;
  static final int BITXOR = 8;
  static final int BITAND = 9;
  static final int EQUALITY = 10;
  static final int RELATIONAL = 11;
  static final int SHIFT = 12;
  static final int ADDITIVE = 13;
  static final int MULTIPLICATIVE = 14;
  static final int EXPONENT = 15;
  static final int UNARY = 16;
  static final int POSTFIX = 17;
  static final int MEMBER = 18;
  static final int PRIMARY = 19;

  /** Words that cannot name a JavaScript variable. */
  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "arguments", "await", "break", "case", "catch", "class", "const", "continue",
          "debugger", "default", "delete", "do", "else", "enum", "eval", "export", "extends",
          "false", "finally", "for", "function", "if", "implements", "import", "in",
          "instanceof", "interface", "let", "new", "null", "package", "private", "protected",
          "public", "return", "static", "super", "switch", "this", "throw", "true", "try",
          "typeof", "var", "void", "while", "with", "yield");

  private static final ImmutableSet<String> BINARY_OPERATORS =
      ImmutableSet.of(
          "+", "-", "*", "/", "%", "**", "==", "!=", "===", "!==", "<", "<=", ">", ">=", "<<", ">>",
          "&", "|", "^", "=~", "!~", "<=>");

  private NodeUtil() {}

  static boolean isReservedWord(String name) {
    return RESERVED_WORDS.contains(name);
  }

  /** Returns {@code name} if it can be used as a JavaScript variable, otherwise {@code name$}. */
  static String safeName(String name) {
    return isReservedWord(name) ? name + "$" : name;
  }

  static boolean isValidSimpleName(String name) {
    if (name.isEmpty() || !isIdentifierStart(name.charAt(0))) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      if (!isIdentifierPart(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  static boolean isBinaryOperator(String selector) {
    return BINARY_OPERATORS.contains(selector);
  }

  /** A receiver-bearing send of one of the binary operators, such as {@code (send a :+ b)}. */
  static boolean isBinaryOperation(Node n) {
    return n.isToken(Token.SEND)
        && n.getChildCount() == 3
        && n.getChild(0) != null
        && isBinaryOperator(n.getString(1));
  }

  /** A unary operator send: {@code !x}, {@code -x}, {@code +x} or {@code ~x}. */
  static boolean isUnaryOperation(Node n) {
    if (!n.isToken(Token.SEND) || n.getChildCount() != 2 || n.getChild(0) == null) {
      return false;
    }
    String selector = n.getString(1);
    return selector.equals("!")
        || selector.equals("-@")
        || selector.equals("+@")
        || selector.equals("~");
  }

  /** The statements of a body: the children of a {@code begin}, or the body itself. */
  static ImmutableList<Node> statementsOf(@Nullable Node body) {
    if (body == null) {
      return ImmutableList.of();
    }
    if (body.isToken(Token.BEGIN)) {
      return body.childNodes();
    }
    return ImmutableList.of(body);
  }

  static boolean isLiteral(@Nullable Node n) {
    if (n == null) {
      return false;
    }
    switch (n.getToken()) {
      case INT:
      case FLOAT:
      case STR:
      case SYM:
      case NIL:
      case TRUE:
      case FALSE:
        return true;
      default:
        return false;
    }
  }

  /** Whether evaluating {@code n} twice is the same as evaluating it once. */
  static boolean isSimple(@Nullable Node n) {
    if (n == null || isLiteral(n)) {
      return true;
    }
    switch (n.getToken()) {
      case LVAR:
      case IVAR:
      case GVAR:
      case CVAR:
      case SELF:
        return true;
      case CONST:
        return isSimple(n.getNode(0));
      case CBASE:
        return true;
      case ATTR:
        return isSimple(n.getNode(0));
      case SEND:
        return n.getChildCount() == 2
            && !n.isMethodCallShape()
            && n.getChild(0) != null
            && isSimple(n.getNode(0));
      default:
        return false;
    }
  }

  /** Whether the node renders as a statement that has no expression form. */
  static boolean isStatementOnly(Node n) {
    switch (n.getToken()) {
      case WHILE:
      case UNTIL:
      case WHILE_POST:
      case UNTIL_POST:
      case FOR:
      case RETURN:
      case BREAK:
      case NEXT:
      case CLASS:
      case MODULE:
      case SCLASS:
      case ALIAS:
      case RESCUE:
      case ENSURE:
      case AUTORETURN:
      case HIDE:
        return true;
      case CASE:
        return true;
      case KWBEGIN:
      case BEGIN:
        return n.childNodes().stream().anyMatch(NodeUtil::isStatementOnly)
            || (n.isToken(Token.KWBEGIN) && n.getChildCount() > 1);
      case IF:
        for (Node child : n.childNodes()) {
          if (isStatementOnly(child) || isMultiStatement(child)) {
            return true;
          }
        }
        return false;
      case SEND:
        return isRaise(n);
      case BLOCK:
        return isLoopCall(n.getNode(0));
      default:
        return false;
    }
  }

  private static boolean isMultiStatement(Node n) {
    return n.isToken(Token.BEGIN) && n.getChildCount() > 1;
  }

  /** An attribute or index assignment: {@code (send a :b= v)} or {@code (send a :[]= i v)}. */
  static boolean isSetter(Node n) {
    if (!n.isToken(Token.SEND) || n.getChild(0) == null || n.getChildCount() < 3) {
      return false;
    }
    return isSetterName(n.getString(1));
  }

  /** {@code x=} or {@code []=}, but not a comparison operator. */
  static boolean isSetterName(String selector) {
    return selector.equals("[]=")
        || (selector.length() > 1
            && selector.endsWith("=")
            && isIdentifierStart(selector.charAt(0)));
  }

  /**
   * The {@code x instanceof C} test the generator builds for {@code case} and {@code rescue}. Only
   * synthetic nodes qualify, so a Ruby method named instanceof still prints as a call.
   */
  static boolean isInstanceofTest(Node n) {
    return n.isToken(Token.SEND)
        && n.isSynthetic()
        && n.getChildCount() == 3
        && n.getChild(0) != null
        && "instanceof".equals(n.getChild(1));
  }

  /** {@code raise ...} with no receiver. */
  static boolean isRaise(Node n) {
    return n.isToken(Token.SEND)
        && n.getChild(0) == null
        && n.getString(1).equals("raise")
        && n.getChildCount() > 2;
  }

  /** {@code loop} with no receiver and no arguments, the call of a {@code loop do ... end}. */
  static boolean isLoopCall(@Nullable Node call) {
    return call != null
        && call.isToken(Token.SEND)
        && call.getChild(0) == null
        && call.getString(1).equals("loop")
        && call.getChildCount() == 2;
  }

  /** {@code lambda}, {@code proc} or {@code ->}, whose blocks print as bare functions. */
  static boolean isLambdaCall(@Nullable Node call) {
    if (call == null || !call.isToken(Token.SEND) || call.getChildCount() != 2) {
      return false;
    }
    String selector = call.getString(1);
    if (call.getChild(0) == null) {
      return selector.equals("lambda") || selector.equals("proc");
    }
    Node receiver = call.getNode(0);
    return selector.equals("new")
        && receiver.isToken(Token.CONST)
        && receiver.getChild(0) == null
        && receiver.getString(1).equals("Proc");
  }

  /** The precedence of {@code n} as printed at {@code mode}. */
  static int precedence(Node n, LanguageMode mode) {
    switch (n.getToken()) {
      case BEGIN:
      case KWBEGIN:
        {
          List<Node> children = n.childNodes();
          if (children.isEmpty()) {
            return PRIMARY;
          }
          if (children.size() == 1) {
            return precedence(children.get(0), mode);
          }
          return n.isToken(Token.BEGIN) ? COMMA : MEMBER;
        }
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
      case CASGN:
      case OP_ASGN:
      case OR_ASGN:
      case AND_ASGN:
      case MASGN:
        return ASSIGN;
      case IF:
        return isStatementOnly(n) ? MEMBER : HOOK;
      case OR:
        return OR;
      case AND:
        return AND;
      case NOT:
      case TYPEOF:
        return UNARY;
      case DEFINED:
        return EQUALITY;
      case INT:
        return ((Long) n.getChild(0)) < 0 ? UNARY : PRIMARY;
      case FLOAT:
        return ((Double) n.getChild(0)) < 0 ? UNARY : PRIMARY;
      case DSTR:
      case DSYM:
        return mode.isEs5() ? ADDITIVE : PRIMARY;
      case BLOCK:
        return isLambdaCall(n.getNode(0)) ? ASSIGN : MEMBER;
      case CSEND:
        return mode.isAtLeast(LanguageMode.ECMASCRIPT_2020) ? MEMBER : AND;
      case SEND:
        return sendPrecedence(n, mode);
      case STR:
      case SYM:
      case NIL:
      case TRUE:
      case FALSE:
      case SELF:
      case ARRAY:
      case HASH:
      case REGEXP:
      case LVAR:
      case IVAR:
      case GVAR:
      case CVAR:
      case CONST:
      case CBASE:
        return PRIMARY;
      default:
        return MEMBER;
    }
  }

  private static int sendPrecedence(Node n, LanguageMode mode) {
    if (isSetter(n)) {
      return ASSIGN;
    }
    if (isInstanceofTest(n)) {
      return RELATIONAL;
    }
    if (isUnaryOperation(n)) {
      return UNARY;
    }
    if (!isBinaryOperation(n)) {
      return MEMBER;
    }
    switch (n.getString(1)) {
      case "**":
        return mode.isAtLeast(LanguageMode.ECMASCRIPT_2016) ? EXPONENT : MEMBER;
      case "*":
      case "/":
      case "%":
        return MULTIPLICATIVE;
      case "+":
      case "-":
        return ADDITIVE;
      case "<<":
      case ">>":
        return SHIFT;
      case "<":
      case "<=":
      case ">":
      case ">=":
        return RELATIONAL;
      case "==":
      case "!=":
      case "===":
      case "!==":
        return EQUALITY;
      case "&":
        return BITAND;
      case "^":
        return BITXOR;
      case "|":
        return BITOR;
      case "!~":
        return UNARY;
      default:
        return MEMBER;
    }
  }
}
