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
import com.google.rubyjs.ast.Comment;
import com.google.rubyjs.ast.IR;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import com.google.rubyjs.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates JavaScript code from a filtered Ruby syntax tree, sending it to the
 * specified CodeConsumer.
 *
 * <p>Every node is printed either as a statement or as an expression. Statement-only constructs
 * that show up where a value is needed are wrapped in an immediately invoked function. Parentheses
 * are added only where the precedence of a child is lower than its position requires.
 */
final class CodeGenerator {

  static final DiagnosticType BANG_METHOD =
      DiagnosticType.warning("RBJS_BANG_METHOD", "Method {0} is called without its trailing !");

  static final DiagnosticType OPTIONAL_CHAIN_LOWERED =
      DiagnosticType.warning(
          "RBJS_OPTIONAL_CHAIN_LOWERED",
          "Safe navigation to {0} evaluates its receiver twice below ES2020");

  static final DiagnosticType THIS_IN_FUNCTION =
      DiagnosticType.warning(
          "RBJS_THIS_IN_FUNCTION", "Block refers to self, which an ES5 function does not keep");

  static final DiagnosticType INHERITED_IVAR =
      DiagnosticType.warning(
          "RBJS_INHERITED_IVAR",
          "Instance variable {0} is read in {1} without being assigned there. Private fields are"
              + " not inherited");

  private static final String IMPLICIT_BLOCK = "_implicitBlockYield";
  private static final String EXCEPTION = "$EXCEPTION";
  private static final ImmutableSet<String> VISIBILITY =
      ImmutableSet.of("private", "protected", "public", "module_function");
  private static final ImmutableSet<String> CATCH_ALL =
      ImmutableSet.of("StandardError", "Exception");

  /**
   * Information on the current context. Used for disambiguating special cases. For example, a "{"
   * could start an object literal or a block, depending on where it is printed.
   */
  enum Context {
    STATEMENT,
    START_OF_EXPR,
    // Handle object literals at the start of a non-block arrow function body.
    START_OF_ARROW_FN_BODY,
    OTHER; // nothing special to watch out for.

    boolean atStart() {
      return this != OTHER;
    }
  }

  /** What {@code break} and {@code next} leave. */
  private enum Jump {
    LOOP,
    BLOCK,
    FUNCTION,
    SWITCH
  }

  private enum MemberKind {
    CONSTRUCTOR,
    METHOD,
    GETTER,
    SETTER,
    ATTR,
    CONSTANT,
    CLASS_VARIABLE,
    INCLUDE,
    EXTEND,
    ALIAS,
    NESTED,
    VISIBILITY,
    OTHER
  }

  /** The class or module whose body is being printed. */
  private static final class ClassInfo {
    /** How generated code refers to the class, such as {@code Outer.Inner}. */
    final String name;
    final @Nullable Node superclass;
    final boolean isModule;
    final Set<String> methods = new LinkedHashSet<>();
    final Set<String> getters = new LinkedHashSet<>();
    final Set<String> staticMethods = new LinkedHashSet<>();
    final Set<String> staticGetters = new LinkedHashSet<>();
    /** Instance methods defined with def, which attr_* declarations do not override. */
    final Set<String> explicit = new LinkedHashSet<>();
    boolean privateFields;

    ClassInfo(String name, @Nullable Node superclass, boolean isModule) {
      this.name = name;
      this.superclass = superclass;
      this.isModule = isModule;
    }

    Set<String> methods(boolean isStatic) {
      return isStatic ? staticMethods : methods;
    }

    Set<String> getters(boolean isStatic) {
      return isStatic ? staticGetters : getters;
    }
  }

  /** The method whose body is being printed. */
  private static final class MethodInfo {
    final String name;
    final @Nullable Node args;
    final boolean constructor;
    final boolean isStatic;
    final boolean getter;
    final @Nullable String yieldName;

    MethodInfo(
        String name,
        @Nullable Node args,
        boolean constructor,
        boolean isStatic,
        boolean getter,
        @Nullable String yieldName) {
      this.name = name;
      this.args = args;
      this.constructor = constructor;
      this.isStatic = isStatic;
      this.getter = getter;
      this.yieldName = yieldName;
    }
  }

  private final CodeConsumer cc;
  private final ConversionContext conversion;
  private final ConversionOptions options;
  private final LanguageMode mode;
  private final CommentMap comments;

  /** Locals declared in the function being printed. */
  private Set<String> declared = new LinkedHashSet<>();
  private final Deque<Jump> jumps = new ArrayDeque<>();
  private @Nullable MethodInfo method = null;
  private @Nullable ClassInfo currentClass = null;
  /** What {@code self} prints as, when it is not {@code this}. */
  private @Nullable String selfName = null;
  private final Map<String, Integer> tempCounts = new LinkedHashMap<>();

  CodeGenerator(CodeConsumer consumer, ConversionContext context, CommentMap comments) {
    this.cc = consumer;
    this.conversion = context;
    this.options = context.getOptions();
    this.mode = context.getLanguageMode();
    this.comments = comments;
  }

  void printProgram(Node root) {
    List<Node> statements =
        root.isToken(Token.BEGIN) ? root.childNodes() : ImmutableList.of(root);
    printStatements(statements, false);
    for (Comment comment : comments.takeRemaining()) {
      cc.addComment(comment.text());
    }
  }

  // Statements.

  private void printStatements(List<Node> statements, boolean returning) {
    Node previous = null;
    for (int i = 0; i < statements.size(); i++) {
      Node statement = statements.get(i);
      printLeading(statement, previous);
      hoistLocals(statement);
      if (returning && i == statements.size() - 1) {
        printReturning(statement);
      } else {
        printStatement(statement);
      }
      previous = statement;
    }
  }

  /** Keeps a blank line between {@code statement} and the previous one, then its comments. */
  private void printLeading(Node statement, @Nullable Node previous) {
    SourceRange range = statement.getSourceRange();
    if (range == null) {
      return;
    }
    if (previous != null && previous.getSourceRange() != null) {
      int firstLine = comments.firstLeadingLine(range);
      if (firstLine < 0) {
        firstLine = range.line();
      }
      if (firstLine > previous.getSourceRange().endLine() + 1) {
        cc.blankLine();
      }
    }
    for (Comment comment : comments.takeLeading(range)) {
      cc.addComment(comment.text());
    }
  }

  private void printTrailing(Node statement) {
    SourceRange range = statement.getSourceRange();
    if (range != null) {
      for (Comment comment : comments.takeTrailing(range)) {
        cc.addTrailingComment(comment.text());
      }
    }
  }

  private void printStatement(Node n) {
    switch (n.getToken()) {
      case BEGIN:
      case KWBEGIN:
      case HIDE:
        printStatements(n.childNodes(), false);
        return;
      case AUTORETURN:
        printStatements(n.childNodes(), true);
        return;
      default:
        break;
    }
    cc.beginStatement();
    cc.startSourceMapping(n);
    boolean endsWithBlock = addStatement(n);
    cc.endSourceMapping(n);
    finishStatement(n, endsWithBlock);
  }

  private void finishStatement(Node n, boolean endsWithBlock) {
    if (!endsWithBlock) {
      cc.endStatement();
    }
    printTrailing(n);
    cc.endLine();
  }

  /** Ends the statement printed so far and starts another one for the same source statement. */
  private void nextStatement(boolean previousEndsWithBlock) {
    if (!previousEndsWithBlock) {
      cc.endStatement();
    }
    cc.endLine();
    cc.beginStatement();
  }

  /** Prints a statement that the caller has already started, returning whether it ends in "}". */
  private boolean addStatement(Node n) {
    switch (n.getToken()) {
      case IF:
        return addIfStatement(n, false);
      case WHILE:
      case UNTIL:
        addWhile(n);
        return true;
      case WHILE_POST:
      case UNTIL_POST:
        addDoWhile(n);
        return false;
      case FOR:
        addFor(n);
        return true;
      case CASE:
        return addCase(n, false);
      case RESCUE:
      case ENSURE:
        addTry(n, false);
        return true;
      case RETURN:
        addReturn(n.getNode(0));
        return false;
      case BREAK:
        addBreak(n);
        return false;
      case NEXT:
        addNext(n);
        return false;
      case DEF:
        {
          String name = methodName(n, n.getString(0));
          cc.add("function");
          cc.add(NodeUtil.safeName(name));
          addMethodBody(name, n.getNode(1), n.getNode(2), false, false, false);
          return true;
        }
      case DEFS:
        {
          String name = methodName(n, n.getString(1));
          addExpr(n.getNode(0), NodeUtil.MEMBER, Context.START_OF_EXPR);
          addMember(name);
          cc.addOp("=", true);
          cc.add("function");
          addMethodBody(name, n.getNode(2), n.getNode(3), false, true, false);
          return false;
        }
      case CLASS:
        return addClass(n);
      case MODULE:
        return addModule(n);
      case SCLASS:
      case ALIAS:
        throw unsupported(n, "only supported in a class body");
      case LVASGN:
        addLocalAssignment(n);
        return false;
      case CASGN:
        addConstantAssignment(n, true);
        return false;
      case MASGN:
        addMultipleAssignment(n, true);
        return false;
      case OR_ASGN:
      case AND_ASGN:
        addLogicalAssignment(n, true);
        return false;
      case SEND:
        if (NodeUtil.isRaise(n)) {
          addThrow(n);
          return false;
        }
        break;
      case BLOCK:
        if (NodeUtil.isLoopCall(n.getNode(0))) {
          addLoop(n);
          return true;
        }
        break;
      default:
        break;
    }
    addExpr(n, NodeUtil.COMMA, Context.STATEMENT);
    return false;
  }

  /** Prints the last statement of a body whose value is returned. */
  private void printReturning(Node n) {
    switch (n.getToken()) {
      case BEGIN:
      case KWBEGIN:
      case HIDE:
      case AUTORETURN:
        printStatements(n.childNodes(), true);
        return;
      case IF:
      case CASE:
      case RESCUE:
      case ENSURE:
        {
          cc.beginStatement();
          cc.startSourceMapping(n);
          boolean endsWithBlock;
          if (n.isToken(Token.IF)) {
            endsWithBlock = addIfStatement(n, true);
          } else if (n.isToken(Token.CASE)) {
            endsWithBlock = addCase(n, true);
          } else {
            addTry(n, true);
            endsWithBlock = true;
          }
          cc.endSourceMapping(n);
          finishStatement(n, endsWithBlock);
          return;
        }
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
      case OR_ASGN:
      case AND_ASGN:
      case OP_ASGN:
        {
          printStatement(n);
          Node target = n.getToken().isVariableAssignment() ? n : n.getNode(0);
          if (target.getToken().isVariableAssignment()) {
            cc.beginStatement();
            cc.add("return ");
            addTarget(target);
            cc.endStatement();
            cc.endLine();
          }
          return;
        }
      default:
        break;
    }
    if (!returnsValue(n)) {
      printStatement(n);
      return;
    }
    cc.beginStatement();
    addReturn(n);
    finishStatement(n, false);
  }

  /** Whether {@code n}, as the last statement of a function, provides its result. */
  private static boolean returnsValue(Node n) {
    switch (n.getToken()) {
      case WHILE:
      case UNTIL:
      case WHILE_POST:
      case UNTIL_POST:
      case FOR:
      case RETURN:
      case BREAK:
      case NEXT:
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
      case SCLASS:
      case ALIAS:
      case CASGN:
      case MASGN:
        return false;
      case SEND:
        return !NodeUtil.isRaise(n)
            && !(n.getString(1).equals("<<") && NodeUtil.isBinaryOperation(n));
      case BLOCK:
        return !NodeUtil.isLoopCall(n.getNode(0));
      default:
        return true;
    }
  }

  /** Whether control never falls off the end of {@code body}. */
  private static boolean endsWithJump(@Nullable Node body, boolean returning) {
    List<Node> statements = NodeUtil.statementsOf(body);
    if (statements.isEmpty()) {
      return false;
    }
    Node last = statements.get(statements.size() - 1);
    switch (last.getToken()) {
      case RETURN:
      case BREAK:
      case NEXT:
        return true;
      case IF:
      case CASE:
      case RESCUE:
      case ENSURE:
      case BEGIN:
      case KWBEGIN:
      case HIDE:
      case AUTORETURN:
        return false;
      default:
        return NodeUtil.isRaise(last) || (returning && returnsValue(last));
    }
  }

  // Variable declarations.

  private String declarationKeyword() {
    return mode.isEs5() ? "var" : "let";
  }

  private boolean isDeclared(String name) {
    return declared.contains(name);
  }

  private void declare(String name) {
    declared.add(name);
  }

  /**
   * Declares the locals that {@code statement} assigns for the first time somewhere other than
   * at its top level, where the assignment itself would be block scoped.
   */
  private void hoistLocals(Node statement) {
    switch (statement.getToken()) {
      case BEGIN:
      case KWBEGIN:
      case HIDE:
      case AUTORETURN:
        return;
      default:
        break;
    }
    Set<String> names = new LinkedHashSet<>();
    collectNestedLocals(statement, names, true);
    names.removeIf(declared::contains);
    if (names.isEmpty()) {
      return;
    }
    cc.beginStatement();
    cc.add(declarationKeyword());
    boolean first = true;
    for (String name : names) {
      if (!first) {
        cc.listSeparator();
      }
      cc.add(NodeUtil.safeName(name));
      declare(name);
      first = false;
    }
    cc.endStatement();
    cc.endLine();
  }

  private void collectNestedLocals(Node n, Set<String> out, boolean direct) {
    switch (n.getToken()) {
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
      case SCLASS:
        return;
      case BLOCK:
        if (NodeUtil.isLoopCall(n.getNode(0))) {
          collectChild(n.getNode(2), out);
        } else {
          collectChild(n.getNode(0), out);
        }
        return;
      case LVASGN:
        if (!direct) {
          out.add(n.getString(0));
        }
        break;
      case MASGN:
        if (!direct || !declaresAllTargets(n.getNode(0))) {
          for (String name : targetNames(n.getNode(0))) {
            out.add(name);
          }
        }
        collectChild(n.getNode(1), out);
        return;
      case OR_ASGN:
      case AND_ASGN:
      case OP_ASGN:
        {
          Node target = n.getNode(0);
          if (target.isToken(Token.LVASGN) && (!direct || n.isToken(Token.OP_ASGN))) {
            out.add(target.getString(0));
          } else if (!target.isToken(Token.LVASGN)) {
            collectChild(target, out);
          }
          collectChild(n.getLastChild(), out);
          return;
        }
      case FOR:
        collectChild(n.getNode(1), out);
        collectChild(n.getNode(2), out);
        return;
      case RESBODY:
        collectChild(n.getNode(0), out);
        collectChild(n.getNode(2), out);
        return;
      default:
        break;
    }
    for (Node child : n.childNodes()) {
      collectNestedLocals(child, out, false);
    }
  }

  private void collectChild(@Nullable Node child, Set<String> out) {
    if (child != null) {
      collectNestedLocals(child, out, false);
    }
  }

  /** The local names a multiple assignment target list assigns. */
  private static List<String> targetNames(Node mlhs) {
    List<String> names = new ArrayList<>();
    for (Node target : mlhs.childNodes()) {
      Node variable = target.isToken(Token.SPLAT) ? target.getNode(0) : target;
      if (variable != null && variable.isToken(Token.LVASGN)) {
        names.add(variable.getString(0));
      } else if (variable != null && variable.isToken(Token.MLHS)) {
        names.addAll(targetNames(variable));
      }
    }
    return names;
  }

  /** Whether every target is a local that is not declared yet. */
  private boolean declaresAllTargets(Node mlhs) {
    List<String> names = targetNames(mlhs);
    if (names.size() != countTargets(mlhs)) {
      return false;
    }
    for (String name : names) {
      if (isDeclared(name)) {
        return false;
      }
    }
    return true;
  }

  private static int countTargets(Node mlhs) {
    int count = 0;
    for (Node target : mlhs.childNodes()) {
      count += target.isToken(Token.MLHS) ? countTargets(target) : 1;
    }
    return count;
  }

  private String tempName(String prefix) {
    int count = tempCounts.merge(prefix, 1, Integer::sum);
    return count == 1 ? prefix : prefix + count;
  }

  private UnsupportedConstructException unsupported(Node n, String detail) {
    return new UnsupportedConstructException(conversion.getSourceName(), n, detail);
  }

  // Expressions.

  private boolean nullish() {
    return options.getOrOperator() == ConversionOptions.OrOperator.NULLISH
        && mode.isAtLeast(LanguageMode.ECMASCRIPT_2020);
  }

  /** Whether {@code n} prints as {@code ??}. Tests the generator builds itself keep {@code ||}. */
  private boolean isCoalescing(Node n) {
    return n.isToken(Token.OR) && nullish() && !n.isSynthetic();
  }

  private int precedence(Node n) {
    if (isCoalescing(n)) {
      return NodeUtil.COALESCE;
    }
    return NodeUtil.precedence(n, mode);
  }

  /** Prints {@code n}, in parentheses if its precedence is below {@code minPrecedence}. */
  private void addExpr(Node n, int minPrecedence, Context context) {
    if (precedence(n) < minPrecedence) {
      cc.add("(");
      add(n, Context.OTHER);
      cc.add(")");
    } else {
      add(n, context);
    }
  }

  private void add(Node n, Context context) {
    cc.startSourceMapping(n);
    if (NodeUtil.isStatementOnly(n)) {
      addStatementAsExpression(n);
    } else {
      addNode(n, context);
    }
    cc.endSourceMapping(n);
  }

  /** Wraps a statement in a function that is called on the spot and returns its value. */
  private void addStatementAsExpression(Node n) {
    switch (n.getToken()) {
      case RETURN:
      case BREAK:
      case NEXT:
        throw unsupported(n, "cannot be used as a value");
      default:
        break;
    }
    jumps.push(Jump.FUNCTION);
    cc.add(mode.isEs5() ? "(function() " : "(() => ");
    cc.beginBlock();
    printStatements(ImmutableList.of(n), true);
    cc.endBlock();
    cc.add(mode.isEs5() ? ").call(this)" : ")()");
    jumps.pop();
  }

  private void addNode(Node n, Context context) {
    switch (n.getToken()) {
      case INT:
        cc.addNumber((Long) n.getChild(0));
        return;
      case FLOAT:
        cc.add(formatDouble((Double) n.getChild(0)));
        return;
      case STR:
      case SYM:
        cc.add(jsString(n.getString(0)));
        return;
      case DSTR:
      case DSYM:
        addInterpolated(n.childNodes());
        return;
      case REGEXP:
        addRegexp(n);
        return;
      case NIL:
        cc.add("null");
        return;
      case TRUE:
        cc.add("true");
        return;
      case FALSE:
        cc.add("false");
        return;
      case SELF:
        cc.add(selfName != null ? selfName : "this");
        return;
      case ARRAY:
        addArray(n.childNodes());
        return;
      case HASH:
        if (context.atStart()) {
          cc.add("(");
          addHash(n);
          cc.add(")");
        } else {
          addHash(n);
        }
        return;
      case LVAR:
        cc.add(NodeUtil.safeName(n.getString(0)));
        return;
      case IVAR:
        addInstanceVariable(n.getString(0));
        return;
      case CVAR:
        addClassVariable(n.getString(0));
        return;
      case GVAR:
        addGlobalVariable(n, n.getString(0));
        return;
      case CONST:
        addConstant(n, context);
        return;
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
        addTarget(n);
        cc.addOp("=", true);
        addExpr(n.getNode(1), NodeUtil.ASSIGN, Context.OTHER);
        return;
      case CASGN:
        addConstantAssignment(n, false);
        return;
      case OP_ASGN:
        addOperatorAssignment(n);
        return;
      case OR_ASGN:
      case AND_ASGN:
        addLogicalAssignment(n, false);
        return;
      case MASGN:
        addMultipleAssignment(n, false);
        return;
      case SEND:
        addSend(n, context, null);
        return;
      case CSEND:
        addSafeSend(n, context, null);
        return;
      case ATTR:
        addReceiver(n.getNode(0), context);
        addMember(n.getString(1));
        return;
      case CALL:
        addCall(n, context, null);
        return;
      case BLOCK:
        addBlock(n, context);
        return;
      case AND:
        addLogical(n, "&&", NodeUtil.AND, context);
        return;
      case OR:
        if (isCoalescing(n)) {
          addLogical(n, "??", NodeUtil.COALESCE, context);
        } else {
          addLogical(n, "||", NodeUtil.OR, context);
        }
        return;
      case NOT:
        cc.addOp("!", false);
        addExpr(n.getNode(0), NodeUtil.UNARY, Context.OTHER);
        return;
      case DEFINED:
        addDefined(n.getNode(0));
        return;
      case TYPEOF:
        cc.add("typeof ");
        addExpr(n.getNode(0), NodeUtil.UNARY, Context.OTHER);
        return;
      case IF:
        addExpr(n.getNode(0), NodeUtil.OR, context);
        cc.addOp("?", true);
        addBranch(n.getNode(1));
        cc.addOp(":", true);
        addBranch(n.getNode(2));
        return;
      case BEGIN:
      case KWBEGIN:
        addSequence(n.childNodes(), context);
        return;
      case YIELD:
        addYield(n);
        return;
      case SUPER:
      case ZSUPER:
        addSuper(n, null);
        return;
      case BLOCK_PASS:
        addBlockPass(n);
        return;
      default:
        throw unsupported(n, "has no JavaScript rendering here");
    }
  }

  private static String formatDouble(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    return String.valueOf(value).replace('E', 'e');
  }

  private void addBranch(@Nullable Node branch) {
    if (branch == null) {
      cc.add("null");
    } else {
      addExpr(branch, NodeUtil.ASSIGN, Context.OTHER);
    }
  }

  private void addSequence(List<Node> children, Context context) {
    if (children.isEmpty()) {
      cc.add("null");
      return;
    }
    if (children.size() == 1) {
      add(children.get(0), context);
      return;
    }
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        cc.addOp(",", true);
      }
      addExpr(children.get(i), NodeUtil.ASSIGN, i == 0 ? context : Context.OTHER);
    }
  }

  // Literals.

  private String jsString(String value) {
    char quote = quoteFor(value);
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append(quote);
    appendEscaped(value, quote, sb);
    sb.append(quote);
    return sb.toString();
  }

  private char quoteFor(String value) {
    switch (options.getQuoteStyle()) {
      case SINGLE:
        return '\'';
      case DOUBLE:
        return '"';
      default:
        int doubles = 0;
        int singles = 0;
        for (int i = 0; i < value.length(); i++) {
          char c = value.charAt(i);
          if (c == '"') {
            doubles++;
          } else if (c == '\'') {
            singles++;
          }
        }
        return doubles > singles ? '\'' : '"';
    }
  }

  /**
   * Escapes {@code value} for a literal delimited by {@code quote}. A backtick quote escapes the
   * {@code ${} of template literals as well.
   */
  private static void appendEscaped(String value, char quote, StringBuilder sb) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\u2028':
          sb.append("\\u2028");
          break;
        case '\u2029':
          sb.append("\\u2029");
          break;
        case '$':
          if (quote == '`' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
            sb.append("\\$");
          } else {
            sb.append(c);
          }
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
  }

  /** Prints the parts of an interpolated string: {@code str} text and {@code begin} code. */
  private void addInterpolated(List<Node> parts) {
    if (mode.isEs5()) {
      addConcatenation(parts);
      return;
    }
    StringBuilder text = new StringBuilder("`");
    for (Node part : parts) {
      if (part.isToken(Token.STR)) {
        appendEscaped(part.getString(0), '`', text);
        continue;
      }
      if (part.getChildCount() == 0) {
        continue;
      }
      text.append("${");
      cc.add(text.toString());
      text.setLength(0);
      addSequence(part.childNodes(), Context.OTHER);
      text.append("}");
    }
    text.append("`");
    cc.add(text.toString());
  }

  private void addConcatenation(List<Node> parts) {
    List<Node> pieces = new ArrayList<>();
    for (Node part : parts) {
      if (!part.isToken(Token.BEGIN) || part.getChildCount() > 0) {
        pieces.add(part);
      }
    }
    if (pieces.isEmpty() || !pieces.get(0).isToken(Token.STR)) {
      cc.add(jsString(""));
      if (pieces.isEmpty()) {
        return;
      }
      cc.addOp("+", true);
    }
    for (int i = 0; i < pieces.size(); i++) {
      if (i > 0) {
        cc.addOp("+", true);
      }
      Node piece = pieces.get(i);
      if (piece.isToken(Token.STR)) {
        cc.add(jsString(piece.getString(0)));
      } else if (piece.getChildCount() == 1) {
        addExpr(piece.getNode(0), NodeUtil.MULTIPLICATIVE, Context.OTHER);
      } else {
        cc.add("(");
        addSequence(piece.childNodes(), Context.OTHER);
        cc.add(")");
      }
    }
  }

  private void addRegexp(Node n) {
    List<Node> parts = new ArrayList<>(n.childNodes());
    Set<String> rubyFlags = new LinkedHashSet<>();
    if (!parts.isEmpty() && parts.get(parts.size() - 1).isToken(Token.REGOPT)) {
      Node regopt = parts.remove(parts.size() - 1);
      for (Object flag : regopt.getChildren()) {
        rubyFlags.add(String.valueOf(flag));
      }
    }
    boolean extended = rubyFlags.contains("x");
    StringBuilder flags = new StringBuilder();
    if (rubyFlags.contains("i")) {
      flags.append('i');
    }
    if (rubyFlags.contains("m") && mode.isAtLeast(LanguageMode.ECMASCRIPT_2018)) {
      flags.append('s');
    }

    boolean literal = parts.stream().allMatch(part -> part.isToken(Token.STR));
    if (literal) {
      StringBuilder source = new StringBuilder();
      for (Node part : parts) {
        source.append(part.getString(0));
      }
      String pattern = convertPattern(source.toString(), extended);
      cc.add("/" + (pattern.isEmpty() ? "(?:)" : pattern) + "/" + flags);
      return;
    }

    List<Node> converted = new ArrayList<>();
    for (Node part : parts) {
      if (part.isToken(Token.STR)) {
        converted.add(part.withChild(0, convertPattern(part.getString(0), extended)));
      } else {
        converted.add(part);
      }
    }
    cc.add("new RegExp(");
    addInterpolated(converted);
    if (flags.length() > 0) {
      cc.listSeparator();
      cc.add(jsString(flags.toString()));
    }
    cc.add(")");
  }

  /** Rewrites the Ruby-only parts of a regular expression source. */
  static String convertPattern(String source, boolean extended) {
    StringBuilder sb = new StringBuilder(source.length());
    boolean inClass = false;
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\\' && i + 1 < source.length()) {
        char next = source.charAt(++i);
        if (next == 'h') {
          sb.append(inClass ? "0-9a-fA-F" : "[0-9a-fA-F]");
        } else if (!inClass && next == 'A') {
          sb.append('^');
        } else if (!inClass && (next == 'z' || next == 'Z')) {
          sb.append('$');
        } else {
          sb.append(c).append(next);
        }
        continue;
      }
      if (inClass) {
        if (c == ']') {
          inClass = false;
        }
        sb.append(c == '/' ? "\\/" : String.valueOf(c));
        continue;
      }
      if (extended && Character.isWhitespace(c)) {
        continue;
      }
      if (extended && c == '#') {
        while (i + 1 < source.length() && source.charAt(i + 1) != '\n') {
          i++;
        }
        continue;
      }
      switch (c) {
        case '[':
          inClass = true;
          sb.append(c);
          break;
        case '/':
          sb.append("\\/");
          break;
        case '\n':
          sb.append("\\n");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  private void addArray(List<Node> items) {
    if (mode.isEs5() && items.stream().anyMatch(item -> item.isToken(Token.SPLAT))) {
      addConcat(items);
      return;
    }
    cc.add("[");
    addList(items);
    cc.add("]");
  }

  private void addList(List<Node> items) {
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      addListItem(items.get(i));
    }
  }

  private void addListItem(Node item) {
    if (item.isToken(Token.SPLAT)) {
      cc.add("...");
      addExpr(item.getNode(0), NodeUtil.ASSIGN, Context.OTHER);
    } else if (item.isToken(Token.BLOCK_PASS)) {
      addBlockPass(item);
    } else {
      addExpr(item, NodeUtil.ASSIGN, Context.OTHER);
    }
  }

  /** The ES5 form of a list with spread items: {@code [a].concat(rest, [b])}. */
  private void addConcat(List<Node> items) {
    int first = 0;
    while (first < items.size() && !items.get(first).isToken(Token.SPLAT)) {
      first++;
    }
    cc.add("[");
    addList(items.subList(0, first));
    cc.add("]");
    cc.add(".concat(");
    List<Node> run = new ArrayList<>();
    boolean separate = false;
    for (Node item : items.subList(first, items.size())) {
      if (!item.isToken(Token.SPLAT)) {
        run.add(item);
        continue;
      }
      if (!run.isEmpty()) {
        if (separate) {
          cc.listSeparator();
        }
        cc.add("[");
        addList(run);
        cc.add("]");
        run.clear();
        separate = true;
      }
      if (separate) {
        cc.listSeparator();
      }
      addExpr(item.getNode(0), NodeUtil.ASSIGN, Context.OTHER);
      separate = true;
    }
    if (!run.isEmpty()) {
      cc.listSeparator();
      cc.add("[");
      addList(run);
      cc.add("]");
    }
    cc.add(")");
  }

  private void addHash(Node n) {
    List<Node> entries = n.childNodes();
    if (entries.isEmpty()) {
      cc.add("{}");
      return;
    }
    if (!mode.isAtLeast(LanguageMode.ECMASCRIPT_2018)
        && entries.stream().anyMatch(entry -> entry.isToken(Token.KWSPLAT))) {
      addObjectAssign(entries);
      return;
    }
    SourceRange range = n.getSourceRange();
    boolean multiline = cc.breaksLines() && range != null && range.endLine() > range.line();
    if (multiline) {
      cc.beginBlock();
    } else {
      cc.add("{");
    }
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        if (multiline) {
          cc.add(",");
          cc.endLine();
        } else {
          cc.listSeparator();
        }
      }
      addHashEntry(entries.get(i));
    }
    if (multiline) {
      cc.endBlock();
    } else {
      cc.add("}");
    }
  }

  private void addObjectAssign(List<Node> entries) {
    cc.add("Object.assign({}");
    List<Node> run = new ArrayList<>();
    for (Node entry : entries) {
      if (!entry.isToken(Token.KWSPLAT)) {
        run.add(entry);
        continue;
      }
      if (!run.isEmpty()) {
        cc.listSeparator();
        addHash(Node.make(Token.HASH, run));
        run.clear();
      }
      cc.listSeparator();
      addExpr(entry.getNode(0), NodeUtil.ASSIGN, Context.OTHER);
    }
    if (!run.isEmpty()) {
      cc.listSeparator();
      addHash(Node.make(Token.HASH, run));
    }
    cc.add(")");
  }

  private void addHashEntry(Node entry) {
    if (entry.isToken(Token.KWSPLAT)) {
      cc.add("...");
      addExpr(entry.getNode(0), NodeUtil.ASSIGN, Context.OTHER);
      return;
    }
    if (!entry.isToken(Token.PAIR)) {
      throw unsupported(entry, "is not a hash entry");
    }
    Node key = entry.getNode(0);
    Node value = entry.getNode(1);
    switch (key.getToken()) {
      case STR:
      case SYM:
        {
          String name = key.getString(0);
          if (NodeUtil.isValidSimpleName(name)) {
            if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2015)
                && value.isToken(Token.LVAR)
                && value.getString(0).equals(name)
                && !NodeUtil.isReservedWord(name)) {
              cc.add(name);
              return;
            }
            cc.add(name);
          } else {
            cc.add(jsString(name));
          }
          break;
        }
      case INT:
      case FLOAT:
        addNode(key, Context.OTHER);
        break;
      default:
        if (mode.isEs5()) {
          throw unsupported(key, "computed property names need ES2015");
        }
        cc.add("[");
        addExpr(key, NodeUtil.ASSIGN, Context.OTHER);
        cc.add("]");
        break;
    }
    cc.add(": ");
    addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
  }

  // Variables.

  private boolean usesPrivateFields() {
    return currentClass != null
        && currentClass.privateFields
        && (method == null || !method.isStatic);
  }

  private void addInstanceVariable(String ivar) {
    cc.add(selfName != null ? selfName : "this");
    cc.add("." + (usesPrivateFields() ? "#" : "_") + ivar.substring(1));
  }

  private void addClassVariable(String cvar) {
    if (currentClass != null && !currentClass.isModule) {
      cc.add(currentClass.name);
    } else {
      cc.add("this.constructor");
    }
    cc.add("._" + cvar.substring(2));
  }

  private void addGlobalVariable(Node n, String name) {
    if (!NodeUtil.isValidSimpleName(name)) {
      throw unsupported(n, "global " + name + " has no JavaScript name");
    }
    cc.add(name);
  }

  private void addConstant(Node n, Context context) {
    Node scope = n.getNode(0);
    if (scope != null && !scope.isToken(Token.CBASE)) {
      addExpr(scope, NodeUtil.MEMBER, context);
      cc.add(".");
    }
    cc.add(n.getString(1));
  }

  /** The JavaScript name of a Ruby method: no trailing {@code ?}, and no trailing {@code !}. */
  private String methodName(Node n, String selector) {
    if (selector.length() > 1 && selector.endsWith("?")) {
      return selector.substring(0, selector.length() - 1);
    }
    if (selector.length() > 1 && selector.endsWith("!") && !selector.equals("!")) {
      conversion.report(n, BANG_METHOD, selector);
      return selector.substring(0, selector.length() - 1);
    }
    return selector;
  }

  /** Prints {@code .name}, or {@code ["name"]} when the name is not an identifier. */
  private void addMember(String name) {
    if (NodeUtil.isValidSimpleName(name)) {
      cc.add("." + name);
    } else {
      cc.add("[" + jsString(name) + "]");
    }
  }

  private void addReceiver(Node receiver, Context context) {
    if (receiver.isToken(Token.INT) || receiver.isToken(Token.FLOAT)) {
      cc.add("(");
      add(receiver, Context.OTHER);
      cc.add(")");
    } else {
      addExpr(receiver, NodeUtil.MEMBER, context);
    }
  }

  // Calls.

  private static List<Node> argumentsOf(Node call) {
    List<Node> args = new ArrayList<>();
    for (int i = 2; i < call.getChildCount(); i++) {
      Node arg = call.getNode(i);
      if (arg != null) {
        args.add(arg);
      }
    }
    return args;
  }

  private void addSelf() {
    cc.add(selfName != null ? selfName : "this");
  }

  private void addSend(Node n, Context context, @Nullable Node block) {
    Node receiver = n.getNode(0);
    String selector = n.getString(1);
    List<Node> args = argumentsOf(n);
    if (block == null) {
      if (NodeUtil.isInstanceofTest(n)) {
        addExpr(receiver, NodeUtil.RELATIONAL, context);
        cc.add(" instanceof ");
        addExpr(args.get(0), NodeUtil.RELATIONAL + 1, Context.OTHER);
        return;
      }
      if (NodeUtil.isBinaryOperation(n)) {
        addBinary(n, context);
        return;
      }
      if (NodeUtil.isUnaryOperation(n)) {
        addUnary(n);
        return;
      }
      if (NodeUtil.isSetter(n)) {
        addAssignableSend(n, context);
        cc.addOp("=", true);
        addExpr(args.get(args.size() - 1), NodeUtil.ASSIGN, Context.OTHER);
        return;
      }
    }
    if (receiver == null) {
      addReceiverlessSend(n, selector, args, block);
      return;
    }
    switch (selector) {
      case "[]":
        if (block == null) {
          addIndex(n, receiver, args, context);
          return;
        }
        break;
      case "new":
        if (mode.isEs5() && args.stream().anyMatch(arg -> arg.isToken(Token.SPLAT))) {
          throw unsupported(n, "spread arguments to new need ES2015");
        }
        cc.add("new ");
        addExpr(receiver, NodeUtil.MEMBER, Context.OTHER);
        addArguments(null, args, block);
        return;
      case "call":
        addExpr(receiver, NodeUtil.MEMBER, context);
        addArguments(null, args, block);
        return;
      default:
        break;
    }
    addReceiver(receiver, context);
    addMember(methodName(n, selector));
    if (n.isMethodCallShape() || block != null) {
      addArguments(receiver, args, block);
    }
  }

  /** Calls a method of the current class through {@code this}; anything else by name. */
  private void addReceiverlessSend(
      Node n, String selector, List<Node> args, @Nullable Node block) {
    String name = methodName(n, selector);
    if (currentClass != null) {
      boolean isStatic = method != null ? method.isStatic : !currentClass.isModule;
      if (currentClass.methods(isStatic).contains(name)) {
        addSelf();
        addMember(name);
        addArguments(IR.self(), args, block);
        return;
      }
      if (currentClass.getters(isStatic).contains(name) && args.isEmpty() && block == null) {
        addSelf();
        addMember(name);
        return;
      }
    }
    cc.add(NodeUtil.safeName(name));
    if (n.isMethodCallShape() || block != null) {
      addArguments(null, args, block);
    }
  }

  /**
   * Prints call arguments, with a block as a trailing function. Below ES2015, spread arguments
   * go through {@code Function.prototype.apply} with {@code thisArg} as the receiver.
   */
  private void addArguments(@Nullable Node thisArg, List<Node> args, @Nullable Node block) {
    if (mode.isEs5() && args.stream().anyMatch(arg -> arg.isToken(Token.SPLAT))) {
      cc.add(".apply(");
      if (thisArg != null) {
        addExpr(thisArg, NodeUtil.ASSIGN, Context.OTHER);
      } else {
        cc.add("null");
      }
      cc.listSeparator();
      List<Node> items = new ArrayList<>(args);
      if (block != null) {
        items.add(block.withChild(0, IR.send(null, "lambda")));
      }
      addConcat(items);
      cc.add(")");
      return;
    }
    cc.add("(");
    addList(args);
    if (block != null) {
      if (!args.isEmpty()) {
        cc.listSeparator();
      }
      addFunction(block, Context.OTHER);
    }
    cc.add(")");
  }

  private void addBinary(Node n, Context context) {
    Node left = n.getNode(0);
    String op = n.getString(1);
    Node right = n.getNode(2);
    switch (op) {
      case "=~":
        addMatch(left, right, context);
        return;
      case "!~":
        cc.addOp("!", false);
        addMatch(left, right, Context.OTHER);
        return;
      case "<=>":
        throw unsupported(n, "<=> has no JavaScript operator");
      case "**":
        if (!mode.isAtLeast(LanguageMode.ECMASCRIPT_2016)) {
          cc.add("Math.pow(");
          addExpr(left, NodeUtil.ASSIGN, Context.OTHER);
          cc.listSeparator();
          addExpr(right, NodeUtil.ASSIGN, Context.OTHER);
          cc.add(")");
          return;
        }
        // Right associative, and a unary left operand needs parentheses.
        addExpr(left, NodeUtil.POSTFIX, context);
        cc.addOp("**", true);
        addExpr(right, NodeUtil.EXPONENT, Context.OTHER);
        return;
      default:
        break;
    }
    int p = precedence(n);
    String jsOp = op;
    if (options.getComparison() == ConversionOptions.Comparison.IDENTITY) {
      if (op.equals("==")) {
        jsOp = "===";
      } else if (op.equals("!=")) {
        jsOp = "!==";
      }
    }
    addExpr(left, p, context);
    cc.addOp(jsOp, true);
    addExpr(right, p + 1, Context.OTHER);
  }

  /** {@code s =~ re} as {@code re.test(s)}; a regexp literal on either side is the pattern. */
  private void addMatch(Node left, Node right, Context context) {
    Node pattern = left.isToken(Token.REGEXP) ? left : right;
    Node subject = pattern == left ? right : left;
    addExpr(pattern, NodeUtil.MEMBER, context);
    cc.add(".test(");
    addExpr(subject, NodeUtil.ASSIGN, Context.OTHER);
    cc.add(")");
  }

  private void addUnary(Node n) {
    String op = n.getString(1);
    switch (op) {
      case "-@":
        cc.addOp("-", false);
        break;
      case "+@":
        cc.addOp("+", false);
        break;
      default:
        cc.addOp(op, false);
        break;
    }
    addExpr(n.getNode(0), NodeUtil.UNARY, Context.OTHER);
  }

  /** Prints {@code recv.name} or {@code recv[index]} for a getter or setter send. */
  private void addAssignableSend(Node send, Context context) {
    Node receiver = send.getNode(0);
    String selector = send.getString(1);
    if (receiver == null) {
      throw unsupported(send, "cannot be assigned");
    }
    addReceiver(receiver, context);
    if (selector.equals("[]") || selector.equals("[]=")) {
      List<Node> args = argumentsOf(send);
      int indexCount = selector.equals("[]") ? args.size() : args.size() - 1;
      if (indexCount != 1) {
        throw unsupported(send, "index assignment takes one index");
      }
      cc.add("[");
      addExpr(args.get(0), NodeUtil.COMMA, Context.OTHER);
      cc.add("]");
    } else {
      addMember(selector.endsWith("=") ? selector.substring(0, selector.length() - 1) : selector);
    }
  }

  private void addIndex(Node n, Node receiver, List<Node> args, Context context) {
    if (args.size() == 2) {
      Node start = args.get(0);
      Node length = args.get(1);
      addReceiver(receiver, context);
      cc.add(".slice(");
      addExpr(start, NodeUtil.ASSIGN, Context.OTHER);
      cc.listSeparator();
      if (start.isToken(Token.INT) && length.isToken(Token.INT)) {
        cc.addNumber((Long) start.getChild(0) + (Long) length.getChild(0));
      } else {
        addExpr(start, NodeUtil.ADDITIVE, Context.OTHER);
        cc.addOp("+", true);
        addExpr(length, NodeUtil.ADDITIVE + 1, Context.OTHER);
      }
      cc.add(")");
      return;
    }
    if (args.size() != 1) {
      throw unsupported(n, "index with " + args.size() + " arguments");
    }
    Node index = args.get(0);
    if (index.isToken(Token.IRANGE) || index.isToken(Token.ERANGE)) {
      addReceiver(receiver, context);
      cc.add(".slice(");
      addSliceBounds(index);
      cc.add(")");
      return;
    }
    if (index.isToken(Token.INT) && (Long) index.getChild(0) < 0) {
      long fromEnd = -(Long) index.getChild(0);
      addReceiver(receiver, context);
      if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2022)) {
        cc.add(".at(");
        cc.addNumber(-fromEnd);
        cc.add(")");
      } else if (NodeUtil.isSimple(receiver)) {
        cc.add("[");
        addReceiver(receiver, Context.OTHER);
        cc.add(".length");
        cc.addOp("-", true);
        cc.addNumber(fromEnd);
        cc.add("]");
      } else {
        cc.add(".slice(");
        cc.addNumber(-fromEnd);
        cc.add(")[0]");
      }
      return;
    }
    addReceiver(receiver, context);
    cc.add("[");
    addExpr(index, NodeUtil.COMMA, Context.OTHER);
    cc.add("]");
  }

  private void addSliceBounds(Node range) {
    Node start = range.getNode(0);
    Node end = range.getNode(1);
    if (start == null) {
      cc.addNumber(0L);
    } else {
      addExpr(start, NodeUtil.ASSIGN, Context.OTHER);
    }
    if (end == null) {
      return;
    }
    if (range.isToken(Token.ERANGE)) {
      cc.listSeparator();
      addExpr(end, NodeUtil.ASSIGN, Context.OTHER);
      return;
    }
    if (end.isToken(Token.INT)) {
      long last = (Long) end.getChild(0);
      if (last != -1) {
        cc.listSeparator();
        cc.addNumber(last + 1);
      }
      return;
    }
    cc.listSeparator();
    addExpr(end, NodeUtil.ADDITIVE, Context.OTHER);
    cc.addOp("+", true);
    cc.addNumber(1L);
  }

  /** {@code a&.b}: optional chaining, or {@code a && a.b} before ES2020. */
  private void addSafeSend(Node n, Context context, @Nullable Node block) {
    Node receiver = n.getNode(0);
    String selector = n.getString(1);
    if (NodeUtil.isSetterName(selector)) {
      throw unsupported(n, "safe navigation cannot assign");
    }
    if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2020)) {
      String name = methodName(n, selector);
      addReceiver(receiver, context);
      cc.add(NodeUtil.isValidSimpleName(name) ? "?." + name : "?.[" + jsString(name) + "]");
      if (n.isMethodCallShape() || block != null) {
        addArguments(receiver, argumentsOf(n), block);
      }
      return;
    }
    conversion.report(n, OPTIONAL_CHAIN_LOWERED, selector);
    addExpr(receiver, NodeUtil.AND, context);
    cc.addOp("&&", true);
    Node send = n.updated(Token.SEND);
    if (block == null) {
      addExpr(send, NodeUtil.AND + 1, Context.OTHER);
    } else {
      addSend(send, Context.OTHER, block);
    }
  }

  private void addCall(Node n, Context context, @Nullable Node block) {
    Node receiver = n.getNode(0);
    String name = n.getString(1);
    if (receiver == null) {
      cc.add(NodeUtil.safeName(name));
    } else {
      addReceiver(receiver, context);
      addMember(name);
    }
    addArguments(receiver, argumentsOf(n), block);
  }

  private void addBlock(Node n, Context context) {
    Node call = n.getNode(0);
    if (NodeUtil.isLambdaCall(call)) {
      addFunction(n, context);
      return;
    }
    switch (call.getToken()) {
      case SEND:
        addSend(call, context, n);
        return;
      case CSEND:
        addSafeSend(call, context, n);
        return;
      case CALL:
        addCall(call, context, n);
        return;
      case SUPER:
      case ZSUPER:
        addSuper(call, n);
        return;
      default:
        throw unsupported(n, "block passed to " + call.getToken().tag());
    }
  }

  /** {@code &:name} reads the property of each item; any other value is passed as is. */
  private void addBlockPass(Node n) {
    Node value = n.getNode(0);
    if (value == null) {
      throw unsupported(n, "anonymous block argument");
    }
    if (value.isToken(Token.SYM)) {
      String name = methodName(n, value.getString(0));
      cc.add(mode.isEs5() ? "function(item) {return item" : "item => item");
      addMember(name);
      if (mode.isEs5()) {
        cc.add("}");
      }
      return;
    }
    addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
  }

  // Functions.

  /** Prints a block or lambda as an arrow function, or as a function expression in ES5. */
  private void addFunction(Node block, Context context) {
    Node args = block.getNode(1);
    Node body = block.getNode(2);
    Set<String> savedDeclared = declared;
    declared = new LinkedHashSet<>(declared);
    jumps.push(Jump.BLOCK);

    Node expression = conciseBody(body);
    if (mode.isEs5()) {
      if (body != null && selfName == null && usesSelf(body)) {
        conversion.report(body, THIS_IN_FUNCTION);
      }
      boolean parens = context == Context.STATEMENT || context == Context.START_OF_EXPR;
      cc.add(parens ? "(function(" : "function(");
      List<Runnable> prologue = addParameters(args, false, true);
      cc.add(") ");
      addBody(body, prologue, expression != null);
      if (parens) {
        cc.add(")");
      }
    } else {
      List<Node> params = args == null ? ImmutableList.of() : args.childNodes();
      List<Runnable> prologue;
      if (params.size() == 1 && params.get(0).isToken(Token.ARG)) {
        prologue = addParameters(args, false, false);
      } else {
        cc.add("(");
        prologue = addParameters(args, false, false);
        cc.add(")");
      }
      cc.addOp("=>", true);
      if (expression != null && prologue.isEmpty()) {
        addExpr(expression, NodeUtil.ASSIGN, Context.START_OF_ARROW_FN_BODY);
      } else {
        addBody(body, prologue, expression != null);
      }
    }

    jumps.pop();
    declared = savedDeclared;
  }

  /** The single expression a block body consists of, if it can be its concise body. */
  private @Nullable Node conciseBody(@Nullable Node body) {
    Node single = body;
    while (single != null
        && (single.isToken(Token.AUTORETURN) || single.isToken(Token.BEGIN))
        && single.getChildCount() == 1) {
      single = single.getNode(0);
    }
    if (single == null) {
      return null;
    }
    switch (single.getToken()) {
      case AUTORETURN:
      case BEGIN:
      case KWBEGIN:
      case HIDE:
      case DEF:
      case DEFS:
        return null;
      default:
        break;
    }
    if (NodeUtil.isStatementOnly(single) || !returnsValue(single)) {
      return null;
    }
    Set<String> locals = new LinkedHashSet<>();
    collectNestedLocals(single, locals, false);
    locals.removeIf(declared::contains);
    return locals.isEmpty() ? single : null;
  }

  /** Whether {@code n} refers to the object a method runs on. */
  private boolean usesSelf(Node n) {
    switch (n.getToken()) {
      case SELF:
      case IVAR:
      case IVASGN:
      case SUPER:
      case ZSUPER:
        return true;
      case SEND:
        if (n.getChild(0) == null
            && currentClass != null
            && (currentClass.methods.contains(n.getString(1))
                || currentClass.getters.contains(n.getString(1)))) {
          return true;
        }
        break;
      default:
        break;
    }
    for (Node child : n.childNodes()) {
      if (usesSelf(child)) {
        return true;
      }
    }
    return false;
  }

  /** Prints a braced body after its prologue statements. */
  private void addBody(@Nullable Node body, List<Runnable> prologue, boolean returning) {
    List<Node> statements = NodeUtil.statementsOf(body);
    if (statements.isEmpty() && prologue.isEmpty()) {
      cc.add("{}");
      return;
    }
    cc.beginBlock();
    for (Runnable statement : prologue) {
      statement.run();
    }
    printStatements(statements, returning);
    cc.endBlock();
  }

  /** Prints a complete statement outside the normal statement loop. */
  private void printSynthetic(Runnable body) {
    cc.beginStatement();
    body.run();
    cc.endStatement();
    cc.endLine();
  }

  /**
   * Prints a parameter list and declares its names. Returns the statements that must start the
   * body, which is how ES5 provides defaults and rest parameters.
   *
   * <p>A JavaScript rest parameter has to come last, so a rest parameter followed by a block
   * parameter is read from {@code arguments} instead: a trailing function argument becomes the
   * block. That needs a function with its own {@code arguments}, which arrows do not have.
   */
  private List<Runnable> addParameters(
      @Nullable Node args, boolean implicitBlock, boolean ownArguments) {
    List<Runnable> prologue = new ArrayList<>();
    List<Node> params = args == null ? ImmutableList.of() : args.childNodes();
    List<Node> keywords = new ArrayList<>();
    Node keywordRest = null;
    String blockName = blockParameterName(args);
    String blockParam = blockName != null ? blockName : implicitBlock ? IMPLICIT_BLOCK : null;
    Node rest = restParameter(params);
    boolean restTakesBlock = rest != null && blockParam != null;
    if (restTakesBlock && !ownArguments) {
      throw unsupported(rest, "before a block parameter in an arrow function");
    }
    int printed = 0;
    for (int index = 0; index < params.size(); index++) {
      Node param = params.get(index);
      switch (param.getToken()) {
        case KWARG:
        case KWOPTARG:
          keywords.add(param);
          continue;
        case KWRESTARG:
          keywordRest = param;
          continue;
        case BLOCKARG:
          continue;
        case ARG:
          separate(printed++);
          cc.add(declareParameter(param.getString(0)));
          break;
        case OPTARG:
          {
            String name = declareParameter(param.getString(0));
            Node value = param.getNode(1);
            separate(printed++);
            cc.add(name);
            if (mode.isEs5()) {
              prologue.add(
                  () ->
                      printSynthetic(
                          () -> {
                            cc.add("if (" + name + " === undefined) " + name);
                            cc.addOp("=", true);
                            addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
                          }));
            } else {
              cc.addOp("=", true);
              addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
            }
            break;
          }
        case RESTARG:
          {
            if (param.getChild(0) == null) {
              continue;
            }
            String name = declareParameter(param.getString(0));
            if (restTakesBlock) {
              addRestAndBlock(prologue, name, declareParameter(blockParam), printed);
            } else if (mode.isEs5()) {
              int position = printed;
              prologue.add(
                  () ->
                      printSynthetic(
                          () ->
                              cc.add(
                                  "var "
                                      + name
                                      + " = Array.prototype.slice.call(arguments, "
                                      + position
                                      + ")")));
            } else {
              separate(printed++);
              cc.add("..." + name);
            }
            break;
          }
        case MLHS:
          if (mode.isEs5()) {
            throw unsupported(param, "destructuring parameters need ES2015");
          }
          separate(printed++);
          addDestructuringParameter(param);
          break;
        default:
          throw unsupported(param, "is not a parameter");
      }
    }
    if (!keywords.isEmpty() || keywordRest != null) {
      if (mode.isEs5()) {
        throw unsupported(args, "keyword arguments need ES2015");
      }
      if (rest != null) {
        throw unsupported(rest, "before keyword parameters");
      }
      if (keywordRest != null && !mode.isAtLeast(LanguageMode.ECMASCRIPT_2018)) {
        throw unsupported(keywordRest, "keyword rest arguments need ES2018");
      }
      separate(printed++);
      cc.add("{");
      boolean required = false;
      for (int i = 0; i < keywords.size(); i++) {
        Node keyword = keywords.get(i);
        if (i > 0) {
          cc.listSeparator();
        }
        cc.add(declareParameter(keyword.getString(0)));
        if (keyword.isToken(Token.KWOPTARG)) {
          cc.addOp("=", true);
          addExpr(keyword.getNode(1), NodeUtil.ASSIGN, Context.OTHER);
        } else {
          required = true;
        }
      }
      if (keywordRest != null && keywordRest.getChild(0) != null) {
        if (!keywords.isEmpty()) {
          cc.listSeparator();
        }
        cc.add("..." + declareParameter(keywordRest.getString(0)));
      }
      cc.add("}");
      if (!required) {
        cc.addOp("=", true);
        cc.add("{}");
      }
    }
    if (restTakesBlock) {
      return prologue;
    }
    if (blockName != null) {
      separate(printed++);
      cc.add(declareParameter(blockName));
    } else if (implicitBlock) {
      separate(printed++);
      cc.add(declareParameter(IMPLICIT_BLOCK));
      if (!mode.isEs5()) {
        cc.addOp("=", true);
        cc.add("null");
      }
    }
    return prologue;
  }

  /**
   * The named rest parameter of {@code params}. Parameters after it have no JavaScript
   * equivalent.
   */
  private @Nullable Node restParameter(List<Node> params) {
    Node rest = null;
    for (Node param : params) {
      switch (param.getToken()) {
        case RESTARG:
          if (param.getChild(0) != null) {
            rest = param;
          }
          break;
        case ARG:
        case OPTARG:
        case MLHS:
          if (rest != null) {
            throw unsupported(param, "after a rest parameter");
          }
          break;
        default:
          break;
      }
    }
    return rest;
  }

  /**
   * {@code rest = Array.prototype.slice.call(arguments, position)}, then the last element becomes
   * {@code block} when it is a function.
   */
  private void addRestAndBlock(List<Runnable> prologue, String rest, String block, int position) {
    String keyword = mode.isEs5() ? "var " : "let ";
    prologue.add(
        () ->
            printSynthetic(
                () ->
                    cc.add(
                        keyword
                            + rest
                            + " = Array.prototype.slice.call(arguments, "
                            + position
                            + ")")));
    prologue.add(
        () ->
            printSynthetic(
                () -> {
                  cc.add(keyword + block);
                  cc.addOp("=", true);
                  cc.add("typeof " + rest + "[" + rest + ".length - 1]");
                  cc.addOp("===", true);
                  cc.add(jsString("function"));
                  cc.addOp("?", true);
                  cc.add(rest + ".pop()");
                  cc.addOp(":", true);
                  cc.add("null");
                }));
  }

  private void separate(int printed) {
    if (printed > 0) {
      cc.listSeparator();
    }
  }

  private String declareParameter(String name) {
    declare(name);
    return NodeUtil.safeName(name);
  }

  private void addDestructuringParameter(Node mlhs) {
    cc.add("[");
    List<Node> items = mlhs.childNodes();
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      Node item = items.get(i);
      switch (item.getToken()) {
        case ARG:
          cc.add(declareParameter(item.getString(0)));
          break;
        case RESTARG:
          if (item.getChild(0) != null) {
            cc.add("..." + declareParameter(item.getString(0)));
          }
          break;
        case MLHS:
          addDestructuringParameter(item);
          break;
        default:
          throw unsupported(item, "is not a destructuring parameter");
      }
    }
    cc.add("]");
  }

  /** Prints the parameters and body of a method, after whatever names it. */
  private void addMethodBody(
      String jsName,
      @Nullable Node args,
      @Nullable Node body,
      boolean constructor,
      boolean isStatic,
      boolean getter) {
    MethodInfo savedMethod = method;
    Set<String> savedDeclared = declared;
    String blockName = blockParameterName(args);
    boolean implicitBlock = blockName == null && containsYield(body);
    String yieldName =
        blockName != null ? NodeUtil.safeName(blockName) : implicitBlock ? IMPLICIT_BLOCK : null;
    method = new MethodInfo(jsName, args, constructor, isStatic, getter, yieldName);
    declared = new LinkedHashSet<>();
    jumps.push(Jump.FUNCTION);

    cc.add("(");
    List<Runnable> prologue = addParameters(args, implicitBlock, true);
    cc.add(") ");
    // Getters always return their last value.
    addBody(body, prologue, getter);

    jumps.pop();
    declared = savedDeclared;
    method = savedMethod;
  }

  private static @Nullable String blockParameterName(@Nullable Node args) {
    if (args == null) {
      return null;
    }
    for (Node param : args.childNodes()) {
      if (param.isToken(Token.BLOCKARG) && param.getChild(0) != null) {
        return param.getString(0);
      }
    }
    return null;
  }

  private static boolean containsYield(@Nullable Node n) {
    if (n == null) {
      return false;
    }
    switch (n.getToken()) {
      case YIELD:
        return true;
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
      case SCLASS:
        return false;
      default:
        break;
    }
    for (Node child : n.childNodes()) {
      if (containsYield(child)) {
        return true;
      }
    }
    return false;
  }

  private void addYield(Node n) {
    if (method == null || method.yieldName == null) {
      throw unsupported(n, "yield outside of a method");
    }
    cc.add(method.yieldName);
    addArguments(null, n.childNodes(), null);
  }

  private void addSuper(Node n, @Nullable Node block) {
    MethodInfo current = method;
    ClassInfo owner = currentClass;
    if (current == null || owner == null || owner.superclass == null) {
      throw unsupported(n, "super outside of a subclass method");
    }
    List<Node> args =
        n.isToken(Token.ZSUPER) ? forwardedArguments(current.args) : n.childNodes();
    if (mode.isEs5()) {
      if (current.getter) {
        throw unsupported(n, "super in an ES5 accessor");
      }
      addExpr(owner.superclass, NodeUtil.MEMBER, Context.OTHER);
      if (!current.constructor) {
        if (!current.isStatic) {
          cc.add(".prototype");
        }
        addMember(current.name);
      }
      if (n.isToken(Token.ZSUPER) && block == null) {
        cc.add(".apply(this, arguments)");
        return;
      }
      if (args.stream().anyMatch(arg -> arg.isToken(Token.SPLAT))) {
        throw unsupported(n, "spread arguments to super need ES2015");
      }
      cc.add(".call(this");
      for (Node arg : args) {
        cc.listSeparator();
        addListItem(arg);
      }
      if (block != null) {
        cc.listSeparator();
        addFunction(block, Context.OTHER);
      }
      cc.add(")");
      return;
    }
    cc.add("super");
    if (current.constructor) {
      addArguments(null, args, block);
      return;
    }
    addMember(current.name);
    if (!current.getter) {
      addArguments(null, args, block);
    }
  }

  /** The arguments a bare {@code super} passes on: the parameters of the current method. */
  private static List<Node> forwardedArguments(@Nullable Node args) {
    List<Node> forwarded = new ArrayList<>();
    List<Node> pairs = new ArrayList<>();
    Node blockPass = null;
    List<Node> params = args == null ? ImmutableList.of() : args.childNodes();
    for (Node param : params) {
      if (param.getChild(0) == null) {
        continue;
      }
      switch (param.getToken()) {
        case ARG:
        case OPTARG:
          forwarded.add(IR.lvar(param.getString(0)));
          break;
        case RESTARG:
          forwarded.add(Node.make(Token.SPLAT, IR.lvar(param.getString(0))));
          break;
        case KWARG:
        case KWOPTARG:
          pairs.add(Node.make(Token.PAIR, IR.sym(param.getString(0)), IR.lvar(param.getString(0))));
          break;
        case KWRESTARG:
          pairs.add(Node.make(Token.KWSPLAT, IR.lvar(param.getString(0))));
          break;
        case BLOCKARG:
          blockPass = Node.make(Token.BLOCK_PASS, IR.lvar(param.getString(0)));
          break;
        default:
          break;
      }
    }
    if (!pairs.isEmpty()) {
      forwarded.add(Node.make(Token.HASH, pairs));
    }
    if (blockPass != null) {
      forwarded.add(blockPass);
    }
    return forwarded;
  }

  // Operators.

  private void addLogical(Node n, String op, int precedence, Context context) {
    addLogicalOperand(n.getNode(0), op, precedence, context);
    cc.addOp(op, true);
    addLogicalOperand(n.getNode(1), op, precedence + 1, Context.OTHER);
  }

  /** JavaScript does not allow {@code ??} next to {@code &&} or {@code ||} without parentheses. */
  private void addLogicalOperand(Node operand, String op, int minPrecedence, Context context) {
    boolean mixed =
        op.equals("??")
            ? operand.isToken(Token.AND) || (operand.isToken(Token.OR) && !isCoalescing(operand))
            : isCoalescing(operand);
    if (mixed) {
      cc.add("(");
      add(operand, Context.OTHER);
      cc.add(")");
    } else {
      addExpr(operand, minPrecedence, context);
    }
  }

  private void addNegated(Node condition) {
    if (condition.isToken(Token.NOT)
        || (NodeUtil.isUnaryOperation(condition) && condition.getString(1).equals("!"))) {
      addExpr(condition.getNode(0), NodeUtil.COMMA, Context.OTHER);
    } else {
      cc.addOp("!", false);
      addExpr(condition, NodeUtil.UNARY, Context.OTHER);
    }
  }

  private void addDefined(Node expression) {
    cc.add("typeof ");
    if (expression.isToken(Token.SEND)
        && expression.getChild(0) == null
        && argumentsOf(expression).isEmpty()) {
      cc.add(NodeUtil.safeName(expression.getString(1)));
    } else {
      addExpr(expression, NodeUtil.UNARY, Context.OTHER);
    }
    cc.addOp("!==", true);
    cc.add(jsString("undefined"));
  }

  // Assignments.

  private void addTarget(Node target) {
    switch (target.getToken()) {
      case LVASGN:
        cc.add(NodeUtil.safeName(target.getString(0)));
        return;
      case IVASGN:
        addInstanceVariable(target.getString(0));
        return;
      case CVASGN:
        addClassVariable(target.getString(0));
        return;
      case GVASGN:
        addGlobalVariable(target, target.getString(0));
        return;
      case CASGN:
        addConstantTarget(target);
        return;
      case SEND:
        addAssignableSend(target, Context.OTHER);
        return;
      case SPLAT:
        if (target.getNode(0) == null) {
          throw unsupported(target, "anonymous splat target");
        }
        cc.add("...");
        addTarget(target.getNode(0));
        return;
      case MLHS:
        {
          cc.add("[");
          List<Node> targets = target.childNodes();
          for (int i = 0; i < targets.size(); i++) {
            if (i > 0) {
              cc.listSeparator();
            }
            addTarget(targets.get(i));
          }
          cc.add("]");
          return;
        }
      default:
        throw unsupported(target, "cannot be assigned");
    }
  }

  private void addLocalAssignment(Node n) {
    String name = n.getString(0);
    if (!isDeclared(name)) {
      cc.add(declarationKeyword() + " ");
      declare(name);
    }
    cc.add(NodeUtil.safeName(name));
    cc.addOp("=", true);
    addExpr(n.getNode(1), NodeUtil.ASSIGN, Context.OTHER);
  }

  private void addConstantAssignment(Node n, boolean statement) {
    Node scope = n.getNode(0);
    if (statement && scope == null) {
      cc.add(mode.isEs5() ? "var " : "const ");
    }
    addConstantTarget(n);
    cc.addOp("=", true);
    addExpr(n.getNode(2), NodeUtil.ASSIGN, Context.OTHER);
  }

  private void addConstantTarget(Node casgn) {
    Node scope = casgn.getNode(0);
    if (scope != null && !scope.isToken(Token.CBASE)) {
      addExpr(scope, NodeUtil.MEMBER, Context.OTHER);
      cc.add(".");
    }
    cc.add(casgn.getString(1));
  }

  private void addOperatorAssignment(Node n) {
    Node target = n.getNode(0);
    String op = n.getString(1);
    Node value = n.getNode(2);
    if (op.equals("**") && !mode.isAtLeast(LanguageMode.ECMASCRIPT_2016)) {
      addTarget(target);
      cc.addOp("=", true);
      cc.add("Math.pow(");
      addTarget(target);
      cc.listSeparator();
      addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
      cc.add(")");
      return;
    }
    addTarget(target);
    cc.addOp(op + "=", true);
    addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
  }

  /** {@code x ||= v} and {@code x &&= v}. */
  private void addLogicalAssignment(Node n, boolean statement) {
    Node target = n.getNode(0);
    Node value = n.getNode(1);
    boolean or = n.isToken(Token.OR_ASGN);
    if (statement && target.isToken(Token.LVASGN) && !isDeclared(target.getString(0))) {
      // The local is still nil here.
      cc.add(declarationKeyword() + " " + NodeUtil.safeName(target.getString(0)));
      declare(target.getString(0));
      cc.addOp("=", true);
      if (or) {
        addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
      } else {
        cc.add("null");
      }
      return;
    }
    String op = or ? (nullish() && !n.isSynthetic() ? "??" : "||") : "&&";
    if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2021)) {
      addTarget(target);
      cc.addOp(op + "=", true);
      addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
      return;
    }
    int p = op.equals("??") ? NodeUtil.COALESCE : or ? NodeUtil.OR : NodeUtil.AND;
    addTarget(target);
    cc.addOp("=", true);
    addTarget(target);
    cc.addOp(op, true);
    if (op.equals("??") && (value.isToken(Token.AND) || value.isToken(Token.OR))) {
      cc.add("(");
      add(value, Context.OTHER);
      cc.add(")");
    } else {
      addExpr(value, p + 1, Context.OTHER);
    }
  }

  private void addMultipleAssignment(Node n, boolean statement) {
    Node mlhs = n.getNode(0);
    Node value = n.getNode(1);
    if (mode.isEs5()) {
      if (!statement) {
        throw unsupported(n, "multiple assignment as a value needs ES2015");
      }
      addEs5MultipleAssignment(mlhs, value);
      return;
    }
    if (statement && declaresAllTargets(mlhs)) {
      cc.add("let ");
      targetNames(mlhs).forEach(this::declare);
    }
    addTarget(mlhs);
    cc.addOp("=", true);
    addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
  }

  private void addEs5MultipleAssignment(Node mlhs, Node value) {
    String temp = tempName("$masgn");
    cc.add("var " + temp);
    cc.addOp("=", true);
    addExpr(value, NodeUtil.ASSIGN, Context.OTHER);
    List<Node> targets = mlhs.childNodes();
    for (int i = 0; i < targets.size(); i++) {
      nextStatement(false);
      Node target = targets.get(i);
      String element = temp + "[" + i + "]";
      if (target.isToken(Token.SPLAT)) {
        target = target.getNode(0);
        element = temp + ".slice(" + i + ")";
      }
      if (target == null || target.isToken(Token.MLHS)) {
        throw unsupported(mlhs, "nested multiple assignment needs ES2015");
      }
      if (target.isToken(Token.LVASGN) && !isDeclared(target.getString(0))) {
        cc.add("var ");
        declare(target.getString(0));
      }
      addTarget(target);
      cc.addOp("=", true);
      cc.add(element);
    }
  }

  // Jumps.

  private @Nullable Jump jumpTarget() {
    for (Jump jump : jumps) {
      if (jump != Jump.SWITCH) {
        return jump;
      }
    }
    return null;
  }

  private void addReturn(@Nullable Node value) {
    if (value == null) {
      cc.add("return");
      return;
    }
    cc.add("return ");
    addExpr(value, NodeUtil.COMMA, Context.OTHER);
  }

  private void addBreak(Node n) {
    if (jumpTarget() != Jump.LOOP) {
      throw unsupported(n, "break outside of a loop");
    }
    if (n.getChildCount() > 0) {
      throw unsupported(n, "break with a value");
    }
    cc.add("break");
  }

  /** {@code next} continues a loop, or returns from the function a block became. */
  private void addNext(Node n) {
    Jump target = jumpTarget();
    if (target == Jump.LOOP) {
      if (n.getChildCount() > 0) {
        throw unsupported(n, "next with a value in a loop");
      }
      cc.add("continue");
    } else if (target == Jump.BLOCK) {
      addReturn(n.getNode(0));
    } else {
      throw unsupported(n, "next outside of a block or loop");
    }
  }

  private void addThrow(Node n) {
    List<Node> args = argumentsOf(n);
    cc.add("throw ");
    Node first = args.get(0);
    if (args.size() == 1) {
      if (first.isToken(Token.CONST)) {
        cc.add("new ");
        addExpr(first, NodeUtil.MEMBER, Context.OTHER);
        cc.add("()");
      } else {
        addExpr(first, NodeUtil.COMMA, Context.OTHER);
      }
      return;
    }
    cc.add("new ");
    addExpr(first, NodeUtil.MEMBER, Context.OTHER);
    addArguments(null, args.subList(1, args.size()), null);
  }

  // Control flow.

  private boolean addIfStatement(Node n, boolean returning) {
    Node condition = n.getNode(0);
    Node then = n.getNode(1);
    Node otherwise = n.getNode(2);
    cc.add("if (");
    if (then == null && otherwise != null) {
      addNegated(condition);
      cc.add(") ");
      addBody(otherwise, ImmutableList.of(), returning);
      return true;
    }
    addExpr(condition, NodeUtil.COMMA, Context.OTHER);
    cc.add(") ");
    addBody(then, ImmutableList.of(), returning);
    if (otherwise != null) {
      cc.add(" else ");
      if (otherwise.isToken(Token.IF) && otherwise.getNode(1) != null) {
        return addIfStatement(otherwise, returning);
      }
      addBody(otherwise, ImmutableList.of(), returning);
    }
    return true;
  }

  private void addWhile(Node n) {
    jumps.push(Jump.LOOP);
    cc.add("while (");
    if (n.isToken(Token.UNTIL)) {
      addNegated(n.getNode(0));
    } else {
      addExpr(n.getNode(0), NodeUtil.COMMA, Context.OTHER);
    }
    cc.add(") ");
    addBody(n.getNode(1), ImmutableList.of(), false);
    jumps.pop();
  }

  private void addDoWhile(Node n) {
    jumps.push(Jump.LOOP);
    cc.add("do ");
    addBody(n.getNode(1), ImmutableList.of(), false);
    cc.add(" while (");
    if (n.isToken(Token.UNTIL_POST)) {
      addNegated(n.getNode(0));
    } else {
      addExpr(n.getNode(0), NodeUtil.COMMA, Context.OTHER);
    }
    cc.add(")");
    jumps.pop();
  }

  /** {@code loop do ... end}. */
  private void addLoop(Node block) {
    jumps.push(Jump.LOOP);
    cc.add("while (true) ");
    addBody(block.getNode(2), ImmutableList.of(), false);
    jumps.pop();
  }

  private void addFor(Node n) {
    Node variable = n.getNode(0);
    Node iterable = n.getNode(1);
    Node body = n.getNode(2);
    jumps.push(Jump.LOOP);
    boolean range = iterable.isToken(Token.IRANGE) || iterable.isToken(Token.ERANGE);
    if (range
        && iterable.getNode(0) != null
        && iterable.getNode(1) != null
        && variable.isToken(Token.LVASGN)) {
      String name = NodeUtil.safeName(variable.getString(0));
      cc.add("for (");
      if (!isDeclared(variable.getString(0))) {
        cc.add(declarationKeyword() + " ");
      }
      cc.add(name);
      cc.addOp("=", true);
      addExpr(iterable.getNode(0), NodeUtil.ASSIGN, Context.OTHER);
      cc.add("; " + name);
      cc.addOp(iterable.isToken(Token.IRANGE) ? "<=" : "<", true);
      addExpr(iterable.getNode(1), NodeUtil.RELATIONAL + 1, Context.OTHER);
      cc.add("; " + name + "++) ");
      addBody(body, ImmutableList.of(), false);
    } else if (range) {
      throw unsupported(iterable, "endless range in a for loop");
    } else if (mode.isEs5()) {
      if (!variable.isToken(Token.LVASGN)) {
        throw unsupported(variable, "destructuring for loops need ES2015");
      }
      String index = tempName("$i");
      String list = tempName("$list");
      cc.add("for (var " + index + " = 0, " + list);
      cc.addOp("=", true);
      addExpr(iterable, NodeUtil.ASSIGN, Context.OTHER);
      cc.add("; " + index + " < " + list + ".length; " + index + "++) ");
      String name = variable.getString(0);
      Runnable element =
          () ->
              printSynthetic(
                  () -> {
                    if (!isDeclared(name)) {
                      cc.add("var ");
                    }
                    cc.add(NodeUtil.safeName(name));
                    cc.addOp("=", true);
                    cc.add(list + "[" + index + "]");
                  });
      addBody(body, ImmutableList.of(element), false);
    } else {
      cc.add("for (");
      if (variable.isToken(Token.MLHS)) {
        if (declaresAllTargets(variable)) {
          cc.add("let ");
        }
      } else if (variable.isToken(Token.LVASGN) && !isDeclared(variable.getString(0))) {
        cc.add("let ");
      }
      addTarget(variable);
      cc.add(" of ");
      addExpr(iterable, NodeUtil.ASSIGN, Context.OTHER);
      cc.add(") ");
      addBody(body, ImmutableList.of(), false);
    }
    jumps.pop();
  }

  /** The {@code when} clauses of a case, between its subject and its else body. */
  private static List<Node> whensOf(Node caseNode) {
    List<Node> whens = new ArrayList<>();
    for (int i = 1; i < caseNode.getChildCount() - 1; i++) {
      whens.add(caseNode.getNode(i));
    }
    return whens;
  }

  private static List<Node> whenValues(Node when) {
    List<Node> values = new ArrayList<>();
    for (int i = 0; i < when.getChildCount() - 1; i++) {
      values.add(when.getNode(i));
    }
    return values;
  }

  private static @Nullable Node whenBody(Node when) {
    return when.getNode(when.getChildCount() - 1);
  }

  private boolean addCase(Node n, boolean returning) {
    Node subject = n.getNode(0);
    List<Node> whens = whensOf(n);
    Node otherwise = n.getNode(n.getChildCount() - 1);
    if (subject != null && canSwitch(whens)) {
      addSwitch(subject, whens, otherwise, returning);
      return true;
    }
    if (subject != null && !NodeUtil.isSimple(subject)) {
      String temp = tempName("$case");
      if (mode.isEs5()) {
        cc.add("var " + temp);
      } else {
        cc.add("let " + temp);
      }
      declare(temp);
      cc.addOp("=", true);
      addExpr(subject, NodeUtil.ASSIGN, Context.OTHER);
      nextStatement(false);
      subject = IR.lvar(temp);
    }
    Node chain = otherwise;
    for (int i = whens.size() - 1; i >= 0; i--) {
      Node when = whens.get(i);
      Node condition = null;
      for (Node value : whenValues(when)) {
        Node test = caseTest(subject, value);
        condition = condition == null ? test : Node.make(Token.OR, condition, test);
      }
      chain = IR.ifNode(condition, whenBody(when), chain);
    }
    return addIfStatement(chain, returning);
  }

  private static boolean canSwitch(List<Node> whens) {
    for (Node when : whens) {
      for (Node value : whenValues(when)) {
        if (!NodeUtil.isLiteral(value)) {
          return false;
        }
      }
      Node body = whenBody(when);
      if (body != null && containsToken(body, Token.BREAK)) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsToken(Node n, Token token) {
    if (n.isToken(token)) {
      return true;
    }
    for (Node child : n.childNodes()) {
      if (containsToken(child, token)) {
        return true;
      }
    }
    return false;
  }

  private void addSwitch(
      Node subject, List<Node> whens, @Nullable Node otherwise, boolean returning) {
    jumps.push(Jump.SWITCH);
    cc.add("switch (");
    addExpr(subject, NodeUtil.COMMA, Context.OTHER);
    cc.add(") ");
    cc.beginBlock();
    for (Node when : whens) {
      List<Node> values = whenValues(when);
      for (int i = 0; i < values.size(); i++) {
        cc.add("case ");
        addExpr(values.get(i), NodeUtil.COMMA, Context.OTHER);
        if (i < values.size() - 1) {
          cc.add(":");
          cc.endLine();
        }
      }
      cc.beginCaseBody();
      Node body = whenBody(when);
      printStatements(NodeUtil.statementsOf(body), returning);
      if (!endsWithJump(body, returning)) {
        printSynthetic(() -> cc.add("break"));
      }
      cc.endCaseBody();
    }
    if (otherwise != null) {
      cc.add("default");
      cc.beginCaseBody();
      printStatements(NodeUtil.statementsOf(otherwise), returning);
      cc.endCaseBody();
    }
    cc.endBlock();
    jumps.pop();
  }

  /** The condition under which {@code value} matches the subject of a case. */
  private Node caseTest(@Nullable Node subject, Node value) {
    if (subject == null) {
      return value;
    }
    switch (value.getToken()) {
      case IRANGE:
      case ERANGE:
        {
          Node start = value.getNode(0);
          Node end = value.getNode(1);
          Node lower = start == null ? null : IR.send(subject, ">=", start);
          Node upper =
              end == null
                  ? null
                  : IR.send(subject, value.isToken(Token.IRANGE) ? "<=" : "<", end);
          if (lower == null || upper == null) {
            return lower != null ? lower : checkNotNullTest(upper, value);
          }
          return Node.make(Token.AND, lower, upper);
        }
      case REGEXP:
        return IR.send(value, "=~", subject);
      case SPLAT:
        if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2016)) {
          return IR.call(value.getNode(0), "includes", subject);
        }
        return IR.send(IR.call(value.getNode(0), "indexOf", subject), "!==", IR.number(-1L));
      case CONST:
        if (value.getChild(0) == null) {
          switch (value.getString(1)) {
            case "String":
            case "Symbol":
              return typeofTest(subject, "string");
            case "Numeric":
            case "Integer":
            case "Float":
              return typeofTest(subject, "number");
            case "Array":
              return IR.call(IR.constant("Array"), "isArray", subject);
            default:
              break;
          }
        }
        return Node.make(Token.SEND, subject, "instanceof", value);
      default:
        return IR.send(subject, "===", value);
    }
  }

  private Node checkNotNullTest(@Nullable Node test, Node range) {
    if (test == null) {
      throw unsupported(range, "range with no ends");
    }
    return test;
  }

  private static Node typeofTest(Node subject, String type) {
    return IR.send(Node.make(Token.TYPEOF, subject), "===", IR.string(type));
  }

  private void addTry(Node n, boolean returning) {
    Node rescue = n;
    Node cleanup = null;
    if (n.isToken(Token.ENSURE)) {
      rescue = n.getNode(0);
      cleanup = n.getNode(1);
    }
    Node body = rescue;
    List<Node> resbodies = new ArrayList<>();
    Node otherwise = null;
    if (rescue != null && rescue.isToken(Token.RESCUE)) {
      body = rescue.getNode(0);
      for (int i = 1; i < rescue.getChildCount() - 1; i++) {
        resbodies.add(rescue.getNode(i));
      }
      otherwise = rescue.getNode(rescue.getChildCount() - 1);
    }

    cc.add("try ");
    List<Node> protectedStatements = NodeUtil.statementsOf(body);
    List<Node> elseStatements = NodeUtil.statementsOf(otherwise);
    if (protectedStatements.isEmpty() && elseStatements.isEmpty()) {
      cc.add("{}");
    } else {
      cc.beginBlock();
      printStatements(protectedStatements, returning && elseStatements.isEmpty());
      printStatements(elseStatements, returning);
      cc.endBlock();
    }
    if (!resbodies.isEmpty()) {
      addCatch(resbodies, returning);
    }
    if (cleanup != null) {
      cc.add(" finally ");
      addBody(cleanup, ImmutableList.of(), false);
    }
  }

  private static boolean isCatchAll(Node resbody) {
    Node classes = resbody.getNode(0);
    if (classes == null) {
      return true;
    }
    for (Node exceptionClass : classes.childNodes()) {
      if (!exceptionClass.isToken(Token.CONST)
          || exceptionClass.getChild(0) != null
          || !CATCH_ALL.contains(exceptionClass.getString(1))) {
        return false;
      }
    }
    return true;
  }

  private void addCatch(List<Node> resbodies, boolean returning) {
    cc.add(" catch ");
    if (resbodies.size() == 1 && isCatchAll(resbodies.get(0))) {
      Node resbody = resbodies.get(0);
      Node variable = resbody.getNode(1);
      List<Runnable> prologue = new ArrayList<>();
      if (variable != null && variable.isToken(Token.LVASGN)) {
        cc.add("(" + NodeUtil.safeName(variable.getString(0)) + ") ");
      } else if (variable != null) {
        cc.add("(" + EXCEPTION + ") ");
        prologue.add(exceptionPrologue(variable));
      } else if (!mode.isAtLeast(LanguageMode.ECMASCRIPT_2019)) {
        cc.add("(" + EXCEPTION + ") ");
      }
      addBody(resbody.getNode(2), prologue, returning);
      return;
    }

    cc.add("(" + EXCEPTION + ") ");
    cc.beginBlock();
    cc.beginStatement();
    boolean caughtAll = false;
    for (int i = 0; i < resbodies.size() && !caughtAll; i++) {
      Node resbody = resbodies.get(i);
      List<Runnable> prologue = new ArrayList<>();
      if (resbody.getNode(1) != null) {
        prologue.add(exceptionPrologue(resbody.getNode(1)));
      }
      caughtAll = isCatchAll(resbody);
      if (i > 0) {
        cc.add(" else ");
      }
      if (!caughtAll) {
        Node condition = null;
        for (Node exceptionClass : resbody.getNode(0).childNodes()) {
          Node test = Node.make(Token.SEND, IR.lvar(EXCEPTION), "instanceof", exceptionClass);
          condition = condition == null ? test : Node.make(Token.OR, condition, test);
        }
        cc.add("if (");
        addExpr(condition, NodeUtil.COMMA, Context.OTHER);
        cc.add(") ");
      }
      addBody(resbody.getNode(2), prologue, returning);
    }
    if (!caughtAll) {
      cc.add(" else ");
      cc.beginBlock();
      printSynthetic(() -> cc.add("throw " + EXCEPTION));
      cc.endBlock();
    }
    cc.endLine();
    cc.endBlock();
  }

  /** Stores the caught exception in the variable a rescue clause names. */
  private Runnable exceptionPrologue(Node variable) {
    return () ->
        printSynthetic(
            () -> {
              if (variable.isToken(Token.LVASGN) && !isDeclared(variable.getString(0))) {
                cc.add(declarationKeyword() + " ");
              }
              addTarget(variable);
              cc.addOp("=", true);
              cc.add(EXCEPTION);
            });
  }

  // Classes and modules.

  /** Prints the statements that follow, returning whether the last one ends in "}". */
  private boolean printDeferred(boolean endsWithBlock, List<BooleanSupplier> statements) {
    // The list grows while nested classes print.
    for (int i = 0; i < statements.size(); i++) {
      nextStatement(endsWithBlock);
      endsWithBlock = statements.get(i).getAsBoolean();
    }
    return endsWithBlock;
  }

  /** A method name without its {@code ?} or {@code !}, for lookups that report nothing. */
  private static String plainMethodName(String selector) {
    if (selector.length() > 1 && (selector.endsWith("?") || selector.endsWith("!"))) {
      return selector.substring(0, selector.length() - 1);
    }
    return selector;
  }

  private static String setterName(String selector) {
    return selector.substring(0, selector.length() - 1);
  }

  /** A class member name: an identifier or a quoted string. */
  private String memberKey(String name) {
    return NodeUtil.isValidSimpleName(name) ? name : jsString(name);
  }

  /** The dotted name of a constant path such as {@code A::B}. */
  private String constantPath(Node path) {
    if (!path.isToken(Token.CONST)) {
      throw unsupported(path, "is not a constant name");
    }
    Node scope = path.getNode(0);
    if (scope == null || scope.isToken(Token.CBASE)) {
      return path.getString(1);
    }
    return constantPath(scope) + "." + path.getString(1);
  }

  /**
   * The members of a class body, with {@code private def} unwrapped and the methods of
   * {@code class << self} turned into singleton methods.
   */
  private List<Node> classMembers(@Nullable Node body) {
    List<Node> members = new ArrayList<>();
    for (Node statement : NodeUtil.statementsOf(body)) {
      if (statement.isToken(Token.SEND)
          && statement.getChild(0) == null
          && VISIBILITY.contains(statement.getString(1))
          && statement.getChildCount() == 3
          && statement.getNode(2) != null
          && (statement.getNode(2).isToken(Token.DEF)
              || statement.getNode(2).isToken(Token.DEFS))) {
        members.add(statement.getNode(2));
      } else if (statement.isToken(Token.SCLASS)) {
        if (!statement.getNode(0).isToken(Token.SELF)) {
          throw unsupported(statement, "singleton class of anything but self");
        }
        for (Node member : NodeUtil.statementsOf(statement.getNode(1))) {
          if (member.isToken(Token.DEF)) {
            members.add(
                Node.make(
                        Token.DEFS,
                        IR.self(),
                        member.getString(0),
                        member.getNode(1),
                        member.getNode(2))
                    .withSourceRange(member.getSourceRange()));
          } else if (!isVisibilityCall(member)) {
            throw unsupported(member, "only methods are supported in class << self");
          }
        }
      } else {
        members.add(statement);
      }
    }
    return members;
  }

  private static boolean isVisibilityCall(Node n) {
    return n.isToken(Token.SEND)
        && n.getChild(0) == null
        && VISIBILITY.contains(n.getString(1));
  }

  private MemberKind kindOf(Node member, String className) {
    switch (member.getToken()) {
      case DEF:
        return methodKind(member, member.getString(0), member.getNode(1), true);
      case DEFS:
        {
          Node target = member.getNode(0);
          boolean own =
              target.isToken(Token.SELF)
                  || (target.isToken(Token.CONST)
                      && target.getChild(0) == null
                      && target.getString(1).equals(className));
          return own
              ? methodKind(member, member.getString(1), member.getNode(2), false)
              : MemberKind.OTHER;
        }
      case SEND:
        if (member.getChild(0) != null) {
          return MemberKind.OTHER;
        }
        switch (member.getString(1)) {
          case "attr_reader":
          case "attr_writer":
          case "attr_accessor":
            return MemberKind.ATTR;
          case "include":
            return MemberKind.INCLUDE;
          case "extend":
            return MemberKind.EXTEND;
          default:
            return VISIBILITY.contains(member.getString(1))
                ? MemberKind.VISIBILITY
                : MemberKind.OTHER;
        }
      case CASGN:
        return member.getChild(0) == null ? MemberKind.CONSTANT : MemberKind.OTHER;
      case CVASGN:
        return MemberKind.CLASS_VARIABLE;
      case ALIAS:
        return MemberKind.ALIAS;
      case CLASS:
      case MODULE:
        return MemberKind.NESTED;
      default:
        return MemberKind.OTHER;
    }
  }

  private static MemberKind methodKind(
      Node def, String name, @Nullable Node args, boolean instance) {
    if (instance && name.equals("initialize")) {
      return MemberKind.CONSTRUCTOR;
    }
    if (NodeUtil.isSetterName(name) && !name.equals("[]=")) {
      return MemberKind.SETTER;
    }
    if ((args == null || args.getChildCount() == 0) && !def.isMethodCallShape()) {
      return MemberKind.GETTER;
    }
    return MemberKind.METHOD;
  }

  private static boolean isStaticMember(Node member) {
    return member.isToken(Token.DEFS);
  }

  private static String defName(Node member) {
    return member.isToken(Token.DEFS) ? member.getString(1) : member.getString(0);
  }

  private static @Nullable Node defArgs(Node member) {
    return member.isToken(Token.DEFS) ? member.getNode(2) : member.getNode(1);
  }

  private static @Nullable Node defBody(Node member) {
    return member.isToken(Token.DEFS) ? member.getNode(3) : member.getNode(2);
  }

  /** The names an {@code attr_*} declaration lists. */
  private List<String> attrNames(Node attr) {
    List<String> names = new ArrayList<>();
    for (Node arg : argumentsOf(attr)) {
      if (!arg.isToken(Token.SYM) && !arg.isToken(Token.STR)) {
        throw unsupported(arg, "attribute names must be literal");
      }
      names.add(arg.getString(0));
    }
    return names;
  }

  private static boolean readsAttr(Node attr) {
    return !attr.getString(1).equals("attr_writer");
  }

  private static boolean writesAttr(Node attr) {
    return !attr.getString(1).equals("attr_reader");
  }

  /** Records what receiverless calls in the class body refer to. */
  private void collectMembers(ClassInfo info, List<Node> members, Map<Node, MemberKind> kinds) {
    for (Node member : members) {
      MemberKind kind = kindOf(member, simpleName(info.name));
      kinds.put(member, kind);
      boolean isStatic = isStaticMember(member);
      switch (kind) {
        case METHOD:
          info.methods(isStatic).add(plainMethodName(defName(member)));
          break;
        case GETTER:
          info.getters(isStatic).add(plainMethodName(defName(member)));
          break;
        default:
          break;
      }
      if ((kind == MemberKind.METHOD || kind == MemberKind.GETTER || kind == MemberKind.SETTER)
          && !isStatic) {
        info.explicit.add(defName(member));
      }
    }
    for (Node member : members) {
      if (kinds.get(member) == MemberKind.ATTR && readsAttr(member)) {
        for (String name : attrNames(member)) {
          if (!info.explicit.contains(name)) {
            info.getters.add(name);
          }
        }
      }
    }
  }

  private static String simpleName(String dottedName) {
    return dottedName.substring(dottedName.lastIndexOf('.') + 1);
  }

  private static void collectInstanceVariables(Node n, Set<String> reads, Set<String> writes) {
    switch (n.getToken()) {
      case IVAR:
        reads.add(n.getString(0).substring(1));
        return;
      case IVASGN:
        writes.add(n.getString(0).substring(1));
        break;
      case CLASS:
      case MODULE:
      case SCLASS:
      case DEFS:
        return;
      default:
        break;
    }
    for (Node child : n.childNodes()) {
      collectInstanceVariables(child, reads, writes);
    }
  }

  /** The private fields a class declares, in order of first use. */
  private Set<String> privateFields(
      Node classNode, ClassInfo info, List<Node> members, Map<Node, MemberKind> kinds) {
    Set<String> reads = new LinkedHashSet<>();
    Set<String> writes = new LinkedHashSet<>();
    for (Node member : members) {
      MemberKind kind = kinds.get(member);
      if (kind == MemberKind.ATTR) {
        for (String name : attrNames(member)) {
          reads.add(name);
          if (writesAttr(member)) {
            writes.add(name);
          }
        }
      } else if (member.isToken(Token.DEF)) {
        collectInstanceVariables(member, reads, writes);
      }
    }
    Set<String> fields = new LinkedHashSet<>(reads);
    fields.addAll(writes);
    if (info.superclass != null) {
      for (String name : reads) {
        if (!writes.contains(name)) {
          conversion.report(classNode, INHERITED_IVAR, "@" + name, info.name);
        }
      }
    }
    return fields;
  }

  private boolean addClass(Node n) {
    Node path = n.getNode(0);
    String name = constantPath(path);
    Node scope = path.getNode(0);
    boolean qualified = scope != null && !scope.isToken(Token.CBASE);
    return addClass(n, name, qualified);
  }

  /**
   * Prints a class. A {@code qualified} class is assigned to a property, as in
   * {@code Outer.Inner = class Inner {...}}; any other class is declared.
   */
  private boolean addClass(Node n, String name, boolean qualified) {
    if (mode.isEs5()) {
      ClassInfo info = new ClassInfo(name, n.getNode(1), false);
      List<Node> members = classMembers(n.getNode(2));
      Map<Node, MemberKind> kinds = new LinkedHashMap<>();
      collectMembers(info, members, kinds);
      return addEs5Class(info, members, kinds, qualified);
    }
    if (qualified) {
      cc.add(name);
      cc.addOp("=", true);
    }
    List<BooleanSupplier> after = new ArrayList<>();
    addClassExpression(n, name, after);
    return printDeferred(!qualified, after);
  }

  /**
   * Prints {@code class Name extends Super {...}}. Members that cannot be part of the class body
   * are added to {@code after}.
   */
  private void addClassExpression(Node n, String name, List<BooleanSupplier> after) {
    ClassInfo info = new ClassInfo(name, n.getNode(1), false);
    List<Node> members = classMembers(n.getNode(2));
    Map<Node, MemberKind> kinds = new LinkedHashMap<>();
    collectMembers(info, members, kinds);
    info.privateFields =
        mode.isAtLeast(LanguageMode.ECMASCRIPT_2022) && !options.isUnderscoredPrivate();

    ClassInfo savedClass = currentClass;
    String savedSelf = selfName;
    currentClass = info;
    selfName = null;

    cc.add("class " + simpleName(name));
    if (info.superclass != null) {
      cc.add(" extends ");
      addExpr(info.superclass, NodeUtil.MEMBER, Context.OTHER);
    }
    cc.add(" ");
    Set<String> fields =
        info.privateFields ? privateFields(n, info, members, kinds) : ImmutableSet.of();
    boolean empty =
        fields.isEmpty()
            && members.stream().allMatch(member -> kinds.get(member) == MemberKind.VISIBILITY);
    if (empty) {
      cc.add("{}");
    } else {
      cc.beginBlock();
      for (String field : fields) {
        printSynthetic(() -> cc.add("#" + field));
      }
      Node previous = null;
      for (Node member : members) {
        MemberKind kind = kinds.get(member);
        if (kind == MemberKind.VISIBILITY) {
          continue;
        }
        if (deferredInClass(kind)) {
          after.add(deferredMember(info, member, kind));
          continue;
        }
        printLeading(member, previous);
        cc.beginStatement();
        cc.startSourceMapping(member);
        boolean endsWithBlock = addClassMember(info, member, kind);
        cc.endSourceMapping(member);
        finishStatement(member, endsWithBlock);
        previous = member;
      }
      cc.endBlock();
    }

    currentClass = savedClass;
    selfName = savedSelf;
  }

  /** Members that become statements after the class body. */
  private boolean deferredInClass(MemberKind kind) {
    switch (kind) {
      case INCLUDE:
      case EXTEND:
      case ALIAS:
      case NESTED:
        return true;
      case CONSTANT:
      case CLASS_VARIABLE:
      case OTHER:
        return !mode.isAtLeast(LanguageMode.ECMASCRIPT_2022);
      default:
        return false;
    }
  }

  /** Prints a member inside a class body, returning whether it ends in "}". */
  private boolean addClassMember(ClassInfo info, Node member, MemberKind kind) {
    boolean isStatic = isStaticMember(member);
    String prefix = isStatic ? "static " : "";
    switch (kind) {
      case CONSTRUCTOR:
        cc.add("constructor");
        addMethodBody("constructor", defArgs(member), defBody(member), true, false, false);
        return true;
      case METHOD:
        {
          String name = methodName(member, defName(member));
          cc.add(prefix + memberKey(name));
          addMethodBody(name, defArgs(member), defBody(member), false, isStatic, false);
          return true;
        }
      case GETTER:
        {
          String name = methodName(member, defName(member));
          cc.add(prefix + "get " + memberKey(name));
          addMethodBody(name, defArgs(member), defBody(member), false, isStatic, true);
          return true;
        }
      case SETTER:
        {
          String name = setterName(defName(member));
          cc.add(prefix + "set " + memberKey(name));
          addMethodBody(name, defArgs(member), defBody(member), false, isStatic, false);
          return true;
        }
      case ATTR:
        return addAttrAccessors(info, member);
      case CONSTANT:
        cc.add("static " + member.getString(1));
        cc.addOp("=", true);
        addExpr(member.getNode(2), NodeUtil.ASSIGN, Context.OTHER);
        return false;
      case CLASS_VARIABLE:
        cc.add("static _" + member.getString(0).substring(2));
        cc.addOp("=", true);
        addExpr(member.getNode(1), NodeUtil.ASSIGN, Context.OTHER);
        return false;
      default:
        {
          cc.add("static ");
          Set<String> savedDeclared = declared;
          declared = new LinkedHashSet<>();
          jumps.push(Jump.FUNCTION);
          addBody(member, ImmutableList.of(), false);
          jumps.pop();
          declared = savedDeclared;
          return true;
        }
    }
  }

  /** {@code attr_*}: accessors for instance variables, one line each. */
  private boolean addAttrAccessors(ClassInfo info, Node attr) {
    boolean first = true;
    boolean endsWithBlock = false;
    for (String name : attrNames(attr)) {
      if (readsAttr(attr) && !info.explicit.contains(name)) {
        if (!first) {
          nextStatement(endsWithBlock);
        }
        cc.add("get " + name + "() ");
        cc.beginBlock();
        printSynthetic(
            () -> {
              cc.add("return ");
              addInstanceVariable("@" + name);
            });
        cc.endBlock();
        first = false;
        endsWithBlock = true;
      }
      if (writesAttr(attr) && !info.explicit.contains(name + "=")) {
        if (!first) {
          nextStatement(endsWithBlock);
        }
        String param = NodeUtil.safeName(name);
        cc.add("set " + name + "(" + param + ") ");
        cc.beginBlock();
        printSynthetic(
            () -> {
              addInstanceVariable("@" + name);
              cc.addOp("=", true);
              cc.add(param);
            });
        cc.endBlock();
        first = false;
        endsWithBlock = true;
      }
    }
    return endsWithBlock;
  }

  /** A member printed after the class, with the class standing in for {@code self}. */
  private BooleanSupplier deferredMember(ClassInfo info, Node member, MemberKind kind) {
    return () -> {
      ClassInfo savedClass = currentClass;
      String savedSelf = selfName;
      currentClass = info;
      selfName = info.name;
      cc.startSourceMapping(member);
      boolean endsWithBlock = addDeferredMember(info, member, kind);
      cc.endSourceMapping(member);
      currentClass = savedClass;
      selfName = savedSelf;
      return endsWithBlock;
    };
  }

  private boolean addDeferredMember(ClassInfo info, Node member, MemberKind kind) {
    switch (kind) {
      case INCLUDE:
      case EXTEND:
        {
          List<Node> modules = argumentsOf(member);
          String target = kind == MemberKind.INCLUDE ? info.name + ".prototype" : info.name;
          for (int i = 0; i < modules.size(); i++) {
            if (i > 0) {
              nextStatement(false);
            }
            cc.add("Object.assign(" + target);
            cc.listSeparator();
            addExpr(modules.get(i), NodeUtil.ASSIGN, Context.OTHER);
            cc.add(")");
          }
          return false;
        }
      case ALIAS:
        {
          String prototype = info.name + ".prototype";
          cc.add(prototype);
          addMember(methodName(member, member.getNode(0).getString(0)));
          cc.addOp("=", true);
          cc.add(prototype);
          addMember(methodName(member, member.getNode(1).getString(0)));
          return false;
        }
      case CONSTANT:
        cc.add(info.name + "." + member.getString(1));
        cc.addOp("=", true);
        addExpr(member.getNode(2), NodeUtil.ASSIGN, Context.OTHER);
        return false;
      case CLASS_VARIABLE:
        cc.add(info.name + "._" + member.getString(0).substring(2));
        cc.addOp("=", true);
        addExpr(member.getNode(1), NodeUtil.ASSIGN, Context.OTHER);
        return false;
      case NESTED:
        {
          String name = info.name + "." + member.getNode(0).getString(1);
          currentClass = null;
          selfName = null;
          return member.isToken(Token.CLASS)
              ? addClass(member, name, true)
              : addModule(member, name, true);
        }
      default:
        hoistLocals(member);
        return addStatement(member);
    }
  }

  /** A class as a constructor function with its methods on the prototype. */
  private boolean addEs5Class(
      ClassInfo info, List<Node> members, Map<Node, MemberKind> kinds, boolean qualified) {
    ClassInfo savedClass = currentClass;
    String savedSelf = selfName;
    currentClass = info;
    selfName = null;

    Node constructor = null;
    for (Node member : members) {
      if (kinds.get(member) == MemberKind.CONSTRUCTOR) {
        constructor = member;
      }
    }
    if (qualified) {
      cc.add(info.name);
      cc.addOp("=", true);
      cc.add("function");
    } else {
      cc.add("function " + simpleName(info.name));
    }
    if (constructor != null) {
      addMethodBody("constructor", defArgs(constructor), defBody(constructor), true, false, false);
    } else if (info.superclass != null) {
      cc.add("() ");
      cc.beginBlock();
      printSynthetic(
          () -> {
            addExpr(info.superclass, NodeUtil.MEMBER, Context.OTHER);
            cc.add(".apply(this, arguments)");
          });
      cc.endBlock();
    } else {
      cc.add("() {}");
    }

    List<BooleanSupplier> statements = new ArrayList<>();
    if (info.superclass != null) {
      statements.add(
          () -> {
            cc.add(info.name + ".prototype");
            cc.addOp("=", true);
            cc.add("Object.create(");
            addExpr(info.superclass, NodeUtil.MEMBER, Context.OTHER);
            cc.add(".prototype)");
            return false;
          });
      statements.add(
          () -> {
            cc.add(info.name + ".prototype.constructor");
            cc.addOp("=", true);
            cc.add(info.name);
            return false;
          });
    }
    Set<String> accessorsDone = new LinkedHashSet<>();
    for (Node member : members) {
      MemberKind kind = kinds.get(member);
      switch (kind) {
        case CONSTRUCTOR:
        case VISIBILITY:
          break;
        case METHOD:
          statements.add(
              () -> {
                boolean isStatic = isStaticMember(member);
                String name = methodName(member, defName(member));
                cc.add(isStatic ? info.name : info.name + ".prototype");
                addMember(name);
                cc.addOp("=", true);
                cc.add("function");
                addMethodBody(name, defArgs(member), defBody(member), false, isStatic, false);
                return false;
              });
          break;
        case GETTER:
        case SETTER:
        case ATTR:
          for (String name : accessorNames(member, kind)) {
            String key = (isStaticMember(member) ? "static " : "") + name;
            if (accessorsDone.add(key)) {
              statements.add(
                  () -> addEs5Accessor(info, members, kinds, name, isStaticMember(member)));
            }
          }
          break;
        default:
          statements.add(deferredMember(info, member, kind));
          break;
      }
    }

    currentClass = savedClass;
    selfName = savedSelf;
    List<BooleanSupplier> bound = new ArrayList<>();
    for (BooleanSupplier statement : statements) {
      bound.add(
          () -> {
            ClassInfo outerClass = currentClass;
            currentClass = info;
            boolean endsWithBlock = statement.getAsBoolean();
            currentClass = outerClass;
            return endsWithBlock;
          });
    }
    return printDeferred(!qualified, bound);
  }

  private List<String> accessorNames(Node member, MemberKind kind) {
    switch (kind) {
      case GETTER:
        return ImmutableList.of(plainMethodName(defName(member)));
      case SETTER:
        return ImmutableList.of(setterName(defName(member)));
      default:
        return attrNames(member);
    }
  }

  /** {@code Object.defineProperty} with every getter and setter the class has for {@code name}. */
  private boolean addEs5Accessor(
      ClassInfo info,
      List<Node> members,
      Map<Node, MemberKind> kinds,
      String name,
      boolean isStatic) {
    Node getter = null;
    Node setter = null;
    boolean attrReader = false;
    boolean attrWriter = false;
    for (Node member : members) {
      MemberKind kind = kinds.get(member);
      if (isStaticMember(member) != isStatic) {
        continue;
      }
      if (kind == MemberKind.GETTER && plainMethodName(defName(member)).equals(name)) {
        getter = member;
      } else if (kind == MemberKind.SETTER && setterName(defName(member)).equals(name)) {
        setter = member;
      } else if (kind == MemberKind.ATTR && attrNames(member).contains(name)) {
        attrReader |= readsAttr(member);
        attrWriter |= writesAttr(member);
      }
    }
    cc.add("Object.defineProperty(" + (isStatic ? info.name : info.name + ".prototype"));
    cc.listSeparator();
    cc.add(jsString(name));
    cc.listSeparator();
    cc.beginBlock();
    cc.add("enumerable: true,");
    cc.endLine();
    cc.add("configurable: true");
    if (getter != null) {
      cc.add(",");
      cc.endLine();
      cc.add("get: function");
      addMethodBody(name, defArgs(getter), defBody(getter), false, isStatic, true);
    } else if (attrReader) {
      cc.add(",");
      cc.endLine();
      cc.add("get: function() ");
      cc.beginBlock();
      printSynthetic(
          () -> {
            cc.add("return ");
            addInstanceVariable("@" + name);
          });
      cc.endBlock();
    }
    if (setter != null) {
      cc.add(",");
      cc.endLine();
      cc.add("set: function");
      addMethodBody(name, defArgs(setter), defBody(setter), false, isStatic, false);
    } else if (attrWriter) {
      String param = NodeUtil.safeName(name);
      cc.add(",");
      cc.endLine();
      cc.add("set: function(" + param + ") ");
      cc.beginBlock();
      printSynthetic(
          () -> {
            addInstanceVariable("@" + name);
            cc.addOp("=", true);
            cc.add(param);
          });
      cc.endBlock();
    }
    cc.endBlock();
    cc.add(")");
    return false;
  }

  private boolean addModule(Node n) {
    Node path = n.getNode(0);
    Node scope = path.getNode(0);
    boolean qualified = scope != null && !scope.isToken(Token.CBASE);
    return addModule(n, constantPath(path), qualified);
  }

  /** A module as an object literal of its methods, constants and nested classes. */
  private boolean addModule(Node n, String name, boolean qualified) {
    if (qualified) {
      cc.add(name);
    } else {
      cc.add((mode.isEs5() ? "var " : "const ") + name);
    }
    cc.addOp("=", true);
    List<BooleanSupplier> after = new ArrayList<>();
    addModuleBody(n, name, after);
    return printDeferred(false, after);
  }

  private void addModuleBody(Node n, String name, List<BooleanSupplier> after) {
    ClassInfo info = new ClassInfo(name, null, true);
    List<Node> members = new ArrayList<>();
    for (Node member : classMembers(n.getNode(1))) {
      if (!isModuleDirective(member)) {
        members.add(member);
      }
    }
    for (Node member : members) {
      if (member.isToken(Token.DEF) || member.isToken(Token.DEFS)) {
        MemberKind kind = methodKind(member, defName(member), defArgs(member), false);
        if (kind == MemberKind.METHOD) {
          info.methods.add(plainMethodName(defName(member)));
        } else if (kind == MemberKind.GETTER) {
          info.getters.add(plainMethodName(defName(member)));
        }
      }
    }
    if (members.isEmpty()) {
      cc.add("{}");
      return;
    }

    ClassInfo savedClass = currentClass;
    String savedSelf = selfName;
    currentClass = info;
    selfName = null;
    cc.beginBlock();
    Node previous = null;
    for (int i = 0; i < members.size(); i++) {
      Node member = members.get(i);
      printLeading(member, previous);
      cc.startSourceMapping(member);
      addModuleMember(info, member, after);
      cc.endSourceMapping(member);
      if (i < members.size() - 1) {
        cc.add(",");
      }
      printTrailing(member);
      cc.endLine();
      previous = member;
    }
    cc.endBlock();
    currentClass = savedClass;
    selfName = savedSelf;
  }

  /** {@code module_function}, {@code extend self} and visibility calls, which change nothing. */
  private static boolean isModuleDirective(Node member) {
    if (isVisibilityCall(member)) {
      return true;
    }
    return member.isToken(Token.SEND)
        && member.getChild(0) == null
        && member.getString(1).equals("extend")
        && member.getChildCount() == 3
        && member.getNode(2) != null
        && member.getNode(2).isToken(Token.SELF);
  }

  private void addModuleMember(ClassInfo info, Node member, List<BooleanSupplier> after) {
    switch (member.getToken()) {
      case DEF:
      case DEFS:
        {
          if (member.isToken(Token.DEFS) && !member.getNode(0).isToken(Token.SELF)) {
            throw unsupported(member, "singleton method on another object in a module");
          }
          MemberKind kind = methodKind(member, defName(member), defArgs(member), false);
          if (kind == MemberKind.SETTER) {
            String name = setterName(defName(member));
            cc.add("set " + memberKey(name));
            addMethodBody(name, defArgs(member), defBody(member), false, false, false);
          } else if (kind == MemberKind.GETTER) {
            String name = methodName(member, defName(member));
            cc.add("get " + memberKey(name));
            addMethodBody(name, defArgs(member), defBody(member), false, false, true);
          } else {
            String name = methodName(member, defName(member));
            cc.add(memberKey(name) + (mode.isEs5() ? ": function" : ""));
            addMethodBody(name, defArgs(member), defBody(member), false, false, false);
          }
          return;
        }
      case CASGN:
        if (member.getChild(0) != null) {
          break;
        }
        cc.add(member.getString(1) + ": ");
        addExpr(member.getNode(2), NodeUtil.ASSIGN, Context.OTHER);
        return;
      case CLASS:
        {
          if (mode.isEs5()) {
            throw unsupported(member, "classes inside modules need ES2015");
          }
          String simple = member.getNode(0).getString(1);
          cc.add(simple + ": ");
          addClassExpression(member, info.name + "." + simple, after);
          return;
        }
      case MODULE:
        cc.add(member.getNode(0).getString(1) + ": ");
        addModuleBody(member, info.name + "." + member.getNode(0).getString(1), after);
        return;
      default:
        break;
    }
    throw unsupported(member, "is not supported in a module body");
  }
}
