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

package com.google.rubyjs.compiler.filters;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.rubyjs.ast.IR;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import com.google.rubyjs.ast.Token;
import com.google.rubyjs.compiler.AbstractFilter;
import com.google.rubyjs.compiler.ConversionContext;
import com.google.rubyjs.compiler.FilterChain;
import com.google.rubyjs.compiler.LanguageMode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Maps common methods of Ruby's core classes to their JavaScript counterparts, such as {@code
 * puts} to {@code console.log} and {@code upcase} to {@code toUpperCase()}.
 *
 * <p>A method named in {@link com.google.rubyjs.compiler.ConversionOptions#exclude} is left as
 * written. Rewritten nodes are handed on to the filters after this one.
 */
public final class FunctionsFilter extends AbstractFilter {

  /** Argument-less methods that become a call of a differently named method. */
  private static final ImmutableMap<String, String> RENAMED_CALLS =
      ImmutableMap.of(
          "upcase", "toUpperCase",
          "downcase", "toLowerCase",
          "strip", "trim");

  /** Methods that keep their arguments and block under a JavaScript name. */
  private static final ImmutableMap<String, String> RENAMED_SENDS =
      ImmutableMap.of(
          "each", "forEach",
          "each_with_index", "forEach",
          "select", "filter");

  public FunctionsFilter() {
    super("functions");
    on(Token.SEND, this::onSend);
    on(Token.BLOCK, this::onBlock);
  }

  private Node onSend(Node n, FilterChain chain) {
    ConversionContext context = chain.context();
    String method = n.getString(1);
    if (context.isExcluded(method)) {
      return chain.process(n);
    }
    Node rewritten =
        n.getChild(0) == null
            ? rewriteFunction(n, method, argumentsOf(n))
            : rewriteMethod(n, n.getNode(0), method, argumentsOf(n), context.getLanguageMode());
    return chain.process(rewritten == null ? n : rewritten.withSourceRange(callRange(n)));
  }

  /** The range of the original send, marked so that a rewrite without arguments stays a call. */
  private static @Nullable SourceRange callRange(Node n) {
    SourceRange range = n.getSourceRange();
    return range == null ? null : range.withParens(true);
  }

  private static @Nullable Node rewriteFunction(Node n, String method, List<Node> args) {
    switch (method) {
      case "puts":
        return IR.send(IR.constant("console"), "log", args);
      case "raise":
        if (args.size() == 1 && isString(args.get(0))) {
          return IR.send(null, "raise", IR.constant("Error"), args.get(0));
        }
        return null;
      default:
        return null;
    }
  }

  private static @Nullable Node rewriteMethod(
      Node n, Node target, String method, List<Node> args, LanguageMode mode) {
    String renamed = RENAMED_SENDS.get(method);
    if (renamed != null) {
      return n.withChild(1, renamed);
    }
    renamed = RENAMED_CALLS.get(method);
    if (renamed != null) {
      return args.isEmpty() ? IR.call(target, renamed) : null;
    }
    switch (method) {
      case "to_s":
        return IR.call(target, "toString", args.toArray(new Node[0]));
      case "to_i":
        return IR.send(null, "parseInt", prepend(target, args));
      case "to_f":
        return args.isEmpty() ? IR.send(null, "parseFloat", target) : null;
      case "empty?":
        return args.isEmpty()
            ? IR.send(IR.attr(target, "length"), "==", IR.number(0))
            : null;
      case "nil?":
        return args.isEmpty() ? IR.send(target, "==", IR.nil()) : null;
      case "any?":
        return args.isEmpty() ? IR.send(target, "some", IR.constant("Boolean")) : null;
      case "include?":
        return args.size() == 1 ? rewriteInclude(target, args.get(0), mode) : null;
      case "first":
        if (args.isEmpty()) {
          return IR.send(target, "[]", IR.number(0));
        }
        return args.size() == 1 ? IR.call(target, "slice", IR.number(0), args.get(0)) : null;
      case "last":
        return rewriteLast(target, args, mode);
      case "keys":
        return args.isEmpty() ? IR.send(IR.constant("Object"), "keys", target) : null;
      case "values":
        return args.isEmpty() && mode.isAtLeast(LanguageMode.ECMASCRIPT_2017)
            ? IR.send(IR.constant("Object"), "values", target)
            : null;
      case "merge":
        return rewriteMerge(target, args);
      case "join":
        return args.isEmpty() ? IR.send(target, "join", IR.string("")) : null;
      default:
        return null;
    }
  }

  private static Node rewriteInclude(Node target, Node item, LanguageMode mode) {
    Node range = unwrap(target);
    if ((range.isToken(Token.IRANGE) || range.isToken(Token.ERANGE))
        && range.getNode(0) != null
        && range.getNode(1) != null) {
      String upper = range.isToken(Token.IRANGE) ? "<=" : "<";
      return Node.make(
          Token.AND,
          IR.send(item, ">=", range.getNode(0)),
          IR.send(item, upper, range.getNode(1)));
    }
    if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2016)) {
      return IR.send(target, "includes", item);
    }
    return IR.send(IR.send(target, "indexOf", item), "!=", IR.number(-1));
  }

  private static @Nullable Node rewriteLast(Node target, List<Node> args, LanguageMode mode) {
    if (args.size() == 1) {
      return IR.call(target, "slice", IR.send(args.get(0), "-@"));
    }
    if (!args.isEmpty()) {
      return null;
    }
    if (mode.isAtLeast(LanguageMode.ECMASCRIPT_2022)) {
      return IR.call(target, "at", IR.number(-1));
    }
    if (!isSimple(target)) {
      return null;
    }
    return IR.send(target, "[]", IR.send(IR.attr(target, "length"), "-", IR.number(1)));
  }

  private static @Nullable Node rewriteMerge(Node target, List<Node> args) {
    if (args.isEmpty()) {
      return null;
    }
    List<Node> spreads = new ArrayList<>();
    spreads.add(Node.make(Token.KWSPLAT, target));
    for (Node arg : args) {
      if (arg.isToken(Token.HASH)) {
        spreads.addAll(arg.childNodes());
      } else {
        spreads.add(Node.make(Token.KWSPLAT, arg));
      }
    }
    return Node.make(Token.HASH, spreads);
  }

  private Node onBlock(Node n, FilterChain chain) {
    Node call = n.getNode(0);
    if (!call.isToken(Token.SEND) || call.getChild(0) == null) {
      return chain.process(n);
    }
    String method = call.getString(1);
    if (chain.context().isExcluded(method)) {
      return chain.process(n);
    }
    Node rewritten = rewriteBlock(n, call, method);
    return chain.process(rewritten == null ? n : rewritten.withSourceRange(n.getSourceRange()));
  }

  private static @Nullable Node rewriteBlock(Node n, Node call, String method) {
    Node target = call.getNode(0);
    Node args = n.getNode(1);
    Node body = n.getNode(2);
    List<Node> callArgs = argumentsOf(call);
    switch (method) {
      case "some":
        // any? with a block: drop the Boolean test the argument-less form was given.
        if (callArgs.size() == 1 && isSyntheticBoolean(callArgs.get(0))) {
          return n.withChild(0, IR.send(target, "some"));
        }
        return null;
      case "times":
        return callArgs.isEmpty() ? rewriteTimes(target, args, body) : null;
      case "reject":
        if (!callArgs.isEmpty() || body == null) {
          return null;
        }
        return Node.make(Token.BLOCK, IR.send(target, "filter"), args, negate(body));
      case "inject":
      case "reduce":
        if (callArgs.size() > 1) {
          return null;
        }
        List<Node> reduceArgs = new ArrayList<>();
        reduceArgs.add(Node.make(Token.BLOCK, IR.send(null, "lambda"), args, body));
        reduceArgs.addAll(callArgs);
        return IR.send(target, "reduce", reduceArgs);
      default:
        return null;
    }
  }

  /** {@code n.times { |i| ... }} becomes a counting for loop. */
  private static @Nullable Node rewriteTimes(Node count, @Nullable Node args, @Nullable Node body) {
    String name = "_";
    if (args != null && args.getChildCount() > 0) {
      Node param = args.getNode(0);
      if (args.getChildCount() > 1 || !param.isToken(Token.ARG)) {
        return null;
      }
      name = param.getString(0);
    }
    return Node.make(
        Token.FOR,
        Node.make(Token.LVASGN, name),
        Node.make(Token.ERANGE, IR.number(0), count),
        body);
  }

  /** Negates the value a block body produces. */
  private static Node negate(Node body) {
    if (body.isToken(Token.BEGIN) || body.isToken(Token.AUTORETURN)) {
      ImmutableList<Node> statements = body.childNodes();
      if (statements.isEmpty()) {
        return body;
      }
      List<@Nullable Object> children = new ArrayList<>(statements);
      int last = children.size() - 1;
      children.set(last, IR.not(statements.get(last)));
      return body.updated(null, children);
    }
    return IR.not(body);
  }

  private static List<Node> argumentsOf(Node send) {
    List<Node> args = new ArrayList<>();
    for (int i = 2; i < send.getChildCount(); i++) {
      args.add(send.getNode(i));
    }
    return args;
  }

  private static List<Node> prepend(Node first, List<Node> rest) {
    List<Node> all = new ArrayList<>(rest.size() + 1);
    all.add(first);
    all.addAll(rest);
    return all;
  }

  private static Node unwrap(Node n) {
    while (n.isToken(Token.BEGIN) && n.getChildCount() == 1) {
      n = n.getNode(0);
    }
    return n;
  }

  private static boolean isString(Node n) {
    return n.isToken(Token.STR) || n.isToken(Token.DSTR);
  }

  private static boolean isSyntheticBoolean(Node n) {
    return n.isSynthetic()
        && n.isToken(Token.CONST)
        && n.getChild(0) == null
        && n.getString(1).equals("Boolean");
  }

  /** Whether reading {@code n} twice is safe and cheap. */
  private static boolean isSimple(Node n) {
    switch (n.getToken()) {
      case LVAR:
      case IVAR:
      case CVAR:
      case GVAR:
      case SELF:
        return true;
      case CONST:
        return n.getChild(0) == null;
      default:
        return false;
    }
  }
}
