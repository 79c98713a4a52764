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

import com.google.common.collect.ImmutableSet;
import com.google.rubyjs.ast.IR;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import com.google.rubyjs.compiler.AbstractFilter;
import com.google.rubyjs.compiler.FilterChain;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Makes methods and blocks return the value of their last statement, as they do in Ruby.
 *
 * <p>Constructors, setters and blocks given to iteration methods are left alone, since nothing
 * reads what they return.
 */
public final class ReturnFilter extends AbstractFilter {

  /** Methods whose block runs once per item and whose block result is ignored. */
  private static final ImmutableSet<String> ITERATION_METHODS =
      ImmutableSet.of(
          "each",
          "each_with_index",
          "each_with_object",
          "each_pair",
          "forEach",
          "times",
          "upto",
          "downto",
          "step",
          "loop");

  public ReturnFilter() {
    super("return");
    on(Token.DEF, this::onDef);
    on(Token.DEFS, this::onDefs);
    on(Token.BLOCK, this::onBlock);
  }

  private Node onDef(Node n, FilterChain chain) {
    String name = n.getString(0);
    if (name.equals("initialize") || name.equals("constructor") || isSetterName(name)) {
      return chain.process(n);
    }
    return chain.process(wrapBody(n, 2));
  }

  private Node onDefs(Node n, FilterChain chain) {
    if (isSetterName(n.getString(1))) {
      return chain.process(n);
    }
    return chain.process(wrapBody(n, 3));
  }

  private Node onBlock(Node n, FilterChain chain) {
    Node call = n.getNode(0);
    if (call.isToken(Token.SEND) && ignoresBlockResult(call)) {
      return chain.process(n);
    }
    return chain.process(wrapBody(n, 2));
  }

  private static boolean ignoresBlockResult(Node call) {
    String selector = call.getString(1);
    if (ITERATION_METHODS.contains(selector)) {
      return true;
    }
    // Class.new blocks hold method definitions.
    Node receiver = call.getNode(0);
    return selector.equals("new")
        && receiver != null
        && receiver.isToken(Token.CONST)
        && receiver.getString(1).equals("Class");
  }

  private static boolean isSetterName(String name) {
    return name.length() > 1
        && name.endsWith("=")
        && !name.equals("==")
        && !name.equals("===")
        && !name.equals("!=")
        && !name.equals("<=")
        && !name.equals(">=");
  }

  /** Wraps the body at {@code index} in an autoreturn, unless it already is one or is empty. */
  private static Node wrapBody(Node n, int index) {
    Node body = n.getNode(index);
    if (body == null || body.isToken(Token.AUTORETURN)) {
      return n;
    }
    return n.withChild(index, IR.autoreturn(statementsOf(body)));
  }

  private static List<@Nullable Object> statementsOf(Node body) {
    List<@Nullable Object> statements = new ArrayList<>();
    if (body.isToken(Token.BEGIN)) {
      statements.addAll(body.childNodes());
    } else {
      statements.add(body);
    }
    return statements;
  }
}
