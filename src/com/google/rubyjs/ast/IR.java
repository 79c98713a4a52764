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

package com.google.rubyjs.ast;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. Every node built here is synthetic. */
public class IR {

  private IR() {}

  public static Node nil() {
    return Node.make(Token.NIL);
  }

  public static Node trueNode() {
    return Node.make(Token.TRUE);
  }

  public static Node falseNode() {
    return Node.make(Token.FALSE);
  }

  public static Node self() {
    return Node.make(Token.SELF);
  }

  public static Node number(long value) {
    return Node.make(Token.INT, value);
  }

  public static Node number(double value) {
    return Node.make(Token.FLOAT, value);
  }

  public static Node string(String value) {
    return Node.make(Token.STR, value);
  }

  public static Node sym(String name) {
    return Node.make(Token.SYM, name);
  }

  public static Node lvar(String name) {
    return Node.make(Token.LVAR, name);
  }

  public static Node ivar(String name) {
    checkState(name.startsWith("@"), name);
    return Node.make(Token.IVAR, name);
  }

  /** A constant reference, such as {@code console} or {@code Math}, with no scope. */
  public static Node constant(String name) {
    return Node.make(Token.CONST, null, name);
  }

  public static Node lvasgn(String name, Node value) {
    return Node.make(Token.LVASGN, name, value);
  }

  /** A send. Argument-less sends render as calls; use {@link #attr} for property reads. */
  public static Node send(@Nullable Node receiver, String selector, Node... args) {
    return Node.make(Token.SEND, concat(receiver, selector, args));
  }

  public static Node send(@Nullable Node receiver, String selector, List<Node> args) {
    return send(receiver, selector, args.toArray(new Node[0]));
  }

  public static Node attr(Node receiver, String name) {
    return Node.make(Token.ATTR, receiver, name);
  }

  public static Node call(@Nullable Node receiver, String name, Node... args) {
    return Node.make(Token.CALL, concat(receiver, name, args));
  }

  private static List<@Nullable Object> concat(@Nullable Node receiver, String name, Node[] args) {
    List<@Nullable Object> children = new ArrayList<>(args.length + 2);
    children.add(receiver);
    children.add(name);
    for (Node arg : args) {
      children.add(arg);
    }
    return children;
  }

  public static Node array(List<Node> elements) {
    return Node.make(Token.ARRAY, elements);
  }

  public static Node begin(List<Node> statements) {
    return Node.make(Token.BEGIN, statements);
  }

  public static Node begin(Node... statements) {
    return Node.make(Token.BEGIN, (Object[]) statements);
  }

  public static Node args(String... names) {
    List<Node> params = new ArrayList<>(names.length);
    for (String name : names) {
      params.add(Node.make(Token.ARG, name));
    }
    return Node.make(Token.ARGS, params);
  }

  public static Node block(Node call, Node args, @Nullable Node body) {
    checkState(call.getToken().isCallLike(), call);
    checkState(args.isToken(Token.ARGS), args);
    return Node.make(Token.BLOCK, call, args, body);
  }

  public static Node ifNode(Node cond, @Nullable Node then, @Nullable Node otherwise) {
    return Node.make(Token.IF, cond, then, otherwise);
  }

  public static Node returnNode(@Nullable Node value) {
    return value == null ? Node.make(Token.RETURN) : Node.make(Token.RETURN, value);
  }

  public static Node autoreturn(List<@Nullable Object> statements) {
    return Node.make(Token.AUTORETURN, statements);
  }

  public static Node not(Node operand) {
    return send(operand, "!");
  }
}
