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
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Resolves bare identifiers against the locals in scope.
 *
 * <p>A parser cannot always tell {@code x} the local from {@code x} the method call; that depends
 * on whether an assignment to {@code x} came earlier in the same scope. This pass walks the tree in
 * source order and turns {@code (send nil :x)} into {@code (lvar :x)} when {@code x} is a declared
 * local at that point. Calls written with parentheses, or with arguments, stay calls.
 */
final class ScopeAnalyzer {
  private final ScopeTracker scope = new ScopeTracker();

  /** Returns the tree with local reads resolved. Unchanged subtrees are shared. */
  static Node process(Node root) {
    return new ScopeAnalyzer().visit(root);
  }

  private Node visit(Node n) {
    if (isLocalRead(n)) {
      return Node.make(Token.LVAR, n.getString(1)).withSourceRange(n.getSourceRange());
    }
    declare(n);
    int scopeStart = scopeStartIndex(n.getToken());
    List<@Nullable Object> children = n.getChildren();
    List<@Nullable Object> rewritten = null;
    for (int i = 0; i < children.size(); i++) {
      if (i == scopeStart) {
        scope.enterScope(kindOf(n.getToken()));
      }
      Object child = children.get(i);
      if (child instanceof Node) {
        Node newChild = visit((Node) child);
        if (newChild != child) {
          if (rewritten == null) {
            rewritten = new ArrayList<>(children);
          }
          rewritten.set(i, newChild);
        }
      }
    }
    if (scopeStart >= 0 && scopeStart < children.size()) {
      scope.exitScope();
    }
    return rewritten == null ? n : n.updated(null, rewritten);
  }

  private boolean isLocalRead(Node n) {
    return n.isToken(Token.SEND)
        && n.getChildCount() == 2
        && n.getChild(0) == null
        && !n.isMethodCallShape()
        && scope.isLocal(n.getString(1));
  }

  private void declare(Node n) {
    switch (n.getToken()) {
      case LVASGN:
      case ARG:
      case OPTARG:
      case RESTARG:
      case KWARG:
      case KWOPTARG:
      case KWRESTARG:
      case BLOCKARG:
        if (n.getChild(0) instanceof String) {
          scope.declareLocal(n.getString(0));
        }
        break;
      default:
        break;
    }
  }

  private static int scopeStartIndex(Token token) {
    switch (token) {
      case DEF:
      case MODULE:
      case SCLASS:
      case BLOCK:
        return 1;
      case DEFS:
      case CLASS:
        return 2;
      default:
        return -1;
    }
  }

  private static ScopeTracker.Kind kindOf(Token token) {
    switch (token) {
      case DEF:
      case DEFS:
        return ScopeTracker.Kind.METHOD;
      case CLASS:
      case SCLASS:
        return ScopeTracker.Kind.CLASS;
      case MODULE:
        return ScopeTracker.Kind.MODULE;
      default:
        return ScopeTracker.Kind.BLOCK;
    }
  }
}
