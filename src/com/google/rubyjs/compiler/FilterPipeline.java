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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.IR;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Applies an ordered list of filters to a tree.
 *
 * <p>The tree is visited bottom-up: the children of a node are rewritten before the node itself is
 * offered to the filters. For each node, the first filter with a handler for its type gets it,
 * together with a {@link FilterChain} that reaches the filters after that one.
 *
 * <p>A pipeline belongs to one conversion. The {@link ScopeTracker} of the context follows the
 * traversal, so handlers see the scopes enclosing the node they were given.
 */
final class FilterPipeline {
  private static final Logger logger = Logger.getLogger(FilterPipeline.class.getName());

  private final ImmutableList<Filter> filters;
  private final ConversionContext context;

  FilterPipeline(List<Filter> filters, ConversionContext context) {
    this.filters = ImmutableList.copyOf(filters);
    this.context = checkNotNull(context);
  }

  ConversionContext getContext() {
    return context;
  }

  /**
   * Rewrites a whole program. Statements that filters asked to prepend are placed before the
   * first statement of the result.
   */
  Node run(Node root) {
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("Filter order: " + Joiner.on(", ").join(filters));
    }
    Node result = visit(root);
    ImmutableList<Node> prepended = context.getPrepended();
    if (prepended.isEmpty()) {
      return result;
    }
    List<Node> statements = new ArrayList<>(prepended);
    if (result.isToken(Token.BEGIN)) {
      statements.addAll(result.childNodes());
      return result.updated(null, statements);
    }
    statements.add(result);
    return IR.begin(statements);
  }

  /** Rewrites the children of {@code n}, then {@code n} itself. */
  Node visit(Node n) {
    ScopeTracker scope = context.scope();
    declare(n, scope);
    int scopeStart = scopeStartIndex(n);
    List<@Nullable Object> children = n.getChildren();
    List<@Nullable Object> rewritten = null;
    for (int i = 0; i < children.size(); i++) {
      if (i == scopeStart) {
        enterScope(n, scope);
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
    Node updated = rewritten == null ? n : n.updated(null, rewritten);
    return dispatch(updated, 0);
  }

  /**
   * Offers {@code n} to the filters starting at {@code from}. Filters configured to skip the type
   * are passed over.
   */
  Node dispatch(Node n, int from) {
    Token token = n.getToken();
    for (int i = from; i < filters.size(); i++) {
      Filter filter = filters.get(i);
      NodeHandler handler = filter.handlerFor(token);
      if (handler == null || context.isNodeTypeExcluded(filter.name(), token)) {
        continue;
      }
      try {
        Node result = handler.handle(n, new FilterChain(this, i + 1));
        if (result == null) {
          throw new NullPointerException("handler returned null");
        }
        return result;
      } catch (ConversionException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new FilterException(context.getSourceName(), filter.name(), n, e);
      }
    }
    return n;
  }

  /** The index of the first child that lives inside the scope {@code n} opens, or -1. */
  private static int scopeStartIndex(Node n) {
    switch (n.getToken()) {
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

  private static void enterScope(Node n, ScopeTracker scope) {
    switch (n.getToken()) {
      case DEF:
      case DEFS:
        scope.enterScope(ScopeTracker.Kind.METHOD);
        break;
      case CLASS:
        scope.enterScope(ScopeTracker.Kind.CLASS, constantName(n.getNode(0)));
        break;
      case MODULE:
        scope.enterScope(ScopeTracker.Kind.MODULE, constantName(n.getNode(0)));
        break;
      case SCLASS:
        scope.enterScope(ScopeTracker.Kind.CLASS);
        break;
      default:
        scope.enterScope(ScopeTracker.Kind.BLOCK);
        break;
    }
  }

  private static void declare(Node n, ScopeTracker scope) {
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
      case CASGN:
        scope.declareConstant(n.getString(1));
        break;
      default:
        break;
    }
  }

  /** The qualified name of a constant reference, such as {@code A::B}, or null. */
  static @Nullable String constantName(@Nullable Node n) {
    if (n == null || !n.isToken(Token.CONST)) {
      return null;
    }
    String outer = constantName(n.getNode(0));
    return outer == null ? n.getString(1) : outer + "::" + n.getString(1);
  }
}
