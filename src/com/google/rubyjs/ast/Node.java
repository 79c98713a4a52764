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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node.
 *
 * <p>A node is a {@link Token} plus an ordered list of children. A child is another {@code Node},
 * a {@code String} (names, selectors and string values), a {@code Long} or {@code Double}, or
 * null for an absent slot. What each slot means depends on the token; see the documentation of
 * the individual {@link Token} constants.
 *
 * <p>Equality is structural: two nodes are equal when their tokens match and their children are
 * pairwise equal. Source ranges are metadata and never take part in equality, so a node built by a
 * filter compares equal to the same shape parsed from source.
 *
 * <p>Nodes are never modified. Rewrites produce new nodes through {@link #updated}, which keeps the
 * source range of the node it was derived from.
 */
@Immutable
@SuppressWarnings("Immutable") // children are an unmodifiable copy of immutable values
public final class Node {

  private static final Pattern SYMBOL_LIKE =
      Pattern.compile("[A-Za-z_@$][A-Za-z0-9_@]*[?!=]?|[-+*/%<>=!~^&|\\[\\]]+");

  private final Token token;
  private final List<@Nullable Object> children;
  private final @Nullable SourceRange range;

  private Node(Token token, List<@Nullable Object> children, @Nullable SourceRange range) {
    this.token = checkNotNull(token);
    this.children = children;
    this.range = range;
  }

  /** Creates a synthetic node. Arity is not validated. */
  public static Node make(Token token, @Nullable Object... children) {
    return new Node(token, copyChildren(Arrays.asList(children)), null);
  }

  public static Node make(Token token, List<?> children) {
    return new Node(token, copyChildren(children), null);
  }

  private static List<@Nullable Object> copyChildren(List<?> children) {
    List<@Nullable Object> copy = new ArrayList<>(children.size());
    for (Object child : children) {
      checkArgument(
          child == null
              || child instanceof Node
              || child instanceof String
              || child instanceof Long
              || child instanceof Double,
          "unsupported child value %s",
          child);
      copy.add(child);
    }
    return Collections.unmodifiableList(copy);
  }

  public Token getToken() {
    return token;
  }

  public boolean isToken(Token other) {
    return token == other;
  }

  public List<@Nullable Object> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public @Nullable Object getChild(int index) {
    return index < children.size() ? children.get(index) : null;
  }

  /**
   * Returns the child at {@code index} as a node, or null when the slot is empty or out of range.
   *
   * @throws IllegalStateException if the slot holds a non-node value
   */
  public @Nullable Node getNode(int index) {
    Object child = getChild(index);
    checkState(
        child == null || child instanceof Node, "child %s of %s is not a node", index, token);
    return (Node) child;
  }

  /** Returns the child at {@code index} as a string. */
  public String getString(int index) {
    Object child = getChild(index);
    checkState(child instanceof String, "child %s of %s is not a string", index, token);
    return (String) child;
  }

  public @Nullable Node getFirstChild() {
    return getNode(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : getNode(children.size() - 1);
  }

  /** The node children, skipping names, literals and empty slots. */
  public ImmutableList<Node> childNodes() {
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (Object child : children) {
      if (child instanceof Node) {
        nodes.add((Node) child);
      }
    }
    return nodes.build();
  }

  /** Children from {@code from} to the end. */
  public List<@Nullable Object> childrenFrom(int from) {
    return children.subList(Math.min(from, children.size()), children.size());
  }

  public @Nullable SourceRange getSourceRange() {
    return range;
  }

  /** Synthetic nodes were created by a filter and have no position in the source. */
  public boolean isSynthetic() {
    return range == null;
  }

  public Node withSourceRange(@Nullable SourceRange newRange) {
    return newRange == range ? this : new Node(token, children, newRange);
  }

  /**
   * Returns a copy of this node with the given token and children. Either argument may be null to
   * keep the current value. The source range is carried over.
   */
  public Node updated(@Nullable Token newToken, @Nullable List<?> newChildren) {
    return new Node(
        newToken != null ? newToken : token,
        newChildren != null ? copyChildren(newChildren) : children,
        range);
  }

  public Node updated(Token newToken) {
    return updated(newToken, null);
  }

  /** Returns a copy with the child at {@code index} replaced. */
  public Node withChild(int index, @Nullable Object child) {
    List<@Nullable Object> copy = new ArrayList<>(children);
    copy.set(index, child);
    return updated(null, copy);
  }

  /** Returns true if the two nodes are structurally equal. */
  public boolean isEquivalentTo(@Nullable Node other) {
    return equals(other);
  }

  /**
   * Whether this node renders as a call with parentheses rather than as a property access.
   *
   * <ul>
   *   <li>{@code attr} nodes never are, {@code call} nodes always are.
   *   <li>A send with arguments, or whose selector ends in {@code !}, always is.
   *   <li>A def with arguments, or whose name ends in {@code !} or {@code ?}, always is.
   *   <li>Otherwise a parsed node is a call when its selector was followed by a parenthesis.
   *   <li>Synthetic sends and defs are calls. Filters that want a property read build an {@code
   *       attr} node.
   * </ul>
   */
  public boolean isMethodCallShape() {
    switch (token) {
      case ATTR:
        return false;
      case CALL:
        return true;
      case SEND:
      case CSEND:
        if (children.size() > 2 || isBang(getChild(1))) {
          return true;
        }
        break;
      case DEF:
        if (isPredicateOrBang(getChild(0)) || hasParameters(getNode(1))) {
          return true;
        }
        break;
      case DEFS:
        if (isPredicateOrBang(getChild(1)) || hasParameters(getNode(2))) {
          return true;
        }
        break;
      default:
        return false;
    }
    return range == null || range.hasParens();
  }

  private static boolean isBang(@Nullable Object name) {
    return name instanceof String s && s.length() > 1 && s.endsWith("!");
  }

  private static boolean isPredicateOrBang(@Nullable Object name) {
    return name instanceof String s && (s.endsWith("?") || s.endsWith("!"));
  }

  private static boolean hasParameters(@Nullable Node args) {
    return args != null && args.getChildCount() > 0;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node that = (Node) o;
    return token == that.token && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(token, children);
  }

  /** Prints the tree as an s-expression, for example {@code (send nil :puts (int 1))}. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb) {
    sb.append('(').append(token.tag());
    for (Object child : children) {
      sb.append(' ');
      if (child == null) {
        sb.append("nil");
      } else if (child instanceof Node) {
        ((Node) child).appendTree(sb);
      } else if (child instanceof String) {
        appendString(sb, (String) child);
      } else {
        sb.append(child);
      }
    }
    sb.append(')');
  }

  private void appendString(StringBuilder sb, String value) {
    if (token != Token.STR && SYMBOL_LIKE.matcher(value).matches()) {
      sb.append(':').append(value);
      return;
    }
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    sb.append('"');
  }

  @Override
  public String toString() {
    return toStringTree();
  }
}
