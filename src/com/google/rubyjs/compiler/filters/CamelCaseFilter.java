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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import com.google.rubyjs.compiler.AbstractFilter;
import com.google.rubyjs.compiler.FilterChain;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames snake_case methods, variables, parameters and symbols to camelCase.
 *
 * <p>The filters after this one see a node before it is renamed, so that a filter that maps
 * {@code each_with_index} can still recognize it.
 */
public final class CamelCaseFilter extends AbstractFilter {

  static final ImmutableSet<String> ALLOWLIST =
      ImmutableSet.of(
          "attr_accessor",
          "attr_reader",
          "attr_writer",
          "method_missing",
          "is_a?",
          "kind_of?",
          "instance_of?");

  /** Words that JavaScript spells with more than one capital letter. */
  static final ImmutableMap<String, String> CAPS_EXCEPTIONS =
      ImmutableMap.<String, String>builder()
          .put("innerHtml", "innerHTML")
          .put("innerHtml=", "innerHTML=")
          .put("outerHtml", "outerHTML")
          .put("outerHtml=", "outerHTML=")
          .put("encodeUri", "encodeURI")
          .put("encodeUriComponent", "encodeURIComponent")
          .put("decodeUri", "decodeURI")
          .put("decodeUriComponent", "decodeURIComponent")
          .buildOrThrow();

  private static final Pattern UNDERSCORE = Pattern.compile("(?!^)_[a-z0-9]");
  private static final Pattern SELECTOR = Pattern.compile("_.*\\w[=!?]?$");
  private static final Pattern NAME = Pattern.compile("_.*[?!\\w]$");

  public CamelCaseFilter() {
    super("camelCase");
    on(Token.SEND, this::onSend);
    on(Token.CSEND, this::onSend);
    on(Token.ATTR, this::onSend);
    on(Token.CALL, this::onSend);
    on(Token.DEFS, this::onDefs);
    for (Token token :
        ImmutableSet.of(
            Token.DEF,
            Token.ARG,
            Token.OPTARG,
            Token.KWARG,
            Token.KWOPTARG,
            Token.RESTARG,
            Token.KWRESTARG,
            Token.BLOCKARG,
            Token.LVAR,
            Token.IVAR,
            Token.CVAR,
            Token.LVASGN,
            Token.IVASGN,
            Token.CVASGN,
            Token.SYM)) {
      on(token, this::onNamed);
    }
  }

  /**
   * Converts {@code name} to camelCase. A leading underscore and the sigil of an instance or
   * class variable are kept.
   */
  static String camelCase(String name) {
    if (ALLOWLIST.contains(name)) {
      return name;
    }
    int start = 0;
    while (start < name.length() && name.charAt(start) == '@') {
      start++;
    }
    String bare = name.substring(start);
    Matcher m = UNDERSCORE.matcher(bare);
    StringBuilder sb = new StringBuilder(name.substring(0, start));
    int last = 0;
    while (m.find()) {
      sb.append(bare, last, m.start());
      sb.append(Ascii.toUpperCase(bare.charAt(m.start() + 1)));
      last = m.end();
    }
    sb.append(bare, last, bare.length());
    String converted = sb.toString();
    return CAPS_EXCEPTIONS.getOrDefault(converted, converted);
  }

  private Node onSend(Node n, FilterChain chain) {
    Node result = chain.process(n);
    if (!result.getToken().isCallLike()) {
      return result;
    }
    String selector = result.getString(1);
    if (result.getChild(0) == null && ALLOWLIST.contains(selector)) {
      return result;
    }
    if (!SELECTOR.matcher(selector).find()) {
      return result;
    }
    return rename(result, 1);
  }

  private Node onDefs(Node n, FilterChain chain) {
    Node result = chain.process(n);
    if (!result.isToken(Token.DEFS) || !NAME.matcher(result.getString(1)).find()) {
      return result;
    }
    return rename(result, 1);
  }

  private Node onNamed(Node n, FilterChain chain) {
    Token token = n.getToken();
    Node result = chain.process(n);
    if (!result.isToken(token) || !(result.getChild(0) instanceof String)) {
      return result;
    }
    String name = result.getString(0);
    if (ALLOWLIST.contains(name) || !NAME.matcher(name).find()) {
      return result;
    }
    return rename(result, 0);
  }

  private static Node rename(Node n, int index) {
    String name = n.getString(index);
    String converted = camelCase(name);
    return converted.equals(name) ? n : n.withChild(index, converted);
  }
}
