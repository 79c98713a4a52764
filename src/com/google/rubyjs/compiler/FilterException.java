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

/** A filter handler threw. Carries the filter, the node type it was handling, and the position. */
public final class FilterException extends ConversionException {
  private static final long serialVersionUID = 1L;

  static final DiagnosticType FILTER_FAILED =
      DiagnosticType.error("RBJS_FILTER_FAILED", "Filter {0} failed on {1}: {2}");

  private final String filterName;
  private final Token token;

  FilterException(String sourceName, String filterName, Node node, RuntimeException cause) {
    super(
        Diagnostic.make(
            sourceName,
            node,
            FILTER_FAILED,
            filterName,
            node.getToken().tag(),
            String.valueOf(cause.getMessage())),
        cause);
    this.filterName = filterName;
    this.token = node.getToken();
  }

  public String getFilterName() {
    return filterName;
  }

  public Token getToken() {
    return token;
  }
}
