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
import org.jspecify.annotations.Nullable;

/**
 * A node reached the code generator in a shape it has no rendering for. This points at a gap in
 * filter or generator coverage, never at bad input.
 */
public final class UnsupportedConstructException extends ConversionException {
  private static final long serialVersionUID = 1L;

  static final DiagnosticType UNSUPPORTED_NODE =
      DiagnosticType.error("RBJS_UNSUPPORTED_NODE", "Unsupported construct {0}: {1}");

  public UnsupportedConstructException(@Nullable String sourceName, Node node, String detail) {
    super(Diagnostic.make(sourceName, node, UNSUPPORTED_NODE, node.getToken().tag(), detail));
  }
}
