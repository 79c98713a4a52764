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

/** Rewrites one node on behalf of a {@link Filter}. */
@FunctionalInterface
public interface NodeHandler {

  /**
   * Returns the replacement for {@code n}. The children of {@code n} have already been through the
   * whole pipeline.
   *
   * <p>A handler may call {@code chain.process} before or after its own rewrite to let the
   * filters after it see the node, or ignore the chain and return a node of its own.
   */
  Node handle(Node n, FilterChain chain);
}
