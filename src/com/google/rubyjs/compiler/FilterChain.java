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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The filters that come after the current one, as seen from inside a {@link NodeHandler}. */
public final class FilterChain {
  private final FilterPipeline pipeline;
  private final int nextIndex;

  FilterChain(FilterPipeline pipeline, int nextIndex) {
    this.pipeline = pipeline;
    this.nextIndex = nextIndex;
  }

  /**
   * Hands {@code n} to the remaining filters. Returns {@code n} itself when none of them handles
   * its type. Children are not visited again.
   */
  public Node process(Node n) {
    return pipeline.dispatch(n, nextIndex);
  }

  /** Like {@link #process}, for each of several nodes. Null entries stay null. */
  public List<@Nullable Node> processAll(List<@Nullable Node> nodes) {
    List<@Nullable Node> result = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      result.add(n == null ? null : process(n));
    }
    return result;
  }

  /**
   * Runs the whole pipeline, children first and every filter from the start, over a subtree the
   * handler built.
   */
  public Node rewrite(Node n) {
    return pipeline.visit(n);
  }

  public ConversionContext context() {
    return pipeline.getContext();
  }
}
