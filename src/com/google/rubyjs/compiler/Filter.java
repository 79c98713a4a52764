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

import com.google.rubyjs.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * A named set of node rewrites.
 *
 * <p>Filter instances are shared by every conversion a {@link Compiler} runs, possibly on several
 * threads at once. They must not keep per-conversion state in fields; {@link ConversionContext}
 * exists for that.
 */
public interface Filter {

  /** The name used to select this filter in options and magic comments. */
  String name();

  /** The handler for nodes of type {@code token}, or null if this filter does not rewrite them. */
  @Nullable NodeHandler handlerFor(Token token);
}
