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
import static com.google.common.base.Preconditions.checkState;

import com.google.rubyjs.ast.Token;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Base class for filters that register their handlers in the constructor. */
public abstract class AbstractFilter implements Filter {
  private final String name;
  private final Map<Token, NodeHandler> handlers = new EnumMap<>(Token.class);

  protected AbstractFilter(String name) {
    this.name = checkNotNull(name);
  }

  /** Registers the handler for one node type. Each type may be registered once. */
  protected final void on(Token token, NodeHandler handler) {
    checkState(!handlers.containsKey(token), "%s already handles %s", name, token);
    handlers.put(token, checkNotNull(handler));
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final @Nullable NodeHandler handlerFor(Token token) {
    return handlers.get(token);
  }

  @Override
  public String toString() {
    return name;
  }
}
