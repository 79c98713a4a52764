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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.rubyjs.compiler.filters.CamelCaseFilter;
import com.google.rubyjs.compiler.filters.FunctionsFilter;
import com.google.rubyjs.compiler.filters.ReturnFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps filter names to filter instances. Names are case-insensitive.
 *
 * <p>A registry is safe to use from several threads.
 */
public final class FilterRegistry {
  private final Map<String, Filter> filters = new LinkedHashMap<>();

  /** Returns a registry holding the built-in filters. */
  public static FilterRegistry withBuiltins() {
    FilterRegistry registry = new FilterRegistry();
    registry.register(new ReturnFilter());
    registry.register(new FunctionsFilter());
    registry.register(new CamelCaseFilter());
    return registry;
  }

  /**
   * Adds a filter under its own name.
   *
   * @throws IllegalArgumentException if another filter already has that name
   */
  @CanIgnoreReturnValue
  public synchronized FilterRegistry register(Filter filter) {
    String key = Ascii.toLowerCase(checkNotNull(filter.name()));
    checkArgument(!filters.containsKey(key), "a filter named %s is already registered", key);
    filters.put(key, filter);
    return this;
  }

  public synchronized @Nullable Filter get(String name) {
    return filters.get(Ascii.toLowerCase(name));
  }

  public synchronized ImmutableSet<String> getNames() {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Filter filter : filters.values()) {
      names.add(filter.name());
    }
    return names.build();
  }

  /**
   * Looks up filters by name, keeping the order of {@code names}.
   *
   * @throws ConfigurationException if a name is not registered
   */
  public synchronized ImmutableList<Filter> resolve(List<String> names) {
    ImmutableList.Builder<Filter> resolved = ImmutableList.builder();
    for (String name : names) {
      Filter filter = get(name.trim());
      if (filter == null) {
        throw new ConfigurationException("unknown filter '" + name + "'");
      }
      resolved.add(filter);
    }
    return resolved.build();
  }
}
