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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.compiler.filters.ReturnFilter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FilterRegistryTest {

  private static final class NamedFilter extends AbstractFilter {
    NamedFilter(String name) {
      super(name);
    }
  }

  @Test
  public void testBuiltins() {
    FilterRegistry registry = FilterRegistry.withBuiltins();
    assertThat(registry.getNames()).containsExactly("return", "functions", "camelCase").inOrder();
    assertThat(registry.get("return")).isInstanceOf(ReturnFilter.class);
  }

  @Test
  public void testLookupIgnoresCase() {
    FilterRegistry registry = FilterRegistry.withBuiltins();
    assertThat(registry.get("CAMELCASE")).isSameInstanceAs(registry.get("camelcase"));
    assertThat(registry.get("nope")).isNull();
  }

  @Test
  public void testResolveKeepsRequestedOrder() {
    FilterRegistry registry = FilterRegistry.withBuiltins();
    ImmutableList<Filter> filters = registry.resolve(ImmutableList.of("camelCase", " Return "));
    assertThat(filters.get(0).name()).isEqualTo("camelCase");
    assertThat(filters.get(1).name()).isEqualTo("return");
  }

  @Test
  public void testResolveRejectsUnknownNames() {
    FilterRegistry registry = FilterRegistry.withBuiltins();
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> registry.resolve(ImmutableList.of("return", "jquery")));
    assertThat(e).hasMessageThat().contains("jquery");
  }

  @Test
  public void testRegisterCustomFilter() {
    FilterRegistry registry = new FilterRegistry().register(new NamedFilter("Node"));
    assertThat(registry.getNames()).containsExactly("Node");
    assertThat(registry.get("node").name()).isEqualTo("Node");
    assertThrows(IllegalArgumentException.class, () -> registry.register(new NamedFilter("NODE")));
  }
}
