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

import static com.google.common.truth.Truth.assertThat;

import com.google.rubyjs.compiler.Compiler;
import com.google.rubyjs.compiler.ConversionOptions;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CamelCaseFilterTest {

  private static String convert(String source) {
    ConversionOptions options = new ConversionOptions();
    options.addFilter("camelCase");
    return new Compiler().convert(source, options).text();
  }

  @Test
  public void testCamelCase() {
    assertThat(CamelCaseFilter.camelCase("foo_bar_baz")).isEqualTo("fooBarBaz");
    assertThat(CamelCaseFilter.camelCase("valid_2x?")).isEqualTo("valid2x?");
    assertThat(CamelCaseFilter.camelCase("_private_name")).isEqualTo("_privateName");
    assertThat(CamelCaseFilter.camelCase("@first_name")).isEqualTo("@firstName");
    assertThat(CamelCaseFilter.camelCase("@@instance_count")).isEqualTo("@@instanceCount");
    assertThat(CamelCaseFilter.camelCase("plain")).isEqualTo("plain");
  }

  @Test
  public void testCapsExceptions() {
    assertThat(CamelCaseFilter.camelCase("inner_html")).isEqualTo("innerHTML");
    assertThat(CamelCaseFilter.camelCase("inner_html=")).isEqualTo("innerHTML=");
    assertThat(CamelCaseFilter.camelCase("encode_uri_component")).isEqualTo("encodeURIComponent");
  }

  @Test
  public void testAllowlistIsKept() {
    assertThat(CamelCaseFilter.camelCase("attr_accessor")).isEqualTo("attr_accessor");
    assertThat(CamelCaseFilter.camelCase("is_a?")).isEqualTo("is_a?");
  }

  @Test
  public void testIsIdempotent() {
    String once = CamelCaseFilter.camelCase("some_long_name_2");
    assertThat(CamelCaseFilter.camelCase(once)).isEqualTo(once);
  }

  @Test
  public void testRenamesLocalsAndCalls() {
    assertThat(convert("my_var = 1")).isEqualTo("let myVar = 1;");
    assertThat(convert("puts some_value")).isEqualTo("puts(someValue);");
    assertThat(convert("obj.set_value(1)")).isEqualTo("obj.setValue(1);");
  }

  @Test
  public void testRenamesMethodsAndParameters() {
    assertThat(convert("def add_one(first_arg)\n  first_arg + 1\nend"))
        .isEqualTo("function addOne(firstArg) {\n  firstArg + 1;\n}\n");
  }
}
