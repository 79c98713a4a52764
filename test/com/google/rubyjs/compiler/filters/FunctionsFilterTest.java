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

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.compiler.Compiler;
import com.google.rubyjs.compiler.ConversionOptions;
import com.google.rubyjs.compiler.LanguageMode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FunctionsFilterTest {

  private ConversionOptions options;

  @Before
  public void setUp() {
    options = new ConversionOptions();
    options.addFilter("functions");
  }

  private String convert(String source) {
    return new Compiler().convert(source, options).text();
  }

  @Test
  public void testPuts() {
    assertThat(convert("puts 1, 2")).isEqualTo("console.log(1, 2);");
    assertThat(convert("puts")).isEqualTo("console.log();");
  }

  @Test
  public void testRaiseWithMessage() {
    assertThat(convert("raise 'boom'")).isEqualTo("throw new Error(\"boom\");");
  }

  @Test
  public void testExcludedMethodIsLeftAlone() {
    options.exclude("puts");
    assertThat(convert("puts 1")).isEqualTo("puts(1);");
  }

  @Test
  public void testRenamedMethods() {
    assertThat(convert("a.each { |i| puts i }")).isEqualTo("a.forEach(i => console.log(i));");
    assertThat(convert("s.upcase")).isEqualTo("s.toUpperCase();");
    assertThat(convert("s.strip")).isEqualTo("s.trim();");
  }

  @Test
  public void testEmpty() {
    assertThat(convert("s.empty?")).isEqualTo("s.length == 0;");
    options.setComparison(ConversionOptions.Comparison.IDENTITY);
    assertThat(convert("s.empty?")).isEqualTo("s.length === 0;");
  }

  @Test
  public void testIncludeDependsOnLanguageLevel() {
    assertThat(convert("a.include?(x)")).isEqualTo("a.includes(x);");
    options.setLanguageMode(LanguageMode.ECMASCRIPT5);
    assertThat(convert("a.include?(x)")).isEqualTo("a.indexOf(x) != -1;");
  }

  @Test
  public void testIncludeOnRangeIsBoundsCheck() {
    assertThat(convert("(1..5).include?(x)")).isEqualTo("x >= 1 && x <= 5;");
  }

  @Test
  public void testFirstAndLast() {
    assertThat(convert("a.first")).isEqualTo("a[0];");
    assertThat(convert("a.first(2)")).isEqualTo("a.slice(0, 2);");
    assertThat(convert("a.last(2)")).isEqualTo("a.slice(-2);");
    assertThat(convert("a = [1]\na.last")).isEqualTo("let a = [1];\na[a.length - 1];\n");
    options.setLanguageMode(LanguageMode.ECMASCRIPT_2022);
    assertThat(convert("a = [1]\na.last")).isEqualTo("let a = [1];\na.at(-1);\n");
  }

  @Test
  public void testTimesBecomesCountingLoop() {
    assertThat(convert("n.times { |i| puts i }"))
        .isEqualTo("for (let i = 0; i < n; i++) { console.log(i); }");
  }

  @Test
  public void testReject() {
    assertThat(convert("a.reject { |x| x > 1 }")).isEqualTo("a.filter(x => !(x > 1));");
  }

  @Test
  public void testInject() {
    assertThat(convert("a.inject(0) { |sum, x| sum + x }"))
        .isEqualTo("a.reduce((sum, x) => sum + x, 0);");
  }

  @Test
  public void testRunsBeforeCamelCase() {
    options.setFilters(ImmutableList.of("camelCase", "functions"));
    assertThat(convert("a.each_with_index { |item_value, i| puts item_value }"))
        .isEqualTo("a.forEach((itemValue, i) => console.log(itemValue));");
  }
}
