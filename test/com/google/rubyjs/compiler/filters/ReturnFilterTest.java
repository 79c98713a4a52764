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
public final class ReturnFilterTest {

  private static String convert(String source, String... filters) {
    ConversionOptions options = new ConversionOptions();
    for (String filter : filters) {
      options.addFilter(filter);
    }
    return new Compiler().convert(source, options).text();
  }

  @Test
  public void testMethodReturnsLastExpression() {
    String source = "def f(a)\n  a + 1\nend";
    assertThat(convert(source)).isEqualTo("function f(a) {\n  a + 1;\n}\n");
    assertThat(convert(source, "return")).isEqualTo("function f(a) {\n  return a + 1;\n}\n");
  }

  @Test
  public void testOnlyLastStatementReturns() {
    assertThat(convert("def f(a)\n  b = a * 2\n  b + 1\nend", "return"))
        .isEqualTo("function f(a) {\n  let b = a * 2;\n  return b + 1;\n}\n");
  }

  @Test
  public void testReturnGoesIntoBranches() {
    assertThat(convert("def sign(n)\n  if n > 0\n    1\n  else\n    -1\n  end\nend", "return"))
        .isEqualTo(
            "function sign(n) {\n"
                + "  if (n > 0) {\n"
                + "    return 1;\n"
                + "  } else {\n"
                + "    return -1;\n"
                + "  }\n"
                + "}\n");
  }

  @Test
  public void testConstructorIsLeftAlone() {
    assertThat(convert("def initialize(a)\n  @a = a\nend", "return"))
        .isEqualTo("function initialize(a) {\n  this._a = a;\n}\n");
  }

  @Test
  public void testMapBlockReturns() {
    assertThat(convert("list.map do |x|\n  y = x * 2\n  y + 1\nend", "return"))
        .isEqualTo("list.map(x => {\n  let y = x * 2;\n  return y + 1;\n});\n");
  }

  @Test
  public void testEachBlockDoesNotReturn() {
    assertThat(convert("list.each do |x|\n  y = x\n  puts y\nend", "return"))
        .isEqualTo("list.each(x => {\n  let y = x;\n  puts(y);\n});\n");
  }
}
