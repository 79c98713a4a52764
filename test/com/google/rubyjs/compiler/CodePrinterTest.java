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

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private LanguageMode languageMode;

  @Before
  public void setUp() {
    languageMode = LanguageMode.ECMASCRIPT_2020;
  }

  private ConversionResult convert(String ruby) {
    ConversionOptions options = new ConversionOptions();
    options.setLanguageMode(languageMode);
    return new Compiler().convert(ruby, options);
  }

  private String print(String ruby) {
    return convert(ruby).text();
  }

  private void assertPrint(String ruby, String expected) {
    assertThat(print(ruby)).isEqualTo(expected);
  }

  @Test
  public void testBinaryPrecedence() {
    assertPrint("a + b * c", "a + b * c;");
    assertPrint("(a + b) * c", "(a + b) * c;");
    assertPrint("a + (b * c)", "a + b * c;");
    assertPrint("a - b - c", "a - b - c;");
    assertPrint("a - (b - c)", "a - (b - c);");
  }

  @Test
  public void testExponentiation() {
    // Ruby binds ** tighter than unary minus.
    assertPrint("-a ** 2", "-(a ** 2);");
    assertPrint("(-a) ** 2", "(-a) ** 2;");
    assertPrint("a ** b ** c", "a ** b ** c;");
    assertPrint("(a ** b) ** c", "(a ** b) ** c;");

    languageMode = LanguageMode.ECMASCRIPT5;
    assertPrint("a ** 2", "Math.pow(a, 2);");
  }

  @Test
  public void testCallVersusProperty() {
    assertPrint("obj.attr", "obj.attr;");
    assertPrint("obj.attr()", "obj.attr();");
    assertPrint("obj.attr 1", "obj.attr(1);");
  }

  @Test
  public void testBangMethodIsCalled() {
    ConversionResult result = convert("a.save!");
    assertThat(result.text()).isEqualTo("a.save();");
    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).type()).isEqualTo(CodeGenerator.BANG_METHOD);

    assertPrint("a&.save!", "a?.save();");
  }

  @Test
  public void testGetterReturnsLastValue() {
    assertThat(print("class A\n  def x\n    @x\n  end\nend"))
        .contains("class A {\n  get x() {\n    return this._x;\n  }\n}");
  }

  @Test
  public void testStaticGetterReturnsLastValue() {
    String js = print("class A\n  def self.count\n    @@count\n  end\nend");
    assertThat(js).contains("static get count() {\n    return A._count;\n  }");
  }

  @Test
  public void testSetterAndMethod() {
    String js =
        print(
            "class A\n"
                + "  def x=(value)\n"
                + "    @x = value\n"
                + "  end\n"
                + "  def go(n)\n"
                + "    n\n"
                + "  end\n"
                + "end");
    assertThat(js).contains("set x(value) {\n    this._x = value;\n  }");
    assertThat(js).contains("go(n) {\n    n;\n  }");
  }

  @Test
  public void testPrivateFields() {
    languageMode = LanguageMode.ECMASCRIPT_2022;
    String js = print("class A\n  def initialize\n    @x = 1\n  end\n  def x\n    @x\n  end\nend");
    assertThat(js).contains("#x;");
    assertThat(js).contains("this.#x = 1;");
    assertThat(js).contains("get x() {\n    return this.#x;\n  }");
  }

  @Test
  public void testEs5ClassLowering() {
    languageMode = LanguageMode.ECMASCRIPT5;
    String js =
        print(
            "class A\n"
                + "  def initialize(x)\n"
                + "    @x = x\n"
                + "  end\n"
                + "  def area\n"
                + "    @x * 2\n"
                + "  end\n"
                + "  def go(n)\n"
                + "    n\n"
                + "  end\n"
                + "end");
    assertThat(js).contains("function A(x) {\n  this._x = x;\n}");
    assertThat(js).contains("Object.defineProperty(A.prototype, \"area\"");
    assertThat(js).contains("return this._x * 2;");
    assertThat(js).contains("A.prototype.go = function(n) {");
    assertThat(js).doesNotContain("class ");
  }

  @Test
  public void testRestThenBlockParameter() {
    String js = print("def f(*a, &b)\n  b.call(a)\nend");
    assertThat(js).startsWith("function f() {\n");
    assertThat(js).contains("let a = Array.prototype.slice.call(arguments, 0);");
    assertThat(js).contains("let b = typeof a[a.length - 1] === \"function\" ? a.pop() : null;");
    assertThat(js).doesNotContain("...a");
  }

  @Test
  public void testRestAfterPositionalThenBlockParameter() {
    languageMode = LanguageMode.ECMASCRIPT5;
    String js = print("def f(x, *a, &b)\n  b.call(x)\nend");
    assertThat(js).startsWith("function f(x) {\n");
    assertThat(js).contains("var a = Array.prototype.slice.call(arguments, 1);");
    assertThat(js).contains("var b = typeof a[a.length - 1] === \"function\" ? a.pop() : null;");
  }

  @Test
  public void testRestWithImplicitBlock() {
    String js = print("def f(*a)\n  yield a\nend");
    assertThat(js).startsWith("function f() {\n");
    assertThat(js)
        .contains(
            "let _implicitBlockYield = typeof a[a.length - 1] === \"function\" ? a.pop() : null;");
    assertThat(js).contains("_implicitBlockYield(a);");
  }

  @Test
  public void testRestParameterLastIsSpread() {
    assertThat(print("def f(x, *a)\n  a\nend")).startsWith("function f(x, ...a) {\n");
  }

  @Test
  public void testParametersThatCannotFollowRest() {
    assertThrows(UnsupportedConstructException.class, () -> print("def f(*a, k: 1)\nend"));
    assertThrows(UnsupportedConstructException.class, () -> print("def f(*a, b)\nend"));
    assertThrows(UnsupportedConstructException.class, () -> print("g { |*a, &b| b }"));
  }
}
