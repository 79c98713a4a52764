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

package com.google.rubyjs.parsing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.SourceRange;
import com.google.rubyjs.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RubyParserTest {

  private static ParseResult parse(String code) {
    return new RubyParser().parse(SourceFile.fromCode("test.rb", code));
  }

  private static void assertTree(String code, String expected) {
    assertThat(parse(code).root().toStringTree()).isEqualTo(expected);
  }

  @Test
  public void testAssignedLocalsAreVariables() {
    assertTree(
        "x = 1\nputs x",
        "(begin (lvasgn :x (int 1)) (send nil :puts (lvar :x)))");
  }

  @Test
  public void testUnknownIdentifierIsCall() {
    assertTree("puts y", "(send nil :puts (send nil :y))");
  }

  @Test
  public void testParenthesizedCallIsMarked() {
    Node call = parse("foo(1)").root();
    assertThat(call.toStringTree()).isEqualTo("(send nil :foo (int 1))");
    assertThat(call.getSourceRange().hasParens()).isTrue();
    assertThat(parse("foo 1").root().getSourceRange().hasParens()).isFalse();
  }

  @Test
  public void testOperatorPrecedence() {
    assertTree("1 + 2 * 3", "(send (int 1) :+ (send (int 2) :* (int 3)))");
    assertTree("a && b || c", "(or (and (send nil :a) (send nil :b)) (send nil :c))");
    assertTree("-2 ** 2", "(send (send (int 2) :** (int 2)) \"-@\")");
  }

  @Test
  public void testSafeNavigation() {
    assertTree("a&.b", "(csend (send nil :a) :b)");
  }

  @Test
  public void testDef() {
    assertTree(
        "def add(a, b)\n  a + b\nend",
        "(def :add (args (arg :a) (arg :b)) (send (lvar :a) :+ (lvar :b)))");
  }

  @Test
  public void testMethodBodyDoesNotSeeOuterLocals() {
    assertTree(
        "x = 1\ndef f\n  x\nend",
        "(begin (lvasgn :x (int 1)) (def :f (args) (send nil :x)))");
  }

  @Test
  public void testIfElse() {
    assertTree("if x\n  1\nelse\n  2\nend", "(if (send nil :x) (int 1) (int 2))");
    assertTree("unless x\n  1\nend", "(if (send nil :x) nil (int 1))");
    assertTree("y if x", "(if (send nil :x) (send nil :y) nil)");
  }

  @Test
  public void testBlock() {
    assertTree(
        "[1, 2].map { |n| n * 2 }",
        "(block (send (array (int 1) (int 2)) :map) (args (arg :n)) (send (lvar :n) :* (int 2)))");
  }

  @Test
  public void testOperatorAssignment() {
    assertTree("x = 1\nx += 2", "(begin (lvasgn :x (int 1)) (op_asgn (lvasgn :x) :+ (int 2)))");
    assertTree("@a ||= 1", "(or_asgn (ivasgn :@a) (int 1))");
  }

  @Test
  public void testAttributeAssignment() {
    assertTree("a.b = 1", "(send (send nil :a) :b= (int 1))");
    assertTree("a[0] = 1", "(send (send nil :a) :[]= (int 0) (int 1))");
  }

  @Test
  public void testClass() {
    assertTree(
        "class Foo < Bar\n  def initialize\n  end\nend",
        "(class (const nil :Foo) (const nil :Bar) (def :initialize (args) nil))");
  }

  @Test
  public void testHashArguments() {
    assertTree("f a: 1", "(send nil :f (hash (pair (sym :a) (int 1))))");
  }

  @Test
  public void testPositions() {
    Node root = parse("x = 1\nif x > 0\n  puts x\nend").root();
    Node ifNode = root.getNode(1);
    assertThat(ifNode.getToken()).isEqualTo(Token.IF);
    SourceRange range = ifNode.getSourceRange();
    assertThat(range.line()).isEqualTo(2);
    assertThat(range.column()).isEqualTo(0);
    assertThat(range.endLine()).isEqualTo(4);
    SourceRange puts = ifNode.getNode(1).getSourceRange();
    assertThat(puts.line()).isEqualTo(3);
    assertThat(puts.column()).isEqualTo(2);
  }

  @Test
  public void testComments() {
    ParseResult result = parse("# first\nx = 1 # second\n");
    assertThat(result.comments()).hasSize(2);
    assertThat(result.comments().get(0).text()).isEqualTo("first");
    assertThat(result.comments().get(1).text()).isEqualTo("second");
  }

  @Test
  public void testSyntaxErrorPosition() {
    ParseException e = assertThrows(ParseException.class, () -> parse("x = 1\nputs 1 2"));
    assertThat(e.getLine()).isEqualTo(2);
    assertThat(e.getColumn()).isEqualTo(7);
    assertThat(e.getDiagnostic().sourceName()).isEqualTo("test.rb");
  }

  @Test
  public void testUnsupportedKeyword() {
    ParseException e = assertThrows(ParseException.class, () -> parse("redo"));
    assertThat(e).hasMessageThat().contains("'redo' is not supported");
  }

  @Test
  public void testMissingEnd() {
    assertThrows(ParseException.class, () -> parse("def f\n  1\n"));
  }
}
