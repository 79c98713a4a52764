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
import com.google.rubyjs.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SexpParserTest {

  private static Node parse(String sexp) {
    return new SexpParser().parse(SourceFile.fromCode("tree.sexp", sexp)).root();
  }

  @Test
  public void testReadsWhatRubyParserBuilds() {
    String ruby = "def greet(name)\n  puts \"hi #{name}\"\nend\ngreet(1.5)";
    Node tree = new RubyParser().parse(SourceFile.fromCode("a.rb", ruby)).root();
    Node reread = parse(tree.toStringTree());
    assertThat(reread).isEqualTo(tree);
    assertThat(reread.toStringTree()).isEqualTo(tree.toStringTree());
  }

  @Test
  public void testChildValues() {
    Node n = parse("(send nil :puts (str \"a\\nb\") (int 42) (float 2.5))");
    assertThat(n.getToken()).isEqualTo(Token.SEND);
    assertThat(n.getChild(0)).isNull();
    assertThat(n.getString(1)).isEqualTo("puts");
    assertThat(n.getNode(2).getString(0)).isEqualTo("a\nb");
    assertThat(n.getNode(3).getChild(0)).isEqualTo(42L);
    assertThat(n.getNode(4).getChild(0)).isEqualTo(2.5);
  }

  @Test
  public void testDefinedSpelling() {
    assertThat(parse("(defined? (lvar :x))").getToken()).isEqualTo(Token.DEFINED);
  }

  @Test
  public void testZeroArgumentSendIsPropertyRead() {
    assertThat(parse("(send (lvar :a) :length)").isMethodCallShape()).isFalse();
  }

  @Test
  public void testEmptyInput() {
    assertThat(parse("  ").toStringTree()).isEqualTo("(begin)");
  }

  @Test
  public void testErrors() {
    assertThrows(ParseException.class, () -> parse("(bogus)"));
    assertThrows(ParseException.class, () -> parse("(int 1"));
    assertThrows(ParseException.class, () -> parse("(int 1) (int 2)"));
    assertThrows(ParseException.class, () -> parse("(int one)"));
  }
}
