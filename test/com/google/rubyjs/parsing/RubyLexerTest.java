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

import com.google.rubyjs.ast.Comment;
import com.google.rubyjs.parsing.RubyLexer.Lexeme;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RubyLexerTest {
  private final List<Comment> comments = new ArrayList<>();

  private List<String> lex(String code) {
    SourceFile file = SourceFile.fromCode("test.rb", code);
    List<String> result = new ArrayList<>();
    for (Lexeme lexeme : new RubyLexer(file, 0, code.length(), comments).tokenize()) {
      result.add(lexeme.kind + ":" + lexeme.text);
    }
    return result;
  }

  @Test
  public void testAssignment() {
    assertThat(lex("x = 1"))
        .containsExactly("IDENTIFIER:x", "OPERATOR:=", "INTEGER:1", "EOF:")
        .inOrder();
  }

  @Test
  public void testPredicateMethodName() {
    assertThat(lex("foo.bar?"))
        .containsExactly("IDENTIFIER:foo", "OPERATOR:.", "IDENTIFIER:bar?", "EOF:")
        .inOrder();
  }

  @Test
  public void testVariables() {
    assertThat(lex("@x @@y $z"))
        .containsExactly("IVAR:@x", "CVAR:@@y", "GVAR:$z", "EOF:")
        .inOrder();
  }

  @Test
  public void testNumbers() {
    assertThat(lex("0x1F")).containsExactly("INTEGER:31", "EOF:").inOrder();
    assertThat(lex("1_000")).containsExactly("INTEGER:1000", "EOF:").inOrder();
    assertThat(lex("1.5e3")).containsExactly("FLOAT:1.5e3", "EOF:").inOrder();
    assertThrows(ParseException.class, () -> lex("12abc"));
  }

  @Test
  public void testSymbols() {
    assertThat(lex(":foo? :+ :[]="))
        .containsExactly("SYMBOL:foo?", "SYMBOL:+", "SYMBOL:[]=", "EOF:")
        .inOrder();
  }

  @Test
  public void testLabels() {
    assertThat(lex("{a: 1}"))
        .containsExactly("OPERATOR:{", "LABEL:a", "INTEGER:1", "OPERATOR:}", "EOF:")
        .inOrder();
  }

  @Test
  public void testSlashAfterIdentifier() {
    assertThat(lex("a / b"))
        .containsExactly("IDENTIFIER:a", "OPERATOR:/", "IDENTIFIER:b", "EOF:")
        .inOrder();
    assertThat(lex("a /b/"))
        .containsExactly("IDENTIFIER:a", "REGEXP:/b/", "EOF:")
        .inOrder();
  }

  @Test
  public void testNewlinesCollapse() {
    assertThat(lex("a\n\nb"))
        .containsExactly("IDENTIFIER:a", "NEWLINE:\n", "IDENTIFIER:b", "EOF:")
        .inOrder();
    assertThat(lex("a;b"))
        .containsExactly("IDENTIFIER:a", "NEWLINE:;", "IDENTIFIER:b", "EOF:")
        .inOrder();
  }

  @Test
  public void testLeadingDotContinuesLine() {
    assertThat(lex("a\n  .b"))
        .containsExactly("IDENTIFIER:a", "OPERATOR:.", "IDENTIFIER:b", "EOF:")
        .inOrder();
  }

  @Test
  public void testKeywordAfterDotIsMethodName() {
    assertThat(lex("x.class"))
        .containsExactly("IDENTIFIER:x", "OPERATOR:.", "IDENTIFIER:class", "EOF:")
        .inOrder();
  }

  @Test
  public void testComments() {
    assertThat(lex("# own\nx = 1 # trailing"))
        .containsExactly("IDENTIFIER:x", "OPERATOR:=", "INTEGER:1", "EOF:")
        .inOrder();
    assertThat(comments).hasSize(2);
    assertThat(comments.get(0).text()).isEqualTo("own");
    assertThat(comments.get(0).placement()).isEqualTo(Comment.Placement.OWN_LINE);
    assertThat(comments.get(1).text()).isEqualTo("trailing");
    assertThat(comments.get(1).placement()).isEqualTo(Comment.Placement.END_OF_LINE);
    assertThat(comments.get(1).range().line()).isEqualTo(2);
  }

  @Test
  public void testBlockComment() {
    assertThat(lex("=begin\nhello\n=end\nx"))
        .containsExactly("IDENTIFIER:x", "EOF:")
        .inOrder();
    assertThat(comments).hasSize(1);
    assertThat(comments.get(0).text()).isEqualTo("hello");
  }

  @Test
  public void testHeredocIsRejected() {
    ParseException e = assertThrows(ParseException.class, () -> lex("x = <<~EOS\nhi\nEOS"));
    assertThat(e.getLine()).isEqualTo(1);
    assertThat(e.getColumn()).isEqualTo(4);
  }
}
