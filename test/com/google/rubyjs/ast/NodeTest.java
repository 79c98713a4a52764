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

package com.google.rubyjs.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {
  private static final SourceRange RANGE = SourceRange.create(0, 5, 1, 0, 1);

  @Test
  public void testToStringTree() {
    Node n = IR.send(null, "puts", IR.string("a \"b\""), IR.number(1), IR.sym("x"));
    assertThat(n.toStringTree())
        .isEqualTo("(send nil :puts (str \"a \\\"b\\\"\") (int 1) (sym :x))");
    assertThat(IR.send(IR.lvar("a"), "+", IR.number(2.5)).toStringTree())
        .isEqualTo("(send (lvar :a) :+ (float 2.5))");
  }

  @Test
  public void testEqualityIgnoresPosition() {
    Node synthetic = IR.lvar("x");
    Node parsed = synthetic.withSourceRange(RANGE);
    assertThat(parsed).isEqualTo(synthetic);
    assertThat(parsed.hashCode()).isEqualTo(synthetic.hashCode());
    assertThat(parsed.isSynthetic()).isFalse();
    assertThat(synthetic.isSynthetic()).isTrue();
  }

  @Test
  public void testUpdatedKeepsPosition() {
    Node parsed = IR.lvasgn("x", IR.number(1)).withSourceRange(RANGE);
    Node changed = parsed.withChild(1, IR.number(2));
    assertThat(changed.getSourceRange()).isEqualTo(RANGE);
    assertThat(changed.toStringTree()).isEqualTo("(lvasgn :x (int 2))");
    assertThat(parsed.toStringTree()).isEqualTo("(lvasgn :x (int 1))");
    assertThat(parsed.updated(Token.IVASGN).getToken()).isEqualTo(Token.IVASGN);
  }

  @Test
  public void testChildAccessors() {
    Node n = IR.send(IR.lvar("a"), "b", IR.number(1));
    assertThat(n.getChildCount()).isEqualTo(3);
    assertThat(n.getFirstChild()).isEqualTo(IR.lvar("a"));
    assertThat(n.getLastChild()).isEqualTo(IR.number(1));
    assertThat(n.childNodes()).containsExactly(IR.lvar("a"), IR.number(1)).inOrder();
    assertThat(n.childrenFrom(2)).containsExactly(IR.number(1));
    assertThat(n.getChild(7)).isNull();
    assertThrows(IllegalStateException.class, () -> n.getNode(1));
    assertThrows(IllegalStateException.class, () -> n.getString(0));
  }

  @Test
  public void testUnsupportedChildValue() {
    assertThrows(IllegalArgumentException.class, () -> Node.make(Token.INT, 1));
  }

  @Test
  public void testMethodCallShape() {
    Node property = Node.make(Token.SEND, IR.lvar("a"), "length").withSourceRange(RANGE);
    assertThat(property.isMethodCallShape()).isFalse();
    assertThat(property.withSourceRange(RANGE.withParens(true)).isMethodCallShape()).isTrue();
    assertThat(IR.send(IR.lvar("a"), "pop").isMethodCallShape()).isTrue();
    assertThat(IR.attr(IR.lvar("a"), "pop").isMethodCallShape()).isFalse();
    assertThat(IR.call(IR.lvar("a"), "pop").isMethodCallShape()).isTrue();
  }

  @Test
  public void testBangSendCallShape() {
    Node bang = Node.make(Token.SEND, IR.lvar("a"), "save!").withSourceRange(RANGE);
    Node safeBang = Node.make(Token.CSEND, IR.lvar("a"), "save!").withSourceRange(RANGE);
    Node predicate = Node.make(Token.SEND, IR.lvar("a"), "empty?").withSourceRange(RANGE);
    assertThat(bang.isMethodCallShape()).isTrue();
    assertThat(safeBang.isMethodCallShape()).isTrue();
    assertThat(predicate.isMethodCallShape()).isFalse();
  }

  @Test
  public void testDefCallShape() {
    Node noParams = Node.make(Token.DEF, "name", IR.args(), null).withSourceRange(RANGE);
    Node predicate = Node.make(Token.DEF, "empty?", IR.args(), null).withSourceRange(RANGE);
    Node withParams = Node.make(Token.DEF, "set", IR.args("v"), null).withSourceRange(RANGE);
    assertThat(noParams.isMethodCallShape()).isFalse();
    assertThat(predicate.isMethodCallShape()).isTrue();
    assertThat(withParams.isMethodCallShape()).isTrue();
  }

  @Test
  public void testTokenTags() {
    assertThat(Token.OP_ASGN.tag()).isEqualTo("op_asgn");
    assertThat(Token.fromTag("block_pass")).isEqualTo(Token.BLOCK_PASS);
    assertThat(Token.fromTag("nope")).isNull();
    assertThat(Token.ATTR.isSynthetic()).isTrue();
    assertThat(Token.SEND.isSynthetic()).isFalse();
    assertThat(Token.BLOCK.isScopeRoot()).isTrue();
    assertThat(Token.IVASGN.isVariableAssignment()).isTrue();
    assertThat(Token.CALL.isCallLike()).isTrue();
  }

  @Test
  public void testIrGuards() {
    assertThrows(IllegalStateException.class, () -> IR.ivar("x"));
    assertThrows(IllegalStateException.class, () -> IR.block(IR.lvar("x"), IR.args(), null));
  }
}
