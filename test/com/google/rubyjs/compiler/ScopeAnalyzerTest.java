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

import com.google.rubyjs.ast.Node;
import com.google.rubyjs.parsing.SexpParser;
import com.google.rubyjs.parsing.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeAnalyzerTest {

  private static String analyze(String sexp) {
    Node root = new SexpParser().parse(SourceFile.fromCode("tree.sexp", sexp)).root();
    return ScopeAnalyzer.process(root).toStringTree();
  }

  @Test
  public void testReadAfterAssignmentBecomesLocal() {
    assertThat(analyze("(begin (send nil :x) (lvasgn :x (int 1)) (send nil :x))"))
        .isEqualTo("(begin (send nil :x) (lvasgn :x (int 1)) (lvar :x))");
  }

  @Test
  public void testCallWithArgumentsStaysCall() {
    assertThat(analyze("(begin (lvasgn :x (int 1)) (send nil :x (int 2)))"))
        .isEqualTo("(begin (lvasgn :x (int 1)) (send nil :x (int 2)))");
  }

  @Test
  public void testMethodBodyDoesNotSeeOuterLocals() {
    assertThat(analyze("(begin (lvasgn :x (int 1)) (def :f (args) (send nil :x)))"))
        .isEqualTo("(begin (lvasgn :x (int 1)) (def :f (args) (send nil :x)))");
    assertThat(analyze("(def :f (args (arg :x)) (send nil :x))"))
        .isEqualTo("(def :f (args (arg :x)) (lvar :x))");
  }

  @Test
  public void testBlockSeesOuterLocalsAndKeepsItsOwn() {
    assertThat(
            analyze(
                "(begin (lvasgn :x (int 1))"
                    + " (block (send nil :each) (args (arg :y)) (send nil :puts (send nil :x)"
                    + " (send nil :y)))"
                    + " (send nil :y))"))
        .isEqualTo(
            "(begin (lvasgn :x (int 1))"
                + " (block (send nil :each) (args (arg :y)) (send nil :puts (lvar :x) (lvar :y)))"
                + " (send nil :y))");
  }

  @Test
  public void testUnchangedTreeIsShared() {
    Node root =
        new SexpParser().parse(SourceFile.fromCode("tree.sexp", "(send nil :puts (int 1))")).root();
    assertThat(ScopeAnalyzer.process(root)).isSameInstanceAs(root);
  }
}
