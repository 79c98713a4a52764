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

import com.google.rubyjs.compiler.ScopeTracker.Kind;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeTrackerTest {
  private ScopeTracker scope;

  @Before
  public void setUp() {
    scope = new ScopeTracker();
  }

  @Test
  public void testProgramScopeIsImplicit() {
    assertThat(scope.currentKind()).isEqualTo(Kind.PROGRAM);
    assertThat(scope.depth()).isEqualTo(0);
    assertThrows(IllegalStateException.class, () -> scope.exitScope());
    assertThrows(IllegalStateException.class, () -> scope.enterScope(Kind.PROGRAM));
  }

  @Test
  public void testBlocksSeeEnclosingLocals() {
    scope.declareLocal("x");
    scope.enterScope(Kind.BLOCK);
    scope.declareLocal("y");

    assertThat(scope.isLocal("x")).isTrue();
    assertThat(scope.isLocal("y")).isTrue();
    assertThat(scope.isDeclaredInCurrentScope("x")).isFalse();
    assertThat(scope.currentLocals()).containsExactly("y");

    scope.exitScope();
    assertThat(scope.isLocal("y")).isFalse();
  }

  @Test
  public void testMethodsHideEnclosingLocals() {
    scope.declareLocal("x");
    scope.enterScope(Kind.METHOD);
    assertThat(scope.isLocal("x")).isFalse();

    scope.enterScope(Kind.BLOCK);
    scope.declareLocal("z");
    assertThat(scope.isLocal("z")).isTrue();
    assertThat(scope.isLocal("x")).isFalse();
    assertThat(scope.depth()).isEqualTo(2);
  }

  @Test
  public void testLocalsKeepDeclarationOrder() {
    scope.declareLocal("b");
    scope.declareLocal("a");
    scope.declareLocal("b");
    assertThat(scope.currentLocals()).containsExactly("b", "a").inOrder();
  }

  @Test
  public void testConstantsAreVisibleFromNestedScopes() {
    scope.declareConstant("LIMIT");
    scope.enterScope(Kind.CLASS, "Foo");
    scope.enterScope(Kind.METHOD);
    assertThat(scope.isConstant("LIMIT")).isTrue();
    assertThat(scope.isConstant("OTHER")).isFalse();
  }

  @Test
  public void testClassPath() {
    scope.enterScope(Kind.MODULE, "Outer::Inner");
    scope.enterScope(Kind.CLASS, "Foo");
    assertThat(scope.isInClassBody()).isTrue();
    assertThat(scope.currentClassPath()).containsExactly("Outer", "Inner", "Foo").inOrder();

    scope.enterScope(Kind.METHOD, "ignored");
    assertThat(scope.isInClassBody()).isFalse();
    assertThat(scope.currentClassPath()).containsExactly("Outer", "Inner", "Foo").inOrder();
  }
}
