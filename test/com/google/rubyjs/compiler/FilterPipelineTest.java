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

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.IR;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FilterPipelineTest {

  private ConversionOptions options;

  @Before
  public void setUp() {
    options = new ConversionOptions();
  }

  /** Appends a suffix to every selector, then hands the send on unless told not to. */
  private static final class SuffixFilter extends AbstractFilter {
    SuffixFilter(String name, boolean passOn) {
      super(name);
      on(
          Token.SEND,
          (n, chain) -> {
            Node renamed = n.withChild(1, n.getString(1) + "_" + name);
            return passOn ? chain.process(renamed) : renamed;
          });
    }
  }

  private static final class FailingFilter extends AbstractFilter {
    FailingFilter(NodeHandler handler) {
      super("failing");
      on(Token.SEND, handler);
    }
  }

  private Node run(Node root, Filter... filters) {
    ConversionContext context =
        new ConversionContext(options, new LoggerErrorManager(Logger.getLogger("test")));
    return new FilterPipeline(ImmutableList.copyOf(filters), context).run(root);
  }

  @Test
  public void testFiltersRunInOrder() {
    Node result =
        run(IR.send(null, "foo"), new SuffixFilter("a", true), new SuffixFilter("b", true));
    assertThat(result.getString(1)).isEqualTo("foo_a_b");
  }

  @Test
  public void testHandlerMayStopTheChain() {
    Node result =
        run(IR.send(null, "foo"), new SuffixFilter("a", false), new SuffixFilter("b", true));
    assertThat(result.getString(1)).isEqualTo("foo_a");
  }

  @Test
  public void testChildrenAreRewrittenFirst() {
    List<String> seen = new ArrayList<>();
    AbstractFilter filter =
        new AbstractFilter("upper") {
          {
            on(Token.LVAR, (n, chain) -> IR.lvar(n.getString(0).toUpperCase()));
            on(
                Token.SEND,
                (n, chain) -> {
                  seen.add(n.getNode(2).getString(0));
                  return n;
                });
          }
        };
    Node result = run(IR.send(null, "puts", IR.lvar("x")), filter);
    assertThat(seen).containsExactly("X");
    assertThat(result).isEqualTo(IR.send(null, "puts", IR.lvar("X")));
  }

  @Test
  public void testUnhandledTreeIsReturnedAsIs() {
    Node tree = IR.begin(IR.lvasgn("x", IR.number(1)), IR.lvar("x"));
    assertThat(run(tree, new SuffixFilter("a", true))).isSameInstanceAs(tree);
  }

  @Test
  public void testExcludedNodeTypeSkipsFilter() {
    options.excludeNodeTypes("A", Token.SEND);
    Node result =
        run(IR.send(null, "foo"), new SuffixFilter("a", true), new SuffixFilter("b", true));
    assertThat(result.getString(1)).isEqualTo("foo_b");
  }

  @Test
  public void testPrependedStatementsLeadTheProgram() {
    Node helper = IR.lvasgn("helper", IR.number(1));
    AbstractFilter filter =
        new AbstractFilter("helpers") {
          {
            on(
                Token.SEND,
                (n, chain) -> {
                  chain.context().prepend(helper);
                  chain.context().prepend(IR.lvasgn("helper", IR.number(1)));
                  return n;
                });
          }
        };
    Node call = IR.send(null, "foo");

    assertThat(run(IR.begin(call, call), filter)).isEqualTo(IR.begin(helper, call, call));
    assertThat(run(call, filter)).isEqualTo(IR.begin(helper, call));
  }

  @Test
  public void testScopeFollowsTraversal() {
    List<String> seen = new ArrayList<>();
    AbstractFilter filter =
        new AbstractFilter("scopes") {
          {
            on(
                Token.LVAR,
                (n, chain) -> {
                  ScopeTracker scope = chain.context().scope();
                  seen.add(scope.currentKind() + ":" + scope.isLocal(n.getString(0)));
                  return n;
                });
          }
        };
    Node tree =
        IR.begin(
            IR.block(IR.send(IR.lvar("list"), "each"), IR.args("item"), IR.lvar("item")),
            IR.lvar("item"));
    run(tree, filter);
    assertThat(seen).containsExactly("PROGRAM:false", "BLOCK:true", "PROGRAM:false").inOrder();
  }

  @Test
  public void testRewriteRunsWholePipelineOnNewSubtree() {
    AbstractFilter wrap =
        new AbstractFilter("wrap") {
          {
            on(Token.SYM, (n, chain) -> chain.rewrite(IR.send(null, n.getString(0))));
          }
        };
    Node result = run(IR.sym("go"), wrap, new SuffixFilter("a", true));
    assertThat(result).isEqualTo(IR.send(null, "go_a"));
  }

  @Test
  public void testHandlerFailureIsWrapped() {
    options.setSourceFileName("lib/app.rb");
    FilterException e =
        assertThrows(
            FilterException.class,
            () ->
                run(
                    IR.send(null, "foo"),
                    new FailingFilter(
                        (n, chain) -> {
                          throw new IllegalStateException("boom");
                        })));
    assertThat(e.getFilterName()).isEqualTo("failing");
    assertThat(e.getToken()).isEqualTo(Token.SEND);
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
    assertThat(e.getDiagnostic().sourceName()).isEqualTo("lib/app.rb");
    assertThat(e.getDiagnostic().description()).isEqualTo("Filter failing failed on send: boom");
  }

  @Test
  public void testNullFromHandlerIsWrapped() {
    FilterException e =
        assertThrows(
            FilterException.class,
            () -> run(IR.send(null, "foo"), new FailingFilter((n, chain) -> null)));
    assertThat(e).hasCauseThat().isInstanceOf(NullPointerException.class);
  }

  @Test
  public void testReportedErrorIsNotWrapped() {
    DiagnosticType type = DiagnosticType.error("TEST_ERROR", "no {0}");
    ConversionException e =
        assertThrows(
            ConversionException.class,
            () ->
                run(
                    IR.send(null, "foo"),
                    new FailingFilter(
                        (n, chain) -> {
                          chain.context().report(n, type, n.getString(1));
                          return n;
                        })));
    assertThat(e).isNotInstanceOf(FilterException.class);
    assertThat(e.getDiagnostic().type()).isEqualTo(type);
    assertThat(e.getDiagnostic().description()).isEqualTo("no foo");
  }
}
