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

import com.google.debugging.sourcemap.OriginalMapping;
import com.google.debugging.sourcemap.SourceMapConsumerV3;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.rubyjs.parsing.ParseException;
import com.google.rubyjs.parsing.ParseResult;
import com.google.rubyjs.parsing.SexpParser;
import com.google.rubyjs.parsing.SourceFile;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private static final String IF_PROGRAM = "x = 1\nif x > 0\n  puts x\nend";

  private Compiler compiler;
  private ConversionOptions options;

  @Before
  public void setUp() {
    compiler = new Compiler();
    options = new ConversionOptions();
  }

  @Test
  public void testConvertsAssignmentAndIf() {
    ConversionResult result = compiler.convert(IF_PROGRAM, options);
    assertThat(result.text()).isEqualTo("let x = 1;\nif (x > 0) {\n  puts(x);\n}\n");
    assertThat(result.sourceMap()).isNull();
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testSourceMapPointsIfBackToItsLine() {
    options.setSourceFileName("test.rb");
    options.setCreateSourceMap(true);
    options.setIncludeSourcesContent(true);
    ConversionResult result = compiler.convert(IF_PROGRAM, options);

    JsonObject json = JsonParser.parseString(result.sourceMap()).getAsJsonObject();
    assertThat(json.get("version").getAsInt()).isEqualTo(3);
    assertThat(json.get("file").getAsString()).isEqualTo("test.js");

    SourceMapConsumerV3 consumer = SourceMapConsumerV3.parse(result.sourceMap());
    assertThat(consumer.getOriginalSources()).containsExactly("test.rb");
    assertThat(consumer.getSourceContent("test.rb")).isEqualTo(IF_PROGRAM);

    OriginalMapping ifMapping = consumer.getMappingForLine(2, 1);
    assertThat(ifMapping.getOriginalFile()).isEqualTo("test.rb");
    assertThat(ifMapping.getLineNumber()).isEqualTo(2);
    assertThat(ifMapping.getColumnPosition()).isEqualTo(1);

    OriginalMapping putsMapping = consumer.getMappingForLine(3, 3);
    assertThat(putsMapping.getLineNumber()).isEqualTo(3);
    assertThat(putsMapping.getColumnPosition()).isEqualTo(3);
  }

  @Test
  public void testOutputIsDeterministic() {
    options.setCreateSourceMap(true);
    ConversionResult first = compiler.convert(IF_PROGRAM, options);
    ConversionResult second = compiler.convert(IF_PROGRAM, options);
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void testOneLineSourcePrintsOnOneLine() {
    assertThat(compiler.convert("x = 1", options).text()).isEqualTo("let x = 1;");
    options.setLanguageMode(LanguageMode.ECMASCRIPT5);
    assertThat(compiler.convert("x = 1", options).text()).isEqualTo("var x = 1;");
  }

  @Test
  public void testFiltersFromOptions() {
    options.addFilter("functions");
    assertThat(compiler.convert("puts 1", options).text()).isEqualTo("console.log(1);");
  }

  @Test
  public void testFiltersFromMagicComment() {
    String text = compiler.convert("# rubyjs: filters: functions\nputs 1\n", options).text();
    assertThat(text).contains("console.log(1);");
    assertThat(options.getFilters()).isEmpty();
  }

  @Test
  public void testUnknownFilterFailsBeforeParsing() {
    Compiler failingParser =
        new Compiler(
            FilterRegistry.withBuiltins(),
            file -> {
              throw new AssertionError("parsed " + file.getName());
            });
    options.addFilter("jquery");
    assertThrows(ConfigurationException.class, () -> failingParser.convert("puts 1", options));
    assertThrows(
        ConfigurationException.class,
        () -> failingParser.convert("# rubyjs: filters: jquery\nputs 1", new ConversionOptions()));
  }

  @Test
  public void testInvalidOptionsFail() {
    options.setLineWidth(-5);
    assertThrows(ConfigurationException.class, () -> compiler.convert("puts 1", options));
  }

  @Test
  public void testParseErrorCarriesPosition() {
    options.setSourceFileName("app.rb");
    ParseException e =
        assertThrows(ParseException.class, () -> compiler.convert("x = 1\nputs 1 2", options));
    assertThat(e.getLine()).isEqualTo(2);
    assertThat(e.getColumn()).isEqualTo(7);
    assertThat(e.getDiagnostic().sourceName()).isEqualTo("app.rb");
  }

  @Test
  public void testUnsupportedConstruct() {
    assertThrows(UnsupportedConstructException.class, () -> compiler.convert("break", options));
  }

  @Test
  public void testWarningsAreCollected() {
    ConversionResult result = compiler.convert("item.save!()", options);
    assertThat(result.text()).isEqualTo("item.save();");
    assertThat(result.diagnostics()).hasSize(1);
    Diagnostic warning = result.diagnostics().get(0);
    assertThat(warning.type()).isEqualTo(CodeGenerator.BANG_METHOD);
    assertThat(warning.level()).isEqualTo(CheckLevel.WARNING);
    assertThat(warning.line()).isEqualTo(1);
  }

  @Test
  public void testStrictModeTurnsWarningsIntoErrors() {
    options.setStrict(true);
    ConversionException e =
        assertThrows(ConversionException.class, () -> compiler.convert("item.save!()", options));
    assertThat(e.getDiagnostic().type()).isEqualTo(CodeGenerator.BANG_METHOD);
    assertThat(e.getDiagnostic().level()).isEqualTo(CheckLevel.ERROR);
  }

  @Test
  public void testCommentsAreKept() {
    String text = compiler.convert("# greet\nputs 1 # trailing\n", options).text();
    assertThat(text).isEqualTo("// greet\nputs(1); // trailing\n");
  }

  @Test
  public void testConvertTreeFromAnotherParser() {
    ParseResult tree =
        new SexpParser()
            .parse(
                SourceFile.fromCode(
                    "t.sexp", "(begin (lvasgn :x (int 1)) (send nil :puts (send nil :x)))"));
    assertThat(compiler.convertTree(tree, options).text()).isEqualTo("let x = 1; puts(x);");
  }

  @Test
  public void testConcurrentConversionsAreIndependent() throws Exception {
    String expected = compiler.convert(IF_PROGRAM, options).text();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        ConversionOptions perCall = options.copy();
        perCall.setSourceFileName("file" + i + ".rb");
        results.add(executor.submit(() -> compiler.convert(IF_PROGRAM, perCall).text()));
      }
      for (Future<String> result : results) {
        assertThat(result.get()).isEqualTo(expected);
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testGeneratedFileName() {
    assertThat(Compiler.generatedFileName("lib/a.rb")).isEqualTo("lib/a.js");
    assertThat(Compiler.generatedFileName("a")).isEqualTo("a.js");
    assertThat(Compiler.generatedFileName("v1.2/a")).isEqualTo("v1.2/a.js");
    assertThat(Compiler.generatedFileName(null)).isEmpty();
  }

  @Test
  public void testParseResolvesLocals() {
    ParseResult result = compiler.parse("x = 1\nx", "a.rb");
    assertThat(result.root().toStringTree()).isEqualTo("(begin (lvasgn :x (int 1)) (lvar :x))");
    assertThat(result.sourceFile().getName()).isEqualTo("a.rb");
    assertThat(result.comments()).isEmpty();
  }
}
