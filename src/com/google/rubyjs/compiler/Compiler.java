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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.debugging.sourcemap.SourceMapGeneratorV3;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.parsing.ParseResult;
import com.google.rubyjs.parsing.RubyParser;
import com.google.rubyjs.parsing.SourceFile;
import com.google.rubyjs.parsing.SourceParser;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Converts Ruby source to JavaScript.
 *
 * <p>A conversion runs in fixed steps: the options are copied and checked, the magic comment of
 * the source is applied, the source is parsed and its scopes recorded, the filters rewrite the
 * tree and the printer renders it, with a source map when one was asked for.
 *
 * <p>Every call gets its own {@link ConversionContext}, so one compiler may serve several threads
 * at once.
 */
public final class Compiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  static final DiagnosticType INTERNAL_ERROR =
      DiagnosticType.error("RBJS_INTERNAL_ERROR", "Internal error converting {0}: {1}");

  private final FilterRegistry filterRegistry;
  private final SourceParser parser;

  public Compiler() {
    this(FilterRegistry.withBuiltins(), new RubyParser());
  }

  public Compiler(FilterRegistry filterRegistry, SourceParser parser) {
    this.filterRegistry = checkNotNull(filterRegistry);
    this.parser = checkNotNull(parser);
  }

  public FilterRegistry getFilterRegistry() {
    return filterRegistry;
  }

  /**
   * Converts one source file.
   *
   * @throws ConfigurationException if the options or the magic comment name something unknown.
   *     Nothing is parsed in that case.
   * @throws ConversionException if the source cannot be parsed, a filter fails or the tree holds
   *     something the printer cannot render
   */
  public ConversionResult convert(String source, ConversionOptions options) {
    checkNotNull(source);
    ConversionOptions effective = prepareOptions(options);
    MagicComments.apply(source, effective);
    effective.validate();
    ImmutableList<Filter> filters = filterRegistry.resolve(effective.getFilters());
    return run(effective, filters, () -> parse(source, effective.getSourceFileName()));
  }

  /**
   * Converts a tree produced by any parser. Magic comments are not looked for, since the source
   * text may not be at hand.
   */
  public ConversionResult convertTree(ParseResult tree, ConversionOptions options) {
    checkNotNull(tree);
    ConversionOptions effective = prepareOptions(options);
    ImmutableList<Filter> filters = filterRegistry.resolve(effective.getFilters());
    return run(effective, filters, () -> tree.withRoot(ScopeAnalyzer.process(tree.root())));
  }

  /** Parses {@code source} and records the scope of every local, without converting. */
  public ParseResult parse(String source, @Nullable String sourceName) {
    SourceFile file = SourceFile.fromCode(nullToEmpty(sourceName), source);
    ParseResult result = parser.parse(file);
    return result.withRoot(ScopeAnalyzer.process(result.root()));
  }

  private static ConversionOptions prepareOptions(ConversionOptions options) {
    ConversionOptions copy = checkNotNull(options).copy();
    copy.validate();
    return copy;
  }

  private interface TreeSupplier {
    ParseResult get();
  }

  private ConversionResult run(
      ConversionOptions options, ImmutableList<Filter> filters, TreeSupplier treeSupplier) {
    String sourceName = options.getSourceFileName();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Converting "
              + (sourceName == null ? "<input>" : sourceName)
              + " at "
              + options.getLanguageMode()
              + " with filters ["
              + Joiner.on(", ").join(filters)
              + "]");
    }
    LoggerErrorManager errorManager = new LoggerErrorManager(logger);
    ConversionContext context = new ConversionContext(options, errorManager);
    try {
      ParseResult tree = treeSupplier.get();
      Node root = new FilterPipeline(filters, context).run(tree.root());
      SourceMapGeneratorV3 sourceMap = newSourceMap(options, tree);
      CodePrinter.Builder printer =
          new CodePrinter.Builder(context, root)
              .setPrettyPrint(prettyPrint(options, tree))
              .setComments(tree.comments());
      if (sourceMap != null) {
        printer.setSourceMap(sourceMap);
      }
      String text = printer.build();
      errorManager.generateReport();
      return ConversionResult.create(
          text,
          sourceMap == null ? null : sourceMap.toJsonString(generatedFileName(sourceName)),
          errorManager.getDiagnostics());
    } catch (ConversionException e) {
      logger.log(Level.WARNING, "Conversion failed: " + e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Conversion failed", e);
      throw new ConversionException(
          Diagnostic.make(
              INTERNAL_ERROR, sourceName == null ? "<input>" : sourceName, String.valueOf(e)),
          e);
    }
  }

  private static boolean prettyPrint(ConversionOptions options, ParseResult tree) {
    switch (options.getFormat()) {
      case PRETTY:
        return true;
      case ONE_LINE:
        return false;
      case AUTO:
      default:
        return tree.sourceFile().getLineCount() > 1;
    }
  }

  private static @Nullable SourceMapGeneratorV3 newSourceMap(
      ConversionOptions options, ParseResult tree) {
    if (!options.shouldCreateSourceMap()) {
      return null;
    }
    SourceMapGeneratorV3 generator = new SourceMapGeneratorV3();
    if (options.shouldIncludeSourcesContent()) {
      generator.addSourcesContent(nullToEmpty(options.getSourceFileName()),
          tree.sourceFile().getCode());
    }
    return generator;
  }

  /** {@code lib/a.rb} becomes {@code lib/a.js}. */
  static String generatedFileName(@Nullable String sourceName) {
    if (isNullOrEmpty(sourceName)) {
      return "";
    }
    int slash = sourceName.lastIndexOf('/');
    int dot = sourceName.lastIndexOf('.');
    String stem = dot > slash ? sourceName.substring(0, dot) : sourceName;
    return stem + ".js";
  }
}
