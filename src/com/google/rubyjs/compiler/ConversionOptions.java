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

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Options for a conversion.
 *
 * <p>The options are mutable. {@link Compiler} takes a copy at the start of every conversion, so
 * one instance may be shared by concurrent callers as long as nobody changes it meanwhile.
 */
public final class ConversionOptions {

  /** How string literals are quoted. */
  public enum QuoteStyle {
    /** Double quotes, unless the string contains more double quotes than single ones. */
    AUTO,
    SINGLE,
    DOUBLE
  }

  /** Line layout of the output. */
  public enum Format {
    /** {@link #PRETTY} when the source has more than one line, {@link #ONE_LINE} otherwise. */
    AUTO,
    PRETTY,
    ONE_LINE
  }

  /** How Ruby {@code ==} is rendered. */
  public enum Comparison {
    /** {@code ==} and {@code !=}. */
    EQUALITY,
    /** {@code ===} and {@code !==}. */
    IDENTITY
  }

  /** How Ruby {@code ||} and {@code ||=} are rendered. */
  public enum OrOperator {
    LOGICAL,
    /** {@code ??} and {@code ??=}; needs ES2020 and ES2021 respectively. */
    NULLISH
  }

  private LanguageMode languageMode = LanguageMode.DEFAULT;
  private final List<String> filters = new ArrayList<>();
  private @Nullable String sourceFileName;
  private boolean strict = false;

  private QuoteStyle quoteStyle = QuoteStyle.AUTO;
  private boolean semicolons = true;
  private Format format = Format.AUTO;
  private int lineWidth = 80;
  private Comparison comparison = Comparison.EQUALITY;
  private OrOperator orOperator = OrOperator.LOGICAL;
  private boolean underscoredPrivate = false;

  private boolean createSourceMap = false;
  private boolean includeSourcesContent = false;

  private final Set<String> excludedMethods = new LinkedHashSet<>();
  private final Set<String> includedMethods = new LinkedHashSet<>();
  private final SetMultimap<String, Token> excludedNodeTypes = LinkedHashMultimap.create();

  public ConversionOptions() {}

  /** Returns an independent copy of these options. */
  public ConversionOptions copy() {
    ConversionOptions copy = new ConversionOptions();
    copy.languageMode = languageMode;
    copy.filters.addAll(filters);
    copy.sourceFileName = sourceFileName;
    copy.strict = strict;
    copy.quoteStyle = quoteStyle;
    copy.semicolons = semicolons;
    copy.format = format;
    copy.lineWidth = lineWidth;
    copy.comparison = comparison;
    copy.orOperator = orOperator;
    copy.underscoredPrivate = underscoredPrivate;
    copy.createSourceMap = createSourceMap;
    copy.includeSourcesContent = includeSourcesContent;
    copy.excludedMethods.addAll(excludedMethods);
    copy.includedMethods.addAll(includedMethods);
    copy.excludedNodeTypes.putAll(excludedNodeTypes);
    return copy;
  }

  /**
   * Checks option combinations that no conversion could honor.
   *
   * @throws ConfigurationException describing the first problem found
   */
  public void validate() {
    if (lineWidth < 0) {
      throw new ConfigurationException("line width must not be negative: " + lineWidth);
    }
    for (String filter : filters) {
      if (filter.trim().isEmpty()) {
        throw new ConfigurationException("empty filter name");
      }
    }
    Set<String> both = new LinkedHashSet<>(excludedMethods);
    both.retainAll(includedMethods);
    if (!both.isEmpty()) {
      throw new ConfigurationException("methods both included and excluded: " + both);
    }
  }

  public LanguageMode getLanguageMode() {
    return languageMode;
  }

  public void setLanguageMode(LanguageMode languageMode) {
    this.languageMode = checkNotNull(languageMode);
  }

  /** Filter names, in the order the filters run. */
  public ImmutableList<String> getFilters() {
    return ImmutableList.copyOf(filters);
  }

  public void setFilters(List<String> names) {
    filters.clear();
    for (String name : names) {
      addFilter(name);
    }
  }

  /** Appends a filter to the end of the list, unless it is already present. */
  public void addFilter(String name) {
    checkNotNull(name);
    for (String existing : filters) {
      if (Ascii.equalsIgnoreCase(existing, name)) {
        return;
      }
    }
    filters.add(name);
  }

  /** The file name used in diagnostics and in the {@code sources} of the source map. */
  public @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  public void setSourceFileName(@Nullable String sourceFileName) {
    this.sourceFileName = sourceFileName;
  }

  /** Whether warnings abort the conversion. */
  public boolean isStrict() {
    return strict;
  }

  public void setStrict(boolean strict) {
    this.strict = strict;
  }

  public QuoteStyle getQuoteStyle() {
    return quoteStyle;
  }

  public void setQuoteStyle(QuoteStyle quoteStyle) {
    this.quoteStyle = checkNotNull(quoteStyle);
  }

  public boolean getSemicolons() {
    return semicolons;
  }

  public void setSemicolons(boolean semicolons) {
    this.semicolons = semicolons;
  }

  public Format getFormat() {
    return format;
  }

  public void setFormat(Format format) {
    this.format = checkNotNull(format);
  }

  public int getLineWidth() {
    return lineWidth;
  }

  /** Sets the line length after which the printer breaks lines where it can. 0 disables this. */
  public void setLineWidth(int lineWidth) {
    this.lineWidth = lineWidth;
  }

  public Comparison getComparison() {
    return comparison;
  }

  public void setComparison(Comparison comparison) {
    this.comparison = checkNotNull(comparison);
  }

  public OrOperator getOrOperator() {
    return orOperator;
  }

  public void setOrOperator(OrOperator orOperator) {
    this.orOperator = checkNotNull(orOperator);
  }

  /**
   * Whether instance variables render as {@code this._name} even at levels that have {@code
   * #private} fields.
   */
  public boolean isUnderscoredPrivate() {
    return underscoredPrivate;
  }

  public void setUnderscoredPrivate(boolean underscoredPrivate) {
    this.underscoredPrivate = underscoredPrivate;
  }

  public boolean shouldCreateSourceMap() {
    return createSourceMap;
  }

  public void setCreateSourceMap(boolean createSourceMap) {
    this.createSourceMap = createSourceMap;
  }

  public boolean shouldIncludeSourcesContent() {
    return includeSourcesContent;
  }

  /** Whether the source map embeds the original text. Only meaningful with a source map. */
  public void setIncludeSourcesContent(boolean includeSourcesContent) {
    this.includeSourcesContent = includeSourcesContent;
  }

  /** Ruby methods that filters must leave alone. */
  @CanIgnoreReturnValue
  public ConversionOptions exclude(String... methods) {
    excludedMethods.addAll(Arrays.asList(methods));
    return this;
  }

  /** Ruby methods that filters only rewrite when asked to. */
  @CanIgnoreReturnValue
  public ConversionOptions include(String... methods) {
    includedMethods.addAll(Arrays.asList(methods));
    return this;
  }

  public ImmutableSet<String> getExcludedMethods() {
    return ImmutableSet.copyOf(excludedMethods);
  }

  public ImmutableSet<String> getIncludedMethods() {
    return ImmutableSet.copyOf(includedMethods);
  }

  /** Makes the named filter pass nodes of the given types through untouched. */
  @CanIgnoreReturnValue
  public ConversionOptions excludeNodeTypes(String filterName, Token... types) {
    excludedNodeTypes.putAll(Ascii.toLowerCase(filterName), Arrays.asList(types));
    return this;
  }

  public boolean isNodeTypeExcluded(String filterName, Token type) {
    return excludedNodeTypes.containsEntry(Ascii.toLowerCase(filterName), type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("languageMode", languageMode)
        .add("filters", filters)
        .add("sourceFileName", sourceFileName)
        .add("strict", strict)
        .add("format", format)
        .toString();
  }
}
