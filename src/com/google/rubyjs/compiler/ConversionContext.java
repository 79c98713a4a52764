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

import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.Node;
import com.google.rubyjs.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The state of one conversion, handed to every filter and to the code generator.
 *
 * <p>A context is created by {@link Compiler} for each call and is never shared between
 * conversions. Filters keep anything that must survive between two handler calls here, never in
 * their own fields.
 */
public final class ConversionContext {

  private final ConversionOptions options;
  private final ErrorManager errorManager;
  private final ScopeTracker scope = new ScopeTracker();
  private final List<Node> prepended = new ArrayList<>();

  ConversionContext(ConversionOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public ConversionOptions getOptions() {
    return options;
  }

  public LanguageMode getLanguageMode() {
    return options.getLanguageMode();
  }

  /** The name of the file being converted, or null for anonymous input. */
  public @Nullable String getSourceName() {
    return options.getSourceFileName();
  }

  /** The scopes enclosing the node currently being filtered. */
  public ScopeTracker scope() {
    return scope;
  }

  ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Reports a diagnostic at the position of {@code n}.
   *
   * @throws ConversionException if the diagnostic is an error, or a warning under strict mode
   */
  public void report(Node n, DiagnosticType type, Object... arguments) {
    Diagnostic diagnostic = Diagnostic.make(getSourceName(), n, type, arguments);
    CheckLevel level = type.level;
    if (level == CheckLevel.WARNING && options.isStrict()) {
      level = CheckLevel.ERROR;
    }
    errorManager.report(level, diagnostic);
    if (level == CheckLevel.ERROR) {
      throw new ConversionException(diagnostic.withLevel(level));
    }
  }

  /**
   * Asks for a statement to be placed at the top of the program. Requests keep their order and
   * repeated requests for an equal statement are dropped.
   */
  public void prepend(Node statement) {
    if (!prepended.contains(statement)) {
      prepended.add(statement);
    }
  }

  public ImmutableList<Node> getPrepended() {
    return ImmutableList.copyOf(prepended);
  }

  /** Whether filters must leave calls to {@code method} alone. */
  public boolean isExcluded(String method) {
    return options.getExcludedMethods().contains(method);
  }

  /** Whether a filter was asked to rewrite {@code method}, which it otherwise would not. */
  public boolean isIncluded(String method) {
    return options.getIncludedMethods().contains(method);
  }

  boolean isNodeTypeExcluded(String filterName, Token type) {
    return options.isNodeTypeExcluded(filterName, type);
  }
}
