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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An error manager that keeps diagnostics in the order they were reported. Subclasses decide how
 * to print them through {@link #println} and {@link #printSummary}.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, Diagnostic diagnostic) {
    switch (level) {
      case ERROR -> errorCount++;
      case WARNING -> warningCount++;
      case OFF -> {
        return;
      }
    }
    diagnostics.add(diagnostic.level() == level ? diagnostic : diagnostic.withLevel(level));
  }

  @Override
  public void generateReport() {
    for (Diagnostic diagnostic : diagnostics) {
      println(diagnostic.level(), diagnostic);
    }
    printSummary();
  }

  /** Prints one diagnostic. Called by {@link #generateReport()}. */
  public abstract void println(CheckLevel level, Diagnostic diagnostic);

  /** Prints the number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}
