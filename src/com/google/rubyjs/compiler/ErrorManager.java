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

/** Receives the diagnostics of a conversion. */
public interface ErrorManager {

  /** Reports a diagnostic at the given level. Diagnostics at {@code OFF} are dropped. */
  void report(CheckLevel level, Diagnostic diagnostic);

  /** Writes out everything reported so far, followed by a summary. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  /** Every reported error and warning, in the order reported. */
  ImmutableList<Diagnostic> getDiagnostics();

  default boolean hasErrors() {
    return getErrorCount() > 0;
  }
}
