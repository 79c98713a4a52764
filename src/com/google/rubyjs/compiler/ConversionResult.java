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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** What a successful conversion produced. */
@AutoValue
public abstract class ConversionResult {

  /** The JavaScript program. */
  public abstract String text();

  /** A source map in Revision 3 JSON form, or null when none was requested. */
  public abstract @Nullable String sourceMap();

  /** Warnings reported while converting, in the order they were found. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  static ConversionResult create(
      String text, @Nullable String sourceMap, ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_ConversionResult(text, sourceMap, diagnostics);
  }
}
