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

import org.jspecify.annotations.Nullable;

/**
 * Base class of every failure that aborts a conversion. The attached {@link Diagnostic}, when
 * present, says where in the source the failure happened.
 */
public class ConversionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final @Nullable Diagnostic diagnostic;

  public ConversionException(String message) {
    super(message);
    this.diagnostic = null;
  }

  public ConversionException(Diagnostic diagnostic) {
    super(diagnostic.toString());
    this.diagnostic = diagnostic;
  }

  public ConversionException(Diagnostic diagnostic, @Nullable Throwable cause) {
    super(diagnostic.toString(), cause);
    this.diagnostic = diagnostic;
  }

  public @Nullable Diagnostic getDiagnostic() {
    return diagnostic;
  }
}
