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

/**
 * The options of a conversion are invalid: an unknown filter name, an unknown language level, or
 * a malformed magic comment. Raised before any parsing takes place.
 */
public final class ConfigurationException extends ConversionException {
  private static final long serialVersionUID = 1L;

  static final DiagnosticType INVALID_OPTION =
      DiagnosticType.error("RBJS_INVALID_OPTION", "Invalid configuration: {0}");

  public ConfigurationException(String message) {
    super(Diagnostic.make(INVALID_OPTION, message));
  }
}
