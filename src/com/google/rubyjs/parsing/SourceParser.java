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

package com.google.rubyjs.parsing;

/**
 * Turns source text into the canonical node vocabulary.
 *
 * <p>Implementations either return a complete tree or throw; they never hand back a partial
 * result. Different implementations are expected to produce structurally equal trees for the same
 * program.
 */
public interface SourceParser {

  /**
   * Parses a file.
   *
   * @throws ParseException if the text is malformed, with the position of the problem
   */
  ParseResult parse(SourceFile file);
}
