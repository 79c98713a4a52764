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

package com.google.rubyjs.ast;

import com.google.auto.value.AutoValue;

/**
 * A source comment. Comments are kept apart from the tree and matched to statements by position
 * when code is printed.
 */
@AutoValue
public abstract class Comment {

  /** Where the comment sat relative to code on its line. */
  public enum Placement {
    /** Nothing but whitespace precedes the comment on its line. */
    OWN_LINE,
    /** The comment follows code on the same line. */
    END_OF_LINE
  }

  /** The comment text without the leading marker or surrounding whitespace. */
  public abstract String text();

  public abstract SourceRange range();

  public abstract Placement placement();

  public static Comment create(String text, SourceRange range, Placement placement) {
    return new AutoValue_Comment(text, range, placement);
  }
}
