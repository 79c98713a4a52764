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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.rubyjs.ast.Comment;
import com.google.rubyjs.ast.Node;

/** The output of a {@link SourceParser}: the tree, its comments and the file they came from. */
@AutoValue
public abstract class ParseResult {

  public abstract Node root();

  /** Comments in source order. */
  public abstract ImmutableList<Comment> comments();

  public abstract SourceFile sourceFile();

  public static ParseResult create(Node root, ImmutableList<Comment> comments, SourceFile file) {
    return new AutoValue_ParseResult(root, comments, file);
  }

  public ParseResult withRoot(Node newRoot) {
    return create(newRoot, comments(), sourceFile());
  }
}
