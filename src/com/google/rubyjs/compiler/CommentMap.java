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
import com.google.rubyjs.ast.Comment;
import com.google.rubyjs.ast.SourceRange;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Hands out source comments to the statements they belong to, in source order.
 *
 * <p>Every comment that starts before a statement and has not been printed yet leads that
 * statement. An end-of-line comment that follows a statement on its last line trails it. The
 * printer asks for the remaining comments once the program is done. Statements without a source
 * range never claim comments.
 */
final class CommentMap {
  /** Settings comments that only mean something to a Ruby tool or to this compiler. */
  private static final Pattern DIRECTIVE =
      Pattern.compile("^(?:rubyjs|ruby2js|frozen_string_literal|encoding|coding):.*");

  private final ImmutableList<Comment> comments;
  private int next = 0;

  CommentMap(List<Comment> comments) {
    List<Comment> sorted = new ArrayList<>();
    for (Comment comment : comments) {
      if (!DIRECTIVE.matcher(comment.text()).matches()) {
        sorted.add(comment);
      }
    }
    sorted.sort(Comparator.comparingInt(c -> c.range().startOffset()));
    this.comments = ImmutableList.copyOf(sorted);
  }

  /** The line of the first comment that {@link #takeLeading} would return, or -1. */
  int firstLeadingLine(SourceRange statement) {
    if (next < comments.size()
        && comments.get(next).range().startOffset() < statement.startOffset()) {
      return comments.get(next).range().line();
    }
    return -1;
  }

  ImmutableList<Comment> takeLeading(SourceRange statement) {
    ImmutableList.Builder<Comment> taken = ImmutableList.builder();
    while (next < comments.size()
        && comments.get(next).range().startOffset() < statement.startOffset()) {
      taken.add(comments.get(next++));
    }
    return taken.build();
  }

  ImmutableList<Comment> takeTrailing(SourceRange statement) {
    ImmutableList.Builder<Comment> taken = ImmutableList.builder();
    while (next < comments.size()) {
      Comment comment = comments.get(next);
      if (comment.placement() != Comment.Placement.END_OF_LINE
          || comment.range().line() != statement.endLine()
          || comment.range().startOffset() < statement.endOffset()) {
        break;
      }
      taken.add(comment);
      next++;
    }
    return taken.build();
  }

  ImmutableList<Comment> takeRemaining() {
    ImmutableList<Comment> rest = comments.subList(next, comments.size());
    next = comments.size();
    return rest;
  }
}
