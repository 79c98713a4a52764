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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A stack of lexical scopes: which locals and constants are declared, and which classes and
 * modules enclose the current position.
 *
 * <p>Blocks see the locals of the scopes around them. Methods, classes and modules start with a
 * clean set of locals, as in Ruby.
 */
public final class ScopeTracker {

  /** The construct that opened a scope. */
  public enum Kind {
    PROGRAM,
    CLASS,
    MODULE,
    METHOD,
    BLOCK;

    boolean isolatesLocals() {
      return this != BLOCK;
    }
  }

  private static final Splitter PATH_SPLITTER = Splitter.on("::").omitEmptyStrings();

  private static final class Frame {
    final Kind kind;
    final @Nullable String name;
    final Set<String> locals = new LinkedHashSet<>();
    final Set<String> constants = new LinkedHashSet<>();

    Frame(Kind kind, @Nullable String name) {
      this.kind = kind;
      this.name = name;
    }
  }

  private final Deque<Frame> frames = new ArrayDeque<>();

  public ScopeTracker() {
    frames.push(new Frame(Kind.PROGRAM, null));
  }

  public void enterScope(Kind kind) {
    enterScope(kind, null);
  }

  /**
   * Opens a scope. {@code name} is the class or module name (possibly qualified, such as {@code
   * Foo::Bar}) for CLASS and MODULE scopes, and ignored otherwise.
   */
  public void enterScope(Kind kind, @Nullable String name) {
    checkState(kind != Kind.PROGRAM, "the program scope is implicit");
    frames.push(new Frame(kind, name));
  }

  public void exitScope() {
    checkState(frames.size() > 1, "no scope to exit");
    frames.pop();
  }

  public Kind currentKind() {
    return frames.peek().kind;
  }

  /** The number of scopes entered and not yet exited. */
  public int depth() {
    return frames.size() - 1;
  }

  public void declareLocal(String name) {
    frames.peek().locals.add(name);
  }

  /** Whether {@code name} is a local visible from the current scope. */
  public boolean isLocal(String name) {
    for (Frame frame : frames) {
      if (frame.locals.contains(name)) {
        return true;
      }
      if (frame.kind.isolatesLocals()) {
        return false;
      }
    }
    return false;
  }

  /** Whether {@code name} was declared in the innermost scope itself, not an enclosing one. */
  public boolean isDeclaredInCurrentScope(String name) {
    return frames.peek().locals.contains(name);
  }

  /** Locals of the innermost scope, in declaration order. */
  public ImmutableSet<String> currentLocals() {
    return ImmutableSet.copyOf(frames.peek().locals);
  }

  public void declareConstant(String name) {
    frames.peek().constants.add(name);
  }

  /** Whether a constant of this name was assigned in the current scope or an enclosing one. */
  public boolean isConstant(String name) {
    for (Frame frame : frames) {
      if (frame.constants.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Names of the enclosing classes and modules, outermost first. */
  public ImmutableList<String> currentClassPath() {
    ImmutableList.Builder<String> path = ImmutableList.builder();
    Iterator<Frame> outermostFirst = frames.descendingIterator();
    while (outermostFirst.hasNext()) {
      Frame frame = outermostFirst.next();
      if ((frame.kind == Kind.CLASS || frame.kind == Kind.MODULE) && frame.name != null) {
        path.addAll(PATH_SPLITTER.split(frame.name));
      }
    }
    return path.build();
  }

  /** Whether the innermost scope is a class or module body. */
  public boolean isInClassBody() {
    Kind kind = currentKind();
    return kind == Kind.CLASS || kind == Kind.MODULE;
  }
}
