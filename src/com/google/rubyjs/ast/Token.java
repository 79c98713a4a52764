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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The node vocabulary shared by the parsers, the filters and the code generator.
 *
 * <p>Tags follow the names used by the whitequark Ruby parser, so {@code LVASGN} prints as {@code
 * lvasgn}. The meaning of each child slot is documented on the constant.
 */
public enum Token {
  // Literals.
  /** {@code (int value:Long)} */
  INT,
  /** {@code (float value:Double)} */
  FLOAT,
  /** {@code (str value:String)} */
  STR,
  /** {@code (dstr parts...)}, each part a STR or a BEGIN holding the interpolated expression. */
  DSTR,
  /** {@code (sym name:String)} */
  SYM,
  DSYM,
  /** {@code (regexp parts... (regopt flags...))} */
  REGEXP,
  REGOPT,
  NIL,
  TRUE,
  FALSE,
  SELF,
  ARRAY,
  HASH,
  /** {@code (pair key value)} */
  PAIR,
  SPLAT,
  KWSPLAT,
  IRANGE,
  ERANGE,

  // Variables.
  LVAR,
  IVAR,
  GVAR,
  CVAR,
  /** {@code (const scope-or-null name:String)} */
  CONST,
  CBASE,

  // Assignments.
  LVASGN,
  IVASGN,
  GVASGN,
  CVASGN,
  /** {@code (casgn scope-or-null name:String value)} */
  CASGN,
  /** {@code (op_asgn target op:String value)} */
  OP_ASGN,
  OR_ASGN,
  AND_ASGN,
  /** {@code (masgn (mlhs targets...) value)} */
  MASGN,
  MLHS,

  // Calls.
  /** {@code (send receiver-or-null selector:String args...)} */
  SEND,
  CSEND,
  /** {@code (block call (args ...) body-or-null)} */
  BLOCK,
  BLOCK_PASS,
  ARGS,
  ARG,
  OPTARG,
  RESTARG,
  KWARG,
  KWOPTARG,
  KWRESTARG,
  BLOCKARG,
  YIELD,
  SUPER,
  ZSUPER,

  // Logic and control flow.
  AND,
  OR,
  NOT,
  /** {@code (defined? expr)}; the tag drops the question mark. */
  DEFINED,
  /** {@code (if cond then-or-null else-or-null)} */
  IF,
  WHILE,
  UNTIL,
  WHILE_POST,
  UNTIL_POST,
  /** {@code (for (lvasgn name) iterable body)} */
  FOR,
  /** {@code (case subject whens... else-or-null)} */
  CASE,
  /** {@code (when values... body-or-null)} */
  WHEN,
  BREAK,
  NEXT,
  RETURN,
  BEGIN,
  KWBEGIN,
  /** {@code (rescue body resbodies... else-or-null)} */
  RESCUE,
  /** {@code (resbody (array classes...)-or-null (lvasgn name)-or-null body-or-null)} */
  RESBODY,
  ENSURE,

  // Definitions.
  /** {@code (def name:String (args ...) body-or-null)} */
  DEF,
  /** {@code (defs target name:String (args ...) body-or-null)} */
  DEFS,
  /** {@code (class (const ...) superclass-or-null body-or-null)} */
  CLASS,
  MODULE,
  SCLASS,
  ALIAS,

  // Synthetic nodes, only ever created by filters.
  /** A property read that never renders with parentheses: {@code (attr receiver name:String)}. */
  ATTR,
  /** A call that always renders with parentheses: {@code (call receiver name:String args...)}. */
  CALL,
  /** Returns the value of the last statement of its children. */
  AUTORETURN,
  TYPEOF,
  /** Groups statements without introducing a block. */
  HIDE;

  private static final ImmutableMap<String, Token> BY_TAG = buildTagMap();

  private static ImmutableMap<String, Token> buildTagMap() {
    ImmutableMap.Builder<String, Token> builder = ImmutableMap.builder();
    for (Token token : values()) {
      builder.put(token.tag(), token);
    }
    return builder.buildOrThrow();
  }

  /** The lower-case tag used in s-expression dumps. */
  public String tag() {
    return Ascii.toLowerCase(name());
  }

  /** Returns the token for a tag, or null if the tag is not part of the vocabulary. */
  public static @Nullable Token fromTag(String tag) {
    return BY_TAG.get(tag);
  }

  /** Whether nodes of this type can only be produced by a filter. */
  public boolean isSynthetic() {
    return switch (this) {
      case ATTR, CALL, AUTORETURN, TYPEOF, HIDE -> true;
      default -> false;
    };
  }

  /** Node types that introduce a new local variable scope. */
  public boolean isScopeRoot() {
    return switch (this) {
      case DEF, DEFS, CLASS, MODULE, SCLASS, BLOCK -> true;
      default -> false;
    };
  }

  /** Node types whose first child is an assignment target name. */
  public boolean isVariableAssignment() {
    return switch (this) {
      case LVASGN, IVASGN, GVASGN, CVASGN -> true;
      default -> false;
    };
  }

  public boolean isCallLike() {
    return switch (this) {
      case SEND, CSEND, ATTR, CALL -> true;
      default -> false;
    };
  }
}
