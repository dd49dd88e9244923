/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.loopkernel.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}, and the operators that calls and generic
 * forms are printed with. */
public enum Op {
  // expressions
  ID(true),
  LITERAL(true),
  APPLY(true),
  ASSIGN(" = ", 1, false),
  GENERIC(true),

  // binary operators; a call whose callee is the operator name is printed
  // infix
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),

  // updating assignments, e.g. "s += x"; generic forms
  PLUS_ASSIGN(" += ", 1, false),
  MINUS_ASSIGN(" -= ", 1, false),
  TIMES_ASSIGN(" *= ", 1, false),
  DIVIDE_ASSIGN(" /= ", 1, false),

  // generic forms created by lowering, plus indexing
  BLOCK,
  LET,
  WHILE,
  REF,

  // kernel description
  INSTRUCTION,
  DOMAIN,
  KERNEL;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator name, e.g. "+" or "+=". Null if this is not an operator. */
  public final @Nullable String opName;

  /** Operators by {@link #opName}. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.opName != null) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded == null ? "" : padded;
    this.left = left;
    this.right = right;
    this.opName = padded == null || padded.trim().isEmpty()
        ? null
        : padded.trim();
  }

  /** Returns the name in lower case, e.g. "while". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Whether this is one of the binary operators that print infix. */
  public boolean isBinary() {
    return compareTo(TIMES) >= 0 && compareTo(NE) <= 0;
  }

  /** Whether this is an updating assignment such as "+=". */
  public boolean isUpdate() {
    return compareTo(PLUS_ASSIGN) >= 0 && compareTo(DIVIDE_ASSIGN) <= 0;
  }

  /** Returns the binary operator that an updating assignment applies;
   * for example, {@code PLUS} for {@code PLUS_ASSIGN}. */
  public Op updateOperator() {
    switch (this) {
    case PLUS_ASSIGN:
      return PLUS;
    case MINUS_ASSIGN:
      return MINUS;
    case TIMES_ASSIGN:
      return TIMES;
    case DIVIDE_ASSIGN:
      return DIVIDE;
    default:
      throw new AssertionError("not an update: " + this);
    }
  }

  /** Returns the binary operator with a given callee name, or null. */
  public static @Nullable Op binaryOp(String callee) {
    final Op op = BY_OP_NAME.get(callee);
    return op != null && op.isBinary() ? op : null;
  }

  /** Classifies the tag of a generic form. Returns {@link #GENERIC} if the
   * tag is not one of the forms that have special meaning. */
  public static Op forTag(String tag) {
    final Op op = BY_OP_NAME.get(tag);
    if (op != null && op.isUpdate()) {
      return op;
    }
    switch (tag) {
    case "block":
      return BLOCK;
    case "let":
      return LET;
    case "while":
      return WHILE;
    case "ref":
      return REF;
    default:
      return GENERIC;
    }
  }
}

// End Op.java
