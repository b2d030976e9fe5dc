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
package net.hydromatic.gradgen.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sub-types of {@link AstNode}.
 *
 * <p>Operators carry Java's precedence. An operator that Java does not
 * overload for tensors also carries the name of the runtime method that it
 * is lowered to, for example {@code a * b} becomes {@code times(a, b)}.
 */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),

  // value constructors
  /** Brace list, "{1, 2}". */
  LIST(true),
  /** Java array creation, "new long[] {1, 2}". */
  ARRAY(true),

  // calls and postfix operators
  APPLY(true),
  DOT(".", 15),
  INDEX("[", 15),

  NEGATE("-", 14, false, "neg"),
  NOT("!", 14, false, "not"),
  TIMES(" * ", 12, true, "times"),
  DIVIDE(" / ", 12, true, "divide"),
  MOD(" % ", 12, true, "remainder"),
  PLUS(" + ", 11, true, "plus"),
  MINUS(" - ", 11, true, "minus"),
  LT(" < ", 9, true, "lt"),
  LE(" <= ", 9, true, "le"),
  GT(" > ", 9, true, "gt"),
  GE(" >= ", 9, true, "ge"),
  EQ(" == ", 8, true, "eq"),
  NE(" != ", 8, true, "ne"),
  ANDALSO(" && ", 4, true, "and"),
  ORELSE(" || ", 3, true, "or"),
  CONDITIONAL(" ? ", 2, false, null);

  /** Padded name, e.g. " * ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Name of the runtime method that implements this operator, or null. */
  public final @Nullable String methodName;

  Op(boolean atom) {
    this("", 99, 99, null);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true, null);
  }

  Op(String padded, int precedence, boolean leftAssociative,
      @Nullable String methodName) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0),
        methodName);
  }

  Op(String padded, int left, int right, @Nullable String methodName) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.methodName = methodName;
  }
}

// End Op.java
