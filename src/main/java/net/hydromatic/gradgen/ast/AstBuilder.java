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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a simple identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, Boolean.toString(b));
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.INT_LITERAL, text);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal realLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, text);
  }

  /** Creates a string literal; the text includes the quotes. */
  public Ast.Literal stringLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, text);
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.ArrayExp array(Pos pos, String elementType,
      List<? extends Ast.Exp> args) {
    return new Ast.ArrayExp(pos, elementType, ImmutableList.copyOf(args));
  }

  public Ast.Call call(Pos pos, String name, List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.MethodCall methodCall(Pos pos, Ast.Exp receiver, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.MethodCall(pos, receiver, name, ImmutableList.copyOf(args));
  }

  public Ast.Member member(Pos pos, Ast.Exp receiver, String name) {
    return new Ast.Member(pos, receiver, name);
  }

  public Ast.Index index(Pos pos, Ast.Exp receiver, Ast.Exp index) {
    return new Ast.Index(pos, receiver, index);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.Conditional conditional(Pos pos, Ast.Exp condition,
      Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.Conditional(pos, condition, ifTrue, ifFalse);
  }
}

// End AstBuilder.java
