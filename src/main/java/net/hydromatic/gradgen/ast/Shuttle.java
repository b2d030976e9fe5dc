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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each method returns its argument if neither it nor any of its
 * descendants changed.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // leaves

  protected Ast.Exp visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  // value constructors

  protected Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args));
  }

  protected Ast.Exp visit(Ast.ArrayExp array) {
    return array.copy(visitList(array.args));
  }

  // calls

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(call.name, visitList(call.args));
  }

  protected Ast.Exp visit(Ast.MethodCall methodCall) {
    return methodCall.copy(
        methodCall.receiver.accept(this),
        methodCall.name,
        visitList(methodCall.args));
  }

  protected Ast.Exp visit(Ast.Member member) {
    return member.copy(member.receiver.accept(this));
  }

  protected Ast.Exp visit(Ast.Index index) {
    return index.copy(index.receiver.accept(this), index.index.accept(this));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this), infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.Conditional conditional) {
    return conditional.copy(
        conditional.condition.accept(this),
        conditional.ifTrue.accept(this),
        conditional.ifFalse.accept(this));
  }
}

// End Shuttle.java
