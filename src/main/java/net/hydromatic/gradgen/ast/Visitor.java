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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.ArrayExp array) {
    array.args.forEach(this::accept);
  }

  // calls

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.MethodCall methodCall) {
    methodCall.receiver.accept(this);
    methodCall.args.forEach(this::accept);
  }

  protected void visit(Ast.Member member) {
    member.receiver.accept(this);
  }

  protected void visit(Ast.Index index) {
    index.receiver.accept(this);
    index.index.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.Conditional conditional) {
    conditional.condition.accept(this);
    conditional.ifTrue.accept(this);
    conditional.ifFalse.accept(this);
  }
}

// End Visitor.java
