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

import static java.util.Objects.requireNonNull;

/**
 * Node of a formula expression.
 *
 * <p>A node prints as Java source: {@link #toString()} writes the expression
 * with the parentheses that Java's operator precedence needs, and no others.
 */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /** Returns this expression as Java source. */
  @Override
  public final String toString() {
    return unparse(new AstWriter(), 0, 0).toString();
  }

  /**
   * Writes this expression. {@code left} and {@code right} are the binding
   * strengths of the operators either side; if either binds tighter than
   * this node's operator, the writer encloses it in parentheses.
   */
  abstract AstWriter unparse(AstWriter w, int left, int right);

  /** Returns the result of a shuttle rewriting this node. */
  public abstract AstNode accept(Shuttle shuttle);

  /** Calls a visitor's method for this type of node. */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
