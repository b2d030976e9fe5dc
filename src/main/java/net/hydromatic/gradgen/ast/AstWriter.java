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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    if (op == Op.NEGATE && a.toString().startsWith("-")) {
      // "-(-x)", not "--x"
      return append("(").append(a, 0, 0).append(")");
    }
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a conditional expression, "c ? a : b". */
  public AstWriter conditional(int left, AstNode condition, AstNode ifTrue,
      AstNode ifFalse, int right) {
    final Op op = Op.CONDITIONAL;
    if (left > op.left || op.right < right) {
      return append("(")
          .conditional(0, condition, ifTrue, ifFalse, 0)
          .append(")");
    }
    condition.unparse(this, left, op.left);
    append(" ? ");
    ifTrue.unparse(this, 0, 0);
    append(" : ");
    ifFalse.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a receiver followed by a postfix operator, "x.y" or "x[i]". The
   * receiver is parenthesized unless it binds at least as tightly.
   */
  public AstWriter receiver(AstNode receiver) {
    return receiver.unparse(this, 0, Op.DOT.left);
  }

  /** Appends a list of nodes separated by commas, between delimiters. */
  public AstWriter list(String open, List<? extends AstNode> nodes,
      String close) {
    append(open);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    return append(close);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
