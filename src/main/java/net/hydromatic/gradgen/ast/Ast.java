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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.ObjIntConsumer;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Calls an action for each argument (child expression). */
    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Identifier, possibly qualified, such as "self" or "Declarations.add". */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /**
   * Literal, such as "1", "0.5", "true" or "\"sum\"".
   *
   * <p>Keeps the text as written, so that it prints unchanged.
   */
  public static class Literal extends Exp {
    public final String text;

    Literal(Pos pos, Op op, String text) {
      super(pos, op);
      this.text = requireNonNull(text);
      checkArgument(op == Op.BOOL_LITERAL
          || op == Op.INT_LITERAL
          || op == Op.REAL_LITERAL
          || op == Op.STRING_LITERAL);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Brace list, such as "{0, 1}" or "{}". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("{", args, "}");
    }

    public ListExp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new ListExp(pos, ImmutableList.copyOf(args));
    }
  }

  /** Array creation, such as "new long[] {0, 1}". */
  public static class ArrayExp extends Exp {
    /** Element type, such as "long". */
    public final String elementType;
    public final List<Exp> args;

    ArrayExp(Pos pos, String elementType, ImmutableList<Exp> args) {
      super(pos, Op.ARRAY);
      this.elementType = requireNonNull(elementType);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("new ").append(elementType).list("[] {", args, "}");
    }

    public ArrayExp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new ArrayExp(pos, elementType, ImmutableList.copyOf(args));
    }
  }

  /**
   * Call to a named function, such as "sum(self, 0)".
   *
   * <p>The name may be qualified, such as "at::sum" in a formula, or
   * "Declarations.sum" after rewriting.
   */
  public static class Call extends Exp {
    public final String name;
    public final List<Exp> args;

    Call(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).list("(", args, ")");
    }

    /**
     * Creates a copy of this {@code Call} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Call copy(String name, List<Exp> args) {
      return this.name.equals(name) && this.args.equals(args)
          ? this
          : new Call(pos, name, ImmutableList.copyOf(args));
    }
  }

  /** Call to a method of an expression, such as "self.sizes()". */
  public static class MethodCall extends Exp {
    public final Exp receiver;
    public final String name;
    public final List<Exp> args;

    MethodCall(Pos pos, Exp receiver, String name, ImmutableList<Exp> args) {
      super(pos, Op.DOT);
      this.receiver = requireNonNull(receiver);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(receiver, 0);
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i + 1);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.receiver(receiver).append(".").append(name)
          .list("(", args, ")");
    }

    public MethodCall copy(Exp receiver, String name, List<Exp> args) {
      return this.receiver.equals(receiver)
          && this.name.equals(name)
          && this.args.equals(args)
          ? this
          : new MethodCall(pos, receiver, name, ImmutableList.copyOf(args));
    }
  }

  /** Access to a member of an expression, such as "fwd_result.weight". */
  public static class Member extends Exp {
    public final Exp receiver;
    public final String name;

    Member(Pos pos, Exp receiver, String name) {
      super(pos, Op.DOT);
      this.receiver = requireNonNull(receiver);
      this.name = requireNonNull(name);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(receiver, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.receiver(receiver).append(".").append(name);
    }

    public Member copy(Exp receiver) {
      return this.receiver.equals(receiver)
          ? this
          : new Member(pos, receiver, name);
    }
  }

  /** Indexing, such as "grad_input_mask[0]". */
  public static class Index extends Exp {
    public final Exp receiver;
    public final Exp index;

    Index(Pos pos, Exp receiver, Exp index) {
      super(pos, Op.INDEX);
      this.receiver = requireNonNull(receiver);
      this.index = requireNonNull(index);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(receiver, 0);
      action.accept(index, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.receiver(receiver).append("[").append(index, 0, 0).append("]");
    }

    public Index copy(Exp receiver, Exp index) {
      return this.receiver.equals(receiver) && this.index.equals(index)
          ? this
          : new Index(pos, receiver, index);
    }
  }

  /** Call to a prefix operator, such as "-x" or "!b". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    public PrefixCall copy(Exp a) {
      return this.a.equals(a) ? this : new PrefixCall(pos, op, a);
    }
  }

  /** Call to an infix operator, such as "a * b". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this {@code InfixCall} with given contents, or
     * {@code this} if the contents are the same.
     */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : new InfixCall(pos, op, a0, a1);
    }
  }

  /** Conditional expression, "c ? a : b". */
  public static class Conditional extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Conditional(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.CONDITIONAL);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(condition, 0);
      action.accept(ifTrue, 1);
      action.accept(ifFalse, 2);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.conditional(left, condition, ifTrue, ifFalse, right);
    }

    public Conditional copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return this.condition.equals(condition)
          && this.ifTrue.equals(ifTrue)
          && this.ifFalse.equals(ifFalse)
          ? this
          : new Conditional(pos, condition, ifTrue, ifFalse);
    }
  }
}

// End Ast.java
