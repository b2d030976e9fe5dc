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
package net.hydromatic.gradgen.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.gradgen.ast.AstBuilder.ast;
import static net.hydromatic.gradgen.util.Static.plus;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.gradgen.ast.Ast;
import net.hydromatic.gradgen.ast.Op;
import net.hydromatic.gradgen.ast.Shuttle;
import net.hydromatic.gradgen.ast.Visitor;
import net.hydromatic.gradgen.parse.FormulaParseException;
import net.hydromatic.gradgen.parse.FormulaParser;
import net.hydromatic.gradgen.table.Formula;
import net.hydromatic.gradgen.table.FormulaEntry;
import net.hydromatic.gradgen.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites the body fields of a formula into the statements of a backward
 * procedure.
 *
 * <p>Each body is parsed into a tree, rewritten by a {@link Shuttle}, and
 * printed:
 *
 * <ul>
 *   <li>calls to declared operations become calls to their bindings, and
 *       calls to helpers become calls to the helpers class, or method calls
 *       for tensor helpers such as {@code sizes()};
 *   <li>"result" and "output" become the forward result, "resultN" its Nth
 *       component, and the name of a tuple field its accessor;
 *   <li>forward arguments take their Java names;
 *   <li>brace lists become {@code long[]} arrays;
 *   <li>operators become calls to the operators class, because Java cannot
 *       overload them for tensors.
 * </ul>
 *
 * <p>A body of the form {@code training ? x : y} becomes {@code x}, and the
 * procedure throws if it is called with {@code training} false. Each
 * distinct printed expression is bound once.
 *
 * <p>Thread-safe, because it only reads the registry; each call to
 * {@link #rewrite} has its own {@link RewriteContext}.
 */
public class ExpressionRewriter {
  private static final Pattern PLACEHOLDER =
      Pattern.compile("(result|output)([0-9]+)?");
  private static final String GRADS = "grads";
  private static final String TRAINING = "training";

  private final ProcRegistry registry;
  private final String bindingsClass;
  private final String helpersClass;
  private final String operatorsClass;

  public ExpressionRewriter(ProcRegistry registry, Map<Prop, Object> map) {
    this.registry = requireNonNull(registry);
    this.bindingsClass = Prop.BINDINGS_CLASS.stringValue(map);
    this.helpersClass = Prop.HELPERS_CLASS.stringValue(map);
    this.operatorsClass = Prop.OPERATORS_CLASS.stringValue(map);
  }

  /**
   * Rewrites a formula whose forward signature has been resolved.
   *
   * @throws GenerateException if the formula cannot be generated
   */
  public BackwardProc rewrite(Formula formula, ProcSignature forward) {
    final List<String> takenNames = new ArrayList<>();
    takenNames.add(BackwardProc.GRAD);
    takenNames.add(BackwardProc.FWD_RESULT);
    takenNames.add(BackwardProc.GRAD_INPUT_MASK);
    forward.args.forEach(arg -> takenNames.add(arg.name));
    final RewriteContext cx = new RewriteContext(takenNames);

    final Set<String> outputNames = new HashSet<>();
    final List<BackwardProc.Output> outputs = new ArrayList<>();
    for (FormulaEntry entry : formula.entries) {
      if (entry.isNotImplemented()) {
        continue;
      }
      final List<ArgumentSpec> targets = new ArrayList<>();
      for (String output : entry.outputs) {
        final ArgumentSpec arg = forwardArg(forward, output);
        if (arg == null) {
          throw new GenerateException(
              GenerateException.Reason.MISSING_DEPENDENCY,
              "output '" + output + "' is not an argument of '"
                  + forward.originalName + "'");
        }
        if (!outputNames.add(output)) {
          throw new GenerateException(
              GenerateException.Reason.MALFORMED_FORMULA,
              "output '" + output + "' occurs more than once");
        }
        targets.add(arg);
      }
      rewriteEntry(cx, forward, entry, targets, outputs);
    }
    if (outputs.isEmpty()) {
      throw new GenerateException(GenerateException.Reason.NOT_IMPLEMENTED,
          "no gradient is implemented");
    }
    return new BackwardProc(formula.header, forward, cx.guardCondition(),
        cx.mask(), cx.statements(), outputs);
  }

  private void rewriteEntry(RewriteContext cx, ProcSignature forward,
      FormulaEntry entry, List<ArgumentSpec> targets,
      List<BackwardProc.Output> outputs) {
    final Ast.Exp exp;
    try {
      exp = FormulaParser.parseExpression(entry.expression);
    } catch (FormulaParseException e) {
      throw new GenerateException(GenerateException.Reason.MALFORMED_FORMULA,
          "cannot parse '" + entry.expression + "': " + e);
    }
    checkGrads(exp);
    checkCalls(exp);

    Ast.Exp body = exp;
    final Rewriter rewriter = new Rewriter(cx, forward);
    if (body instanceof Ast.Conditional
        && isId(((Ast.Conditional) body).condition, TRAINING)) {
      final Ast.Conditional conditional = (Ast.Conditional) body;
      final Ast.Exp condition = conditional.condition.accept(rewriter);
      cx.guard(ast.prefixCall(condition.pos, Op.NOT, condition).toString());
      body = conditional.ifTrue;
    }

    if (targets.size() == 1) {
      final String value =
          cx.bind(body.accept(rewriter).toString(), targets.get(0).name);
      outputs.add(
          new BackwardProc.Output(targets.get(0).name, targets.get(0).type,
              value));
      return;
    }

    final ReturnShape tuple = tupleShape(body, entry);
    final String value =
        cx.bind(body.accept(rewriter).toString(), targets.get(0).name);
    for (int i = 0; i < targets.size(); i++) {
      final ReturnShape.Field field = tuple.field(i);
      if (field == null) {
        throw new GenerateException(
            GenerateException.Reason.UNSUPPORTED_TUPLE_SHAPE,
            targets.size() + " outputs but " + tuple + " has "
                + tuple.fields.size() + " fields");
      }
      outputs.add(
          new BackwardProc.Output(targets.get(i).name, targets.get(i).type,
              value + "." + field.name + "()"));
    }
  }

  /** Returns the forward argument with a given name in the tables. */
  private static @Nullable ArgumentSpec forwardArg(ProcSignature forward,
      String originalName) {
    for (ArgumentSpec arg : forward.args) {
      if (arg.originalName.equals(originalName)) {
        return arg;
      }
    }
    return null;
  }

  private static boolean isId(Ast.Exp exp, String name) {
    return exp instanceof Ast.Id && ((Ast.Id) exp).name.equals(name);
  }

  /** Throws if an expression refers to the gradients of several outputs. */
  private static void checkGrads(Ast.Exp exp) {
    exp.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Id id) {
            if (id.name.equals(GRADS)) {
              throw new GenerateException(
                  GenerateException.Reason.UNSUPPORTED_MULTI_GRAD_SHAPE,
                  "refers to '" + GRADS + "'");
            }
          }
        });
  }

  /** Throws if an expression calls something that is not registered. */
  private void checkCalls(Ast.Exp exp) {
    exp.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Call call) {
            check(call.name);
            super.visit(call);
          }

          @Override
          protected void visit(Ast.MethodCall methodCall) {
            check(methodCall.name);
            super.visit(methodCall);
          }

          private void check(String name) {
            if (registry.lookupCallable(name) == null) {
              throw new GenerateException(
                  GenerateException.Reason.MISSING_DEPENDENCY,
                  "no procedure named '" + name + "'");
            }
          }
        });
  }

  /**
   * Returns the tuple that an expression returns; the expression must be a
   * call to an operation that returns a tuple.
   */
  private ReturnShape tupleShape(Ast.Exp exp, FormulaEntry entry) {
    final String name;
    if (exp instanceof Ast.Call) {
      name = ((Ast.Call) exp).name;
    } else if (exp instanceof Ast.MethodCall) {
      name = ((Ast.MethodCall) exp).name;
    } else {
      name = null;
    }
    final ProcSignature signature =
        name == null ? null : registry.lookupCallable(name);
    if (signature == null || !signature.returns.isTuple()) {
      throw new GenerateException(
          GenerateException.Reason.UNSUPPORTED_TUPLE_SHAPE,
          "outputs " + entry.outputs + " but '" + exp
              + "' does not return a tuple");
    }
    return signature.returns;
  }

  /** Shuttle that rewrites one body. */
  private class Rewriter extends Shuttle {
    private final RewriteContext cx;
    private final ProcSignature forward;

    Rewriter(RewriteContext cx, ProcSignature forward) {
      this.cx = cx;
      this.forward = forward;
    }

    private Ast.Exp fwdResult(Ast.Exp exp) {
      return ast.id(exp.pos, BackwardProc.FWD_RESULT);
    }

    private Ast.Exp accessor(Ast.Exp exp, ReturnShape.Field field) {
      return ast.methodCall(exp.pos, fwdResult(exp), field.name,
          ImmutableList.of());
    }

    @Override
    protected Ast.Exp visit(Ast.Id id) {
      final String name = id.name;
      if (name.equals(BackwardProc.GRAD)) {
        return id;
      }
      if (name.equals(BackwardProc.GRAD_INPUT_MASK)) {
        cx.addMask();
        return id;
      }
      final Matcher matcher = PLACEHOLDER.matcher(name);
      if (matcher.matches()) {
        if (matcher.group(2) == null) {
          return fwdResult(id);
        }
        final int i = Integer.parseInt(matcher.group(2));
        final ReturnShape returns = forward.returns;
        if (!returns.isTuple() && i == 0) {
          return fwdResult(id);
        }
        final ReturnShape.Field field = returns.field(i);
        if (field == null) {
          throw new GenerateException(
              GenerateException.Reason.UNSUPPORTED_TUPLE_SHAPE,
              "'" + name + "' but forward result is " + returns);
        }
        return accessor(id, field);
      }
      for (ReturnShape.Field field : forward.returns.fields) {
        if (field.originalName.equals(name)) {
          return accessor(id, field);
        }
      }
      final ArgumentSpec arg = forwardArg(forward, name);
      if (arg != null && !arg.name.equals(name)) {
        return ast.id(id.pos, arg.name);
      }
      return id;
    }

    @Override
    protected Ast.Exp visit(Ast.ListExp list) {
      return ast.array(list.pos, "long", visitList(list.args));
    }

    @Override
    protected Ast.Exp visit(Ast.Call call) {
      final ProcSignature signature = callable(call.name);
      final List<Ast.Exp> args = visitList(call.args);
      if (signature.builtin) {
        if (signature.kind == InvocationKind.INSTANCE_METHOD
            && !args.isEmpty()) {
          return ast.methodCall(call.pos, args.get(0), signature.displayName,
              args.subList(1, args.size()));
        }
        return ast.call(call.pos, helpersClass + "." + signature.displayName,
            args);
      }
      return ast.call(call.pos, bindingsClass + "." + signature.displayName,
          args);
    }

    @Override
    protected Ast.Exp visit(Ast.MethodCall methodCall) {
      final ProcSignature signature = callable(methodCall.name);
      final Ast.Exp receiver = methodCall.receiver.accept(this);
      final List<Ast.Exp> args = visitList(methodCall.args);
      if (signature.builtin) {
        if (signature.kind == InvocationKind.INSTANCE_METHOD) {
          return ast.methodCall(methodCall.pos, receiver,
              signature.displayName, args);
        }
        return ast.call(methodCall.pos,
            helpersClass + "." + signature.displayName, plus(receiver, args));
      }
      return ast.call(methodCall.pos,
          bindingsClass + "." + signature.displayName, plus(receiver, args));
    }

    @Override
    protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
      final Ast.Exp a = prefixCall.a.accept(this);
      return ast.call(prefixCall.pos, operator(prefixCall.op),
          ImmutableList.of(a));
    }

    @Override
    protected Ast.Exp visit(Ast.InfixCall infixCall) {
      final Ast.Exp a0 = infixCall.a0.accept(this);
      final Ast.Exp a1 = infixCall.a1.accept(this);
      return ast.call(infixCall.pos, operator(infixCall.op),
          ImmutableList.of(a0, a1));
    }

    private String operator(Op op) {
      return operatorsClass + "." + requireNonNull(op.methodName, op::name);
    }

    private ProcSignature callable(String name) {
      final ProcSignature signature = registry.lookupCallable(name);
      if (signature == null) {
        throw new GenerateException(
            GenerateException.Reason.MISSING_DEPENDENCY,
            "no procedure named '" + name + "'");
      }
      return signature;
    }
  }
}

// End ExpressionRewriter.java
