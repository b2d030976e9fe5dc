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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Backward procedure of one formula, ready to be emitted.
 *
 * <p>The procedure takes the upstream gradient, the forward arguments and
 * the forward result, and returns a record with one field per
 * differentiated argument.
 */
public final class BackwardProc {
  /** Name of the gradient parameter. */
  static final String GRAD = "grad";
  /** Name of the forward result parameter. */
  static final String FWD_RESULT = "fwd_result";
  /** Name of the output mask parameter. */
  static final String GRAD_INPUT_MASK = "grad_input_mask";

  /** Header of the formula. */
  public final String header;
  public final ProcSignature forward;
  /**
   * Condition under which the procedure throws, e.g. "!training"; or null.
   */
  public final @Nullable String guard;
  /** Whether the procedure takes the output mask parameter. */
  public final boolean mask;
  /** Statements that bind subexpressions, e.g. "final var x = y;". */
  public final ImmutableList<String> statements;
  public final ImmutableList<Output> outputs;

  BackwardProc(String header, ProcSignature forward, @Nullable String guard,
      boolean mask, List<String> statements, List<Output> outputs) {
    this.header = requireNonNull(header);
    this.forward = requireNonNull(forward);
    this.guard = guard;
    this.mask = mask;
    this.statements = ImmutableList.copyOf(statements);
    this.outputs = ImmutableList.copyOf(outputs);
  }

  /** Returns the method name, e.g. "dot_backward". */
  public String methodName() {
    return forward.displayName + "_backward";
  }

  /**
   * Returns the name of the method that calls the forward binding and pairs
   * its result with this procedure, e.g. "dot_autograd".
   */
  public String autogradName() {
    return forward.displayName + "_autograd";
  }

  /** Returns the erasure of the {@link #autogradName()} method. */
  public String autogradErasure() {
    final String erasure = forward.erasure(forward.args.size());
    return autogradName() + erasure.substring(forward.displayName.length());
  }

  /** Returns the parameter list. */
  public String parameters() {
    final StringBuilder b = new StringBuilder();
    b.append(TypeToken.TENSOR.javaType).append(' ').append(GRAD);
    for (ArgumentSpec arg : forward.args) {
      b.append(", ").append(arg.declaration());
    }
    b.append(", ").append(forward.returns.javaType()).append(' ')
        .append(FWD_RESULT);
    if (mask) {
      b.append(", boolean[] ").append(GRAD_INPUT_MASK);
    }
    return b.toString();
  }

  /** Returns the erasure of the method. */
  public String erasure() {
    final StringBuilder b = new StringBuilder(methodName()).append('(')
        .append(TypeToken.TENSOR.erasure());
    for (ArgumentSpec arg : forward.args) {
      b.append(", ").append(arg.type.erasure());
    }
    b.append(", ").append(forward.returns.isTuple()
        ? forward.returns.javaType()
        : requireNonNull(forward.returns.type).erasure());
    if (mask) {
      b.append(", boolean[]");
    }
    return b.append(')').toString();
  }

  @Override
  public String toString() {
    return methodName() + "(" + parameters() + ")";
  }

  /** Gradient of one forward argument. */
  public static final class Output {
    /** Name of the forward argument, and of the record field. */
    public final String name;
    public final TypeToken type;
    /** Expression that computes the value, e.g. "self_result". */
    public final String value;

    Output(String name, TypeToken type, String value) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return name + " = " + value;
    }
  }
}

// End BackwardProc.java
