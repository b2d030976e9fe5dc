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
import java.util.stream.Collectors;
import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fully-typed callable shape of one operation for one invocation kind.
 *
 * <p>Immutable. Signatures are created by {@link SignatureSynthesizer} (or,
 * for helpers that the runtime provides, by {@link BuiltIn}) and held by
 * {@link ProcRegistry}.
 */
public final class ProcSignature {
  /** Name of the engine entry point, e.g. "thnn_conv2d_forward". */
  public final String originalName;
  /**
   * Another name by which formulas may call this operation, e.g.
   * "thnn_conv2d" for "thnn_conv2d_forward"; or null.
   */
  public final @Nullable String alternateName;
  /** Name of the generated method, e.g. "thnn_conv2d". */
  public final String displayName;
  /** Arguments; for an instance method, {@code self} is first. */
  public final ImmutableList<ArgumentSpec> args;
  public final ReturnShape returns;
  public final InvocationKind kind;
  /** Expression that calls the engine and converts its result. */
  public final String callExpression;
  /**
   * Whether this is a helper that the runtime provides; built-ins may be
   * called from formulas but are never emitted.
   */
  public final boolean builtin;

  ProcSignature(String originalName, @Nullable String alternateName,
      String displayName, List<ArgumentSpec> args, ReturnShape returns,
      InvocationKind kind, String callExpression, boolean builtin) {
    this.originalName = requireNonNull(originalName);
    this.alternateName = alternateName;
    this.displayName = requireNonNull(displayName);
    this.args = ImmutableList.copyOf(args);
    this.returns = requireNonNull(returns);
    this.kind = requireNonNull(kind);
    this.callExpression = requireNonNull(callExpression);
    this.builtin = builtin;
  }

  /** Returns the types of the arguments, in order. */
  public List<TypeToken> argTypes() {
    return args.stream().map(a -> a.type).collect(Collectors.toList());
  }

  /**
   * Returns the parameter list of the generated method with the first
   * {@code n} arguments, e.g. "Tensor self, long dim".
   */
  public String parameters(int n) {
    final StringBuilder b = new StringBuilder(kind.leadingParameter);
    for (ArgumentSpec arg : args.subList(0, n)) {
      if (b.length() > 0) {
        b.append(", ");
      }
      b.append(arg.declaration());
    }
    return b.toString();
  }

  /**
   * Returns the erasure of the generated method with the first {@code n}
   * arguments; two methods of a class may not have the same erasure.
   */
  public String erasure(int n) {
    final StringBuilder b = new StringBuilder(displayName).append('(');
    if (kind == InvocationKind.STATIC_ON_TYPE) {
      b.append("TensorType");
    }
    for (ArgumentSpec arg : args.subList(0, n)) {
      if (b.charAt(b.length() - 1) != '(') {
        b.append(", ");
      }
      b.append(arg.type.erasure());
    }
    return b.append(')').toString();
  }

  /**
   * Returns the number of leading arguments that have no default value. The
   * generated method has an overload for each number of arguments between
   * this and the full count.
   */
  public int requiredCount() {
    int n = args.size();
    while (n > 0 && args.get(n - 1).defaultValue != null) {
      --n;
    }
    return n;
  }

  @Override
  public String toString() {
    return kind + " " + returns.javaType() + " " + displayName + "("
        + parameters(args.size()) + ")";
  }
}

// End ProcSignature.java
