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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import net.hydromatic.gradgen.table.Declaration;
import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a {@link Declaration} into one {@link ProcSignature} per
 * invocation kind, and registers them.
 */
public class SignatureSynthesizer {
  private static final Logger LOGGER =
      Logger.getLogger(SignatureSynthesizer.class.getName());

  static final String FORWARD = "_forward";
  static final String BACKWARD = "_backward";

  private final ProcRegistry.Builder builder;

  public SignatureSynthesizer(ProcRegistry.Builder builder) {
    this.builder = requireNonNull(builder);
  }

  /**
   * Synthesizes and registers the signatures of a declaration.
   *
   * <p>A problem that prevents one invocation kind but not another (an
   * instance method without a {@code self} argument) is passed to
   * {@code warn}, and the other kinds are still registered.
   *
   * @param declaration Declaration
   * @param warn Receives problems that do not prevent every kind
   * @return Signatures registered, possibly empty
   * @throws GenerateException if no signature can be synthesized
   */
  public List<ProcSignature> synthesize(Declaration declaration,
      Consumer<GenerateException> warn) {
    final String name = declaration.name;

    // Under NN mode, "foo_forward" is the entry point of "foo"; "foo" itself
    // has no entry point, and "foo_backward" is an ordinary declaration.
    @Nullable String alternateName = null;
    String displayName = name;
    if (declaration.nn) {
      if (name.contains(FORWARD)) {
        alternateName = name.replace(FORWARD, "");
        displayName = alternateName;
      } else if (!name.contains(BACKWARD)) {
        LOGGER.fine(() -> "skipping NN declaration without entry point: "
            + name);
        return ImmutableList.of();
      }
    }
    displayName = Names.validate(displayName);

    final List<ArgumentSpec> args = arguments(declaration);
    final List<ReturnShape.Field> fields = returnFields(declaration);

    final List<InvocationKind> kinds = new ArrayList<>();
    if (declaration.methodOf.contains(Declaration.MethodOf.TYPE)) {
      kinds.add(InvocationKind.STATIC_ON_TYPE);
    }
    final boolean namespace =
        declaration.methodOf.contains(Declaration.MethodOf.NAMESPACE);
    final int self = selfIndex(declaration);
    if (declaration.methodOf.contains(Declaration.MethodOf.TENSOR)) {
      if (self >= 0) {
        kinds.add(InvocationKind.INSTANCE_METHOD);
      } else {
        final GenerateException e =
            new GenerateException(GenerateException.Reason.MISSING_SELF,
                "method of Tensor has no Tensor argument 'self'");
        if (!namespace && kinds.isEmpty()) {
          throw e;
        }
        warn.accept(e);
        if (namespace) {
          kinds.add(InvocationKind.FREE_FUNCTION);
        }
      }
    } else if (namespace) {
      kinds.add(InvocationKind.FREE_FUNCTION);
    }

    if (kinds.isEmpty()) {
      return ImmutableList.of();
    }
    final ReturnShape returns = fields.size() == 1
        ? ReturnShape.of(fields.get(0).type)
        : builder.tuple(displayName, fields);
    final ImmutableList.Builder<ProcSignature> signatures =
        ImmutableList.builder();
    for (InvocationKind kind : kinds) {
      final List<ArgumentSpec> kindArgs =
          kind == InvocationKind.INSTANCE_METHOD
              ? selfFirst(args, self)
              : args;
      final ProcSignature signature =
          new ProcSignature(name, alternateName, displayName, kindArgs,
              returns, kind, callExpression(kind, name, args, returns),
              false);
      builder.add(signature);
      signatures.add(signature);
    }
    return signatures.build();
  }

  /** Resolves the arguments of a declaration. */
  private static List<ArgumentSpec> arguments(Declaration declaration) {
    final List<ArgumentSpec> args = new ArrayList<>();
    for (Declaration.Arg arg : declaration.arguments) {
      final TypeToken type = TypeResolver.resolve(arg.dynamicType);
      args.add(
          new ArgumentSpec(Names.validate(arg.name), arg.name, type,
              translateDefault(declaration.name, arg, type)));
    }
    return args;
  }

  /**
   * Resolves the return values of a declaration. If there are several, they
   * become the fields of a tuple.
   */
  private static List<ReturnShape.Field> returnFields(
      Declaration declaration) {
    if (declaration.returns.isEmpty()) {
      throw new GenerateException(GenerateException.Reason.NO_RETURNS,
          "no return values");
    }
    final List<ReturnShape.Field> fields = new ArrayList<>();
    for (Declaration.Ret ret : declaration.returns) {
      fields.add(
          new ReturnShape.Field(Names.tupleField(ret.name),
              Names.renameReturn(ret.name),
              TypeResolver.resolve(ret.dynamicType)));
    }
    return fields;
  }

  /**
   * Returns the position of the tensor argument "self", or -1.
   * "BoolTensor self" does not count.
   */
  private static int selfIndex(Declaration declaration) {
    for (int i = 0; i < declaration.arguments.size(); i++) {
      final Declaration.Arg arg = declaration.arguments.get(i);
      if (arg.name.equals("self") && arg.dynamicType.trim().equals("Tensor")) {
        return i;
      }
    }
    return -1;
  }

  private static List<ArgumentSpec> selfFirst(List<ArgumentSpec> args,
      int self) {
    if (self == 0) {
      return args;
    }
    final List<ArgumentSpec> list = new ArrayList<>();
    list.add(args.get(self));
    for (int i = 0; i < args.size(); i++) {
      if (i != self) {
        list.add(args.get(i));
      }
    }
    return list;
  }

  /**
   * Returns the expression that a binding evaluates: a call to the engine
   * entry point with the arguments in declared order, converted to the
   * return shape.
   */
  static String callExpression(InvocationKind kind, String originalName,
      List<ArgumentSpec> args, ReturnShape returns) {
    final String passed = args.stream()
        .filter(a ->
            kind != InvocationKind.INSTANCE_METHOD
                || !a.originalName.equals("self"))
        .map(a -> a.type.pass(a.name))
        .collect(Collectors.joining(", "));
    return returns.convert(kind.call(originalName, passed));
  }

  /**
   * Converts the default value of an argument to a Java expression, or
   * returns null if it has none or it cannot be converted.
   */
  static @Nullable String translateDefault(String declarationName,
      Declaration.Arg arg, TypeToken type) {
    final Object value = arg.defaultValue;
    if (value == null) {
      return null;
    }
    final String s = translate(value, type);
    if (s == null) {
      LOGGER.log(Level.FINE, "dropping default {0} of argument {1} of {2}",
          new Object[] {describe(value), arg.name, declarationName});
    }
    return s;
  }

  private static @Nullable String translate(Object value, TypeToken type) {
    if (value instanceof Boolean) {
      return type == TypeToken.BOOL ? value.toString() : null;
    }
    if (value instanceof Long) {
      final long n = (Long) value;
      switch (type) {
      case INT64:
        return n + "L";
      case FLOAT:
        return Double.toString(n);
      case INT_LIST:
        return "new long[] {" + n + "}";
      default:
        return null;
      }
    }
    if (value instanceof List && type == TypeToken.INT_LIST) {
      final List<String> elements = new ArrayList<>();
      for (Object o : (List<?>) value) {
        if (!(o instanceof Long)) {
          return null;
        }
        elements.add(o.toString());
      }
      return "new long[] {" + String.join(", ", elements) + "}";
    }
    if ("nullptr".equals(value) && !type.isPrimitive()) {
      return "null";
    }
    return null;
  }

  private static String describe(Object value) {
    return value == Declaration.Arg.OTHER ? "<object>" : value.toString();
  }
}

// End SignatureSynthesizer.java
