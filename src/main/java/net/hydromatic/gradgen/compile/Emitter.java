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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.gradgen.util.Prop;

/**
 * Writes Java source for the forward bindings and the backward procedures.
 *
 * <p>Output depends only on its input; no timestamps, no hash ordering.
 */
public class Emitter {
  private static final String INDENT = "  ";

  private final String bindingsPackage;
  private final String bindingsClass;
  private final String derivativesClass;
  private final String runtimePackage;

  public Emitter(Map<Prop, Object> map) {
    this.bindingsPackage = Prop.BINDINGS_PACKAGE.stringValue(map);
    this.bindingsClass = Prop.BINDINGS_CLASS.stringValue(map);
    this.derivativesClass = Prop.DERIVATIVES_CLASS.stringValue(map);
    this.runtimePackage = Prop.RUNTIME_PACKAGE.stringValue(map);
    checkArgument(!bindingsPackage.isEmpty(),
        "bindings package must not be empty");
  }

  /**
   * Writes the bindings class: a record for each tuple shape and a method
   * (with overloads for trailing default arguments) for each signature that
   * is not built in.
   *
   * @param registry Registry
   * @param diagnostics Receives a diagnostic for each signature that is not
   *     written because its erasure clashes with an earlier one
   * @return Java source
   */
  public String bindings(ProcRegistry registry,
      Consumer<Diagnostic> diagnostics) {
    final StringBuilder b = new StringBuilder();
    header(b, bindingsClass, "Forward bindings of the engine's operations.",
        false);
    for (ReturnShape tuple : registry.tuples) {
      record(b, tuple);
    }

    // Full signatures claim their erasures before any default overload.
    final Set<String> erasures = new HashSet<>();
    final List<ProcSignature> methods = new ArrayList<>();
    for (ProcSignature signature : registry.signatures) {
      if (signature.builtin) {
        continue;
      }
      final String erasure = signature.erasure(signature.args.size());
      if (!erasures.add(erasure)) {
        diagnostics.accept(
            new Diagnostic(GenerateException.Reason.DUPLICATE_SIGNATURE,
                signature.originalName,
                "method " + erasure + " is already defined"));
        continue;
      }
      methods.add(signature);
    }
    for (ProcSignature signature : methods) {
      method(b, signature);
      for (int n = signature.requiredCount(); n < signature.args.size(); n++) {
        // A shorter overload may clash with another binding; the longer
        // form remains callable.
        if (erasures.add(signature.erasure(n))) {
          overload(b, signature, n);
        }
      }
    }
    return footer(b);
  }

  /**
   * Writes the derivatives class: for each backward procedure, a record of
   * gradients, a method that computes them, and a method that calls the
   * forward binding and returns its result with the backward procedure.
   *
   * @param procs Backward procedures, in the order they are to be written
   * @param diagnostics Receives a diagnostic for each procedure that is not
   *     written because its erasure clashes with an earlier one
   * @return Java source
   */
  public String derivatives(List<BackwardProc> procs,
      Consumer<Diagnostic> diagnostics) {
    final StringBuilder b = new StringBuilder();
    header(b, derivativesClass,
        "Backward procedures, one for each differentiable operation.", true);
    b.append('\n')
        .append(INDENT).append("static final double M_PI = Math.PI;\n")
        .append('\n')
        .append(INDENT).append("/** Result of a forward call, and the backward"
            + " procedure that differentiates it. */\n")
        .append(INDENT).append("public record Differentiable<R, G>(R result,\n")
        .append(INDENT).append(INDENT).append(INDENT)
        .append("BiFunction<Tensor, boolean[], G> backward) {}\n");

    final Set<String> erasures = new HashSet<>();
    final Map<List<Object>, String> gradsByKey = new HashMap<>();
    final NameGenerator nameGenerator = new NameGenerator();
    for (BackwardProc proc : procs) {
      final String erasure = proc.erasure();
      final String autogradErasure = proc.autogradErasure();
      if (erasures.contains(erasure) || erasures.contains(autogradErasure)) {
        diagnostics.accept(
            new Diagnostic(GenerateException.Reason.DUPLICATE_SIGNATURE,
                proc.header,
                "method "
                    + (erasures.contains(erasure) ? erasure : autogradErasure)
                    + " is already defined"));
        continue;
      }
      erasures.add(erasure);
      erasures.add(autogradErasure);
      final String baseName =
          Names.upperCamel(proc.forward.displayName) + "Grads";
      final List<Object> key = ImmutableList.of(baseName, shape(proc));
      String grads = gradsByKey.get(key);
      if (grads == null) {
        grads = nameGenerator.unique(baseName);
        gradsByKey.put(key, grads);
        gradsRecord(b, grads, proc.outputs);
      }
      backward(b, grads, proc);
      autograd(b, grads, proc);
    }
    return footer(b);
  }

  private void header(StringBuilder b, String className, String doc,
      boolean importBindings) {
    b.append("// Generated by gradgen. Do not edit.\n")
        .append("package ").append(bindingsPackage).append(";\n")
        .append('\n');
    if (importBindings) {
      b.append("import ").append(bindingsPackage).append('.')
          .append(bindingsClass).append(".*;\n");
    }
    b.append("import ").append(runtimePackage).append(".*;\n")
        .append("import java.util.List;\n");
    if (importBindings) {
      b.append("import java.util.function.BiFunction;\n");
    }
    b.append('\n')
        .append("/** ").append(doc).append(" */\n")
        .append("public final class ").append(className).append(" {\n")
        .append(INDENT).append("private ").append(className)
        .append("() {}\n");
  }

  private static String footer(StringBuilder b) {
    return b.append("}\n").toString();
  }

  private static void record(StringBuilder b, ReturnShape tuple) {
    final String name = tuple.javaType();
    final List<String> components = new ArrayList<>();
    final List<String> values = new ArrayList<>();
    for (int i = 0; i < tuple.fields.size(); i++) {
      final ReturnShape.Field field = tuple.fields.get(i);
      components.add(field.type.javaType + " " + field.name);
      values.add(field.type.convert("value.get(" + i + ")"));
    }
    b.append('\n')
        .append(INDENT).append("public record ").append(name).append('(')
        .append(String.join(", ", components)).append(") {\n")
        .append(INDENT).append(INDENT).append("static ").append(name)
        .append(" of(EngineValue value) {\n")
        .append(INDENT).append(INDENT).append(INDENT).append("return new ")
        .append(name).append('(').append(String.join(", ", values))
        .append(");\n")
        .append(INDENT).append(INDENT).append("}\n")
        .append(INDENT).append("}\n");
  }

  private static void method(StringBuilder b, ProcSignature signature) {
    signatureLine(b, signature, signature.args.size());
    b.append(INDENT).append(INDENT).append("return ")
        .append(signature.callExpression).append(";\n")
        .append(INDENT).append("}\n");
  }

  /** Writes an overload that supplies the trailing default arguments. */
  private static void overload(StringBuilder b, ProcSignature signature,
      int n) {
    final List<String> args = new ArrayList<>();
    if (signature.kind == InvocationKind.STATIC_ON_TYPE) {
      args.add("ty");
    }
    for (int i = 0; i < signature.args.size(); i++) {
      final ArgumentSpec arg = signature.args.get(i);
      args.add(i < n ? arg.name : defaultValue(arg));
    }
    signatureLine(b, signature, n);
    b.append(INDENT).append(INDENT).append("return ")
        .append(signature.displayName).append('(')
        .append(String.join(", ", args)).append(");\n")
        .append(INDENT).append("}\n");
  }

  /**
   * Returns the default value of an argument. A null is cast to the
   * argument's type, so that the call is not ambiguous.
   */
  private static String defaultValue(ArgumentSpec arg) {
    final String value = requireNonNull(arg.defaultValue, arg.name);
    return value.equals("null") ? "(" + arg.type.javaType + ") null" : value;
  }

  private static void signatureLine(StringBuilder b, ProcSignature signature,
      int n) {
    b.append('\n')
        .append(INDENT).append("public static ")
        .append(signature.returns.javaType()).append(' ')
        .append(signature.displayName).append('(')
        .append(signature.parameters(n)).append(") {\n");
  }

  /** Returns the names and types of a procedure's outputs. */
  private static List<Object> shape(BackwardProc proc) {
    final ImmutableList.Builder<Object> list = ImmutableList.builder();
    for (BackwardProc.Output output : proc.outputs) {
      list.add(output.name, output.type);
    }
    return list.build();
  }

  private static void gradsRecord(StringBuilder b, String name,
      List<BackwardProc.Output> outputs) {
    final List<String> components = new ArrayList<>();
    for (BackwardProc.Output output : outputs) {
      components.add(output.type.javaType + " " + output.name);
    }
    b.append('\n')
        .append(INDENT).append("public record ").append(name).append('(')
        .append(String.join(", ", components)).append(") {}\n");
  }

  private static void backward(StringBuilder b, String grads,
      BackwardProc proc) {
    final String methodName = proc.methodName();
    b.append('\n')
        .append(INDENT).append("/** Gradient of {@code ")
        .append(escape(proc.header)).append("}. */\n")
        .append(INDENT).append("public static ").append(grads).append(' ')
        .append(methodName).append('(').append(proc.parameters())
        .append(") {\n");
    if (proc.guard != null) {
      b.append(INDENT).append(INDENT).append("if (").append(proc.guard)
          .append(") {\n")
          .append(INDENT).append(INDENT).append(INDENT)
          .append("throw new IllegalStateException(\"").append(methodName)
          .append(" is only defined in training mode\");\n")
          .append(INDENT).append(INDENT).append("}\n");
    }
    for (String statement : proc.statements) {
      b.append(INDENT).append(INDENT).append(statement).append('\n');
    }
    final List<String> values = new ArrayList<>();
    for (BackwardProc.Output output : proc.outputs) {
      values.add(output.value);
    }
    b.append(INDENT).append(INDENT).append("return new ").append(grads)
        .append('(').append(String.join(", ", values)).append(");\n")
        .append(INDENT).append("}\n");
  }

  /**
   * Writes a method that calls the forward binding, and returns its result
   * with a function that calls the backward procedure.
   */
  private void autograd(StringBuilder b, String grads, BackwardProc proc) {
    final ProcSignature forward = proc.forward;
    final String result = forward.returns.javaType();
    final List<String> args = new ArrayList<>();
    if (forward.kind == InvocationKind.STATIC_ON_TYPE) {
      args.add("ty");
    }
    final List<String> backwardArgs = new ArrayList<>();
    backwardArgs.add(BackwardProc.GRAD);
    for (ArgumentSpec arg : forward.args) {
      args.add(arg.name);
      backwardArgs.add(arg.name);
    }
    backwardArgs.add(BackwardProc.FWD_RESULT);
    if (proc.mask) {
      backwardArgs.add(BackwardProc.GRAD_INPUT_MASK);
    }
    b.append('\n')
        .append(INDENT).append("/** Calls {@code ")
        .append(forward.displayName).append("}, recording {@code ")
        .append(proc.methodName()).append("}. */\n")
        .append(INDENT).append("public static Differentiable<").append(result)
        .append(", ").append(grads).append("> ").append(proc.autogradName())
        .append('(').append(forward.parameters(forward.args.size()))
        .append(") {\n")
        .append(INDENT).append(INDENT).append("final ").append(result)
        .append(' ').append(BackwardProc.FWD_RESULT).append(" = ")
        .append(bindingsClass).append('.').append(forward.displayName)
        .append('(').append(String.join(", ", args)).append(");\n")
        .append(INDENT).append(INDENT).append("return new Differentiable<>(")
        .append(BackwardProc.FWD_RESULT).append(",\n")
        .append(INDENT).append(INDENT).append(INDENT).append(INDENT)
        .append('(').append(BackwardProc.GRAD).append(", ")
        .append(BackwardProc.GRAD_INPUT_MASK).append(") -> ")
        .append(proc.methodName()).append('(')
        .append(String.join(", ", backwardArgs)).append("));\n")
        .append(INDENT).append("}\n");
  }

  /** Escapes text for a Javadoc comment. */
  static String escape(String s) {
    return s.replace("*/", "*&#47;").replace("@", "&#64;")
        .replace("{", "&#123;").replace("}", "&#125;");
  }
}

// End Emitter.java
