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
package net.hydromatic.gradgen;

import static net.hydromatic.gradgen.Gen.DOT;
import static net.hydromatic.gradgen.Gen.MAX;
import static net.hydromatic.gradgen.Gen.MUL;
import static net.hydromatic.gradgen.Gen.RRELU;
import static net.hydromatic.gradgen.Gen.gen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.gradgen.compile.GenerationResult;
import net.hydromatic.gradgen.compile.Tracers;
import net.hydromatic.gradgen.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests {@link net.hydromatic.gradgen.compile.Generator}, end to end. */
public class GeneratorTest {
  /** Formula of "dot". */
  private static final String DOT_FORMULA =
      "{'name': 'dot(Tensor self, Tensor tensor)',"
          + " 'self': 'grad * tensor', 'tensor': 'grad * self'}";

  @Test
  void testBindings() {
    final String expected = "// Generated by gradgen. Do not edit.\n"
        + "package aten.generated;\n"
        + "\n"
        + "import aten.runtime.*;\n"
        + "import java.util.List;\n"
        + "\n"
        + "/** Forward bindings of the engine's operations. */\n"
        + "public final class Declarations {\n"
        + "  private Declarations() {}\n"
        + "\n"
        + "  public static Tensor dot(Tensor self, Tensor tensor) {\n"
        + "    return Tensor.own(self.handle().call(\"dot\","
        + " tensor.handle()));\n"
        + "  }\n"
        + "}\n";
    gen().declarations(DOT)
        .assertBindings(is(expected))
        .assertDiagnostics(empty());
  }

  @Test
  void testDerivatives() {
    final String expected = "// Generated by gradgen. Do not edit.\n"
        + "package aten.generated;\n"
        + "\n"
        + "import aten.generated.Declarations.*;\n"
        + "import aten.runtime.*;\n"
        + "import java.util.List;\n"
        + "import java.util.function.BiFunction;\n"
        + "\n"
        + "/** Backward procedures, one for each differentiable operation."
        + " */\n"
        + "public final class Derivatives {\n"
        + "  private Derivatives() {}\n"
        + "\n"
        + "  static final double M_PI = Math.PI;\n"
        + "\n"
        + "  /** Result of a forward call, and the backward procedure that"
        + " differentiates it. */\n"
        + "  public record Differentiable<R, G>(R result,\n"
        + "      BiFunction<Tensor, boolean[], G> backward) {}\n"
        + "\n"
        + "  public record DotGrads(Tensor self, Tensor tensor) {}\n"
        + "\n"
        + "  /** Gradient of {@code dot(Tensor self, Tensor tensor)}. */\n"
        + "  public static DotGrads dot_backward(Tensor grad, Tensor self,"
        + " Tensor tensor, Tensor fwd_result) {\n"
        + "    final var self_result = Operators.times(grad, tensor);\n"
        + "    final var tensor_result = Operators.times(grad, self);\n"
        + "    return new DotGrads(self_result, tensor_result);\n"
        + "  }\n"
        + "\n"
        + "  /** Calls {@code dot}, recording {@code dot_backward}. */\n"
        + "  public static Differentiable<Tensor, DotGrads>"
        + " dot_autograd(Tensor self, Tensor tensor) {\n"
        + "    final Tensor fwd_result = Declarations.dot(self, tensor);\n"
        + "    return new Differentiable<>(fwd_result,\n"
        + "        (grad, grad_input_mask) -> dot_backward(grad, self,"
        + " tensor, fwd_result));\n"
        + "  }\n"
        + "}\n";
    gen().declarations(DOT)
        .formulas(DOT_FORMULA)
        .assertDerivatives(is(expected))
        .assertDiagnostics(empty());
  }

  /** An instance method with one extra tensor argument. */
  @Test
  void testScenarioA() {
    final GenerationResult result = gen().declarations(DOT).generate();
    assertThat(result.registry.signatures.get(
            result.registry.signatures.size() - 1).toString(),
        is("INSTANCE_METHOD Tensor dot(Tensor self, Tensor tensor)"));
  }

  /** Return values named "grad_input" and "other" become a record. */
  @Test
  void testScenarioB() {
    final String decl = "{'name': 'foo_backward',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'grad', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'grad_input', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Tensor'}]}";
    final String record = "  public record FooBackwardResult(Tensor self,"
        + " Tensor other) {\n"
        + "    static FooBackwardResult of(EngineValue value) {\n"
        + "      return new FooBackwardResult(Tensor.own(value.get(0)),"
        + " Tensor.own(value.get(1)));\n"
        + "    }\n"
        + "  }\n";
    final String method = "  public static FooBackwardResult"
        + " foo_backward(Tensor agrad) {\n"
        + "    return FooBackwardResult.of(Engine.call(\"at::foo_backward\","
        + " agrad.handle()));\n"
        + "  }\n";
    gen().declarations(decl)
        .assertBindings(containsString(record))
        .assertBindings(containsString(method));
  }

  /** A "training ? x : y" body emits one guard, however many fields. */
  @Test
  void testScenarioC() {
    final String formula = "{'name': 'rrelu(Tensor self, Tensor noise,"
        + " bool training)',"
        + " 'self': 'training ? mul(grad, noise) : grad',"
        + " 'noise': 'training ? mul(grad, self) : grad'}";
    final String expected = "  public static RreluGrads rrelu_backward("
        + "Tensor grad, Tensor self, Tensor noise, boolean training,"
        + " Tensor fwd_result) {\n"
        + "    if (!training) {\n"
        + "      throw new IllegalStateException(\"rrelu_backward is only"
        + " defined in training mode\");\n"
        + "    }\n"
        + "    final var self_result = Declarations.mul(grad, noise);\n"
        + "    final var noise_result = Declarations.mul(grad, self);\n"
        + "    return new RreluGrads(self_result, noise_result);\n"
        + "  }\n";
    gen().declarations(MUL, RRELU)
        .formulas(formula)
        .assertDerivatives(containsString(expected))
        .assertDiagnostics(empty());
  }

  /** A body that refers to "grads" is not generated. */
  @Test
  void testScenarioD() {
    final String formula = "{'name': 'mul(Tensor self, Tensor other)',"
        + " 'self': 'grads[0] * other', 'other': 'grad * self'}";
    gen().declarations(MUL)
        .formulas(formula)
        .assertDerivatives(not(containsString("mul_backward")))
        .assertDiagnostics(
            contains("UnsupportedMultiGradShape: mul(Tensor self,"
                + " Tensor other): refers to 'grads'"));
  }

  /** Two fields with the same expression share one statement. */
  @Test
  void testCommonSubexpression() {
    final String formula = "{'name': 'mul(Tensor self, Tensor other)',"
        + " 'self': 'grad * other', 'other': 'grad*other'}";
    final String expected = "    final var self_result ="
        + " Operators.times(grad, other);\n"
        + "    return new MulGrads(self_result, self_result);\n";
    gen().declarations(MUL)
        .formulas(formula)
        .assertDerivatives(containsString(expected))
        .assertDerivatives(not(containsString("other_result")));
  }

  /** "result1" and the names of return values refer to the forward result. */
  @Test
  void testTupleForward() {
    final String formula =
        "{'name': 'max(Tensor self, int64_t dim, bool keepdim)',"
            + " 'self': 'mul(grad, result1) + values'}";
    final String expected = "  public static MaxGrads max_backward("
        + "Tensor grad, Tensor self, long dim, boolean keepdim,"
        + " MaxResult fwd_result) {\n"
        + "    final var self_result = Operators.plus(Declarations.mul(grad,"
        + " fwd_result.indices()), fwd_result.values());\n"
        + "    return new MaxGrads(self_result);\n"
        + "  }\n";
    gen().declarations(MUL, MAX)
        .formulas(formula)
        .assertDerivatives(containsString(expected))
        .assertDiagnostics(empty());
  }

  /** A comma-joined key takes each output from a component of a tuple. */
  @Test
  void testTupleOutputs() {
    final String forward = "{'name': 'thnn_conv2d_forward', 'mode': 'NN',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'weight', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'output', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'finput', 'dynamic_type': 'Tensor'}]}";
    final String backward = "{'name': 'thnn_conv2d_backward', 'mode': 'NN',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'grad_output', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'weight', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'output_mask',"
        + "     'dynamic_type': 'std::array<bool,2>'}],"
        + " 'returns': [{'name': 'grad_input', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'grad_weight', 'dynamic_type': 'Tensor'}]}";
    final String formula = "{'name': 'thnn_conv2d_forward(Tensor self,"
        + " Tensor weight)',"
        + " 'self, weight': 'thnn_conv2d_backward(grad, self, weight,"
        + " grad_input_mask)'}";
    final String expected = "  public static ThnnConv2dGrads"
        + " thnn_conv2d_backward(Tensor grad, Tensor self, Tensor weight,"
        + " ThnnConv2dResult fwd_result, boolean[] grad_input_mask) {\n"
        + "    final var self_result ="
        + " Declarations.thnn_conv2d_backward(grad, self, weight,"
        + " grad_input_mask);\n"
        + "    return new ThnnConv2dGrads(self_result.self(),"
        + " self_result.weight());\n"
        + "  }\n";
    gen().declarations(forward, backward)
        .formulas(formula)
        .assertBindings(
            containsString("public static ThnnConv2dResult"
                + " thnn_conv2d(Tensor self, Tensor weight) {\n"
                + "    return ThnnConv2dResult.of(Engine.call("
                + "\"at::thnn_conv2d_forward\", self.handle(),"
                + " weight.handle()));\n"))
        .assertDerivatives(containsString(expected))
        .assertDiagnostics(empty());
  }

  /** A comma-joined key whose expression is not a tuple is rejected. */
  @Test
  void testTupleOutputsNotTuple() {
    final String formula = "{'name': 'mul(Tensor self, Tensor other)',"
        + " 'self, other': 'mul(grad, other)'}";
    gen().declarations(MUL)
        .formulas(formula)
        .assertDiagnostics(
            contains("UnsupportedTupleShape: mul(Tensor self,"
                + " Tensor other): outputs [self, other] but"
                + " 'mul(grad, other)' does not return a tuple"));
  }

  @Test
  void testHelpers() {
    final String add = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'alpha', 'dynamic_type': 'Scalar', 'default': 1}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String formula =
        "{'name': 'add(Tensor self, Tensor other, *, Scalar alpha)',"
            + " 'self': 'grad.sum_to_size(self.sizes())',"
            + " 'other': 'maybe_multiply(grad, alpha)'}";
    gen().declarations(add)
        .formulas(formula)
        .assertDiagnostics(
            contains("MissingDependency: add(Tensor self, Tensor other,"
                + " *, Scalar alpha): no procedure named 'sum_to_size'"));

    final String formula2 =
        "{'name': 'add(Tensor self, Tensor other, *, Scalar alpha)',"
            + " 'self': 'mul(grad, self.sizes())',"
            + " 'other': 'maybe_multiply(grad, -alpha)'}";
    gen().declarations(add, MUL)
        .formulas(formula2)
        .assertDerivatives(
            containsString("    final var self_result ="
                + " Declarations.mul(grad, self.sizes());\n"
                + "    final var other_result ="
                + " AutogradHelpers.maybe_multiply(grad,"
                + " Operators.neg(alpha));\n"))
        .assertDiagnostics(empty());
  }

  @Test
  void testDefaultOverloads() {
    final String add = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'alpha', 'dynamic_type': 'Scalar', 'default': 1}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String ones = "{'name': 'ones',"
        + " 'method_of': ['Type'],"
        + " 'arguments': [{'name': 'size', 'dynamic_type': 'IntList'},"
        + "   {'name': 'requires_grad', 'dynamic_type': 'bool',"
        + "     'default': false}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String bernoulli = "{'name': 'bernoulli',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'generator', 'dynamic_type': 'Generator*',"
        + "     'default': 'nullptr'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    gen().declarations(add, ones, bernoulli)
        .assertBindings(
            containsString("  public static Tensor add(Tensor self,"
                + " Tensor other, double alpha) {\n"
                + "    return Tensor.own(self.handle().call(\"add\","
                + " other.handle(), alpha));\n"
                + "  }\n"
                + "\n"
                + "  public static Tensor add(Tensor self, Tensor other) {\n"
                + "    return add(self, other, 1.0);\n"
                + "  }\n"))
        .assertBindings(
            containsString("  public static Tensor ones(TensorType ty,"
                + " long[] size) {\n"
                + "    return ones(ty, size, false);\n"
                + "  }\n"))
        .assertBindings(
            containsString("    return bernoulli(self, (Generator) null);\n"));
  }

  @Test
  void testRenamedArguments() {
    final String view = "{'name': 'view',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'size_', 'dynamic_type': 'IntList'},"
        + "   {'name': 'int', 'dynamic_type': 'int64_t'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String formula =
        "{'name': 'view(Tensor self, IntList size_, int64_t int)',"
            + " 'self': 'mul(grad, int)'}";
    gen().declarations(view, MUL)
        .formulas(formula)
        .assertBindings(
            containsString("  public static Tensor view(Tensor self,"
                + " long[] size_u, long aint) {\n"
                + "    return Tensor.own(Engine.call(\"at::view\","
                + " self.handle(), size_u, aint));\n"))
        .assertDerivatives(
            containsString("final var self_result ="
                + " Declarations.mul(grad, aint);"));
  }

  @Test
  void testDuplicateSignature() {
    final String abs = "{'name': 'abs',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String formula = "{'name': 'abs(Tensor self)',"
        + " 'self': 'grad * self.sign()'}";
    final GenerationResult result = gen().declarations(abs, abs)
        .formulas("{'name': 'abs(Tensor self)', 'self': 'grad'}",
            "{'name': 'abs(Tensor self)', 'self': 'grad * self'}",
            "{'name': 'abs(Tensor self)', 'self': 'mul(grad, self)'}")
        .generate();
    assertThat(result.bindingsSource.split("static Tensor abs\\(").length,
        is(2));
    assertThat(
        result.derivativesSource.split("abs_backward\\(Tensor").length,
        is(2));
    assertThat(result.diagnostics.toString(),
        is("[DuplicateSignature: abs: method abs(Tensor) is already defined,"
            + " MissingDependency: abs(Tensor self): no procedure named"
            + " 'mul', DuplicateSignature: abs(Tensor self):"
            + " method abs_backward(Tensor, Tensor, Tensor) is already"
            + " defined]"));
    gen().declarations(abs)
        .formulas(formula)
        .assertDiagnostics(
            contains("MissingDependency: abs(Tensor self): no procedure named"
                + " 'sign'"));
  }

  @Test
  void testSkippedEntries() {
    final String sparse = "{'name': 'to_sparse',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'result',"
        + "   'dynamic_type': 'SparseTensor'}]}";
    final String noSelf = "{'name': 'where',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'condition',"
        + "   'dynamic_type': 'BoolTensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String noReturns = "{'name': 'set_flag',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [],"
        + " 'returns': []}";
    gen().declarations(sparse, noSelf, noReturns, MUL)
        .formulas("{'name': 'foo(Tensor self)', 'self': 'grad'}",
            "{'name': 'mul(Tensor self, Tensor other)',"
                + " 'self': 'not_implemented(mul)'}",
            "{'name': 'mul(Tensor self, Tensor other)',"
                + " 'input': 'grad'}",
            "{'name': 'mul(Tensor self, Tensor other)',"
                + " 'self': 'grad * (other'}")
        .assertDiagnostics(
            contains("UnsupportedType: to_sparse: unsupported type"
                    + " 'SparseTensor'",
                "MissingSelf: where: method of Tensor has no Tensor"
                    + " argument 'self'",
                "NoReturns: set_flag: no return values",
                "UnknownDeclaration: foo(Tensor self): no declaration named"
                    + " 'foo'",
                "NotImplemented: mul(Tensor self, Tensor other): no gradient"
                    + " is implemented",
                "MissingDependency: mul(Tensor self, Tensor other): output"
                    + " 'input' is not an argument of 'mul'",
                "MalformedFormula: mul(Tensor self, Tensor other): cannot"
                    + " parse 'grad * (other': 14 Error: unexpected"
                    + " '<EOF>'"));
  }

  @Test
  void testOverloads() {
    final String addTensor = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String addScalar = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Scalar'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    gen().declarations(addTensor, addScalar)
        .formulas("{'name': 'add(Tensor self, Scalar other)',"
                + " 'self': 'grad'}",
            "{'name': 'add(Tensor self, int64_t other)', 'self': 'grad'}")
        .assertDerivatives(
            containsString("add_backward(Tensor grad, Tensor self,"
                + " double other, Tensor fwd_result)"))
        .assertDiagnostics(
            contains("AmbiguousOrMissingOverload: add(Tensor self,"
                + " int64_t other): none of 2 overloads of 'add' has"
                + " argument types [Tensor, int64_t]"));
  }

  /** A default overload never takes the place of a declared binding. */
  @Test
  void testDefaultOverloadClash() {
    final String fooDim = "{'name': 'foo',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'dim', 'dynamic_type': 'int64_t', 'default': 0}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String foo = "{'name': 'foo',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final GenerationResult result =
        gen().declarations(fooDim, foo).generate();
    assertThat(result.bindingsSource,
        containsString("  public static Tensor foo(Tensor self) {\n"
            + "    return Tensor.own(self.handle().call(\"foo\"));\n"));
    assertThat(result.bindingsSource,
        containsString("  public static Tensor foo(Tensor self, long dim) {"));
    assertThat(
        result.bindingsSource.split("static Tensor foo\\(Tensor self\\)")
            .length,
        is(2));
    assertThat(result.diagnostics, empty());
    assertThat(result.bindingCount, is(2));
  }

  /** Bodies refer to a tuple's fields by their renamed names. */
  @Test
  void testRenamedReturnValue() {
    final String conv = "{'name': 'conv_backward',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'grad_output', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'input', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'grad_input', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'grad_weight', 'dynamic_type': 'Tensor'}]}";
    final String formula = "{'name': 'conv_backward(Tensor grad_output,"
        + " Tensor input)',"
        + " 'grad_output': 'mul(grad, weight)'}";
    gen().declarations(conv, MUL)
        .formulas(formula)
        .assertDerivatives(
            containsString("    final var grad_output_result ="
                + " Declarations.mul(grad, fwd_result.weight());\n"))
        .assertDiagnostics(empty());
  }

  /** However often a body refers to the mask, it is one parameter. */
  @Test
  void testOutputMask() {
    final String masked = "{'name': 'masked',"
        + " 'method_of': ['namespace'],"
        + " 'arguments': [{'name': 'input', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'output_mask',"
        + "     'dynamic_type': 'std::array<bool,2>'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String formula = "{'name': 'mul(Tensor self, Tensor other)',"
        + " 'self': 'masked(grad, grad_input_mask)',"
        + " 'other': 'masked(grad * self, grad_input_mask)"
        + " + masked(self, grad_input_mask)'}";
    final GenerationResult result =
        gen().declarations(MUL, masked).formulas(formula).generate();
    assertThat(result.diagnostics, empty());
    assertThat(result.derivativesSource,
        containsString("  public static MulGrads mul_backward(Tensor grad,"
            + " Tensor self, Tensor other, Tensor fwd_result,"
            + " boolean[] grad_input_mask) {\n"));
    assertThat(
        result.derivativesSource.split("boolean\\[] grad_input_mask").length,
        is(2));
    assertThat(result.derivativesSource,
        containsString("  public static Differentiable<Tensor, MulGrads>"
            + " mul_autograd(Tensor self, Tensor other) {\n"
            + "    final Tensor fwd_result = Declarations.mul(self, other);\n"
            + "    return new Differentiable<>(fwd_result,\n"
            + "        (grad, grad_input_mask) -> mul_backward(grad, self,"
            + " other, fwd_result, grad_input_mask));\n"
            + "  }\n"));
  }

  /** When an earlier overload matches, a later one that matches in part
   * is not chosen. */
  @Test
  void testFirstMatchingOverload() {
    final String addTensor = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Tensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final String addScalar = "{'name': 'add',"
        + " 'method_of': ['Tensor'],"
        + " 'arguments': [{'name': 'self', 'dynamic_type': 'Tensor'},"
        + "   {'name': 'other', 'dynamic_type': 'Scalar'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    gen().declarations(addTensor, addScalar)
        .formulas("{'name': 'add(Tensor self, Tensor other)',"
            + " 'self': 'grad'}")
        .assertDerivatives(
            containsString("add_backward(Tensor grad, Tensor self,"
                + " Tensor other, Tensor fwd_result)"))
        .assertDiagnostics(empty());
  }

  /** A warning does not count as a skipped entry; a clash does. */
  @Test
  void testCounts() {
    final String where = "{'name': 'where',"
        + " 'method_of': ['Tensor', 'namespace'],"
        + " 'arguments': [{'name': 'condition',"
        + "   'dynamic_type': 'BoolTensor'}],"
        + " 'returns': [{'name': 'result', 'dynamic_type': 'Tensor'}]}";
    final GenerationResult result =
        gen().declarations(where, DOT, DOT)
            .formulas(DOT_FORMULA)
            .generate();
    assertThat(result.diagnostics.toString(),
        is("[MissingSelf: where: method of Tensor has no Tensor argument"
            + " 'self', DuplicateSignature: dot: method dot(Tensor, Tensor)"
            + " is already defined]"));
    assertThat(result.diagnostics.get(0).warning, is(true));
    assertThat(result.diagnostics.get(1).warning, is(false));
    assertThat(result.bindingCount, is(2));
    assertThat(result.backwardCount, is(1));
  }

  /** Parallel generation gives the same output as sequential. */
  @Test
  void testParallel() {
    final List<String> formulas = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      formulas.add(i % 7 == 0
          ? "{'name': 'mul(Tensor self, Tensor other)',"
              + " 'self': 'grads[" + i + "]'}"
          : "{'name': 'mul(Tensor self, Tensor other)',"
              + " 'self': 'grad * " + i + "'}");
    }
    final Gen gen = gen().declarations(MUL, DOT)
        .formulas(formulas.toArray(new String[0]));
    final GenerationResult sequential = gen.generate();
    final GenerationResult parallel =
        gen.with(Prop.PARALLEL, true).generate();
    assertThat(parallel.derivativesSource, is(sequential.derivativesSource));
    assertThat(parallel.bindingsSource, is(sequential.bindingsSource));
    assertThat(parallel.diagnostics, is(sequential.diagnostics));
    assertThat(sequential.diagnostics, hasSize(50 - 1));

    // Generation is deterministic.
    assertThat(gen.generate().derivativesSource,
        is(sequential.derivativesSource));
  }

  @Test
  void testTracer() {
    final List<String> list = new ArrayList<>();
    gen().declarations(MUL, DOT)
        .formulas(DOT_FORMULA, "{'name': 'foo(Tensor self)', 'self': 'grad'}")
        .withTracer(
            Tracers.withOnDiagnostic(
                Tracers.withOnBackward(
                    Tracers.withOnSignature(Tracers.empty(),
                        s -> list.add("signature " + s.displayName)),
                    p -> list.add("backward " + p.methodName())),
                d -> list.add(d.reason.category)))
        .generate();
    assertThat(list,
        contains("signature mul", "signature dot", "backward dot_backward",
            "UnknownDeclaration"));
  }

  @Test
  void testProperties() {
    gen().declarations(DOT)
        .formulas(DOT_FORMULA)
        .with(Prop.BINDINGS_PACKAGE, "com.example.torch")
        .with(Prop.BINDINGS_CLASS, "Torch")
        .with(Prop.RUNTIME_PACKAGE, "com.example.runtime")
        .with(Prop.OPERATORS_CLASS, "Ops")
        .assertBindings(
            containsString("package com.example.torch;\n\n"
                + "import com.example.runtime.*;\n"))
        .assertBindings(containsString("public final class Torch {\n"))
        .assertDerivatives(
            containsString("import com.example.torch.Torch.*;\n"))
        .assertDerivatives(
            containsString("final var self_result = Ops.times(grad,"
                + " tensor);"));
  }
}

// End GeneratorTest.java
