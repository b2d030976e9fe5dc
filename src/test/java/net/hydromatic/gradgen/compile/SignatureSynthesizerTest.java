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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.gradgen.table.Declaration;
import org.junit.jupiter.api.Test;

/** Tests {@link SignatureSynthesizer}. */
public class SignatureSynthesizerTest {
  private final ProcRegistry.Builder builder = ProcRegistry.builder();
  private final List<GenerateException> warnings = new ArrayList<>();

  private List<ProcSignature> synthesize(Declaration declaration) {
    return new SignatureSynthesizer(builder)
        .synthesize(declaration, warnings::add);
  }

  private static Declaration.Builder dot() {
    return Declaration.builder("dot")
        .arg("self", "Tensor")
        .arg("tensor", "Tensor")
        .ret("result", "Tensor");
  }

  @Test
  void testInstanceMethod() {
    final List<ProcSignature> list =
        synthesize(dot().methodOf(Declaration.MethodOf.TENSOR).build());
    assertThat(list, hasSize(1));
    final ProcSignature signature = list.get(0);
    assertThat(signature.kind, is(InvocationKind.INSTANCE_METHOD));
    assertThat(signature,
        hasToString("INSTANCE_METHOD Tensor dot(Tensor self, Tensor tensor)"));
    assertThat(signature.callExpression,
        is("Tensor.own(self.handle().call(\"dot\", tensor.handle()))"));
    assertThat(signature.builtin, is(false));
    assertThat(builder.build().signatures, hasSize(1));
  }

  /** "Type" adds a function scoped to a tensor type; "Tensor" with a self
   * argument wins over "namespace". */
  @Test
  void testKinds() {
    final List<ProcSignature> list =
        synthesize(dot()
            .methodOf(Declaration.MethodOf.TYPE, Declaration.MethodOf.TENSOR,
                Declaration.MethodOf.NAMESPACE)
            .build());
    assertThat(list, hasSize(2));
    assertThat(list.get(0),
        hasToString("STATIC_ON_TYPE Tensor dot(TensorType ty, Tensor self,"
            + " Tensor tensor)"));
    assertThat(list.get(0).callExpression,
        is("Tensor.own(ty.call(\"dot\", self.handle(), tensor.handle()))"));
    assertThat(list.get(1).kind, is(InvocationKind.INSTANCE_METHOD));

    final List<ProcSignature> list2 =
        synthesize(dot().methodOf(Declaration.MethodOf.NAMESPACE).build());
    assertThat(list2, hasSize(1));
    assertThat(list2.get(0).callExpression,
        is("Tensor.own(Engine.call(\"at::dot\", self.handle(),"
            + " tensor.handle()))"));
    assertThat(synthesize(dot().build()), empty());
  }

  /** For an instance method, "self" moves to the front, but the engine
   * receives the other arguments in declared order. */
  @Test
  void testSelfFirst() {
    final Declaration declaration =
        Declaration.builder("addcmul")
            .methodOf(Declaration.MethodOf.TENSOR)
            .arg("value", "Scalar")
            .arg("self", "Tensor")
            .arg("tensor1", "Tensor")
            .ret("result", "Tensor")
            .build();
    final ProcSignature signature = synthesize(declaration).get(0);
    assertThat(signature,
        hasToString("INSTANCE_METHOD Tensor addcmul(Tensor self,"
            + " double value, Tensor tensor1)"));
    assertThat(signature.callExpression,
        is("Tensor.own(self.handle().call(\"addcmul\", value,"
            + " tensor1.handle()))"));
  }

  @Test
  void testMissingSelf() {
    final Declaration declaration =
        Declaration.builder("where")
            .methodOf(Declaration.MethodOf.TENSOR)
            .arg("self", "BoolTensor")
            .ret("result", "Tensor")
            .build();
    final GenerateException e =
        assertThrows(GenerateException.class, () -> synthesize(declaration));
    assertThat(e.reason, is(GenerateException.Reason.MISSING_SELF));
    assertThat(warnings, empty());

    // With "namespace", the function is still generated, with a warning.
    final Declaration declaration2 =
        Declaration.builder("where")
            .methodOf(Declaration.MethodOf.TENSOR,
                Declaration.MethodOf.NAMESPACE)
            .arg("condition", "BoolTensor")
            .ret("result", "Tensor")
            .build();
    final List<ProcSignature> list = synthesize(declaration2);
    assertThat(list, hasSize(1));
    assertThat(list.get(0).kind, is(InvocationKind.FREE_FUNCTION));
    assertThat(warnings, hasSize(1));
    assertThat(warnings.get(0).reason,
        is(GenerateException.Reason.MISSING_SELF));
  }

  @Test
  void testUnsupportedType() {
    final Declaration declaration =
        dot().methodOf(Declaration.MethodOf.TENSOR)
            .arg("names", "DimnameList")
            .build();
    final GenerateException e =
        assertThrows(GenerateException.class, () -> synthesize(declaration));
    assertThat(e.reason, is(GenerateException.Reason.UNSUPPORTED_TYPE));
    assertThat(builder.build().signatures, empty());
  }

  @Test
  void testNoReturns() {
    final Declaration declaration =
        Declaration.builder("set_")
            .methodOf(Declaration.MethodOf.TENSOR)
            .arg("self", "Tensor")
            .build();
    final GenerateException e =
        assertThrows(GenerateException.class, () -> synthesize(declaration));
    assertThat(e.reason, is(GenerateException.Reason.NO_RETURNS));
  }

  @Test
  void testTuple() {
    final Declaration declaration =
        Declaration.builder("conv_backward")
            .methodOf(Declaration.MethodOf.NAMESPACE)
            .arg("grad_output", "Tensor")
            .ret("grad_input", "Tensor")
            .ret("grad_weight", "Tensor")
            .ret("grad_bias", "Tensor")
            .build();
    final ProcSignature signature = synthesize(declaration).get(0);
    assertThat(signature.returns.isTuple(), is(true));
    assertThat(signature.returns.javaType(), is("ConvBackwardResult"));
    assertThat(signature.returns.fields,
        hasToString("[Tensor self, Tensor weight, Tensor bias]"));
    assertThat(signature.returns.fields.get(1).originalName, is("weight"));
    assertThat(signature.callExpression,
        is("ConvBackwardResult.of(Engine.call(\"at::conv_backward\","
            + " grad_output.handle()))"));

    // A different tuple under the same name gets an ordinal; the same tuple
    // is shared.
    final Declaration declaration2 =
        Declaration.builder("conv_backward")
            .methodOf(Declaration.MethodOf.NAMESPACE)
            .arg("grad_output", "Tensor")
            .arg("weight", "Tensor")
            .ret("grad_input", "Tensor")
            .ret("grad_weight", "Tensor")
            .build();
    assertThat(synthesize(declaration2).get(0).returns.javaType(),
        is("ConvBackwardResult1"));
    assertThat(synthesize(declaration).get(0).returns.javaType(),
        is("ConvBackwardResult"));
    assertThat(builder.build().tuples, hasSize(2));
  }

  /** Under NN mode, "foo_forward" is called "foo". */
  @Test
  void testNn() {
    final Declaration forward =
        Declaration.builder("thnn_conv2d_forward")
            .nn(true)
            .methodOf(Declaration.MethodOf.NAMESPACE)
            .arg("self", "Tensor")
            .ret("output", "Tensor")
            .build();
    final ProcSignature signature = synthesize(forward).get(0);
    assertThat(signature.originalName, is("thnn_conv2d_forward"));
    assertThat(signature.alternateName, is("thnn_conv2d"));
    assertThat(signature.displayName, is("thnn_conv2d"));
    assertThat(signature.callExpression,
        is("Tensor.own(Engine.call(\"at::thnn_conv2d_forward\","
            + " self.handle()))"));

    final Declaration plain =
        Declaration.builder("thnn_conv2d")
            .nn(true)
            .methodOf(Declaration.MethodOf.NAMESPACE)
            .arg("self", "Tensor")
            .ret("output", "Tensor")
            .build();
    assertThat(synthesize(plain), empty());

    final Declaration backward =
        Declaration.builder("thnn_conv2d_backward")
            .nn(true)
            .methodOf(Declaration.MethodOf.NAMESPACE)
            .arg("grad_output", "Tensor")
            .ret("grad_input", "Tensor")
            .build();
    final ProcSignature signature2 = synthesize(backward).get(0);
    assertThat(signature2.displayName, is("thnn_conv2d_backward"));
    assertThat(signature2.alternateName, nullValue());
  }

  @Test
  void testDefaults() {
    assertThat(translate("IntList", ImmutableList.of(0L, 1L)),
        is("new long[] {0, 1}"));
    assertThat(translate("IntList", ImmutableList.of()),
        is("new long[] {}"));
    assertThat(translate("IntList", 2L), is("new long[] {2}"));
    assertThat(translate("int64_t", -1L), is("-1L"));
    assertThat(translate("Scalar", 1L), is("1.0"));
    assertThat(translate("bool", true), is("true"));
    assertThat(translate("Generator*", "nullptr"), is("null"));
    assertThat(translate("Tensor", "nullptr"), is("null"));

    // Dropped.
    assertThat(translate("int64_t", "nullptr"), nullValue());
    assertThat(translate("int64_t", true), nullValue());
    assertThat(translate("double", 0.5), nullValue());
    assertThat(translate("ScalarType", "Long"), nullValue());
    assertThat(translate("Tensor", Declaration.Arg.OTHER), nullValue());
    assertThat(
        translate("IntList", ImmutableList.of(1L, Declaration.Arg.OTHER)),
        nullValue());
  }

  private static String translate(String type, Object value) {
    final Declaration.Arg arg = new Declaration.Arg("x", type, value);
    return SignatureSynthesizer.translateDefault("f", arg,
        TypeResolver.resolve(type));
  }

  @Test
  void testRequiredCount() {
    final Declaration declaration =
        Declaration.builder("sum")
            .methodOf(Declaration.MethodOf.TENSOR)
            .arg("self", "Tensor")
            .arg("dim", "IntList", 0L)
            .arg("keepdim", "bool", false)
            .ret("result", "Tensor")
            .build();
    final ProcSignature signature = synthesize(declaration).get(0);
    assertThat(signature.requiredCount(), is(1));
    assertThat(signature.parameters(1), is("Tensor self"));
    assertThat(signature.erasure(2), is("sum(Tensor, long[])"));
    assertThat(signature.args.get(1).defaultValue, is("new long[] {0}"));
    assertThat(signature.argTypes(), hasToString("[TENSOR, INT_LIST, BOOL]"));
  }
}

// End SignatureSynthesizerTest.java
