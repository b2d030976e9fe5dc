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
import java.util.function.Consumer;
import net.hydromatic.gradgen.type.TypeToken;

/**
 * Helper procedures that formulas may call but that no declaration
 * describes.
 *
 * <p>Namespace helpers are static methods of the runtime's helpers class
 * (see {@link net.hydromatic.gradgen.util.Prop#HELPERS_CLASS}); instance
 * helpers are methods of {@code Tensor}. None is emitted as a binding, and
 * none is a candidate when resolving the declaration of a formula.
 */
public enum BuiltIn {
  /** Function "maybe_multiply(Tensor t, Scalar s)". */
  MAYBE_MULTIPLY("maybe_multiply", TypeToken.TENSOR),

  /** Gradient of "mm" with respect to its first argument. */
  MM_MAT1_BACKWARD("mm_mat1_backward", TypeToken.TENSOR),

  /** Gradient of "mm" with respect to its second argument. */
  MM_MAT2_BACKWARD("mm_mat2_backward", TypeToken.TENSOR),

  POW_BACKWARD("pow_backward", TypeToken.TENSOR),
  POW_BACKWARD_SELF("pow_backward_self", TypeToken.TENSOR),
  POW_BACKWARD_EXPONENT("pow_backward_exponent", TypeToken.TENSOR),
  ATAN2_BACKWARD("atan2_backward", TypeToken.TENSOR),
  SPLIT_BACKWARD("split_backward", TypeToken.TENSOR),
  SPLIT_WITH_SIZES_BACKWARD("split_with_sizes_backward", TypeToken.TENSOR),

  /** Method "Tensor.sizes()", the shape of a tensor. */
  SIZES(InvocationKind.INSTANCE_METHOD, "sizes", "sizes", TypeToken.INT_LIST),

  /** Method "Tensor.strides()". */
  STRIDES(InvocationKind.INSTANCE_METHOD, "strides", "strides",
      TypeToken.INT_LIST),

  /**
   * Method "Tensor.type()", whose name in Java is "getType" so as not to
   * suggest {@code Object.getClass()}.
   */
  TYPE(InvocationKind.INSTANCE_METHOD, "type", "getType",
      TypeToken.TENSOR_TYPE);

  public final InvocationKind kind;
  /** Name by which formulas call the helper. */
  public final String originalName;
  /** Name of the method in Java. */
  public final String displayName;
  public final TypeToken returnType;

  BuiltIn(String name, TypeToken returnType) {
    this(InvocationKind.FREE_FUNCTION, name, name, returnType);
  }

  BuiltIn(InvocationKind kind, String originalName, String displayName,
      TypeToken returnType) {
    this.kind = requireNonNull(kind);
    this.originalName = requireNonNull(originalName);
    this.displayName = requireNonNull(displayName);
    this.returnType = requireNonNull(returnType);
  }

  /** Returns the signature by which formulas see this helper. */
  public ProcSignature signature() {
    return new ProcSignature(originalName, null, displayName,
        ImmutableList.of(), ReturnShape.of(returnType), kind, "", true);
  }

  /** Calls a consumer with the signature of each built-in. */
  public static void forEach(Consumer<ProcSignature> consumer) {
    for (BuiltIn builtIn : values()) {
      consumer.accept(builtIn.signature());
    }
  }
}

// End BuiltIn.java
