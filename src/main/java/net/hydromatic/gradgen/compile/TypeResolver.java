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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps the type tags of the declaration and formula tables to {@link
 * TypeToken}s.
 *
 * <p>Resolution is a pure function of the tag.
 */
public final class TypeResolver {
  private TypeResolver() {}

  private static final ImmutableMap<String, TypeToken> TAGS =
      ImmutableMap.<String, TypeToken>builder()
          .put("Tensor", TypeToken.TENSOR)
          .put("BoolTensor", TypeToken.TENSOR)
          .put("IndexTensor", TypeToken.TENSOR)
          .put("IntegerTensor", TypeToken.TENSOR)
          .put("TensorList", TypeToken.TENSOR_LIST)
          .put("int64_t", TypeToken.INT64)
          .put("bool", TypeToken.BOOL)
          .put("real", TypeToken.FLOAT)
          .put("accreal", TypeToken.FLOAT)
          .put("Scalar", TypeToken.FLOAT)
          .put("double", TypeToken.FLOAT)
          .put("Generator*", TypeToken.GENERATOR)
          .put("Generator *", TypeToken.GENERATOR)
          .put("Generator", TypeToken.GENERATOR)
          .put("IntList", TypeToken.INT_LIST)
          .put("std::string", TypeToken.STRING)
          .put("std::array<bool,2>", TypeToken.BOOL_ARRAY_2)
          .put("std::array<bool,3>", TypeToken.BOOL_ARRAY_3)
          .put("std::array<bool,4>", TypeToken.BOOL_ARRAY_4)
          .put("ScalarType", TypeToken.SCALAR_TYPE)
          .put("Type", TypeToken.TENSOR_TYPE)
          .put("TensorOptions", TypeToken.TENSOR_OPTIONS)
          .put("Storage", TypeToken.STORAGE)
          .put("SparseTensorRef", TypeToken.SPARSE_TENSOR_REF)
          .build();

  /** Returns the token for a type tag, or null if the tag is not supported. */
  public static @Nullable TypeToken lookup(String tag) {
    return TAGS.get(tag.trim());
  }

  /**
   * Returns the token for a type tag.
   *
   * @throws GenerateException with reason {@code UNSUPPORTED_TYPE} if the tag
   *     is not supported
   */
  public static TypeToken resolve(String tag) {
    final TypeToken token = lookup(tag);
    if (token == null) {
      throw new GenerateException(
          GenerateException.Reason.UNSUPPORTED_TYPE,
          "unsupported type '" + tag + "'");
    }
    return token;
  }
}

// End TypeResolver.java
