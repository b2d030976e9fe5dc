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
package net.hydromatic.gradgen.type;

/**
 * Recognized type of an argument or return value, and the Java type that
 * generated code uses for it.
 *
 * <p>The set is closed. A declaration that uses a type tag that does not map
 * to one of these tokens cannot be bound.
 *
 * @see net.hydromatic.gradgen.compile.TypeResolver
 */
public enum TypeToken {
  /** Tensor reference. */
  TENSOR("Tensor"),
  /** List of tensor references. */
  TENSOR_LIST("List<Tensor>"),
  /** 64-bit integer. */
  INT64("long"),
  BOOL("boolean"),
  /** Floating-point scalar. */
  FLOAT("double"),
  /** Random number generator handle; may be null. */
  GENERATOR("Generator"),
  /** List of 64-bit integers, such as a size or a list of dimensions. */
  INT_LIST("long[]"),
  STRING("String"),
  BOOL_ARRAY_2("boolean[]", 2),
  BOOL_ARRAY_3("boolean[]", 3),
  BOOL_ARRAY_4("boolean[]", 4),
  /** Type descriptor of the elements of a tensor. */
  SCALAR_TYPE("ScalarType"),
  /** Type descriptor of a tensor (backend and element type). */
  TENSOR_TYPE("TensorType"),
  TENSOR_OPTIONS("TensorOptions"),
  STORAGE("Storage"),
  SPARSE_TENSOR_REF("SparseTensorRef");

  /** Java type, e.g. {@code long[]}. */
  public final String javaType;

  /** Number of elements of a fixed-size array, or -1. */
  public final int arity;

  TypeToken(String javaType) {
    this(javaType, -1);
  }

  TypeToken(String javaType, int arity) {
    this.javaType = javaType;
    this.arity = arity;
  }

  /** Returns whether values of this type are Java primitives. */
  public boolean isPrimitive() {
    return this == INT64 || this == BOOL || this == FLOAT;
  }

  /**
   * Returns the type as it contributes to a method's erasure; for example
   * {@code List<Tensor>} erases to {@code List}.
   */
  public String erasure() {
    final int i = javaType.indexOf('<');
    return i < 0 ? javaType : javaType.substring(0, i);
  }

  /**
   * Returns an expression that converts an expression of type {@code
   * EngineValue} to this type.
   *
   * <p>Tensors take ownership of the engine's handle.
   */
  public String convert(String value) {
    switch (this) {
    case TENSOR:
      return "Tensor.own(" + value + ")";
    case TENSOR_LIST:
      return "Tensor.ownAll(" + value + ")";
    case INT64:
      return value + ".toLong()";
    case BOOL:
      return value + ".toBoolean()";
    case FLOAT:
      return value + ".toDouble()";
    default:
      return value + ".to(" + javaType + ".class)";
    }
  }

  /**
   * Returns an expression that passes an argument of this type to the
   * engine. Tensors pass their handle.
   */
  public String pass(String name) {
    return this == TENSOR ? name + ".handle()" : name;
  }
}

// End TypeToken.java
