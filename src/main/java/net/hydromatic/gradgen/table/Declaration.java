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
package net.hydromatic.gradgen.table;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** One record of the declaration table: the callable shape of an operation. */
public final class Declaration {
  public final String name;
  /** Whether this is a neural-network declaration ("mode: NN"). */
  public final boolean nn;
  public final ImmutableSet<MethodOf> methodOf;
  public final ImmutableList<Arg> arguments;
  public final ImmutableList<Ret> returns;

  Declaration(
      String name,
      boolean nn,
      Set<MethodOf> methodOf,
      List<Arg> arguments,
      List<Ret> returns) {
    this.name = requireNonNull(name);
    this.nn = nn;
    this.methodOf = ImmutableSet.copyOf(methodOf);
    this.arguments = ImmutableList.copyOf(arguments);
    this.returns = ImmutableList.copyOf(returns);
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return name + arguments + " -> " + returns;
  }

  /** Invocation styles that a declaration requests. */
  public enum MethodOf {
    /** Function scoped to a tensor type ("Type"). */
    TYPE("Type"),
    /** Method of a tensor ("Tensor"). */
    TENSOR("Tensor"),
    /** Free function in the engine's namespace ("namespace"). */
    NAMESPACE("namespace");

    /** Spelling in the table. */
    public final String tag;

    MethodOf(String tag) {
      this.tag = tag;
    }

    /** Looks up a value by its spelling in the table, or returns null. */
    public static @Nullable MethodOf of(String tag) {
      for (MethodOf m : values()) {
        if (m.tag.equals(tag)) {
          return m;
        }
      }
      return null;
    }
  }

  /**
   * Argument of a declaration.
   *
   * <p>The default value, if present, is a {@link Long}, {@link Double},
   * {@link Boolean}, {@link String}, or a {@link List} of such values; any
   * other JSON shape is represented by {@link #OTHER}.
   */
  public static final class Arg {
    /** Placeholder for a default value whose shape is not recognized. */
    public static final Object OTHER = new Object();

    public final String name;
    public final String dynamicType;
    public final @Nullable Object defaultValue;

    public Arg(String name, String dynamicType, @Nullable Object defaultValue) {
      this.name = requireNonNull(name);
      this.dynamicType = requireNonNull(dynamicType);
      this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
      return dynamicType + " " + name;
    }
  }

  /** Return value of a declaration. */
  public static final class Ret {
    public final String name;
    public final String dynamicType;

    public Ret(String name, String dynamicType) {
      this.name = requireNonNull(name);
      this.dynamicType = requireNonNull(dynamicType);
    }

    @Override
    public String toString() {
      return dynamicType + " " + name;
    }
  }

  /** Builder for {@link Declaration}. */
  public static final class Builder {
    private final String name;
    private boolean nn;
    private final Set<MethodOf> methodOf = EnumSet.noneOf(MethodOf.class);
    private final List<Arg> arguments = new ArrayList<>();
    private final List<Ret> returns = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder nn(boolean nn) {
      this.nn = nn;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder methodOf(MethodOf... methodOfs) {
      methodOf.addAll(ImmutableList.copyOf(methodOfs));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder arg(String name, String dynamicType) {
      return arg(name, dynamicType, null);
    }

    @CanIgnoreReturnValue
    public Builder arg(
        String name, String dynamicType, @Nullable Object defaultValue) {
      arguments.add(new Arg(name, dynamicType, defaultValue));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder ret(String name, String dynamicType) {
      returns.add(new Ret(name, dynamicType));
      return this;
    }

    public Declaration build() {
      return new Declaration(name, nn, methodOf, arguments, returns);
    }
  }
}

// End Declaration.java
