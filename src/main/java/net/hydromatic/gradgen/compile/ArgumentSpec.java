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

import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Argument of a {@link ProcSignature}. */
public final class ArgumentSpec {
  /** Name in generated code, e.g. "aint" for an argument called "int". */
  public final String name;
  /** Name in the tables. */
  public final String originalName;
  public final TypeToken type;
  /** Default value as a Java expression, or null if there is no default. */
  public final @Nullable String defaultValue;

  public ArgumentSpec(String name, String originalName, TypeToken type,
      @Nullable String defaultValue) {
    this.name = requireNonNull(name);
    this.originalName = requireNonNull(originalName);
    this.type = requireNonNull(type);
    this.defaultValue = defaultValue;
  }

  /** Returns the parameter declaration, e.g. "long[] dims". */
  public String declaration() {
    return type.javaType + " " + name;
  }

  @Override
  public String toString() {
    return defaultValue == null
        ? declaration()
        : declaration() + " = " + defaultValue;
  }
}

// End ArgumentSpec.java
