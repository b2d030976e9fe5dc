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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableSet;

/**
 * Utilities for naming generated parameters, methods, fields and records.
 *
 * <p>All functions are pure, so that names are stable from run to run.
 */
public final class Names {
  private Names() {}

  /** Prefix that escapes a reserved name. */
  static final String ESCAPE = "a";

  /** Java keywords and literals, and the restricted identifiers. */
  static final ImmutableSet<String> JAVA_RESERVED =
      ImmutableSet.of(
          "abstract", "assert", "boolean", "break", "byte", "case", "catch",
          "char", "class", "const", "continue", "default", "do", "double",
          "else", "enum", "extends", "final", "finally", "float", "for",
          "goto", "if", "implements", "import", "instanceof", "int",
          "interface", "long", "native", "new", "package", "private",
          "protected", "public", "return", "short", "static", "strictfp",
          "super", "switch", "synchronized", "this", "throw", "throws",
          "transient", "try", "void", "volatile", "while", "true", "false",
          "null", "var", "yield", "record", "_");

  /** Names that generated code declares itself. */
  static final ImmutableSet<String> GENERATOR_RESERVED =
      ImmutableSet.of("ty", "fwd_result", "grad", "grad_input_mask", "grads",
          "result");

  /**
   * Converts a name from the tables into a valid Java identifier that does
   * not clash with the names generated code declares.
   *
   * <p>In order: a trailing "_" gets "u" appended; a leading "_" gets "u"
   * prepended; a reserved name gets {@link #ESCAPE} prepended; each "__" is
   * replaced by "_u_u".
   *
   * <p>For example, "dim_" becomes "dim_u", "_values" becomes "u_values",
   * "int" becomes "aint", and "a__b" becomes "a_u_ub".
   */
  public static String validate(String name) {
    String s = name;
    if (s.endsWith("_")) {
      s = s + "u";
    }
    if (s.startsWith("_")) {
      s = "u" + s;
    }
    if (JAVA_RESERVED.contains(s) || GENERATOR_RESERVED.contains(s)) {
      s = ESCAPE + s;
    }
    return s.replace("__", "_u_u");
  }

  /**
   * Converts the name of a return value into the name of a tuple field.
   *
   * @see #renameReturn(String)
   */
  public static String tupleField(String name) {
    return validate(renameReturn(name));
  }

  /**
   * Renames a return value, before it is made a valid identifier.
   *
   * <p>"grad_input" becomes "self", and a "grad_" prefix is removed, so that
   * the fields of a backward declaration's result are named after the forward
   * arguments that they differentiate. Formula bodies refer to return values
   * by this name.
   */
  public static String renameReturn(String name) {
    if (name.equals("grad_input")) {
      return "self";
    }
    if (name.startsWith("grad_") && name.length() > "grad_".length()) {
      return name.substring("grad_".length());
    }
    return name;
  }

  /** Converts "batch_norm" to "BatchNorm". */
  public static String upperCamel(String name) {
    final String s =
        CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name);
    return s.isEmpty() ? "U" : s;
  }
}

// End Names.java
