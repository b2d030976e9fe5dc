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
package net.hydromatic.gradgen.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls generation.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * value in the map takes its default value.
 */
public enum Prop {
  /** Package of the generated bindings and derivatives classes. */
  BINDINGS_PACKAGE("bindingsPackage", String.class, true, "aten.generated"),

  /** Simple name of the class that holds the forward bindings. */
  BINDINGS_CLASS("bindingsClass", String.class, true, "Declarations"),

  /** Simple name of the class that holds the backward procedures. */
  DERIVATIVES_CLASS("derivativesClass", String.class, true, "Derivatives"),

  /**
   * Package of the runtime library that generated code calls into. It
   * provides {@code Tensor}, {@code EngineValue}, {@code Engine} and the
   * other types that declarations mention.
   */
  RUNTIME_PACKAGE("runtimePackage", String.class, true, "aten.runtime"),

  /**
   * Simple name of the hand-written runtime class that provides the helper
   * procedures that backward formulas call, such as {@code maybe_multiply}.
   */
  HELPERS_CLASS("helpersClass", String.class, true, "AutogradHelpers"),

  /**
   * Simple name of the runtime class whose static methods implement the
   * arithmetic, comparison and logical operators of formula bodies.
   */
  OPERATORS_CLASS("operatorsClass", String.class, true, "Operators"),

  /**
   * Boolean property "parallel" controls whether backward formulas are
   * resolved and rewritten in parallel. Output is the same either way.
   * Default is false.
   */
  PARALLEL("parallel", Boolean.class, true, false),

  /** File property "declarations" is the declaration table to read. */
  DECLARATIONS("declarations", File.class, false, null),

  /** File property "derivatives" is the formula table to read. */
  DERIVATIVES("derivatives", File.class, false, null),

  /**
   * File property "outputDirectory" is the directory into which the bindings
   * and derivatives sources are written. Default is the current directory.
   */
  OUTPUT_DIRECTORY("outputDirectory", File.class, true, new File("."));

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(
      String camelName,
      Class<?> type,
      boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or null if it has no value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, converting from a string if the property
   * is not a string property.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type == Boolean.class) {
        final String low = s.toLowerCase(Locale.ROOT);
        if (!low.equals("true") && !low.equals("false")) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be true or false");
        }
        set(map, Boolean.valueOf(low));
        return;
      }
      if (type == File.class) {
        set(map, new File(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
