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
import java.util.List;
import java.util.Objects;
import net.hydromatic.gradgen.type.TypeToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a {@link ProcSignature} returns: either a single value, or a tuple of
 * named fields that generated code declares as a record.
 */
public final class ReturnShape {
  /** Type of a single value; null for a tuple. */
  public final @Nullable TypeToken type;
  /** Name of the record; null for a single value. */
  public final @Nullable String recordName;
  /** Fields of a tuple; empty for a single value. */
  public final ImmutableList<Field> fields;

  private ReturnShape(@Nullable TypeToken type, @Nullable String recordName,
      ImmutableList<Field> fields) {
    this.type = type;
    this.recordName = recordName;
    this.fields = requireNonNull(fields);
  }

  /** Creates a shape that returns one value. */
  public static ReturnShape of(TypeToken type) {
    return new ReturnShape(requireNonNull(type), null, ImmutableList.of());
  }

  /** Creates a shape that returns a tuple. */
  public static ReturnShape tuple(String recordName, List<Field> fields) {
    return new ReturnShape(null, requireNonNull(recordName),
        ImmutableList.copyOf(fields));
  }

  public boolean isTuple() {
    return recordName != null;
  }

  /** Returns the Java type, e.g. "Tensor" or "MaxResult". */
  public String javaType() {
    return recordName != null ? recordName : requireNonNull(type).javaType;
  }

  /**
   * Returns an expression that converts a value of type {@code EngineValue}
   * to this shape.
   */
  public String convert(String value) {
    return recordName != null
        ? recordName + ".of(" + value + ")"
        : requireNonNull(type).convert(value);
  }

  /** Returns the field with a given position, or null. */
  public @Nullable Field field(int i) {
    return i >= 0 && i < fields.size() ? fields.get(i) : null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, recordName, fields);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ReturnShape
            && type == ((ReturnShape) o).type
            && Objects.equals(recordName, ((ReturnShape) o).recordName)
            && fields.equals(((ReturnShape) o).fields);
  }

  @Override
  public String toString() {
    return recordName != null ? recordName + fields : javaType();
  }

  /** Field of a tuple. */
  public static final class Field {
    /** Name of the field, and of its accessor method, e.g. "self". */
    public final String name;
    /**
     * Name by which formula bodies refer to the field: the return value's
     * name after renaming, e.g. "weight" for "grad_weight".
     */
    public final String originalName;
    public final TypeToken type;

    public Field(String name, String originalName, TypeToken type) {
      this.name = requireNonNull(name);
      this.originalName = requireNonNull(originalName);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, originalName, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && name.equals(((Field) o).name)
              && originalName.equals(((Field) o).originalName)
              && type == ((Field) o).type;
    }

    @Override
    public String toString() {
      return type.javaType + " " + name;
    }
  }
}

// End ReturnShape.java
