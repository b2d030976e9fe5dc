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

import static net.hydromatic.gradgen.table.Tables.bool;
import static net.hydromatic.gradgen.table.Tables.object;
import static net.hydromatic.gradgen.table.Tables.requireString;
import static net.hydromatic.gradgen.table.Tables.string;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration table: the ordered list of operations to bind.
 *
 * <p>The table is a JSON array of objects. Deprecated declarations and
 * out-variants (whose name contains "_out") are filtered out while reading;
 * records without a name are ignored.
 */
public final class DeclarationTable {
  public final String name;
  public final ImmutableList<Declaration> declarations;

  public DeclarationTable(String name, List<Declaration> declarations) {
    this.name = name;
    this.declarations = ImmutableList.copyOf(declarations);
  }

  /** Reads a declaration table from a file. */
  public static DeclarationTable read(Path path) {
    return of(path.toString(), Tables.parse(path));
  }

  /** Reads a declaration table from a reader. */
  public static DeclarationTable parse(String name, Reader reader) {
    return of(name, Tables.parse(name, reader));
  }

  private static DeclarationTable of(String table, JsonElement root) {
    if (!root.isJsonArray()) {
      throw new TableException(table, "expected an array of declarations");
    }
    final ImmutableList.Builder<Declaration> list = ImmutableList.builder();
    for (JsonElement e : root.getAsJsonArray()) {
      final JsonObject o = object(table, e);
      final String name = string(table, o, "name");
      if (name == null
          || bool(table, o, "deprecated")
          || name.contains("_out")) {
        continue;
      }
      list.add(toDeclaration(table, name, o));
    }
    return new DeclarationTable(table, list.build());
  }

  private static Declaration toDeclaration(
      String table, String name, JsonObject o) {
    final Declaration.Builder b = Declaration.builder(name);
    b.nn("NN".equals(string(table, o, "mode")));

    for (JsonElement m : array(table, o, "method_of", true)) {
      final String tag = m.isJsonPrimitive() ? m.getAsString() : m.toString();
      final Declaration.MethodOf methodOf = Declaration.MethodOf.of(tag);
      if (methodOf == null) {
        throw new TableException(
            table, "unknown method_of '" + tag + "' in " + name);
      }
      b.methodOf(methodOf);
    }

    for (JsonElement a : array(table, o, "arguments", true)) {
      final JsonObject arg = object(table, a);
      b.arg(
          requireString(table, arg, "name"),
          requireString(table, arg, "dynamic_type"),
          arg.has("default") ? toDefault(arg.get("default")) : null);
    }

    int i = 0;
    for (JsonElement r : array(table, o, "returns", false)) {
      final JsonObject ret = object(table, r);
      final String retName = string(table, ret, "name");
      b.ret(
          retName == null ? "result" + i : retName,
          requireString(table, ret, "dynamic_type"));
      ++i;
    }
    return b.build();
  }

  private static JsonArray array(
      String table, JsonObject o, String name, boolean required) {
    final JsonElement e = o.get(name);
    if (e == null || e.isJsonNull()) {
      if (required) {
        throw new TableException(table, "missing '" + name + "': " + o);
      }
      return new JsonArray();
    }
    if (!e.isJsonArray()) {
      throw new TableException(table, "'" + name + "' must be an array: " + o);
    }
    return e.getAsJsonArray();
  }

  /** Converts a JSON default value to a Java value. */
  private static @Nullable Object toDefault(JsonElement e) {
    if (e.isJsonNull()) {
      return null;
    }
    if (e.isJsonPrimitive()) {
      final JsonPrimitive p = e.getAsJsonPrimitive();
      if (p.isBoolean()) {
        return p.getAsBoolean();
      }
      if (p.isString()) {
        return p.getAsString();
      }
      final BigDecimal d = p.getAsBigDecimal();
      try {
        return d.longValueExact();
      } catch (ArithmeticException ignored) {
        return d.doubleValue();
      }
    }
    if (e.isJsonArray()) {
      final ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (JsonElement element : e.getAsJsonArray()) {
        final Object value = toDefault(element);
        list.add(value == null ? Declaration.Arg.OTHER : value);
      }
      return list.build();
    }
    return Declaration.Arg.OTHER;
  }
}

// End DeclarationTable.java
