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

import static net.hydromatic.gradgen.table.Tables.object;
import static net.hydromatic.gradgen.table.Tables.string;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.gradgen.parse.FormulaParseException;
import net.hydromatic.gradgen.parse.FormulaParser;

/**
 * Formula table: the backward formula of each differentiable operation.
 *
 * <p>The table is a JSON array of objects. The "name" member of each object
 * is the header, such as {@code "dot(Tensor self, Tensor tensor)"}; each
 * other member whose value is a string is a body field. Members whose values
 * are not strings, such as "output_differentiability", are ignored, as are
 * records without a name.
 */
public final class FormulaTable {
  private static final String NAME = "name";

  public final String name;
  public final ImmutableList<Formula> formulas;

  public FormulaTable(String name, List<Formula> formulas) {
    this.name = name;
    this.formulas = ImmutableList.copyOf(formulas);
  }

  /** Reads a formula table from a file. */
  public static FormulaTable read(Path path) {
    return of(path.toString(), Tables.parse(path));
  }

  /** Reads a formula table from a reader. */
  public static FormulaTable parse(String name, Reader reader) {
    return of(name, Tables.parse(name, reader));
  }

  private static FormulaTable of(String table, JsonElement root) {
    if (!root.isJsonArray()) {
      throw new TableException(table, "expected an array of formulas");
    }
    final ImmutableList.Builder<Formula> list = ImmutableList.builder();
    for (JsonElement e : root.getAsJsonArray()) {
      final JsonObject o = object(table, e);
      final String header = string(table, o, NAME);
      if (header == null) {
        continue;
      }
      final FormulaParser.Header parsedHeader;
      try {
        parsedHeader = FormulaParser.parse(header);
      } catch (FormulaParseException ex) {
        throw new TableException(table,
            "malformed header '" + header + "': " + ex.getMessage(), ex);
      }
      final List<FormulaEntry> entries = new ArrayList<>();
      for (Map.Entry<String, JsonElement> member : o.entrySet()) {
        final JsonElement value = member.getValue();
        if (member.getKey().equals(NAME)
            || !value.isJsonPrimitive()
            || !value.getAsJsonPrimitive().isString()) {
          continue;
        }
        try {
          entries.add(
              new FormulaEntry(header, member.getKey(), value.getAsString()));
        } catch (IllegalArgumentException ex) {
          throw new TableException(table, ex.getMessage(), ex);
        }
      }
      list.add(new Formula(header, parsedHeader, entries));
    }
    return new FormulaTable(table, list.build());
  }
}

// End FormulaTable.java
