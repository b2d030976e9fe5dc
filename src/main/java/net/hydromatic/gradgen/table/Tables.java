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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for reading JSON tables. */
abstract class Tables {
  private Tables() {}

  /** Parses a reader as JSON. Throws if the JSON is malformed. */
  static JsonElement parse(String table, Reader reader) {
    try {
      return JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new TableException(table, "malformed JSON: " + e.getMessage(), e);
    }
  }

  /** Parses a file as JSON. Throws if it cannot be read or is malformed. */
  static JsonElement parse(Path path) {
    final String table = path.toString();
    try (Reader reader =
             Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(table, reader);
    } catch (IOException e) {
      throw new TableException(table, "cannot read: " + e.getMessage(), e);
    }
  }

  /**
   * Returns the value of a string member, or null if the object has no such
   * member. Throws if the member is not a string.
   */
  static @Nullable String string(String table, JsonObject o, String name) {
    final JsonElement e = o.get(name);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
      throw new TableException(table, "'" + name + "' must be a string: " + o);
    }
    return e.getAsString();
  }

  /** Returns the value of a string member, throwing if it is absent. */
  static String requireString(String table, JsonObject o, String name) {
    final String s = string(table, o, name);
    if (s == null) {
      throw new TableException(table, "missing '" + name + "': " + o);
    }
    return s;
  }

  /** Returns the value of a boolean member, or false if absent. */
  static boolean bool(String table, JsonObject o, String name) {
    final JsonElement e = o.get(name);
    if (e == null || e.isJsonNull()) {
      return false;
    }
    if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
      throw new TableException(table, "'" + name + "' must be a boolean: " + o);
    }
    return e.getAsBoolean();
  }

  /** Checks that an element is an object, and returns it. */
  static JsonObject object(String table, JsonElement e) {
    if (!e.isJsonObject()) {
      throw new TableException(table, "expected an object: " + e);
    }
    return e.getAsJsonObject();
  }
}

// End Tables.java
