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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mutable state while rewriting the body fields of one formula.
 *
 * <p>Owned by one formula; not shared between threads.
 */
class RewriteContext {
  /** Maps the text of each bound expression to the name it is bound to. */
  private final Map<String, String> boundNames = new HashMap<>();
  private final NameGenerator nameGenerator = new NameGenerator();
  private final List<String> statements = new ArrayList<>();
  private @Nullable String guardCondition;
  private boolean mask;

  /**
   * Creates a context.
   *
   * @param takenNames Names already declared, such as parameters, that a
   *     bound expression must not use
   */
  RewriteContext(Iterable<String> takenNames) {
    takenNames.forEach(nameGenerator::inc);
  }

  /**
   * Returns the name bound to an expression. The first time an expression is
   * seen, binds it to a new name based on {@code fieldName}, and adds a
   * statement that declares it.
   */
  String bind(String expression, String fieldName) {
    final String existing = boundNames.get(expression);
    if (existing != null) {
      return existing;
    }
    final String name = nameGenerator.unique(fieldName + "_result");
    statements.add("final var " + name + " = " + expression + ";");
    boundNames.put(expression, name);
    return name;
  }

  /**
   * Records that the body may only be evaluated when a condition is false;
   * only the first call has any effect.
   */
  void guard(String condition) {
    if (guardCondition == null) {
      guardCondition = condition;
    }
  }

  /** Records that the body refers to the output mask. */
  void addMask() {
    mask = true;
  }

  @Nullable String guardCondition() {
    return guardCondition;
  }

  boolean mask() {
    return mask;
  }

  ImmutableList<String> statements() {
    return ImmutableList.copyOf(statements);
  }
}

// End RewriteContext.java
