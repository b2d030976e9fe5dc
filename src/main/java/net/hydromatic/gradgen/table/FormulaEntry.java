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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * One body field of a formula: the gradient of one or more forward
 * arguments.
 *
 * <p>For example, in the formula for "max_pool2d", the field
 * {@code "self": "max_pool2d_backward(grad, self, ...)"} has one output,
 * "self". A field whose key is comma-joined, such as
 * {@code "input, weight, bias"}, takes each output from the corresponding
 * component of a tuple.
 */
public final class FormulaEntry {
  private static final String NOT_IMPLEMENTED = "not_implemented";
  private static final Splitter COMMA = Splitter.on(',').trimResults();

  /** Names of the forward arguments, in order. */
  public final ImmutableList<String> outputs;
  /** Expression, as written. */
  public final String expression;
  /** Header of the formula that contains this entry. */
  public final String header;

  public FormulaEntry(String header, String key, String expression) {
    this.header = requireNonNull(header);
    this.outputs = ImmutableList.copyOf(COMMA.split(key));
    this.expression = requireNonNull(expression);
    checkArgument(!outputs.contains(""), "empty output name in '%s'", key);
  }

  /** Whether the expression says that the gradient is not implemented. */
  public boolean isNotImplemented() {
    return expression.trim().startsWith(NOT_IMPLEMENTED);
  }

  @Override
  public String toString() {
    return String.join(", ", outputs) + ": " + expression;
  }
}

// End FormulaEntry.java
