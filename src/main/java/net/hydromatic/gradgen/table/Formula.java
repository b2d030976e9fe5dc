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
import java.util.List;
import net.hydromatic.gradgen.parse.FormulaParser;

/** One record of the formula table: a header and its body fields. */
public final class Formula {
  /** Header as written, e.g. "dot(Tensor self, Tensor tensor)". */
  public final String header;
  public final FormulaParser.Header parsedHeader;
  public final ImmutableList<FormulaEntry> entries;

  public Formula(String header, FormulaParser.Header parsedHeader,
      List<FormulaEntry> entries) {
    this.header = requireNonNull(header);
    this.parsedHeader = requireNonNull(parsedHeader);
    this.entries = ImmutableList.copyOf(entries);
  }

  /** Creates a formula, parsing its header. */
  public static Formula of(String header, List<FormulaEntry> entries) {
    return new Formula(header, FormulaParser.parse(header), entries);
  }

  @Override
  public String toString() {
    return header + entries;
  }
}

// End Formula.java
