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

/** Output of a {@link Generator}. */
public final class GenerationResult {
  /** Java source of the bindings class. */
  public final String bindingsSource;
  /** Java source of the derivatives class. */
  public final String derivativesSource;
  /** Entries that were left out, in the order they were encountered. */
  public final ImmutableList<Diagnostic> diagnostics;
  public final ProcRegistry registry;
  /** Backward procedures, in table order. */
  public final ImmutableList<BackwardProc> backwardProcs;
  /** Number of binding methods written, not counting default overloads. */
  public final int bindingCount;
  /** Number of backward procedures written. */
  public final int backwardCount;

  GenerationResult(String bindingsSource, String derivativesSource,
      List<Diagnostic> diagnostics, ProcRegistry registry,
      List<BackwardProc> backwardProcs, int bindingCount,
      int backwardCount) {
    this.bindingsSource = requireNonNull(bindingsSource);
    this.derivativesSource = requireNonNull(derivativesSource);
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.registry = requireNonNull(registry);
    this.backwardProcs = ImmutableList.copyOf(backwardProcs);
    this.bindingCount = bindingCount;
    this.backwardCount = backwardCount;
  }
}

// End GenerationResult.java
