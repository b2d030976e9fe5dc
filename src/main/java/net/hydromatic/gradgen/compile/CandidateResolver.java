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

import java.util.List;
import net.hydromatic.gradgen.parse.FormulaParser;
import net.hydromatic.gradgen.type.TypeToken;

/**
 * Finds the forward signature that a formula differentiates.
 *
 * <p>If several signatures share the formula's name, the first one (in
 * registration order) whose argument types equal the header's wins. This is
 * "first match", not "best match": two overloads with the same argument
 * types cannot be told apart, and the earlier one is chosen.
 */
public class CandidateResolver {
  private final ProcRegistry registry;

  public CandidateResolver(ProcRegistry registry) {
    this.registry = requireNonNull(registry);
  }

  /**
   * Resolves a formula header.
   *
   * @throws GenerateException with reason {@code UNKNOWN_DECLARATION} if no
   *     signature has the name, or {@code AMBIGUOUS_OR_MISSING_OVERLOAD} if
   *     several do but none has matching argument types
   */
  public ProcSignature resolve(FormulaParser.Header header) {
    final List<ProcSignature> candidates = registry.candidates(header.name);
    switch (candidates.size()) {
    case 0:
      throw new GenerateException(
          GenerateException.Reason.UNKNOWN_DECLARATION,
          "no declaration named '" + header.name + "'");
    case 1:
      return candidates.get(0);
    default:
      for (ProcSignature candidate : candidates) {
        if (matches(candidate, header.argTypes)) {
          return candidate;
        }
      }
      throw new GenerateException(
          GenerateException.Reason.AMBIGUOUS_OR_MISSING_OVERLOAD,
          "none of " + candidates.size() + " overloads of '" + header.name
              + "' has argument types " + header.argTypes);
    }
  }

  /**
   * Returns whether a signature's argument types equal a list of type tags.
   * A tag that does not resolve matches nothing.
   */
  static boolean matches(ProcSignature signature, List<String> argTypes) {
    final List<TypeToken> types = signature.argTypes();
    if (types.size() != argTypes.size()) {
      return false;
    }
    for (int i = 0; i < argTypes.size(); i++) {
      if (TypeResolver.lookup(argTypes.get(i)) != types.get(i)) {
        return false;
      }
    }
    return true;
  }
}

// End CandidateResolver.java
