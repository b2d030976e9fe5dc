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

import net.hydromatic.gradgen.util.GradgenException;

/**
 * A table entry (declaration or formula) cannot be generated.
 *
 * <p>Thrown inside synthesis, resolution or rewriting, and caught at the
 * boundary of the entry, which is then left out of the output. Generation of
 * other entries continues.
 */
public class GenerateException extends RuntimeException
    implements GradgenException {
  public final Reason reason;

  public GenerateException(Reason reason, String message) {
    super(message);
    this.reason = requireNonNull(reason);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(reason.category).append(": ").append(getMessage());
  }

  /** Why an entry was skipped. */
  public enum Reason {
    UNSUPPORTED_TYPE("UnsupportedType"),
    MISSING_SELF("MissingSelf"),
    NO_RETURNS("NoReturns"),
    AMBIGUOUS_OR_MISSING_OVERLOAD("AmbiguousOrMissingOverload"),
    UNKNOWN_DECLARATION("UnknownDeclaration"),
    MISSING_DEPENDENCY("MissingDependency"),
    UNSUPPORTED_MULTI_GRAD_SHAPE("UnsupportedMultiGradShape"),
    /** A formula body does not parse, or names an output twice. */
    MALFORMED_FORMULA("MalformedFormula"),
    /** A tuple component is taken from an expression that is not a tuple. */
    UNSUPPORTED_TUPLE_SHAPE("UnsupportedTupleShape"),
    /** A binding or backward procedure has the same erasure as another. */
    DUPLICATE_SIGNATURE("DuplicateSignature"),
    /** Every output of a formula is marked as not implemented. */
    NOT_IMPLEMENTED("NotImplemented");

    /** Name that appears in diagnostics, e.g. "UnsupportedType". */
    public final String category;

    Reason(String category) {
      this.category = category;
    }
  }
}

// End GenerateException.java
