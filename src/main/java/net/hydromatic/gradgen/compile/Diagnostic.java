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

import java.util.Objects;

/**
 * Report that one declaration or formula was left out of the output, or, if
 * it is a warning, that it was generated in a reduced form.
 */
public final class Diagnostic {
  public final GenerateException.Reason reason;
  /** Name of the declaration, or header of the formula. */
  public final String entry;
  public final String message;
  /** Whether the entry was still generated. */
  public final boolean warning;

  public Diagnostic(
      GenerateException.Reason reason, String entry, String message) {
    this(reason, entry, message, false);
  }

  private Diagnostic(GenerateException.Reason reason, String entry,
      String message, boolean warning) {
    this.reason = requireNonNull(reason);
    this.entry = requireNonNull(entry);
    this.message = requireNonNull(message);
    this.warning = warning;
  }

  /** Creates a diagnostic from an exception thrown while processing. */
  public static Diagnostic of(String entry, GenerateException e) {
    return new Diagnostic(e.reason, entry, e.getMessage());
  }

  /** Creates a warning about an entry that was generated in part. */
  public static Diagnostic warning(String entry, GenerateException e) {
    return new Diagnostic(e.reason, entry, e.getMessage(), true);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reason, entry, message, warning);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Diagnostic
            && reason == ((Diagnostic) o).reason
            && entry.equals(((Diagnostic) o).entry)
            && message.equals(((Diagnostic) o).message)
            && warning == ((Diagnostic) o).warning;
  }

  /** Returns the one-line form, e.g. "NoReturns: foo: no return values". */
  @Override
  public String toString() {
    return reason.category + ": " + entry + ": " + message;
  }
}

// End Diagnostic.java
