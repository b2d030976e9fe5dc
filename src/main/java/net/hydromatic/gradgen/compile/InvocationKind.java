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

/**
 * How a generated binding invokes the engine.
 *
 * <p>Each kind has a template for the leading parameter (if any) and for the
 * call expression. Every binding is a static method; an instance method takes
 * its receiver, {@code self}, as its first parameter.
 */
public enum InvocationKind {
  /** Method of a tensor; "self.handle().call("dot", ...)". */
  INSTANCE_METHOD(""),

  /** Function scoped to a tensor type; "ty.call("zeros", ...)". */
  STATIC_ON_TYPE("TensorType ty"),

  /** Free function in the engine's namespace; "Engine.call("at::cat", ...)". */
  FREE_FUNCTION("");

  /** Parameter declared ahead of the arguments, or empty. */
  public final String leadingParameter;

  InvocationKind(String leadingParameter) {
    this.leadingParameter = leadingParameter;
  }

  /**
   * Returns an expression that calls the engine entry point.
   *
   * @param originalName Name of the engine entry point, e.g. "dot"
   * @param args Arguments, already converted for passing to the engine and
   *     joined with ", "; for an instance method, excludes {@code self}
   */
  public String call(String originalName, String args) {
    final String rest = args.isEmpty() ? "" : ", " + args;
    switch (this) {
    case INSTANCE_METHOD:
      return "self.handle().call(\"" + originalName + "\"" + rest + ")";
    case STATIC_ON_TYPE:
      return "ty.call(\"" + originalName + "\"" + rest + ")";
    case FREE_FUNCTION:
      return "Engine.call(\"at::" + originalName + "\"" + rest + ")";
    default:
      throw new AssertionError(this);
    }
  }
}

// End InvocationKind.java
