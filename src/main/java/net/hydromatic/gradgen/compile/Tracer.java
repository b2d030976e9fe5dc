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

/** Called on various events during generation. */
public interface Tracer {
  /** Called when a signature is registered. */
  void onSignature(ProcSignature signature);

  /** Called when a formula has been rewritten into a backward procedure. */
  void onBackward(BackwardProc proc);

  /** Called when a declaration or formula is left out of the output. */
  void onDiagnostic(Diagnostic diagnostic);
}

// End Tracer.java
