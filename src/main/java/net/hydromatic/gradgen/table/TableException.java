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

import net.hydromatic.gradgen.util.GradgenException;

/**
 * An input table cannot be read, or is structurally malformed.
 *
 * <p>Unlike {@link net.hydromatic.gradgen.compile.GenerateException}, this
 * stops generation; nothing is written.
 */
public class TableException extends RuntimeException
    implements GradgenException {
  /** Name of the table, usually a file name. */
  public final String table;

  public TableException(String table, String message) {
    super(message);
    this.table = table;
  }

  public TableException(String table, String message, Throwable cause) {
    super(message, cause);
    this.table = table;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(table).append(": Error: ").append(getMessage());
  }
}

// End TableException.java
