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
package net.hydromatic.gradgen.ast;

import java.util.Objects;

/**
 * Position of a parse-tree node within the text of a formula body.
 *
 * <p>Columns are 1-based; the end column is inclusive.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0);

  public final String file;
  public final int startColumn;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(String file, int startColumn, int endColumn) {
    this.file = file;
    this.startColumn = startColumn;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two 0-based offsets, the end exclusive. */
  public static Pos of(String file, int startOffset, int endOffset) {
    return new Pos(file, startOffset + 1, Math.max(startOffset, endOffset - 1)
        + 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startColumn, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startColumn == ((Pos) o).startColumn
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file).append(file.isEmpty() ? "" : ":").append(startColumn);
    if (endColumn != startColumn) {
      buf.append('-').append(endColumn);
    }
    return buf;
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    if (this.equals(ZERO)) {
      return pos;
    }
    if (pos.equals(ZERO)) {
      return this;
    }
    return new Pos(file,
        Math.min(startColumn, pos.startColumn),
        Math.max(endColumn, pos.endColumn));
  }
}

// End Pos.java
