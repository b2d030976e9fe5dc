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
package net.hydromatic.gradgen.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import net.hydromatic.gradgen.ast.Ast;
import net.hydromatic.gradgen.ast.Pos;

/**
 * Parses formula headers and formula bodies.
 *
 * <p>A header such as
 * {@code "addmm(Tensor self, Tensor mat1, *, Scalar beta=1)"} yields a
 * declaration name and a list of argument type tags. A body such as
 * {@code "grad * other.conj() + at::zeros_like(self)"} yields an expression
 * tree.
 *
 * <p>The grammar, in {@code FormulaParser.jj}, is a subset of C++:
 * identifiers (possibly qualified with "::"), literals, brace lists, calls,
 * method calls, member access, indexing, unary, binary and conditional
 * operators, and parentheses. The "at::" namespace prefix is dropped while
 * reading.
 */
public final class FormulaParser {
  private FormulaParser() {}

  /**
   * Parses a header.
   *
   * <p>The name may be qualified ("at::foo", "Tensor.foo"); the last segment
   * is returned. Commas inside angle brackets and parentheses do not separate
   * arguments, so {@code std::array<bool,2> mask} is one argument. A lone
   * {@code *} separates required and keyword arguments, and is discarded. Of
   * each {@code <type> <name>[=default]} argument, only the type is kept.
   *
   * @throws FormulaParseException if the header does not have this shape
   */
  public static Header parse(String header) {
    final FormulaParserImpl parser = parser(header);
    try {
      return parser.headerEof();
    } catch (ParseException e) {
      throw wrap(header, e);
    }
  }

  /**
   * Parses the body of a formula.
   *
   * @throws FormulaParseException if the text is not a valid expression
   */
  public static Ast.Exp parseExpression(String text) {
    final FormulaParserImpl parser = parser(text);
    try {
      return parser.expressionEof();
    } catch (ParseException e) {
      throw wrap(text, e);
    }
  }

  private static FormulaParserImpl parser(String text) {
    // One line, so that a token's columns are offsets into the text.
    final String line = CharMatcher.whitespace().replaceFrom(text, ' ');
    final FormulaParserImpl parser =
        new FormulaParserImpl(new StringReader(line));
    parser.setText(line);
    return parser;
  }

  /** Converts the parser's exception into one that reports the offending
   * token and its position. */
  private static FormulaParseException wrap(String text, ParseException e) {
    final Token t =
        e.currentToken == null ? null : e.currentToken.next;
    if (t == null) {
      return new FormulaParseException(e.getMessage(),
          Pos.of("", 0, text.length()), e);
    }
    if (t.kind == FormulaParserImplConstants.EOF) {
      return new FormulaParseException("unexpected '<EOF>'",
          Pos.of("", text.length(), text.length()), e);
    }
    return new FormulaParseException("unexpected '" + t.image + "'",
        new Pos("", t.beginColumn, t.endColumn), e);
  }

  /** Name and argument types of a formula header. */
  public static final class Header {
    /** Bare name of the declaration, for example "addmm". */
    public final String name;
    /** Type tags of the arguments, in order, for example "Tensor". */
    public final ImmutableList<String> argTypes;

    public Header(String name, ImmutableList<String> argTypes) {
      this.name = requireNonNull(name);
      this.argTypes = requireNonNull(argTypes);
    }

    @Override
    public String toString() {
      return name + argTypes;
    }
  }
}

// End FormulaParser.java
