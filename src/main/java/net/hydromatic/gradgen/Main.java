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
package net.hydromatic.gradgen;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.gradgen.compile.Diagnostic;
import net.hydromatic.gradgen.compile.GenerationResult;
import net.hydromatic.gradgen.compile.Generator;
import net.hydromatic.gradgen.compile.Tracers;
import net.hydromatic.gradgen.table.DeclarationTable;
import net.hydromatic.gradgen.table.FormulaTable;
import net.hydromatic.gradgen.table.TableException;
import net.hydromatic.gradgen.util.Prop;

/**
 * Command-line entry point.
 *
 * <p>Reads a declaration table and a formula table, and writes the bindings
 * and derivatives classes to the output directory. Arguments have the form
 * {@code --property=value}, for example
 *
 * <blockquote><pre>
 * gradgen --declarations=Declarations.json --derivatives=derivatives.json
 *     --outputDirectory=target/generated
 * </pre></blockquote>
 */
public class Main {
  private Main() {}

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    System.exit(run(ImmutableList.copyOf(args), System.out, System.err));
  }

  /**
   * Runs the generator, and returns the exit status: 0 if the classes were
   * written (perhaps with some entries left out), 1 if the arguments or
   * tables are invalid, in which case nothing is written.
   */
  public static int run(List<String> args, PrintStream out,
      PrintStream err) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (String arg : args) {
      if (arg.equals("--help")) {
        usage(out);
        return 0;
      }
      final int eq = arg.indexOf('=');
      if (!arg.startsWith("--") || eq < 0) {
        err.println("Error: invalid argument '" + arg + "'");
        usage(err);
        return 1;
      }
      try {
        Prop.lookup(arg.substring(2, eq))
            .setLenient(map, arg.substring(eq + 1));
      } catch (IllegalArgumentException e) {
        err.println("Error: " + e.getMessage());
        usage(err);
        return 1;
      }
    }
    final Object declarations = Prop.DECLARATIONS.get(map);
    final Object derivatives = Prop.DERIVATIVES.get(map);
    if (declarations == null || derivatives == null) {
      err.println("Error: both declarations and derivatives are required");
      usage(err);
      return 1;
    }

    final DeclarationTable declarationTable;
    final FormulaTable formulaTable;
    try {
      declarationTable =
          DeclarationTable.read(Prop.DECLARATIONS.fileValue(map).toPath());
      formulaTable =
          FormulaTable.read(Prop.DERIVATIVES.fileValue(map).toPath());
    } catch (TableException e) {
      err.println(e.describeTo(new StringBuilder()));
      return 1;
    }

    final GenerationResult result =
        new Generator(map, Tracers.empty())
            .generate(declarationTable, formulaTable);

    final File outputDirectory = Prop.OUTPUT_DIRECTORY.fileValue(map);
    try {
      write(outputDirectory, Prop.BINDINGS_CLASS.stringValue(map),
          result.bindingsSource);
      write(outputDirectory, Prop.DERIVATIVES_CLASS.stringValue(map),
          result.derivativesSource);
    } catch (IOException e) {
      err.println("Error: cannot write to " + outputDirectory + ": " + e);
      return 1;
    }

    for (Diagnostic diagnostic : result.diagnostics) {
      out.println(diagnostic);
    }
    out.println("Generated " + result.bindingCount + " bindings and "
        + result.backwardCount + " backward procedures; skipped "
        + countSkipped(result) + " entries");
    return 0;
  }

  /** Counts the entries that were left out; warnings do not count. */
  private static long countSkipped(GenerationResult result) {
    return result.diagnostics.stream()
        .filter(diagnostic -> !diagnostic.warning)
        .count();
  }

  private static void write(File directory, String className, String source)
      throws IOException {
    final Path dir = directory.toPath();
    Files.createDirectories(dir);
    Files.write(dir.resolve(className + ".java"),
        source.getBytes(StandardCharsets.UTF_8));
  }

  private static void usage(PrintStream out) {
    out.println("Usage: gradgen --declarations=FILE --derivatives=FILE"
        + " [--property=value]...");
    out.println("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      final Object value = prop.get(ImmutableMap.of());
      out.println("  " + prop.camelName
          + (value == null ? "" : " (default " + value + ")"));
    }
  }
}

// End Main.java
