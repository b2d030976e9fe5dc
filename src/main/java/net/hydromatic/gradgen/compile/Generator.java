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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.hydromatic.gradgen.table.Declaration;
import net.hydromatic.gradgen.table.DeclarationTable;
import net.hydromatic.gradgen.table.Formula;
import net.hydromatic.gradgen.table.FormulaTable;
import net.hydromatic.gradgen.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates forward bindings and backward procedures from a declaration
 * table and a formula table.
 *
 * <p>Runs in phases. First, every declaration is synthesized into
 * signatures and the registry is frozen. Then each formula is resolved
 * against the registry and rewritten; if {@link Prop#PARALLEL} is set,
 * formulas are processed in parallel, but results are collected in table
 * order. Finally both classes are written.
 *
 * <p>A problem with one declaration or formula leaves that entry out of the
 * output and becomes a {@link Diagnostic}; other entries are unaffected.
 */
public class Generator {
  private static final Logger LOGGER =
      Logger.getLogger(Generator.class.getName());

  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  public Generator(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Generates source from two tables. */
  public GenerationResult generate(DeclarationTable declarationTable,
      FormulaTable formulaTable) {
    final List<Diagnostic> diagnostics = new ArrayList<>();

    // Phase 1. Populate the registry.
    final ProcRegistry.Builder builder = ProcRegistry.builder();
    BuiltIn.forEach(builder::add);
    final SignatureSynthesizer synthesizer = new SignatureSynthesizer(builder);
    for (Declaration declaration : declarationTable.declarations) {
      try {
        synthesizer
            .synthesize(declaration,
                e ->
                    diagnostics.add(Diagnostic.warning(declaration.name, e)))
            .forEach(tracer::onSignature);
      } catch (GenerateException e) {
        diagnostics.add(Diagnostic.of(declaration.name, e));
      }
    }
    final ProcRegistry registry = builder.build();

    // Phase 2. Write bindings. Each binding left out reports one diagnostic.
    final Emitter emitter = new Emitter(map);
    int diagnosticCount = diagnostics.size();
    final String bindingsSource =
        emitter.bindings(registry, diagnostics::add);
    final int bindingCount = (int) registry.signatures.stream()
        .filter(signature -> !signature.builtin)
        .count() - (diagnostics.size() - diagnosticCount);

    // Phase 3. Resolve and rewrite formulas.
    final CandidateResolver resolver = new CandidateResolver(registry);
    final ExpressionRewriter rewriter = new ExpressionRewriter(registry, map);
    final Stream<Formula> stream = Prop.PARALLEL.booleanValue(map)
        ? formulaTable.formulas.parallelStream()
        : formulaTable.formulas.stream();
    final List<Outcome> outcomes = stream
        .map(formula -> process(resolver, rewriter, formula))
        .collect(Collectors.toList());
    final List<BackwardProc> procs = new ArrayList<>();
    for (Outcome outcome : outcomes) {
      if (outcome.proc != null) {
        procs.add(outcome.proc);
        tracer.onBackward(outcome.proc);
      } else {
        diagnostics.add(requireNonNull(outcome.diagnostic));
      }
    }

    // Phase 4. Write derivatives.
    diagnosticCount = diagnostics.size();
    final String derivativesSource =
        emitter.derivatives(procs, diagnostics::add);
    final int backwardCount =
        procs.size() - (diagnostics.size() - diagnosticCount);

    for (Diagnostic diagnostic : diagnostics) {
      LOGGER.fine(diagnostic::toString);
      tracer.onDiagnostic(diagnostic);
    }
    return new GenerationResult(bindingsSource, derivativesSource,
        diagnostics, registry, procs, bindingCount, backwardCount);
  }

  /** Resolves and rewrites one formula. Called from several threads. */
  private static Outcome process(CandidateResolver resolver,
      ExpressionRewriter rewriter, Formula formula) {
    try {
      final ProcSignature forward = resolver.resolve(formula.parsedHeader);
      return new Outcome(rewriter.rewrite(formula, forward), null);
    } catch (GenerateException e) {
      return new Outcome(null, Diagnostic.of(formula.header, e));
    }
  }

  /** Result of processing one formula: a procedure or a diagnostic. */
  private static class Outcome {
    final @Nullable BackwardProc proc;
    final @Nullable Diagnostic diagnostic;

    Outcome(@Nullable BackwardProc proc, @Nullable Diagnostic diagnostic) {
      this.proc = proc;
      this.diagnostic = diagnostic;
    }
  }
}

// End Generator.java
