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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table of the signatures synthesized from the declaration table, keyed by
 * original name.
 *
 * <p>A registry is populated by a {@link Builder} in a single write phase;
 * {@link Builder#build()} freezes it. Formula resolution and rewriting, which
 * happen afterwards and possibly in parallel, only read it.
 */
public final class ProcRegistry {
  /** All signatures, in registration order. */
  public final ImmutableList<ProcSignature> signatures;
  /** Tuple shapes, one per distinct record, in registration order. */
  public final ImmutableList<ReturnShape> tuples;
  private final ImmutableListMultimap<String, ProcSignature> byName;

  private ProcRegistry(ImmutableList<ProcSignature> signatures,
      ImmutableList<ReturnShape> tuples) {
    this.signatures = signatures;
    this.tuples = tuples;
    final ImmutableListMultimap.Builder<String, ProcSignature> b =
        ImmutableListMultimap.builder();
    for (ProcSignature signature : signatures) {
      b.put(signature.originalName, signature);
      if (signature.alternateName != null) {
        b.put(signature.alternateName, signature);
      }
    }
    this.byName = b.build();
  }

  /** Creates an empty builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the signatures that a formula whose header has a given name
   * could refer to: those whose original name matches, excluding built-ins,
   * in registration order.
   */
  public List<ProcSignature> candidates(String originalName) {
    final ImmutableList.Builder<ProcSignature> list = ImmutableList.builder();
    for (ProcSignature signature : byName.get(originalName)) {
      if (!signature.builtin && signature.originalName.equals(originalName)) {
        list.add(signature);
      }
    }
    return list.build();
  }

  /**
   * Returns the first signature that a formula body can call by a given
   * name, or null.
   *
   * <p>Matches the original or alternate name. Functions scoped to a tensor
   * type are not callable from formulas.
   */
  public @Nullable ProcSignature lookupCallable(String name) {
    for (ProcSignature signature : byName.get(name)) {
      if (signature.kind != InvocationKind.STATIC_ON_TYPE) {
        return signature;
      }
    }
    return null;
  }

  /** Builds a {@link ProcRegistry}. Not thread-safe; use once. */
  public static final class Builder {
    private final List<ProcSignature> signatures = new ArrayList<>();
    private final List<ReturnShape> tuples = new ArrayList<>();
    private final Map<List<Object>, ReturnShape> tupleByKey = new HashMap<>();
    private final NameGenerator nameGenerator = new NameGenerator();
    private boolean built;

    private Builder() {}

    /** Registers a signature. */
    @CanIgnoreReturnValue
    public Builder add(ProcSignature signature) {
      checkState(!built, "registry is frozen");
      signatures.add(signature);
      return this;
    }

    /**
     * Returns the tuple shape with the given fields for an operation,
     * creating it if this is the first time.
     *
     * <p>The record is named after the operation, for example "MaxResult"
     * for "max". If another operation of that name has a differently shaped
     * tuple, the second record gets an ordinal, "MaxResult1".
     */
    public ReturnShape tuple(String displayName,
        List<ReturnShape.Field> fields) {
      checkState(!built, "registry is frozen");
      final String baseName = Names.upperCamel(displayName) + "Result";
      final List<Object> key = ImmutableList.of(baseName, fields);
      final ReturnShape existing = tupleByKey.get(key);
      if (existing != null) {
        return existing;
      }
      final ReturnShape shape =
          ReturnShape.tuple(nameGenerator.unique(baseName), fields);
      tupleByKey.put(key, shape);
      tuples.add(shape);
      return shape;
    }

    /** Freezes the registry. The builder may not be used afterwards. */
    public ProcRegistry build() {
      checkState(!built, "registry is frozen");
      built = true;
      return new ProcRegistry(ImmutableList.copyOf(signatures),
          ImmutableList.copyOf(tuples));
    }
  }
}

// End ProcRegistry.java
