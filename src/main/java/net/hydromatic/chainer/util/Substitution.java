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
package net.hydromatic.chainer.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.ast.AstBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable mapping from variables to terms.
 *
 * <p>A substitution is never modified; {@link #extend} returns a new one. A
 * search that backtracks can therefore revert to an earlier state by keeping a
 * reference to the earlier substitution.
 *
 * <p>Because terms have no function symbols, no chain of bindings can lead
 * back to the variable it started from, and {@link #resolve} terminates.
 */
public final class Substitution {
  /** The substitution that binds no variables. */
  public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  private final ImmutableMap<Ast.Variable, Ast.Term> map;

  private Substitution(ImmutableMap<Ast.Variable, Ast.Term> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a substitution from a map. */
  public static Substitution of(Map<Ast.Variable, ? extends Ast.Term> map) {
    return map.isEmpty() ? EMPTY : new Substitution(ImmutableMap.copyOf(map));
  }

  /**
   * Creates a substitution from alternating variable and term names.
   *
   * <p>For example, {@code of("x", "T1", "r", "A")} becomes
   * {@code [T1/x, A/r]}.
   */
  public static Substitution of(String... varTerms) {
    checkArgument(varTerms.length % 2 == 0,
        "expected variable and term pairs, got %s names", varTerms.length);
    Substitution s = EMPTY;
    for (int i = 0; i < varTerms.length; i += 2) {
      s =
          s.extend(
              AstBuilder.ast.variable(varTerms[i]),
              AstBuilder.ast.term(varTerms[i + 1]));
    }
    return s;
  }

  public int size() {
    return map.size();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the bindings, in the order they were added. */
  public ImmutableMap<Ast.Variable, Ast.Term> asMap() {
    return map;
  }

  /** Returns whether a variable is bound. */
  public boolean isBound(Ast.Variable variable) {
    return map.containsKey(variable);
  }

  /** Returns the term a variable is directly bound to, or null. */
  public Ast.@Nullable Term get(Ast.Variable variable) {
    return map.get(variable);
  }

  /**
   * Resolves a term, following bindings until reaching a constant or a
   * variable that is not bound.
   */
  public Ast.Term resolve(Ast.Term term) {
    Ast.Term current = term;
    while (current instanceof Ast.Variable) {
      final Ast.Term next = map.get(current);
      if (next == null) {
        break;
      }
      current = next;
    }
    return current;
  }

  /** Applies this substitution to every argument of a fact. */
  public Ast.Fact apply(Ast.Fact fact) {
    if (map.isEmpty() || fact.isGround()) {
      return fact;
    }
    final ImmutableList.Builder<Ast.Term> terms = ImmutableList.builder();
    fact.terms.forEach(term -> terms.add(resolve(term)));
    return AstBuilder.ast.fact(fact.name, terms.build());
  }

  /**
   * Returns a substitution that has all of the bindings of this one plus
   * {@code variable} bound to {@code term}.
   *
   * @throws IllegalStateException if the variable is already bound
   */
  public Substitution extend(Ast.Variable variable, Ast.Term term) {
    checkState(
        !map.containsKey(variable),
        "variable %s is already bound in %s",
        variable,
        this);
    return new Substitution(
        ImmutableMap.<Ast.Variable, Ast.Term>builderWithExpectedSize(
                map.size() + 1)
            .putAll(map)
            .put(variable, term)
            .build());
  }

  /**
   * Composes two substitutions.
   *
   * <p>The result binds each variable of {@code other} to its fully resolved
   * value in {@code other}, resolved again by this substitution, then adds
   * the bindings of this substitution whose variables {@code other} does not
   * bind. Bindings of a variable to itself are dropped. Applying the result
   * to a term is equivalent to applying {@code other} and then this
   * substitution, unless this substitution maps a variable onto one that
   * {@code other} binds.
   */
  public Substitution compose(Substitution other) {
    final Map<Ast.Variable, Ast.Term> composed = new LinkedHashMap<>();
    other.map.keySet().forEach(variable -> {
      final Ast.Term term = resolve(other.resolve(variable));
      if (!term.equals(variable)) {
        composed.put(variable, term);
      }
    });
    map.forEach(composed::putIfAbsent);
    return of(composed);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Substitution && map.equals(((Substitution) obj).map);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    map.forEach(
        (variable, term) ->
            buf.append(buf.length() > 1 ? ", " : "")
                .append(term)
                .append('/')
                .append(variable));
    return buf.append(']').toString();
  }
}

// End Substitution.java
