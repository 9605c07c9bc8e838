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
package net.hydromatic.chainer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.chainer.compile.Analyzer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of the logic: terms, facts, rules and programs.
 *
 * <p>All nodes are immutable. Create them using {@link AstBuilder}.
 */
public class Ast {
  private Ast() {
    // Utility class
  }

  /**
   * Base class for the arguments of a fact.
   *
   * <p>Whether a term is a {@link Variable} or a {@link Constant} is decided
   * when it is created, and carried in its class.
   */
  public abstract static class Term {
    public final String name;

    Term(String name) {
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    /** Returns whether this term is a {@link Variable}. */
    public abstract boolean isVariable();

    @Override
    public String toString() {
      return name;
    }
  }

  /** A variable, ranging over individuals within one rule application. */
  public static final class Variable extends Term {
    Variable(String name) {
      super(name);
    }

    @Override
    public boolean isVariable() {
      return true;
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A constant, naming a specific individual. */
  public static final class Constant extends Term {
    Constant(String name) {
      super(name);
    }

    @Override
    public boolean isVariable() {
      return false;
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Constant && name.equals(((Constant) o).name);
    }

    @Override
    public int hashCode() {
      // Differs from a variable of the same name
      return ~name.hashCode();
    }
  }

  /**
   * A predicate applied to a list of terms, such as {@code Owns(A, x)}.
   *
   * <p>A fact with no variables is <em>ground</em>; only ground facts live in
   * a fact base. Facts with variables are templates, used as the premises and
   * conclusion of a {@link Rule}.
   */
  public static final class Fact {
    public final String name;
    public final List<Term> terms;
    private final boolean ground;
    private final int hash;

    Fact(String name, List<? extends Term> terms) {
      this.name = requireNonNull(name);
      this.terms = ImmutableList.copyOf(terms);
      this.ground = this.terms.stream().noneMatch(Term::isVariable);
      this.hash = name.hashCode() * 31 + this.terms.hashCode();
    }

    public int arity() {
      return terms.size();
    }

    /** Returns whether this fact contains no variables. */
    public boolean isGround() {
      return ground;
    }

    /** Returns the variables of this fact, in order of first occurrence. */
    public ImmutableSet<Variable> variables() {
      final ImmutableSet.Builder<Variable> builder = ImmutableSet.builder();
      for (Term term : terms) {
        if (term instanceof Variable) {
          builder.add((Variable) term);
        }
      }
      return builder.build();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Fact)) {
        return false;
      }
      final Fact fact = (Fact) o;
      return hash == fact.hash
          && name.equals(fact.name)
          && terms.equals(fact.terms);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public String toString() {
      if (terms.isEmpty()) {
        return name;
      }
      final StringBuilder b = new StringBuilder(name).append('(');
      for (int i = 0; i < terms.size(); i++) {
        if (i > 0) {
          b.append(',');
        }
        b.append(terms.get(i).name);
      }
      return b.append(')').toString();
    }
  }

  /**
   * A Horn rule: if every premise holds, the conclusion holds.
   *
   * <p>Every variable of the conclusion must occur in some premise; the
   * constructor throws {@link net.hydromatic.chainer.compile.UnsafeRuleException}
   * otherwise.
   */
  public static final class Rule {
    public final List<Fact> premises;
    public final Fact conclusion;

    Rule(List<Fact> premises, Fact conclusion) {
      this.premises = ImmutableList.copyOf(premises);
      this.conclusion = requireNonNull(conclusion);
      Analyzer.checkRuleSafety(this);
    }

    /** Returns the variables that the premises bind. */
    public ImmutableSet<Variable> premiseVariables() {
      final ImmutableSet.Builder<Variable> builder = ImmutableSet.builder();
      premises.forEach(premise -> builder.addAll(premise.variables()));
      return builder.build();
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Rule
              && premises.equals(((Rule) o).premises)
              && conclusion.equals(((Rule) o).conclusion);
    }

    @Override
    public int hashCode() {
      return premises.hashCode() * 31 + conclusion.hashCode();
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (int i = 0; i < premises.size(); i++) {
        b.append(i > 0 ? ", " : "").append(premises.get(i));
      }
      return b.append(" => ").append(conclusion).toString();
    }
  }

  /** The facts, rules and optional query read from a script. */
  public static final class Program {
    public final List<Fact> facts;
    public final List<Rule> rules;
    public final @Nullable Fact query;

    Program(List<Fact> facts, List<Rule> rules, @Nullable Fact query) {
      this.facts = ImmutableList.copyOf(facts);
      this.rules = ImmutableList.copyOf(rules);
      this.query = query;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      facts.forEach(fact -> b.append(fact).append(".\n"));
      rules.forEach(rule -> b.append(rule).append(".\n"));
      if (query != null) {
        b.append("?- ").append(query).append(".\n");
      }
      return b.toString();
    }
  }
}

// End Ast.java
