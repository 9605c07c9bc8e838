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
package net.hydromatic.chainer.compile;

import static java.lang.String.format;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.chainer.ast.Ast.Fact;
import net.hydromatic.chainer.ast.Ast.Rule;
import net.hydromatic.chainer.ast.Ast.Variable;

/**
 * Analyzer for facts, rules and queries.
 *
 * <p>Every check runs before the first round, so that malformed input fails
 * fast rather than part way through a fixpoint.
 */
public class Analyzer {
  private Analyzer() {
    // Utility class
  }

  /**
   * Checks the inputs of a run.
   *
   * @param facts Initial facts
   * @param rules Rules
   * @param query Query
   * @param strictArity Whether to check that each predicate has one arity
   * @throws NonGroundFactException if an initial fact contains a variable
   * @throws InvalidQueryException if the query contains a variable
   * @throws UnsafeRuleException if a rule is unsafe
   * @throws ArityMismatchException if {@code strictArity} and a predicate is
   *     used with different numbers of arguments
   */
  public static void analyze(
      Iterable<Fact> facts,
      Iterable<Rule> rules,
      Fact query,
      boolean strictArity) {
    checkFacts(facts);
    checkQuery(query);
    rules.forEach(Analyzer::checkRuleSafety);
    if (strictArity) {
      checkArity(facts, rules, query);
    }
  }

  /** Checks that every fact contains only constants. */
  private static void checkFacts(Iterable<Fact> facts) {
    for (Fact fact : facts) {
      if (!fact.isGround()) {
        throw new NonGroundFactException(
            format(
                "Fact %s is not ground: variable '%s'",
                fact, fact.variables().iterator().next()));
      }
    }
  }

  private static void checkQuery(Fact query) {
    if (!query.isGround()) {
      throw new InvalidQueryException(
          format(
              "Query %s is not ground: variable '%s'",
              query, query.variables().iterator().next()));
    }
  }

  /**
   * Checks that a rule is safe.
   *
   * <p>A rule is safe if each variable in its conclusion appears in at least
   * one premise. Otherwise the rule could derive a fact with a variable in it.
   */
  public static void checkRuleSafety(Rule rule) {
    final Set<Variable> groundedVars = rule.premiseVariables();
    for (Variable variable : rule.conclusion.variables()) {
      if (!groundedVars.contains(variable)) {
        throw new UnsafeRuleException(
            format(
                "Rule is unsafe. Variable '%s' in conclusion does not appear"
                    + " in any premise",
                variable.name),
            variable.name);
      }
    }
  }

  /**
   * Checks that each predicate is used with the same number of arguments in
   * every fact, premise, conclusion and query. The first use of a predicate
   * sets its arity.
   */
  private static void checkArity(
      Iterable<Fact> facts, Iterable<Rule> rules, Fact query) {
    final Map<String, Fact> firstUses = new HashMap<>();
    facts.forEach(fact -> checkArity(firstUses, fact, "fact"));
    for (Rule rule : rules) {
      for (Fact premise : rule.premises) {
        checkArity(firstUses, premise, "premise of rule " + rule);
      }
      checkArity(firstUses, rule.conclusion, "conclusion of rule " + rule);
    }
    checkArity(firstUses, query, "query");
  }

  private static void checkArity(
      Map<String, Fact> firstUses, Fact fact, String context) {
    final Fact firstUse = firstUses.putIfAbsent(fact.name, fact);
    if (firstUse != null && firstUse.arity() != fact.arity()) {
      throw new ArityMismatchException(
          format(
              "Predicate %s/%d in %s does not match earlier use %s/%d in %s",
              fact.name,
              fact.arity(),
              context,
              firstUse.name,
              firstUse.arity(),
              firstUse),
          fact.name,
          firstUse.arity(),
          fact.arity());
    }
  }
}

// End Analyzer.java
