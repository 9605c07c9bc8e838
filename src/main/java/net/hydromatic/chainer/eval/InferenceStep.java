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
package net.hydromatic.chainer.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.util.Substitution;

/**
 * One derivation: a rule, applied with a substitution to facts present before
 * the round began, produced a new fact.
 */
public final class InferenceStep {
  /** Round in which the fact was derived, starting at 1. */
  public final int round;
  /** Position of the rule in the rule list, starting at 0. */
  public final int ruleIndex;
  public final Ast.Rule rule;
  public final Substitution substitution;
  /** The rule's premises under the substitution, in premise order. */
  public final List<Ast.Fact> sources;
  public final Ast.Fact fact;

  InferenceStep(
      int round,
      int ruleIndex,
      Ast.Rule rule,
      Substitution substitution,
      List<Ast.Fact> sources,
      Ast.Fact fact) {
    this.round = round;
    this.ruleIndex = ruleIndex;
    this.rule = requireNonNull(rule);
    this.substitution = requireNonNull(substitution);
    this.sources = ImmutableList.copyOf(sources);
    this.fact = requireNonNull(fact);
  }

  @Override
  public String toString() {
    final StringBuilder b =
        new StringBuilder().append(fact).append(" <= ");
    for (int i = 0; i < sources.size(); i++) {
      b.append(i > 0 ? " & " : "").append(sources.get(i));
    }
    return b.append(" (rule ")
        .append(ruleIndex)
        .append(", round ")
        .append(round)
        .append(", ")
        .append(substitution)
        .append(')')
        .toString();
  }
}

// End InferenceStep.java
