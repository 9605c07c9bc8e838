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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import net.hydromatic.chainer.ast.Ast;

/** Outcome of a forward-chaining run. */
public final class Result {
  public final Status status;
  public final Ast.Fact query;
  /** Number of rounds that added facts to the fact base. */
  public final int rounds;
  /** Every derivation, in the order it was made. */
  public final ImmutableList<InferenceStep> steps;
  /** Initial facts followed by derived facts, in order. */
  public final ImmutableSet<Ast.Fact> facts;

  Result(
      Status status,
      Ast.Fact query,
      int rounds,
      List<InferenceStep> steps,
      Iterable<Ast.Fact> facts) {
    this.status = requireNonNull(status);
    this.query = requireNonNull(query);
    this.rounds = rounds;
    this.steps = ImmutableList.copyOf(steps);
    this.facts = ImmutableSet.copyOf(facts);
  }

  /** Returns whether the query was derived (or was an initial fact). */
  public boolean proven() {
    return status == Status.QUERY_PROVEN;
  }

  /**
   * Returns the steps that a fact depends on, ending with the step that
   * derived it, in trace order.
   *
   * <p>Returns an empty list if the fact was an initial fact or was not
   * derived.
   */
  public ImmutableList<InferenceStep> derivation(Ast.Fact fact) {
    final Map<Ast.Fact, Integer> producers = new HashMap<>();
    for (int i = 0; i < steps.size(); i++) {
      producers.putIfAbsent(steps.get(i).fact, i);
    }
    final TreeSet<Integer> used = new TreeSet<>();
    final Deque<Ast.Fact> queue = new ArrayDeque<>();
    queue.add(fact);
    while (!queue.isEmpty()) {
      final Integer i = producers.get(queue.remove());
      if (i != null && used.add(i)) {
        queue.addAll(steps.get(i).sources);
      }
    }
    final ImmutableList.Builder<InferenceStep> builder =
        ImmutableList.builder();
    used.forEach(i -> builder.add(steps.get(i)));
    return builder.build();
  }

  @Override
  public String toString() {
    return "Result{status=" + status
        + ", query=" + query
        + ", rounds=" + rounds
        + ", steps=" + steps.size()
        + ", facts=" + facts.size()
        + "}";
  }

  /** How a run ended. */
  public enum Status {
    /** A round derived no new facts; the fact base is closed under the rules. */
    CONVERGED,
    /** The query is in the fact base. */
    QUERY_PROVEN,
    /**
     * The round cap was reached before convergence or proof. The result holds
     * the partial fact base and trace; the caller may retry with a larger cap.
     */
    ROUND_CAP_EXCEEDED,
    /** The run was cancelled between rounds. */
    CANCELLED
  }
}

// End Result.java
