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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.util.Substitution;

/**
 * Finds every substitution that satisfies a conjunction of premises.
 *
 * <p>This is a join of the fact relation with itself, with unification as the
 * join condition, evaluated by ordered backtracking. The first premise is
 * matched against each candidate fact; for each match, the remaining premises
 * are solved under the extended substitution.
 *
 * <p>Results are produced lazily. Each call to {@link Iterable#iterator()}
 * starts an independent search with its own state, so one result may be
 * iterated several times, or from several threads at once.
 */
public final class Solver {
  private Solver() {}

  /**
   * Returns the extensions of {@code sub0} that unify each premise, in order,
   * with some fact in {@code facts}.
   *
   * <p>Callers must not depend on the order of the results, only on the set.
   */
  public static Iterable<Substitution> solve(
      List<Ast.Fact> premises, Collection<Ast.Fact> facts, Substitution sub0) {
    return solve(premises, FactBase.Snapshot.of(facts), sub0);
  }

  /** As {@link #solve(List, Collection, Substitution)}, over a snapshot. */
  public static Iterable<Substitution> solve(
      List<Ast.Fact> premises, FactBase.Snapshot snapshot, Substitution sub0) {
    final ImmutableList<Ast.Fact> premiseList = ImmutableList.copyOf(premises);
    requireNonNull(snapshot, "snapshot");
    requireNonNull(sub0, "sub0");
    return () -> new SolutionIterator(premiseList, snapshot, sub0);
  }

  /**
   * Backtracking search with an explicit stack.
   *
   * <p>Level {@code d} of the stack holds the substitution in force before
   * premise {@code d} is matched, and the candidates for premise {@code d}
   * with the position of the next one to try.
   */
  private static class SolutionIterator extends AbstractIterator<Substitution> {
    private final List<Ast.Fact> premises;
    private final FactBase.Snapshot snapshot;
    private final Substitution[] subs;
    private final List<List<Ast.Fact>> candidates;
    private final int[] positions;
    private int depth;

    SolutionIterator(
        List<Ast.Fact> premises, FactBase.Snapshot snapshot, Substitution sub0) {
      this.premises = premises;
      this.snapshot = snapshot;
      final int n = premises.size();
      this.subs = new Substitution[n + 1];
      this.candidates =
          new ArrayList<>(
              Collections.nCopies(n, ImmutableList.<Ast.Fact>of()));
      this.positions = new int[n];
      this.subs[0] = sub0;
      if (n > 0) {
        push(0);
      }
    }

    /** Prepares to match premise {@code d} from its first candidate. */
    private void push(int d) {
      candidates.set(d, snapshot.candidates(premises.get(d).name));
      positions[d] = 0;
    }

    @Override
    protected Substitution computeNext() {
      final int n = premises.size();
      while (depth >= 0) {
        if (depth == n) {
          // Every premise matched. Emit, then resume at the previous level.
          --depth;
          return subs[n];
        }
        final List<Ast.Fact> factList = candidates.get(depth);
        if (positions[depth] == factList.size()) {
          --depth;
          continue;
        }
        final Ast.Fact fact = factList.get(positions[depth]++);
        final Substitution s =
            Unifier.unify(premises.get(depth), fact, subs[depth]);
        if (s != null) {
          subs[++depth] = s;
          if (depth < n) {
            push(depth);
          }
        }
      }
      return endOfData();
    }
  }
}

// End Solver.java
