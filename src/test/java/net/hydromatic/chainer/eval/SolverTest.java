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

import static net.hydromatic.chainer.TestUtils.CRIME_FACTS;
import static net.hydromatic.chainer.TestUtils.fact;
import static net.hydromatic.chainer.TestUtils.facts;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.util.Substitution;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solver}. */
class SolverTest {
  private static List<String> solve(List<Ast.Fact> premises,
      List<Ast.Fact> facts, Substitution sub0) {
    final List<String> list = new ArrayList<>();
    Solver.solve(premises, facts, sub0).forEach(s -> list.add(s.toString()));
    return list;
  }

  @Test
  void testJoin() {
    assertThat(
        solve(facts("Missile(x)", "Owns(A, x)"), CRIME_FACTS,
            Substitution.EMPTY),
        is(ImmutableList.of("[T1/x]")));
  }

  @Test
  void testThreadsBindings() {
    final List<Ast.Fact> facts =
        ImmutableList.<Ast.Fact>builder()
            .addAll(CRIME_FACTS)
            .addAll(
                facts("Weapon(T1)", "Hostile(A)", "Sells(Robert, T1, A)"))
            .build();
    assertThat(
        solve(
            facts("American(p)", "Weapon(q)", "Sells(p, q, r)", "Hostile(r)"),
            facts, Substitution.EMPTY),
        is(ImmutableList.of("[Robert/p, T1/q, A/r]")));
    // Without Sells(Robert, T1, A) and Hostile(A), nothing matches
    assertThat(
        solve(
            facts("American(p)", "Weapon(q)", "Sells(p, q, r)", "Hostile(r)"),
            facts.subList(0, facts.size() - 2), Substitution.EMPTY),
        empty());
  }

  @Test
  void testAllSolutions() {
    final List<Ast.Fact> facts =
        facts("Parent(A, B)", "Parent(B, C)", "Parent(C, D)", "Parent(A, E)");
    assertThat(
        solve(facts("Parent(x, y)", "Parent(y, z)"), facts,
            Substitution.EMPTY),
        containsInAnyOrder("[A/x, B/y, C/z]", "[B/x, C/y, D/z]"));
    assertThat(
        solve(facts("Parent(x, y)"), facts, Substitution.EMPTY),
        hasSize(4));
  }

  @Test
  void testInitialSubstitution() {
    final List<Ast.Fact> facts =
        facts("Parent(A, B)", "Parent(B, C)", "Parent(A, E)");
    assertThat(
        solve(facts("Parent(x, y)"), facts, Substitution.of("x", "A")),
        containsInAnyOrder("[A/x, B/y]", "[A/x, E/y]"));
  }

  @Test
  void testNoPremises() {
    final Substitution sub0 = Substitution.of("x", "A");
    assertThat(solve(ImmutableList.of(), CRIME_FACTS, sub0),
        is(ImmutableList.of("[A/x]")));
    assertThat(solve(ImmutableList.of(), ImmutableList.of(), sub0),
        hasSize(1));
  }

  @Test
  void testNoFacts() {
    assertThat(
        solve(facts("Missile(x)"), ImmutableList.of(), Substitution.EMPTY),
        empty());
  }

  /** Each iterator is an independent search. */
  @Test
  void testRestartable() {
    final List<Ast.Fact> facts =
        facts("Parent(A, B)", "Parent(B, C)", "Parent(C, D)");
    final Iterable<Substitution> solutions =
        Solver.solve(facts("Parent(x, y)", "Parent(y, z)"), facts,
            Substitution.EMPTY);
    final List<Substitution> first = ImmutableList.copyOf(solutions);
    final List<Substitution> second = ImmutableList.copyOf(solutions);
    assertThat(first, hasSize(2));
    assertThat(second, is(first));

    final Iterator<Substitution> i1 = solutions.iterator();
    final Iterator<Substitution> i2 = solutions.iterator();
    assertThat(i1.next(), is(first.get(0)));
    assertThat(i2.next(), is(first.get(0)));
    assertThat(i1.next(), is(first.get(1)));
    assertThat(i1.hasNext(), is(false));
    assertThat(i2.next(), is(first.get(1)));
  }

  /** Solutions are produced on demand; asking for the first one does not
   * enumerate the other million. */
  @Test
  void testLazy() {
    final ImmutableList.Builder<Ast.Fact> builder = ImmutableList.builder();
    for (int i = 0; i < 100; i++) {
      builder.add(fact("Node(N" + i + ")"));
    }
    final Iterable<Substitution> solutions =
        Solver.solve(facts("Node(x)", "Node(y)", "Node(z)"), builder.build(),
            Substitution.EMPTY);
    final Substitution first = Iterables.getFirst(solutions, null);
    assertThat(first, hasToString("[N0/x, N0/y, N0/z]"));
    assertThat(Iterables.size(Iterables.limit(solutions, 250)), is(250));
  }
}

// End SolverTest.java
