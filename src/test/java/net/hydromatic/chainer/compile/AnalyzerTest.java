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

import static net.hydromatic.chainer.TestUtils.CRIME_FACTS;
import static net.hydromatic.chainer.TestUtils.CRIME_RULES;
import static net.hydromatic.chainer.TestUtils.fact;
import static net.hydromatic.chainer.TestUtils.facts;
import static net.hydromatic.chainer.TestUtils.rule;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Analyzer}. */
class AnalyzerTest {
  @Test
  void testValid() {
    Analyzer.analyze(CRIME_FACTS, CRIME_RULES, fact("Criminal(Robert)"), true);
    Analyzer.analyze(ImmutableList.of(), ImmutableList.of(), fact("Goal"),
        true);
  }

  @Test
  void testNonGroundFact() {
    final NonGroundFactException e =
        assertThrows(NonGroundFactException.class,
            () -> Analyzer.analyze(facts("Likes(John, x)"), CRIME_RULES,
                fact("Criminal(Robert)"), true));
    assertThat(e.getMessage(),
        is("Fact Likes(John,x) is not ground: variable 'x'"));
  }

  @Test
  void testNonGroundQuery() {
    final InvalidQueryException e =
        assertThrows(InvalidQueryException.class,
            () -> Analyzer.analyze(CRIME_FACTS, CRIME_RULES,
                fact("Sells(Robert, x, A)"), true));
    assertThat(e.getMessage(),
        is("Query Sells(Robert,x,A) is not ground: variable 'x'"));
  }

  @Test
  void testRuleSafety() {
    final Ast.Rule safe = rule("Grandparent(x, z)", "Parent(x, y)",
        "Parent(y, z)");
    Analyzer.checkRuleSafety(safe);

    // A rule with no premises is safe only if its conclusion is ground
    Analyzer.checkRuleSafety(rule("Sunny"));
    final UnsafeRuleException e =
        assertThrows(UnsafeRuleException.class, () -> rule("Likes(x, x)"));
    assertThat(e.variableName, is("x"));

    final UnsafeRuleException e2 =
        assertThrows(UnsafeRuleException.class,
            () -> rule("Likes(x, z)", "Parent(x, y)"));
    assertThat(e2.variableName, is("z"));
  }

  @Test
  void testArityMismatch() {
    final List<Ast.Rule> rules =
        ImmutableList.of(rule("Foo(x)", "Foo(x, y)"));
    final ArityMismatchException e =
        assertThrows(ArityMismatchException.class,
            () -> Analyzer.analyze(ImmutableList.of(), rules, fact("Bar"),
                true));
    assertThat(e.predicate, is("Foo"));
    assertThat(e.expectedArity, is(2));
    assertThat(e.actualArity, is(1));
    assertThat(e.getMessage(),
        is("Predicate Foo/1 in conclusion of rule Foo(x,y) => Foo(x)"
            + " does not match earlier use Foo/2 in Foo(x,y)"));

    // Not checked unless strict
    Analyzer.analyze(ImmutableList.of(), rules, fact("Bar"), false);
  }

  /** The query counts as a use of its predicate. */
  @Test
  void testQueryArity() {
    final ArityMismatchException e =
        assertThrows(ArityMismatchException.class,
            () -> Analyzer.analyze(CRIME_FACTS, CRIME_RULES, fact("Missile"),
                true));
    assertThat(e.predicate, is("Missile"));
    assertThat(e.expectedArity, is(1));
    assertThat(e.actualArity, is(0));
  }
}

// End AnalyzerTest.java
