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
package net.hydromatic.chainer;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.parse.FactParser;

/** Static utilities for tests. */
public abstract class TestUtils {
  private TestUtils() {}

  /** Facts of the "Robert is a criminal" example. */
  public static final List<Ast.Fact> CRIME_FACTS =
      facts("American(Robert)", "Owns(A, T1)", "Missile(T1)",
          "Enemy(A, America)");

  /** Rules of the "Robert is a criminal" example. */
  public static final List<Ast.Rule> CRIME_RULES =
      ImmutableList.of(
          rule("Weapon(x)", "Missile(x)"),
          rule("Hostile(x)", "Enemy(x, America)"),
          rule("Sells(Robert, x, A)", "Missile(x)", "Owns(A, x)"),
          rule("Criminal(p)", "American(p)", "Weapon(q)", "Sells(p, q, r)",
              "Hostile(r)"));

  /** Parses a fact. */
  public static Ast.Fact fact(String text) {
    return FactParser.parseFact(text);
  }

  /** Parses a list of facts. */
  public static List<Ast.Fact> facts(String... texts) {
    return FactParser.parseFacts(Arrays.asList(texts));
  }

  /** Parses a rule; the conclusion comes first, as in a Horn clause. */
  public static Ast.Rule rule(String conclusion, String... premises) {
    return FactParser.parseRule(Arrays.asList(premises), conclusion);
  }

  /**
   * Facts {@code Edge(N1, N2)}, {@code Edge(N2, N3)}, ... of a chain with
   * {@code n} nodes.
   */
  public static List<Ast.Fact> chain(int n) {
    final ImmutableList.Builder<Ast.Fact> facts = ImmutableList.builder();
    for (int i = 1; i < n; i++) {
      facts.add(fact("Edge(N" + i + ", N" + (i + 1) + ")"));
    }
    return facts.build();
  }

  /** Rules that compute the transitive closure of {@code Edge}. */
  public static final List<Ast.Rule> PATH_RULES =
      ImmutableList.of(
          rule("Path(x, y)", "Edge(x, y)"),
          rule("Path(x, z)", "Path(x, y)", "Edge(y, z)"));
}

// End TestUtils.java
