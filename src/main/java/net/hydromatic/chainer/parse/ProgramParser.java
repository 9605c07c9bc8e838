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
package net.hydromatic.chainer.parse;

import static net.hydromatic.chainer.ast.AstBuilder.ast;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses a script of facts, rules and a query.
 *
 * <p>Each non-blank line holds one statement, optionally terminated by
 * {@code .}; a line starting with {@code #} or {@code %} is a comment. For
 * example:
 *
 * <pre>{@code
 * # Facts
 * Missile(T1).
 * Owns(A, T1).
 * # Rules
 * Missile(x) => Weapon(x).
 * Missile(x), Owns(A, x) => Sells(Robert, x, A).
 * # Query
 * ?- Sells(Robert, T1, A).
 * }</pre>
 */
public final class ProgramParser {
  static final String QUERY_PREFIX = "?-";
  static final String ARROW = "=>";

  private ProgramParser() {}

  /** Parses a script. */
  public static Ast.Program parse(String script) {
    final List<Ast.Fact> facts = new ArrayList<>();
    final List<Ast.Rule> rules = new ArrayList<>();
    Ast.@Nullable Fact query = null;
    int lineNumber = 0;
    for (String line : Splitter.onPattern("\r?\n").split(script)) {
      ++lineNumber;
      String s = line.trim();
      if (s.isEmpty() || s.startsWith("#") || s.startsWith("%")) {
        continue;
      }
      if (s.endsWith(".")) {
        s = s.substring(0, s.length() - 1);
      }
      try {
        if (s.startsWith(QUERY_PREFIX)) {
          if (query != null) {
            throw new ParseException("more than one query", s, -1);
          }
          query = FactParser.parseFact(s.substring(QUERY_PREFIX.length()));
        } else if (s.contains(ARROW)) {
          rules.add(parseRule(s));
        } else {
          facts.add(FactParser.parseFact(s));
        }
      } catch (ParseException e) {
        throw e.atLine(lineNumber);
      }
    }
    return ast.program(facts, rules, query);
  }

  /** Parses a rule of the form {@code P1, P2 => C}. */
  static Ast.Rule parseRule(String s) {
    final int arrow = s.indexOf(ARROW);
    final String conclusion = s.substring(arrow + ARROW.length());
    if (conclusion.contains(ARROW)) {
      throw new ParseException("more than one '=>'", s, -1);
    }
    return FactParser.parseRule(
        splitPremises(s.substring(0, arrow)), conclusion);
  }

  /**
   * Splits premises on the commas that are not inside parentheses.
   *
   * <p>For example, {@code "P(x, y), Q(y)"} becomes {@code ["P(x, y)",
   * " Q(y)"]}.
   */
  static List<String> splitPremises(String s) {
    if (s.trim().isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<String> premises = ImmutableList.builder();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '(':
          ++depth;
          break;
        case ')':
          --depth;
          break;
        case ',':
          if (depth == 0) {
            premises.add(s.substring(start, i));
            start = i + 1;
          }
          break;
        default:
          break;
      }
    }
    premises.add(s.substring(start));
    return premises.build();
  }
}

// End ProgramParser.java
