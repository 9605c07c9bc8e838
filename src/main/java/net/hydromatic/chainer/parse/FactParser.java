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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.chainer.ast.Ast;

/**
 * Parses facts and terms, and renders facts as text.
 *
 * <p>A fact has the form {@code Name}, {@code Name()} or {@code Name(arg, ...)}
 * with one level of parentheses. Whitespace around the fact and around each
 * argument is ignored. Predicate names and arguments are identifiers: an ASCII
 * letter or digit followed by ASCII letters, digits and underscores.
 *
 * <p>{@link #render(Ast.Fact)} is the inverse of {@link #parseFact(String)}
 * for ground facts.
 */
public final class FactParser {
  private FactParser() {}

  /** Parses a fact, such as {@code "Sells(Robert, x, A)"}. */
  public static Ast.Fact parseFact(String text) {
    final int start = skipSpace(text, 0, text.length());
    final int end = trimEnd(text, start);
    if (start == end) {
      throw new ParseException("empty fact", text, 0);
    }
    final int nameEnd = scanIdentifier(text, start, end, "predicate name");
    final String name = text.substring(start, nameEnd);
    final int open = skipSpace(text, nameEnd, end);
    if (open == end) {
      return ast.fact(name, ImmutableList.of());
    }
    if (text.charAt(open) != '(') {
      throw unexpected(text, open, "'('");
    }
    final int close = end - 1;
    if (close == open || text.charAt(close) != ')') {
      throw new ParseException("missing ')'", text, end);
    }
    final ImmutableList.Builder<Ast.Term> terms = ImmutableList.builder();
    int i = skipSpace(text, open + 1, close);
    if (i == close) {
      return ast.fact(name, terms.build());
    }
    for (;;) {
      final int argEnd = scanIdentifier(text, i, close, "argument");
      terms.add(ast.term(text.substring(i, argEnd)));
      i = skipSpace(text, argEnd, close);
      if (i == close) {
        return ast.fact(name, terms.build());
      }
      if (text.charAt(i) != ',') {
        throw unexpected(text, i, "',' or ')'");
      }
      i = skipSpace(text, i + 1, close);
    }
  }

  /**
   * Parses a term. A name that starts with a lower-case letter is a variable;
   * any other name is a constant.
   */
  public static Ast.Term parseTerm(String text) {
    final int start = skipSpace(text, 0, text.length());
    final int end = trimEnd(text, start);
    final int nameEnd = scanIdentifier(text, start, end, "term");
    if (nameEnd != end) {
      throw unexpected(text, nameEnd, "end of term");
    }
    return ast.term(text.substring(start, end));
  }

  /**
   * Parses the premises and conclusion of a rule, and builds the rule.
   *
   * @throws ParseException if any of the facts is malformed
   * @throws net.hydromatic.chainer.compile.UnsafeRuleException if the rule is
   *     not safe
   */
  public static Ast.Rule parseRule(List<String> premises, String conclusion) {
    final ImmutableList.Builder<Ast.Fact> facts = ImmutableList.builder();
    premises.forEach(premise -> facts.add(parseFact(premise)));
    return ast.rule(facts.build(), parseFact(conclusion));
  }

  /** Parses a list of facts. */
  public static List<Ast.Fact> parseFacts(Iterable<String> texts) {
    final ImmutableList.Builder<Ast.Fact> facts = ImmutableList.builder();
    texts.forEach(text -> facts.add(parseFact(text)));
    return facts.build();
  }

  /** Renders a fact as text, such as {@code "Sells(Robert,T1,A)"}. */
  public static String render(Ast.Fact fact) {
    return fact.toString();
  }

  /** Returns whether a character may start an identifier. */
  static boolean isIdentifierStart(char c) {
    return c >= 'a' && c <= 'z'
        || c >= 'A' && c <= 'Z'
        || c >= '0' && c <= '9';
  }

  /** Returns whether a character may occur after the start of an identifier. */
  static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || c == '_';
  }

  /**
   * Scans an identifier starting at {@code start}, and returns the index just
   * after it.
   */
  private static int scanIdentifier(
      String text, int start, int end, String what) {
    if (start >= end || !isIdentifierStart(text.charAt(start))) {
      if (start >= end || text.charAt(start) == ',') {
        throw new ParseException("missing " + what, text, start);
      }
      throw invalid(text, start);
    }
    int i = start + 1;
    while (i < end && isIdentifierPart(text.charAt(i))) {
      ++i;
    }
    return i;
  }

  private static int skipSpace(String text, int i, int end) {
    while (i < end && Character.isWhitespace(text.charAt(i))) {
      ++i;
    }
    return i;
  }

  private static int trimEnd(String text, int start) {
    int end = text.length();
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      --end;
    }
    return end;
  }

  private static ParseException unexpected(String text, int i, String expected) {
    if (!isIdentifierPart(text.charAt(i))
        && !Character.isWhitespace(text.charAt(i))
        && "(),".indexOf(text.charAt(i)) < 0) {
      return invalid(text, i);
    }
    return new ParseException(
        "expected " + expected + " but found '" + text.charAt(i) + "'",
        text, i);
  }

  private static ParseException invalid(String text, int i) {
    final int codePoint = text.codePointAt(i);
    return new ParseException(
        "invalid character '" + new String(Character.toChars(codePoint)) + "'",
        text, i);
  }
}

// End FactParser.java
