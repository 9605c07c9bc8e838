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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds terms, facts, rules and programs. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /**
   * Returns whether a name denotes a variable: its first character is a
   * lower-case ASCII letter.
   */
  public boolean isVariableName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    final char c = name.charAt(0);
    return c >= 'a' && c <= 'z';
  }

  /**
   * Creates a term from a name. Names that start with a lower-case letter
   * become variables; all others become constants.
   */
  public Ast.Term term(String name) {
    return isVariableName(name) ? variable(name) : constant(name);
  }

  public Ast.Variable variable(String name) {
    return new Ast.Variable(name);
  }

  public Ast.Constant constant(String name) {
    return new Ast.Constant(name);
  }

  public Ast.Fact fact(String name, List<? extends Ast.Term> terms) {
    return new Ast.Fact(name, terms);
  }

  public Ast.Fact fact(String name, Ast.Term... terms) {
    return new Ast.Fact(name, ImmutableList.copyOf(terms));
  }

  /**
   * Creates a rule.
   *
   * @throws net.hydromatic.chainer.compile.UnsafeRuleException if a variable
   *     in the conclusion occurs in no premise
   */
  public Ast.Rule rule(List<Ast.Fact> premises, Ast.Fact conclusion) {
    return new Ast.Rule(premises, conclusion);
  }

  public Ast.Program program(
      List<Ast.Fact> facts, List<Ast.Rule> rules, Ast.@Nullable Fact query) {
    return new Ast.Program(facts, rules, query);
  }
}

// End AstBuilder.java
