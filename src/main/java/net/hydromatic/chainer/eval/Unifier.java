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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.util.Substitution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches a rule premise against a ground fact.
 *
 * <p>Unification here is one-sided. The pattern may contain variables; the
 * fact may not. There is no occurs check, because terms have no function
 * symbols.
 */
public final class Unifier {
  private Unifier() {}

  /**
   * Extends a substitution so that {@code pattern}, after substitution, equals
   * {@code fact}; returns null if there is no such extension.
   *
   * <p>Each argument of the pattern is first resolved through {@code sub}. A
   * variable is then bound to the corresponding argument of the fact; a
   * constant must equal it.
   *
   * @param pattern Premise template, possibly containing variables
   * @param fact Ground fact
   * @param sub Bindings established so far
   * @return Extended substitution, or null if the pattern does not match
   */
  public static @Nullable Substitution unify(
      Ast.Fact pattern, Ast.Fact fact, Substitution sub) {
    checkArgument(fact.isGround(), "fact %s is not ground", fact);
    if (!pattern.name.equals(fact.name) || pattern.arity() != fact.arity()) {
      return null;
    }
    Substitution s = sub;
    for (int i = 0; i < pattern.terms.size(); i++) {
      final Ast.Term resolved = s.resolve(pattern.terms.get(i));
      final Ast.Term factTerm = fact.terms.get(i);
      if (resolved instanceof Ast.Variable) {
        s = s.extend((Ast.Variable) resolved, factTerm);
      } else if (!resolved.equals(factTerm)) {
        return null;
      }
    }
    return s;
  }
}

// End Unifier.java
