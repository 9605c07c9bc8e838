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

/**
 * Forward-chaining evaluation.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.chainer.eval.ForwardChainer} - Main entry point.
 *       Runs rounds of rule application until the query is derived or a
 *       fixpoint is reached.
 *   <li>{@link net.hydromatic.chainer.eval.Solver} - Enumerates the
 *       substitutions that satisfy a rule's premises.
 *   <li>{@link net.hydromatic.chainer.eval.Unifier} - Matches one premise
 *       against one ground fact.
 *   <li>{@link net.hydromatic.chainer.eval.FactBase} - The growing set of
 *       ground facts, and immutable snapshots of it.
 *   <li>{@link net.hydromatic.chainer.eval.Tracer} - Receives events during a
 *       run.
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * List<Ast.Fact> facts =
 *     FactParser.parseFacts(
 *         ImmutableList.of("Missile(T1)", "Owns(A, T1)"));
 * List<Ast.Rule> rules =
 *     ImmutableList.of(
 *         FactParser.parseRule(ImmutableList.of("Missile(x)"), "Weapon(x)"));
 * Result result =
 *     ForwardChainer.run(facts, rules, FactParser.parseFact("Weapon(T1)"), 100);
 * // result.proven() is true; result.rounds is 1
 * }</pre>
 */
package net.hydromatic.chainer.eval;

// End package-info.java
