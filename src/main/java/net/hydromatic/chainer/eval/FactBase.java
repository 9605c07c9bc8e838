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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.chainer.ast.Ast;

/**
 * Set of ground facts, in the order they were added.
 *
 * <p>A fact base only grows. The driver that owns it adds facts between
 * rounds; during a round, rules read an immutable {@link Snapshot}.
 */
public class FactBase implements Iterable<Ast.Fact> {
  private final Set<Ast.Fact> facts = new LinkedHashSet<>();

  /** Creates an empty fact base. */
  public FactBase() {}

  /** Creates a fact base containing the given facts. */
  public FactBase(Iterable<Ast.Fact> facts) {
    facts.forEach(this::add);
  }

  /**
   * Adds a fact; returns whether it was not already present.
   *
   * @throws IllegalArgumentException if the fact is not ground
   */
  public boolean add(Ast.Fact fact) {
    checkArgument(fact.isGround(), "fact %s is not ground", fact);
    return facts.add(fact);
  }

  public boolean contains(Ast.Fact fact) {
    return facts.contains(fact);
  }

  public int size() {
    return facts.size();
  }

  @Override
  public Iterator<Ast.Fact> iterator() {
    return Collections.unmodifiableSet(facts).iterator();
  }

  /** Returns an immutable copy of the current contents. */
  public Snapshot snapshot() {
    return new Snapshot(ImmutableSet.copyOf(facts));
  }

  @Override
  public String toString() {
    return facts.toString();
  }

  /**
   * Immutable view of a fact base at one moment, indexed by predicate name.
   * Safe to share between threads.
   */
  public static final class Snapshot {
    public final ImmutableSet<Ast.Fact> facts;
    private final ImmutableListMultimap<String, Ast.Fact> byName;

    Snapshot(ImmutableSet<Ast.Fact> facts) {
      this.facts = facts;
      final ImmutableListMultimap.Builder<String, Ast.Fact> builder =
          ImmutableListMultimap.builder();
      facts.forEach(fact -> builder.put(fact.name, fact));
      this.byName = builder.build();
    }

    /** Creates a snapshot of a collection of ground facts. */
    public static Snapshot of(Collection<Ast.Fact> facts) {
      for (Ast.Fact fact : facts) {
        checkArgument(fact.isGround(), "fact %s is not ground", fact);
      }
      return new Snapshot(ImmutableSet.copyOf(facts));
    }

    public boolean contains(Ast.Fact fact) {
      return facts.contains(fact);
    }

    public int size() {
      return facts.size();
    }

    /** Returns the facts that could match a premise with a given predicate. */
    public ImmutableList<Ast.Fact> candidates(String name) {
      return byName.get(name);
    }
  }
}

// End FactBase.java
