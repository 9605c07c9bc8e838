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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.compile.Analyzer;
import net.hydromatic.chainer.util.Substitution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Derives facts from rules, round by round, until a query fact is derived or
 * no new facts appear.
 *
 * <p>Evaluation is semi-naive. Each round reads a snapshot of the fact base
 * taken when the round began; facts derived in round <i>k</i> are visible from
 * round <i>k</i> + 1. Within a round, rules are independent, and when the
 * {@link Prop#PARALLELISM} property is greater than 1 they are evaluated on
 * a pool of threads. The results are gathered in rule order, so the trace is
 * the same however many threads are used.
 *
 * <p>A run ends in one of the states of {@link Result.Status}.
 */
public class ForwardChainer {
  private static final Logger LOGGER =
      LogManager.getLogger(ForwardChainer.class);

  private final ImmutableList<Ast.Rule> rules;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Creates a ForwardChainer.
   *
   * @param rules Rules, in the order they are applied within a round
   * @param propMap Property values; see {@link Prop}
   * @param tracer Receives events during each run
   */
  public ForwardChainer(
      List<Ast.Rule> rules, Map<Prop, Object> propMap, Tracer tracer) {
    this.rules = ImmutableList.copyOf(rules);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /**
   * Runs forward chaining with a given round cap and default values for other
   * properties.
   */
  public static Result run(
      Collection<Ast.Fact> facts0,
      List<Ast.Rule> rules,
      Ast.Fact query,
      int roundCap) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.ROUND_CAP.set(propMap, roundCap);
    return new ForwardChainer(rules, propMap, Tracers.empty())
        .run(facts0, query);
  }

  /**
   * Requests that the current run, or the next run if none is in progress,
   * stop before its next round starts. A round that is in progress completes.
   */
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * Runs forward chaining.
   *
   * @param facts0 Initial facts; must be ground
   * @param query Fact to prove; must be ground
   * @return Verdict, trace and final fact set
   * @throws net.hydromatic.chainer.util.ChainerException if the input is
   *     malformed; nothing has been evaluated in that case
   */
  public Result run(Collection<Ast.Fact> facts0, Ast.Fact query) {
    final int roundCap = Prop.ROUND_CAP.intValue(propMap);
    final int parallelism = Prop.PARALLELISM.intValue(propMap);
    checkArgument(roundCap > 0, "round cap must be positive: %s", roundCap);
    checkArgument(
        parallelism > 0, "parallelism must be positive: %s", parallelism);
    Analyzer.analyze(
        facts0, rules, query, Prop.STRICT_ARITY.booleanValue(propMap));

    final FactBase factBase = new FactBase(facts0);
    final List<InferenceStep> steps = new ArrayList<>();
    if (factBase.contains(query)) {
      return finish(Result.Status.QUERY_PROVEN, query, 0, steps, factBase);
    }

    final @Nullable ExecutorService executor =
        parallelism > 1 && rules.size() > 1
            ? Executors.newFixedThreadPool(
                Math.min(parallelism, rules.size()),
                new ThreadFactoryBuilder()
                    .setNameFormat("chainer-%d")
                    .setDaemon(true)
                    .build())
            : null;
    try {
      int rounds = 0;
      for (;;) {
        if (cancelled.compareAndSet(true, false)) {
          return finish(Result.Status.CANCELLED, query, rounds, steps,
              factBase);
        }
        if (rounds == roundCap) {
          return finish(Result.Status.ROUND_CAP_EXCEEDED, query, rounds, steps,
              factBase);
        }
        final int round = rounds + 1;
        final FactBase.Snapshot snapshot = factBase.snapshot();
        tracer.onRoundStart(round, snapshot.size());

        final List<InferenceStep> batch = new ArrayList<>();
        final Set<Ast.Fact> collected = new HashSet<>();
        for (List<InferenceStep> ruleSteps
            : evaluate(snapshot, round, executor)) {
          for (InferenceStep step : ruleSteps) {
            if (collected.add(step.fact)) {
              batch.add(step);
              tracer.onStep(step);
            }
          }
        }

        final ImmutableList.Builder<Ast.Fact> newFacts =
            ImmutableList.builder();
        batch.forEach(step -> newFacts.add(step.fact));
        tracer.onRoundEnd(round, newFacts.build());
        if (batch.isEmpty()) {
          return finish(Result.Status.CONVERGED, query, rounds, steps,
              factBase);
        }

        // Merge. This is the only place that the fact base changes.
        batch.forEach(step -> factBase.add(step.fact));
        steps.addAll(batch);
        rounds = round;
        LOGGER.debug("round {} derived {} facts; fact base has {} facts",
            round, batch.size(), factBase.size());
        if (factBase.contains(query)) {
          return finish(Result.Status.QUERY_PROVEN, query, rounds, steps,
              factBase);
        }
      }
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }
  }

  /**
   * Applies every rule to a snapshot, and returns the steps each rule produced,
   * in rule order.
   */
  private List<List<InferenceStep>> evaluate(FactBase.Snapshot snapshot,
      int round, @Nullable ExecutorService executor) {
    final List<Callable<List<InferenceStep>>> tasks = new ArrayList<>();
    for (int i = 0; i < rules.size(); i++) {
      final int ruleIndex = i;
      tasks.add(() -> applyRule(ruleIndex, snapshot, round));
    }
    final List<List<InferenceStep>> results = new ArrayList<>();
    if (executor == null) {
      for (Callable<List<InferenceStep>> task : tasks) {
        results.add(call(task));
      }
      return results;
    }
    try {
      for (Future<List<InferenceStep>> future : executor.invokeAll(tasks)) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted during round " + round, e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    }
    return results;
  }

  private static <T> T call(Callable<T> task) {
    try {
      return task.call();
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new IllegalStateException(e);
    }
  }

  /**
   * Applies one rule to a snapshot. Returns a step for each distinct
   * conclusion that is not already in the snapshot.
   */
  private List<InferenceStep> applyRule(int ruleIndex,
      FactBase.Snapshot snapshot, int round) {
    final Ast.Rule rule = rules.get(ruleIndex);
    final List<InferenceStep> ruleSteps = new ArrayList<>();
    final Set<Ast.Fact> seen = new HashSet<>();
    for (Substitution sub
        : Solver.solve(rule.premises, snapshot, Substitution.EMPTY)) {
      final Ast.Fact fact = sub.apply(rule.conclusion);
      checkState(fact.isGround(), "rule %s derived non-ground fact %s",
          rule, fact);
      if (!snapshot.contains(fact) && seen.add(fact)) {
        final ImmutableList.Builder<Ast.Fact> sources =
            ImmutableList.builder();
        rule.premises.forEach(premise -> sources.add(sub.apply(premise)));
        ruleSteps.add(
            new InferenceStep(round, ruleIndex, rule, sub, sources.build(),
                fact));
      }
    }
    return ruleSteps;
  }

  private Result finish(Result.Status status, Ast.Fact query, int rounds,
      List<InferenceStep> steps, FactBase factBase) {
    final Result result = new Result(status, query, rounds, steps, factBase);
    LOGGER.info("{} for query {} after {} rounds; {} facts derived",
        status, query, rounds, steps.size());
    tracer.onFinish(result);
    return result;
  }
}

// End ForwardChainer.java
