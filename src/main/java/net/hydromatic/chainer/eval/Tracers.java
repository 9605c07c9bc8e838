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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.chainer.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes a human-readable account of the run to a
   * writer, then calls the underlying tracer.
   */
  public static Tracer printTracer(Tracer tracer, PrintWriter w) {
    return new PrintTracer(tracer, w);
  }

  /**
   * Returns a tracer that performs the given action on each step, then calls
   * the underlying tracer.
   */
  public static Tracer withOnStep(
      Tracer tracer, Consumer<InferenceStep> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(InferenceStep step) {
        consumer.accept(step);
        super.onStep(step);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action at the end of each round,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRoundEnd(
      Tracer tracer, BiConsumer<Integer, List<Ast.Fact>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRoundEnd(int round, List<Ast.Fact> newFacts) {
        consumer.accept(round, newFacts);
        super.onRoundEnd(round, newFacts);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result, then calls
   * the underlying tracer.
   */
  public static Tracer withOnFinish(Tracer tracer, Consumer<Result> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFinish(Result result) {
        consumer.accept(result);
        super.onFinish(result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRoundStart(int round, int factCount) {}

    @Override
    public void onStep(InferenceStep step) {}

    @Override
    public void onRoundEnd(int round, List<Ast.Fact> newFacts) {}

    @Override
    public void onFinish(Result result) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onRoundStart(int round, int factCount) {
      tracer.onRoundStart(round, factCount);
    }

    @Override
    public void onStep(InferenceStep step) {
      tracer.onStep(step);
    }

    @Override
    public void onRoundEnd(int round, List<Ast.Fact> newFacts) {
      tracer.onRoundEnd(round, newFacts);
    }

    @Override
    public void onFinish(Result result) {
      tracer.onFinish(result);
    }
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer extends DelegatingTracer {
    private final PrintWriter w;

    PrintTracer(Tracer tracer, PrintWriter w) {
      super(tracer);
      this.w = requireNonNull(w);
    }

    @Override
    public void onRoundStart(int round, int factCount) {
      w.println("--- Round " + round + " (" + factCount + " facts) ---");
      super.onRoundStart(round, factCount);
    }

    @Override
    public void onStep(InferenceStep step) {
      w.println("Applied rule: " + step.rule);
      w.print("   With facts:");
      step.sources.forEach(source -> w.print(" " + source));
      w.println();
      w.println("   Using substitution: " + step.substitution);
      w.println("   Inferred: " + step.fact);
      super.onStep(step);
    }

    @Override
    public void onRoundEnd(int round, List<Ast.Fact> newFacts) {
      if (newFacts.isEmpty()) {
        w.println("No new facts can be inferred.");
      } else {
        w.println("Added " + newFacts + " to the fact base.");
      }
      w.flush();
      super.onRoundEnd(round, newFacts);
    }

    @Override
    public void onFinish(Result result) {
      w.flush();
      super.onFinish(result);
    }
  }
}

// End Tracers.java
