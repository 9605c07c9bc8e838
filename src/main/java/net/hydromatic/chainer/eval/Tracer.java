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

import java.util.List;
import net.hydromatic.chainer.ast.Ast;

/** Called on various events during a forward-chaining run. */
public interface Tracer {
  /** Called before a round evaluates its rules. */
  void onRoundStart(int round, int factCount);

  /** Called for each new fact, in the order it will appear in the trace. */
  void onStep(InferenceStep step);

  /**
   * Called after a round, with the facts it derived. The list is empty if the
   * round derived nothing, in which case the run has converged.
   */
  void onRoundEnd(int round, List<Ast.Fact> newFacts);

  /** Called once, when the run ends. */
  void onFinish(Result result);
}

// End Tracer.java
