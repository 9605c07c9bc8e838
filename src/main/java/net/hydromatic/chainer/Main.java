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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.chainer.ast.Ast;
import net.hydromatic.chainer.eval.ForwardChainer;
import net.hydromatic.chainer.eval.InferenceStep;
import net.hydromatic.chainer.eval.Prop;
import net.hydromatic.chainer.eval.Result;
import net.hydromatic.chainer.eval.Tracer;
import net.hydromatic.chainer.eval.Tracers;
import net.hydromatic.chainer.parse.ProgramParser;
import net.hydromatic.chainer.util.ChainerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command-line prover.
 *
 * <p>Usage: {@code chainer [--property=value ...] [file ...]}. Reads a script
 * of facts, rules and a query (see {@link ProgramParser}) from the files, or
 * from standard input if there are none, and prints whether the query
 * follows. Properties are those of {@link Prop}, for example
 * {@code --roundCap=50} or {@code --trace=true}.
 */
public class Main {
  private static final Logger LOGGER = LogManager.getLogger(Main.class);

  private final List<String> argList;
  private final Reader in;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(
            ImmutableList.copyOf(args),
            new InputStreamReader(System.in, UTF_8),
            new OutputStreamWriter(System.out, UTF_8),
            new LinkedHashMap<>());
    final int status;
    try {
      status = main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
      return;
    }
    System.exit(status);
  }

  /** Creates a Main. */
  public Main(
      List<String> argList, Reader in, Writer out, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.in = in;
    this.out = new PrintWriter(out);
    this.propMap = propMap;
  }

  /**
   * Reads the script, runs the prover and prints the verdict.
   *
   * @return Exit status: 0 if the run completed, 1 if the input was invalid
   */
  public int run() {
    try {
      final List<File> files = new ArrayList<>();
      for (String arg : argList) {
        if (arg.startsWith("--")) {
          setProperty(arg.substring(2));
        } else {
          files.add(new File(arg));
        }
      }
      final Ast.Program program = ProgramParser.parse(readScript(files));
      final Ast.Fact query = program.query;
      if (query == null) {
        out.println("Error: script has no query ('?- Fact')");
        return 1;
      }
      Tracer tracer = Tracers.empty();
      if (Prop.TRACE.booleanValue(propMap)) {
        tracer = Tracers.printTracer(tracer, out);
      }
      final Result result =
          new ForwardChainer(program.rules, propMap, tracer)
              .run(program.facts, query);
      printResult(result);
      return 0;
    } catch (ChainerException | IllegalArgumentException e) {
      LOGGER.debug("invalid input", e);
      out.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      out.println("Error: " + e.getMessage());
      return 1;
    } finally {
      out.flush();
    }
  }

  /** Sets a property from an argument of the form "name=value". */
  private void setProperty(String arg) {
    final int eq = arg.indexOf('=');
    if (eq < 0) {
      throw new IllegalArgumentException(
          "expected --property=value, got --" + arg);
    }
    Prop.lookup(arg.substring(0, eq))
        .setLenient(propMap, arg.substring(eq + 1));
  }

  private String readScript(List<File> files) throws IOException {
    if (files.isEmpty()) {
      return CharStreams.toString(in);
    }
    final StringBuilder b = new StringBuilder();
    for (File file : files) {
      b.append(Files.asCharSource(file, UTF_8).read()).append('\n');
    }
    return b.toString();
  }

  private void printResult(Result result) {
    final String summary =
        result.rounds + (result.rounds == 1 ? " round" : " rounds")
            + " (" + result.steps.size() + " facts inferred)";
    switch (result.status) {
      case QUERY_PROVEN:
        out.println(result.query + " proven after " + summary);
        for (InferenceStep step : result.derivation(result.query)) {
          out.println("  " + step);
        }
        break;
      case CONVERGED:
        out.println(result.query + " not proven; converged after " + summary);
        break;
      case ROUND_CAP_EXCEEDED:
        out.println(result.query + " not proven; round cap reached after "
            + summary);
        break;
      default:
        out.println(result.query + " not proven; " + result.status
            + " after " + summary);
        break;
    }
  }
}

// End Main.java
