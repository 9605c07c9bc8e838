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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Main}. */
class MainTest {
  private static final String CRIME_PROOF =
      "Criminal(Robert) proven after 2 rounds (4 facts inferred)\n"
          + "  Weapon(T1) <= Missile(T1) (rule 0, round 1, [T1/x])\n"
          + "  Hostile(A) <= Enemy(A,America) (rule 1, round 1, [A/x])\n"
          + "  Sells(Robert,T1,A) <= Missile(T1) & Owns(A,T1)"
          + " (rule 2, round 1, [T1/x])\n"
          + "  Criminal(Robert) <= American(Robert) & Weapon(T1)"
          + " & Sells(Robert,T1,A) & Hostile(A)"
          + " (rule 3, round 2, [Robert/p, T1/q, A/r])\n";

  private static final String CRIME_SCRIPT = "American(Robert).\n"
      + "Owns(A, T1).\n"
      + "Missile(T1).\n"
      + "Enemy(A, America).\n"
      + "Missile(x) => Weapon(x).\n"
      + "Enemy(x, America) => Hostile(x).\n"
      + "Missile(x), Owns(A, x) => Sells(Robert, x, A).\n"
      + "American(p), Weapon(q), Sells(p, q, r), Hostile(r) => Criminal(p).\n";

  /** Result of running {@link Main}. */
  private static class Run {
    final int status;
    final String output;

    Run(int status, String output) {
      this.status = status;
      this.output = output;
    }
  }

  private static Run run(String script, String... args) {
    final StringWriter sw = new StringWriter();
    final List<String> argList = ImmutableList.copyOf(args);
    final Main main =
        new Main(argList, new StringReader(script), sw,
            new LinkedHashMap<>());
    final int status = main.run();
    return new Run(status,
        sw.toString().replace(System.lineSeparator(), "\n"));
  }

  @Test
  void testProven() {
    final Run run = run(CRIME_SCRIPT + "?- Criminal(Robert).\n");
    assertThat(run.status, is(0));
    assertThat(run.output, is(CRIME_PROOF));
  }

  @Test
  void testNotProven() {
    final Run run = run(CRIME_SCRIPT + "?- Criminal(A)\n");
    assertThat(run.status, is(0));
    assertThat(run.output,
        is("Criminal(A) not proven; converged after 2 rounds"
            + " (4 facts inferred)\n"));
  }

  @Test
  void testRoundCap() {
    final Run run =
        run(CRIME_SCRIPT + "?- Criminal(Robert)\n", "--roundCap=1");
    assertThat(run.status, is(0));
    assertThat(run.output,
        is("Criminal(Robert) not proven; round cap reached after 1 round"
            + " (3 facts inferred)\n"));
  }

  @Test
  void testFile() throws URISyntaxException {
    final URL url = MainTest.class.getResource("/crime.chain");
    final String path = new File(url.toURI()).getAbsolutePath();
    final Run run = run("", path);
    assertThat(run.status, is(0));
    assertThat(run.output, is(CRIME_PROOF));
  }

  @Test
  void testTrace() {
    final Run run =
        run(CRIME_SCRIPT + "?- Criminal(Robert)\n", "--trace=true",
            "--parallelism=2");
    assertThat(run.status, is(0));
    assertThat(run.output, startsWith("--- Round 1 (4 facts) ---\n"
        + "Applied rule: Missile(x) => Weapon(x)\n"));
    assertThat(run.output,
        containsString("Added [Weapon(T1), Hostile(A), Sells(Robert,T1,A)]"
            + " to the fact base.\n"
            + "--- Round 2 (7 facts) ---\n"));
    assertThat(run.output,
        containsString("Added [Criminal(Robert)] to the fact base.\n"
            + CRIME_PROOF));
  }

  @Test
  void testErrors() {
    final Run run = run("American(Robert).\nOwns(A,\n?- American(Robert)\n");
    assertThat(run.status, is(1));
    assertThat(run.output, startsWith("Error: line 2: "));

    final Run run2 = run(CRIME_SCRIPT);
    assertThat(run2.status, is(1));
    assertThat(run2.output, is("Error: script has no query ('?- Fact')\n"));

    final Run run3 = run(CRIME_SCRIPT + "?- Criminal(Robert)\n", "--foo=1");
    assertThat(run3.status, is(1));
    assertThat(run3.output, is("Error: property foo not found\n"));

    final Run run4 = run(CRIME_SCRIPT + "?- Criminal(Robert)\n", "--trace");
    assertThat(run4.status, is(1));
    assertThat(run4.output,
        is("Error: expected --property=value, got --trace\n"));

    final Run run5 = run("Likes(x, z) <= Likes(x, y)\n?- Likes(A, B)\n");
    assertThat(run5.status, is(1));
    assertThat(run5.output, startsWith("Error: line 1: "));

    final Run run6 = run("Foo(x) => Bar(y)\n?- Bar(A)\n");
    assertThat(run6.status, is(1));
    assertThat(run6.output,
        is("Error: Rule is unsafe. Variable 'y' in conclusion"
            + " does not appear in any premise\n"));

    final Run run7 = run(CRIME_SCRIPT + "?- Criminal(Robert)\n",
        "/no/such/file.chain");
    assertThat(run7.status, is(1));
    assertThat(run7.output, startsWith("Error: "));
  }
}

// End MainTest.java
