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

import static java.util.Objects.requireNonNull;

import net.hydromatic.chainer.util.ChainerException;

/** Text could not be parsed as a fact, term, rule or script line. */
public class ParseException extends ChainerException {
  /** What is wrong, without the location. */
  public final String reason;

  /** The text that failed to parse. */
  public final String text;

  /** Zero-based column at which the error was detected, or -1. */
  public final int column;

  /** One-based script line number, or 0 if not parsing a script. */
  public final int line;

  public ParseException(String message, String text, int column) {
    this(message, text, column, 0);
  }

  public ParseException(String message, String text, int column, int line) {
    super(describe(message, text, column, line));
    this.reason = requireNonNull(message);
    this.text = requireNonNull(text);
    this.column = column;
    this.line = line;
  }

  private static String describe(
      String message, String text, int column, int line) {
    final StringBuilder b = new StringBuilder();
    if (line > 0) {
      b.append("line ").append(line).append(": ");
    }
    b.append(message).append(" in '").append(text).append('\'');
    if (column >= 0) {
      b.append(" at column ").append(column + 1);
    }
    return b.toString();
  }

  /** Returns a copy of this exception that records a script line number. */
  public ParseException atLine(int line) {
    return new ParseException(reason, text, column, line);
  }
}

// End ParseException.java
