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
package net.hydromatic.chainer.util;

/**
 * Base class for errors that the engine reports to its caller.
 *
 * <p>Each kind of failure has its own subclass, so that a caller can tell a
 * malformed fact from an unsafe rule without parsing the message. None of
 * these errors is transient; retrying with the same input fails the same way.
 */
public abstract class ChainerException extends RuntimeException {
  protected ChainerException(String message) {
    super(message);
  }

  protected ChainerException(String message, Throwable cause) {
    super(message, cause);
  }
}

// End ChainerException.java
