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
package net.hydromatic.cykgen.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.cykgen.ast.Pos;

/** An error occurred while generating code. */
public class CompileException extends RuntimeException {
  private final Kind kind;
  private final Pos pos;

  public CompileException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception for a violated invariant; the program was not
   * analyzed correctly. */
  public static CompileException internal(String message, Pos pos) {
    return new CompileException(Kind.INTERNAL, message, pos);
  }

  /** Creates an exception for a configuration that code generation does not
   * support. */
  public static CompileException unsupported(String message, Pos pos) {
    return new CompileException(Kind.UNSUPPORTED, message, pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  public Kind kind() {
    return kind;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(' ')
        .append(kind.label)
        .append(": ")
        .append(getMessage());
  }

  /** Kind of compile exception. */
  public enum Kind {
    INTERNAL("Internal error"),
    UNSUPPORTED("Unsupported"),
    ERROR("Error"),
    WARNING("Warning");

    final String label;

    Kind(String label) {
      this.label = label;
    }
  }
}

// End CompileException.java
