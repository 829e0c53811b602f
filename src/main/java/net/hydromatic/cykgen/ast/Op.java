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
package net.hydromatic.cykgen.ast;

/**
 * Kinds of {@link Exp} and {@link Stmt}.
 *
 * <p>Precedences follow C++, so that {@link CodeWriter} inserts parentheses
 * only where the emitted code needs them.
 */
public enum Op {
  // expressions
  ID(true),
  INT_LITERAL(true),
  APPLY(true),
  POST_INCREMENT("++", 16),
  NOT("!", 15),
  TIMES(" * ", 13),
  DIVIDE(" / ", 13),
  PLUS(" + ", 12),
  MINUS(" - ", 12),
  LT(" < ", 10),
  GT(" > ", 10),
  ORELSE(" || ", 4),
  CONDITIONAL(" ? ", 3, false),

  // statements
  FOR,
  BLOCK,
  CALL,
  ASSIGN,
  DECL,
  RAW,
  IFDEF;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is the kind of a statement. */
  public boolean isStatement() {
    return ordinal() >= FOR.ordinal();
  }
}

// End Op.java
