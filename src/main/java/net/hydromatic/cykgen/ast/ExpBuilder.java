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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expressions. */
public enum ExpBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  exp;

  private final Exp.Literal zero = new Exp.Literal(0);
  private final Exp.Literal one = new Exp.Literal(1);

  /** Creates a reference to a variable. */
  public Exp.Id id(String name) {
    return new Exp.Id(name);
  }

  /** Creates an integer literal. */
  public Exp.Literal literal(long value) {
    if (value == 0) {
      return zero;
    }
    if (value == 1) {
      return one;
    }
    return new Exp.Literal(value);
  }

  /** Creates "a + b". */
  public Exp plus(Exp a0, Exp a1) {
    return new Exp.Infix(Op.PLUS, a0, a1);
  }

  /** Creates "a + n". */
  public Exp plus(Exp a0, long n) {
    return plus(a0, literal(n));
  }

  /** Creates "a - b". */
  public Exp minus(Exp a0, Exp a1) {
    return new Exp.Infix(Op.MINUS, a0, a1);
  }

  /** Creates "a - n". */
  public Exp minus(Exp a0, long n) {
    return minus(a0, literal(n));
  }

  /** Creates "a * b". */
  public Exp times(Exp a0, Exp a1) {
    return new Exp.Infix(Op.TIMES, a0, a1);
  }

  /** Creates "a / b". */
  public Exp divide(Exp a0, Exp a1) {
    return new Exp.Infix(Op.DIVIDE, a0, a1);
  }

  /** Creates "a &lt; b". */
  public Exp lessThan(Exp a0, Exp a1) {
    return new Exp.Infix(Op.LT, a0, a1);
  }

  /** Creates "a &gt; b". */
  public Exp greaterThan(Exp a0, Exp a1) {
    return new Exp.Infix(Op.GT, a0, a1);
  }

  /** Creates "a || b". */
  public Exp orElse(Exp a0, Exp a1) {
    return new Exp.Infix(Op.ORELSE, a0, a1);
  }

  /** Creates "!a". */
  public Exp not(Exp a) {
    return new Exp.Prefix(Op.NOT, a);
  }

  /** Creates "x++". */
  public Exp postIncrement(Exp.Id id) {
    return new Exp.PostIncrement(id);
  }

  /** Creates "c ? a : b". */
  public Exp conditional(Exp condition, Exp ifTrue, Exp ifFalse) {
    return new Exp.Conditional(condition, ifTrue, ifFalse);
  }

  /** Creates a call to a method of an object. */
  public Exp.Apply method(
      @Nullable String receiver, String name, List<? extends Exp> args) {
    return new Exp.Apply(receiver, name, ImmutableList.copyOf(args));
  }

  /** Creates "seq.size()", the length of an input sequence. */
  public Exp.Apply size(String sequence) {
    return method(sequence, "size", ImmutableList.of());
  }
}

// End ExpBuilder.java
