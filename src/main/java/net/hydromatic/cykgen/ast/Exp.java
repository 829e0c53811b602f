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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expressions that occur in generated code.
 *
 * <p>Expressions are immutable, and may therefore be shared between
 * statements, and between the copies of a statement tree that
 * {@link StmtArena#copy(int)} creates.
 *
 * <p>Create expressions via {@link ExpBuilder#exp}.
 */
public abstract class Exp {
  public final Op op;

  Exp(Op op) {
    this.op = requireNonNull(op);
    checkArgument(!op.isStatement(), "not an expression: %s", op);
  }

  /** Converts this expression to C++ text. */
  @Override
  public final String toString() {
    return unparse(new CodeWriter(), 0, 0).toString();
  }

  abstract CodeWriter unparse(CodeWriter w, int left, int right);

  /** Reference to a variable or macro. */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && name.equals(((Id) o).name);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Integer literal. */
  public static class Literal extends Exp {
    public final long value;

    Literal(long value) {
      super(Op.INT_LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Literal && value == ((Literal) o).value;
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }
  }

  /** Call to a binary operator, such as "a + b" or "a || b". */
  public static class Infix extends Exp {
    public final Exp a0;
    public final Exp a1;

    Infix(Op op, Exp a0, Exp a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Infix
              && op == ((Infix) o).op
              && a0.equals(((Infix) o).a0)
              && a1.equals(((Infix) o).a1);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator; currently only "!". */
  public static class Prefix extends Exp {
    public final Exp a;

    Prefix(Op op, Exp a) {
      super(op);
      this.a = requireNonNull(a);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Prefix
              && op == ((Prefix) o).op
              && a.equals(((Prefix) o).a);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /**
   * Post-increment of a variable, "x++".
   *
   * <p>Evaluates to the value before the increment.
   */
  public static class PostIncrement extends Exp {
    public final Id id;

    PostIncrement(Id id) {
      super(Op.POST_INCREMENT);
      this.id = requireNonNull(id);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, id);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PostIncrement && id.equals(((PostIncrement) o).id);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.postfix(left, id, op, right);
    }
  }

  /** Conditional expression, "c ? a : b". */
  public static class Conditional extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Conditional(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.CONDITIONAL);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Conditional
              && condition.equals(((Conditional) o).condition)
              && ifTrue.equals(((Conditional) o).ifTrue)
              && ifFalse.equals(((Conditional) o).ifFalse);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(condition, left, op.left)
          .append(" ? ")
          .append(ifTrue, 0, 0)
          .append(" : ")
          .append(ifFalse, op.right, right);
    }
  }

  /**
   * Call to a function, "f(a, b)", or to a method of an object,
   * "seq.size()".
   */
  public static class Apply extends Exp {
    public final @Nullable String receiver;
    public final String name;
    public final List<Exp> args;

    Apply(@Nullable String receiver, String name, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.receiver = receiver;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(receiver, name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && Objects.equals(receiver, ((Apply) o).receiver)
              && name.equals(((Apply) o).name)
              && args.equals(((Apply) o).args);
    }

    @Override
    CodeWriter unparse(CodeWriter w, int left, int right) {
      return w.call(receiver, name, args);
    }
  }
}

// End Exp.java
