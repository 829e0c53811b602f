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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Payload of a statement node.
 *
 * <p>The set of statement kinds is closed: {@link For}, {@link Block},
 * {@link Call}, {@link Assign}, {@link Decl}, {@link Raw} and {@link IfDef}.
 * A payload holds only the fields of its kind and is immutable; which
 * statements a loop or block contains is recorded by the {@link StmtArena}
 * that owns the node.
 */
public abstract class Stmt {
  public final Op op;

  Stmt(Op op) {
    this.op = requireNonNull(op);
    checkArgument(op.isStatement(), "not a statement: %s", op);
  }

  /** Whether nodes of this kind may have children in a {@link StmtArena}. */
  public boolean hasChildren() {
    return false;
  }

  /** Creates a loop. */
  public static For forLoop(VarType type, String var, Exp init, Exp condition,
      Exp step, boolean tableIndex) {
    return new For(type, var, init, condition, step, tableIndex, null);
  }

  /** Creates a block; if {@code scoped}, it is enclosed in braces. */
  public static Block block(boolean scoped) {
    return new Block(scoped, null);
  }

  /** Creates a call to a function as a statement. */
  public static Call call(String name, List<? extends Exp> args) {
    return new Call(null, name, ImmutableList.copyOf(args), false);
  }

  /** Creates a call to a method of an object as a statement. */
  public static Call methodCall(String receiver, String name,
      List<? extends Exp> args) {
    return new Call(requireNonNull(receiver), name,
        ImmutableList.copyOf(args), false);
  }

  /** Creates a call to the routine that fills one cell of a
   * non-terminal's table. */
  public static Call evaluate(String routine, List<? extends Exp> args) {
    return new Call(null, routine, ImmutableList.copyOf(args), true);
  }

  /** Creates an assignment "x = value". */
  public static Assign assign(String target, Exp value) {
    return new Assign(target, false, value);
  }

  /** Creates an increment "x += value". */
  public static Assign increment(String target, Exp value) {
    return new Assign(target, true, value);
  }

  /** Creates a declaration. */
  public static Decl decl(VarType type, String name, @Nullable Exp init) {
    return new Decl(type, name, init);
  }

  /** Creates a fragment of code that is emitted verbatim. */
  public static Raw raw(String text) {
    return new Raw(text);
  }

  /** Creates "#ifdef macro" (if {@code defined}) or "#ifndef macro". */
  public static IfDef ifDef(String macro, boolean defined) {
    return new IfDef(macro, defined);
  }

  /** Type of a declared variable. */
  public enum VarType {
    SIZE("unsigned int"),
    INT("int"),
    /** The variable is declared elsewhere; the "declaration" assigns it. */
    EXTERNAL(null);

    public final @Nullable String cppName;

    VarType(@Nullable String cppName) {
      this.cppName = cppName;
    }
  }

  /**
   * Counting loop, "for (type var = init; condition; step)".
   *
   * <p>{@link #step} is the signed amount added to the variable after each
   * iteration: a literal 1 or -1, or an arbitrary stride expression.
   *
   * <p>{@link #tableIndex} is true if the variable is the running index of a
   * DP table; false for loops that only schedule work. If {@link #pragma} is
   * not null, the loop is preceded by "#pragma pragma".
   */
  public static class For extends Stmt {
    public final VarType type;
    public final String var;
    public final Exp init;
    public final Exp condition;
    public final Exp step;
    public final boolean tableIndex;
    public final @Nullable String pragma;

    For(VarType type, String var, Exp init, Exp condition, Exp step,
        boolean tableIndex, @Nullable String pragma) {
      super(Op.FOR);
      this.type = requireNonNull(type);
      this.var = requireNonNull(var);
      this.init = requireNonNull(init);
      this.condition = requireNonNull(condition);
      this.step = requireNonNull(step);
      this.tableIndex = tableIndex;
      this.pragma = pragma;
    }

    @Override
    public boolean hasChildren() {
      return true;
    }

    /** Returns a copy of this loop, preceded by a pragma. */
    public For withPragma(String pragma) {
      return new For(type, var, init, condition, step, tableIndex,
          requireNonNull(pragma));
    }
  }

  /** Sequence of statements; braces and a scope if {@link #scoped}. */
  public static class Block extends Stmt {
    public final boolean scoped;
    public final @Nullable String pragma;

    Block(boolean scoped, @Nullable String pragma) {
      super(Op.BLOCK);
      this.scoped = scoped;
      this.pragma = pragma;
      checkArgument(scoped || pragma == null,
          "pragma requires a structured block");
    }

    @Override
    public boolean hasChildren() {
      return true;
    }

    /** Returns a scoped block preceded by a pragma. */
    public static Block withPragma(String pragma) {
      return new Block(true, requireNonNull(pragma));
    }
  }

  /** Function or method call. */
  public static class Call extends Stmt {
    public final @Nullable String receiver;
    public final String name;
    public final List<Exp> args;
    /** Whether this calls a non-terminal's evaluation routine. */
    public final boolean evaluation;

    Call(@Nullable String receiver, String name, ImmutableList<Exp> args,
        boolean evaluation) {
      super(Op.CALL);
      this.receiver = receiver;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.evaluation = evaluation;
    }
  }

  /** Assignment; if {@link #accumulate}, "target += value". */
  public static class Assign extends Stmt {
    public final String target;
    public final boolean accumulate;
    public final Exp value;

    Assign(String target, boolean accumulate, Exp value) {
      super(Op.ASSIGN);
      this.target = requireNonNull(target);
      this.accumulate = accumulate;
      this.value = requireNonNull(value);
    }
  }

  /** Variable declaration. */
  public static class Decl extends Stmt {
    public final VarType type;
    public final String name;
    public final @Nullable Exp init;

    Decl(VarType type, String name, @Nullable Exp init) {
      super(Op.DECL);
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
      this.init = init;
      checkArgument(type != VarType.EXTERNAL || init != null,
          "assignment to external variable %s needs a value", name);
    }
  }

  /** Verbatim code: a comment, a directive, or a C++ statement that the
   * model does not represent. */
  public static class Raw extends Stmt {
    public final String text;

    Raw(String text) {
      super(Op.RAW);
      this.text = requireNonNull(text);
    }
  }

  /**
   * Preprocessor conditional.
   *
   * <p>Its first child is the block emitted when the condition holds; the
   * optional second child is the "#else" block. Both are unscoped blocks.
   */
  public static class IfDef extends Stmt {
    public final String macro;
    public final boolean defined;

    IfDef(String macro, boolean defined) {
      super(Op.IFDEF);
      this.macro = requireNonNull(macro);
      this.defined = defined;
    }

    @Override
    public boolean hasChildren() {
      return true;
    }
  }
}

// End Stmt.java
