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

import com.google.common.base.Strings;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing expressions and statements out as C++ text. */
public class CodeWriter {
  private final StringBuilder b = new StringBuilder();
  private final int indentWidth;
  private int level;

  /** Creates a CodeWriter that indents by two spaces. */
  public CodeWriter() {
    this(2);
  }

  /** Creates a CodeWriter with a given indentation width. */
  public CodeWriter(int indentWidth) {
    checkArgument(indentWidth >= 0);
    this.indentWidth = indentWidth;
  }

  /** Appends a string to the output. */
  public CodeWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression, parenthesized if the surrounding operators
   * bind more tightly. */
  public CodeWriter append(Exp e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public CodeWriter infix(int left, Exp a0, Op op, Exp a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public CodeWriter prefix(int left, Op op, Exp a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a postfix operator. */
  public CodeWriter postfix(int left, Exp a, Op op, int right) {
    if (left > op.left || op.right < right) {
      return append("(").postfix(0, a, op, 0).append(")");
    }
    a.unparse(this, left, op.left);
    append(op.padded);
    return this;
  }

  /** Appends a function or method call. */
  public CodeWriter call(@Nullable String receiver, String name,
      List<? extends Exp> args) {
    if (receiver != null) {
      append(receiver).append(".");
    }
    append(name).append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      args.get(i).unparse(this, 0, 0);
    }
    return append(")");
  }

  private CodeWriter indent() {
    return append(Strings.repeat(" ", level * indentWidth));
  }

  private CodeWriter line(String s) {
    return indent().append(s).append("\n");
  }

  /** Appends a statement and, recursively, its children. */
  public CodeWriter statement(StmtArena arena, int id) {
    final Stmt stmt = arena.get(id);
    switch (stmt.op) {
    case FOR:
      final Stmt.For loop = (Stmt.For) stmt;
      if (loop.pragma != null) {
        line("#pragma " + loop.pragma);
      }
      indent().append("for (");
      declaration(loop.type, loop.var, loop.init);
      append("; ").append(loop.condition, 0, 0).append("; ");
      step(loop.var, loop.step);
      append(") {\n");
      return children(arena, id).line("}");

    case BLOCK:
      final Stmt.Block block = (Stmt.Block) stmt;
      if (!block.scoped) {
        for (int child : arena.children(id)) {
          statement(arena, child);
        }
        return this;
      }
      if (block.pragma != null) {
        line("#pragma " + block.pragma);
      }
      line("{");
      return children(arena, id).line("}");

    case CALL:
      final Stmt.Call call = (Stmt.Call) stmt;
      return indent().call(call.receiver, call.name, call.args)
          .append(";\n");

    case ASSIGN:
      final Stmt.Assign assign = (Stmt.Assign) stmt;
      indent();
      if (assign.accumulate) {
        step(assign.target, assign.value);
      } else {
        append(assign.target).append(" = ").append(assign.value, 0, 0);
      }
      return append(";\n");

    case DECL:
      final Stmt.Decl decl = (Stmt.Decl) stmt;
      indent();
      return declaration(decl.type, decl.name, decl.init).append(";\n");

    case RAW:
      final Stmt.Raw raw = (Stmt.Raw) stmt;
      if (raw.text.startsWith("#") && !raw.text.startsWith("#pragma")) {
        return append(raw.text).append("\n");
      }
      return line(raw.text);

    case IFDEF:
      final Stmt.IfDef ifDef = (Stmt.IfDef) stmt;
      final List<Integer> branches = arena.children(id);
      append(ifDef.defined ? "#ifdef " : "#ifndef ")
          .append(ifDef.macro).append("\n");
      for (int i = 0; i < branches.size(); i++) {
        if (i > 0) {
          append("#else\n");
        }
        statement(arena, branches.get(i));
      }
      return append("#endif\n");

    default:
      throw new AssertionError("unknown statement " + stmt.op);
    }
  }

  private CodeWriter children(StmtArena arena, int id) {
    ++level;
    for (int child : arena.children(id)) {
      statement(arena, child);
    }
    --level;
    return this;
  }

  private CodeWriter declaration(Stmt.VarType type, String name,
      @Nullable Exp init) {
    if (type.cppName != null) {
      append(type.cppName).append(" ");
    }
    append(name);
    if (init != null) {
      append(" = ").append(init, 0, 0);
    }
    return this;
  }

  private CodeWriter step(String var, Exp step) {
    if (step instanceof Exp.Literal) {
      final long value = ((Exp.Literal) step).value;
      if (value == 1) {
        return append("++").append(var);
      }
      if (value == -1) {
        return append("--").append(var);
      }
    }
    return append(var).append(" += ").append(step, 0, 0);
  }

  /** Appends a procedure that takes no arguments and returns nothing. */
  public CodeWriter procedure(String name, StmtArena arena, int body) {
    append("void ").append(name).append("() {\n");
    return children(arena, body).append("}\n");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CodeWriter.java
