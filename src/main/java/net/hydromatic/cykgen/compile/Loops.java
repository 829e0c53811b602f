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

import static net.hydromatic.cykgen.ast.ExpBuilder.exp;

import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;

/** Builds the loops from which traversals are assembled. */
public abstract class Loops {
  private Loops() {}

  /**
   * Creates a loop over the right index of a track (a column of the DP
   * matrix), "for (unsigned int j = start; j &lt; end; ++j)".
   *
   * <p>The boundary value is {@code end}.
   */
  public static LoopPair column(StmtArena arena, Exp.Id var, Exp start,
      Exp end, boolean checkpoint, CykMode mode) {
    Stmt.VarType type = Stmt.VarType.SIZE;
    if (checkpoint && mode != CykMode.PARALLEL) {
      // the variable is declared by the checkpoint code
      type = Stmt.VarType.EXTERNAL;
      start = CheckpointOverlay.resumableStart(var, start);
    }
    final Stmt.For loop =
        Stmt.forLoop(type, var.name, start, exp.lessThan(var, end),
            exp.literal(1), true);
    return new LoopPair(arena, arena.add(loop),
        arena.add(Stmt.decl(type, var.name, end)));
  }

  /**
   * Creates a loop over the left index of a track (a row of the DP matrix).
   *
   * <p>In inside modes, the loop counts down from the diagonal,
   * "for (unsigned int i = start; i &gt; end; --i)", and visits row
   * {@code i - 1}; in the parallel tile phases the variable is signed. In
   * outside mode the loop counts up, "for (unsigned int i = start; i &lt; end;
   * ++i)".
   *
   * <p>The boundary value is 1, which addresses row 0.
   */
  public static LoopPair row(StmtArena arena, Exp.Id var, Exp start,
      Exp end, boolean checkpoint, CykMode mode) {
    Stmt.VarType type =
        mode == CykMode.PARALLEL ? Stmt.VarType.INT : Stmt.VarType.SIZE;
    if (checkpoint && mode != CykMode.PARALLEL) {
      type = Stmt.VarType.EXTERNAL;
      start = CheckpointOverlay.resumableStart(var, start);
    }
    final Stmt.For loop;
    if (mode.isOutside()) {
      loop = Stmt.forLoop(type, var.name, start, exp.lessThan(var, end),
          exp.literal(1), true);
    } else {
      loop = Stmt.forLoop(type, var.name, start, exp.greaterThan(var, end),
          exp.literal(-1), true);
    }
    return new LoopPair(arena, arena.add(loop),
        arena.add(Stmt.decl(type, var.name, exp.literal(1))));
  }

  /**
   * Creates a loop that schedules tiles rather than addressing table cells,
   * "for (int v = start; v &lt; end; v += stride)".
   */
  public static int scheduling(StmtArena arena, String var, Exp start,
      Exp end, Exp stride) {
    return arena.add(
        Stmt.forLoop(Stmt.VarType.INT, var, start,
            exp.lessThan(exp.id(var), end), stride, false));
  }
}

// End Loops.java
