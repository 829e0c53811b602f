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
import static net.hydromatic.cykgen.ast.ExpBuilder.exp;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Op;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.grammar.Grammar;
import net.hydromatic.cykgen.grammar.NonTerminal;
import net.hydromatic.cykgen.grammar.Program;
import net.hydromatic.cykgen.grammar.Table;

/**
 * Adds calls to the evaluation routines of non-terminals to a traversal
 * skeleton.
 *
 * <p>A non-terminal is called at each level of the loop nest where every
 * running index bound by an enclosing loop is one of its table's indices.
 * A table with both indices on a track is therefore called inside the
 * track's row loop, and also after it, where the boundary declarations
 * hold the top row and last column; a constant table is called once, at
 * the outermost level. Calls at one level follow the grammar's
 * topological order. Loops that end up with neither calls nor nested loops
 * are removed.
 */
public class CallInjector {
  private final Program program;
  private final CykMode mode;
  private final boolean checkpoint;
  private final String mutex;

  public CallInjector(Program program, CykMode mode, boolean checkpoint,
      String mutex) {
    this.program = requireNonNull(program);
    this.mode = requireNonNull(mode);
    this.checkpoint = checkpoint;
    this.mutex = requireNonNull(mutex);
  }

  /** Adds calls to the statements under {@code parent}, and recursively to
   * the loops among them. A level that already contains calls is left
   * unchanged, so injecting twice has the same effect as injecting
   * once. */
  public void inject(StmtArena arena, int parent) {
    inject(arena, parent, ImmutableList.of());
  }

  private void inject(StmtArena arena, int parent, List<String> loopVars) {
    final List<Integer> children =
        ImmutableList.copyOf(arena.children(parent));
    boolean containsLoop = false;
    for (int child : children) {
      if (arena.op(child) == Op.FOR) {
        containsLoop = true;
        final Stmt.For loop = arena.get(child, Stmt.For.class);
        inject(arena, child,
            loop.tableIndex
                ? ImmutableList.<String>builder().addAll(loopVars)
                    .add(loop.var).build()
                : loopVars);
      }
    }

    for (int child : children) {
      if (arena.op(child) == Op.FOR && isEmptyLoop(arena, child)) {
        arena.detach(child);
      }
    }

    if (mode == CykMode.PARALLEL && containsLoop) {
      // tiles are scheduled by the outer loops; calls go innermost only
      return;
    }
    if (hasEvaluation(arena, parent)) {
      return;
    }

    final List<Stmt> calls = calls(loopVars);
    if (calls.isEmpty()) {
      return;
    }
    if (checkpoint && mode == CykMode.SINGLE_THREAD) {
      arena.add(parent, CheckpointOverlay.guard(mutex));
    } else if (checkpoint && mode == CykMode.SERIAL) {
      arena.add(parent, CheckpointOverlay.lock(mutex));
    }
    for (Stmt call : calls) {
      arena.add(parent, call);
    }
    if (checkpoint && mode == CykMode.SERIAL) {
      arena.add(parent, CheckpointOverlay.unlock(mutex));
    }
  }

  /** Returns the calls for a level where {@code loopVars} are bound by
   * enclosing loops. */
  List<Stmt> calls(List<String> loopVars) {
    final Grammar grammar = program.grammar;
    final List<Stmt> calls = new ArrayList<>();
    for (NonTerminal nt : grammar.topologicalOrder) {
      if (!nt.tabulated) {
        continue;
      }
      final List<Exp> args = new ArrayList<>();
      int used = 0;
      for (int t = 0; t < nt.tracks(); t++) {
        final int track = nt.firstTrack + t;
        final Table table = nt.table(t);
        if (table.hasLeftIndex()) {
          if (loopVars.contains(grammar.leftIndex(track))) {
            ++used;
          }
          args.add(leftArgument(track));
        }
        if (table.hasRightIndex()) {
          if (loopVars.contains(grammar.rightIndex(track))) {
            ++used;
          }
          args.add(grammar.rightIndexExp(track));
        }
      }
      if (used != loopVars.size()) {
        continue;
      }
      if (mode.isOutside() && used != nt.indexCount()) {
        // outside loops leave no boundary values behind
        continue;
      }
      calls.add(Stmt.evaluate(nt.routine, args));
    }
    return calls;
  }

  /** Returns the row that a left index addresses: "i - 1" in inside
   * traversals, "j + i - n" in outside traversals. */
  private Exp leftArgument(int track) {
    final Grammar grammar = program.grammar;
    if (mode.isOutside()) {
      return exp.minus(
          exp.plus(grammar.rightIndexExp(track), grammar.leftIndexExp(track)),
          exp.size(program.sequence(track)));
    }
    return exp.minus(grammar.leftIndexExp(track), 1);
  }

  private static boolean isEmptyLoop(StmtArena arena, int loop) {
    for (int child : arena.children(loop)) {
      if (arena.op(child) == Op.FOR || isEvaluation(arena, child)) {
        return false;
      }
    }
    return true;
  }

  private static boolean hasEvaluation(StmtArena arena, int parent) {
    for (int child : arena.children(parent)) {
      if (isEvaluation(arena, child)) {
        return true;
      }
    }
    return false;
  }

  static boolean isEvaluation(StmtArena arena, int id) {
    return arena.op(id) == Op.CALL
        && arena.get(id, Stmt.Call.class).evaluation;
  }
}

// End CallInjector.java
