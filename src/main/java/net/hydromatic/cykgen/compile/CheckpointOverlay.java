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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.grammar.Grammar;

/**
 * Code that lets a resumed run continue from the loop indices saved in a
 * checkpoint.
 *
 * <p>Each saved index {@code v} has a marker {@code v_loaded} that is 0
 * while the saved value has not yet been used. A loop over {@code v} starts
 * at {@code v_loaded++ ? start : v}: the first entry reads the saved value
 * and sets the marker, and every later entry starts at {@code start}.
 */
public abstract class CheckpointOverlay {
  /** Global flag that is set if the run resumes from a checkpoint. */
  public static final String LOAD_CHECKPOINT = "load_checkpoint";

  /** Progress of phase A of the tiled traversal. */
  public static final String OUTER_LOOP_1 = "outer_loop_1_idx";
  /** Outer progress of phase B of the tiled traversal. */
  public static final String OUTER_LOOP_2 = "outer_loop_2_idx";
  /** Inner progress of phase B of the tiled traversal. */
  public static final String INNER_LOOP_2 = "inner_loop_2_idx";

  private CheckpointOverlay() {}

  /** Returns the name of the marker of a saved index. */
  public static String loaded(String var) {
    return var + "_loaded";
  }

  /** Returns the name of the variable that holds the resumed start of a
   * tile loop. */
  public static String start(String var) {
    return var + "_start";
  }

  /** Returns the start of a loop that resumes from a saved index,
   * "v_loaded++ ? start : v". */
  public static Exp resumableStart(Exp.Id var, Exp start) {
    return exp.conditional(exp.postIncrement(exp.id(loaded(var.name))),
        start, var);
  }

  /** Creates "int v_loaded = !load_checkpoint || !v;". */
  public static int marker(StmtArena arena, String var) {
    return arena.add(
        Stmt.decl(Stmt.VarType.INT, loaded(var),
            exp.orElse(exp.not(exp.id(LOAD_CHECKPOINT)),
                exp.not(exp.id(var)))));
  }

  /** Creates the markers of the running indices of every track. */
  public static List<Integer> markers(StmtArena arena, Grammar grammar) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int t = 0; t < grammar.tracks(); t++) {
      b.add(marker(arena, grammar.leftIndex(t)));
      b.add(marker(arena, grammar.rightIndex(t)));
    }
    return b.build();
  }

  /** Creates the markers and the resumed starts of the tile loops. */
  public static List<Integer> parallelMarkers(StmtArena arena,
      Exp.Id tileSize) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    b.add(marker(arena, OUTER_LOOP_1));
    b.add(marker(arena, OUTER_LOOP_2));
    b.add(marker(arena, INNER_LOOP_2));
    b.add(
        arena.add(
            Stmt.decl(Stmt.VarType.INT, start(OUTER_LOOP_1),
                resumableStart(exp.id(OUTER_LOOP_1), exp.literal(0)))));
    b.add(
        arena.add(
            Stmt.decl(Stmt.VarType.INT, start(OUTER_LOOP_2),
                resumableStart(exp.id(OUTER_LOOP_2), tileSize))));
    b.add(
        arena.add(
            Stmt.decl(Stmt.VarType.INT, start(INNER_LOOP_2),
                exp.id(INNER_LOOP_2))));
    return b.build();
  }

  /** Creates "mutex.lock_shared();". */
  public static Stmt lock(String mutex) {
    return Stmt.methodCall(mutex, "lock_shared", ImmutableList.of());
  }

  /** Creates "mutex.unlock_shared();". */
  public static Stmt unlock(String mutex) {
    return Stmt.methodCall(mutex, "unlock_shared", ImmutableList.of());
  }

  /** Creates a scoped lock that holds a mutex until the end of the
   * enclosing block. */
  public static Stmt guard(String mutex) {
    return Stmt.raw("std::lock_guard<fair_mutex> lock(" + mutex + ");");
  }
}

// End CheckpointOverlay.java
