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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.grammar.Grammar;
import net.hydromatic.cykgen.grammar.Program;

/**
 * Builds the loop skeletons that visit every cell of the DP tables in a
 * single thread.
 *
 * <p>A skeleton contains loops, boundary declarations and the statements of
 * inner tracks, but no evaluation calls; {@link CallInjector} adds those.
 */
public abstract class Traversals {
  private Traversals() {}

  /**
   * Builds the skeleton for all tracks of a program, the first track's loops
   * outermost. Returns the id of an unscoped block that holds it.
   */
  public static int singleThread(StmtArena arena, Program program,
      CykMode mode, boolean checkpoint) {
    final Grammar grammar = program.grammar;
    if (program.sequences.size() != grammar.tracks()) {
      throw CompileException.internal("grammar " + grammar.name + " has "
          + grammar.tracks() + " tracks but " + program.sequences.size()
          + " input sequences", grammar.pos);
    }
    List<Integer> stmts = ImmutableList.of();
    for (int track = grammar.tracks() - 1; track >= 0; track--) {
      stmts = mode.isOutside()
          ? outsideTrack(arena, program, track, stmts, checkpoint, mode)
          : insideTrack(arena, program, track, stmts, checkpoint, mode);
    }
    final int block = arena.add(Stmt.block(false));
    arena.appendAll(block, stmts);
    return block;
  }

  /**
   * Builds the inside traversal of one track around the statements of the
   * inner tracks, {@code nested}.
   *
   * <p>The cells of the track fall into four regions, each of which gets
   * its own copy of {@code nested}:
   *
   * <pre>
   *   |  0  1  2  3  4  5
   * --|------------------
   * 0 |  B  B  B  B  B  D
   * 1 |     A  A  A  A  C
   * 2 |        A  A  A  C
   * 3 |           A  A  C
   * 4 |              A  C
   * 5 |                 C
   * </pre>
   *
   * <p>Columns are visited left to right, and each column bottom to top.
   * In {@link CykMode#SERIAL} mode the columns start after the last tile.
   */
  static List<Integer> insideTrack(StmtArena arena, Program program,
      int track, List<Integer> nested, boolean checkpoint, CykMode mode) {
    final Exp.Id i = program.grammar.leftIndexExp(track);
    final Exp.Id j = program.grammar.rightIndexExp(track);
    final Exp size = exp.size(program.sequence(track));
    final Exp rowStart = exp.plus(j, 1);
    final List<Integer> stmts = new ArrayList<>();

    // A: cells below the top row, left of the last column
    final LoopPair row =
        Loops.row(arena, i, rowStart, exp.literal(1), checkpoint, mode);
    arena.appendAll(row.loop, arena.copyAll(nested));
    final Exp columnStart = mode == CykMode.SERIAL
        ? exp.id(TiledTraversals.MAX_TILES_N)
        : exp.literal(0);
    final LoopPair column =
        Loops.column(arena, j, columnStart, size, checkpoint, mode);
    arena.append(column.loop, row.loop);
    arena.append(column.loop, row.boundary);

    // B: top row
    arena.appendAll(column.loop, arena.copyAll(nested));
    stmts.add(column.loop);
    stmts.add(column.boundary);

    // C: last column
    final LoopPair lastColumn =
        Loops.row(arena, i, rowStart, exp.literal(1), checkpoint, mode);
    arena.appendAll(lastColumn.loop, arena.copyAll(nested));
    stmts.add(lastColumn.loop);
    stmts.add(lastColumn.boundary);

    // D: top right cell
    stmts.addAll(arena.copyAll(nested));
    return stmts;
  }

  /**
   * Builds the outside traversal of one track around the statements of the
   * inner tracks.
   *
   * <p>In iteration {@code i} of the outer loop, the inner loop visits the
   * cells {@code (j + i - n, j)} for {@code j} from {@code n - i} to
   * {@code n}; that is, every span of length {@code n - i}, so that each
   * span is visited after the spans that enclose it.
   */
  static List<Integer> outsideTrack(StmtArena arena, Program program,
      int track, List<Integer> nested, boolean checkpoint, CykMode mode) {
    final Exp.Id i = program.grammar.leftIndexExp(track);
    final Exp.Id j = program.grammar.rightIndexExp(track);
    final Exp size = exp.size(program.sequence(track));

    final LoopPair column = Loops.column(arena, j, exp.minus(size, i),
        exp.plus(size, 1), checkpoint, mode);
    arena.appendAll(column.loop, arena.copyAll(nested));
    final LoopPair row = Loops.row(arena, i, exp.literal(0),
        exp.plus(size, 1), checkpoint, mode);
    arena.append(row.loop, column.loop);
    return ImmutableList.of(row.loop);
  }
}

// End Traversals.java
