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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cykgen.ast.ExpBuilder.exp;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.grammar.Grammar;
import net.hydromatic.cykgen.grammar.Program;

/**
 * Builds the tiled traversal that fills the DP matrix of a single-track
 * program with OpenMP.
 *
 * <p>The part of the matrix left of column {@code max_tiles_n} is cut into
 * square tiles of {@code tile_size} columns. Phase A computes the tiles on
 * the diagonal; they are independent of each other. Phase B then computes,
 * for each diagonal offset {@code z}, the tiles {@code z} columns right of
 * the diagonal; such a tile reads only tiles of smaller offsets, so the
 * tiles of one offset are also computed in parallel. With tile size 4 and
 * an input of length 12, the tiles are computed in this order:
 *
 * <pre>
 *    |  0 .. 3   4 .. 7   8 .. 11  12
 * ---|--------------------------------
 *  0 |   A0       B4       B8
 *  4 |            A4       B4
 *  8 |                     A8
 * 12 |
 * </pre>
 *
 * <p>The remaining cells, in columns {@code max_tiles_n} onwards, are left
 * to the serial traversal ({@link Traversals} in {@link CykMode#SERIAL}
 * mode).
 */
public class TiledTraversals {
  public static final String TILE_SIZE = "tile_size";
  public static final String MAX_TILES = "max_tiles";
  public static final String MAX_TILES_N = "max_tiles_n";

  private final StmtArena arena;
  private final Program program;
  private final int defaultTileSize;
  private final String tileSizeMacro;
  private final String mutex;
  private final boolean checkpoint;

  private final Exp.Id tileSize = exp.id(TILE_SIZE);
  private final Exp.Id maxTilesN = exp.id(MAX_TILES_N);

  public TiledTraversals(StmtArena arena, Program program,
      int defaultTileSize, String tileSizeMacro, String mutex) {
    this.arena = requireNonNull(arena);
    this.program = requireNonNull(program);
    this.defaultTileSize = defaultTileSize;
    this.tileSizeMacro = requireNonNull(tileSizeMacro);
    this.mutex = requireNonNull(mutex);
    this.checkpoint = program.checkpointCyk();
    checkArgument(defaultTileSize > 0, "tile size must be positive");
    final Grammar grammar = program.grammar;
    if (grammar.tracks() != 1 || program.sequences.size() != 1) {
      throw CompileException.internal("tiled traversal of grammar "
          + grammar.name + " requires exactly one track", grammar.pos);
    }
  }

  /** Creates "unsigned int tile_size = 32;" and its override by a
   * macro. */
  public List<Integer> tileSizeHeader() {
    final int decl = arena.add(
        Stmt.decl(Stmt.VarType.SIZE, TILE_SIZE,
            exp.literal(defaultTileSize)));
    final int ifDef = arena.add(Stmt.ifDef(tileSizeMacro, true));
    final int then = arena.add(ifDef, Stmt.block(false));
    arena.add(then, Stmt.assign(TILE_SIZE, exp.id(tileSizeMacro)));
    return ImmutableList.of(decl, ifDef);
  }

  /** Creates the declarations of the tile size (unless checkpointing has
   * hoisted it to the start of the branch), of the number of tiles, and of
   * {@code max_tiles_n}, the first column after the last tile. */
  public List<Integer> tileComputation() {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    if (!checkpoint) {
      b.addAll(tileSizeHeader());
    }
    b.add(arena.add(Stmt.call("assert", ImmutableList.of(tileSize))));
    b.add(
        arena.add(
            Stmt.decl(Stmt.VarType.SIZE, MAX_TILES,
                exp.divide(exp.size(program.sequence(0)), tileSize))));
    b.add(
        arena.add(
            Stmt.decl(Stmt.VarType.INT, MAX_TILES_N,
                exp.times(exp.id(MAX_TILES), tileSize))));
    return b.build();
  }

  /** Creates phase A and phase B. */
  public List<Integer> build() {
    return ImmutableList.of(phaseA(), phaseB());
  }

  private String workSharing() {
    return checkpoint ? "omp for ordered schedule(dynamic)" : "omp for";
  }

  /** Creates the loop over the tiles on the diagonal. */
  private int phaseA() {
    final Grammar grammar = program.grammar;
    final Exp.Id z = exp.id("z");
    final Exp.Id j = grammar.rightIndexExp(0);
    final LoopPair row = Loops.row(arena, grammar.leftIndexExp(0),
        exp.plus(j, 1), z, checkpoint, CykMode.PARALLEL);
    final LoopPair column = Loops.column(arena, j, z,
        exp.plus(z, tileSize), checkpoint, CykMode.PARALLEL);
    arena.append(column.loop, row.loop);

    final Exp start = checkpoint
        ? exp.id(CheckpointOverlay.start(CheckpointOverlay.OUTER_LOOP_1))
        : exp.literal(0);
    final int loopZ =
        Loops.scheduling(arena, z.name, start, maxTilesN, tileSize);
    arena.set(loopZ,
        arena.get(loopZ, Stmt.For.class).withPragma(workSharing()));
    if (checkpoint) {
      arena.add(loopZ, CheckpointOverlay.lock(mutex));
    }
    arena.append(loopZ, column.loop);
    if (checkpoint) {
      final int ordered =
          arena.add(loopZ, Stmt.Block.withPragma("omp ordered"));
      arena.add(ordered,
          Stmt.raw("// wait until all threads have finished their tile"));
      arena.add(ordered,
          Stmt.assign(CheckpointOverlay.OUTER_LOOP_1,
              exp.plus(z, tileSize)));
      arena.add(ordered, CheckpointOverlay.unlock(mutex));
    }
    return loopZ;
  }

  /** Creates the loop over diagonal offsets, and within it the work-shared
   * loop over the tiles of one offset. */
  private int phaseB() {
    final Grammar grammar = program.grammar;
    final Exp.Id z = exp.id("z");
    final Exp.Id y = exp.id("y");
    final Exp.Id x = exp.id("x");
    final LoopPair row = Loops.row(arena, grammar.leftIndexExp(0), x,
        exp.minus(x, tileSize), checkpoint, CykMode.PARALLEL);
    final LoopPair column = Loops.column(arena, grammar.rightIndexExp(0), y,
        exp.plus(y, tileSize), checkpoint, CykMode.PARALLEL);
    arena.append(column.loop, row.loop);

    final String innerLoaded =
        CheckpointOverlay.loaded(CheckpointOverlay.INNER_LOOP_2);
    final Exp startY = checkpoint
        ? exp.conditional(exp.id(innerLoaded), z,
            exp.id(CheckpointOverlay.start(CheckpointOverlay.INNER_LOOP_2)))
        : z;
    final int loopY =
        Loops.scheduling(arena, y.name, startY, maxTilesN, tileSize);
    arena.set(loopY,
        arena.get(loopY, Stmt.For.class).withPragma(workSharing()));
    if (checkpoint) {
      arena.add(loopY, Stmt.increment(innerLoaded, exp.literal(1)));
      arena.add(loopY, CheckpointOverlay.lock(mutex));
    }
    arena.add(loopY,
        Stmt.decl(Stmt.VarType.SIZE, x.name,
            exp.plus(exp.minus(y, z), tileSize)));
    arena.append(loopY, column.loop);
    if (checkpoint) {
      final int ordered =
          arena.add(loopY, Stmt.Block.withPragma("omp ordered"));
      arena.add(ordered,
          Stmt.increment(CheckpointOverlay.INNER_LOOP_2, tileSize));
      arena.add(ordered, Stmt.assign(CheckpointOverlay.OUTER_LOOP_2, z));
      arena.add(ordered, CheckpointOverlay.unlock(mutex));
    }

    final Exp startZ = checkpoint
        ? exp.id(CheckpointOverlay.start(CheckpointOverlay.OUTER_LOOP_2))
        : tileSize;
    final int loopZ =
        Loops.scheduling(arena, z.name, startZ, maxTilesN, tileSize);
    arena.append(loopZ, loopY);
    if (checkpoint) {
      arena.add(loopZ,
          Stmt.assign(CheckpointOverlay.INNER_LOOP_2,
              exp.plus(z, tileSize)));
    }
    return loopZ;
  }
}

// End TiledTraversals.java
