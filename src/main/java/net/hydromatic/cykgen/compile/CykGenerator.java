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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cykgen.ast.Procedure;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.eval.Prop;
import net.hydromatic.cykgen.grammar.Program;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the procedure that fills the DP tables of a program.
 *
 * <p>The procedure has two branches, selected when the generated code is
 * compiled: a single-threaded traversal, and, if OpenMP is enabled, a tiled
 * parallel traversal followed by a serial traversal of the cells that the
 * tiles do not cover:
 *
 * <pre>{@code
 * void cyk() {
 * #ifndef _OPENMP
 *   // single-threaded traversal
 * #else
 *   #pragma omp parallel
 *   {
 *     // phases A and B
 *   }
 *   // serial remainder
 * #endif
 * }
 * }</pre>
 */
public class CykGenerator {
  private final Map<Prop, Object> map;
  private final Tracer tracer;

  public CykGenerator(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a generator with default properties that traces nothing. */
  public static CykGenerator create() {
    return new CykGenerator(ImmutableMap.of(), Tracers.empty());
  }

  /** Generates the procedure and converts it to C++ text. Returns null if
   * the tracer handled a compile exception. */
  public @Nullable String generateCode(Program program) {
    final Procedure procedure = generate(program);
    return procedure == null
        ? null
        : procedure.unparse(Prop.INDENT.intValue(map));
  }

  /**
   * Generates the procedure.
   *
   * <p>A {@link CompileException} is passed to the tracer; if the tracer
   * handles it, returns null, otherwise rethrows it. After a successful
   * generation, the tracer receives a null exception.
   */
  public @Nullable Procedure generate(Program program) {
    final Procedure procedure;
    try {
      procedure = build(program);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
      return null;
    }
    tracer.handleCompileException(null);
    return procedure;
  }

  /** Builds the procedure. If the program does not evaluate DP tables,
   * the procedure is empty; it is generated anyway, because the code that
   * surrounds it calls it unconditionally. */
  private Procedure build(Program program) {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    final String name = Prop.PROCEDURE_NAME.stringValue(map);
    if (program.cyk) {
      final List<CompileException> warnings = new ArrayList<>();
      new ProgramValidator(program, Prop.PARALLEL.booleanValue(map))
          .validate(warnings::add);
      if (!warnings.isEmpty()) {
        tracer.onWarnings(ImmutableList.copyOf(warnings));
      }
      body(arena, body, program);
    }
    final Procedure procedure = new Procedure(name, arena, body);
    tracer.onProcedure(procedure);
    return procedure;
  }

  private void body(StmtArena arena, int body, Program program) {
    final boolean checkpoint = program.checkpointCyk();
    if (checkpoint) {
      arena.appendAll(body,
          CheckpointOverlay.markers(arena, program.grammar));
    }

    final int ifDef = arena.add(body,
        Stmt.ifDef(Prop.PARALLEL_MACRO.stringValue(map), false));
    final int singleThread = arena.add(ifDef, Stmt.block(false));
    final CykMode mode = program.outside
        ? CykMode.SINGLE_THREAD_OUTSIDE
        : CykMode.SINGLE_THREAD;
    arena.append(singleThread,
        decorate(arena, Traversals.singleThread(arena, program, mode,
            checkpoint), program, mode));

    final int parallel = arena.add(ifDef, Stmt.block(false));
    final String obstacle = ProgramValidator.tilingObstacle(program);
    if (obstacle == null) {
      parallel(arena, parallel, program);
    } else {
      // fail when the generated code is compiled with OpenMP
      arena.add(parallel, Stmt.raw("#error " + obstacle));
    }
  }

  /** Creates the tiled traversal and the serial remainder. */
  private void parallel(StmtArena arena, int parent, Program program) {
    final boolean checkpoint = program.checkpointCyk();
    final TiledTraversals tiled =
        new TiledTraversals(arena, program, Prop.TILE_SIZE.intValue(map),
            Prop.TILE_SIZE_MACRO.stringValue(map),
            Prop.MUTEX_NAME.stringValue(map));
    if (checkpoint) {
      arena.appendAll(parent, tiled.tileSizeHeader());
      arena.appendAll(parent,
          CheckpointOverlay.parallelMarkers(arena,
              exp.id(TiledTraversals.TILE_SIZE)));
    }

    final int region =
        arena.add(parent, Stmt.Block.withPragma("omp parallel"));
    arena.appendAll(region, tiled.tileComputation());
    final int phases = arena.add(Stmt.block(false));
    arena.appendAll(phases, tiled.build());
    arena.append(region, decorate(arena, phases, program, CykMode.PARALLEL));
    arena.add(region, Stmt.raw("// end parallel"));

    arena.appendAll(parent, tiled.tileComputation());
    arena.append(parent,
        decorate(arena,
            Traversals.singleThread(arena, program, CykMode.SERIAL,
                checkpoint),
            program, CykMode.SERIAL));
  }

  /** Adds evaluation calls to a skeleton. */
  private int decorate(StmtArena arena, int skeleton, Program program,
      CykMode mode) {
    new CallInjector(program, mode, program.checkpointCyk(),
        Prop.MUTEX_NAME.stringValue(map))
        .inject(arena, skeleton);
    tracer.onSkeleton(mode, arena.unparse(skeleton));
    return skeleton;
  }
}

// End CykGenerator.java
