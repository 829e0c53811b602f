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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import net.hydromatic.cykgen.Cyk;
import net.hydromatic.cykgen.ast.Op;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.eval.Simulator;
import net.hydromatic.cykgen.grammar.NonTerminal;
import net.hydromatic.cykgen.grammar.Program;
import net.hydromatic.cykgen.grammar.Table;
import org.junit.jupiter.api.Test;

/** Tests {@link Traversals} and {@link Loops}. */
class TraversalsTest {
  private static final NonTerminal A = NonTerminal.of("a", Table.QUADRATIC);

  private static String skeleton(Program program, CykMode mode,
      boolean checkpoint) {
    final StmtArena arena = new StmtArena();
    return arena.unparse(
        Traversals.singleThread(arena, program, mode, checkpoint));
  }

  @Test void testInside() {
    final String expected = ""
        + "for (unsigned int t_0_j = 0; t_0_j < t_0_seq.size(); ++t_0_j) {\n"
        + "  for (unsigned int t_0_i = t_0_j + 1; t_0_i > 1; --t_0_i) {\n"
        + "  }\n"
        + "  unsigned int t_0_i = 1;\n"
        + "}\n"
        + "unsigned int t_0_j = t_0_seq.size();\n"
        + "for (unsigned int t_0_i = t_0_j + 1; t_0_i > 1; --t_0_i) {\n"
        + "}\n"
        + "unsigned int t_0_i = 1;\n";
    assertThat(skeleton(Cyk.program(b -> b, A), CykMode.SINGLE_THREAD, false),
        is(expected));
  }

  @Test void testSerialStartsAfterTiles() {
    final String s =
        skeleton(Cyk.program(b -> b, A), CykMode.SERIAL, false);
    assertThat(s.substring(0, s.indexOf('\n')),
        is("for (unsigned int t_0_j = max_tiles_n; t_0_j < t_0_seq.size();"
            + " ++t_0_j) {"));
  }

  @Test void testOutside() {
    final String expected = ""
        + "for (unsigned int t_0_i = 0; t_0_i < t_0_seq.size() + 1;"
        + " ++t_0_i) {\n"
        + "  for (unsigned int t_0_j = t_0_seq.size() - t_0_i;"
        + " t_0_j < t_0_seq.size() + 1; ++t_0_j) {\n"
        + "  }\n"
        + "}\n";
    assertThat(
        skeleton(Cyk.program(b -> b, A), CykMode.SINGLE_THREAD_OUTSIDE,
            false),
        is(expected));
  }

  /** With checkpointing, loop variables are declared by the code that
   * restores the checkpoint, and each loop resumes at the saved index the
   * first time it is entered. */
  @Test void testCheckpoint() {
    final String expected = ""
        + "for (t_0_j = t_0_j_loaded++ ? 0 : t_0_j; t_0_j < t_0_seq.size();"
        + " ++t_0_j) {\n"
        + "  for (t_0_i = t_0_i_loaded++ ? t_0_j + 1 : t_0_i; t_0_i > 1;"
        + " --t_0_i) {\n"
        + "  }\n"
        + "  t_0_i = 1;\n"
        + "}\n"
        + "t_0_j = t_0_seq.size();\n"
        + "for (t_0_i = t_0_i_loaded++ ? t_0_j + 1 : t_0_i; t_0_i > 1;"
        + " --t_0_i) {\n"
        + "}\n"
        + "t_0_i = 1;\n";
    assertThat(skeleton(Cyk.program(b -> b, A), CykMode.SINGLE_THREAD, true),
        is(expected));
  }

  /** The skeleton of an inner track is copied into each of the four regions
   * of the outer track. */
  @Test void testTwoTracks() {
    final NonTerminal nt =
        NonTerminal.of("ali", Table.QUADRATIC, Table.QUADRATIC);
    final Program program = Cyk.program(b -> b, nt);
    final StmtArena arena = new StmtArena();
    final int block =
        Traversals.singleThread(arena, program, CykMode.SINGLE_THREAD, false);
    final List<String> vars = new ArrayList<>();
    for (int id : Cyk.descendants(arena, block)) {
      if (arena.op(id) == Op.FOR) {
        vars.add(arena.get(id, Stmt.For.class).var);
      }
    }
    // track 0: one column loop, two row loops
    assertThat(count(vars, "t_0_j"), is(1));
    assertThat(count(vars, "t_0_i"), is(2));
    // track 1: one column loop and two row loops per region
    assertThat(count(vars, "t_1_j"), is(4));
    assertThat(count(vars, "t_1_i"), is(8));

    // track 0 loops are outermost
    final List<Integer> top = arena.children(block);
    assertThat(arena.get(top.get(0), Stmt.For.class).var, is("t_0_j"));

    // copies are distinct nodes
    final List<Integer> descendants = Cyk.descendants(arena, block);
    assertThat(new HashSet<>(descendants).size(), is(descendants.size()));
  }

  @Test void testSequenceMismatch() {
    final Program program = Cyk.program(b -> b.sequences("s", "t"), A);
    final CompileException e = assertThrows(CompileException.class, () ->
        Traversals.singleThread(new StmtArena(), program,
            CykMode.SINGLE_THREAD, false));
    assertThat(e.kind(), is(CompileException.Kind.INTERNAL));
  }

  /** The single-threaded traversal visits every cell exactly once, each
   * after the cells it depends on. */
  @Test void testInsideOrder() {
    for (int n = 0; n < 8; n++) {
      final List<String> calls = Cyk.of(A).calls(n);
      final List<String> expected = new ArrayList<>();
      for (int j = 0; j <= n; j++) {
        for (int i = j; i >= 0; i--) {
          expected.add("nt_tabulate_a(" + i + ", " + j + ")");
        }
      }
      assertThat(calls, is(expected));
    }
  }

  /** The outside traversal visits every cell exactly once, each after the
   * cells that enclose it. */
  @Test void testOutsideOrder() {
    final Cyk cyk = Cyk.of(Cyk.program(b -> b.outside(true), A));
    for (int n = 0; n < 8; n++) {
      final List<String> calls = cyk.calls(n);
      final List<String> expected = new ArrayList<>();
      for (int length = n; length >= 0; length--) {
        for (int i = 0; i + length <= n; i++) {
          expected.add("nt_tabulate_a(" + i + ", " + (i + length) + ")");
        }
      }
      assertThat(calls, is(expected));
    }
  }

  /** Two-track traversal visits every pair of cells exactly once. */
  @Test void testTwoTrackCoverage() {
    final NonTerminal nt =
        NonTerminal.of("ali", Table.QUADRATIC, Table.QUADRATIC);
    final Cyk cyk = Cyk.of(nt);
    final Simulator simulator = cyk.simulator(2, 3).build();
    final List<List<Long>> cells = new ArrayList<>();
    simulator.run(cyk.procedure(), (routine, args) -> cells.add(args));
    assertThat(cells.size(), is(6 * 10));
    assertThat(new HashSet<>(cells).size(), is(cells.size()));
    for (List<Long> cell : cells) {
      assertThat(cell.get(0) <= cell.get(1) && cell.get(1) <= 2, is(true));
      assertThat(cell.get(2) <= cell.get(3) && cell.get(3) <= 3, is(true));
    }
    // the last call fills the cell that spans both inputs
    assertThat(cells.get(cells.size() - 1),
        is(ImmutableList.of(0L, 2L, 0L, 3L)));
  }

  private static int count(List<String> list, String s) {
    int n = 0;
    for (String e : list) {
      if (e.equals(s)) {
        ++n;
      }
    }
    return n;
  }
}

// End TraversalsTest.java
