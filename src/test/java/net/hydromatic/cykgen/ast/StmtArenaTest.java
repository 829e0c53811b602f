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

import static net.hydromatic.cykgen.ast.ExpBuilder.exp;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.cykgen.Cyk;
import org.junit.jupiter.api.Test;

/** Tests {@link StmtArena}, and how {@link CodeWriter} writes
 * statements. */
class StmtArenaTest {
  /** Creates "for (unsigned int j = 0; j &lt; s.size(); ++j) {...}" with a
   * row loop and a boundary declaration inside. */
  private static int columnWithRow(StmtArena arena) {
    final int column = arena.add(
        Stmt.forLoop(Stmt.VarType.SIZE, "j", exp.literal(0),
            exp.lessThan(exp.id("j"), exp.size("s")), exp.literal(1), true));
    final int row = arena.add(column,
        Stmt.forLoop(Stmt.VarType.INT, "i", exp.plus(exp.id("j"), 1),
            exp.greaterThan(exp.id("i"), exp.literal(1)), exp.literal(-1),
            true));
    arena.add(row,
        Stmt.evaluate("f",
            ImmutableList.of(exp.minus(exp.id("i"), 1), exp.id("j"))));
    arena.add(column, Stmt.decl(Stmt.VarType.SIZE, "i", exp.literal(1)));
    return column;
  }

  @Test void testUnparse() {
    final StmtArena arena = new StmtArena();
    final int column = columnWithRow(arena);
    final String expected = "for (unsigned int j = 0; j < s.size(); ++j) {\n"
        + "  for (int i = j + 1; i > 1; --i) {\n"
        + "    f(i - 1, j);\n"
        + "  }\n"
        + "  unsigned int i = 1;\n"
        + "}\n";
    assertThat(arena.unparse(column), is(expected));
  }

  @Test void testUnparseDirectives() {
    final StmtArena arena = new StmtArena();
    final int block = arena.add(Stmt.Block.withPragma("omp parallel"));
    final int ifDef = arena.add(block, Stmt.ifDef("TILE_SIZE", true));
    final int then = arena.add(ifDef, Stmt.block(false));
    arena.add(then, Stmt.raw("// override"));
    arena.add(then, Stmt.assign("tile_size", exp.id("TILE_SIZE")));
    final int orElse = arena.add(ifDef, Stmt.block(false));
    arena.add(orElse, Stmt.raw("#error no tile size"));
    arena.add(block, Stmt.increment("x", exp.id("tile_size")));
    arena.add(block, Stmt.increment("n", exp.literal(1)));
    arena.add(block,
        Stmt.decl(Stmt.VarType.EXTERNAL, "t_0_i", exp.literal(1)));
    arena.add(block,
        Stmt.methodCall("mutex", "unlock_shared", ImmutableList.of()));
    final String expected = "#pragma omp parallel\n"
        + "{\n"
        + "#ifdef TILE_SIZE\n"
        + "  // override\n"
        + "  tile_size = TILE_SIZE;\n"
        + "#else\n"
        + "#error no tile size\n"
        + "#endif\n"
        + "  x += tile_size;\n"
        + "  ++n;\n"
        + "  t_0_i = 1;\n"
        + "  mutex.unlock_shared();\n"
        + "}\n";
    assertThat(arena.unparse(block), is(expected));
  }

  @Test void testStructure() {
    final StmtArena arena = new StmtArena();
    final int column = columnWithRow(arena);
    final int row = arena.children(column).get(0);
    final int call = arena.children(row).get(0);
    assertThat(arena.parent(column), is(StmtArena.NONE));
    assertThat(arena.parent(row), is(column));
    assertThat(arena.parent(call), is(row));
    assertThat(arena.isAncestor(column, call), is(true));
    assertThat(arena.isAncestor(call, column), is(false));
    assertThat(Cyk.descendants(arena, column),
        is(ImmutableList.of(column, row, call, row + 2)));
    assertThat(arena.children(call), empty());
  }

  @Test void testCopy() {
    final StmtArena arena = new StmtArena();
    final int column = columnWithRow(arena);
    final int size = arena.size();
    final int copy = arena.copy(column);
    assertThat(copy, not(is(column)));
    assertThat(arena.size(), is(2 * size));
    assertThat(arena.parent(copy), is(StmtArena.NONE));
    assertThat(arena.unparse(copy), is(arena.unparse(column)));
    assertThat(arena.get(copy), sameInstance(arena.get(column)));

    // changing the copy leaves the original unchanged
    final int copiedRow = arena.children(copy).get(0);
    arena.detach(copiedRow);
    assertThat(arena.children(copy), hasSize(1));
    assertThat(arena.children(column), hasSize(2));
    assertThat(arena.parent(copiedRow), is(StmtArena.NONE));
  }

  @Test void testInsert() {
    final StmtArena arena = new StmtArena();
    final int block = arena.add(Stmt.block(false));
    final int a = arena.add(block, Stmt.raw("a"));
    final int c = arena.add(block, Stmt.raw("c"));
    final int b = arena.add(Stmt.raw("b"));
    arena.insert(block, 1, b);
    assertThat(arena.children(block), is(ImmutableList.of(a, b, c)));

    // a node cannot have two parents
    assertThrows(IllegalArgumentException.class, () -> arena.append(block, a));
    // a node cannot contain itself
    final int inner = arena.add(block, Stmt.block(true));
    arena.detach(block);
    assertThrows(IllegalArgumentException.class,
        () -> arena.append(inner, block));
    // leaves have no children
    assertThrows(IllegalArgumentException.class,
        () -> arena.append(a, arena.add(Stmt.raw("d"))));
  }

  @Test void testSet() {
    final StmtArena arena = new StmtArena();
    final int loop = arena.add(
        Stmt.forLoop(Stmt.VarType.INT, "z", exp.literal(0),
            exp.lessThan(exp.id("z"), exp.id("n")), exp.id("tile_size"),
            false));
    arena.set(loop, arena.get(loop, Stmt.For.class).withPragma("omp for"));
    assertThat(arena.unparse(loop),
        is("#pragma omp for\n"
            + "for (int z = 0; z < n; z += tile_size) {\n"
            + "}\n"));
    assertThrows(IllegalArgumentException.class,
        () -> arena.set(loop, Stmt.raw("x")));
  }
}

// End StmtArenaTest.java
