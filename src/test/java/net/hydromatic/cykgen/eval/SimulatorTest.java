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
package net.hydromatic.cykgen.eval;

import static net.hydromatic.cykgen.ast.ExpBuilder.exp;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cykgen.ast.Procedure;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import org.junit.jupiter.api.Test;

/** Tests {@link Simulator}. */
class SimulatorTest {
  /** Creates a procedure named "p". */
  private static Procedure procedure(StmtArena arena, int body) {
    return new Procedure("p", arena, body);
  }

  /** Creates "for (int v = 0; v &lt; n; v += step) { f(v); }". */
  private static int loop(StmtArena arena, String v, long n, long step) {
    final int loop = arena.add(
        Stmt.forLoop(Stmt.VarType.INT, v, exp.literal(0),
            exp.lessThan(exp.id(v), exp.literal(n)), exp.literal(step),
            true));
    arena.add(loop, Stmt.evaluate("f", ImmutableList.of(exp.id(v))));
    return loop;
  }

  @Test void testLoop() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.append(body, loop(arena, "v", 7, 3));
    assertThat(Simulator.builder().build().calls(procedure(arena, body)),
        is(ImmutableList.of("f(0)", "f(3)", "f(6)")));
  }

  @Test void testWorkSharing() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    final int loop = loop(arena, "v", 4, 1);
    arena.set(loop, arena.get(loop, Stmt.For.class).withPragma("omp for"));
    arena.append(body, loop);
    final Procedure p = procedure(arena, body);
    assertThat(Simulator.builder().build().calls(p),
        is(ImmutableList.of("f(0)", "f(1)", "f(2)", "f(3)")));
    assertThat(Simulator.builder().reverseWorkSharing(true).build().calls(p),
        is(ImmutableList.of("f(3)", "f(2)", "f(1)", "f(0)")));
  }

  @Test void testIfDef() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.add(body, Stmt.decl(Stmt.VarType.INT, "x", exp.literal(1)));
    final int ifDef = arena.add(body, Stmt.ifDef("M", true));
    final int then = arena.add(ifDef, Stmt.block(false));
    arena.add(then, Stmt.assign("x", exp.id("M")));
    arena.add(body, Stmt.evaluate("f", ImmutableList.of(exp.id("x"))));
    final Procedure p = procedure(arena, body);
    assertThat(Simulator.builder().build().calls(p),
        is(ImmutableList.of("f(1)")));
    assertThat(Simulator.builder().define("M", 8).build().calls(p),
        is(ImmutableList.of("f(8)")));
  }

  @Test void testSequenceSize() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.add(body,
        Stmt.evaluate("f",
            ImmutableList.of(exp.size("s"),
                exp.divide(exp.size("s"), exp.literal(2)))));
    final Procedure p = procedure(arena, body);
    assertThat(Simulator.builder().sequence("s", 9).build().calls(p),
        is(ImmutableList.of("f(9, 4)")));
    final SimulationException e = assertThrows(SimulationException.class,
        () -> Simulator.builder().build().calls(p));
    assertThat(e.getMessage(), is("unknown sequence s"));
  }

  @Test void testLocks() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.add(body,
        Stmt.methodCall("mutex", "lock_shared", ImmutableList.of()));
    arena.add(body, Stmt.raw("std::lock_guard<fair_mutex> lock(mutex);"));
    arena.add(body,
        Stmt.methodCall("mutex", "unlock_shared", ImmutableList.of()));
    final List<String> events = new ArrayList<>();
    Simulator.builder().build().run(procedure(arena, body),
        new Simulator.Listener() {
          @Override public void evaluate(String routine, List<Long> args) {
            events.add(routine);
          }

          @Override public void onLock(String mutex, boolean lock) {
            events.add(mutex + (lock ? " locked" : " unlocked"));
          }
        });
    assertThat(events,
        is(ImmutableList.of("mutex locked", "mutex unlocked")));
  }

  @Test void testErrors() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.add(body, Stmt.raw("#error no tiles"));
    assertThat(
        assertThrows(SimulationException.class,
            () -> Simulator.builder().build().calls(procedure(arena, body)))
            .getMessage(),
        is("#error no tiles"));

    final StmtArena arena2 = new StmtArena();
    final int body2 = arena2.add(Stmt.block(false));
    arena2.add(body2, Stmt.decl(Stmt.VarType.INT, "x", exp.literal(0)));
    arena2.add(body2, Stmt.call("assert", ImmutableList.of(exp.id("x"))));
    assertThat(
        assertThrows(SimulationException.class,
            () -> Simulator.builder().build().calls(procedure(arena2, body2)))
            .getMessage(),
        is("assertion failed: x"));

    final StmtArena arena3 = new StmtArena();
    final int body3 = arena3.add(Stmt.block(false));
    arena3.add(body3, Stmt.decl(Stmt.VarType.INT, "x", exp.literal(0)));
    arena3.add(body3, Stmt.decl(Stmt.VarType.SIZE, "x", exp.literal(1)));
    assertThat(
        assertThrows(SimulationException.class,
            () -> Simulator.builder().build().calls(procedure(arena3, body3)))
            .getMessage(),
        is("variable x is declared twice in the same scope"));

    final StmtArena arena4 = new StmtArena();
    final int body4 = arena4.add(Stmt.block(false));
    arena4.add(body4, Stmt.assign("y", exp.literal(1)));
    assertThat(
        assertThrows(SimulationException.class,
            () -> Simulator.builder().build().calls(procedure(arena4, body4)))
            .getMessage(),
        is("variable y is not declared"));
  }

  /** A loop that counts in the wrong direction is caught. */
  @Test void testNonTerminating() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    arena.add(body,
        Stmt.forLoop(Stmt.VarType.INT, "v", exp.literal(0),
            exp.lessThan(exp.id("v"), exp.literal(1)), exp.literal(-1),
            true));
    final SimulationException e = assertThrows(SimulationException.class,
        () -> Simulator.builder().build().calls(procedure(arena, body)));
    assertThat(e.getMessage(), is("loop over v does not terminate"));
  }

  /** A scoped block hides its declarations from the statements that follow
   * it; external declarations assign to a global. */
  @Test void testScopes() {
    final StmtArena arena = new StmtArena();
    final int body = arena.add(Stmt.block(false));
    final int block = arena.add(body, Stmt.block(true));
    arena.add(block, Stmt.decl(Stmt.VarType.INT, "x", exp.literal(1)));
    arena.add(body, Stmt.decl(Stmt.VarType.INT, "x", exp.literal(2)));
    arena.add(body, Stmt.decl(Stmt.VarType.EXTERNAL, "g", exp.literal(5)));
    arena.add(body,
        Stmt.evaluate("f", ImmutableList.of(exp.id("x"), exp.id("g"))));
    assertThat(
        Simulator.builder().global("g", 0).build()
            .calls(procedure(arena, body)),
        is(ImmutableList.of("f(2, 5)")));
  }
}

// End SimulatorTest.java
