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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Op;
import net.hydromatic.cykgen.ast.Procedure;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs a generated procedure without compiling it.
 *
 * <p>Input sequences, preprocessor macros and global variables (such as
 * the indices saved in a checkpoint) are given when the simulator is
 * built. Every call to an evaluation routine is reported to a
 * {@link Listener}.
 *
 * <p>Threads are not simulated. A loop marked "omp for" runs its iterations
 * one after another, in reverse order if {@link Builder#reverseWorkSharing}
 * is set; if the procedure is correct, the order does not matter.
 */
public class Simulator {
  /** Upper bound on the iterations of one loop, to catch loops that do not
   * terminate. */
  private static final long MAX_ITERATIONS = 1_000_000L;

  private final Map<String, Long> sequences;
  private final Map<String, @Nullable Long> macros;
  private final Map<String, Long> globals;
  private final boolean reverseWorkSharing;

  private Simulator(Builder builder) {
    this.sequences = ImmutableMap.copyOf(builder.sequences);
    this.macros = new HashMap<>(builder.macros);
    this.globals = ImmutableMap.copyOf(builder.globals);
    this.reverseWorkSharing = builder.reverseWorkSharing;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Runs a procedure. */
  public void run(Procedure procedure, Listener listener) {
    new Run(procedure.arena, listener).run(procedure.body);
  }

  /** Runs a procedure and returns the evaluation calls, each formatted as
   * "routine(arg, ...)". */
  public List<String> calls(Procedure procedure) {
    final List<String> calls = new ArrayList<>();
    run(procedure, (routine, args) ->
        calls.add(
            args.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", routine + "(", ")"))));
    return calls;
  }

  /** Receives the events of a simulation. */
  public interface Listener {
    /** Called when the procedure calls an evaluation routine. */
    void evaluate(String routine, List<Long> args);

    /** Called when a loop starts, with the first value of its
     * variable. */
    default void onLoopStart(String var, long start) {
    }

    /** Called when the procedure locks ({@code lock} true) or unlocks the
     * mutex. */
    default void onLock(String mutex, boolean lock) {
    }
  }

  /** State of one run. */
  private class Run {
    final StmtArena arena;
    final Listener listener;
    final Deque<Map<String, Long>> scopes = new ArrayDeque<>();

    Run(StmtArena arena, Listener listener) {
      this.arena = arena;
      this.listener = listener;
    }

    void run(int body) {
      scopes.push(new HashMap<>(globals));
      scopes.push(new HashMap<>());
      children(body);
    }

    void children(int id) {
      for (int child : arena.children(id)) {
        statement(child);
      }
    }

    void scoped(int id) {
      scopes.push(new HashMap<>());
      try {
        children(id);
      } finally {
        scopes.pop();
      }
    }

    void statement(int id) {
      final Stmt stmt = arena.get(id);
      switch (stmt.op) {
      case FOR:
        loop(id, (Stmt.For) stmt);
        return;

      case BLOCK:
        if (((Stmt.Block) stmt).scoped) {
          scoped(id);
        } else {
          children(id);
        }
        return;

      case CALL:
        call((Stmt.Call) stmt);
        return;

      case ASSIGN:
        final Stmt.Assign assign = (Stmt.Assign) stmt;
        final long value = eval(assign.value);
        set(assign.target,
            assign.accumulate ? lookup(assign.target) + value : value);
        return;

      case DECL:
        final Stmt.Decl decl = (Stmt.Decl) stmt;
        declare(decl.type, decl.name,
            decl.init == null ? 0L : eval(decl.init));
        return;

      case RAW:
        final String text = ((Stmt.Raw) stmt).text;
        if (text.startsWith("#error")) {
          throw new SimulationException(text);
        }
        return;

      case IFDEF:
        final Stmt.IfDef ifDef = (Stmt.IfDef) stmt;
        final List<Integer> branches = arena.children(id);
        final int branch = macros.containsKey(ifDef.macro) == ifDef.defined
            ? 0 : 1;
        if (branch < branches.size()) {
          statement(branches.get(branch));
        }
        return;

      default:
        throw new AssertionError("unknown statement " + stmt.op);
      }
    }

    void loop(int id, Stmt.For loop) {
      final long start = eval(loop.init);
      scopes.push(new HashMap<>());
      try {
        declare(loop.type, loop.var, start);
        listener.onLoopStart(loop.var, start);
        if (loop.pragma != null && loop.pragma.startsWith("omp for")) {
          // iterations are independent; compute them up front
          final List<Long> values = new ArrayList<>();
          while (eval(loop.condition) != 0) {
            check(loop, values.size());
            final long v = lookup(loop.var);
            values.add(v);
            set(loop.var, v + eval(loop.step));
          }
          for (long v : reverseWorkSharing ? Lists.reverse(values) : values) {
            set(loop.var, v);
            scoped(id);
          }
        } else {
          for (long n = 0; eval(loop.condition) != 0; n++) {
            check(loop, n);
            scoped(id);
            set(loop.var, lookup(loop.var) + eval(loop.step));
          }
        }
      } finally {
        scopes.pop();
      }
    }

    void check(Stmt.For loop, long iterations) {
      if (iterations >= MAX_ITERATIONS) {
        throw new SimulationException("loop over " + loop.var
            + " does not terminate");
      }
    }

    void call(Stmt.Call call) {
      if (call.evaluation) {
        final ImmutableList.Builder<Long> args = ImmutableList.builder();
        for (Exp arg : call.args) {
          args.add(eval(arg));
        }
        listener.evaluate(call.name, args.build());
        return;
      }
      if (call.receiver == null && call.name.equals("assert")) {
        if (eval(call.args.get(0)) == 0) {
          throw new SimulationException("assertion failed: "
              + call.args.get(0));
        }
        return;
      }
      if (call.receiver != null && call.name.equals("lock_shared")) {
        listener.onLock(call.receiver, true);
        return;
      }
      if (call.receiver != null && call.name.equals("unlock_shared")) {
        listener.onLock(call.receiver, false);
        return;
      }
      throw new SimulationException("unknown function " + call.name);
    }

    long eval(Exp e) {
      switch (e.op) {
      case ID:
        return lookup(((Exp.Id) e).name);
      case INT_LITERAL:
        return ((Exp.Literal) e).value;
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case LT:
      case GT:
      case ORELSE:
        return infix((Exp.Infix) e);
      case NOT:
        return eval(((Exp.Prefix) e).a) == 0 ? 1 : 0;
      case POST_INCREMENT:
        final String name = ((Exp.PostIncrement) e).id.name;
        final long value = lookup(name);
        set(name, value + 1);
        return value;
      case CONDITIONAL:
        final Exp.Conditional c = (Exp.Conditional) e;
        return eval(c.condition) != 0 ? eval(c.ifTrue) : eval(c.ifFalse);
      case APPLY:
        final Exp.Apply apply = (Exp.Apply) e;
        if (apply.receiver != null
            && apply.name.equals("size")
            && apply.args.isEmpty()) {
          final Long length = sequences.get(apply.receiver);
          if (length == null) {
            throw new SimulationException("unknown sequence "
                + apply.receiver);
          }
          return length;
        }
        throw new SimulationException("unknown function " + apply.name);
      default:
        throw new AssertionError("unknown expression " + e.op);
      }
    }

    long infix(Exp.Infix e) {
      final long a0 = eval(e.a0);
      if (e.op == Op.ORELSE) {
        return a0 != 0 || eval(e.a1) != 0 ? 1 : 0;
      }
      final long a1 = eval(e.a1);
      switch (e.op) {
      case PLUS:
        return a0 + a1;
      case MINUS:
        return a0 - a1;
      case TIMES:
        return a0 * a1;
      case DIVIDE:
        if (a1 == 0) {
          throw new SimulationException("division by zero: " + e);
        }
        return a0 / a1;
      case LT:
        return a0 < a1 ? 1 : 0;
      case GT:
        return a0 > a1 ? 1 : 0;
      default:
        throw new AssertionError("unknown operator " + e.op);
      }
    }

    long lookup(String name) {
      for (Map<String, Long> scope : scopes) {
        final Long value = scope.get(name);
        if (value != null) {
          return value;
        }
      }
      final Long macro = macros.get(name);
      if (macro != null) {
        return macro;
      }
      throw new SimulationException("variable " + name + " is not declared");
    }

    void set(String name, long value) {
      for (Map<String, Long> scope : scopes) {
        if (scope.containsKey(name)) {
          scope.put(name, value);
          return;
        }
      }
      throw new SimulationException("variable " + name + " is not declared");
    }

    void declare(Stmt.VarType type, String name, long value) {
      if (type == Stmt.VarType.EXTERNAL) {
        set(name, value);
        return;
      }
      final Map<String, Long> scope = requireNonNull(scopes.peek());
      if (scope.containsKey(name)) {
        throw new SimulationException("variable " + name
            + " is declared twice in the same scope");
      }
      scope.put(name, value);
    }
  }

  /** Builder for {@link Simulator}. */
  public static class Builder {
    private final Map<String, Long> sequences = new LinkedHashMap<>();
    private final Map<String, @Nullable Long> macros = new LinkedHashMap<>();
    private final Map<String, Long> globals = new LinkedHashMap<>();
    private boolean reverseWorkSharing;

    Builder() {
    }

    /** Declares an input sequence of a given length. */
    public Builder sequence(String name, long length) {
      sequences.put(name, length);
      return this;
    }

    /** Defines a macro without a value. */
    public Builder define(String macro) {
      macros.put(macro, null);
      return this;
    }

    /** Defines a macro with an integer value. */
    public Builder define(String macro, long value) {
      macros.put(macro, value);
      return this;
    }

    /** Declares a global variable, e.g. a saved loop index. */
    public Builder global(String name, long value) {
      globals.put(name, value);
      return this;
    }

    public Builder reverseWorkSharing(boolean reverseWorkSharing) {
      this.reverseWorkSharing = reverseWorkSharing;
      return this;
    }

    public Simulator build() {
      return new Simulator(this);
    }
  }
}

// End Simulator.java
