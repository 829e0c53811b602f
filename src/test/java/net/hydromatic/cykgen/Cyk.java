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
package net.hydromatic.cykgen;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.cykgen.ast.Procedure;
import net.hydromatic.cykgen.ast.StmtArena;
import net.hydromatic.cykgen.compile.CompileException;
import net.hydromatic.cykgen.compile.CykGenerator;
import net.hydromatic.cykgen.compile.Tracer;
import net.hydromatic.cykgen.compile.Tracers;
import net.hydromatic.cykgen.eval.Prop;
import net.hydromatic.cykgen.eval.Simulator;
import net.hydromatic.cykgen.grammar.Grammar;
import net.hydromatic.cykgen.grammar.NonTerminal;
import net.hydromatic.cykgen.grammar.Program;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper for generating and simulating the procedure of a
 * program. */
public class Cyk {
  private final Program program;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  private Cyk(Program program, Map<Prop, Object> propMap, Tracer tracer) {
    this.program = requireNonNull(program);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a fixture for a program. */
  public static Cyk of(Program program) {
    return new Cyk(program, ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a fixture for a program over a single-track grammar "g" with
   * the given non-terminals, the first of which is the axiom. */
  public static Cyk of(NonTerminal... nonTerminals) {
    return of(program(b -> b, nonTerminals));
  }

  /** Creates a program over grammar "g"; the caller may set further
   * properties of the program. */
  public static Program program(UnaryOperator<Program.Builder> transform,
      NonTerminal... nonTerminals) {
    final Grammar.Builder b = Grammar.builder("g");
    for (NonTerminal nt : nonTerminals) {
      b.add(nt);
    }
    return transform.apply(Program.builder(b.build())).build();
  }

  public Program program() {
    return program;
  }

  public Cyk withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new HashMap<>(propMap);
    prop.set(map, value);
    return new Cyk(program, map, tracer);
  }

  public Cyk withTracer(UnaryOperator<Tracer> transform) {
    return new Cyk(program, propMap, transform.apply(tracer));
  }

  /** Generates the procedure. Returns null if the tracer handled a compile
   * exception. */
  private @Nullable Procedure generate(Tracer tracer) {
    return new CykGenerator(propMap, tracer).generate(program);
  }

  public Procedure procedure() {
    return requireNonNull(generate(tracer));
  }

  /** Returns the generated code. */
  public String code() {
    return procedure().unparse(Prop.INDENT.intValue(propMap));
  }

  @CanIgnoreReturnValue
  public Cyk assertCode(Matcher<String> matcher) {
    assertThat(code(), matcher);
    return this;
  }

  /** Asserts that generation fails with a given kind of exception. */
  @CanIgnoreReturnValue
  public Cyk assertCompileException(CompileException.Kind kind,
      Matcher<String> messageMatcher) {
    final List<CompileException> exceptions = new ArrayList<>();
    final Procedure procedure =
        generate(Tracers.withOnCompileException(tracer, exceptions::add));
    if (procedure != null) {
      fail("expected error, got " + procedure);
    }
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0).kind(), is(kind));
    assertThat(exceptions.get(0).getMessage(), messageMatcher);
    return this;
  }

  /** Asserts that generation succeeds with warnings. */
  @CanIgnoreReturnValue
  public Cyk assertWarnings(
      Matcher<? super List<CompileException>> matcher) {
    final List<CompileException> warnings = new ArrayList<>();
    generate(Tracers.withOnWarnings(tracer, warnings::addAll));
    assertThat(warnings, matcher);
    return this;
  }

  /** Returns the ids of a statement and all of its descendants, in
   * pre-order. */
  public static List<Integer> descendants(StmtArena arena, int id) {
    final List<Integer> list = new ArrayList<>();
    list.add(id);
    for (int child : arena.children(id)) {
      list.addAll(descendants(arena, child));
    }
    return list;
  }

  /** Creates a simulator builder whose input sequences have the given
   * lengths, one per track. */
  public Simulator.Builder simulator(long... lengths) {
    assertThat(lengths.length, is(program.sequences.size()));
    final Simulator.Builder b = Simulator.builder();
    for (int t = 0; t < lengths.length; t++) {
      b.sequence(program.sequence(t), lengths[t]);
    }
    return b;
  }

  /** Simulates the single-threaded branch and returns the evaluation
   * calls. */
  public List<String> calls(long... lengths) {
    return simulator(lengths).build().calls(procedure());
  }

  /** Simulates the procedure built by a configured simulator. */
  @CanIgnoreReturnValue
  public Cyk simulate(Simulator.Builder simulator,
      Simulator.Listener listener) {
    simulator.build().run(procedure(), listener);
    return this;
  }
}

// End Cyk.java
