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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.cykgen.grammar.Grammar;
import net.hydromatic.cykgen.grammar.NonTerminal;
import net.hydromatic.cykgen.grammar.Program;
import net.hydromatic.cykgen.grammar.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that a program is consistent, and that code can be generated for
 * it.
 *
 * <p>Errors are thrown as {@link CompileException}; warnings are passed to
 * a consumer.
 */
class ProgramValidator {
  private final Program program;
  private final boolean parallel;

  ProgramValidator(Program program, boolean parallel) {
    this.program = requireNonNull(program);
    this.parallel = parallel;
  }

  void validate(Consumer<CompileException> warningConsumer) {
    final Grammar grammar = program.grammar;
    if (program.sequences.size() != grammar.tracks()) {
      throw CompileException.internal("grammar " + grammar.name + " has "
          + grammar.tracks() + " tracks but " + program.sequences.size()
          + " input sequences", grammar.pos);
    }
    for (NonTerminal nt : grammar.nonTerminals.values()) {
      if (nt.firstTrack + nt.tracks() > grammar.tracks()) {
        throw CompileException.internal("non-terminal " + nt.name
            + " spans tracks " + nt.firstTrack + " to "
            + (nt.firstTrack + nt.tracks() - 1) + " but grammar "
            + grammar.name + " has " + grammar.tracks() + " tracks", nt.pos);
      }
    }
    checkOrder(grammar);

    final String obstacle = tilingObstacle(program);
    if (parallel && obstacle != null) {
      throw CompileException.unsupported(obstacle, grammar.pos);
    }
    if (program.outside) {
      for (NonTerminal nt : grammar.topologicalOrder) {
        for (Table table : nt.tables) {
          if (nt.tabulated && table.isLinear()) {
            throw CompileException.unsupported("outside traversal of "
                + "non-terminal " + nt.name + ", whose table has been "
                + "reduced to " + table, nt.pos);
          }
        }
      }
      checkOutsideEmptyWord(grammar, warningConsumer);
    }
    checkOutsideNonTerminals(grammar);
  }

  /** Returns why the tiled parallel traversal cannot fill the tables of a
   * program, or null if it can. */
  static @Nullable String tilingObstacle(Program program) {
    final Grammar grammar = program.grammar;
    if (program.outside) {
      return "parallel code for the outside traversal of grammar "
          + grammar.name;
    }
    if (grammar.tracks() != 1) {
      return "parallel code for grammar " + grammar.name + " over "
          + grammar.tracks() + " tracks; only single-track grammars can be "
          + "tiled";
    }
    for (NonTerminal nt : grammar.topologicalOrder) {
      // the serial remainder visits the top row only right of the tiles
      if (nt.tabulated && nt.table(0) == Table.RIGHT) {
        return "parallel code for non-terminal " + nt.name
            + ", whose table has only a right index";
      }
    }
    return null;
  }

  /** Checks that every tabulated non-terminal occurs exactly once in the
   * topological order. */
  private void checkOrder(Grammar grammar) {
    final Set<String> seen = new HashSet<>();
    for (NonTerminal nt : grammar.topologicalOrder) {
      if (!seen.add(nt.name)) {
        throw CompileException.internal("non-terminal " + nt.name
            + " occurs more than once in the topological order", nt.pos);
      }
    }
    for (NonTerminal nt : grammar.nonTerminals.values()) {
      if (nt.tabulated && !seen.contains(nt.name)) {
        throw CompileException.internal("tabulated non-terminal " + nt.name
            + " is missing from the topological order", nt.pos);
      }
    }
  }

  /** Warns if the axiom cannot parse the empty word; outside values are
   * then all empty. */
  private void checkOutsideEmptyWord(Grammar grammar,
      Consumer<CompileException> warningConsumer) {
    for (int minYield : grammar.axiom.minYields) {
      if (minYield > 0) {
        warningConsumer.accept(
            new CompileException(CompileException.Kind.WARNING,
                "The minimal yield size of grammar '" + grammar.name
                    + "' is " + minYield + ", so it cannot parse the empty "
                    + "input; every outside candidate will be empty. Add "
                    + "an alternative such as nil(EMPTY) to the axiom.",
                grammar.pos));
        return;
      }
    }
  }

  /** Checks that the non-terminals whose outside values were requested
   * exist. */
  private void checkOutsideNonTerminals(Grammar grammar) {
    if (program.outsideNonTerminals == null) {
      return;
    }
    final List<String> missing = new ArrayList<>();
    for (String name : program.outsideNonTerminals) {
      if (!name.equals(Program.ALL) && grammar.get(name) == null) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      final StringBuilder b = new StringBuilder()
          .append("outside values requested for non-terminals that do not ")
          .append("exist in grammar '").append(grammar.name).append("':");
      for (String name : missing) {
        b.append(" '").append(name).append("'");
      }
      throw new CompileException(CompileException.Kind.ERROR, b.toString(),
          grammar.pos);
    }
  }
}

// End ProgramValidator.java
