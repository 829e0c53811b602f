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
package net.hydromatic.cykgen.grammar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cykgen.ast.ExpBuilder.exp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cykgen.ast.Exp;
import net.hydromatic.cykgen.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Grammar after semantic analysis.
 *
 * <p>Holds the facts that code generation consumes: the non-terminals with
 * their table shapes, the topological order in which non-terminals must be
 * evaluated for one cell, and the names of the running indices of each
 * track.
 */
public class Grammar {
  public final String name;
  public final Pos pos;
  public final NonTerminal axiom;
  public final Map<String, NonTerminal> nonTerminals;
  /** Evaluation order: for every production, the non-terminals on the
   * right-hand side precede the left-hand side. */
  public final List<NonTerminal> topologicalOrder;
  public final List<String> leftRunningIndices;
  public final List<String> rightRunningIndices;

  Grammar(String name, Pos pos, NonTerminal axiom,
      ImmutableMap<String, NonTerminal> nonTerminals,
      ImmutableList<NonTerminal> topologicalOrder,
      ImmutableList<String> leftRunningIndices,
      ImmutableList<String> rightRunningIndices) {
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
    this.axiom = requireNonNull(axiom);
    this.nonTerminals = requireNonNull(nonTerminals);
    this.topologicalOrder = requireNonNull(topologicalOrder);
    this.leftRunningIndices = requireNonNull(leftRunningIndices);
    this.rightRunningIndices = requireNonNull(rightRunningIndices);
    checkArgument(leftRunningIndices.size() == axiom.tracks()
        && rightRunningIndices.size() == axiom.tracks());
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns the number of tracks of the axiom. */
  public int tracks() {
    return axiom.tracks();
  }

  /** Returns the name of the left running index of a track, e.g. "t_0_i". */
  public String leftIndex(int track) {
    return leftRunningIndices.get(track);
  }

  /** Returns the name of the right running index of a track, e.g.
   * "t_0_j". */
  public String rightIndex(int track) {
    return rightRunningIndices.get(track);
  }

  /** Returns a reference to the left running index of a track. */
  public Exp.Id leftIndexExp(int track) {
    return exp.id(leftIndex(track));
  }

  /** Returns a reference to the right running index of a track. */
  public Exp.Id rightIndexExp(int track) {
    return exp.id(rightIndex(track));
  }

  /** Returns a non-terminal by name, or null. */
  public @Nullable NonTerminal get(String name) {
    return nonTerminals.get(name);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builder for {@link Grammar}. */
  public static class Builder {
    private final String name;
    private Pos pos = Pos.ZERO;
    private final Map<String, NonTerminal> nonTerminals =
        new LinkedHashMap<>();
    private @Nullable String axiom;
    private @Nullable List<String> order;
    private final Map<Integer, String[]> indexNames = new LinkedHashMap<>();

    Builder(String name) {
      this.name = requireNonNull(name);
    }

    public Builder pos(Pos pos) {
      this.pos = requireNonNull(pos);
      return this;
    }

    /** Adds a non-terminal. The first non-terminal added is the axiom,
     * unless {@link #axiom(String)} says otherwise. */
    public Builder add(NonTerminal nonTerminal) {
      checkArgument(!nonTerminals.containsKey(nonTerminal.name),
          "duplicate non-terminal %s", nonTerminal.name);
      nonTerminals.put(nonTerminal.name, nonTerminal);
      if (axiom == null) {
        axiom = nonTerminal.name;
      }
      return this;
    }

    public Builder axiom(String axiom) {
      this.axiom = requireNonNull(axiom);
      return this;
    }

    /** Sets the topological order. If not called, non-terminals are
     * evaluated in the order they were added. */
    public Builder order(String... names) {
      this.order = Arrays.asList(names);
      return this;
    }

    /** Overrides the names of the running indices of a track. */
    public Builder runningIndices(int track, String left, String right) {
      indexNames.put(track, new String[] {left, right});
      return this;
    }

    public Grammar build() {
      checkState(axiom != null, "grammar %s has no non-terminals", name);
      final NonTerminal axiomNt = nonTerminals.get(axiom);
      checkArgument(axiomNt != null, "unknown axiom %s", axiom);
      final List<NonTerminal> orderList = new ArrayList<>();
      if (order == null) {
        orderList.addAll(nonTerminals.values());
      } else {
        for (String ntName : order) {
          final NonTerminal nt = nonTerminals.get(ntName);
          checkArgument(nt != null, "unknown non-terminal %s in order",
              ntName);
          orderList.add(nt);
        }
      }
      final ImmutableList.Builder<String> lefts = ImmutableList.builder();
      final ImmutableList.Builder<String> rights = ImmutableList.builder();
      for (int t = 0; t < axiomNt.tracks(); t++) {
        final String[] names = indexNames.get(t);
        lefts.add(names != null ? names[0] : "t_" + t + "_i");
        rights.add(names != null ? names[1] : "t_" + t + "_j");
      }
      return new Grammar(name, pos, axiomNt,
          ImmutableMap.copyOf(nonTerminals), ImmutableList.copyOf(orderList),
          lefts.build(), rights.build());
    }
  }
}

// End Grammar.java
