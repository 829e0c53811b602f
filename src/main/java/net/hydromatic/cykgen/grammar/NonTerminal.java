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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.cykgen.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Non-terminal of an analyzed grammar.
 *
 * <p>A non-terminal spans {@link #tracks()} consecutive tracks of the
 * grammar, starting at {@link #firstTrack}, and has one {@link Table} shape
 * per track.
 */
public class NonTerminal {
  /** Prefix of the name of the routine that fills a table cell. */
  public static final String ROUTINE_PREFIX = "nt_tabulate_";

  public final String name;
  public final Pos pos;
  public final int firstTrack;
  public final List<Table> tables;
  public final boolean tabulated;
  public final String routine;
  public final List<Integer> minYields;

  NonTerminal(String name, Pos pos, int firstTrack,
      ImmutableList<Table> tables, boolean tabulated, String routine,
      ImmutableList<Integer> minYields) {
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
    this.firstTrack = firstTrack;
    this.tables = requireNonNull(tables);
    this.tabulated = tabulated;
    this.routine = requireNonNull(routine);
    this.minYields = requireNonNull(minYields);
    checkArgument(firstTrack >= 0, "negative track %s", firstTrack);
    checkArgument(!tables.isEmpty(), "non-terminal %s has no tracks", name);
    checkArgument(minYields.size() == tables.size(),
        "non-terminal %s has %s tracks but %s yield sizes", name,
        tables.size(), minYields.size());
  }

  /** Creates a tabulated non-terminal with the default routine name and
   * minimal yield size 0 on every track. */
  public static NonTerminal of(String name, Table... tables) {
    return builder(name).tables(tables).build();
  }

  /** Creates a builder for a non-terminal. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns the number of tracks. */
  public int tracks() {
    return tables.size();
  }

  /** Returns the table shape on track {@code t}, relative to
   * {@link #firstTrack}. */
  public Table table(int t) {
    return tables.get(t);
  }

  /** Returns the number of materialized indices over all tracks. */
  public int indexCount() {
    int n = 0;
    for (Table table : tables) {
      n += table.indexCount();
    }
    return n;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builder for {@link NonTerminal}. */
  public static class Builder {
    private final String name;
    private Pos pos = Pos.ZERO;
    private int firstTrack = 0;
    private ImmutableList<Table> tables = ImmutableList.of(Table.QUADRATIC);
    private boolean tabulated = true;
    private String routine;
    private @Nullable ImmutableList<Integer> minYields;

    Builder(String name) {
      this.name = requireNonNull(name);
      this.routine = ROUTINE_PREFIX + name;
    }

    public Builder pos(Pos pos) {
      this.pos = requireNonNull(pos);
      return this;
    }

    public Builder firstTrack(int firstTrack) {
      this.firstTrack = firstTrack;
      return this;
    }

    public Builder tables(Table... tables) {
      this.tables = ImmutableList.copyOf(tables);
      return this;
    }

    public Builder tabulated(boolean tabulated) {
      this.tabulated = tabulated;
      return this;
    }

    public Builder routine(String routine) {
      this.routine = requireNonNull(routine);
      return this;
    }

    public Builder minYields(Integer... minYields) {
      this.minYields = ImmutableList.copyOf(minYields);
      return this;
    }

    public NonTerminal build() {
      final ImmutableList<Integer> yields = minYields != null
          ? minYields
          : ImmutableList.copyOf(Collections.nCopies(tables.size(), 0));
      return new NonTerminal(name, pos, firstTrack, tables, tabulated,
          routine, yields);
    }
  }
}

// End NonTerminal.java
