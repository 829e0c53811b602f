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
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Analyzed program from which the table-filling procedure is generated.
 *
 * <p>Besides the grammar, it holds the names of the declared input
 * sequences (one per track), and the flags that select checkpointing and
 * outside generation.
 */
public class Program {
  /** Value in {@link #outsideNonTerminals} that selects every
   * non-terminal. */
  public static final String ALL = "ALL";

  public final Grammar grammar;
  public final List<String> sequences;
  public final Checkpoint checkpoint;
  public final boolean outside;
  /** Whether the program evaluates DP tables at all. */
  public final boolean cyk;
  /** Non-terminals whose outside values are reported, or null. */
  public final @Nullable List<String> outsideNonTerminals;

  Program(Grammar grammar, ImmutableList<String> sequences,
      Checkpoint checkpoint, boolean outside, boolean cyk,
      @Nullable ImmutableList<String> outsideNonTerminals) {
    this.grammar = requireNonNull(grammar);
    this.sequences = requireNonNull(sequences);
    this.checkpoint = requireNonNull(checkpoint);
    this.outside = outside;
    this.cyk = cyk;
    this.outsideNonTerminals = outsideNonTerminals;
  }

  /** Creates a builder for a program over a given grammar. */
  public static Builder builder(Grammar grammar) {
    return new Builder(grammar);
  }

  /** Returns the name of the input sequence of a track, e.g. "t_0_seq". */
  public String sequence(int track) {
    return sequences.get(track);
  }

  /** Returns whether the table-filling procedure is checkpointed. */
  public boolean checkpointCyk() {
    return checkpoint.appliesToCyk();
  }

  /** Builder for {@link Program}. */
  public static class Builder {
    private final Grammar grammar;
    private @Nullable List<String> sequences;
    private Checkpoint checkpoint = Checkpoint.NONE;
    private boolean outside;
    private boolean cyk = true;
    private @Nullable List<String> outsideNonTerminals;

    Builder(Grammar grammar) {
      this.grammar = requireNonNull(grammar);
    }

    /** Sets the names of the declared input sequences. If not called,
     * track {@code k} reads sequence "t_k_seq". */
    public Builder sequences(String... sequences) {
      this.sequences = Arrays.asList(sequences);
      return this;
    }

    public Builder checkpoint(Checkpoint checkpoint) {
      this.checkpoint = requireNonNull(checkpoint);
      return this;
    }

    public Builder outside(boolean outside) {
      this.outside = outside;
      return this;
    }

    public Builder cyk(boolean cyk) {
      this.cyk = cyk;
      return this;
    }

    public Builder outsideNonTerminals(String... names) {
      checkArgument(names.length > 0, "empty list of outside non-terminals");
      this.outsideNonTerminals = Arrays.asList(names);
      return this;
    }

    public Program build() {
      final ImmutableList<String> seqs;
      if (sequences != null) {
        seqs = ImmutableList.copyOf(sequences);
      } else {
        final ImmutableList.Builder<String> b = ImmutableList.builder();
        for (int t = 0; t < grammar.tracks(); t++) {
          b.add("t_" + t + "_seq");
        }
        seqs = b.build();
      }
      return new Program(grammar, seqs, checkpoint, outside, cyk,
          outsideNonTerminals == null
              ? null
              : ImmutableList.copyOf(outsideNonTerminals));
    }
  }
}

// End Program.java
