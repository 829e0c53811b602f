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

/**
 * Checkpoint configuration of a program.
 *
 * <p>If a program is checkpointed, the generated code periodically saves
 * the running indices of its loops, and a run started with
 * {@code load_checkpoint} set resumes from the saved indices.
 */
public class Checkpoint {
  /** Checkpointing disabled. */
  public static final Checkpoint NONE = new Checkpoint(false, false);

  public final boolean enabled;
  /** Whether the table-filling procedure is checkpointed, as opposed to
   * only the back-trace. */
  public final boolean cyk;

  private Checkpoint(boolean enabled, boolean cyk) {
    this.enabled = enabled;
    this.cyk = cyk;
  }

  /** Returns an enabled checkpoint configuration. */
  public static Checkpoint of(boolean cyk) {
    return new Checkpoint(true, cyk);
  }

  /** Returns whether checkpointing affects the table-filling procedure. */
  public boolean appliesToCyk() {
    return enabled && cyk;
  }

  @Override
  public String toString() {
    return enabled ? "Checkpoint{cyk=" + cyk + "}" : "Checkpoint{none}";
  }
}

// End Checkpoint.java
