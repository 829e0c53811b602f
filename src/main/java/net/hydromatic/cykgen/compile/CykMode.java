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

/** Traversal mode; selects the shape of loops and of checkpoint guards. */
public enum CykMode {
  /** Inside traversal, single-threaded build. */
  SINGLE_THREAD,
  /** Tile phases of the OpenMP build. */
  PARALLEL,
  /** Cells of the OpenMP build that are not covered by tiles. */
  SERIAL,
  /** Outside traversal, single-threaded build. */
  SINGLE_THREAD_OUTSIDE;

  /** Returns whether this is the outside traversal. */
  public boolean isOutside() {
    return this == SINGLE_THREAD_OUTSIDE;
  }
}

// End CykMode.java
