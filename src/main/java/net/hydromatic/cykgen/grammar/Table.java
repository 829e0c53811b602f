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
 * Shape of a non-terminal's table on one track: which of the track's two
 * running indices are materialized as table dimensions.
 *
 * <p>Yield-size analysis removes an index when its value is fixed; for
 * example, a non-terminal that always extends to the end of the input needs
 * no right index.
 */
public enum Table {
  /** Both indices; a quadratic table. */
  QUADRATIC(true, true),
  /** Left index only; the right index is always the end of the input. */
  LEFT(true, false),
  /** Right index only; the left index is always 0. */
  RIGHT(false, true),
  /** Neither index; a single cell. */
  CONSTANT(false, false);

  private final boolean left;
  private final boolean right;

  Table(boolean left, boolean right) {
    this.left = left;
    this.right = right;
  }

  /** Returns the shape that materializes the given indices. */
  public static Table of(boolean left, boolean right) {
    return left
        ? (right ? QUADRATIC : LEFT)
        : (right ? RIGHT : CONSTANT);
  }

  public boolean hasLeftIndex() {
    return left;
  }

  public boolean hasRightIndex() {
    return right;
  }

  /** Returns the number of materialized indices, 0, 1 or 2. */
  public int indexCount() {
    return (left ? 1 : 0) + (right ? 1 : 0);
  }

  /** Returns whether exactly one of the indices was removed. */
  public boolean isLinear() {
    return indexCount() == 1;
  }
}

// End Table.java
