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
package net.hydromatic.cykgen.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;

/**
 * Generated procedure: a name and a body of statements.
 *
 * <p>The body is an unscoped {@link Stmt.Block} in {@link #arena}.
 */
public class Procedure {
  public final String name;
  public final StmtArena arena;
  public final int body;

  public Procedure(String name, StmtArena arena, int body) {
    this.name = requireNonNull(name);
    this.arena = requireNonNull(arena);
    this.body = body;
    checkArgument(arena.op(body) == Op.BLOCK, "body must be a block");
  }

  /** Returns the ids of the top-level statements of the body. */
  public List<Integer> statements() {
    return arena.children(body);
  }

  /** Returns whether the body is empty. */
  public boolean isEmpty() {
    return statements().isEmpty();
  }

  /** Converts this procedure to C++ text. */
  public String unparse(int indentWidth) {
    return new CodeWriter(indentWidth).procedure(name, arena, body)
        .toString();
  }

  @Override
  public String toString() {
    return unparse(2);
  }
}

// End Procedure.java
