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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.cykgen.ast.Op;
import net.hydromatic.cykgen.ast.Stmt;
import net.hydromatic.cykgen.ast.StmtArena;

/**
 * A loop over a running index, and the declaration of the value that the
 * index has for cells that the loop does not visit.
 *
 * <p>Both nodes live, detached, in the same {@link StmtArena}. The caller
 * attaches the boundary declaration after the loop, so that statements
 * that follow (the top row, the last column) see a consistent index.
 */
public class LoopPair {
  public final int loop;
  public final int boundary;

  LoopPair(StmtArena arena, int loop, int boundary) {
    this.loop = loop;
    this.boundary = boundary;
    checkArgument(arena.op(loop) == Op.FOR);
    checkArgument(arena.get(loop, Stmt.For.class).var
        .equals(arena.get(boundary, Stmt.Decl.class).name),
        "loop and boundary must declare the same variable");
  }

  @Override public String toString() {
    return "LoopPair{loop=" + loop + ", boundary=" + boundary + "}";
  }
}

// End LoopPair.java
