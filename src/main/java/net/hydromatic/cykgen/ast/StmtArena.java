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
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Arena of statement nodes.
 *
 * <p>Each node is addressed by a stable {@code int} id, holds an immutable
 * {@link Stmt} payload, and records its parent as an id ({@link #NONE} if
 * the node is detached). Nodes whose kind has children (loops, blocks,
 * preprocessor conditionals) own an ordered list of child ids.
 *
 * <p>Nodes are never freed; a detached subtree simply becomes unreachable
 * from the root of the procedure being generated.
 */
public class StmtArena {
  /** Parent id of a node that is not attached to any parent. */
  public static final int NONE = -1;

  private final List<Stmt> payloads = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final List<@Nullable List<Integer>> children = new ArrayList<>();

  /** Adds a detached node and returns its id. */
  public int add(Stmt stmt) {
    final int id = payloads.size();
    payloads.add(requireNonNull(stmt));
    parents.add(NONE);
    children.add(stmt.hasChildren() ? new ArrayList<>() : null);
    return id;
  }

  /** Adds a node as the last child of {@code parent} and returns its id. */
  public int add(int parent, Stmt stmt) {
    final int id = add(stmt);
    append(parent, id);
    return id;
  }

  /** Returns the number of nodes ever added. */
  public int size() {
    return payloads.size();
  }

  /** Returns the payload of a node. */
  public Stmt get(int id) {
    checkElementIndex(id, payloads.size());
    return payloads.get(id);
  }

  /** Returns the payload of a node, cast to the expected kind. */
  public <S extends Stmt> S get(int id, Class<S> stmtClass) {
    return stmtClass.cast(get(id));
  }

  /** Returns the kind of a node. */
  public Op op(int id) {
    return get(id).op;
  }

  /** Replaces the payload of a node with one of the same kind. */
  public void set(int id, Stmt stmt) {
    checkArgument(get(id).op == stmt.op, "cannot change %s into %s",
        get(id).op, stmt.op);
    payloads.set(id, stmt);
  }

  /** Returns the id of the parent of a node, or {@link #NONE}. */
  public int parent(int id) {
    checkElementIndex(id, parents.size());
    return parents.get(id);
  }

  /** Returns the ids of the children of a node, in order. The list is a
   * read-only view; copy it before modifying the node's children. */
  public List<Integer> children(int id) {
    final List<Integer> list = children.get(id);
    return list == null
        ? ImmutableList.of()
        : Collections.unmodifiableList(list);
  }

  private List<Integer> mutableChildren(int id) {
    checkElementIndex(id, payloads.size());
    final List<Integer> list = children.get(id);
    checkArgument(list != null, "%s node cannot have children", op(id));
    return list;
  }

  /** Appends a detached node to the children of {@code parent}. */
  public void append(int parent, int child) {
    insert(parent, mutableChildren(parent).size(), child);
  }

  /** Appends detached nodes to the children of {@code parent}. */
  public void appendAll(int parent, Iterable<Integer> ids) {
    for (int id : ids) {
      append(parent, id);
    }
  }

  /** Inserts a detached node among the children of {@code parent}. */
  public void insert(int parent, int index, int child) {
    final List<Integer> list = mutableChildren(parent);
    checkArgument(parent(child) == NONE, "node %s is already attached", child);
    checkArgument(!isAncestor(child, parent),
        "node %s is an ancestor of %s", child, parent);
    list.add(index, child);
    parents.set(child, parent);
  }

  /** Removes a node from its parent's children. Does nothing if the node
   * is already detached. */
  public void detach(int id) {
    final int parent = parent(id);
    if (parent == NONE) {
      return;
    }
    mutableChildren(parent).remove(Integer.valueOf(id));
    parents.set(id, NONE);
  }

  /** Returns whether {@code ancestor} is {@code id} or one of its
   * ancestors. */
  public boolean isAncestor(int ancestor, int id) {
    for (int i = id; i != NONE; i = parent(i)) {
      if (i == ancestor) {
        return true;
      }
    }
    return false;
  }

  /** Makes a deep copy of a subtree; returns the id of the new, detached,
   * root. Payloads are immutable and are shared with the original. */
  public int copy(int id) {
    final int root = add(get(id));
    for (int child : children(id)) {
      append(root, copy(child));
    }
    return root;
  }

  /** Makes deep copies of several subtrees. */
  public List<Integer> copyAll(List<Integer> ids) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int id : ids) {
      b.add(copy(id));
    }
    return b.build();
  }

  /** Converts a subtree to C++ text. */
  public String unparse(int id) {
    return new CodeWriter().statement(this, id).toString();
  }
}

// End StmtArena.java
