/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.lola.common.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.UnificationException;

/**
 * Union-find over inference variables, each set optionally bound to a
 * value of a lattice.  Supports speculative updates: changes made after
 * {@link #snapshot()} can be undone with {@link #rollback(Mark)}.
 *
 * Variables are opaque handles; callers never hold values directly, so
 * undoing a binding cannot leave stale state behind.
 *
 * @param <V> the bound values
 */
public class UnionFind<V> {

  /**
   * Defines how two bound values combine.
   */
  public static interface Lattice<V> {
    /**
     * Combine the values of two sets being merged.  May unify variables
     * nested in the values through uf.
     * @return the value of the merged set
     * @throws UnificationException if the values are incompatible
     */
    V merge(UnionFind<V> uf, V left, V right) throws UnificationException;

    /**
     * @return variables nested directly inside value
     */
    Collection<Var> children(V value);
  }

  public static final class Var {
    private final int id;

    private Var(int id) {
      this.id = id;
    }

    public int id() {
      return id;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Var && ((Var) obj).id == id;
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public String toString() {
      return "?" + id;
    }
  }

  /**
   * A point to which the structure can be rolled back
   */
  public static final class Mark {
    private final int depth;
    private final int trailSize;
    private final int numVars;

    private Mark(int depth, int trailSize, int numVars) {
      this.depth = depth;
      this.trailSize = trailSize;
      this.numVars = numVars;
    }

    @Override
    public String toString() {
      return "mark#" + depth;
    }
  }

  /** Old state of one variable, restored on rollback */
  private static final class TrailEntry<V> {
    final int var;
    final int parent;
    final int rank;
    final V value;

    TrailEntry(int var, int parent, int rank, V value) {
      this.var = var;
      this.parent = parent;
      this.rank = rank;
      this.value = value;
    }
  }

  private final Lattice<V> lattice;

  private final List<Integer> parent = new ArrayList<Integer>();
  private final List<Integer> rank = new ArrayList<Integer>();
  private final List<V> values = new ArrayList<V>();

  private final List<TrailEntry<V>> trail = new ArrayList<TrailEntry<V>>();
  private final Deque<Mark> openMarks = new ArrayDeque<Mark>();

  public UnionFind(Lattice<V> lattice) {
    this.lattice = lattice;
  }

  public Var newVar() {
    return newVar(null);
  }

  /**
   * @param value initial binding, or null for none
   */
  public Var newVar(V value) {
    int id = parent.size();
    parent.add(id);
    rank.add(0);
    values.add(value);
    return new Var(id);
  }

  public int numVars() {
    return parent.size();
  }

  /**
   * @return representative of the set containing v
   */
  public Var find(Var v) {
    return new Var(findRoot(checkVar(v)));
  }

  public boolean sameSet(Var a, Var b) {
    return findRoot(checkVar(a)) == findRoot(checkVar(b));
  }

  /**
   * @return current binding of v's set, null if still unbound
   */
  public V lookup(Var v) {
    return values.get(findRoot(checkVar(v)));
  }

  public boolean isBound(Var v) {
    return lookup(v) != null;
  }

  /**
   * Bind the set of v to value, merging with any existing binding.
   * Creates no variable.
   */
  public void unify(Var v, V value) throws UnificationException {
    Preconditions.checkNotNull(value);
    Mark m = snapshot();
    try {
      int root = findRoot(checkVar(v));
      V current = values.get(root);
      if (current == null) {
        checkOccurs(root, value);
        setValue(root, value);
      } else {
        V merged = lattice.merge(this, current, value);
        int newRoot = findRoot(root);
        checkOccurs(newRoot, merged);
        setValue(newRoot, merged);
      }
    } catch (UnificationException e) {
      rollback(m);
      throw e;
    }
    commit(m);
  }

  /**
   * Merge the sets of a and b.  Either succeeds completely or throws,
   * leaving the structure as it was before the call.  Unifying
   * variables that are already in one set has no effect.
   * @throws UnificationException if the bindings conflict or the merge
   *          would create a value that contains itself
   */
  public void unify(Var a, Var b) throws UnificationException {
    Mark m = snapshot();
    try {
      unifyRoots(findRoot(checkVar(a)), findRoot(checkVar(b)));
    } catch (UnificationException e) {
      rollback(m);
      throw e;
    }
    commit(m);
  }

  private void unifyRoots(int ra, int rb) throws UnificationException {
    if (ra == rb) {
      return;
    }
    V va = values.get(ra);
    V vb = values.get(rb);
    if (va == null && vb == null) {
      link(ra, rb, null);
    } else if (va == null) {
      checkOccurs(ra, vb);
      link(ra, rb, vb);
    } else if (vb == null) {
      checkOccurs(rb, va);
      link(ra, rb, va);
    } else {
      // Link first so that recursive unification of children terminates
      int root = link(ra, rb, va);
      V merged = lattice.merge(this, va, vb);
      int newRoot = findRoot(root);
      checkOccurs(newRoot, merged);
      setValue(newRoot, merged);
    }
  }

  /**
   * Union by rank.
   * @return the new root
   */
  private int link(int ra, int rb, V value) {
    int ranka = rank.get(ra);
    int rankb = rank.get(rb);
    int root, child;
    if (ranka < rankb) {
      root = rb;
      child = ra;
    } else {
      root = ra;
      child = rb;
    }
    record(child);
    parent.set(child, root);
    values.set(child, null);
    if (ranka == rankb) {
      record(root);
      rank.set(root, rank.get(root) + 1);
    }
    setValue(root, value);
    return root;
  }

  private void setValue(int root, V value) {
    if (values.get(root) != value) {
      record(root);
      values.set(root, value);
    }
  }

  private int findRoot(int id) {
    int root = id;
    while (parent.get(root) != root) {
      root = parent.get(root);
    }
    // Path compression
    int curr = id;
    while (curr != root) {
      int next = parent.get(curr);
      if (next != root) {
        record(curr);
        parent.set(curr, root);
      }
      curr = next;
    }
    return root;
  }

  /**
   * Fail if binding root to value would make the value contain itself
   */
  private void checkOccurs(int root, V value) throws UnificationException {
    Set<Integer> visited = new HashSet<Integer>();
    if (occurs(root, value, visited)) {
      throw new UnificationException(new Var(root), value,
          "Recursive value: " + new Var(root) + " occurs in " + value);
    }
  }

  private boolean occurs(int root, V value, Set<Integer> visited) {
    if (value == null) {
      return false;
    }
    for (Var child: lattice.children(value)) {
      int childRoot = findRoot(child.id);
      if (childRoot == root) {
        return true;
      }
      if (visited.add(childRoot) &&
          occurs(root, values.get(childRoot), visited)) {
        return true;
      }
    }
    return false;
  }

  private void record(int var) {
    if (!openMarks.isEmpty() && var < openMarks.peek().numVars) {
      trail.add(new TrailEntry<V>(var, parent.get(var), rank.get(var),
                                  values.get(var)));
    }
  }

  private int checkVar(Var v) {
    Preconditions.checkNotNull(v);
    if (v.id >= parent.size()) {
      throw new LolaRuntimeError("Variable " + v + " was discarded by " +
                                 "rollback or belongs to another unifier");
    }
    return v.id;
  }

  /**
   * Begin a speculative region.  Must be closed with either
   * {@link #rollback(Mark)} or {@link #commit(Mark)}.
   */
  public Mark snapshot() {
    Mark m = new Mark(openMarks.size(), trail.size(), parent.size());
    openMarks.push(m);
    return m;
  }

  /**
   * Undo all changes since the mark was taken, including variables
   * created since.  Any marks taken after m are closed too.
   */
  public void rollback(Mark m) {
    checkOpen(m);
    for (int i = trail.size() - 1; i >= m.trailSize; i--) {
      TrailEntry<V> e = trail.remove(i);
      if (e.var < m.numVars) {
        parent.set(e.var, e.parent);
        rank.set(e.var, e.rank);
        values.set(e.var, e.value);
      }
    }
    truncate(m.numVars);
    while (openMarks.peek() != m) {
      openMarks.pop();
    }
    openMarks.pop();
  }

  /**
   * Keep all changes since the mark was taken.  m must be the most
   * recent open mark.
   */
  public void commit(Mark m) {
    checkOpen(m);
    if (openMarks.peek() != m) {
      throw new LolaRuntimeError("Committing " + m + " with nested marks " +
                                 "still open");
    }
    openMarks.pop();
    if (openMarks.isEmpty()) {
      trail.clear();
    }
  }

  private void checkOpen(Mark m) {
    if (!openMarks.contains(m)) {
      throw new LolaRuntimeError(m + " is not open");
    }
  }

  private void truncate(int numVars) {
    while (parent.size() > numVars) {
      int last = parent.size() - 1;
      parent.remove(last);
      rank.remove(last);
      values.remove(last);
    }
  }
}
