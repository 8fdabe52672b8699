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
package exm.lola.common.lang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntFunction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Activation condition of an event-driven stream: a boolean formula over
 * stream ids, kept in minimal disjunctive normal form.  The stream fires
 * when all streams of at least one conjunct have a new value.
 */
public final class Activation {

  private static final Comparator<SortedSet<Integer>> CONJUNCT_ORDER =
      new Comparator<SortedSet<Integer>>() {
        @Override
        public int compare(SortedSet<Integer> a, SortedSet<Integer> b) {
          if (a.size() != b.size()) {
            return Integer.compare(a.size(), b.size());
          }
          Iterator<Integer> ia = a.iterator(), ib = b.iterator();
          while (ia.hasNext()) {
            int c = Integer.compare(ia.next(), ib.next());
            if (c != 0) {
              return c;
            }
          }
          return 0;
        }
      };

  private final ImmutableList<ImmutableSortedSet<Integer>> conjuncts;

  private Activation(ImmutableList<ImmutableSortedSet<Integer>> conjuncts) {
    this.conjuncts = conjuncts;
  }

  public static Activation of(int stream) {
    return new Activation(ImmutableList.of(ImmutableSortedSet.of(stream)));
  }

  public static Activation allOf(Collection<Integer> streams) {
    Preconditions.checkArgument(!streams.isEmpty(), "Empty conjunction");
    return new Activation(ImmutableList.of(ImmutableSortedSet.copyOf(streams)));
  }

  public static Activation anyOf(Collection<Integer> streams) {
    Preconditions.checkArgument(!streams.isEmpty(), "Empty disjunction");
    List<Set<Integer>> conj = new ArrayList<Set<Integer>>();
    for (Integer s: streams) {
      conj.add(ImmutableSortedSet.of(s));
    }
    return normalize(conj);
  }

  public List<ImmutableSortedSet<Integer>> conjuncts() {
    return conjuncts;
  }

  /**
   * @return all streams mentioned anywhere in the condition
   */
  public SortedSet<Integer> streams() {
    TreeSet<Integer> all = new TreeSet<Integer>();
    for (Set<Integer> c: conjuncts) {
      all.addAll(c);
    }
    return all;
  }

  public Activation or(Activation other) {
    List<Set<Integer>> conj = new ArrayList<Set<Integer>>(conjuncts);
    conj.addAll(other.conjuncts);
    return normalize(conj);
  }

  public Activation and(Activation other) {
    List<Set<Integer>> conj = new ArrayList<Set<Integer>>();
    for (Set<Integer> a: conjuncts) {
      for (Set<Integer> b: other.conjuncts) {
        TreeSet<Integer> merged = new TreeSet<Integer>(a);
        merged.addAll(b);
        conj.add(merged);
      }
    }
    return normalize(conj);
  }

  /**
   * Whenever this condition holds, does other hold too?
   * True iff every conjunct here contains some conjunct of other.
   */
  public boolean implies(Activation other) {
    for (Set<Integer> mine: conjuncts) {
      boolean covered = false;
      for (Set<Integer> theirs: other.conjuncts) {
        if (mine.containsAll(theirs)) {
          covered = true;
          break;
        }
      }
      if (!covered) {
        return false;
      }
    }
    return true;
  }

  /**
   * Drop conjuncts that are supersets of other conjuncts (absorption),
   * remove duplicates and sort for a canonical form
   */
  private static Activation normalize(List<? extends Set<Integer>> conj) {
    List<ImmutableSortedSet<Integer>> sorted =
        new ArrayList<ImmutableSortedSet<Integer>>();
    for (Set<Integer> c: conj) {
      sorted.add(ImmutableSortedSet.copyOf(c));
    }
    sorted.sort(CONJUNCT_ORDER);

    List<ImmutableSortedSet<Integer>> minimal =
        new ArrayList<ImmutableSortedSet<Integer>>();
    for (ImmutableSortedSet<Integer> c: sorted) {
      boolean absorbed = false;
      for (ImmutableSortedSet<Integer> kept: minimal) {
        if (c.containsAll(kept)) {
          absorbed = true;
          break;
        }
      }
      if (!absorbed) {
        minimal.add(c);
      }
    }
    return new Activation(ImmutableList.copyOf(minimal));
  }

  public String toString(IntFunction<String> names) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < conjuncts.size(); i++) {
      if (i > 0) {
        sb.append(" | ");
      }
      ImmutableSortedSet<Integer> c = conjuncts.get(i);
      boolean paren = c.size() > 1 && conjuncts.size() > 1;
      if (paren) {
        sb.append('(');
      }
      boolean first = true;
      for (int s: c) {
        if (!first) {
          sb.append(" & ");
        }
        sb.append(names.apply(s));
        first = false;
      }
      if (paren) {
        sb.append(')');
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Activation &&
        conjuncts.equals(((Activation) obj).conjuncts);
  }

  @Override
  public int hashCode() {
    return conjuncts.hashCode();
  }

  @Override
  public String toString() {
    return toString(new IntFunction<String>() {
      @Override
      public String apply(int value) {
        return "#" + value;
      }
    });
  }
}
