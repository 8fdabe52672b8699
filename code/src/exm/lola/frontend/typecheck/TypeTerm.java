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
package exm.lola.frontend.typecheck;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lola.common.util.UnionFind.Var;

/**
 * Partially known type, the value bound to a type variable during
 * inference.  Components are themselves variables, so that they can be
 * refined independently.
 */
public abstract class TypeTerm {
  public static enum TermKind {
    BOOL, STRING, NUMERIC, OPTION, TUPLE, ERROR;
  }

  public static final TypeTerm BOOL = new Simple(TermKind.BOOL);
  public static final TypeTerm STRING = new Simple(TermKind.STRING);
  /** Absorbs anything it is unified with */
  public static final TypeTerm ERROR = new Simple(TermKind.ERROR);

  public abstract TermKind kind();

  public List<Var> children() {
    return ImmutableList.of();
  }

  private static final class Simple extends TypeTerm {
    private final TermKind kind;

    private Simple(TermKind kind) {
      this.kind = kind;
    }

    @Override
    public TermKind kind() {
      return kind;
    }

    @Override
    public String toString() {
      return kind.name();
    }
  }

  /**
   * Number whose representation is drawn from a set of numeric kinds
   * and whose unit is a separate variable
   */
  public static final class Numeric extends TypeTerm {
    final Var kinds;
    final Var unit;

    Numeric(Var kinds, Var unit) {
      this.kinds = kinds;
      this.unit = unit;
    }

    @Override
    public TermKind kind() {
      return TermKind.NUMERIC;
    }

    public Var kinds() {
      return kinds;
    }

    public Var unit() {
      return unit;
    }

    @Override
    public String toString() {
      return "Numeric(" + kinds + ", " + unit + ")";
    }
  }

  public static final class Option extends TypeTerm {
    final Var inner;

    Option(Var inner) {
      this.inner = inner;
    }

    @Override
    public TermKind kind() {
      return TermKind.OPTION;
    }

    public Var inner() {
      return inner;
    }

    @Override
    public List<Var> children() {
      return ImmutableList.of(inner);
    }

    @Override
    public String toString() {
      return "Option(" + inner + ")";
    }
  }

  public static final class Tuple extends TypeTerm {
    final List<Var> fields;

    Tuple(List<Var> fields) {
      this.fields = ImmutableList.copyOf(fields);
    }

    @Override
    public TermKind kind() {
      return TermKind.TUPLE;
    }

    public List<Var> fields() {
      return fields;
    }

    @Override
    public List<Var> children() {
      return fields;
    }

    @Override
    public String toString() {
      return "Tuple" + fields;
    }
  }
}
