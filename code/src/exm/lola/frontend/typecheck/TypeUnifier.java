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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.UnificationException;
import exm.lola.common.lang.Types;
import exm.lola.common.lang.Types.NumKind;
import exm.lola.common.lang.Types.NumericType;
import exm.lola.common.lang.Types.OptionType;
import exm.lola.common.lang.Types.TupleType;
import exm.lola.common.lang.Types.Type;
import exm.lola.common.lang.Unit;
import exm.lola.common.util.UnionFind;
import exm.lola.common.util.UnionFind.Mark;
import exm.lola.common.util.UnionFind.Var;
import exm.lola.frontend.typecheck.TypeTerm.TermKind;

/**
 * Type variables for inference.  Three unifiers work together: one for
 * type structure, one for the set of numeric kinds a number may still
 * take, one for units.  Checkpoints cover all three.
 */
public class TypeUnifier {

  /**
   * Snapshot of all three unifiers
   */
  public static final class Checkpoint {
    private final Mark types;
    private final Mark kinds;
    private final Mark units;

    private Checkpoint(Mark types, Mark kinds, Mark units) {
      this.types = types;
      this.kinds = kinds;
      this.units = units;
    }
  }

  private final UnionFind<TypeTerm> types;
  private final UnionFind<Set<NumKind>> kinds;
  private final UnionFind<Unit> units;

  public TypeUnifier() {
    this.kinds = new UnionFind<Set<NumKind>>(
        new UnionFind.Lattice<Set<NumKind>>() {
      @Override
      public Set<NumKind> merge(UnionFind<Set<NumKind>> uf,
          Set<NumKind> left, Set<NumKind> right) throws UnificationException {
        EnumSet<NumKind> both = EnumSet.noneOf(NumKind.class);
        both.addAll(left);
        both.retainAll(right);
        if (both.isEmpty()) {
          throw new UnificationException(left, right);
        }
        return both;
      }

      @Override
      public Collection<Var> children(Set<NumKind> value) {
        return ImmutableList.of();
      }
    });

    this.units = new UnionFind<Unit>(new UnionFind.Lattice<Unit>() {
      @Override
      public Unit merge(UnionFind<Unit> uf, Unit left, Unit right)
          throws UnificationException {
        if (!left.equals(right)) {
          throw new UnificationException(left, right);
        }
        return left;
      }

      @Override
      public Collection<Var> children(Unit value) {
        return ImmutableList.of();
      }
    });

    this.types = new UnionFind<TypeTerm>(new TermLattice());
  }

  /**
   * Structural merge of type terms
   */
  private class TermLattice implements UnionFind.Lattice<TypeTerm> {
    @Override
    public TypeTerm merge(UnionFind<TypeTerm> uf, TypeTerm left,
                          TypeTerm right) throws UnificationException {
      if (left.kind() == TermKind.ERROR) {
        return left;
      } else if (right.kind() == TermKind.ERROR) {
        return right;
      } else if (left.kind() != right.kind()) {
        throw new UnificationException(left, right);
      }
      switch (left.kind()) {
        case BOOL:
        case STRING:
          return left;
        case NUMERIC: {
          TypeTerm.Numeric l = (TypeTerm.Numeric) left;
          TypeTerm.Numeric r = (TypeTerm.Numeric) right;
          kinds.unify(l.kinds, r.kinds);
          units.unify(l.unit, r.unit);
          return left;
        }
        case OPTION:
          uf.unify(((TypeTerm.Option) left).inner,
                   ((TypeTerm.Option) right).inner);
          return left;
        case TUPLE: {
          List<Var> lf = ((TypeTerm.Tuple) left).fields;
          List<Var> rf = ((TypeTerm.Tuple) right).fields;
          if (lf.size() != rf.size()) {
            throw new UnificationException(left, right);
          }
          for (int i = 0; i < lf.size(); i++) {
            uf.unify(lf.get(i), rf.get(i));
          }
          return left;
        }
        default:
          throw new LolaRuntimeError("Unknown term kind " + left.kind());
      }
    }

    @Override
    public Collection<Var> children(TypeTerm value) {
      return value.children();
    }
  }

  public Var fresh() {
    return types.newVar();
  }

  public Var of(TypeTerm term) {
    return types.newVar(term);
  }

  public Var error() {
    return types.newVar(TypeTerm.ERROR);
  }

  public Var bool() {
    return types.newVar(TypeTerm.BOOL);
  }

  public Var string() {
    return types.newVar(TypeTerm.STRING);
  }

  public Var kindVar(Set<NumKind> allowed) {
    return kinds.newVar(EnumSet.copyOf(allowed));
  }

  /**
   * @param unit fixed unit, or null for a fresh unit variable
   */
  public Var unitVar(Unit unit) {
    return units.newVar(unit);
  }

  public Var numeric(Var kindVar, Var unitVar) {
    return types.newVar(new TypeTerm.Numeric(kindVar, unitVar));
  }

  /**
   * @param unit fixed unit, or null for any unit
   */
  public Var numeric(Set<NumKind> allowed, Unit unit) {
    return numeric(kindVar(allowed), unitVar(unit));
  }

  public Var option(Var inner) {
    return types.newVar(new TypeTerm.Option(inner));
  }

  public Var tuple(List<Var> fields) {
    return types.newVar(new TypeTerm.Tuple(fields));
  }

  /**
   * Variable fixed to a concrete type
   */
  public Var fromType(Type t) {
    switch (t.kind()) {
      case BOOL:
        return bool();
      case STRING:
        return string();
      case ERROR:
        return error();
      case NUMERIC: {
        NumericType nt = (NumericType) t;
        return numeric(EnumSet.of(nt.numKind()), nt.unit());
      }
      case OPTION:
        return option(fromType(((OptionType) t).inner()));
      case TUPLE: {
        List<Var> fields = new ArrayList<Var>();
        for (Type f: ((TupleType) t).fields()) {
          fields.add(fromType(f));
        }
        return tuple(fields);
      }
      default:
        throw new LolaRuntimeError("Unknown type kind " + t.kind());
    }
  }

  public TypeTerm lookup(Var v) {
    return types.lookup(v);
  }

  public Unit unitOf(Var unitVar) {
    return units.lookup(unitVar);
  }

  public Checkpoint checkpoint() {
    return new Checkpoint(types.snapshot(), kinds.snapshot(),
                          units.snapshot());
  }

  public void rollback(Checkpoint cp) {
    units.rollback(cp.units);
    kinds.rollback(cp.kinds);
    types.rollback(cp.types);
  }

  public void commit(Checkpoint cp) {
    units.commit(cp.units);
    kinds.commit(cp.kinds);
    types.commit(cp.types);
  }

  /**
   * Unify two type variables; all or nothing
   */
  public void unify(Var a, Var b) throws UnificationException {
    Checkpoint cp = checkpoint();
    try {
      types.unify(a, b);
    } catch (UnificationException e) {
      rollback(cp);
      throw e;
    }
    commit(cp);
  }

  public void bindUnit(Var unitVar, Unit unit) throws UnificationException {
    units.unify(unitVar, unit);
  }

  /**
   * Concrete type of v, with unbound units taken as dimensionless.
   * @param defaultLiterals if true, a number that may still be several
   *        kinds becomes Int64 or Float64
   * @return null if the type cannot be determined
   */
  public Type resolve(Var v, boolean defaultLiterals) {
    TypeTerm t = types.lookup(v);
    if (t == null) {
      return null;
    }
    switch (t.kind()) {
      case BOOL:
        return Types.BOOL;
      case STRING:
        return Types.STRING;
      case ERROR:
        return Types.ERROR;
      case NUMERIC: {
        TypeTerm.Numeric n = (TypeTerm.Numeric) t;
        NumKind kind = resolveKind(kinds.lookup(n.kinds), defaultLiterals);
        if (kind == null) {
          return null;
        }
        Unit unit = units.lookup(n.unit);
        return Types.numeric(kind, unit == null ? Unit.DIMENSIONLESS : unit);
      }
      case OPTION: {
        Type inner = resolve(((TypeTerm.Option) t).inner, defaultLiterals);
        return inner == null ? null : Types.option(inner);
      }
      case TUPLE: {
        List<Type> fields = new ArrayList<Type>();
        for (Var f: ((TypeTerm.Tuple) t).fields) {
          Type ft = resolve(f, defaultLiterals);
          if (ft == null) {
            return null;
          }
          fields.add(ft);
        }
        return Types.tuple(fields);
      }
      default:
        throw new LolaRuntimeError("Unknown term kind " + t.kind());
    }
  }

  private static NumKind resolveKind(Set<NumKind> allowed,
                                     boolean defaultLiterals) {
    if (allowed.size() == 1) {
      return allowed.iterator().next();
    } else if (!defaultLiterals) {
      return null;
    } else if (allowed.contains(NumKind.INT64)) {
      return NumKind.INT64;
    } else if (allowed.contains(NumKind.FLOAT64)) {
      return NumKind.FLOAT64;
    }
    // Lowest kind of those left
    return allowed.iterator().next();
  }

  /**
   * Human-readable form of what is known about v
   */
  public String describe(Var v) {
    return describe(types.lookup(v));
  }

  public String describe(TypeTerm t) {
    if (t == null) {
      return "unknown";
    }
    switch (t.kind()) {
      case BOOL:
        return "Bool";
      case STRING:
        return "String";
      case ERROR:
        return "<error>";
      case NUMERIC: {
        TypeTerm.Numeric n = (TypeTerm.Numeric) t;
        Set<NumKind> allowed = kinds.lookup(n.kinds);
        String k;
        if (allowed.size() == 1) {
          k = allowed.iterator().next().typeName();
        } else if (allowed.equals(NumKind.all())) {
          k = "numeric";
        } else if (allowed.equals(NumKind.floats())) {
          k = "float";
        } else if (allowed.equals(NumKind.integers())) {
          k = "integer";
        } else {
          k = describeKinds(allowed);
        }
        Unit u = units.lookup(n.unit);
        if (u == null || u.equals(Unit.DIMENSIONLESS)) {
          return k;
        }
        return k + "[" + u + "]";
      }
      case OPTION:
        return "Option<" + describe(((TypeTerm.Option) t).inner) + ">";
      case TUPLE: {
        StringBuilder sb = new StringBuilder("(");
        List<Var> fields = ((TypeTerm.Tuple) t).fields;
        for (int i = 0; i < fields.size(); i++) {
          if (i > 0) {
            sb.append(", ");
          }
          sb.append(describe(fields.get(i)));
        }
        return sb.append(")").toString();
      }
      default:
        return t.toString();
    }
  }

  private static String describeKinds(Set<NumKind> allowed) {
    StringBuilder sb = new StringBuilder("one of {");
    boolean first = true;
    for (NumKind k: allowed) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(k.typeName());
      first = false;
    }
    return sb.append("}").toString();
  }
}
