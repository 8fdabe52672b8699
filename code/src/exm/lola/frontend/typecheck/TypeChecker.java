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
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Predicates;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import exm.lola.ast.SourceSpan;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.AmbiguousTypeException;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.TypeMismatchException;
import exm.lola.common.exceptions.UnificationException;
import exm.lola.common.exceptions.UnitMismatchException;
import exm.lola.common.exceptions.UserException;
import exm.lola.common.lang.Operators.BinaryOp;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.Types;
import exm.lola.common.lang.Types.NumKind;
import exm.lola.common.lang.Types.Type;
import exm.lola.common.lang.Unit;
import exm.lola.common.util.UnionFind.Var;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;
import exm.lola.frontend.typecheck.TypeUnifier.Checkpoint;
import exm.lola.ir.Expr;

/**
 * Infers the value type of every stream and subexpression.
 *
 * Each expression node gets a type variable, constrained against the
 * variables of its operands by the typing rule of the node.  A node
 * whose rule fails is reported and typed as an error, which unifies with
 * anything, so a mistake is reported once.  Units of products and
 * quotients are solved after all other constraints are in.
 */
public class TypeChecker {
  private static final Logger logger = Logging.getStageLogger("typecheck");

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;
  private final boolean defaultLiterals;

  private final TypeUnifier unifier = new TypeUnifier();
  private final Var[] streamVars;
  private final Map<Integer, Var> exprVars =
      new HashMap<Integer, Var>();
  /** Expressions of each stream, children before parents */
  private final ListMultimap<Integer, Expr> exprsByStream =
      ArrayListMultimap.create();

  private final List<UnitEquation> equations = new ArrayList<UnitEquation>();
  /** Equations of the rule being applied, kept only if it succeeds */
  private final List<UnitEquation> pendingEquations =
      new ArrayList<UnitEquation>();

  /** Streams that already have an ambiguity reported */
  private final Set<Integer> ambiguousReported = new HashSet<Integer>();

  /**
   * Deferred constraint result = left * right or result = left / right on
   * units
   */
  private static class UnitEquation {
    final BinaryOp op;
    final Var result;
    final Var left;
    final Var right;
    final SourceSpan span;
    final int stream;

    UnitEquation(BinaryOp op, Var result, Var left, Var right,
                 SourceSpan span, int stream) {
      this.op = op;
      this.result = result;
      this.left = left;
      this.right = right;
      this.span = span;
      this.stream = stream;
    }
  }

  public TypeChecker(StreamGraph graph, DiagnosticCollector diagnostics,
                     Settings settings) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    this.defaultLiterals = settings.defaultLiteralTypes();
    this.streamVars = new Var[graph.size()];
  }

  /**
   * Set the type of every stream in the graph
   * @return type of each expression node, by node id
   */
  public static Map<Integer, Type> check(StreamGraph graph,
          DiagnosticCollector diagnostics, Settings settings) {
    return new TypeChecker(graph, diagnostics, settings).run();
  }

  public Map<Integer, Type> run() {
    logger.debug("Type checking " + graph.size() + " streams");
    for (Stream s: graph.streams()) {
      if (s.declaredType() != null) {
        streamVars[s.id()] = unifier.fromType(s.declaredType());
      } else if (s.isTrigger()) {
        streamVars[s.id()] = unifier.bool();
      } else {
        streamVars[s.id()] = unifier.fresh();
      }
    }

    // Readers after what they read, so that tuple widths are known
    StreamGraph.SortResult sorted = graph.sortByDependencies(
                              Predicates.<StreamAccess>alwaysTrue());
    List<Integer> order = new ArrayList<Integer>(sorted.order);
    order.addAll(sorted.unsorted);
    for (int id: order) {
      Stream s = graph.stream(id);
      if (s.expr() != null) {
        checkStream(s);
      }
    }

    solveUnitEquations();
    return resolveAll();
  }

  private void checkStream(Stream s) {
    Var exprVar = checkExpr(s, s.expr());
    Var streamVar = streamVars[s.id()];
    try {
      unifier.unify(streamVar, exprVar);
    } catch (UnificationException e) {
      UserException err;
      if (e.getLeft() instanceof Unit) {
        err = new UnitMismatchException(s.expr().span(), "stream " +
            s.name() + " has unit " + e.getLeft() + " but its expression " +
            "has unit " + e.getRight());
      } else if (s.isTrigger()) {
        err = new TypeMismatchException(s.expr().span(),
              "trigger condition must be Bool but has type " +
              unifier.describe(exprVar));
      } else if (s.declaredType() != null) {
        err = new TypeMismatchException(s.expr().span(), "stream " +
            s.name() + " is declared as " + s.declaredType() +
            " but its expression has type " + unifier.describe(exprVar));
      } else {
        err = new TypeMismatchException(s.expr().span(), "stream " +
            s.name() + " would have a recursive type " +
            unifier.describe(exprVar));
      }
      diagnostics.error(err, s.id());
      if (s.declaredType() == null && !s.isTrigger()) {
        streamVars[s.id()] = unifier.error();
      }
    }
  }

  private Var checkExpr(Stream s, Expr e) {
    List<Var> args = new ArrayList<Var>(e.args().size());
    for (Expr arg: e.args()) {
      args.add(checkExpr(s, arg));
    }

    Checkpoint cp = unifier.checkpoint();
    pendingEquations.clear();
    Var result;
    try {
      result = applyRule(s, e, args);
      unifier.commit(cp);
      equations.addAll(pendingEquations);
    } catch (UserException ex) {
      unifier.rollback(cp);
      if (ex instanceof AmbiguousTypeException) {
        ambiguousReported.add(s.id());
      }
      diagnostics.error(ex, s.id());
      result = unifier.error();
    }
    pendingEquations.clear();

    exprVars.put(e.id(), result);
    exprsByStream.put(s.id(), e);
    return result;
  }

  private Var applyRule(Stream s, Expr e, List<Var> args)
      throws UserException {
    SourceSpan span = e.span();
    switch (e.kind()) {
      case CONST:
        return constant(e.constant());
      case STREAM:
        return streamRead(e);
      case BINARY:
        return binary(s, e, args.get(0), args.get(1));
      case UNARY: {
        Var a = args.get(0);
        switch (e.unaryOp()) {
          case NOT:
            expect(a, unifier.bool(), span, "operand of !");
            return a;
          case NEG:
            expect(a, unifier.numeric(NumKind.signed(), null), span,
                   "operand of unary -");
            return a;
          default:
            throw new LolaRuntimeError("Unknown operator " + e.unaryOp());
        }
      }
      case ITE:
        expect(args.get(0), unifier.bool(), e.arg(0).span(),
               "if condition");
        expect(args.get(2), args.get(1), span, "else branch");
        return args.get(1);
      case TUPLE:
        return unifier.tuple(args);
      case TUPLE_ACCESS:
        return tupleAccess(e, args.get(0));
      case CALL:
        expect(args.get(0), unifier.numeric(e.function().argKinds(), null),
               span, "argument of " + e.function().fnName());
        return args.get(0);
      case DEFAULT:
        expect(args.get(0), unifier.option(args.get(1)), span,
               "value with default");
        return args.get(1);
      case ERROR:
        return unifier.error();
      default:
        throw new LolaRuntimeError("Unknown expression kind " + e.kind());
    }
  }

  private Var constant(Expr.Constant c) {
    switch (c.kind()) {
      case INTEGER:
        return unifier.numeric(NumKind.all(), c.unit());
      case FLOAT:
        return unifier.numeric(NumKind.floats(), c.unit());
      case BOOL:
        return unifier.bool();
      case STRING:
        return unifier.string();
      default:
        throw new LolaRuntimeError("Unknown constant kind " + c.kind());
    }
  }

  private Var streamRead(Expr e) throws UserException {
    Var t = streamVars[e.stream()];
    StreamAccess access = e.access();
    switch (access.kind()) {
      case CURRENT:
        return t;
      case LOOKBACK:
      case LOOKAHEAD:
      case HOLD:
        return unifier.option(t);
      case WINDOW:
        break;
      default:
        throw new LolaRuntimeError("Unknown access " + access);
    }

    String what = access.windowOp().opName() + " window over " +
                  graph.name(e.stream());
    switch (access.windowOp()) {
      case COUNT:
        return unifier.fromType(Types.UINT64);
      case SUM:
        expect(t, unifier.numeric(NumKind.all(), null), e.span(), what);
        return t;
      case PRODUCT:
        expect(t, unifier.numeric(NumKind.all(), Unit.DIMENSIONLESS),
               e.span(), what);
        return t;
      case AVERAGE:
        expect(t, unifier.numeric(NumKind.all(), null), e.span(), what);
        return unifier.option(t);
      case INTEGRAL: {
        Var unit = unifier.unitVar(null);
        expect(t, unifier.numeric(unifier.kindVar(NumKind.all()), unit),
               e.span(), what);
        Var resultUnit = unifier.unitVar(null);
        pendingEquations.add(new UnitEquation(BinaryOp.MUL, resultUnit, unit,
            unifier.unitVar(Unit.SECOND), e.span(), e.stream()));
        return unifier.numeric(unifier.kindVar(EnumSet.of(NumKind.FLOAT64)),
                               resultUnit);
      }
      default:
        throw new LolaRuntimeError("Unknown window operation " +
                                   access.windowOp());
    }
  }

  private Var binary(Stream s, Expr e, Var left, Var right)
      throws UserException {
    BinaryOp op = e.binaryOp();
    SourceSpan span = e.span();
    String what = "operands of " + op.symbol();
    switch (op.category()) {
      case ADDITIVE:
        expect(right, left, span, what);
        expect(left, unifier.numeric(NumKind.all(), null), span, what);
        return left;
      case MULTIPLICATIVE: {
        Var kind = unifier.kindVar(NumKind.all());
        Var lu = unifier.unitVar(null);
        Var ru = unifier.unitVar(null);
        Var resultUnit = unifier.unitVar(null);
        expect(left, unifier.numeric(kind, lu), span, what);
        expect(right, unifier.numeric(kind, ru), span, what);
        pendingEquations.add(new UnitEquation(op, resultUnit, lu, ru, span,
                                              s.id()));
        return unifier.numeric(kind, resultUnit);
      }
      case REMAINDER:
        expect(right, left, span, what);
        expect(left, unifier.numeric(NumKind.integers(), null), span, what);
        return left;
      case POWER:
        expect(left, unifier.numeric(NumKind.all(), Unit.DIMENSIONLESS),
               span, what);
        expect(right, left, span, what);
        return left;
      case LOGICAL:
        expect(left, unifier.bool(), span, what);
        expect(right, unifier.bool(), span, what);
        return unifier.bool();
      case EQUALITY:
        expect(right, left, span, what);
        return unifier.bool();
      case ORDERING:
        expect(right, left, span, what);
        expect(left, unifier.numeric(NumKind.all(), null), span, what);
        return unifier.bool();
      default:
        throw new LolaRuntimeError("Unknown operator " + op);
    }
  }

  private Var tupleAccess(Expr e, Var target) throws UserException {
    TypeTerm t = unifier.lookup(target);
    if (t == null) {
      throw new AmbiguousTypeException(e.span(), "cannot infer the tuple " +
                                       "type of " + e.arg(0));
    } else if (t.kind() == TypeTerm.TermKind.ERROR) {
      return unifier.error();
    } else if (t.kind() != TypeTerm.TermKind.TUPLE) {
      throw TypeMismatchException.expected(e.span(), "a tuple",
                                           unifier.describe(t));
    }
    List<Var> fields = ((TypeTerm.Tuple) t).fields();
    if (e.index() >= fields.size()) {
      throw new TypeMismatchException(e.span(), "tuple " +
          unifier.describe(t) + " has no field " + e.index());
    }
    return fields.get(e.index());
  }

  /**
   * Unify actual with expected, describing a failure in terms of what
   */
  private void expect(Var actual, Var expected, SourceSpan span,
                      String what) throws UserException {
    try {
      unifier.unify(actual, expected);
    } catch (UnificationException e) {
      if (e.getLeft() instanceof Unit) {
        throw new UnitMismatchException(span, "unit mismatch in " + what +
                                  ": " + e.getLeft() + " and " + e.getRight());
      } else if (e.getLeft() instanceof Var) {
        throw new TypeMismatchException(span, "recursive type in " + what +
                                        ": " + unifier.describe(actual));
      }
      throw new TypeMismatchException(span, "type mismatch in " + what +
          ": expected " + unifier.describe(expected) + " but found " +
          unifier.describe(actual));
    }
  }

  /**
   * Solve the deferred unit equations.  When none can make progress, the
   * earliest created unknown operand unit is taken to be dimensionless.
   */
  private void solveUnitEquations() {
    List<UnitEquation> pending = new ArrayList<UnitEquation>(equations);
    while (!pending.isEmpty()) {
      boolean progress = false;
      Iterator<UnitEquation> it = pending.iterator();
      while (it.hasNext()) {
        UnitEquation eq = it.next();
        if (solve(eq)) {
          it.remove();
          progress = true;
        }
      }
      if (!progress) {
        Var lowest = null;
        for (UnitEquation eq: pending) {
          for (Var v: new Var[] {eq.left, eq.right}) {
            if (unifier.unitOf(v) == null &&
                (lowest == null || v.id() < lowest.id())) {
              lowest = v;
            }
          }
        }
        if (lowest == null) {
          throw new LolaRuntimeError("Unit equations stuck with all " +
                                     "operands known");
        }
        logger.trace("defaulting unit " + lowest + " to dimensionless");
        bindUnit(lowest, Unit.DIMENSIONLESS, pending.get(0));
      }
    }
  }

  /**
   * @return true if the equation is settled
   */
  private boolean solve(UnitEquation eq) {
    Unit r = unifier.unitOf(eq.result);
    Unit l = unifier.unitOf(eq.left);
    Unit rt = unifier.unitOf(eq.right);
    boolean mul = eq.op == BinaryOp.MUL;
    if (l != null && rt != null) {
      Unit expected = mul ? l.multiply(rt) : l.divide(rt);
      if (r == null) {
        bindUnit(eq.result, expected, eq);
      } else if (!r.equals(expected)) {
        diagnostics.error(new UnitMismatchException(eq.span, "result unit " +
            r + " does not match " + expected), eq.stream);
      }
      return true;
    } else if (r != null && l != null) {
      bindUnit(eq.right, mul ? r.divide(l) : l.divide(r), eq);
      return true;
    } else if (r != null && rt != null) {
      bindUnit(eq.left, mul ? r.divide(rt) : r.multiply(rt), eq);
      return true;
    }
    return false;
  }

  private void bindUnit(Var v, Unit unit, UnitEquation eq) {
    try {
      unifier.bindUnit(v, unit);
    } catch (UnificationException e) {
      diagnostics.error(new UnitMismatchException(eq.span, "unit " +
          e.getLeft() + " does not match " + e.getRight()), eq.stream);
    }
  }

  private Map<Integer, Type> resolveAll() {
    ImmutableMap.Builder<Integer, Type> exprTypes = ImmutableMap.builder();
    for (Stream s: graph.streams()) {
      Type t = unifier.resolve(streamVars[s.id()], defaultLiterals);
      if (t == null) {
        reportAmbiguous(s, s.span(), "cannot infer the type of stream " +
                        s.name());
        t = Types.ERROR;
      }
      s.setType(t);
      if (logger.isTraceEnabled()) {
        logger.trace(s.name() + ": " + t);
      }

      for (Expr e: exprsByStream.get(s.id())) {
        Type et = unifier.resolve(exprVars.get(e.id()), defaultLiterals);
        if (et == null) {
          reportAmbiguous(s, e.span(), "cannot infer the type of " + e);
          et = Types.ERROR;
        }
        exprTypes.put(e.id(), et);
      }
    }
    logger.debug("Type checking done");
    return exprTypes.build();
  }

  private void reportAmbiguous(Stream s, SourceSpan span, String msg) {
    if (ambiguousReported.add(s.id())) {
      diagnostics.error(new AmbiguousTypeException(span, msg), s.id());
    }
  }
}
