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
package exm.lola.ir;

import java.math.BigInteger;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.lola.ast.SourceSpan;
import exm.lola.common.lang.Builtins;
import exm.lola.common.lang.Operators.BinaryOp;
import exm.lola.common.lang.Operators.UnaryOp;
import exm.lola.common.lang.Rational;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.Unit;

/**
 * Lowered expression.  Stream names are resolved to stream ids and each
 * stream read points at the edge of the stream graph that records it.
 * Every node has an id, unique within one stream graph, under which
 * analysis results such as its type are recorded.
 */
public class Expr {
  public static enum ExprKind {
    CONST, STREAM, BINARY, UNARY, ITE, TUPLE, TUPLE_ACCESS, CALL, DEFAULT,
    /** Stands in for a subexpression whose error was already reported */
    ERROR;
  }

  /**
   * Literal value with its written unit (null if none written)
   */
  public static final class Constant {
    public static enum ConstKind {
      INTEGER, FLOAT, BOOL, STRING;
    }

    private final ConstKind kind;
    private final Object value;
    private final Unit unit;

    private Constant(ConstKind kind, Object value, Unit unit) {
      this.kind = kind;
      this.value = value;
      this.unit = unit;
    }

    public static Constant integer(BigInteger value, Unit unit) {
      return new Constant(ConstKind.INTEGER, value, unit);
    }

    public static Constant decimal(Rational value, Unit unit) {
      return new Constant(ConstKind.FLOAT, value, unit);
    }

    public static Constant bool(boolean value) {
      return new Constant(ConstKind.BOOL, value, null);
    }

    public static Constant string(String value) {
      return new Constant(ConstKind.STRING, value, null);
    }

    public ConstKind kind() {
      return kind;
    }

    public Object value() {
      return value;
    }

    public Unit unit() {
      return unit;
    }

    @Override
    public String toString() {
      String s = kind == ConstKind.STRING ? "\"" + value + "\""
                                          : String.valueOf(value);
      return unit == null ? s : s + unit;
    }
  }

  private final int id;
  private final ExprKind kind;
  private final SourceSpan span;
  private final List<Expr> args;

  private final Constant constant;
  private final int stream;
  private final int reference;
  private final StreamAccess access;
  private final BinaryOp binaryOp;
  private final UnaryOp unaryOp;
  private final Builtins function;
  private final int index;

  private Expr(int id, ExprKind kind, SourceSpan span, List<Expr> args,
      Constant constant, int stream, int reference, StreamAccess access,
      BinaryOp binaryOp, UnaryOp unaryOp, Builtins function, int index) {
    this.id = id;
    this.kind = kind;
    this.span = span;
    this.args = ImmutableList.copyOf(args);
    this.constant = constant;
    this.stream = stream;
    this.reference = reference;
    this.access = access;
    this.binaryOp = binaryOp;
    this.unaryOp = unaryOp;
    this.function = function;
    this.index = index;
  }

  private static Expr node(int id, ExprKind kind, SourceSpan span,
                           List<Expr> args) {
    return new Expr(id, kind, span, args, null, -1, -1, null, null, null,
                    null, -1);
  }

  public static Expr constant(int id, SourceSpan span, Constant c) {
    return new Expr(id, ExprKind.CONST, span, ImmutableList.<Expr>of(), c,
                    -1, -1, null, null, null, null, -1);
  }

  /**
   * Read of a stream
   * @param stream the stream read
   * @param reference id of the graph edge for this read
   */
  public static Expr stream(int id, SourceSpan span, int stream,
                            int reference, StreamAccess access) {
    return new Expr(id, ExprKind.STREAM, span, ImmutableList.<Expr>of(),
                    null, stream, reference, access, null, null, null, -1);
  }

  public static Expr binary(int id, SourceSpan span, BinaryOp op,
                            Expr left, Expr right) {
    return new Expr(id, ExprKind.BINARY, span, ImmutableList.of(left, right),
                    null, -1, -1, null, op, null, null, -1);
  }

  public static Expr unary(int id, SourceSpan span, UnaryOp op,
                           Expr operand) {
    return new Expr(id, ExprKind.UNARY, span, ImmutableList.of(operand),
                    null, -1, -1, null, null, op, null, -1);
  }

  public static Expr ite(int id, SourceSpan span, Expr cond, Expr thenE,
                         Expr elseE) {
    return node(id, ExprKind.ITE, span, ImmutableList.of(cond, thenE, elseE));
  }

  public static Expr tuple(int id, SourceSpan span, List<Expr> elements) {
    return node(id, ExprKind.TUPLE, span, elements);
  }

  public static Expr tupleAccess(int id, SourceSpan span, Expr target,
                                 int index) {
    Preconditions.checkArgument(index >= 0, "negative tuple index");
    return new Expr(id, ExprKind.TUPLE_ACCESS, span, ImmutableList.of(target),
                    null, -1, -1, null, null, null, null, index);
  }

  public static Expr call(int id, SourceSpan span, Builtins function,
                          List<Expr> args) {
    return new Expr(id, ExprKind.CALL, span, args, null, -1, -1, null, null,
                    null, function, -1);
  }

  public static Expr withDefault(int id, SourceSpan span, Expr expr,
                                 Expr dflt) {
    return node(id, ExprKind.DEFAULT, span, ImmutableList.of(expr, dflt));
  }

  public static Expr error(int id, SourceSpan span) {
    return node(id, ExprKind.ERROR, span, ImmutableList.<Expr>of());
  }

  public int id() {
    return id;
  }

  public ExprKind kind() {
    return kind;
  }

  public SourceSpan span() {
    return span;
  }

  public List<Expr> args() {
    return args;
  }

  public Expr arg(int i) {
    return args.get(i);
  }

  /**
   * @return true if this expression contains a placeholder for
   *          something that could not be lowered
   */
  public boolean containsError() {
    if (kind == ExprKind.ERROR) {
      return true;
    }
    for (Expr arg: args) {
      if (arg.containsError()) {
        return true;
      }
    }
    return false;
  }

  public Constant constant() {
    Preconditions.checkState(kind == ExprKind.CONST);
    return constant;
  }

  /**
   * @return id of the stream read
   */
  public int stream() {
    Preconditions.checkState(kind == ExprKind.STREAM);
    return stream;
  }

  public int reference() {
    Preconditions.checkState(kind == ExprKind.STREAM);
    return reference;
  }

  public StreamAccess access() {
    Preconditions.checkState(kind == ExprKind.STREAM);
    return access;
  }

  public BinaryOp binaryOp() {
    Preconditions.checkState(kind == ExprKind.BINARY);
    return binaryOp;
  }

  public UnaryOp unaryOp() {
    Preconditions.checkState(kind == ExprKind.UNARY);
    return unaryOp;
  }

  public Builtins function() {
    Preconditions.checkState(kind == ExprKind.CALL);
    return function;
  }

  public int index() {
    Preconditions.checkState(kind == ExprKind.TUPLE_ACCESS);
    return index;
  }

  @Override
  public String toString() {
    switch (kind) {
      case CONST:
        return constant.toString();
      case STREAM:
        return "#" + stream + "." + access;
      case BINARY:
        return "(" + args.get(0) + " " + binaryOp.symbol() + " " +
                args.get(1) + ")";
      case UNARY:
        return unaryOp.symbol() + args.get(0);
      case ITE:
        return "if " + args.get(0) + " then " + args.get(1) + " else " +
                args.get(2);
      case TUPLE:
        return args.toString();
      case TUPLE_ACCESS:
        return args.get(0) + "." + index;
      case CALL:
        return function.fnName() + args;
      case DEFAULT:
        return args.get(0) + ".defaults(" + args.get(1) + ")";
      case ERROR:
        return "<error>";
      default:
        return kind.name();
    }
  }
}
