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
package exm.lola.frontend;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.lola.ast.ActivationExpr;
import exm.lola.ast.BinaryExpr;
import exm.lola.ast.CallExpr;
import exm.lola.ast.Declaration;
import exm.lola.ast.Declaration.DeclKind;
import exm.lola.ast.DefaultExpr;
import exm.lola.ast.Expression;
import exm.lola.ast.InputDeclaration;
import exm.lola.ast.IteExpr;
import exm.lola.ast.LiteralExpr;
import exm.lola.ast.LolaSpec;
import exm.lola.ast.OutputDeclaration;
import exm.lola.ast.PacingAnnotation;
import exm.lola.ast.SourceSpan;
import exm.lola.ast.StreamExpr;
import exm.lola.ast.TriggerDeclaration;
import exm.lola.ast.TupleAccessExpr;
import exm.lola.ast.TupleExpr;
import exm.lola.ast.TypeAnnotation;
import exm.lola.ast.UnaryExpr;
import exm.lola.ast.WindowExpr;
import exm.lola.common.Logging;
import exm.lola.common.exceptions.DuplicateDeclarationException;
import exm.lola.common.exceptions.InvalidLiteralException;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.TypeMismatchException;
import exm.lola.common.exceptions.UndeclaredFunctionException;
import exm.lola.common.exceptions.UndeclaredStreamException;
import exm.lola.common.exceptions.UnitMismatchException;
import exm.lola.common.exceptions.UnknownTypeException;
import exm.lola.common.exceptions.UserException;
import exm.lola.common.lang.Activation;
import exm.lola.common.lang.Builtins;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Quantity;
import exm.lola.common.lang.Rational;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.Types;
import exm.lola.common.lang.Types.NumKind;
import exm.lola.common.lang.Types.Type;
import exm.lola.common.lang.Unit;
import exm.lola.common.lang.WindowOperation;
import exm.lola.frontend.Stream.StreamKind;
import exm.lola.ir.Expr;
import exm.lola.ir.Expr.Constant;

/**
 * Resolves names in the parsed specification and builds the stream
 * graph: one node per declaration, one edge per stream read.
 *
 * Problems are reported to the collector and lowering carries on: a
 * duplicate declaration is dropped, an unresolvable subexpression
 * becomes an error placeholder.
 */
public class Lowering {
  private static final Logger logger = Logging.getStageLogger("lowering");

  private final DiagnosticCollector diagnostics;
  private final StreamGraph graph = new StreamGraph();

  /** Declarations that become streams, in order; index is the stream id */
  private final List<Declaration> kept = new ArrayList<Declaration>();
  private final Map<String, Integer> ids = new HashMap<String, Integer>();

  private int nextExprId = 0;

  public Lowering(DiagnosticCollector diagnostics) {
    this.diagnostics = diagnostics;
  }

  public static StreamGraph lower(LolaSpec spec,
                                  DiagnosticCollector diagnostics) {
    return new Lowering(diagnostics).run(spec);
  }

  public StreamGraph run(LolaSpec spec) {
    logger.debug("Lowering " + spec.getDeclarations().size() +
                 " declarations");
    declareNames(spec);
    for (Declaration decl: kept) {
      createStream(decl);
    }
    for (int id = 0; id < kept.size(); id++) {
      lowerDefinition(id, kept.get(id));
    }
    graph.finishStructure();
    logger.debug("Stream graph has " + graph.size() + " streams and " +
                 graph.references().size() + " references");
    return graph;
  }

  /**
   * Assign ids in declaration order, dropping duplicates
   */
  private void declareNames(LolaSpec spec) {
    Map<String, SourceSpan> seen = new HashMap<String, SourceSpan>();
    for (Declaration decl: spec.getDeclarations()) {
      String name = decl.getName();
      if (name != null) {
        SourceSpan prev = seen.get(name);
        if (prev != null) {
          diagnostics.error(new DuplicateDeclarationException(decl.getSpan(),
                                                        name, prev),
                            ids.get(name));
          continue;
        }
        seen.put(name, decl.getSpan());
        ids.put(name, kept.size());
      }
      kept.add(decl);
    }
  }

  private void createStream(Declaration decl) {
    int id = graph.size();
    Type declaredType = null;
    TypeAnnotation typeAnn = null;
    String message = null;
    StreamKind kind;
    switch (decl.getKind()) {
      case INPUT:
        kind = StreamKind.INPUT;
        typeAnn = ((InputDeclaration) decl).getType();
        break;
      case OUTPUT:
        kind = StreamKind.OUTPUT;
        typeAnn = ((OutputDeclaration) decl).getType();
        break;
      case TRIGGER:
        kind = StreamKind.TRIGGER;
        message = ((TriggerDeclaration) decl).getMessage();
        break;
      default:
        throw new LolaRuntimeError("Unknown declaration kind " +
                                   decl.getKind());
    }

    if (typeAnn != null) {
      try {
        declaredType = resolveType(typeAnn);
      } catch (UserException e) {
        diagnostics.error(e, id);
        declaredType = Types.ERROR;
      }
    } else if (kind == StreamKind.INPUT) {
      throw new LolaRuntimeError("Input " + decl.getName() +
                                 " without type from parser");
    }

    Pacing declaredPacing = null;
    PacingAnnotation pacingAnn = decl.getPacing();
    if (pacingAnn != null) {
      try {
        declaredPacing = resolvePacing(pacingAnn);
      } catch (UserException e) {
        diagnostics.error(e, id);
        declaredPacing = Pacing.ERROR;
      }
    }

    Stream s = graph.addStream(decl.getName(), kind, decl.getSpan(),
              declaredType, declaredPacing,
              pacingAnn == null ? null : pacingAnn.getSpan(), message);
    assert(s.id() == id);
    if (logger.isTraceEnabled()) {
      logger.trace("declared " + s + " as #" + id);
    }
  }

  private void lowerDefinition(int id, Declaration decl) {
    Expression body;
    if (decl.getKind() == DeclKind.OUTPUT) {
      body = ((OutputDeclaration) decl).getExpression();
    } else if (decl.getKind() == DeclKind.TRIGGER) {
      body = ((TriggerDeclaration) decl).getCondition();
    } else {
      return;
    }
    Stream s = graph.stream(id);
    s.setExpr(lowerExpr(s.id(), body));
  }

  Type resolveType(TypeAnnotation ann) throws UserException {
    String name = ann.getName();
    if (name.equals(TypeAnnotation.OPTION)) {
      if (ann.getParams().size() != 1 || ann.getUnit() != null) {
        throw new UnknownTypeException(ann.getSpan(), ann.toString());
      }
      return Types.option(resolveType(ann.getParams().get(0)));
    } else if (name.equals(TypeAnnotation.TUPLE)) {
      List<Type> fields = new ArrayList<Type>();
      for (TypeAnnotation p: ann.getParams()) {
        fields.add(resolveType(p));
      }
      return Types.tuple(fields);
    }

    Type prim = Types.primitiveByName(name);
    if (prim == null || !ann.getParams().isEmpty()) {
      throw new UnknownTypeException(ann.getSpan(), ann.toString());
    }
    if (ann.getUnit() == null) {
      return prim;
    }
    if (!prim.isNumeric()) {
      throw new InvalidLiteralException(ann.getSpan(), "Type " + name +
                                        " cannot carry a unit");
    }
    NumKind kind = ((Types.NumericType) prim).numKind();
    return Types.numeric(kind, parseUnit(ann.getUnit(), ann.getSpan()));
  }

  Pacing resolvePacing(PacingAnnotation ann) throws UserException {
    if (ann.isFrequency()) {
      Quantity q = parseQuantity(ann.getFrequency(), ann.getSpan());
      if (!q.magnitude().isPositive()) {
        throw new InvalidLiteralException(ann.getSpan(),
            "Frequency must be positive: " + ann.getFrequency());
      }
      try {
        return Pacing.periodic(q.toFrequency());
      } catch (UnitMismatchException e) {
        throw new UnitMismatchException(ann.getSpan(), e.getMessage());
      }
    }
    return Pacing.eventDriven(resolveActivation(ann.getActivation()));
  }

  private Activation resolveActivation(ActivationExpr e)
      throws UserException {
    switch (e.getOp()) {
      case NAME: {
        Integer id = ids.get(e.getName());
        if (id == null) {
          throw new UndeclaredStreamException(e.getSpan(), e.getName());
        }
        return Activation.of(id);
      }
      case AND:
      case OR: {
        Activation result = null;
        for (ActivationExpr operand: e.getOperands()) {
          Activation a = resolveActivation(operand);
          if (result == null) {
            result = a;
          } else if (e.getOp() == ActivationExpr.Op.AND) {
            result = result.and(a);
          } else {
            result = result.or(a);
          }
        }
        if (result == null) {
          throw new InvalidLiteralException(e.getSpan(),
                                            "Empty activation condition");
        }
        return result;
      }
      default:
        throw new LolaRuntimeError("Unknown activation operator " +
                                   e.getOp());
    }
  }

  private Expr lowerExpr(int target, Expression e) {
    try {
      return tryLowerExpr(target, e);
    } catch (UserException ex) {
      diagnostics.error(ex, target);
      return Expr.error(nextExprId++, e.getSpan());
    }
  }

  private Expr tryLowerExpr(int target, Expression e) throws UserException {
    SourceSpan span = e.getSpan();
    switch (e.getKind()) {
      case LITERAL:
        return Expr.constant(nextExprId++, span,
                             lowerLiteral((LiteralExpr) e));
      case STREAM: {
        StreamExpr se = (StreamExpr) e;
        StreamAccess access;
        switch (se.getAccess()) {
          case SYNC:
            access = StreamAccess.CURRENT;
            break;
          case HOLD:
            access = StreamAccess.HOLD;
            break;
          case OFFSET:
            access = StreamAccess.fromOffset(se.getOffset());
            break;
          default:
            throw new LolaRuntimeError("Unknown access " + se.getAccess());
        }
        return read(target, se.getName(), access, span);
      }
      case WINDOW: {
        WindowExpr we = (WindowExpr) e;
        WindowOperation op = WindowOperation.fromName(we.getOperation());
        if (op == null) {
          throw new UndeclaredFunctionException(span,
              "unknown window operation: " + we.getOperation());
        }
        Quantity q = parseQuantity(we.getDuration(), span);
        Rational seconds;
        try {
          seconds = q.toSeconds();
        } catch (UnitMismatchException ex) {
          throw new UnitMismatchException(span, ex.getMessage());
        }
        if (!seconds.isPositive()) {
          throw new InvalidLiteralException(span,
              "Window duration must be positive: " + we.getDuration());
        }
        return read(target, we.getName(), StreamAccess.window(seconds, op),
                    span);
      }
      case BINARY: {
        BinaryExpr be = (BinaryExpr) e;
        Expr left = lowerExpr(target, be.getLeft());
        Expr right = lowerExpr(target, be.getRight());
        return Expr.binary(nextExprId++, span, be.getOp(), left, right);
      }
      case UNARY: {
        UnaryExpr ue = (UnaryExpr) e;
        Expr operand = lowerExpr(target, ue.getOperand());
        return Expr.unary(nextExprId++, span, ue.getOp(), operand);
      }
      case ITE: {
        IteExpr ie = (IteExpr) e;
        Expr cond = lowerExpr(target, ie.getCondition());
        Expr thenE = lowerExpr(target, ie.getThen());
        Expr elseE = lowerExpr(target, ie.getElse());
        return Expr.ite(nextExprId++, span, cond, thenE, elseE);
      }
      case TUPLE: {
        List<Expr> elems = new ArrayList<Expr>();
        for (Expression elem: ((TupleExpr) e).getElements()) {
          elems.add(lowerExpr(target, elem));
        }
        return Expr.tuple(nextExprId++, span, elems);
      }
      case TUPLE_ACCESS: {
        TupleAccessExpr ta = (TupleAccessExpr) e;
        if (ta.getIndex() < 0) {
          throw new InvalidLiteralException(span, "Negative tuple index " +
                                            ta.getIndex());
        }
        Expr tuple = lowerExpr(target, ta.getTarget());
        return Expr.tupleAccess(nextExprId++, span, tuple, ta.getIndex());
      }
      case CALL: {
        CallExpr ce = (CallExpr) e;
        Builtins fn = Builtins.lookup(ce.getFunction());
        if (fn == null) {
          throw UndeclaredFunctionException.unknownFunction(span,
                                                   ce.getFunction());
        }
        if (ce.getArgs().size() != fn.arity()) {
          throw new TypeMismatchException(span, "Function " + fn.fnName() +
              " expects " + fn.arity() + " argument(s) but got " +
              ce.getArgs().size());
        }
        List<Expr> args = new ArrayList<Expr>();
        for (Expression arg: ce.getArgs()) {
          args.add(lowerExpr(target, arg));
        }
        return Expr.call(nextExprId++, span, fn, args);
      }
      case DEFAULT: {
        DefaultExpr de = (DefaultExpr) e;
        Expr inner = lowerExpr(target, de.getExpr());
        Expr dflt = lowerExpr(target, de.getDefault());
        return Expr.withDefault(nextExprId++, span, inner, dflt);
      }
      default:
        throw new LolaRuntimeError("Unexpected expression kind " +
                                   e.getKind());
    }
  }

  private Expr read(int target, String name, StreamAccess access,
                    SourceSpan span) throws UndeclaredStreamException {
    Integer source = ids.get(name);
    if (source == null) {
      throw new UndeclaredStreamException(span, name);
    }
    Reference ref = graph.addReference(source, target, access, span);
    return Expr.stream(nextExprId++, span, source, ref.id(), access);
  }

  private Constant lowerLiteral(LiteralExpr lit) throws UserException {
    SourceSpan span = lit.getSpan();
    String text = lit.getText();
    Unit unit = lit.getUnit() == null ? null
                                      : parseUnit(lit.getUnit(), span);
    switch (lit.getLiteralKind()) {
      case INTEGER:
        try {
          return Constant.integer(new BigInteger(text.trim()), unit);
        } catch (NumberFormatException e) {
          throw new InvalidLiteralException(span, "Invalid integer literal: " +
                                            text);
        }
      case FLOAT:
        try {
          return Constant.decimal(Rational.parseDecimal(text), unit);
        } catch (NumberFormatException e) {
          throw new InvalidLiteralException(span, "Invalid float literal: " +
                                            text);
        }
      case BOOL:
        if (text.equals("true")) {
          return Constant.bool(true);
        } else if (text.equals("false")) {
          return Constant.bool(false);
        }
        throw new InvalidLiteralException(span, "Invalid boolean literal: " +
                                          text);
      case STRING:
        return Constant.string(text);
      default:
        throw new LolaRuntimeError("Unknown literal kind " +
                                   lit.getLiteralKind());
    }
  }

  private static Unit parseUnit(String text, SourceSpan span)
      throws InvalidLiteralException {
    try {
      return Unit.parse(text);
    } catch (InvalidLiteralException e) {
      throw new InvalidLiteralException(span, e.getMessage());
    }
  }

  private static Quantity parseQuantity(String text, SourceSpan span)
      throws InvalidLiteralException {
    try {
      return Quantity.parse(text);
    } catch (InvalidLiteralException e) {
      throw new InvalidLiteralException(span, e.getMessage());
    }
  }
}
