package exm.lola;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.lola.ast.ActivationExpr;
import exm.lola.ast.BinaryExpr;
import exm.lola.ast.CallExpr;
import exm.lola.ast.Declaration;
import exm.lola.ast.DefaultExpr;
import exm.lola.ast.Expression;
import exm.lola.ast.InputDeclaration;
import exm.lola.ast.IteExpr;
import exm.lola.ast.LiteralExpr;
import exm.lola.ast.LiteralExpr.LiteralKind;
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
import exm.lola.common.lang.Operators;

/**
 * Builds parsed specifications for tests.  Every node gets its own
 * source line, in the order the nodes are created.
 */
public class SpecBuilder {
  public static final String FILE = "test.lola";

  private static int nextLine = 1;

  private final List<Declaration> decls = new ArrayList<Declaration>();

  public static synchronized SourceSpan span() {
    return new SourceSpan(FILE, nextLine++, 1);
  }

  public SpecBuilder input(String name, String type) {
    decls.add(new InputDeclaration(name, span(), type(type)));
    return this;
  }

  public SpecBuilder input(String name, TypeAnnotation type) {
    decls.add(new InputDeclaration(name, span(), type));
    return this;
  }

  public SpecBuilder periodicInput(String name, String type,
                                   String frequency) {
    decls.add(new InputDeclaration(name, span(), type(type),
                                   PacingAnnotation.frequency(frequency, span())));
    return this;
  }

  public SpecBuilder output(String name, Expression e) {
    decls.add(new OutputDeclaration(name, span(), null, null, e));
    return this;
  }

  public SpecBuilder output(String name, String type, Expression e) {
    decls.add(new OutputDeclaration(name, span(), type(type), null, e));
    return this;
  }

  public SpecBuilder output(String name, TypeAnnotation type, Expression e) {
    decls.add(new OutputDeclaration(name, span(), type, null, e));
    return this;
  }

  public SpecBuilder periodicOutput(String name, String frequency,
                                    Expression e) {
    decls.add(new OutputDeclaration(name, span(), null,
                        PacingAnnotation.frequency(frequency, span()), e));
    return this;
  }

  public SpecBuilder activatedOutput(String name, ActivationExpr activation,
                                     Expression e) {
    decls.add(new OutputDeclaration(name, span(), null,
                        PacingAnnotation.activation(activation, span()), e));
    return this;
  }

  public SpecBuilder trigger(Expression condition, String message) {
    decls.add(new TriggerDeclaration(null, span(), null, condition,
                                     message));
    return this;
  }

  public SpecBuilder periodicTrigger(String frequency, Expression condition,
                                     String message) {
    decls.add(new TriggerDeclaration(null, span(),
        PacingAnnotation.frequency(frequency, span()), condition, message));
    return this;
  }

  public LolaSpec build() {
    return new LolaSpec(decls);
  }

  public static TypeAnnotation type(String name) {
    return TypeAnnotation.named(name, span());
  }

  public static TypeAnnotation type(String name, String unit) {
    return TypeAnnotation.withUnit(name, unit, span());
  }

  public static Expression ref(String name) {
    return StreamExpr.sync(span(), name);
  }

  public static Expression offset(String name, int offset) {
    return StreamExpr.offset(span(), name, offset);
  }

  public static Expression hold(String name) {
    return StreamExpr.hold(span(), name);
  }

  public static Expression window(String name, String duration, String op) {
    return new WindowExpr(span(), name, duration, op);
  }

  public static Expression intLit(long value) {
    return new LiteralExpr(span(), LiteralKind.INTEGER, Long.toString(value));
  }

  public static Expression floatLit(String text) {
    return new LiteralExpr(span(), LiteralKind.FLOAT, text);
  }

  public static Expression floatLit(String text, String unit) {
    return new LiteralExpr(span(), LiteralKind.FLOAT, text, unit);
  }

  public static Expression boolLit(boolean value) {
    return new LiteralExpr(span(), LiteralKind.BOOL, Boolean.toString(value));
  }

  public static Expression stringLit(String text) {
    return new LiteralExpr(span(), LiteralKind.STRING, text);
  }

  public static Expression bin(String op, Expression left, Expression right) {
    return new BinaryExpr(span(), Operators.binaryOp(op), left, right);
  }

  public static Expression not(Expression operand) {
    return new UnaryExpr(span(), Operators.unaryOp("!"), operand);
  }

  public static Expression neg(Expression operand) {
    return new UnaryExpr(span(), Operators.unaryOp("-"), operand);
  }

  public static Expression ite(Expression cond, Expression thenE,
                               Expression elseE) {
    return new IteExpr(span(), cond, thenE, elseE);
  }

  public static Expression call(String fn, Expression... args) {
    return new CallExpr(span(), fn, Arrays.asList(args));
  }

  public static Expression dflt(Expression e, Expression d) {
    return new DefaultExpr(span(), e, d);
  }

  public static Expression tuple(Expression... elems) {
    return new TupleExpr(span(), Arrays.asList(elems));
  }

  public static Expression field(Expression target, int index) {
    return new TupleAccessExpr(span(), target, index);
  }

  public static ActivationExpr on(String name) {
    return ActivationExpr.name(name, span());
  }

  public static ActivationExpr allOf(ActivationExpr... operands) {
    return ActivationExpr.and(Arrays.asList(operands), span());
  }

  public static ActivationExpr anyOf(ActivationExpr... operands) {
    return ActivationExpr.or(Arrays.asList(operands), span());
  }
}
