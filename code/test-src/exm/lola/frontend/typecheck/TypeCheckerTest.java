package exm.lola.frontend.typecheck;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.boolLit;
import static exm.lola.SpecBuilder.call;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.field;
import static exm.lola.SpecBuilder.floatLit;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.ite;
import static exm.lola.SpecBuilder.neg;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.ref;
import static exm.lola.SpecBuilder.tuple;
import static exm.lola.SpecBuilder.type;
import static exm.lola.SpecBuilder.window;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.SpecBuilder;
import exm.lola.ast.LolaSpec;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.lang.Types;
import exm.lola.common.lang.Types.NumKind;
import exm.lola.common.lang.Types.Type;
import exm.lola.common.lang.Unit;
import exm.lola.frontend.Diagnostic;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Lowering;
import exm.lola.frontend.StreamGraph;
import exm.lola.ir.Expr;

public class TypeCheckerTest {

  private DiagnosticCollector diags;
  private Map<Integer, Type> exprTypes;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  private StreamGraph check(SpecBuilder spec) {
    return check(spec.build(), Settings.defaults());
  }

  private StreamGraph check(LolaSpec spec, Settings settings) {
    diags = new DiagnosticCollector();
    StreamGraph g = Lowering.lower(spec, diags);
    assertFalse("Lowering should succeed: " + diags.reported(),
                diags.hasErrors());
    exprTypes = TypeChecker.check(g, diags, settings);
    return g;
  }

  private List<ErrorKind> errors() {
    List<ErrorKind> kinds = new ArrayList<ErrorKind>();
    for (Diagnostic d: diags.reported()) {
      kinds.add(d.getKind());
    }
    return kinds;
  }

  private static Type typeOf(StreamGraph g, String name) {
    return g.lookup(name).type();
  }

  @Test
  public void testLiteralDefaults() {
    StreamGraph g = check(new SpecBuilder()
        .input("a", "Int32")
        .output("b", bin("+", intLit(1), intLit(2)))
        .output("c", floatLit("2.5"))
        .output("d", bin("+", ref("a"), intLit(1)))
        .output("e", dflt(offset("a", -1), intLit(0))));

    assertEquals(errors().toString(), 0, diags.size());
    assertEquals(Types.INT64, typeOf(g, "b"));
    assertEquals(Types.FLOAT64, typeOf(g, "c"));
    assertEquals("Literal takes the other operand's type",
                 Types.INT32, typeOf(g, "d"));
    assertEquals(Types.INT32, typeOf(g, "e"));

    Expr literal = g.lookup("d").expr().arg(1);
    assertEquals(Types.INT32, exprTypes.get(literal.id()));
    Expr lookback = g.lookup("e").expr().arg(0);
    assertEquals(Types.option(Types.INT32), exprTypes.get(lookback.id()));
  }

  @Test
  public void testNoDefaulting() throws Exception {
    check(new SpecBuilder()
        .output("b", bin("+", intLit(1), intLit(2))).build(),
        Settings.defaults().with(Settings.DEFAULT_LITERAL_TYPES, "false"));
    assertEquals(Arrays.asList(ErrorKind.AMBIGUOUS_TYPE), errors());
  }

  @Test
  public void testUnitsOfProducts() throws Exception {
    StreamGraph g = check(new SpecBuilder()
        .input("x", type("Float64", "m"))
        .input("t", type("Float64", "s"))
        .output("v", bin("/", ref("x"), ref("t")))
        .output("k", bin("*", ref("x"), floatLit("2.0")))
        .output("area", bin("*", ref("x"), ref("x"))));

    assertEquals(errors().toString(), 0, diags.size());
    assertEquals(Types.numeric(NumKind.FLOAT64, Unit.parse("m/s")),
                 typeOf(g, "v"));
    assertEquals("Unknown factor is dimensionless",
                 Types.numeric(NumKind.FLOAT64, Unit.parse("m")),
                 typeOf(g, "k"));
    assertEquals(Types.numeric(NumKind.FLOAT64, Unit.parse("m^2")),
                 typeOf(g, "area"));
  }

  @Test
  public void testUnitFromDeclaration() throws Exception {
    // x * y : m, with x in m, so y must be dimensionless
    StreamGraph g = check(new SpecBuilder()
        .input("x", type("Float64", "m"))
        .output("y", bin("*", floatLit("3.0"), ref("x")))
        .output("z", type("Float64", "m"), bin("*", ref("x"), ref("w")))
        .output("w", floatLit("0.5")));
    assertEquals(errors().toString(), 0, diags.size());
    assertEquals(Types.numeric(NumKind.FLOAT64, Unit.parse("m")),
                 typeOf(g, "y"));
    assertEquals(Types.FLOAT64, typeOf(g, "w"));
  }

  @Test
  public void testUnitMismatch() {
    check(new SpecBuilder()
        .input("x", type("Float64", "m"))
        .input("t", type("Float64", "s"))
        .output("bad", bin("+", ref("x"), ref("t")))
        .output("badPow", bin("**", ref("x"), floatLit("2.0"))));
    assertEquals(Arrays.asList(ErrorKind.UNIT_MISMATCH,
                               ErrorKind.UNIT_MISMATCH), errors());
  }

  @Test
  public void testTypeMismatches() {
    check(new SpecBuilder()
        .input("a", "Int32")
        .input("f", "Float64")
        .input("u", "UInt8")
        .output("mixed", bin("+", ref("a"), ref("f")))
        .output("declared", "Bool", bin("+", ref("a"), intLit(1)))
        .output("sqrtInt", call("sqrt", ref("a")))
        .output("negUnsigned", neg(ref("u")))
        .output("notBool", ite(ref("a"), intLit(1), intLit(2)))
        .output("remFloat", bin("%", ref("f"), floatLit("2.0")))
        .trigger(bin("+", ref("a"), intLit(1)), "not a condition"));
    assertEquals(7, diags.errorCount());
    for (ErrorKind k: errors()) {
      assertEquals(ErrorKind.TYPE_MISMATCH, k);
    }
  }

  @Test
  public void testErrorReportedOnce() {
    StreamGraph g = check(new SpecBuilder()
        .input("a", "Int32")
        .input("f", "Float64")
        .output("bad", bin("*", bin("+", ref("a"), ref("f")), intLit(2)))
        .output("user", bin("+", ref("bad"), intLit(1)))
        .trigger(bin(">", ref("user"), intLit(3)), "still checked"));
    assertEquals(1, diags.errorCount());
    assertEquals(Types.BOOL, g.stream(4).type());
  }

  @Test
  public void testTriggerCondition() {
    StreamGraph g = check(new SpecBuilder()
        .input("a", "Int32")
        .trigger(bin("&&", bin(">", ref("a"), intLit(3)), boolLit(true)),
                 "a large"));
    assertEquals(0, diags.size());
    assertEquals(Types.BOOL, g.stream(1).type());
  }

  @Test
  public void testWindows() throws Exception {
    StreamGraph g = check(new SpecBuilder()
        .input("x", type("Float64", "m"))
        .output("n", window("x", "1s", "count"))
        .output("avg", window("x", "1s", "avg"))
        .output("dist", window("x", "2s", "integral"))
        .output("total", window("x", "2s", "sum")));
    assertEquals(errors().toString(), 0, diags.size());
    assertEquals(Types.UINT64, typeOf(g, "n"));
    assertEquals(Types.option(Types.numeric(NumKind.FLOAT64, Unit.parse("m"))),
                 typeOf(g, "avg"));
    assertEquals(Types.numeric(NumKind.FLOAT64, Unit.parse("m*s")),
                 typeOf(g, "dist"));
    assertEquals(Types.numeric(NumKind.FLOAT64, Unit.parse("m")),
                 typeOf(g, "total"));
  }

  @Test
  public void testProductWindowNeedsDimensionless() {
    check(new SpecBuilder()
        .input("x", type("Float64", "m"))
        .output("p", window("x", "1s", "product")));
    assertEquals(Arrays.asList(ErrorKind.UNIT_MISMATCH), errors());
  }

  @Test
  public void testTuples() {
    StreamGraph g = check(new SpecBuilder()
        .input("a", "Int32")
        .output("p", tuple(ref("a"), floatLit("2.5"), boolLit(false)))
        .output("q", field(ref("p"), 1))
        .output("r", field(ref("p"), 3)));
    assertEquals(Arrays.asList(ErrorKind.TYPE_MISMATCH), errors());
    assertEquals(Types.tuple(Arrays.<Type>asList(Types.INT32, Types.FLOAT64,
                                                 Types.BOOL)),
                 typeOf(g, "p"));
    assertEquals(Types.FLOAT64, typeOf(g, "q"));
  }

  @Test
  public void testTupleOfUnknownType() {
    check(new SpecBuilder()
        .output("w", field(ref("z"), 0))
        .output("z", field(ref("w"), 0)));
    assertEquals(Arrays.asList(ErrorKind.AMBIGUOUS_TYPE), errors());
  }

  @Test
  public void testRecursiveType() {
    check(new SpecBuilder()
        .output("o", tuple(dflt(offset("o", -1), intLit(0)))));
    assertEquals(Arrays.asList(ErrorKind.TYPE_MISMATCH), errors());
    assertTrue(diags.reported().get(0).getMessage(),
               diags.reported().get(0).getMessage().contains("recursive"));
  }

  @Test
  public void testSelfReferenceWithHistory() {
    StreamGraph g = check(new SpecBuilder()
        .input("a", "UInt16")
        .output("sum", bin("+", dflt(offset("sum", -1), intLit(0)),
                           ref("a"))));
    assertEquals(0, diags.size());
    assertEquals(Types.UINT16, typeOf(g, "sum"));
  }

  @Test
  public void testBuiltins() {
    StreamGraph g = check(new SpecBuilder()
        .input("f", "Float32")
        .input("i", "Int16")
        .output("root", call("sqrt", ref("f")))
        .output("mag", call("abs", ref("i"))));
    assertEquals(0, diags.size());
    assertEquals(Types.FLOAT32, typeOf(g, "root"));
    assertEquals(Types.INT16, typeOf(g, "mag"));
  }
}
