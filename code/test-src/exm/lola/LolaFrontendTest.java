package exm.lola;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.boolLit;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.floatLit;
import static exm.lola.SpecBuilder.hold;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.on;
import static exm.lola.SpecBuilder.ref;
import static exm.lola.SpecBuilder.window;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.function.IntFunction;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.ast.LolaSpec;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.lang.Activation;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Rational;
import exm.lola.common.lang.Types;
import exm.lola.frontend.Diagnostic;
import exm.lola.frontend.Stream;
import exm.lola.ir.FeatureFlag;
import exm.lola.ir.LolaIR;
import exm.lola.ir.MemoryBound;
import exm.lola.ir.Schedule.Deadline;

public class LolaFrontendTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  private static LolaSpec altimeter() {
    return new SpecBuilder()
        .input("altitude", "Float64")                                  // 0
        .input("pressure", "Float64")                                  // 1
        .output("delta", bin("-", ref("altitude"),                     // 2
                 dflt(offset("altitude", -1), ref("altitude"))))
        .periodicOutput("avg", "1Hz",                                  // 3
                 dflt(window("altitude", "10s", "avg"), floatLit("0.0")))
        .trigger(bin(">", ref("delta"), floatLit("10.0")),             // 4
                 "climbing fast")
        .trigger(bin("<", ref("pressure"), floatLit("0.5")),           // 5
                 "low pressure")
        .build();
  }

  /**
   * Same declarations as altimeter(), with an input and an output that
   * nothing else reads mixed in
   */
  private static LolaSpec altimeterWithExtras() {
    return new SpecBuilder()
        .input("altitude", "Float64")
        .input("unrelated", "Int32")
        .input("pressure", "Float64")
        .output("delta", bin("-", ref("altitude"),
                 dflt(offset("altitude", -1), ref("altitude"))))
        .output("unrelatedOut", bin("+", ref("unrelated"), intLit(1)))
        .periodicOutput("avg", "1Hz",
                 dflt(window("altitude", "10s", "avg"), floatLit("0.0")))
        .trigger(bin(">", ref("delta"), floatLit("10.0")),
                 "climbing fast")
        .trigger(bin("<", ref("pressure"), floatLit("0.5")),
                 "low pressure")
        .build();
  }

  /** Trigger names depend on their position, messages do not */
  private static String key(Stream s) {
    return s.isTrigger() ? "trigger " + s.triggerMessage() : s.name();
  }

  private static String pacingOf(final LolaIR ir, Stream s) {
    return s.pacing().toString(new IntFunction<String>() {
      @Override
      public String apply(int id) {
        return key(ir.stream(id));
      }
    });
  }

  private static List<ErrorKind> kinds(List<Diagnostic> diagnostics) {
    List<ErrorKind> result = new ArrayList<ErrorKind>();
    for (Diagnostic d: diagnostics) {
      result.add(d.getKind());
    }
    return result;
  }

  @Test
  public void testSuccess() {
    AnalysisResult result = LolaFrontend.analyze(altimeter());
    assertTrue(result.getDiagnostics().toString(), result.isSuccess());
    assertTrue(result.getDiagnostics().isEmpty());

    LolaIR ir = result.getIR();
    assertTrue(ir.graph().isFrozen());
    assertEquals(2, ir.inputs().size());
    assertEquals(2, ir.outputs().size());
    assertEquals(2, ir.triggers().size());

    Stream delta = ir.stream("delta");
    assertEquals(Types.FLOAT64, delta.type());
    assertEquals(Pacing.eventDriven(Activation.of(0)), delta.pacing());
    assertEquals(Types.BOOL, ir.typeOf(ir.stream(4).expr()));
    assertEquals(Pacing.periodic(Rational.ONE), ir.stream("avg").pacing());
    assertEquals(Pacing.eventDriven(Activation.of(1)), ir.stream(5).pacing());

    assertEquals("One value back, ten seconds of window",
                 new MemoryBound(2, Rational.of(10)),
                 ir.stream("altitude").memoryBound());
    assertEquals(MemoryBound.MINIMAL, ir.stream("pressure").memoryBound());

    assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5), ir.evaluationOrder());
    assertEquals(Arrays.<List<Integer>>asList(Arrays.asList(2, 5),
                                              Arrays.asList(4)),
                 ir.eventDrivenLayers());
    assertEquals(Arrays.<List<Integer>>asList(Arrays.asList(3)),
                 ir.periodicLayers());
    assertEquals(1, ir.periodicStreams().size());
    assertEquals(3, ir.eventDrivenStreams().size());

    assertEquals(Rational.ONE, ir.schedule().hyperPeriod());
    assertEquals(Arrays.asList(new Deadline(Rational.ONE, Arrays.asList(3))),
                 ir.schedule().deadlines());
    assertEquals(EnumSet.of(FeatureFlag.SLIDING_WINDOWS,
                            FeatureFlag.PERIODIC_STREAMS,
                            FeatureFlag.EVENT_DRIVEN_STREAMS),
                 ir.featureFlags());
  }

  @Test
  public void testFrozenAfterSuccess() {
    LolaIR ir = LolaFrontend.analyze(altimeter()).getIR();
    try {
      ir.stream("delta").setLayer(7);
      fail("Streams of the IR are read-only");
    } catch (LolaRuntimeError e) {
      // expected
    }
  }

  @Test
  public void testAnalysisIsRepeatable() {
    LolaSpec spec = altimeter();
    LolaIR first = LolaFrontend.analyze(spec).getIR();
    LolaIR second = LolaFrontend.analyze(spec).getIR();
    assertEquals(first.evaluationOrder(), second.evaluationOrder());
    assertEquals(first.schedule().deadlines(), second.schedule().deadlines());
    for (Stream s: first.streams()) {
      Stream t = second.stream(s.id());
      assertEquals(s.name(), t.name());
      assertEquals(s.type(), t.type());
      assertEquals(s.pacing(), t.pacing());
      assertEquals(s.memoryBound(), t.memoryBound());
      assertEquals(s.layer(), t.layer());
    }
  }

  @Test
  public void testFailureKeepsGoing() {
    AnalysisResult result = LolaFrontend.analyze(new SpecBuilder()
        .input("a", "Int32")
        .output("b", bin("+", ref("a"), ref("nope")))
        .output("c", bin("*", ref("a"), boolLit(true)))
        .build());
    assertFalse(result.isSuccess());
    assertEquals("Ranked by position",
                 Arrays.asList(ErrorKind.UNDECLARED_STREAM,
                               ErrorKind.TYPE_MISMATCH),
                 kinds(result.errors()));
    try {
      result.getIR();
      fail("No IR after errors");
    } catch (LolaRuntimeError e) {
      assertTrue(e.getMessage(), e.getMessage().contains("2 error(s)"));
    }
  }

  @Test
  public void testErrorsFromEveryStage() {
    AnalysisResult result = LolaFrontend.analyze(new SpecBuilder()
        .periodicInput("p", "Int32", "10Hz")
        .periodicInput("q", "Int32", "3Hz")
        .output("c", bin("+", ref("p"), ref("q")))
        .output("d", bin("+", ref("p"), boolLit(true)))
        .output("z", bin("+", ref("z"), ref("p")))
        .build());
    List<ErrorKind> kinds = kinds(result.errors());
    assertEquals(kinds.toString(), 3, kinds.size());
    assertTrue(kinds.contains(ErrorKind.INCOMPATIBLE_FREQUENCY));
    assertTrue(kinds.contains(ErrorKind.TYPE_MISMATCH));
    assertTrue(kinds.contains(ErrorKind.ILLEGAL_CYCLE));
  }

  @Test
  public void testUnusedInputs() throws Exception {
    LolaSpec spec = new SpecBuilder()
        .input("a", "Int32")
        .input("b", "Int32")
        .input("clock", "Bool")
        .output("o", bin("+", ref("a"), intLit(1)))
        .activatedOutput("sampled", on("clock"), dflt(hold("a"), intLit(0)))
        .build();
    AnalysisResult result = LolaFrontend.analyze(spec);
    assertTrue(result.isSuccess());
    assertEquals(0, result.errors().size());
    List<Diagnostic> warnings = result.warnings();
    assertEquals(1, warnings.size());
    assertEquals(ErrorKind.UNUSED_STREAM, warnings.get(0).getKind());
    assertEquals(Arrays.asList(1), warnings.get(0).getStreams());

    Settings quiet = Settings.defaults().with(Settings.WARN_UNUSED_INPUTS,
                                              "false");
    assertTrue(LolaFrontend.analyze(spec, quiet).getDiagnostics().isEmpty());
  }

  @Test
  public void testFeatureFlags() {
    LolaIR ir = LolaFrontend.analyze(new SpecBuilder()
        .periodicInput("p", "Int32", "1Hz")
        .input("e", "Int32")
        .output("n", bin("+", dflt(offset("p", 1), intLit(0)), ref("p")))
        .periodicOutput("w", "1Hz", window("e", "1s", "count"))
        .output("h", bin("+", dflt(hold("e"), intLit(0)), ref("p")))
        .build()).getIR();
    assertEquals(EnumSet.allOf(FeatureFlag.class), ir.featureFlags());
    assertTrue(ir.stream("n").isFutureDependent());
  }

  @Test
  public void testUnrelatedStreamsChangeNothingElse() {
    LolaIR base = LolaFrontend.analyze(altimeter()).getIR();
    AnalysisResult extended = LolaFrontend.analyze(altimeterWithExtras());
    assertTrue(extended.getDiagnostics().toString(), extended.isSuccess());
    LolaIR ir = extended.getIR();
    assertEquals(base.streams().size() + 2, ir.streams().size());

    List<String> baseOrder = new ArrayList<String>();
    for (int id: base.evaluationOrder()) {
      baseOrder.add(key(base.stream(id)));
    }
    List<String> order = new ArrayList<String>();
    for (int id: ir.evaluationOrder()) {
      String name = key(ir.stream(id));
      if (baseOrder.contains(name)) {
        order.add(name);
      }
    }
    assertEquals(baseOrder, order);

    for (Stream s: base.streams()) {
      Stream t = null;
      for (Stream candidate: ir.streams()) {
        if (key(candidate).equals(key(s))) {
          t = candidate;
        }
      }
      assertTrue("Missing " + key(s), t != null);
      assertEquals(key(s), s.type(), t.type());
      assertEquals(key(s), pacingOf(base, s), pacingOf(ir, t));
      assertEquals(key(s), s.memoryBound(), t.memoryBound());
      assertEquals(key(s), s.isFutureDependent(), t.isFutureDependent());
    }
  }

  @Test
  public void testNoPacingErrorAfterUndeclaredName() {
    AnalysisResult result = LolaFrontend.analyze(new SpecBuilder()
        .output("o", bin("+", ref("nope"), intLit(1)))
        .build());
    assertEquals(Arrays.asList(ErrorKind.UNDECLARED_STREAM),
                 kinds(result.getDiagnostics()));
  }

  @Test
  public void testNoPacingErrorOnCurrentCycle() {
    AnalysisResult result = LolaFrontend.analyze(new SpecBuilder()
        .output("z", bin("+", ref("z"), intLit(1)))
        .output("w", bin("+", ref("z"), intLit(2)))
        .build());
    assertEquals(Arrays.asList(ErrorKind.ILLEGAL_CYCLE),
                 kinds(result.getDiagnostics()));
  }

  @Test
  public void testLongChain() {
    int n = 5000;
    SpecBuilder spec = new SpecBuilder().input("s0", "Int64");
    for (int i = 1; i < n; i++) {
      spec.output("s" + i, bin("+", ref("s" + (i - 1)), intLit(1)));
    }
    AnalysisResult result = LolaFrontend.analyze(spec.build());
    assertTrue(result.getDiagnostics().toString(), result.isSuccess());
    LolaIR ir = result.getIR();
    assertEquals(n, ir.evaluationOrder().size());
    assertEquals(Integer.valueOf(n - 1),
                 ir.evaluationOrder().get(n - 1));
    assertEquals(Pacing.eventDriven(Activation.of(0)),
                 ir.stream("s" + (n - 1)).pacing());
  }
}
