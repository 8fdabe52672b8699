package exm.lola.frontend.pacing;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.hold;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.on;
import static exm.lola.SpecBuilder.ref;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.SpecBuilder;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.lang.Activation;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Rational;
import exm.lola.frontend.Diagnostic;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Lowering;
import exm.lola.frontend.StreamGraph;

public class PacingAnalyzerTest {

  private DiagnosticCollector diags;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  private StreamGraph analyze(SpecBuilder spec) {
    return analyze(spec, Settings.defaults());
  }

  private StreamGraph analyze(SpecBuilder spec, Settings settings) {
    diags = new DiagnosticCollector();
    StreamGraph g = Lowering.lower(spec.build(), diags);
    assertFalse("Lowering should succeed: " + diags.reported(),
                diags.hasErrors());
    PacingAnalyzer.analyze(g, diags, settings);
    return g;
  }

  private List<ErrorKind> errors() {
    List<ErrorKind> kinds = new ArrayList<ErrorKind>();
    for (Diagnostic d: diags.reported()) {
      kinds.add(d.getKind());
    }
    return kinds;
  }

  private static Pacing hz(long frequency) {
    return Pacing.periodic(Rational.of(frequency));
  }

  @Test
  public void testInputsAreEventDriven() {
    StreamGraph g = analyze(new SpecBuilder()
        .input("a", "Int32")
        .periodicInput("p", "Int32", "5Hz"));
    assertEquals(Pacing.eventDriven(Activation.of(0)), g.stream(0).pacing());
    assertEquals(hz(5), g.stream(1).pacing());
  }

  @Test
  public void testFasterClockWins() {
    StreamGraph g = analyze(new SpecBuilder()
        .periodicInput("fast", "Int32", "10Hz")
        .periodicInput("slow", "Int32", "5Hz")
        .output("sum", bin("+", ref("fast"), ref("slow")))
        .output("twice", bin("*", ref("sum"), ref("slow"))));
    assertEquals(0, diags.size());
    assertEquals(hz(10), g.lookup("sum").pacing());
    assertEquals(hz(10), g.lookup("twice").pacing());
    assertEquals("Readers do not change the clocks they read",
                 hz(5), g.lookup("slow").pacing());
  }

  @Test
  public void testIncompatibleFrequencies() {
    StreamGraph g = analyze(new SpecBuilder()
        .periodicInput("a", "Int32", "10Hz")
        .periodicInput("b", "Int32", "3Hz")
        .output("c", bin("+", ref("a"), ref("b")))
        .output("d", bin("+", ref("c"), intLit(1))));
    assertEquals("Reported once, readers of c stay quiet",
                 Arrays.asList(ErrorKind.INCOMPATIBLE_FREQUENCY), errors());
    Diagnostic d = diags.reported().get(0);
    assertTrue(d.getMessage(), d.getMessage().contains("reads b"));
    assertEquals(Arrays.asList(2, 1), d.getStreams());
    assertTrue(g.lookup("c").pacing().isError());
  }

  @Test
  public void testOperandOrderDoesNotMatter() {
    List<SpecBuilder> specs = Arrays.asList(
        new SpecBuilder()
            .periodicInput("a2", "Int32", "2Hz")
            .periodicInput("a3", "Int32", "3Hz")
            .periodicInput("a6", "Int32", "6Hz")
            .output("o", bin("+", bin("+", ref("a6"), ref("a2")), ref("a3"))),
        new SpecBuilder()
            .periodicInput("a2", "Int32", "2Hz")
            .periodicInput("a3", "Int32", "3Hz")
            .periodicInput("a6", "Int32", "6Hz")
            .output("o", bin("+", bin("+", ref("a2"), ref("a3")), ref("a6"))),
        new SpecBuilder()
            .periodicInput("a2", "Int32", "2Hz")
            .periodicInput("a3", "Int32", "3Hz")
            .periodicInput("a6", "Int32", "6Hz")
            .output("o", bin("+", bin("+", ref("a3"), ref("a6")), ref("a2"))));
    for (SpecBuilder spec: specs) {
      StreamGraph g = analyze(spec);
      assertEquals(errors().toString(), 0, diags.size());
      assertEquals(hz(6), g.lookup("o").pacing());
    }
  }

  @Test
  public void testSlowerThanFastestIsChecked() {
    List<SpecBuilder> specs = Arrays.asList(
        new SpecBuilder()
            .periodicInput("a4", "Int32", "4Hz")
            .periodicInput("a3", "Int32", "3Hz")
            .periodicInput("a12", "Int32", "12Hz")
            .periodicInput("a5", "Int32", "5Hz")
            .output("o", bin("+", bin("+", ref("a4"), ref("a5")),
                             bin("+", ref("a3"), ref("a12")))),
        new SpecBuilder()
            .periodicInput("a4", "Int32", "4Hz")
            .periodicInput("a3", "Int32", "3Hz")
            .periodicInput("a12", "Int32", "12Hz")
            .periodicInput("a5", "Int32", "5Hz")
            .output("o", bin("+", bin("+", ref("a12"), ref("a3")),
                             bin("+", ref("a5"), ref("a4")))));
    for (SpecBuilder spec: specs) {
      analyze(spec);
      assertEquals(Arrays.asList(ErrorKind.INCOMPATIBLE_FREQUENCY), errors());
      Diagnostic d = diags.reported().get(0);
      assertTrue(d.getMessage(), d.getMessage().contains("reads a5"));
      assertTrue(d.getMessage(), d.getMessage().contains("@12Hz"));
    }
  }

  @Test
  public void testCommonDivisorRule() throws Exception {
    StreamGraph g = analyze(new SpecBuilder()
        .periodicInput("a", "Int32", "10Hz")
        .periodicInput("b", "Int32", "4Hz")
        .output("c", bin("+", ref("a"), ref("b"))),
        Settings.defaults().with(Settings.FREQUENCY_RULE, "common-divisor"));
    assertEquals(0, diags.size());
    assertEquals(hz(2), g.lookup("c").pacing());
  }

  @Test
  public void testEventCombination() throws Exception {
    SpecBuilder spec = new SpecBuilder()
        .input("a", "Int32")
        .input("b", "Int32")
        .output("c", bin("+", ref("a"), ref("b")))
        .output("d", bin("+", ref("c"), ref("a")));
    Activation a = Activation.of(0);
    Activation b = Activation.of(1);

    StreamGraph g = analyze(spec);
    assertEquals(0, diags.size());
    assertEquals(Pacing.eventDriven(a.or(b)), g.lookup("c").pacing());
    assertEquals(Pacing.eventDriven(a.or(b)), g.lookup("d").pacing());

    g = analyze(spec, Settings.defaults().with(Settings.EVENT_COMBINATION,
                                               "conjunction"));
    assertEquals(0, diags.size());
    assertEquals(Pacing.eventDriven(a.and(b)), g.lookup("c").pacing());
    assertEquals(Pacing.eventDriven(a.and(b)), g.lookup("d").pacing());
  }

  @Test
  public void testMixedClocks() {
    analyze(new SpecBuilder()
        .input("e", "Int32")
        .periodicInput("p", "Int32", "1Hz")
        .output("m", bin("+", ref("e"), ref("p"))));
    assertEquals(Arrays.asList(ErrorKind.INCONSISTENT_PACING), errors());
  }

  @Test
  public void testHoldSynchronises() {
    StreamGraph g = analyze(new SpecBuilder()
        .input("e", "Int32")
        .periodicInput("p", "Int32", "1Hz")
        .output("m", bin("+", dflt(hold("e"), intLit(0)), ref("p")))
        .periodicOutput("sampled", "2Hz", dflt(hold("e"), intLit(0))));
    assertEquals(0, diags.size());
    assertEquals(hz(1), g.lookup("m").pacing());
    assertEquals(hz(2), g.lookup("sampled").pacing());
  }

  @Test
  public void testAmbiguousPacing() {
    analyze(new SpecBuilder()
        .input("a", "Int32")
        .output("past", dflt(offset("a", -1), intLit(0)))
        .output("constant", intLit(3)));
    assertEquals(Arrays.asList(ErrorKind.AMBIGUOUS_PACING,
                               ErrorKind.AMBIGUOUS_PACING), errors());
  }

  @Test
  public void testAnnotatedStreams() {
    analyze(new SpecBuilder()
        .periodicInput("x", "Int32", "10Hz")
        .input("a", "Int32")
        .input("b", "Int32")
        .periodicOutput("slower", "2Hz", ref("x"))
        .periodicOutput("odd", "3Hz", ref("x"))
        .activatedOutput("onA", on("a"), bin("+", ref("a"), ref("b"))));
    assertEquals(Arrays.asList(ErrorKind.INCOMPATIBLE_FREQUENCY,
                               ErrorKind.INCONSISTENT_PACING), errors());
  }

  @Test
  public void testAnnotationWins() {
    StreamGraph g = analyze(new SpecBuilder()
        .periodicInput("x", "Int32", "10Hz")
        .periodicOutput("slower", "2Hz", ref("x"))
        .output("reader", bin("+", ref("slower"), intLit(1))));
    assertEquals(0, diags.size());
    assertEquals(hz(2), g.lookup("reader").pacing());
  }

  @Test
  public void testLookahead() throws Exception {
    SpecBuilder spec = new SpecBuilder()
        .periodicInput("p", "Int32", "1Hz")
        .input("e", "Int32")
        .output("next", bin("+", dflt(offset("p", 1), intLit(0)), ref("p")))
        .output("nextEvent", bin("+", dflt(offset("e", 1), intLit(0)),
                                 ref("e")));
    analyze(spec);
    assertEquals(Arrays.asList(ErrorKind.UNDECIDABLE_LOOKAHEAD), errors());
    assertEquals(Arrays.asList(3, 1), diags.reported().get(0).getStreams());

    analyze(spec, Settings.defaults().with(Settings.ALLOW_LOOKAHEAD, "false"));
    assertEquals(Arrays.asList(ErrorKind.UNDECIDABLE_LOOKAHEAD,
                               ErrorKind.UNDECIDABLE_LOOKAHEAD), errors());
  }

  @Test
  public void testLattice() {
    PacingLattice lattice = new PacingLattice(
                        Settings.defaults().pacingPolicy());
    assertTrue(lattice.compatible(hz(2), hz(10)));
    assertTrue(lattice.compatible(hz(10), hz(2)));
    assertFalse(lattice.compatible(hz(3), hz(10)));
    assertFalse(lattice.compatible(hz(3), Pacing.eventDriven(Activation.of(0))));
    assertTrue(lattice.compatible(Pacing.ERROR, hz(3)));
  }
}
