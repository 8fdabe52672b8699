package exm.lola.analysis;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.ref;
import static exm.lola.SpecBuilder.window;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.SpecBuilder;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.lang.Rational;
import exm.lola.frontend.Diagnostic;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.StreamGraph;
import exm.lola.ir.MemoryBound;

public class MemoryAnalyzerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  @Test
  public void testLookbackAndWindow() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .periodicInput("x", "Int32", "10Hz")
        .output("o", bin("+", bin("+", dflt(offset("x", -3), intLit(0)),
                                  window("x", "500ms", "sum")),
                         ref("x"))), diags);
    MemoryAnalyzer.analyze(g, diags, Settings.defaults());
    assertEquals(0, diags.size());
    assertEquals("Half a second at 10Hz beats 4 values for the lookback",
                 new MemoryBound(5, null), g.lookup("x").memoryBound());
    assertEquals(MemoryBound.MINIMAL, g.lookup("o").memoryBound());
  }

  @Test
  public void testLookbackOnly() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .input("a", "Int32")
        .output("o", bin("+", dflt(offset("a", -7), ref("a")),
                         dflt(offset("o", -1), intLit(0)))), diags);
    MemoryAnalyzer.analyze(g, diags, Settings.defaults());
    assertEquals(8, g.lookup("a").memoryBound().samples());
    assertEquals(2, g.lookup("o").memoryBound().samples());
  }

  @Test
  public void testEventDrivenWindow() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .input("e", "Int32")
        .periodicOutput("c", "1Hz", window("e", "2s", "count"))
        .periodicOutput("d", "1Hz", window("e", "5s", "sum"))
        .output("l", bin("+", dflt(offset("e", -2), intLit(0)), ref("e"))),
        diags);
    MemoryAnalyzer.analyze(g, diags, Settings.defaults());
    assertEquals(0, diags.size());
    MemoryBound bound = g.lookup("e").memoryBound();
    assertEquals(new MemoryBound(3, Rational.of(5)), bound);
    assertTrue(bound.hasRetention());
    assertFalse(g.lookup("l").memoryBound().hasRetention());
  }

  @Test
  public void testBoundExceeded() throws Exception {
    DiagnosticCollector diags = new DiagnosticCollector();
    Settings settings = Settings.defaults().with(Settings.MAX_MEMORY_BOUND, "3");
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .input("x", "Int32")
        .output("y", bin("+", dflt(offset("x", -10), intLit(0)), ref("x"))),
        diags, settings);
    MemoryAnalyzer.analyze(g, diags, settings);
    assertEquals(1, diags.errorCount());
    Diagnostic d = diags.reported().get(0);
    assertEquals(ErrorKind.MEMORY_BOUND_EXCEEDED, d.getKind());
    assertTrue(d.getMessage(), d.getMessage().contains("11"));
    assertEquals(Arrays.asList(0, 1), d.getStreams());
    assertEquals("Clamped to the limit", 3,
                 g.lookup("x").memoryBound().samples());
  }

  @Test
  public void testFutureDependence() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .periodicInput("p", "Int32", "1Hz")
        .output("n", bin("+", dflt(offset("p", 1), intLit(0)), ref("p")))
        .output("m", bin("+", ref("n"), intLit(1)))
        .output("q", bin("+", ref("p"), intLit(1))), diags);
    MemoryAnalyzer.analyze(g, diags, Settings.defaults());
    assertTrue(g.lookup("n").isFutureDependent());
    assertTrue(g.lookup("m").isFutureDependent());
    assertFalse(g.lookup("q").isFutureDependent());
    assertFalse(g.lookup("p").isFutureDependent());
    assertEquals("The lookahead keeps the next value",
                 2, g.lookup("p").memoryBound().samples());
  }
}
