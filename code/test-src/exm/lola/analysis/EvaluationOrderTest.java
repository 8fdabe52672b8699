package exm.lola.analysis;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.hold;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.ref;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.SpecBuilder;
import exm.lola.common.Logging;
import exm.lola.common.exceptions.SchedulingCycleError;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.StreamGraph;

public class EvaluationOrderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  @Test
  public void testLayers() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .input("a", "Int32")                                     // 0
        .output("b", bin("+", ref("a"), intLit(1)))              // 1
        .output("c", bin("+", ref("b"), ref("a")))               // 2
        .output("d", bin("+", ref("a"),                          // 3
                         dflt(offset("c", -1), intLit(0))))
        .periodicInput("p", "Int32", "1Hz")                      // 4
        .output("q", bin("*", ref("p"), intLit(2)))              // 5
        .output("h", bin("+", dflt(hold("c"), intLit(0)),        // 6
                         ref("p"))), diags);
    EvaluationOrder order = EvaluationOrder.compute(g);

    assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5, 6), order.order());
    assertEquals(0, g.lookup("a").layer());
    assertEquals(2, g.lookup("c").layer());
    assertEquals("History reads do not raise the layer",
                 1, g.lookup("d").layer());
    assertEquals("Hold reads the current value", 3, g.lookup("h").layer());

    assertEquals(Arrays.<List<Integer>>asList(Arrays.asList(1, 3),
                                              Arrays.asList(2)),
                 order.eventDrivenLayers());
    assertEquals(Arrays.<List<Integer>>asList(Arrays.asList(5),
                                              Arrays.asList(6)),
                 order.periodicLayers());
  }

  @Test
  public void testDeclarationOrderBreaksTies() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.prepare(new SpecBuilder()
        .output("late", bin("+", ref("early"), intLit(1)))
        .input("early", "Int32")
        .output("other", bin("-", ref("early"), intLit(1))), diags);
    assertEquals(Arrays.asList(1, 0, 2), EvaluationOrder.compute(g).order());
  }

  @Test
  public void testCurrentCycleIsInternalError() {
    DiagnosticCollector diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.lower(new SpecBuilder()
        .input("a", "Int32")
        .output("x", bin("+", ref("y"), ref("a")))
        .output("y", bin("+", ref("x"), intLit(1))), diags);
    try {
      EvaluationOrder.compute(g);
      fail("x and y read each other");
    } catch (SchedulingCycleError e) {
      assertEquals(Arrays.asList("x", "y"), e.getUnscheduled());
    }
  }
}
