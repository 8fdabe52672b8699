package exm.lola.analysis;

import static exm.lola.SpecBuilder.bin;
import static exm.lola.SpecBuilder.dflt;
import static exm.lola.SpecBuilder.intLit;
import static exm.lola.SpecBuilder.offset;
import static exm.lola.SpecBuilder.ref;
import static exm.lola.SpecBuilder.window;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.lola.SpecBuilder;
import exm.lola.common.Logging;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.frontend.Diagnostic;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.StreamGraph;

public class CycleDetectorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(false);
  }

  private DiagnosticCollector diags;

  private int check(SpecBuilder spec) {
    diags = new DiagnosticCollector();
    StreamGraph g = GraphFixture.lower(spec, diags);
    return CycleDetector.check(g, diags);
  }

  @Test
  public void testCurrentSelfReference() {
    assertEquals(1, check(new SpecBuilder()
        .input("a", "Int32")
        .output("o", bin("+", ref("o"), ref("a")))));
    Diagnostic d = diags.reported().get(0);
    assertEquals(ErrorKind.ILLEGAL_CYCLE, d.getKind());
    assertTrue(d.getMessage(), d.getMessage().contains("o -> o"));
    assertEquals(Arrays.asList(1), d.getStreams());
  }

  @Test
  public void testLookbackSelfReference() {
    assertEquals(0, check(new SpecBuilder()
        .input("a", "Int32")
        .output("o", bin("+", dflt(offset("o", -1), intLit(0)), ref("a")))));
    assertEquals(0, diags.size());
  }

  @Test
  public void testWindowCycle() {
    assertEquals(0, check(new SpecBuilder()
        .input("a", "Int32")
        .output("o", bin("+", window("o", "1s", "count"), intLit(1)))));
    assertEquals(0, diags.size());
  }

  @Test
  public void testLookaheadSelfReference() {
    assertEquals(1, check(new SpecBuilder()
        .output("o", dflt(offset("o", 1), intLit(0)))));
  }

  @Test
  public void testTwoStreamCycle() {
    assertEquals(1, check(new SpecBuilder()
        .output("b", bin("+", ref("c"), intLit(1)))
        .output("c", bin("+", ref("b"), intLit(1)))));
    Diagnostic d = diags.reported().get(0);
    assertTrue(d.getMessage(), d.getMessage().contains("b -> c -> b"));
    assertEquals(Arrays.asList(0, 1), d.getStreams());
  }

  @Test
  public void testEveryEdgeMustReadHistory() {
    // The lookback does not excuse the current read closing the cycle
    assertEquals(1, check(new SpecBuilder()
        .output("b", dflt(offset("c", -1), intLit(0)))
        .output("c", bin("+", ref("b"), intLit(1)))));
    Diagnostic d = diags.reported().get(0);
    assertTrue(d.getMessage(), d.getMessage().contains("c -> b -> c"));
    assertTrue(d.getMessage(), d.getMessage().contains("c reads b"));
  }

  @Test
  public void testOneDiagnosticPerComponent() {
    assertEquals(2, check(new SpecBuilder()
        .output("x", bin("+", ref("y"), intLit(1)))
        .output("y", bin("+", ref("x"), intLit(1)))
        .output("z", bin("*", ref("z"), ref("z")))
        .output("fine", dflt(offset("fine", -2), ref("x")))));
    assertEquals(2, diags.errorCount());
    assertEquals(Arrays.asList(0, 1), diags.reported().get(0).getStreams());
    assertEquals(Arrays.asList(2), diags.reported().get(1).getStreams());
  }

  @Test
  public void testLongChain() {
    int n = 5000;
    SpecBuilder spec = new SpecBuilder().input("s0", "Int64");
    for (int i = 1; i < n; i++) {
      spec.output("s" + i, bin("+", ref("s" + (i - 1)), intLit(1)));
    }
    assertEquals(0, check(spec));
    assertEquals(0, diags.size());
  }

  @Test
  public void testCycleAtEndOfLongChain() {
    int n = 5000;
    SpecBuilder spec = new SpecBuilder()
        .output("s0", bin("+", ref("s" + (n - 1)), intLit(1)));
    for (int i = 1; i < n; i++) {
      spec.output("s" + i, bin("+", ref("s" + (i - 1)), intLit(1)));
    }
    assertEquals(1, check(spec));
    assertEquals(n, diags.reported().get(0).getStreams().size());
  }
}
