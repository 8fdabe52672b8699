package exm.lola.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class ActivationTest {

  private static final Activation A = Activation.of(0);
  private static final Activation B = Activation.of(1);
  private static final Activation C = Activation.of(2);

  @Test
  public void testNormalForm() {
    assertEquals("#0 | #1", A.or(B).toString());
    assertEquals("#0 & #1", A.and(B).toString());
    assertEquals("Operand order does not matter", B.or(A), A.or(B));
    assertEquals(Activation.anyOf(Arrays.asList(1, 0)), A.or(B));
    assertEquals(Activation.allOf(Arrays.asList(1, 0)), B.and(A));
  }

  @Test
  public void testAbsorption() {
    // a | (a & b) == a
    assertEquals(A, A.or(A.and(B)));
    // a & (a | b) == a
    assertEquals(A, A.and(A.or(B)));
    assertEquals(A, A.or(A));
  }

  @Test
  public void testDistribution() {
    Activation e = A.or(B).and(C);
    assertEquals("(#0 & #2) | (#1 & #2)", e.toString());
    assertEquals(Arrays.asList(0, 1, 2),
                 Arrays.asList(e.streams().toArray(new Integer[0])));
  }

  @Test
  public void testImplies() {
    assertTrue(A.and(B).implies(A));
    assertTrue(A.implies(A.or(B)));
    assertFalse(A.or(B).implies(A));
    assertFalse(A.implies(A.and(B)));
  }

  @Test
  public void testPacingEquality() {
    assertEquals(Pacing.eventDriven(A.or(B)), Pacing.eventDriven(B.or(A)));
    assertEquals(Pacing.periodic(Rational.of(10)),
                 Pacing.periodic(Rational.of(20, 2)));
    assertFalse(Pacing.periodic(Rational.of(10)).equals(
                Pacing.eventDriven(A)));
    assertEquals(Rational.of(1, 10),
                 Pacing.periodic(Rational.of(10)).period());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testZeroFrequency() {
    Pacing.periodic(Rational.ZERO);
  }
}
