package exm.lola.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;

import org.junit.Test;

public class RationalTest {

  @Test
  public void testNormalised() {
    assertEquals(Rational.of(1, 2), Rational.of(2, 4));
    assertEquals(Rational.of(-1, 2), Rational.of(1, -2));
    assertEquals(BigInteger.valueOf(2), Rational.of(-6, -3).numerator());
    assertEquals(Rational.ZERO, Rational.of(0, 5));
    assertEquals("3/4", Rational.of(6, 8).toString());
    assertEquals("5", Rational.of(10, 2).toString());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testZeroDenominator() {
    Rational.of(1, 0);
  }

  @Test
  public void testParseDecimal() {
    assertEquals(Rational.of(5, 2), Rational.parseDecimal("2.5"));
    assertEquals(Rational.of(1, 1000), Rational.parseDecimal("1e-3"));
    assertEquals(Rational.of(100), Rational.parseDecimal("100"));
    assertEquals(Rational.of(1, 10), Rational.parseDecimal("0.100"));
  }

  @Test
  public void testArithmetic() {
    Rational third = Rational.of(1, 3);
    Rational half = Rational.of(1, 2);
    assertEquals(Rational.of(5, 6), third.add(half));
    assertEquals(Rational.of(-1, 6), third.subtract(half));
    assertEquals(Rational.of(1, 6), third.multiply(half));
    assertEquals(Rational.of(2, 3), third.divide(half));
    assertEquals(Rational.of(3), third.reciprocal());
    assertEquals(Rational.of(9), third.pow(-2));
  }

  @Test
  public void testGcdLcm() {
    // Periods 1/10 s and 1/4 s: steps of 1/20 s, repeating every 1/2 s
    Rational a = Rational.of(1, 10);
    Rational b = Rational.of(1, 4);
    assertEquals(Rational.of(1, 20), a.gcd(b));
    assertEquals(Rational.of(1, 2), a.lcm(b));
    assertEquals(Rational.of(3), Rational.of(6).gcd(Rational.of(9)));
    assertEquals(Rational.of(18), Rational.of(6).lcm(Rational.of(9)));
    assertEquals(a, a.gcd(Rational.ZERO));
  }

  @Test
  public void testMultiples() {
    assertTrue(Rational.of(10).isMultipleOf(Rational.of(5)));
    assertFalse(Rational.of(10).isMultipleOf(Rational.of(3)));
    assertTrue(Rational.of(1, 2).isMultipleOf(Rational.of(1, 4)));
    assertFalse(Rational.of(1, 2).isMultipleOf(Rational.of(1, 3)));
  }

  @Test
  public void testRounding() {
    assertEquals(BigInteger.valueOf(5), Rational.of(9, 2).ceil());
    assertEquals(BigInteger.valueOf(4), Rational.of(9, 2).floor());
    assertEquals(BigInteger.valueOf(4), Rational.of(4).ceil());
    assertEquals(BigInteger.valueOf(-5), Rational.of(-9, 2).floor());
    assertEquals(BigInteger.valueOf(-4), Rational.of(-9, 2).ceil());
  }

  @Test
  public void testOrdering() {
    assertTrue(Rational.of(1, 3).compareTo(Rational.of(1, 2)) < 0);
    assertEquals(Rational.of(1, 2), Rational.of(1, 3).max(Rational.of(1, 2)));
    assertEquals(Rational.of(1, 3), Rational.of(1, 3).min(Rational.of(1, 2)));
  }
}
