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
package exm.lola.common.lang;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.google.common.base.Preconditions;

/**
 * Exact rational number, always kept in lowest terms with a positive
 * denominator.  Used for every frequency and duration so that clock
 * comparisons never depend on floating point rounding.
 */
public final class Rational implements Comparable<Rational> {

  public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

  private final BigInteger num;
  private final BigInteger den;

  private Rational(BigInteger num, BigInteger den) {
    this.num = num;
    this.den = den;
  }

  public static Rational of(long value) {
    return of(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static Rational of(long num, long den) {
    return of(BigInteger.valueOf(num), BigInteger.valueOf(den));
  }

  public static Rational of(BigInteger num, BigInteger den) {
    Preconditions.checkArgument(den.signum() != 0, "Zero denominator");
    if (den.signum() < 0) {
      num = num.negate();
      den = den.negate();
    }
    BigInteger g = num.gcd(den);
    if (!g.equals(BigInteger.ONE) && g.signum() != 0) {
      num = num.divide(g);
      den = den.divide(g);
    }
    if (num.signum() == 0) {
      return ZERO;
    }
    return new Rational(num, den);
  }

  /**
   * Parse a decimal literal exactly, e.g. "2.5" is 5/2, "1e-3" is 1/1000.
   * @throws NumberFormatException if not a decimal number
   */
  public static Rational parseDecimal(String text) {
    BigDecimal dec = new BigDecimal(text.trim());
    if (dec.scale() <= 0) {
      return of(dec.toBigIntegerExact(), BigInteger.ONE);
    }
    return of(dec.unscaledValue(), BigInteger.TEN.pow(dec.scale()));
  }

  public BigInteger numerator() {
    return num;
  }

  public BigInteger denominator() {
    return den;
  }

  public int signum() {
    return num.signum();
  }

  public boolean isZero() {
    return num.signum() == 0;
  }

  public boolean isPositive() {
    return num.signum() > 0;
  }

  public boolean isInteger() {
    return den.equals(BigInteger.ONE);
  }

  public Rational add(Rational o) {
    return of(num.multiply(o.den).add(o.num.multiply(den)), den.multiply(o.den));
  }

  public Rational subtract(Rational o) {
    return of(num.multiply(o.den).subtract(o.num.multiply(den)),
              den.multiply(o.den));
  }

  public Rational multiply(Rational o) {
    return of(num.multiply(o.num), den.multiply(o.den));
  }

  public Rational multiply(long factor) {
    return multiply(of(factor));
  }

  public Rational divide(Rational o) {
    Preconditions.checkArgument(!o.isZero(), "Division by zero");
    return of(num.multiply(o.den), den.multiply(o.num));
  }

  public Rational reciprocal() {
    return ONE.divide(this);
  }

  public Rational negate() {
    return of(num.negate(), den);
  }

  public Rational pow(int exponent) {
    if (exponent >= 0) {
      return of(num.pow(exponent), den.pow(exponent));
    } else {
      return reciprocal().pow(-exponent);
    }
  }

  /**
   * Largest rational g such that this/g and other/g are both integers.
   * gcd(a/b, c/d) = gcd(a, c) / lcm(b, d)
   */
  public Rational gcd(Rational other) {
    checkNonNegative(this);
    checkNonNegative(other);
    if (this.isZero()) {
      return other;
    } else if (other.isZero()) {
      return this;
    }
    return of(num.gcd(other.num), lcm(den, other.den));
  }

  /**
   * Smallest rational l such that l/this and l/other are both integers.
   * lcm(a/b, c/d) = lcm(a, c) / gcd(b, d)
   */
  public Rational lcm(Rational other) {
    checkNonNegative(this);
    checkNonNegative(other);
    if (this.isZero() || other.isZero()) {
      return ZERO;
    }
    return of(lcm(num, other.num), den.gcd(other.den));
  }

  /**
   * @return true if this is an exact integer multiple of divisor
   */
  public boolean isMultipleOf(Rational divisor) {
    Preconditions.checkArgument(!divisor.isZero(), "Zero divisor");
    return divide(divisor).isInteger();
  }

  /**
   * Round up to the next integer
   */
  public BigInteger ceil() {
    BigInteger[] qr = num.divideAndRemainder(den);
    if (qr[1].signum() > 0) {
      return qr[0].add(BigInteger.ONE);
    }
    return qr[0];
  }

  public BigInteger floor() {
    BigInteger[] qr = num.divideAndRemainder(den);
    if (qr[1].signum() < 0) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  public Rational max(Rational o) {
    return compareTo(o) >= 0 ? this : o;
  }

  public Rational min(Rational o) {
    return compareTo(o) <= 0 ? this : o;
  }

  private static BigInteger lcm(BigInteger a, BigInteger b) {
    return a.divide(a.gcd(b)).multiply(b).abs();
  }

  private static void checkNonNegative(Rational r) {
    Preconditions.checkArgument(r.signum() >= 0,
                                "Expected non-negative rational: %s", r);
  }

  @Override
  public int compareTo(Rational o) {
    return num.multiply(o.den).compareTo(o.num.multiply(den));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Rational)) {
      return false;
    }
    Rational other = (Rational) obj;
    return num.equals(other.num) && den.equals(other.den);
  }

  @Override
  public int hashCode() {
    return num.hashCode() * 31 + den.hashCode();
  }

  @Override
  public String toString() {
    if (isInteger()) {
      return num.toString();
    }
    return num + "/" + den;
  }
}
