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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import exm.lola.common.exceptions.InvalidLiteralException;
import exm.lola.common.exceptions.UnitMismatchException;

/**
 * An exact magnitude with a physical unit.  Quantities are always
 * canonicalized on construction: the magnitude is converted to the
 * canonical unit of its dimension, so 100ms is stored as 1/10 s.
 */
public final class Quantity implements Comparable<Quantity> {

  private static final Pattern LITERAL =
      Pattern.compile("\\s*([0-9]+(?:\\.[0-9]+)?(?:[eE][-+]?[0-9]+)?)\\s*(.*)");

  private final Rational magnitude;
  private final Unit unit;

  private Quantity(Rational magnitude, Unit unit) {
    this.magnitude = magnitude;
    this.unit = unit;
  }

  public static Quantity of(Rational magnitude, Unit unit) {
    return new Quantity(magnitude.multiply(unit.scale()), unit.canonical());
  }

  public static Quantity seconds(Rational seconds) {
    return new Quantity(seconds, Unit.SECOND);
  }

  public static Quantity hertz(Rational hertz) {
    return new Quantity(hertz, Unit.HERTZ);
  }

  /**
   * Parse a literal such as "10Hz", "2.5 s", "100ms" or "3"
   * @param text
   * @return canonicalized quantity
   * @throws InvalidLiteralException
   */
  public static Quantity parse(String text) throws InvalidLiteralException {
    Matcher m = LITERAL.matcher(text);
    if (!m.matches()) {
      throw new InvalidLiteralException("Malformed quantity literal: '" +
                                        text + "'");
    }
    Rational magnitude;
    try {
      magnitude = Rational.parseDecimal(m.group(1));
    } catch (NumberFormatException e) {
      throw new InvalidLiteralException("Malformed number in literal: '" +
                                        text + "'");
    }
    return of(magnitude, Unit.parse(m.group(2)));
  }

  /** Magnitude in the canonical unit */
  public Rational magnitude() {
    return magnitude;
  }

  public Unit unit() {
    return unit;
  }

  public boolean isDuration() {
    return unit.isDuration();
  }

  public boolean isFrequency() {
    return unit.isFrequency();
  }

  public Quantity add(Quantity other) throws UnitMismatchException {
    checkSameDimension(other, "add");
    return new Quantity(magnitude.add(other.magnitude), unit);
  }

  public Quantity subtract(Quantity other) throws UnitMismatchException {
    checkSameDimension(other, "subtract");
    return new Quantity(magnitude.subtract(other.magnitude), unit);
  }

  public Quantity multiply(Quantity other) {
    return new Quantity(magnitude.multiply(other.magnitude),
                        unit.multiply(other.unit).canonical());
  }

  public Quantity divide(Quantity other) {
    return new Quantity(magnitude.divide(other.magnitude),
                        unit.divide(other.unit).canonical());
  }

  /**
   * Compare two quantities of the same dimension
   * @throws UnitMismatchException if dimensions differ
   */
  public int compareWith(Quantity other) throws UnitMismatchException {
    checkSameDimension(other, "compare");
    return magnitude.compareTo(other.magnitude);
  }

  /**
   * Interpret this quantity as a frequency in Hz.  A duration is taken to
   * be the period, e.g. 100ms is 10Hz.
   * @throws UnitMismatchException if neither a frequency nor a duration
   */
  public Rational toFrequency() throws UnitMismatchException {
    if (isFrequency()) {
      return magnitude;
    } else if (isDuration()) {
      Preconditions.checkArgument(magnitude.isPositive(),
                                  "Zero period: %s", this);
      return magnitude.reciprocal();
    }
    throw new UnitMismatchException("Expected a frequency or a period but " +
                                    "found unit " + unit);
  }

  /**
   * @return length of this duration in seconds
   * @throws UnitMismatchException if not a duration
   */
  public Rational toSeconds() throws UnitMismatchException {
    if (!isDuration()) {
      throw new UnitMismatchException("Expected a duration but found unit " +
                                      unit);
    }
    return magnitude;
  }

  private void checkSameDimension(Quantity other, String op)
      throws UnitMismatchException {
    if (!unit.sameDimension(other.unit)) {
      throw new UnitMismatchException("Cannot " + op + " " + this +
                                      " and " + other + ": units " + unit +
                                      " and " + other.unit + " differ");
    }
  }

  @Override
  public int compareTo(Quantity o) {
    Preconditions.checkArgument(unit.sameDimension(o.unit),
                                "Comparing %s with %s", this, o);
    return magnitude.compareTo(o.magnitude);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Quantity)) {
      return false;
    }
    Quantity other = (Quantity) obj;
    return magnitude.equals(other.magnitude) && unit.equals(other.unit);
  }

  @Override
  public int hashCode() {
    return magnitude.hashCode() * 31 + unit.hashCode();
  }

  @Override
  public String toString() {
    if (unit.isDimensionless()) {
      return magnitude.toString();
    }
    return magnitude + " " + unit;
  }
}
