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

import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import exm.lola.common.exceptions.InvalidLiteralException;

/**
 * A physical unit: a product of base dimensions with integer exponents,
 * and a scale factor relative to the canonical unit of that dimension.
 * E.g. "ms" is scale 1/1000 with dimension s^1 and "Hz" is scale 1 with
 * dimension s^-1.
 *
 * Two units are equal only if both dimension and scale are equal, so
 * km and m are different units of the same dimension.
 */
public final class Unit {

  public static final Unit DIMENSIONLESS =
      new Unit(Rational.ONE, ImmutableSortedMap.<String, Integer>of());

  public static final String TIME = "s";

  public static final Unit SECOND = base(TIME);
  public static final Unit HERTZ = SECOND.pow(-1);

  /** Symbols that are understood on their own: scale and dimension */
  private static final Map<String, Unit> SYMBOLS;

  /** Symbols that also accept a metric prefix */
  private static final Map<String, Unit> PREFIXABLE;

  private static final Map<String, Rational> PREFIXES;

  static {
    PREFIXABLE = ImmutableMap.<String, Unit>builder()
        .put("s", SECOND)
        .put("Hz", HERTZ)
        .put("m", base("m"))
        .put("g", base("kg").scale(Rational.of(1, 1000)))
        .put("A", base("A"))
        .put("K", base("K"))
        .put("mol", base("mol"))
        .put("cd", base("cd"))
        .put("rad", base("rad"))
        .put("B", base("B"))
        .build();

    SYMBOLS = ImmutableMap.<String, Unit>builder()
        .putAll(PREFIXABLE)
        .put("min", SECOND.scale(Rational.of(60)))
        .put("h", SECOND.scale(Rational.of(3600)))
        .put("d", SECOND.scale(Rational.of(86400)))
        .build();

    PREFIXES = ImmutableMap.<String, Rational>builder()
        .put("n", Rational.of(1, 1000000000))
        .put("u", Rational.of(1, 1000000))
        .put("µ", Rational.of(1, 1000000))
        .put("m", Rational.of(1, 1000))
        .put("c", Rational.of(1, 100))
        .put("k", Rational.of(1000))
        .put("M", Rational.of(1000000))
        .put("G", Rational.of(1000000000))
        .build();
  }

  private final Rational scale;
  private final ImmutableSortedMap<String, Integer> dimensions;

  private Unit(Rational scale, ImmutableSortedMap<String, Integer> dimensions) {
    this.scale = scale;
    this.dimensions = dimensions;
  }

  private static Unit base(String dimension) {
    return new Unit(Rational.ONE, ImmutableSortedMap.of(dimension, 1));
  }

  /**
   * Factor to convert a magnitude in this unit to the canonical unit
   */
  public Rational scale() {
    return scale;
  }

  public Map<String, Integer> dimensions() {
    return dimensions;
  }

  public int exponent(String dimension) {
    Integer e = dimensions.get(dimension);
    return e == null ? 0 : e;
  }

  public boolean isDimensionless() {
    return dimensions.isEmpty();
  }

  public boolean isDuration() {
    return dimensions.size() == 1 && exponent(TIME) == 1;
  }

  public boolean isFrequency() {
    return dimensions.size() == 1 && exponent(TIME) == -1;
  }

  public boolean sameDimension(Unit other) {
    return dimensions.equals(other.dimensions);
  }

  /**
   * @return unit of same dimension with scale 1
   */
  public Unit canonical() {
    if (scale.equals(Rational.ONE)) {
      return this;
    }
    return new Unit(Rational.ONE, dimensions);
  }

  public Unit scale(Rational factor) {
    return new Unit(scale.multiply(factor), dimensions);
  }

  public Unit multiply(Unit other) {
    return combine(other, 1);
  }

  public Unit divide(Unit other) {
    return combine(other, -1);
  }

  public Unit pow(int exponent) {
    TreeMap<String, Integer> dims = new TreeMap<String, Integer>();
    if (exponent != 0) {
      for (Map.Entry<String, Integer> e: dimensions.entrySet()) {
        dims.put(e.getKey(), e.getValue() * exponent);
      }
    }
    return new Unit(scale.pow(exponent), ImmutableSortedMap.copyOf(dims));
  }

  private Unit combine(Unit other, int sign) {
    TreeMap<String, Integer> dims = new TreeMap<String, Integer>(dimensions);
    for (Map.Entry<String, Integer> e: other.dimensions.entrySet()) {
      int exp = exponent(e.getKey()) + sign * e.getValue();
      if (exp == 0) {
        dims.remove(e.getKey());
      } else {
        dims.put(e.getKey(), exp);
      }
    }
    Rational newScale = sign > 0 ? scale.multiply(other.scale)
                                 : scale.divide(other.scale);
    return new Unit(newScale, ImmutableSortedMap.copyOf(dims));
  }

  /**
   * Parse a unit expression such as "m/s", "m/s^2", "kHz", "km*h^-1".
   * The empty string is the dimensionless unit.
   * @param text
   * @return
   * @throws InvalidLiteralException
   */
  public static Unit parse(String text) throws InvalidLiteralException {
    String s = StringUtils.deleteWhitespace(text);
    if (s.isEmpty() || s.equals("1")) {
      return DIMENSIONLESS;
    }

    Unit result = DIMENSIONLESS;
    int sign = 1;
    int pos = 0;
    while (pos < s.length()) {
      int end = pos;
      while (end < s.length() && s.charAt(end) != '*' && s.charAt(end) != '/') {
        end++;
      }
      Unit factor = parseFactor(s.substring(pos, end), text);
      result = sign > 0 ? result.multiply(factor) : result.divide(factor);
      if (end < s.length()) {
        sign = s.charAt(end) == '*' ? 1 : -1;
        if (end == s.length() - 1) {
          throw new InvalidLiteralException("Unit ends with operator: " + text);
        }
      }
      pos = end + 1;
    }
    return result;
  }

  private static Unit parseFactor(String factor, String whole)
      throws InvalidLiteralException {
    if (factor.isEmpty()) {
      throw new InvalidLiteralException("Malformed unit: " + whole);
    }
    String symbol = factor;
    int exponent = 1;
    int caret = factor.indexOf('^');
    if (caret >= 0) {
      symbol = factor.substring(0, caret);
      try {
        exponent = Integer.parseInt(factor.substring(caret + 1));
      } catch (NumberFormatException e) {
        throw new InvalidLiteralException("Bad unit exponent in " + whole);
      }
    }
    if (symbol.equals("1")) {
      return DIMENSIONLESS;
    }
    Unit unit = lookupSymbol(symbol);
    if (unit == null) {
      throw new InvalidLiteralException("Unknown unit '" + symbol + "' in " +
                                        whole);
    }
    return unit.pow(exponent);
  }

  private static Unit lookupSymbol(String symbol) {
    Unit exact = SYMBOLS.get(symbol);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, Rational> prefix: PREFIXES.entrySet()) {
      if (symbol.length() > prefix.getKey().length() &&
          symbol.startsWith(prefix.getKey())) {
        Unit rest = PREFIXABLE.get(symbol.substring(prefix.getKey().length()));
        if (rest != null) {
          return rest.scale(prefix.getValue());
        }
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Unit)) {
      return false;
    }
    Unit other = (Unit) obj;
    return scale.equals(other.scale) && dimensions.equals(other.dimensions);
  }

  @Override
  public int hashCode() {
    return scale.hashCode() * 31 + dimensions.hashCode();
  }

  @Override
  public String toString() {
    if (isDimensionless() && scale.equals(Rational.ONE)) {
      return "1";
    }
    StringBuilder sb = new StringBuilder();
    if (!scale.equals(Rational.ONE)) {
      sb.append(scale);
    }
    for (Map.Entry<String, Integer> e: dimensions.entrySet()) {
      if (sb.length() > 0) {
        sb.append('*');
      }
      sb.append(e.getKey());
      if (e.getValue() != 1) {
        sb.append('^').append(e.getValue());
      }
    }
    return sb.toString();
  }
}
