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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

import exm.lola.common.exceptions.LolaRuntimeError;

/**
 * Concrete value types of streams, as they are after inference.
 *
 * Numeric types carry a physical unit; the dimensionless unit is the
 * default.  Partially known types during inference are represented
 * separately by the type checker.
 */
public class Types {

  /**
   * The numeric representations of the language
   */
  public static enum NumKind {
    INT8(8, true, false), INT16(16, true, false),
    INT32(32, true, false), INT64(64, true, false),
    UINT8(8, false, false), UINT16(16, false, false),
    UINT32(32, false, false), UINT64(64, false, false),
    FLOAT32(32, true, true), FLOAT64(64, true, true);

    private final int bits;
    private final boolean signed;
    private final boolean floating;

    private NumKind(int bits, boolean signed, boolean floating) {
      this.bits = bits;
      this.signed = signed;
      this.floating = floating;
    }

    public int bits() {
      return bits;
    }

    public boolean isSigned() {
      return signed;
    }

    public boolean isFloat() {
      return floating;
    }

    public boolean isInteger() {
      return !floating;
    }

    public String typeName() {
      switch (this) {
        case INT8: return "Int8";
        case INT16: return "Int16";
        case INT32: return "Int32";
        case INT64: return "Int64";
        case UINT8: return "UInt8";
        case UINT16: return "UInt16";
        case UINT32: return "UInt32";
        case UINT64: return "UInt64";
        case FLOAT32: return "Float32";
        case FLOAT64: return "Float64";
        default:
          throw new LolaRuntimeError("typeName not implemented for " + this);
      }
    }

    public static NumKind fromName(String name) {
      for (NumKind k: values()) {
        if (k.typeName().equals(name)) {
          return k;
        }
      }
      return null;
    }

    public static Set<NumKind> all() {
      return EnumSet.allOf(NumKind.class);
    }

    public static Set<NumKind> integers() {
      return EnumSet.range(INT8, UINT64);
    }

    public static Set<NumKind> floats() {
      return EnumSet.of(FLOAT32, FLOAT64);
    }

    public static Set<NumKind> signed() {
      return EnumSet.of(INT8, INT16, INT32, INT64, FLOAT32, FLOAT64);
    }
  }

  public static enum TypeKind {
    BOOL, STRING, NUMERIC, OPTION, TUPLE,
    /** Placeholder for expressions whose error was already reported */
    ERROR;
  }

  public abstract static class Type {
    public abstract TypeKind kind();

    public abstract String typeName();

    public boolean isNumeric() {
      return kind() == TypeKind.NUMERIC;
    }

    public boolean isError() {
      return kind() == TypeKind.ERROR;
    }

    /**
     * @return true if this type or a component is the error placeholder
     */
    public boolean containsError() {
      return isError();
    }

    @Override
    public String toString() {
      return typeName();
    }
  }

  private static final class SimpleType extends Type {
    private final TypeKind kind;
    private final String name;

    private SimpleType(TypeKind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public TypeKind kind() {
      return kind;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof SimpleType && ((SimpleType) other).kind == kind;
    }

    @Override
    public int hashCode() {
      return kind.hashCode();
    }
  }

  public static final class NumericType extends Type {
    private final NumKind numKind;
    private final Unit unit;

    private NumericType(NumKind numKind, Unit unit) {
      this.numKind = numKind;
      this.unit = unit;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.NUMERIC;
    }

    public NumKind numKind() {
      return numKind;
    }

    public Unit unit() {
      return unit;
    }

    @Override
    public String typeName() {
      if (unit.isDimensionless() && unit.scale().equals(Rational.ONE)) {
        return numKind.typeName();
      }
      return numKind.typeName() + "[" + unit + "]";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof NumericType)) {
        return false;
      }
      NumericType o = (NumericType) other;
      return numKind == o.numKind && unit.equals(o.unit);
    }

    @Override
    public int hashCode() {
      return numKind.hashCode() * 31 + unit.hashCode();
    }
  }

  public static final class OptionType extends Type {
    private final Type inner;

    private OptionType(Type inner) {
      this.inner = inner;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.OPTION;
    }

    public Type inner() {
      return inner;
    }

    @Override
    public boolean containsError() {
      return inner.containsError();
    }

    @Override
    public String typeName() {
      return "Option<" + inner.typeName() + ">";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OptionType &&
          inner.equals(((OptionType) other).inner);
    }

    @Override
    public int hashCode() {
      return inner.hashCode() * 13 + 1;
    }
  }

  /**
   * A type with multiple fields.
   */
  public static final class TupleType extends Type {
    private final List<Type> fields;

    private TupleType(List<Type> fields) {
      this.fields = Collections.unmodifiableList(new ArrayList<Type>(fields));
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TUPLE;
    }

    public List<Type> fields() {
      return fields;
    }

    public int numFields() {
      return fields.size();
    }

    public Type field(int i) {
      return fields.get(i);
    }

    @Override
    public boolean containsError() {
      for (Type f: fields) {
        if (f.containsError()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String typeName() {
      StringBuilder sb = new StringBuilder();
      sb.append("(");
      boolean first = true;
      for (Type field: fields) {
        if (!first) {
          sb.append(", ");
        }
        sb.append(field.typeName());
        first = false;
      }
      sb.append(")");
      return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TupleType &&
          fields.equals(((TupleType) other).fields);
    }

    @Override
    public int hashCode() {
      return fields.hashCode();
    }
  }

  public static final Type BOOL = new SimpleType(TypeKind.BOOL, "Bool");
  public static final Type STRING = new SimpleType(TypeKind.STRING, "String");
  public static final Type ERROR = new SimpleType(TypeKind.ERROR, "<error>");

  public static final NumericType INT8 = numeric(NumKind.INT8);
  public static final NumericType INT16 = numeric(NumKind.INT16);
  public static final NumericType INT32 = numeric(NumKind.INT32);
  public static final NumericType INT64 = numeric(NumKind.INT64);
  public static final NumericType UINT8 = numeric(NumKind.UINT8);
  public static final NumericType UINT16 = numeric(NumKind.UINT16);
  public static final NumericType UINT32 = numeric(NumKind.UINT32);
  public static final NumericType UINT64 = numeric(NumKind.UINT64);
  public static final NumericType FLOAT32 = numeric(NumKind.FLOAT32);
  public static final NumericType FLOAT64 = numeric(NumKind.FLOAT64);

  public static NumericType numeric(NumKind kind) {
    return new NumericType(kind, Unit.DIMENSIONLESS);
  }

  public static NumericType numeric(NumKind kind, Unit unit) {
    Preconditions.checkNotNull(unit);
    return new NumericType(kind, unit);
  }

  public static Type option(Type inner) {
    return new OptionType(inner);
  }

  public static Type tuple(List<Type> fields) {
    return new TupleType(fields);
  }

  /**
   * Look up a primitive type by its name in the language
   * @return null if not a primitive type name
   */
  public static Type primitiveByName(String name) {
    if (name.equals("Bool")) {
      return BOOL;
    } else if (name.equals("String")) {
      return STRING;
    }
    NumKind k = NumKind.fromName(name);
    if (k != null) {
      return numeric(k);
    }
    return null;
  }
}
