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

import java.util.HashMap;
import java.util.Map;

/**
 * Operators of the expression language, grouped by their typing rule.
 */
public class Operators {

  /**
   * Typing rule shared by a group of operators
   */
  public static enum OpCategory {
    /** Numeric operands of one type, unit preserved */
    ADDITIVE,
    /** Numeric operands of one kind, units combined */
    MULTIPLICATIVE,
    /** Integer operands, unit of the left operand */
    REMAINDER,
    /** Numeric operands, dimensionless */
    POWER,
    /** Bool operands, Bool result */
    LOGICAL,
    /** Operands of one type, Bool result */
    EQUALITY,
    /** Numeric operands of one type, Bool result */
    ORDERING;
  }

  public static enum BinaryOp {
    ADD("+", OpCategory.ADDITIVE),
    SUB("-", OpCategory.ADDITIVE),
    MUL("*", OpCategory.MULTIPLICATIVE),
    DIV("/", OpCategory.MULTIPLICATIVE),
    REM("%", OpCategory.REMAINDER),
    POW("**", OpCategory.POWER),
    AND("&&", OpCategory.LOGICAL),
    OR("||", OpCategory.LOGICAL),
    EQ("==", OpCategory.EQUALITY),
    NE("!=", OpCategory.EQUALITY),
    LT("<", OpCategory.ORDERING),
    LE("<=", OpCategory.ORDERING),
    GT(">", OpCategory.ORDERING),
    GE(">=", OpCategory.ORDERING);

    private final String symbol;
    private final OpCategory category;

    private BinaryOp(String symbol, OpCategory category) {
      this.symbol = symbol;
      this.category = category;
    }

    public String symbol() {
      return symbol;
    }

    public OpCategory category() {
      return category;
    }

    public boolean producesBool() {
      return category == OpCategory.LOGICAL ||
             category == OpCategory.EQUALITY ||
             category == OpCategory.ORDERING;
    }
  }

  public static enum UnaryOp {
    NOT("!"),
    NEG("-");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  private static final Map<String, BinaryOp> binaryBySymbol =
      new HashMap<String, BinaryOp>();
  static {
    for (BinaryOp op: BinaryOp.values()) {
      binaryBySymbol.put(op.symbol(), op);
    }
  }

  /**
   * @return the binary operator with this symbol, or null
   */
  public static BinaryOp binaryOp(String symbol) {
    return binaryBySymbol.get(symbol);
  }

  public static UnaryOp unaryOp(String symbol) {
    for (UnaryOp op: UnaryOp.values()) {
      if (op.symbol().equals(symbol)) {
        return op;
      }
    }
    return null;
  }
}
