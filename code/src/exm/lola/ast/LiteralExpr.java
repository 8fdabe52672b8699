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
package exm.lola.ast;

/**
 * Constant as written in the source, e.g. <code>3</code>,
 * <code>2.5</code>, <code>true</code>, <code>"text"</code>, optionally
 * with a unit such as <code>5m</code>
 */
public class LiteralExpr extends Expression {
  public static enum LiteralKind {
    INTEGER, FLOAT, BOOL, STRING;
  }

  private final LiteralKind literalKind;
  private final String text;
  private final String unit;

  public LiteralExpr(SourceSpan span, LiteralKind literalKind, String text,
                     String unit) {
    super(span);
    this.literalKind = literalKind;
    this.text = text;
    this.unit = unit;
  }

  public LiteralExpr(SourceSpan span, LiteralKind literalKind, String text) {
    this(span, literalKind, text, null);
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.LITERAL;
  }

  public LiteralKind getLiteralKind() {
    return literalKind;
  }

  public String getText() {
    return text;
  }

  /**
   * @return the unit suffix, or null
   */
  public String getUnit() {
    return unit;
  }
}
