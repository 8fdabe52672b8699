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
 * <code>if c then a else b</code>
 */
public class IteExpr extends Expression {
  private final Expression condition;
  private final Expression thenExpr;
  private final Expression elseExpr;

  public IteExpr(SourceSpan span, Expression condition, Expression thenExpr,
                 Expression elseExpr) {
    super(span);
    this.condition = condition;
    this.thenExpr = thenExpr;
    this.elseExpr = elseExpr;
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.ITE;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getThen() {
    return thenExpr;
  }

  public Expression getElse() {
    return elseExpr;
  }
}
