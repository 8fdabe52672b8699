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
 * <code>e.defaults(to: d)</code>
 */
public class DefaultExpr extends Expression {
  private final Expression expr;
  private final Expression defaultValue;

  public DefaultExpr(SourceSpan span, Expression expr,
                     Expression defaultValue) {
    super(span);
    this.expr = expr;
    this.defaultValue = defaultValue;
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.DEFAULT;
  }

  public Expression getExpr() {
    return expr;
  }

  public Expression getDefault() {
    return defaultValue;
  }
}
