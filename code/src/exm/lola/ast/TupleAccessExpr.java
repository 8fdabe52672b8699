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
 * Projection <code>e.i</code>, zero-based
 */
public class TupleAccessExpr extends Expression {
  private final Expression target;
  private final int index;

  public TupleAccessExpr(SourceSpan span, Expression target, int index) {
    super(span);
    this.target = target;
    this.index = index;
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.TUPLE_ACCESS;
  }

  public Expression getTarget() {
    return target;
  }

  public int getIndex() {
    return index;
  }
}
