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
 * <code>output name [: Type] [@ pacing] := expression</code>
 */
public class OutputDeclaration extends Declaration {
  private final TypeAnnotation type;
  private final Expression expression;

  public OutputDeclaration(String name, SourceSpan span, TypeAnnotation type,
                           PacingAnnotation pacing, Expression expression) {
    super(name, span, pacing);
    this.type = type;
    this.expression = expression;
  }

  @Override
  public DeclKind getKind() {
    return DeclKind.OUTPUT;
  }

  /**
   * @return declared type, or null if it is to be inferred
   */
  public TypeAnnotation getType() {
    return type;
  }

  public Expression getExpression() {
    return expression;
  }
}
