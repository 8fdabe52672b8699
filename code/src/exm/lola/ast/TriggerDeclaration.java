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
 * <code>trigger [@ pacing] condition ["message"]</code>
 */
public class TriggerDeclaration extends Declaration {
  private final Expression condition;
  private final String message;

  public TriggerDeclaration(String name, SourceSpan span,
        PacingAnnotation pacing, Expression condition, String message) {
    super(name, span, pacing);
    this.condition = condition;
    this.message = message;
  }

  @Override
  public DeclKind getKind() {
    return DeclKind.TRIGGER;
  }

  public Expression getCondition() {
    return condition;
  }

  public String getMessage() {
    return message;
  }
}
