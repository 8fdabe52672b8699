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
 * Sliding window: <code>x.aggregate(over: 5s, using: sum)</code>
 */
public class WindowExpr extends Expression {
  private final String name;
  private final String duration;
  private final String operation;

  public WindowExpr(SourceSpan span, String name, String duration,
                    String operation) {
    super(span);
    this.name = name;
    this.duration = duration;
    this.operation = operation;
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.WINDOW;
  }

  public String getName() {
    return name;
  }

  /**
   * @return duration literal as written, e.g. "5s" or "500ms"
   */
  public String getDuration() {
    return duration;
  }

  public String getOperation() {
    return operation;
  }
}
