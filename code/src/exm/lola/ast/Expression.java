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
 * Expression tree node as produced by the parser
 */
public abstract class Expression {
  public static enum ExprKind {
    LITERAL, STREAM, WINDOW, BINARY, UNARY, ITE, TUPLE, TUPLE_ACCESS, CALL,
    DEFAULT;
  }

  private final SourceSpan span;

  protected Expression(SourceSpan span) {
    this.span = span == null ? SourceSpan.UNKNOWN : span;
  }

  public abstract ExprKind getKind();

  public SourceSpan getSpan() {
    return span;
  }
}
