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
 * A top-level input, output or trigger declaration.
 */
public abstract class Declaration {
  public static enum DeclKind {
    INPUT, OUTPUT, TRIGGER;
  }

  private final String name;
  private final SourceSpan span;
  private final PacingAnnotation pacing;

  protected Declaration(String name, SourceSpan span, PacingAnnotation pacing) {
    this.name = name;
    this.span = span == null ? SourceSpan.UNKNOWN : span;
    this.pacing = pacing;
  }

  public abstract DeclKind getKind();

  /**
   * @return declared name, null for anonymous triggers
   */
  public String getName() {
    return name;
  }

  public SourceSpan getSpan() {
    return span;
  }

  /**
   * @return explicit pacing, or null if not annotated
   */
  public PacingAnnotation getPacing() {
    return pacing;
  }
}
