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

import com.google.common.base.Preconditions;

/**
 * Explicit pacing: either a frequency or period literal such as
 * <code>@10Hz</code> / <code>@100ms</code>, or an activation condition
 * such as <code>@(a &amp; b)</code>.
 */
public class PacingAnnotation {
  private final String frequency;
  private final ActivationExpr activation;
  private final SourceSpan span;

  private PacingAnnotation(String frequency, ActivationExpr activation,
                           SourceSpan span) {
    this.frequency = frequency;
    this.activation = activation;
    this.span = span == null ? SourceSpan.UNKNOWN : span;
  }

  public static PacingAnnotation frequency(String literal, SourceSpan span) {
    Preconditions.checkNotNull(literal);
    return new PacingAnnotation(literal, null, span);
  }

  public static PacingAnnotation activation(ActivationExpr condition,
                                            SourceSpan span) {
    Preconditions.checkNotNull(condition);
    return new PacingAnnotation(null, condition, span);
  }

  public boolean isFrequency() {
    return frequency != null;
  }

  public String getFrequency() {
    return frequency;
  }

  public ActivationExpr getActivation() {
    return activation;
  }

  public SourceSpan getSpan() {
    return span;
  }
}
