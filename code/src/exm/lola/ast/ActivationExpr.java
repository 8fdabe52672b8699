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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Boolean formula over stream names in an activation condition
 */
public class ActivationExpr {
  public static enum Op {
    NAME, AND, OR;
  }

  private final Op op;
  private final String name;
  private final List<ActivationExpr> operands;
  private final SourceSpan span;

  private ActivationExpr(Op op, String name, List<ActivationExpr> operands,
                         SourceSpan span) {
    this.op = op;
    this.name = name;
    this.operands = ImmutableList.copyOf(operands);
    this.span = span == null ? SourceSpan.UNKNOWN : span;
  }

  public static ActivationExpr name(String name, SourceSpan span) {
    return new ActivationExpr(Op.NAME, name,
                              ImmutableList.<ActivationExpr>of(), span);
  }

  public static ActivationExpr and(List<ActivationExpr> operands,
                                   SourceSpan span) {
    return new ActivationExpr(Op.AND, null, operands, span);
  }

  public static ActivationExpr or(List<ActivationExpr> operands,
                                  SourceSpan span) {
    return new ActivationExpr(Op.OR, null, operands, span);
  }

  public Op getOp() {
    return op;
  }

  public String getName() {
    return name;
  }

  public List<ActivationExpr> getOperands() {
    return operands;
  }

  public SourceSpan getSpan() {
    return span;
  }
}
