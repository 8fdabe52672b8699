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
package exm.lola.frontend;

import exm.lola.ast.SourceSpan;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Types.Type;
import exm.lola.ir.Expr;
import exm.lola.ir.MemoryBound;

/**
 * Node of the stream graph.  Created by lowering with its declared
 * information; the inferred fields are filled in by the analysis stages
 * and become read-only once the graph is frozen.
 */
public class Stream {
  public static enum StreamKind {
    INPUT, OUTPUT, TRIGGER;
  }

  private final int id;
  private final String name;
  private final StreamKind kind;
  private final SourceSpan span;

  /** Declared type, null if none */
  private final Type declaredType;
  /** Declared pacing, null if none */
  private final Pacing declaredPacing;
  private final SourceSpan pacingSpan;
  /** Defining expression, null for inputs */
  private Expr expr;
  private final String triggerMessage;

  private boolean frozen = false;
  private Type type;
  private Pacing pacing;
  private MemoryBound memoryBound;
  private int layer = -1;
  private boolean futureDependent = false;

  Stream(int id, String name, StreamKind kind, SourceSpan span,
         Type declaredType, Pacing declaredPacing, SourceSpan pacingSpan,
         String triggerMessage) {
    this.id = id;
    this.name = name;
    this.kind = kind;
    this.span = span;
    this.declaredType = declaredType;
    this.declaredPacing = declaredPacing;
    this.pacingSpan = pacingSpan == null ? span : pacingSpan;
    this.triggerMessage = triggerMessage;
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public StreamKind kind() {
    return kind;
  }

  public boolean isInput() {
    return kind == StreamKind.INPUT;
  }

  public boolean isTrigger() {
    return kind == StreamKind.TRIGGER;
  }

  public SourceSpan span() {
    return span;
  }

  public Type declaredType() {
    return declaredType;
  }

  public Pacing declaredPacing() {
    return declaredPacing;
  }

  public boolean hasDeclaredPacing() {
    return declaredPacing != null;
  }

  public SourceSpan pacingSpan() {
    return pacingSpan;
  }

  public Expr expr() {
    return expr;
  }

  void setExpr(Expr expr) {
    checkNotFrozen();
    this.expr = expr;
  }

  public String triggerMessage() {
    return triggerMessage;
  }

  public Type type() {
    return type;
  }

  public void setType(Type type) {
    checkNotFrozen();
    this.type = type;
  }

  public Pacing pacing() {
    return pacing;
  }

  public void setPacing(Pacing pacing) {
    checkNotFrozen();
    this.pacing = pacing;
  }

  public MemoryBound memoryBound() {
    return memoryBound;
  }

  public void setMemoryBound(MemoryBound memoryBound) {
    checkNotFrozen();
    this.memoryBound = memoryBound;
  }

  /**
   * @return evaluation layer, -1 if not computed
   */
  public int layer() {
    return layer;
  }

  public void setLayer(int layer) {
    checkNotFrozen();
    this.layer = layer;
  }

  /**
   * @return true if the value depends on future values of some stream
   */
  public boolean isFutureDependent() {
    return futureDependent;
  }

  public void setFutureDependent(boolean futureDependent) {
    checkNotFrozen();
    this.futureDependent = futureDependent;
  }

  public boolean isFrozen() {
    return frozen;
  }

  void freeze() {
    this.frozen = true;
  }

  private void checkNotFrozen() {
    if (frozen) {
      throw new LolaRuntimeError("Stream " + name + " modified after " +
                                 "analysis finished");
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.name().toLowerCase()).append(' ').append(name);
    if (type != null) {
      sb.append(": ").append(type.typeName());
    }
    if (pacing != null) {
      sb.append(" @ ").append(pacing);
    }
    return sb.toString();
  }
}
