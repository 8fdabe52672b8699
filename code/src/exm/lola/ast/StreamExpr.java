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
 * A reference to a stream by name: plain <code>x</code>,
 * <code>x.offset(by: n)</code> or <code>x.hold()</code>
 */
public class StreamExpr extends Expression {
  public static enum AccessSyntax {
    SYNC, OFFSET, HOLD;
  }

  private final String name;
  private final AccessSyntax access;
  private final int offset;

  public StreamExpr(SourceSpan span, String name, AccessSyntax access,
                    int offset) {
    super(span);
    this.name = name;
    this.access = access;
    this.offset = offset;
  }

  public static StreamExpr sync(SourceSpan span, String name) {
    return new StreamExpr(span, name, AccessSyntax.SYNC, 0);
  }

  public static StreamExpr offset(SourceSpan span, String name, int offset) {
    return new StreamExpr(span, name, AccessSyntax.OFFSET, offset);
  }

  public static StreamExpr hold(SourceSpan span, String name) {
    return new StreamExpr(span, name, AccessSyntax.HOLD, 0);
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.STREAM;
  }

  public String getName() {
    return name;
  }

  public AccessSyntax getAccess() {
    return access;
  }

  public int getOffset() {
    return offset;
  }
}
