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
package exm.lola.common.lang;

import com.google.common.base.Preconditions;

/**
 * Temporal offset at which one stream reads another: the annotation on
 * each edge of the stream graph.
 */
public final class StreamAccess {

  public static enum AccessKind {
    /** Synchronous read of the value computed in the same cycle */
    CURRENT,
    /** Value n evaluation cycles in the past, n >= 0 */
    LOOKBACK,
    /** Value n evaluation cycles in the future, n > 0 */
    LOOKAHEAD,
    /** Aggregation over a trailing duration */
    WINDOW,
    /** Latest available value, regardless of the reader's clock */
    HOLD;
  }

  public static final StreamAccess CURRENT =
      new StreamAccess(AccessKind.CURRENT, 0, null, null);
  public static final StreamAccess HOLD =
      new StreamAccess(AccessKind.HOLD, 0, null, null);

  private final AccessKind kind;
  private final int offset;
  /** Window length in seconds, only for windows */
  private final Rational duration;
  private final WindowOperation op;

  private StreamAccess(AccessKind kind, int offset, Rational duration,
                       WindowOperation op) {
    this.kind = kind;
    this.offset = offset;
    this.duration = duration;
    this.op = op;
  }

  public static StreamAccess lookback(int n) {
    Preconditions.checkArgument(n >= 0, "Negative lookback: %s", n);
    return new StreamAccess(AccessKind.LOOKBACK, n, null, null);
  }

  public static StreamAccess lookahead(int n) {
    Preconditions.checkArgument(n > 0, "Lookahead must be positive: %s", n);
    return new StreamAccess(AccessKind.LOOKAHEAD, n, null, null);
  }

  public static StreamAccess window(Rational seconds, WindowOperation op) {
    Preconditions.checkArgument(seconds.isPositive(),
                                "Window duration must be positive: %s", seconds);
    Preconditions.checkNotNull(op);
    return new StreamAccess(AccessKind.WINDOW, 0, seconds, op);
  }

  /**
   * Access implied by offset syntax: negative is lookback, positive is
   * lookahead, zero is lookback(0).
   */
  public static StreamAccess fromOffset(int offset) {
    if (offset > 0) {
      return lookahead(offset);
    } else {
      return lookback(-offset);
    }
  }

  public AccessKind kind() {
    return kind;
  }

  public int offset() {
    return offset;
  }

  public Rational duration() {
    Preconditions.checkState(kind == AccessKind.WINDOW);
    return duration;
  }

  public WindowOperation windowOp() {
    Preconditions.checkState(kind == AccessKind.WINDOW);
    return op;
  }

  /**
   * Only synchronous reads constrain the clock of the reader
   */
  public boolean constrainsPacing() {
    return kind == AccessKind.CURRENT;
  }

  /**
   * Must the read stream be evaluated before the reader in one cycle?
   */
  public boolean isSynchronous() {
    return kind == AccessKind.CURRENT || kind == AccessKind.HOLD ||
        (kind == AccessKind.LOOKBACK && offset == 0);
  }

  /**
   * May this access lie on a dependency cycle?  Only accesses that read
   * already retained history may.
   */
  public boolean legalInCycle() {
    return (kind == AccessKind.LOOKBACK && offset > 0) ||
            kind == AccessKind.WINDOW;
  }

  /**
   * @return true if the access yields an optional value
   */
  public boolean yieldsOption() {
    return kind == AccessKind.LOOKBACK || kind == AccessKind.LOOKAHEAD ||
           kind == AccessKind.HOLD;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StreamAccess)) {
      return false;
    }
    StreamAccess other = (StreamAccess) obj;
    return kind == other.kind && offset == other.offset &&
        (duration == null ? other.duration == null
                          : duration.equals(other.duration)) &&
        op == other.op;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + offset * 7 +
        (duration == null ? 0 : duration.hashCode()) +
        (op == null ? 0 : op.hashCode());
  }

  @Override
  public String toString() {
    switch (kind) {
      case CURRENT:
        return "current";
      case LOOKBACK:
        return "offset(-" + offset + ")";
      case LOOKAHEAD:
        return "offset(+" + offset + ")";
      case WINDOW:
        return "window(" + duration + "s, " + op + ")";
      case HOLD:
        return "hold";
      default:
        return kind.name();
    }
  }
}
