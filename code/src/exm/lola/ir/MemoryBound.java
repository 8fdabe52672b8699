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
package exm.lola.ir;

import com.google.common.base.Preconditions;

import exm.lola.common.lang.Rational;

/**
 * Number of values of a stream the runtime must retain, plus, for
 * streams read by a window without a fixed clock, the wall-clock
 * duration over which values must be kept.
 */
public class MemoryBound {
  public static final MemoryBound MINIMAL = new MemoryBound(1, null);

  private final long samples;
  private final Rational retention;

  public MemoryBound(long samples, Rational retention) {
    Preconditions.checkArgument(samples >= 1, "Bound below 1: %s", samples);
    this.samples = samples;
    this.retention = retention;
  }

  public long samples() {
    return samples;
  }

  public boolean hasRetention() {
    return retention != null;
  }

  /**
   * @return retention duration in seconds, null if none
   */
  public Rational retention() {
    return retention;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MemoryBound)) {
      return false;
    }
    MemoryBound o = (MemoryBound) obj;
    return samples == o.samples && (retention == null ? o.retention == null
                                     : retention.equals(o.retention));
  }

  @Override
  public int hashCode() {
    return Long.hashCode(samples) * 31 +
           (retention == null ? 0 : retention.hashCode());
  }

  @Override
  public String toString() {
    if (retention == null) {
      return "Bounded(" + samples + ")";
    }
    return "Bounded(" + samples + ", " + retention + "s)";
  }
}
