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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lola.common.lang.Rational;

/**
 * Static schedule of the periodic streams over one hyper period.
 * All durations are in seconds.
 */
public class Schedule {
  public static final Schedule EMPTY = new Schedule(null, null,
                                  ImmutableList.<Deadline>of());

  /**
   * Wait for pause, then evaluate the due streams in order
   */
  public static class Deadline {
    private final Rational pause;
    private final List<Integer> due;

    public Deadline(Rational pause, List<Integer> due) {
      this.pause = pause;
      this.due = ImmutableList.copyOf(due);
    }

    public Rational pause() {
      return pause;
    }

    public List<Integer> due() {
      return due;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Deadline)) {
        return false;
      }
      Deadline o = (Deadline) obj;
      return pause.equals(o.pause) && due.equals(o.due);
    }

    @Override
    public int hashCode() {
      return pause.hashCode() * 31 + due.hashCode();
    }

    @Override
    public String toString() {
      return "+" + pause + "s " + due;
    }
  }

  private final Rational gcdPeriod;
  private final Rational hyperPeriod;
  private final List<Deadline> deadlines;

  public Schedule(Rational gcdPeriod, Rational hyperPeriod,
                  List<Deadline> deadlines) {
    this.gcdPeriod = gcdPeriod;
    this.hyperPeriod = hyperPeriod;
    this.deadlines = ImmutableList.copyOf(deadlines);
  }

  public boolean isEmpty() {
    return deadlines.isEmpty();
  }

  /**
   * @return longest wait that misses no deadline, null if nothing is
   *          periodic
   */
  public Rational gcdPeriod() {
    return gcdPeriod;
  }

  public Rational hyperPeriod() {
    return hyperPeriod;
  }

  public List<Deadline> deadlines() {
    return deadlines;
  }

  @Override
  public String toString() {
    return "Schedule(gcd=" + gcdPeriod + ", hyper=" + hyperPeriod + ", " +
           deadlines + ")";
  }
}
