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
package exm.lola.analysis;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.apache.log4j.Logger;

import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.UserException;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Rational;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;
import exm.lola.ir.Schedule;
import exm.lola.ir.Schedule.Deadline;

/**
 * Static schedule for the periodic outputs and triggers.
 *
 * Time is divided into steps of the GCD of all periods.  Over one hyper
 * period (the LCM of all periods) a stream with period k steps is due at
 * steps k, 2k, ...; consecutive due steps become deadlines, each with
 * the pause since the previous one.  The due steps of all streams are
 * merged one deadline at a time, and a schedule needing more deadlines
 * than the configured limit is reported instead of built.
 */
public class ScheduleBuilder {
  private static final Logger logger = Logging.getStageLogger("schedule");

  private static class PeriodicStream {
    final int id;
    final Rational period;
    long steps;
    long next;

    PeriodicStream(int id, Rational period) {
      this.id = id;
      this.period = period;
    }
  }

  /** Next due step, then faster streams first, then declaration order */
  private static final Comparator<PeriodicStream> DUE_ORDER =
      new Comparator<PeriodicStream>() {
    @Override
    public int compare(PeriodicStream a, PeriodicStream b) {
      int c = Long.compare(a.next, b.next);
      if (c != 0) {
        return c;
      }
      c = Long.compare(a.steps, b.steps);
      return c != 0 ? c : Integer.compare(a.id, b.id);
    }
  };

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;
  private final long maxDeadlines;

  private ScheduleBuilder(StreamGraph graph, DiagnosticCollector diagnostics,
                          long maxDeadlines) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    this.maxDeadlines = maxDeadlines;
  }

  /**
   * @return the schedule, or null if it would have too many deadlines
   */
  public static Schedule build(StreamGraph graph,
          DiagnosticCollector diagnostics, Settings settings) {
    return new ScheduleBuilder(graph, diagnostics,
                               settings.maxDeadlines()).build();
  }

  private Schedule build() {
    List<PeriodicStream> periodic = new ArrayList<PeriodicStream>();
    for (Stream s: graph.streams()) {
      Pacing p = s.pacing();
      if (!s.isInput() && p != null && p.isPeriodic()) {
        periodic.add(new PeriodicStream(s.id(), p.asPeriodic().period()));
      }
    }
    if (periodic.isEmpty()) {
      return Schedule.EMPTY;
    }

    Rational gcd = periodic.get(0).period;
    Rational hyper = periodic.get(0).period;
    for (PeriodicStream ps: periodic) {
      gcd = gcd.gcd(ps.period);
      hyper = hyper.lcm(ps.period);
    }
    BigInteger numSteps = steps(hyper, gcd);
    PeriodicStream fastest = null;
    for (PeriodicStream ps: periodic) {
      if (numSteps.bitLength() < 62) {
        ps.steps = steps(ps.period, gcd).longValue();
        ps.next = ps.steps;
      }
      if (fastest == null || ps.period.compareTo(fastest.period) < 0) {
        fastest = ps;
      }
    }

    // The fastest stream alone is due hyper / period times
    BigInteger fastestDue = steps(hyper, fastest.period);
    if (fastestDue.compareTo(BigInteger.valueOf(maxDeadlines)) > 0) {
      reportTooLarge(periodic, fastest, hyper, gcd, fastestDue);
      return null;
    } else if (numSteps.bitLength() >= 62) {
      reportTooLarge(periodic, fastest, hyper, gcd, null);
      return null;
    }
    long last = numSteps.longValue();

    PriorityQueue<PeriodicStream> queue =
        new PriorityQueue<PeriodicStream>(periodic.size(), DUE_ORDER);
    queue.addAll(periodic);
    List<Deadline> deadlines = new ArrayList<Deadline>();
    long prev = 0;
    while (!queue.isEmpty() && queue.peek().next <= last) {
      if (deadlines.size() >= maxDeadlines) {
        reportTooLarge(periodic, fastest, hyper, gcd, null);
        return null;
      }
      long step = queue.peek().next;
      List<Integer> due = new ArrayList<Integer>();
      while (!queue.isEmpty() && queue.peek().next == step) {
        PeriodicStream ps = queue.poll();
        due.add(ps.id);
        ps.next += ps.steps;
        if (ps.next <= last) {
          queue.add(ps);
        }
      }
      deadlines.add(new Deadline(gcd.multiply(step - prev), due));
      prev = step;
    }
    if (prev < last) {
      deadlines.add(new Deadline(gcd.multiply(last - prev),
                                 new ArrayList<Integer>()));
    }

    Schedule schedule = new Schedule(gcd, hyper, deadlines);
    logger.debug(schedule);
    return schedule;
  }

  private void reportTooLarge(List<PeriodicStream> periodic,
      PeriodicStream fastest, Rational hyper, Rational gcd,
      BigInteger atLeast) {
    List<Integer> ids = new ArrayList<Integer>();
    for (PeriodicStream ps: periodic) {
      ids.add(ps.id);
    }
    Stream s = graph.stream(fastest.id);
    String count = atLeast == null ? "" : "at least " + atLeast + ", ";
    diagnostics.error(new UserException(ErrorKind.SCHEDULE_TOO_LARGE,
        s.pacingSpan(), "the periodic schedule would need " + count +
        "more deadlines than the limit of " + maxDeadlines +
        ": hyper period " + hyper + "s with steps of " + gcd + "s"), ids);
  }

  private static BigInteger steps(Rational duration, Rational step) {
    Rational q = duration.divide(step);
    if (!q.isInteger()) {
      throw new LolaRuntimeError(duration + " is not a multiple of " + step);
    }
    return q.numerator();
  }
}
