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
import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.log4j.Logger;

import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.UserException;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Rational;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.StreamAccess.AccessKind;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Reference;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;
import exm.lola.ir.MemoryBound;

/**
 * Computes how many values of each stream must be retained, from the
 * accesses of its readers, and which streams depend on future values.
 */
public class MemoryAnalyzer {
  private static final Logger logger = Logging.getStageLogger("memory");

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;
  private final long maxBound;

  public MemoryAnalyzer(StreamGraph graph, DiagnosticCollector diagnostics,
                        Settings settings) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    this.maxBound = settings.maxMemoryBound();
  }

  public static void analyze(StreamGraph graph,
          DiagnosticCollector diagnostics, Settings settings) {
    new MemoryAnalyzer(graph, diagnostics, settings).run();
  }

  public void run() {
    for (Stream s: graph.streams()) {
      s.setMemoryBound(boundOf(s));
      if (logger.isTraceEnabled()) {
        logger.trace(s.name() + " memory " + s.memoryBound());
      }
    }
    markFutureDependent();
  }

  private MemoryBound boundOf(Stream s) {
    BigInteger samples = BigInteger.ONE;
    Rational retention = null;
    Reference largest = null;
    for (Reference r: graph.dependents(s.id())) {
      StreamAccess access = r.access();
      BigInteger needed;
      switch (access.kind()) {
        case LOOKBACK:
        case LOOKAHEAD:
          needed = BigInteger.valueOf(access.offset() + 1L);
          break;
        case WINDOW:
          Pacing p = s.pacing();
          if (p != null && p.isPeriodic()) {
            needed = access.duration().multiply(p.asPeriodic().frequency())
                           .ceil();
          } else {
            retention = retention == null ? access.duration()
                                          : retention.max(access.duration());
            needed = BigInteger.ONE;
          }
          break;
        default:
          needed = BigInteger.ONE;
          break;
      }
      if (needed.compareTo(samples) > 0) {
        samples = needed;
        largest = r;
      }
    }

    if (samples.compareTo(BigInteger.valueOf(maxBound)) > 0) {
      diagnostics.error(new UserException(ErrorKind.MEMORY_BOUND_EXCEEDED,
          largest.span(), "stream " + s.name() + " would need to retain " +
          samples + " values, more than the limit of " + maxBound),
          s.id(), largest.target());
      samples = BigInteger.valueOf(maxBound);
    }
    return new MemoryBound(samples.longValue(), retention);
  }

  /**
   * A stream reading a future value, and everything that synchronously
   * reads such a stream, can only be computed later
   */
  private void markFutureDependent() {
    Deque<Integer> work = new ArrayDeque<Integer>();
    boolean[] future = new boolean[graph.size()];
    for (Reference r: graph.references()) {
      if (r.access().kind() == AccessKind.LOOKAHEAD && !future[r.target()]) {
        future[r.target()] = true;
        work.add(r.target());
      }
    }
    while (!work.isEmpty()) {
      int v = work.poll();
      for (Reference r: graph.dependents(v)) {
        if (r.access().isSynchronous() && !future[r.target()]) {
          future[r.target()] = true;
          work.add(r.target());
        }
      }
    }
    for (Stream s: graph.streams()) {
      s.setFutureDependent(future[s.id()]);
    }
  }
}
