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

import java.util.EnumSet;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.lang.Pacing;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Reference;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;
import exm.lola.ir.FeatureFlag;
import exm.lola.ir.Schedule;

/**
 * Whole-graph checks and derived information, run after types and
 * pacing are known: cycle legality, memory bounds, evaluation order and
 * layers, the periodic schedule, unused inputs and feature flags.
 */
public class GraphAnalyzer {
  private static final Logger logger = Logging.getStageLogger("graph");

  /**
   * What the analysis derived, only available if no error was found
   */
  public static class Result {
    public final EvaluationOrder order;
    public final Schedule schedule;
    public final Set<FeatureFlag> features;

    Result(EvaluationOrder order, Schedule schedule,
           Set<FeatureFlag> features) {
      this.order = order;
      this.schedule = schedule;
      this.features = features;
    }
  }

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;
  private final Settings settings;

  public GraphAnalyzer(StreamGraph graph, DiagnosticCollector diagnostics,
                       Settings settings) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    this.settings = settings;
  }

  /**
   * Cycle detection and the unused input check always run; the rest
   * only if no error has been reported so far, since it relies on an
   * acyclic, fully typed and paced graph.
   * @return null if errors were found
   */
  public Result run() {
    CycleDetector.check(graph, diagnostics);
    if (settings.warnUnusedInputs()) {
      warnUnused();
    }
    if (diagnostics.hasErrors()) {
      logger.debug("Skipping memory and order analysis after " +
                   diagnostics.errorCount() + " error(s)");
      return null;
    }

    MemoryAnalyzer.analyze(graph, diagnostics, settings);
    EvaluationOrder order = EvaluationOrder.compute(graph);
    Schedule schedule = ScheduleBuilder.build(graph, diagnostics, settings);
    if (diagnostics.hasErrors()) {
      return null;
    }
    return new Result(order, schedule, featureFlags());
  }

  private void warnUnused() {
    boolean[] used = new boolean[graph.size()];
    for (Reference r: graph.references()) {
      used[r.source()] = true;
    }
    for (Stream s: graph.streams()) {
      Pacing p = s.declaredPacing();
      if (p != null && p.isEventDriven()) {
        for (int id: p.asEventDriven().activation().streams()) {
          used[id] = true;
        }
      }
    }
    for (Stream s: graph.streamsOfKind(Stream.StreamKind.INPUT)) {
      if (!used[s.id()]) {
        diagnostics.warning(ErrorKind.UNUSED_STREAM, s.span(),
                            "input stream " + s.name() + " is never used",
                            s.id());
      }
    }
  }

  private Set<FeatureFlag> featureFlags() {
    EnumSet<FeatureFlag> flags = EnumSet.noneOf(FeatureFlag.class);
    for (Reference r: graph.references()) {
      switch (r.access().kind()) {
        case LOOKAHEAD:
          flags.add(FeatureFlag.DISCRETE_FUTURE_OFFSET);
          break;
        case WINDOW:
          flags.add(FeatureFlag.SLIDING_WINDOWS);
          break;
        case HOLD:
          flags.add(FeatureFlag.HOLD_ACCESS);
          break;
        default:
          break;
      }
    }
    for (Stream s: graph.streams()) {
      if (s.pacing().isPeriodic()) {
        flags.add(FeatureFlag.PERIODIC_STREAMS);
      } else if (s.pacing().isEventDriven()) {
        flags.add(FeatureFlag.EVENT_DRIVEN_STREAMS);
      }
    }
    return flags;
  }
}
