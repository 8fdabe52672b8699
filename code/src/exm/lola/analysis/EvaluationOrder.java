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

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;

import exm.lola.common.Logging;
import exm.lola.common.exceptions.SchedulingCycleError;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.StreamAccess;
import exm.lola.frontend.Reference;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;

/**
 * Order in which streams are evaluated within one cycle: a stream comes
 * after every stream it reads synchronously.  Accesses to history do not
 * constrain the order.
 */
public class EvaluationOrder {
  private static final Logger logger = Logging.getStageLogger("order");

  static final Predicate<StreamAccess> SYNCHRONOUS =
      new Predicate<StreamAccess>() {
        @Override
        public boolean apply(StreamAccess access) {
          return access.isSynchronous();
        }
      };

  private final List<Integer> order;
  private final List<List<Integer>> periodicLayers;
  private final List<List<Integer>> eventDrivenLayers;

  private EvaluationOrder(List<Integer> order,
      List<List<Integer>> periodicLayers,
      List<List<Integer>> eventDrivenLayers) {
    this.order = order;
    this.periodicLayers = periodicLayers;
    this.eventDrivenLayers = eventDrivenLayers;
  }

  /**
   * Sort the streams and assign each its layer.
   * @throws SchedulingCycleError if synchronous accesses form a cycle,
   *        which cycle detection should have rejected
   */
  public static EvaluationOrder compute(StreamGraph graph) {
    StreamGraph.SortResult sorted = graph.sortByDependencies(SYNCHRONOUS);
    if (!sorted.complete()) {
      List<String> names = new ArrayList<String>();
      for (int id: sorted.unsorted) {
        names.add(graph.name(id));
      }
      throw new SchedulingCycleError(names);
    }

    int[] layer = new int[graph.size()];
    for (int id: sorted.order) {
      int l = 0;
      for (Reference r: graph.dependencies(id)) {
        if (r.access().isSynchronous()) {
          l = Math.max(l, layer[r.source()] + 1);
        }
      }
      layer[id] = l;
      graph.stream(id).setLayer(l);
    }

    EvaluationOrder result = new EvaluationOrder(sorted.order,
                  layersOf(graph, layer, true), layersOf(graph, layer, false));
    logger.debug("Evaluation order: " + result.order);
    return result;
  }

  /**
   * Group the non-input streams of one kind of clock by layer, leaving
   * out empty layers
   */
  private static List<List<Integer>> layersOf(StreamGraph graph, int[] layer,
                                              boolean periodic) {
    TreeMap<Integer, List<Integer>> byLayer =
        new TreeMap<Integer, List<Integer>>();
    for (Stream s: graph.streams()) {
      Pacing p = s.pacing();
      if (s.isInput() || p == null || p.isError() ||
          p.isPeriodic() != periodic) {
        continue;
      }
      List<Integer> streams = byLayer.get(layer[s.id()]);
      if (streams == null) {
        streams = new ArrayList<Integer>();
        byLayer.put(layer[s.id()], streams);
      }
      streams.add(s.id());
    }
    ImmutableList.Builder<List<Integer>> layers = ImmutableList.builder();
    for (List<Integer> l: byLayer.values()) {
      layers.add(ImmutableList.copyOf(l));
    }
    return layers.build();
  }

  /**
   * @return all stream ids, each after the streams it reads synchronously
   */
  public List<Integer> order() {
    return order;
  }

  public List<List<Integer>> periodicLayers() {
    return periodicLayers;
  }

  public List<List<Integer>> eventDrivenLayers() {
    return eventDrivenLayers;
  }
}
