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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.lang.Types.Type;
import exm.lola.frontend.Stream;
import exm.lola.frontend.Stream.StreamKind;
import exm.lola.frontend.StreamGraph;

/**
 * Result of a successful analysis: the frozen stream graph, where every
 * stream has a type, a pacing, a memory bound and a layer, together with
 * the global evaluation order and the periodic schedule.
 */
public class LolaIR {
  private final StreamGraph graph;
  private final Map<Integer, Type> exprTypes;
  private final List<Integer> evaluationOrder;
  private final List<List<Integer>> periodicLayers;
  private final List<List<Integer>> eventDrivenLayers;
  private final Schedule schedule;
  private final Set<FeatureFlag> featureFlags;

  public LolaIR(StreamGraph graph, Map<Integer, Type> exprTypes,
                List<Integer> evaluationOrder,
                List<List<Integer>> periodicLayers,
                List<List<Integer>> eventDrivenLayers,
                Schedule schedule, Set<FeatureFlag> featureFlags) {
    Preconditions.checkArgument(graph.isFrozen(), "Graph not frozen");
    this.graph = graph;
    this.exprTypes = ImmutableMap.copyOf(exprTypes);
    this.evaluationOrder = ImmutableList.copyOf(evaluationOrder);
    this.periodicLayers = ImmutableList.copyOf(periodicLayers);
    this.eventDrivenLayers = ImmutableList.copyOf(eventDrivenLayers);
    this.schedule = schedule;
    this.featureFlags = Collections.unmodifiableSet(
        featureFlags.isEmpty() ? EnumSet.noneOf(FeatureFlag.class)
                               : EnumSet.copyOf(featureFlags));
  }

  public StreamGraph graph() {
    return graph;
  }

  public List<Stream> streams() {
    return graph.streams();
  }

  public Stream stream(int id) {
    return graph.stream(id);
  }

  /**
   * @throws LolaRuntimeError if there is no such stream
   */
  public Stream stream(String name) {
    Stream s = graph.lookup(name);
    if (s == null) {
      throw new LolaRuntimeError("No stream named " + name);
    }
    return s;
  }

  public List<Stream> inputs() {
    return graph.streamsOfKind(StreamKind.INPUT);
  }

  public List<Stream> outputs() {
    return graph.streamsOfKind(StreamKind.OUTPUT);
  }

  public List<Stream> triggers() {
    return graph.streamsOfKind(StreamKind.TRIGGER);
  }

  /**
   * @return periodic outputs and triggers
   */
  public List<Stream> periodicStreams() {
    List<Stream> result = new ArrayList<Stream>();
    for (Stream s: graph.streams()) {
      if (!s.isInput() && s.pacing().isPeriodic()) {
        result.add(s);
      }
    }
    return result;
  }

  /**
   * @return event-driven outputs and triggers
   */
  public List<Stream> eventDrivenStreams() {
    List<Stream> result = new ArrayList<Stream>();
    for (Stream s: graph.streams()) {
      if (!s.isInput() && s.pacing().isEventDriven()) {
        result.add(s);
      }
    }
    return result;
  }

  public Type typeOf(Expr e) {
    Type t = exprTypes.get(e.id());
    if (t == null) {
      throw new LolaRuntimeError("No type recorded for " + e);
    }
    return t;
  }

  public List<Integer> evaluationOrder() {
    return evaluationOrder;
  }

  public List<List<Integer>> periodicLayers() {
    return periodicLayers;
  }

  public List<List<Integer>> eventDrivenLayers() {
    return eventDrivenLayers;
  }

  public Schedule schedule() {
    return schedule;
  }

  public Set<FeatureFlag> featureFlags() {
    return featureFlags;
  }
}
