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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import org.apache.log4j.Logger;

import com.google.common.base.Predicate;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import exm.lola.ast.SourceSpan;
import exm.lola.common.Logging;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.Types.Type;
import exm.lola.frontend.Stream.StreamKind;

/**
 * Arena of streams addressed by integer id, with the reads between them
 * kept as separate adjacency lists.  Ids follow declaration order.
 * The structure is fixed once lowering completes; analysis stages only
 * refine the per-stream results.
 */
public class StreamGraph {
  private static final Logger logger = Logging.getStageLogger("graph");

  private final List<Stream> streams = new ArrayList<Stream>();
  private final List<Reference> references = new ArrayList<Reference>();
  private final Map<String, Integer> byName = new HashMap<String, Integer>();

  /** Edges by the stream that reads */
  private final ListMultimap<Integer, Reference> incoming =
      ArrayListMultimap.create();
  /** Edges by the stream that is read */
  private final ListMultimap<Integer, Reference> outgoing =
      ArrayListMultimap.create();

  private boolean structureFinished = false;
  private boolean frozen = false;

  Stream addStream(String name, StreamKind kind, SourceSpan span,
          Type declaredType, Pacing declaredPacing, SourceSpan pacingSpan,
          String triggerMessage) {
    checkBuilding();
    if (name != null && byName.containsKey(name)) {
      throw new LolaRuntimeError("Duplicate stream " + name + " in graph");
    }
    int id = streams.size();
    String streamName = name != null ? name : "trigger_" + id;
    Stream s = new Stream(id, streamName, kind, span, declaredType,
                          declaredPacing, pacingSpan, triggerMessage);
    streams.add(s);
    if (name != null) {
      byName.put(name, id);
    }
    return s;
  }

  Reference addReference(int source, int target, StreamAccess access,
                         SourceSpan span) {
    checkBuilding();
    checkId(source);
    checkId(target);
    Reference r = new Reference(references.size(), source, target, access,
                                span);
    references.add(r);
    incoming.put(target, r);
    outgoing.put(source, r);
    if (logger.isTraceEnabled()) {
      logger.trace("edge " + name(source) + " -" + access + "-> " +
                   name(target));
    }
    return r;
  }

  /**
   * Called once lowering is done: no more nodes or edges.
   */
  void finishStructure() {
    structureFinished = true;
  }

  /**
   * Make all streams read-only
   */
  public void freeze() {
    finishStructure();
    frozen = true;
    for (Stream s: streams) {
      s.freeze();
    }
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkBuilding() {
    if (structureFinished) {
      throw new LolaRuntimeError("Stream graph modified after lowering");
    }
  }

  private void checkId(int id) {
    if (id < 0 || id >= streams.size()) {
      throw new LolaRuntimeError("Invalid stream id " + id);
    }
  }

  public int size() {
    return streams.size();
  }

  public List<Stream> streams() {
    return Collections.unmodifiableList(streams);
  }

  public Stream stream(int id) {
    checkId(id);
    return streams.get(id);
  }

  public String name(int id) {
    return stream(id).name();
  }

  /**
   * @return the stream declared with this name, or null
   */
  public Stream lookup(String name) {
    Integer id = byName.get(name);
    return id == null ? null : streams.get(id);
  }

  public List<Stream> streamsOfKind(StreamKind kind) {
    List<Stream> result = new ArrayList<Stream>();
    for (Stream s: streams) {
      if (s.kind() == kind) {
        result.add(s);
      }
    }
    return result;
  }

  public List<Reference> references() {
    return Collections.unmodifiableList(references);
  }

  public Reference reference(int id) {
    return references.get(id);
  }

  /**
   * @return reads performed by the expression of stream id
   */
  public List<Reference> dependencies(int id) {
    return Collections.unmodifiableList(incoming.get(id));
  }

  /**
   * @return reads of stream id by other expressions
   */
  public List<Reference> dependents(int id) {
    return Collections.unmodifiableList(outgoing.get(id));
  }

  /**
   * Result of a topological sort
   */
  public static class SortResult {
    public final List<Integer> order;
    /** Streams on or behind a cycle, in id order */
    public final List<Integer> unsorted;

    SortResult(List<Integer> order, List<Integer> unsorted) {
      this.order = ImmutableList.copyOf(order);
      this.unsorted = ImmutableList.copyOf(unsorted);
    }

    public boolean complete() {
      return unsorted.isEmpty();
    }
  }

  /**
   * Kahn's algorithm over the edges selected by the filter, so that every
   * stream comes after the streams it reads.  Among streams that are
   * ready at the same time, the one declared first goes first.
   */
  public SortResult sortByDependencies(Predicate<StreamAccess> edgeFilter) {
    int n = streams.size();
    int[] inDegree = new int[n];
    for (Reference r: references) {
      if (edgeFilter.apply(r.access())) {
        inDegree[r.target()]++;
      }
    }

    PriorityQueue<Integer> ready = new PriorityQueue<Integer>();
    for (int i = 0; i < n; i++) {
      if (inDegree[i] == 0) {
        ready.add(i);
      }
    }

    List<Integer> order = new ArrayList<Integer>(n);
    while (!ready.isEmpty()) {
      int curr = ready.poll();
      order.add(curr);
      for (Reference r: outgoing.get(curr)) {
        if (edgeFilter.apply(r.access()) && --inDegree[r.target()] == 0) {
          ready.add(r.target());
        }
      }
    }

    List<Integer> unsorted = new ArrayList<Integer>();
    if (order.size() != n) {
      for (int i = 0; i < n; i++) {
        if (inDegree[i] > 0) {
          unsorted.add(i);
        }
      }
    }
    return new SortResult(order, unsorted);
  }
}
