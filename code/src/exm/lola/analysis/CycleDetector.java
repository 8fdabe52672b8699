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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import exm.lola.common.Logging;
import exm.lola.common.exceptions.IllegalCycleException;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Reference;
import exm.lola.frontend.StreamGraph;

/**
 * Finds dependency cycles that cannot be evaluated.  A cycle is fine if
 * every edge on it reads retained history (a positive lookback or a
 * window); any other edge inside a strongly connected component makes
 * the component illegal.  One diagnostic is reported per component.
 */
public class CycleDetector {
  private static final Logger logger = Logging.getStageLogger("cycles");

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;

  // Tarjan state
  private int counter = 0;
  private final int[] index;
  private final int[] lowlink;
  private final boolean[] onStack;
  private final Deque<Integer> stack = new ArrayDeque<Integer>();
  private final List<Set<Integer>> components = new ArrayList<Set<Integer>>();

  public CycleDetector(StreamGraph graph, DiagnosticCollector diagnostics) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    int n = graph.size();
    this.index = new int[n];
    this.lowlink = new int[n];
    this.onStack = new boolean[n];
    Arrays.fill(index, -1);
  }

  /**
   * @return number of illegal cycles reported
   */
  public static int check(StreamGraph graph,
                          DiagnosticCollector diagnostics) {
    return new CycleDetector(graph, diagnostics).run();
  }

  public int run() {
    for (int v = 0; v < graph.size(); v++) {
      if (index[v] < 0) {
        strongConnect(v);
      }
    }

    int illegal = 0;
    for (Set<Integer> component: components) {
      if (checkComponent(component)) {
        illegal++;
      }
    }
    logger.debug("Found " + components.size() + " components, " + illegal +
                 " with illegal cycles");
    return illegal;
  }

  /** A vertex being visited and how far through its edges we are */
  private static class Frame {
    final int v;
    final List<Reference> edges;
    int next = 0;

    Frame(int v, List<Reference> edges) {
      this.v = v;
      this.edges = edges;
    }
  }

  /**
   * Tarjan's algorithm with an explicit stack of frames, so that long
   * dependency chains do not exhaust the call stack
   */
  private void strongConnect(int root) {
    Deque<Frame> frames = new ArrayDeque<Frame>();
    frames.push(visit(root));

    while (!frames.isEmpty()) {
      Frame f = frames.peek();
      if (f.next < f.edges.size()) {
        int w = f.edges.get(f.next++).target();
        if (index[w] < 0) {
          frames.push(visit(w));
        } else if (onStack[w]) {
          lowlink[f.v] = Math.min(lowlink[f.v], index[w]);
        }
        continue;
      }

      frames.pop();
      if (lowlink[f.v] == index[f.v]) {
        Set<Integer> component = new TreeSet<Integer>();
        int w;
        do {
          w = stack.pop();
          onStack[w] = false;
          component.add(w);
        } while (w != f.v);
        components.add(component);
      }
      Frame parent = frames.peek();
      if (parent != null) {
        lowlink[parent.v] = Math.min(lowlink[parent.v], lowlink[f.v]);
      }
    }
  }

  private Frame visit(int v) {
    index[v] = counter;
    lowlink[v] = counter;
    counter++;
    stack.push(v);
    onStack[v] = true;
    return new Frame(v, graph.dependents(v));
  }

  /**
   * @return true if an illegal cycle was reported
   */
  private boolean checkComponent(Set<Integer> component) {
    Reference offending = null;
    for (int v: component) {
      for (Reference r: graph.dependents(v)) {
        if (component.contains(r.target()) && !r.access().legalInCycle() &&
            (offending == null || r.id() < offending.id())) {
          offending = r;
        }
      }
    }
    if (offending == null) {
      return false;
    }

    List<Integer> path = pathWithin(component, offending.target(),
                                    offending.source());
    StringBuilder sb = new StringBuilder();
    for (int v: path) {
      sb.append(graph.name(v)).append(" -> ");
    }
    sb.append(graph.name(offending.target()));

    diagnostics.error(new IllegalCycleException(offending.span(),
        "illegal dependency cycle " + sb + ": " +
        graph.name(offending.target()) + " reads " +
        graph.name(offending.source()) + " " + offending.access() +
        ", but only positive lookbacks and windows may close a cycle"),
        new ArrayList<Integer>(component));
    return true;
  }

  /**
   * Shortest path from one stream to another along edges inside the
   * component, by breadth-first search
   */
  private List<Integer> pathWithin(Set<Integer> component, int from,
                                   int to) {
    Map<Integer, Integer> pred = new HashMap<Integer, Integer>();
    Deque<Integer> queue = new ArrayDeque<Integer>();
    queue.add(from);
    pred.put(from, from);
    while (!queue.isEmpty() && !pred.containsKey(to)) {
      int v = queue.poll();
      for (Reference r: graph.dependents(v)) {
        int w = r.target();
        if (component.contains(w) && !pred.containsKey(w)) {
          pred.put(w, v);
          queue.add(w);
        }
      }
    }

    List<Integer> path = new ArrayList<Integer>();
    int curr = to;
    path.add(curr);
    while (curr != from) {
      curr = pred.get(curr);
      path.add(curr);
    }
    Collections.reverse(path);
    return path;
  }
}
