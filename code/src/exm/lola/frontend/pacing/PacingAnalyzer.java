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
package exm.lola.frontend.pacing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

import org.apache.log4j.Logger;

import com.google.common.base.Predicate;

import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.PacingException;
import exm.lola.common.exceptions.UnificationException;
import exm.lola.common.lang.Activation;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.StreamAccess;
import exm.lola.common.lang.StreamAccess.AccessKind;
import exm.lola.common.util.UnionFind;
import exm.lola.common.util.UnionFind.Mark;
import exm.lola.common.util.UnionFind.Var;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Reference;
import exm.lola.frontend.Stream;
import exm.lola.frontend.StreamGraph;

/**
 * Determines the clock of every stream.
 *
 * Inputs and annotated streams have a fixed clock.  The clock of an
 * unannotated stream is combined from the clocks of the streams it
 * reads at the current offset; other accesses read retained history and
 * do not constrain it.  Each combination step is tried speculatively and
 * undone if it conflicts.
 */
public class PacingAnalyzer {
  private static final Logger logger = Logging.getStageLogger("pacing");

  private static final Predicate<StreamAccess> CONSTRAINS_PACING =
      new Predicate<StreamAccess>() {
        @Override
        public boolean apply(StreamAccess access) {
          return access.constrainsPacing();
        }
      };

  private final StreamGraph graph;
  private final DiagnosticCollector diagnostics;
  private final Settings settings;
  private final PacingLattice lattice;
  private final UnionFind<Pacing> unifier;
  private final Var[] vars;
  private final IntFunction<String> names;

  public PacingAnalyzer(StreamGraph graph, DiagnosticCollector diagnostics,
                        Settings settings) {
    this.graph = graph;
    this.diagnostics = diagnostics;
    this.settings = settings;
    this.lattice = new PacingLattice(settings.pacingPolicy());
    this.unifier = new UnionFind<Pacing>(lattice);
    this.vars = new Var[graph.size()];
    this.names = new IntFunction<String>() {
      @Override
      public String apply(int id) {
        return PacingAnalyzer.this.graph.name(id);
      }
    };
  }

  public static void analyze(StreamGraph graph,
          DiagnosticCollector diagnostics, Settings settings) {
    new PacingAnalyzer(graph, diagnostics, settings).run();
  }

  public void run() {
    logger.debug("Pacing analysis with " + settings.pacingPolicy());
    for (Stream s: graph.streams()) {
      if (s.hasDeclaredPacing()) {
        vars[s.id()] = unifier.newVar(s.declaredPacing());
      } else if (s.isInput()) {
        vars[s.id()] = unifier.newVar(
                           Pacing.eventDriven(Activation.of(s.id())));
      } else {
        vars[s.id()] = unifier.newVar();
      }
    }

    StreamGraph.SortResult sorted =
        graph.sortByDependencies(CONSTRAINS_PACING);
    List<Integer> order = new ArrayList<Integer>(sorted.order);
    order.addAll(sorted.unsorted);
    for (int id: order) {
      Stream s = graph.stream(id);
      if (!s.isInput() && !s.hasDeclaredPacing()) {
        infer(s);
      }
    }

    for (Stream s: graph.streams()) {
      if (s.hasDeclaredPacing()) {
        validate(s);
      }
    }

    for (Stream s: graph.streams()) {
      Pacing p = unifier.lookup(vars[s.id()]);
      s.setPacing(p == null ? Pacing.ERROR : p);
      if (logger.isTraceEnabled()) {
        logger.trace(s.name() + " " + s.pacing().toString(names));
      }
    }

    checkLookaheads();
    logger.debug("Pacing analysis done");
  }

  /**
   * Streams read at the current offset, each once, in order of first read
   */
  private Map<Integer, Reference> synchronousDeps(Stream s) {
    Map<Integer, Reference> deps = new LinkedHashMap<Integer, Reference>();
    for (Reference r: graph.dependencies(s.id())) {
      if (r.access().constrainsPacing() && !deps.containsKey(r.source())) {
        deps.put(r.source(), r);
      }
    }
    return deps;
  }

  private void infer(Stream s) {
    Var var = vars[s.id()];
    boolean skipped = false;
    List<Reference> known = new ArrayList<Reference>();
    Reference fastest = null;
    for (Reference r: synchronousDeps(s).values()) {
      Pacing depPacing = unifier.lookup(vars[r.source()]);
      if (depPacing == null) {
        // Dependency on a cycle, not inferred yet
        skipped = true;
        continue;
      }
      known.add(r);
      if (depPacing.isPeriodic() && (fastest == null ||
          depPacing.asPeriodic().frequency().compareTo(
              unifier.lookup(vars[fastest.source()]).asPeriodic()
                     .frequency()) > 0)) {
        fastest = r;
      }
    }

    // Start from the fastest clock so that every other periodic
    // dependency is checked against it, whatever the operand order
    if (fastest != null) {
      known.remove(fastest);
      known.add(0, fastest);
    }
    for (Reference r: known) {
      Mark m = unifier.snapshot();
      try {
        unifier.unify(var, unifier.lookup(vars[r.source()]));
        unifier.commit(m);
      } catch (UnificationException e) {
        unifier.rollback(m);
        reportConflict(s, r, (Pacing) e.getLeft(), (Pacing) e.getRight());
        bindError(var);
        return;
      }
    }

    if (unifier.lookup(var) == null) {
      if (skipped || s.expr().containsError()) {
        // Already reported as a cycle or an unresolved name
        logger.trace("No pacing for " + s.name() + " after earlier errors");
      } else {
        diagnostics.error(new PacingException(ErrorKind.AMBIGUOUS_PACING,
            s.span(), "cannot infer the pacing of " + s.name() +
            ": it reads no stream synchronously; add a pacing annotation"),
            s.id());
      }
      bindError(var);
    }
  }

  private void bindError(Var var) {
    try {
      unifier.unify(var, Pacing.ERROR);
    } catch (UnificationException e) {
      throw new LolaRuntimeError("Error pacing must absorb " +
                                 e.getLeft(), e);
    }
  }

  private void reportConflict(Stream s, Reference r, Pacing left,
                              Pacing right) {
    ErrorKind kind = left.isPeriodic() && right.isPeriodic() ?
        ErrorKind.INCOMPATIBLE_FREQUENCY : ErrorKind.INCONSISTENT_PACING;
    String detail = kind == ErrorKind.INCOMPATIBLE_FREQUENCY ?
        "frequencies are not integer multiples of each other" :
        "periodic and event-driven streams cannot be mixed without hold()";
    diagnostics.error(new PacingException(kind, r.span(),
        "stream " + s.name() + " reads " + graph.name(r.source()) + " " +
        right.toString(names) + " but is already " + left.toString(names) +
        ": " + detail), s.id(), r.source());
  }

  /**
   * An annotated stream must be able to read its synchronous
   * dependencies on its own clock
   */
  private void validate(Stream s) {
    Pacing mine = unifier.lookup(vars[s.id()]);
    for (Reference r: synchronousDeps(s).values()) {
      Pacing theirs = unifier.lookup(vars[r.source()]);
      if (theirs == null || lattice.compatible(mine, theirs)) {
        continue;
      }
      ErrorKind kind = mine.isPeriodic() && theirs.isPeriodic() ?
          ErrorKind.INCOMPATIBLE_FREQUENCY : ErrorKind.INCONSISTENT_PACING;
      diagnostics.error(new PacingException(kind, r.span(), "stream " +
          s.name() + " " + mine.toString(names) + " cannot read " +
          graph.name(r.source()) + " " + theirs.toString(names) +
          " synchronously"), s.id(), r.source());
    }
  }

  /**
   * A future value is only known after a fixed time if the stream is
   * periodic
   */
  private void checkLookaheads() {
    for (Reference r: graph.references()) {
      if (r.access().kind() != AccessKind.LOOKAHEAD) {
        continue;
      }
      Stream source = graph.stream(r.source());
      String msg;
      if (!settings.allowLookahead()) {
        msg = "lookahead is disabled, cannot read " + source.name() +
              " " + r.access();
      } else if (source.pacing().isEventDriven()) {
        msg = "cannot read " + source.name() + " " + r.access() +
              ": future values of an event-driven stream may never arrive";
      } else {
        continue;
      }
      diagnostics.error(new PacingException(ErrorKind.UNDECIDABLE_LOOKAHEAD,
                        r.span(), msg), r.target(), r.source());
    }
  }
}
