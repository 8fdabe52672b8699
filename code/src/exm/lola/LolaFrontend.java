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
package exm.lola;

import java.util.Map;

import org.apache.log4j.Logger;

import exm.lola.analysis.GraphAnalyzer;
import exm.lola.ast.LolaSpec;
import exm.lola.common.Logging;
import exm.lola.common.Settings;
import exm.lola.common.lang.Types.Type;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Lowering;
import exm.lola.frontend.StreamGraph;
import exm.lola.frontend.pacing.PacingAnalyzer;
import exm.lola.frontend.typecheck.TypeChecker;
import exm.lola.ir.LolaIR;

/**
 * Entry point of the semantic analysis: lowering, type checking, pacing
 * analysis and graph analysis, in that order.  Every stage reports into
 * one collector and the pipeline continues past errors as far as it can.
 */
public class LolaFrontend {
  private static final Logger logger = Logging.getLolaLogger();

  private final Settings settings;

  public LolaFrontend(Settings settings) {
    this.settings = settings;
  }

  public static AnalysisResult analyze(LolaSpec spec) {
    return new LolaFrontend(Settings.defaults()).run(spec);
  }

  public static AnalysisResult analyze(LolaSpec spec, Settings settings) {
    return new LolaFrontend(settings).run(spec);
  }

  public AnalysisResult run(LolaSpec spec) {
    DiagnosticCollector diagnostics = new DiagnosticCollector();

    StreamGraph graph = Lowering.lower(spec, diagnostics);
    Map<Integer, Type> exprTypes =
        TypeChecker.check(graph, diagnostics, settings);
    PacingAnalyzer.analyze(graph, diagnostics, settings);
    GraphAnalyzer.Result analysis =
        new GraphAnalyzer(graph, diagnostics, settings).run();

    if (analysis == null || diagnostics.hasErrors()) {
      logger.debug("Analysis failed with " + diagnostics.errorCount() +
                   " error(s)");
      return AnalysisResult.failure(diagnostics.ranked());
    }

    graph.freeze();
    LolaIR ir = new LolaIR(graph, exprTypes, analysis.order.order(),
        analysis.order.periodicLayers(), analysis.order.eventDrivenLayers(),
        analysis.schedule, analysis.features);
    logger.debug("Analysis succeeded: " + graph.size() + " streams");
    return AnalysisResult.success(ir, diagnostics.ranked());
  }
}
