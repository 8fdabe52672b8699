package exm.lola.analysis;

import static org.junit.Assert.assertFalse;

import exm.lola.SpecBuilder;
import exm.lola.common.Settings;
import exm.lola.frontend.DiagnosticCollector;
import exm.lola.frontend.Lowering;
import exm.lola.frontend.StreamGraph;
import exm.lola.frontend.pacing.PacingAnalyzer;
import exm.lola.frontend.typecheck.TypeChecker;

/**
 * Runs the stages before graph analysis
 */
class GraphFixture {

  static StreamGraph lower(SpecBuilder spec, DiagnosticCollector diags) {
    StreamGraph g = Lowering.lower(spec.build(), diags);
    assertFalse("Lowering should succeed: " + diags.reported(),
                diags.hasErrors());
    return g;
  }

  static StreamGraph prepare(SpecBuilder spec, DiagnosticCollector diags,
                             Settings settings) {
    StreamGraph g = lower(spec, diags);
    TypeChecker.check(g, diags, settings);
    PacingAnalyzer.analyze(g, diags, settings);
    assertFalse("Types and pacing should check: " + diags.reported(),
                diags.hasErrors());
    return g;
  }

  static StreamGraph prepare(SpecBuilder spec, DiagnosticCollector diags) {
    return prepare(spec, diags, Settings.defaults());
  }
}
