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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.frontend.Diagnostic;
import exm.lola.ir.LolaIR;

/**
 * Outcome of analysing a specification: the IR if no error was found,
 * and the ranked diagnostics in either case (warnings only on success).
 */
public class AnalysisResult {
  private final LolaIR ir;
  private final List<Diagnostic> diagnostics;

  private AnalysisResult(LolaIR ir, List<Diagnostic> diagnostics) {
    this.ir = ir;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  static AnalysisResult success(LolaIR ir, List<Diagnostic> warnings) {
    return new AnalysisResult(ir, warnings);
  }

  static AnalysisResult failure(List<Diagnostic> diagnostics) {
    return new AnalysisResult(null, diagnostics);
  }

  public boolean isSuccess() {
    return ir != null;
  }

  /**
   * @throws LolaRuntimeError if the analysis failed
   */
  public LolaIR getIR() {
    if (ir == null) {
      throw new LolaRuntimeError("Analysis failed with " + errors().size() +
                                 " error(s), no IR available");
    }
    return ir;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> errors() {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        result.add(d);
      }
    }
    return result;
  }

  public List<Diagnostic> warnings() {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (!d.isError()) {
        result.add(d);
      }
    }
    return result;
  }
}
