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
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.lola.ast.SourceSpan;
import exm.lola.common.Logging;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.UserException;
import exm.lola.frontend.Diagnostic.Severity;

/**
 * Accumulates diagnostics from all stages.  Nothing is thrown: stages
 * report here and carry on.
 */
public class DiagnosticCollector {
  private static final Logger logger = Logging.getLolaLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private int errorCount = 0;

  public void report(Diagnostic d) {
    diagnostics.add(d);
    if (d.isError()) {
      errorCount++;
    }
    logger.debug("Reported " + d);
  }

  public void error(UserException e, Integer... streams) {
    report(Diagnostic.error(e, ImmutableList.copyOf(streams)));
  }

  public void error(UserException e, List<Integer> streams) {
    report(Diagnostic.error(e, streams));
  }

  public void warning(ErrorKind kind, SourceSpan span, String message,
                      Integer... streams) {
    report(new Diagnostic(Severity.WARNING, kind, message, span,
                          ImmutableList.copyOf(streams)));
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public int errorCount() {
    return errorCount;
  }

  public int size() {
    return diagnostics.size();
  }

  /**
   * @return diagnostics in the order they were reported
   */
  public List<Diagnostic> reported() {
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * Errors before warnings, then by source position, then by report
   * order (the sort is stable)
   */
  public List<Diagnostic> ranked() {
    List<Diagnostic> sorted = new ArrayList<Diagnostic>(diagnostics);
    Collections.sort(sorted, new Comparator<Diagnostic>() {
      @Override
      public int compare(Diagnostic a, Diagnostic b) {
        if (a.isError() != b.isError()) {
          return a.isError() ? -1 : 1;
        }
        return a.getSpan().compareTo(b.getSpan());
      }
    });
    return ImmutableList.copyOf(sorted);
  }
}
