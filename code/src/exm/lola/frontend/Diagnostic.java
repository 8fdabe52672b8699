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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lola.ast.SourceSpan;
import exm.lola.common.exceptions.ErrorKind;
import exm.lola.common.exceptions.UserException;

/**
 * A problem found in the specification, with enough information for a
 * reporting layer to render it.
 */
public class Diagnostic {
  public static enum Severity {
    ERROR, WARNING;
  }

  private final Severity severity;
  private final ErrorKind kind;
  private final String message;
  private final SourceSpan span;
  private final List<Integer> streams;

  public Diagnostic(Severity severity, ErrorKind kind, String message,
                    SourceSpan span, List<Integer> streams) {
    this.severity = severity;
    this.kind = kind;
    this.message = message;
    this.span = span == null ? SourceSpan.UNKNOWN : span;
    this.streams = ImmutableList.copyOf(streams);
  }

  public static Diagnostic error(UserException e, List<Integer> streams) {
    return new Diagnostic(Severity.ERROR, e.getKind(), e.getMessage(),
                          e.getSpan(), streams);
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public SourceSpan getSpan() {
    return span;
  }

  /**
   * @return ids of the streams involved
   */
  public List<Integer> getStreams() {
    return streams;
  }

  @Override
  public String toString() {
    String sev = severity == Severity.ERROR ? "error" : "warning";
    String loc = span.isKnown() ? span + ": " : "";
    return loc + sev + "[" + kind.tag() + "]: " + message;
  }
}
