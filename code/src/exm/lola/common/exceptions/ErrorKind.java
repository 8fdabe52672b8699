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
package exm.lola.common.exceptions;

/**
 * Stable tags for every problem the analysis can report.
 */
public enum ErrorKind {
  DUPLICATE_DECLARATION("DuplicateDeclaration"),
  UNDECLARED_STREAM("UndeclaredStream"),
  UNDECLARED_FUNCTION("UndeclaredFunction"),
  UNKNOWN_TYPE("UnknownType"),
  INVALID_LITERAL("InvalidLiteral"),
  TYPE_MISMATCH("TypeMismatch"),
  AMBIGUOUS_TYPE("AmbiguousType"),
  UNIT_MISMATCH("UnitMismatch"),
  INCONSISTENT_PACING("InconsistentPacing"),
  INCOMPATIBLE_FREQUENCY("IncompatibleFrequency"),
  AMBIGUOUS_PACING("AmbiguousPacing"),
  UNDECIDABLE_LOOKAHEAD("UndecidableLookahead"),
  ILLEGAL_CYCLE("IllegalCycle"),
  MEMORY_BOUND_EXCEEDED("MemoryBoundExceeded"),
  SCHEDULE_TOO_LARGE("ScheduleTooLarge"),
  UNUSED_STREAM("UnusedStream"),
  /** Internal invariant violation, never a specification error */
  SCHEDULING_CYCLE("SchedulingCycle");

  private final String tag;

  private ErrorKind(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  @Override
  public String toString() {
    return tag;
  }
}
