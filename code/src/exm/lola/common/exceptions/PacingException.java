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

import com.google.common.base.Preconditions;

import exm.lola.ast.SourceSpan;

/**
 * Problems with the clock of a stream.  The kind tells them apart:
 * inconsistent, incompatible frequency, ambiguous or undecidable lookahead.
 */
public class PacingException extends UserException {

  private static final long serialVersionUID = 1L;

  public PacingException(ErrorKind kind, SourceSpan span, String message) {
    super(kind, span, message);
    Preconditions.checkArgument(kind == ErrorKind.INCONSISTENT_PACING ||
                     kind == ErrorKind.INCOMPATIBLE_FREQUENCY ||
                     kind == ErrorKind.AMBIGUOUS_PACING ||
                     kind == ErrorKind.UNDECIDABLE_LOOKAHEAD,
                     "Not a pacing error kind: %s", kind);
  }
}
