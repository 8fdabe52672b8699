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

import exm.lola.ast.SourceSpan;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final ErrorKind kind;
  private final SourceSpan span;

  public UserException(ErrorKind kind, SourceSpan span, String message)
  {
    super(message);
    this.kind = kind;
    this.span = span == null ? SourceSpan.UNKNOWN : span;
  }

  public UserException(ErrorKind kind, String message) {
    this(kind, SourceSpan.UNKNOWN, message);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public SourceSpan getSpan() {
    return span;
  }

  /**
   * Message prefixed with location, in the usual file:line:col format
   */
  public String getLocatedMessage() {
    if (span.isKnown()) {
      return span + ": " + getMessage();
    } else {
      return getMessage();
    }
  }

  private static final long serialVersionUID = 1L;
}
