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
 * Two bindings could not be unified.  Both conflicting values are kept
 * so that callers can produce a specific message.
 */
public class UnificationException extends Exception {

  private static final long serialVersionUID = 1L;

  private final Object left;
  private final Object right;

  public UnificationException(Object left, Object right, String message) {
    super(message);
    this.left = left;
    this.right = right;
  }

  public UnificationException(Object left, Object right) {
    this(left, right, "cannot unify " + left + " with " + right);
  }

  public Object getLeft() {
    return left;
  }

  public Object getRight() {
    return right;
  }
}
