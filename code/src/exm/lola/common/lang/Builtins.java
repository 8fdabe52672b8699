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
package exm.lola.common.lang;

import java.util.Collections;
import java.util.Set;

import exm.lola.common.lang.Types.NumKind;

/**
 * Builtin functions.  Each takes one numeric argument and returns a
 * value of the same type.
 */
public enum Builtins {
  SQRT("sqrt", NumKind.floats()),
  SIN("sin", NumKind.floats()),
  COS("cos", NumKind.floats()),
  ABS("abs", NumKind.signed());

  private final String fnName;
  private final Set<NumKind> argKinds;

  private Builtins(String fnName, Set<NumKind> argKinds) {
    this.fnName = fnName;
    this.argKinds = Collections.unmodifiableSet(argKinds);
  }

  public String fnName() {
    return fnName;
  }

  public int arity() {
    return 1;
  }

  /**
   * @return numeric kinds accepted for the argument
   */
  public Set<NumKind> argKinds() {
    return argKinds;
  }

  /**
   * @return the builtin with that name, or null if none
   */
  public static Builtins lookup(String name) {
    for (Builtins b: values()) {
      if (b.fnName.equals(name)) {
        return b;
      }
    }
    return null;
  }
}
