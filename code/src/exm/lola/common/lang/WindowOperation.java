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

import exm.lola.common.exceptions.LolaRuntimeError;

/**
 * Aggregations available over sliding windows
 */
public enum WindowOperation {
  SUM, PRODUCT, AVERAGE, COUNT, INTEGRAL;

  public String opName() {
    switch (this) {
      case SUM:
        return "sum";
      case PRODUCT:
        return "product";
      case AVERAGE:
        return "avg";
      case COUNT:
        return "count";
      case INTEGRAL:
        return "integral";
      default:
        throw new LolaRuntimeError("opName not implemented for " + this.name());
    }
  }

  /**
   * @return the operation, or null if name is unknown
   */
  public static WindowOperation fromName(String name) {
    for (WindowOperation op: values()) {
      if (op.opName().equals(name) || op.name().equalsIgnoreCase(name)) {
        return op;
      }
    }
    if (name.equals("average")) {
      return AVERAGE;
    }
    return null;
  }

  @Override
  public String toString() {
    return opName();
  }
}
