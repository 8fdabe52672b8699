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

import java.util.List;

/**
 * The evaluation order could not be computed because synchronous
 * dependencies still form a cycle after cycle checking passed.
 */
public class SchedulingCycleError extends LolaRuntimeError {

  private static final long serialVersionUID = 1L;

  private final List<String> unscheduled;

  public SchedulingCycleError(List<String> unscheduled) {
    super(ErrorKind.SCHEDULING_CYCLE + ": no evaluation order for " +
          unscheduled);
    this.unscheduled = unscheduled;
  }

  public List<String> getUnscheduled() {
    return unscheduled;
  }
}
