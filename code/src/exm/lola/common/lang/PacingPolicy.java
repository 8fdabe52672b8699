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

/**
 * Policy points for clock inference.  The defaults follow the usual
 * conventions of this family of languages; both can be changed through
 * Settings.
 */
public class PacingPolicy {

  public static enum EventCombination {
    /** Stream fires when any dependency fires */
    DISJUNCTION,
    /** Stream fires only when all dependencies fire */
    CONJUNCTION;
  }

  public static enum FrequencyRule {
    /** The faster clock must be an exact integer multiple of the slower */
    INTEGER_MULTIPLE,
    /** Any clocks are compatible; the common clock is their rational GCD */
    COMMON_DIVISOR;
  }

  public static final PacingPolicy DEFAULT =
      new PacingPolicy(EventCombination.DISJUNCTION,
                       FrequencyRule.INTEGER_MULTIPLE);

  public final EventCombination eventCombination;
  public final FrequencyRule frequencyRule;

  public PacingPolicy(EventCombination eventCombination,
                      FrequencyRule frequencyRule) {
    this.eventCombination = eventCombination;
    this.frequencyRule = frequencyRule;
  }

  @Override
  public String toString() {
    return "PacingPolicy(" + eventCombination + ", " + frequencyRule + ")";
  }
}
