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
package exm.lola.frontend.pacing;

import java.util.Collection;

import com.google.common.collect.ImmutableList;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.UnificationException;
import exm.lola.common.lang.Pacing;
import exm.lola.common.lang.Pacing.Periodic;
import exm.lola.common.lang.PacingPolicy;
import exm.lola.common.lang.PacingPolicy.EventCombination;
import exm.lola.common.lang.PacingPolicy.FrequencyRule;
import exm.lola.common.lang.Rational;
import exm.lola.common.util.UnionFind;
import exm.lola.common.util.UnionFind.Var;

/**
 * How two clocks combine into the clock of a stream that reads both
 * synchronously.  {@link Pacing#ERROR} absorbs anything.
 */
public class PacingLattice implements UnionFind.Lattice<Pacing> {
  private final PacingPolicy policy;

  public PacingLattice(PacingPolicy policy) {
    this.policy = policy;
  }

  @Override
  public Pacing merge(UnionFind<Pacing> uf, Pacing left, Pacing right)
      throws UnificationException {
    if (left.isError()) {
      return left;
    } else if (right.isError()) {
      return right;
    } else if (left.isPeriodic() && right.isPeriodic()) {
      return mergePeriodic(left.asPeriodic(), right.asPeriodic());
    } else if (left.isEventDriven() && right.isEventDriven()) {
      if (policy.eventCombination == EventCombination.DISJUNCTION) {
        return Pacing.eventDriven(left.asEventDriven().activation().or(
                                  right.asEventDriven().activation()));
      } else {
        return Pacing.eventDriven(left.asEventDriven().activation().and(
                                  right.asEventDriven().activation()));
      }
    }
    throw new UnificationException(left, right);
  }

  private Pacing mergePeriodic(Periodic left, Periodic right)
      throws UnificationException {
    Rational lf = left.frequency();
    Rational rf = right.frequency();
    switch (policy.frequencyRule) {
      case INTEGER_MULTIPLE: {
        Rational fast = lf.max(rf);
        Rational slow = lf.min(rf);
        if (!fast.isMultipleOf(slow)) {
          throw new UnificationException(left, right);
        }
        return Pacing.periodic(fast);
      }
      case COMMON_DIVISOR:
        return Pacing.periodic(lf.gcd(rf));
      default:
        throw new LolaRuntimeError("Unknown frequency rule " +
                                   policy.frequencyRule);
    }
  }

  /**
   * May a stream with clock reader read a stream with clock dep at the
   * current offset?
   */
  public boolean compatible(Pacing reader, Pacing dep) {
    if (reader.isError() || dep.isError()) {
      return true;
    } else if (reader.isPeriodic() && dep.isPeriodic()) {
      if (policy.frequencyRule == FrequencyRule.COMMON_DIVISOR) {
        return true;
      }
      Rational a = reader.asPeriodic().frequency();
      Rational b = dep.asPeriodic().frequency();
      return a.max(b).isMultipleOf(a.min(b));
    } else if (reader.isEventDriven() && dep.isEventDriven()) {
      if (policy.eventCombination == EventCombination.DISJUNCTION) {
        return reader.asEventDriven().activation().streams().containsAll(
                dep.asEventDriven().activation().streams());
      } else {
        return reader.asEventDriven().activation().implies(
                dep.asEventDriven().activation());
      }
    }
    return false;
  }

  @Override
  public Collection<Var> children(Pacing value) {
    return ImmutableList.of();
  }
}
