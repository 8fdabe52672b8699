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

import java.util.function.IntFunction;

import com.google.common.base.Preconditions;

/**
 * The clock of a stream: periodic with an exact frequency, or
 * event-driven with an activation condition over other streams.
 */
public abstract class Pacing {

  public static enum PacingKind {
    PERIODIC, EVENT_DRIVEN,
    /** Placeholder after an error was reported: unifies with anything */
    ERROR;
  }

  public static final Pacing ERROR = new ErrorPacing();

  public abstract PacingKind kind();

  public boolean isPeriodic() {
    return kind() == PacingKind.PERIODIC;
  }

  public boolean isEventDriven() {
    return kind() == PacingKind.EVENT_DRIVEN;
  }

  public boolean isError() {
    return kind() == PacingKind.ERROR;
  }

  public Periodic asPeriodic() {
    Preconditions.checkState(isPeriodic(), "Not periodic: %s", this);
    return (Periodic) this;
  }

  public EventDriven asEventDriven() {
    Preconditions.checkState(isEventDriven(), "Not event-driven: %s", this);
    return (EventDriven) this;
  }

  public static Periodic periodic(Rational hertz) {
    return new Periodic(hertz);
  }

  public static EventDriven eventDriven(Activation activation) {
    return new EventDriven(activation);
  }

  public abstract String toString(IntFunction<String> names);

  @Override
  public String toString() {
    return toString(new IntFunction<String>() {
      @Override
      public String apply(int value) {
        return "#" + value;
      }
    });
  }

  public static final class Periodic extends Pacing {
    private final Rational frequency;

    private Periodic(Rational frequency) {
      Preconditions.checkArgument(frequency.isPositive(),
                                  "Frequency must be positive: %s", frequency);
      this.frequency = frequency;
    }

    @Override
    public PacingKind kind() {
      return PacingKind.PERIODIC;
    }

    /** Frequency in Hz */
    public Rational frequency() {
      return frequency;
    }

    /** Period in seconds */
    public Rational period() {
      return frequency.reciprocal();
    }

    @Override
    public String toString(IntFunction<String> names) {
      return "@" + frequency + "Hz";
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Periodic &&
          frequency.equals(((Periodic) obj).frequency);
    }

    @Override
    public int hashCode() {
      return frequency.hashCode();
    }
  }

  public static final class EventDriven extends Pacing {
    private final Activation activation;

    private EventDriven(Activation activation) {
      this.activation = activation;
    }

    @Override
    public PacingKind kind() {
      return PacingKind.EVENT_DRIVEN;
    }

    public Activation activation() {
      return activation;
    }

    @Override
    public String toString(IntFunction<String> names) {
      return "@(" + activation.toString(names) + ")";
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof EventDriven &&
          activation.equals(((EventDriven) obj).activation);
    }

    @Override
    public int hashCode() {
      return activation.hashCode() * 17;
    }
  }

  private static final class ErrorPacing extends Pacing {
    @Override
    public PacingKind kind() {
      return PacingKind.ERROR;
    }

    @Override
    public String toString(IntFunction<String> names) {
      return "<error>";
    }
  }
}
