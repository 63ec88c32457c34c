package stagequeue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps simulation minutes to wall-clock time.
 *
 * <p>All due-time arithmetic uses the sim-minute passed to each operation. The clock is
 * only consulted for record timestamps and for mapping an ETA to a calendar date when it
 * is persisted.
 */
public interface SimClock {

  /** Clock with no calendar anchor: {@link #calendarAt} always returns {@code null}. */
  SimClock UNANCHORED = unanchored(Clock.systemUTC());

  /**
   * Wall-clock time used for record timestamps.
   */
  Instant wallClockNow();

  /**
   * Calendar instant of a sim-minute, or {@code null} if the simulation is not anchored.
   */
  Instant calendarAt(long simMinute);

  static SimClock unanchored(Clock clock) {
    Objects.requireNonNull(clock, "clock");
    return new SimClock() {
      @Override
      public Instant wallClockNow() {
        return clock.instant();
      }

      @Override
      public Instant calendarAt(long simMinute) {
        return null;
      }
    };
  }

  /**
   * Clock whose sim-minute 0 corresponds to {@code simulationStart}.
   */
  static SimClock anchoredAt(Instant simulationStart, Clock clock) {
    Objects.requireNonNull(simulationStart, "simulationStart");
    Objects.requireNonNull(clock, "clock");
    return new SimClock() {
      @Override
      public Instant wallClockNow() {
        return clock.instant();
      }

      @Override
      public Instant calendarAt(long simMinute) {
        return simulationStart.plus(Duration.ofMinutes(simMinute));
      }
    };
  }
}
