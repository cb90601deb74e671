package guardrail.schedule;

import java.time.Instant;

/**
 * Source of wall-clock and monotonic time.
 *
 * <p>Deadlines are always computed from {@link #nanoTime()}; {@link #now()} is only used for
 * timestamps that are reported to callers (session start, audit event time).
 */
public interface TimeSource {

  /** Time source backed by {@link System#nanoTime()} and {@link Instant#now()}. */
  TimeSource SYSTEM = new TimeSource() {
    @Override
    public long nanoTime() {
      return System.nanoTime();
    }

    @Override
    public Instant now() {
      return Instant.now();
    }
  };

  /**
   * @return monotonic time in nanoseconds, only meaningful as a difference
   */
  long nanoTime();

  /**
   * @return the current wall-clock instant
   */
  Instant now();
}
