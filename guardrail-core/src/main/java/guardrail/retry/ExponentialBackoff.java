package guardrail.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Exponential backoff with additive jitter.
 *
 * <p>Delay formula for the zero-based retry index {@code k}:
 * {@code min(baseDelay * 2^k, maxDelay) + uniform[0, jitterMax]}. The result is therefore always
 * within {@code [min(base * 2^k, max), min(base * 2^k, max) + jitterMax]}.
 */
public final class ExponentialBackoff {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final long jitterMaxMs;

  /**
   * @param baseDelayMs delay before the first retry, &gt; 0
   * @param maxDelayMs  cap on the exponential part, &ge; baseDelayMs
   * @param jitterMaxMs upper bound of the random addition, &ge; 0
   */
  public ExponentialBackoff(long baseDelayMs, long maxDelayMs, long jitterMaxMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitterMaxMs < 0) {
      throw new IllegalArgumentException("jitterMaxMs must be >= 0, got: " + jitterMaxMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterMaxMs = jitterMaxMs;
  }

  public ExponentialBackoff(Duration baseDelay, Duration maxDelay, Duration jitterMax) {
    this(baseDelay.toMillis(), maxDelay.toMillis(), jitterMax.toMillis());
  }

  public long computeDelayMs(int attemptIndex) {
    return computeDelayMs(attemptIndex, ThreadLocalRandom.current());
  }

  /**
   * @param attemptIndex zero-based index of the retry about to be scheduled
   * @param random       jitter source
   * @return delay in milliseconds
   */
  public long computeDelayMs(int attemptIndex, RandomGenerator random) {
    Objects.requireNonNull(random, "random");
    long jitter = jitterMaxMs == 0 ? 0L : random.nextLong(jitterMaxMs + 1);
    return exponentialDelayMs(attemptIndex) + jitter;
  }

  /**
   * @return the capped exponential part of the delay, without jitter
   */
  public long exponentialDelayMs(int attemptIndex) {
    if (attemptIndex < 0) {
      throw new IllegalArgumentException("attemptIndex must be >= 0, got: " + attemptIndex);
    }
    if (attemptIndex >= 62) {
      return maxDelayMs;
    }
    long shift = 1L << attemptIndex;
    // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
    if (shift > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * shift);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public long jitterMaxMs() {
    return jitterMaxMs;
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{base=" + baseDelayMs + "ms, max=" + maxDelayMs
        + "ms, jitter=" + jitterMaxMs + "ms}";
  }
}
