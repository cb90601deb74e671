package guardrail.bulkhead;

import java.time.Duration;
import java.util.Objects;

/**
 * Admission limits for one named service.
 *
 * @param maxConcurrency operations allowed to run at the same time, &gt; 0
 * @param queueCapacity  operations allowed to wait for a slot, &ge; 0
 * @param waitTimeout    how long a queued operation may wait before it is rejected, &gt; 0
 */
public record BulkheadConfig(int maxConcurrency, int queueCapacity, Duration waitTimeout) {

  public BulkheadConfig {
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + maxConcurrency);
    }
    if (queueCapacity < 0) {
      throw new IllegalArgumentException("queueCapacity must be >= 0, got: " + queueCapacity);
    }
    Objects.requireNonNull(waitTimeout, "waitTimeout");
    if (waitTimeout.isZero() || waitTimeout.isNegative()) {
      throw new IllegalArgumentException("waitTimeout must be positive, got: " + waitTimeout);
    }
  }

  public static BulkheadConfig of(int maxConcurrency, int queueCapacity, long waitTimeoutMs) {
    return new BulkheadConfig(maxConcurrency, queueCapacity, Duration.ofMillis(waitTimeoutMs));
  }
}
