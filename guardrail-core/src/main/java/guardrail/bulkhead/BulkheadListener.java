package guardrail.bulkhead;

import java.time.Duration;

/**
 * Alerting hooks for capacity problems.
 *
 * <p>Callbacks run outside the bulkhead's lock on whichever thread observed the event (the
 * caller for queue-full, the timer thread for timeouts). Exceptions thrown here are logged and
 * otherwise ignored; they never change admission decisions.
 */
public interface BulkheadListener {

  /** Listener that ignores every event. */
  BulkheadListener NOOP = new BulkheadListener() {
  };

  /**
   * A request was rejected because the queue was full.
   */
  default void onQueueFull(String serviceName, int queueCapacity) {
  }

  /**
   * A queued request waited longer than {@code waitTimeout} and was rejected.
   */
  default void onAdmissionTimeout(String serviceName, Duration waitTimeout) {
  }

  /**
   * A queue was drained by an operator.
   */
  default void onQueueCleared(String serviceName, int cancelled, String reason) {
  }
}
