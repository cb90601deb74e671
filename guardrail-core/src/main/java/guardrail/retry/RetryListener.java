package guardrail.retry;

/**
 * Observes retries scheduled by a {@link RetryExecutor}.
 */
public interface RetryListener {

  RetryListener NOOP = new RetryListener() {
  };

  /**
   * Called after a retryable failure, before the backoff delay starts.
   *
   * @param operationName name passed to {@link RetryExecutor#withRetry}
   * @param error         failure of the attempt that just ended
   * @param attempt       1-based number of the attempt that just failed
   * @param delayMs       backoff before the next attempt
   */
  default void onRetry(String operationName, Throwable error, int attempt, long delayMs) {
  }

  /**
   * Called once when the last permitted attempt fails with a retryable error.
   */
  default void onExhausted(String operationName, Throwable lastError, int attempts) {
  }
}
