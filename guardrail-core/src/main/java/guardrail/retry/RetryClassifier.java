package guardrail.retry;

/**
 * Decides whether a failed attempt may be retried.
 *
 * @see RetryClassifiers
 */
@FunctionalInterface
public interface RetryClassifier {

  /**
   * @param error the failure of the last attempt, already unwrapped from
   *              {@link java.util.concurrent.CompletionException}
   * @return true if another attempt may succeed
   */
  boolean isRetryable(Throwable error);
}
