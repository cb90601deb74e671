/**
 * Retry with exponential backoff and jitter.
 *
 * <p>Failures are classified once, at their origin, into an {@link guardrail.retry.ErrorKind};
 * {@link guardrail.retry.RetryClassifier} implementations decide on that kind alone.
 *
 * @see guardrail.retry.RetryExecutor
 * @see guardrail.retry.RetryPolicy
 * @see guardrail.retry.ExponentialBackoff
 */
package guardrail.retry;
