package guardrail;

import guardrail.bulkhead.BulkheadConfig;
import guardrail.retry.RetryPolicy;

/**
 * Named pairing of admission limits and retry settings for a class of external service.
 */
public enum ServiceProfile {
  /** Calls on the clinical hot path, e.g. image analysis. */
  CRITICAL(BulkheadConfig.of(10, 50, 5_000), RetryPolicy.CRITICAL),
  NORMAL(BulkheadConfig.of(5, 20, 10_000), RetryPolicy.NORMAL),
  /** Reports, exports and other work nobody is waiting on. */
  BACKGROUND(BulkheadConfig.of(2, 10, 30_000), RetryPolicy.BACKGROUND);

  private final BulkheadConfig bulkhead;
  private final RetryPolicy retry;

  ServiceProfile(BulkheadConfig bulkhead, RetryPolicy retry) {
    this.bulkhead = bulkhead;
    this.retry = retry;
  }

  public BulkheadConfig bulkhead() {
    return bulkhead;
  }

  public RetryPolicy retry() {
    return retry;
  }
}
