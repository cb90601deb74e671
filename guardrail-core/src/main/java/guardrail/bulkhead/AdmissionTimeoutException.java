package guardrail.bulkhead;

import java.time.Duration;

/**
 * Raised when a queued operation was not promoted to execution within the service's wait
 * timeout. The operation was never invoked.
 */
public final class AdmissionTimeoutException extends BulkheadRejectedException {

  private final Duration waitTimeout;

  public AdmissionTimeoutException(String serviceName, Duration waitTimeout) {
    super(serviceName, "Bulkhead [" + serviceName + "] operation timeout after "
        + waitTimeout.toMillis() + "ms waiting for a slot");
    this.waitTimeout = waitTimeout;
  }

  public Duration waitTimeout() {
    return waitTimeout;
  }
}
