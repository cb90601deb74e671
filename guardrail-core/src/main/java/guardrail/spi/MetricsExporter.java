package guardrail.spi;

import guardrail.audit.RiskLevel;

/**
 * Observability hook for exporting bulkhead, retry, audit and session signals to a metrics
 * backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer, Prometheus or another monitoring system. Implementations are called from
 * arbitrary threads, sometimes from timer callbacks, and must not block.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * An operation was admitted and started running, either directly or after promotion.
   */
  void incrementBulkheadAdmitted(String serviceName);

  /**
   * An operation had to wait in the bulkhead queue.
   */
  void incrementBulkheadQueued(String serviceName);

  /**
   * An operation was rejected because the queue was at capacity.
   */
  void incrementBulkheadQueueFull(String serviceName);

  /**
   * A queued operation's wait timeout fired before it was promoted.
   */
  void incrementBulkheadTimeout(String serviceName);

  /**
   * Records the current number of running and queued operations for a service.
   */
  void recordBulkheadState(String serviceName, int active, int queued);

  /**
   * Records how long an admitted operation ran.
   */
  default void recordBulkheadExecutionMs(String serviceName, long durationMs) {
  }

  /**
   * A failed attempt is about to be retried.
   */
  void incrementRetryAttempt(String operationName);

  /**
   * All attempts of an operation failed with retryable errors.
   */
  void incrementRetriesExhausted(String operationName);

  /**
   * An audit event was appended to the buffer.
   */
  void incrementAuditEvent(RiskLevel riskLevel);

  /**
   * The audit sink rejected a batch; the events were re-buffered.
   */
  void incrementAuditFlushFailure();

  /**
   * Records the number of audit events waiting to be flushed.
   */
  void recordAuditBufferSize(int size);

  /**
   * A session reached its fixed expiry.
   */
  void incrementSessionExpired();

  /**
   * Records the number of sessions that have not expired.
   */
  default void recordActiveSessions(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementBulkheadAdmitted(String serviceName) {
    }

    @Override
    public void incrementBulkheadQueued(String serviceName) {
    }

    @Override
    public void incrementBulkheadQueueFull(String serviceName) {
    }

    @Override
    public void incrementBulkheadTimeout(String serviceName) {
    }

    @Override
    public void recordBulkheadState(String serviceName, int active, int queued) {
    }

    @Override
    public void incrementRetryAttempt(String operationName) {
    }

    @Override
    public void incrementRetriesExhausted(String operationName) {
    }

    @Override
    public void incrementAuditEvent(RiskLevel riskLevel) {
    }

    @Override
    public void incrementAuditFlushFailure() {
    }

    @Override
    public void recordAuditBufferSize(int size) {
    }

    @Override
    public void incrementSessionExpired() {
    }
  }
}
