package guardrail.bulkhead;

/**
 * Raised immediately when a service's wait queue is already at capacity. No timer is
 * allocated and the queue is left untouched.
 */
public final class QueueFullException extends BulkheadRejectedException {

  private final int queueCapacity;
  private final int maxConcurrency;

  public QueueFullException(String serviceName, int queueCapacity, int maxConcurrency) {
    super(serviceName, "Bulkhead [" + serviceName + "] queue is full (capacity=" + queueCapacity
        + ", maxConcurrency=" + maxConcurrency + ")");
    this.queueCapacity = queueCapacity;
    this.maxConcurrency = maxConcurrency;
  }

  public int queueCapacity() {
    return queueCapacity;
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }
}
