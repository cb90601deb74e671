package guardrail.bulkhead;

/**
 * Raised for every waiting operation when a queue is drained with
 * {@link Bulkhead#clearQueue(String)}.
 */
public final class QueueClearedException extends BulkheadRejectedException {

  private final String reason;

  public QueueClearedException(String serviceName, String reason) {
    super(serviceName, "Operation cancelled due to queue clear on bulkhead [" + serviceName
        + "]: " + reason);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
