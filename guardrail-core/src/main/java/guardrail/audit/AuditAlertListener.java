package guardrail.audit;

/**
 * Alerting hooks for an {@link AuditTrail} that cannot keep up with its sink.
 */
public interface AuditAlertListener {

  AuditAlertListener NOOP = new AuditAlertListener() {
  };

  /**
   * The buffer holds at least {@code highWaterMark} unflushed events. Called on every append
   * while the condition holds.
   */
  default void onBufferHighWater(int buffered, int highWaterMark) {
  }

  /**
   * The sink rejected a batch; the events were put back into the buffer.
   */
  default void onFlushFailure(int batchSize, Exception error) {
  }
}
