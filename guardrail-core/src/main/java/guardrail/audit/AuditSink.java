package guardrail.audit;

import java.util.List;

/**
 * Durable destination for audit batches, e.g. an append-only table or a WORM bucket.
 *
 * <p>Calls are serialized by the trail: at most one {@code appendBatch} runs at a time.
 * A batch must be stored completely or not at all; on failure the trail re-buffers every
 * event in it, so the sink may see the same events again.
 */
@FunctionalInterface
public interface AuditSink {

  /**
   * Stores {@code events} in order.
   *
   * @param events non-empty, in logging order
   * @throws AuditSinkException if the batch was not stored
   */
  void appendBatch(List<AuditEvent> events) throws AuditSinkException;
}
