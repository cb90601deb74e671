package guardrail.bulkhead;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a bulkhead's wait queue.
 *
 * @param length         entries waiting now
 * @param capacity       configured queue capacity
 * @param averageWait    mean time the current entries have been waiting, zero when empty
 * @param oldestEnqueued when the head entry was queued, {@code null} when empty
 */
public record QueueInfo(int length, int capacity, Duration averageWait, Instant oldestEnqueued) {
}
