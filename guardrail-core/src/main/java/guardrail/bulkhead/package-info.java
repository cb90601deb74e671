/**
 * Per-service admission control.
 *
 * <p>{@link guardrail.bulkhead.BulkheadRegistry} keeps one {@link guardrail.bulkhead.Bulkhead}
 * per service name. Each bulkhead bounds concurrent executions and the depth of a FIFO wait
 * queue; waiting requests are rejected after a wait timeout, and requests arriving at a full
 * queue are rejected at once.
 *
 * @see guardrail.bulkhead.BulkheadRegistry
 * @see guardrail.bulkhead.BulkheadConfig
 * @see guardrail.bulkhead.BulkheadRejectedException
 */
package guardrail.bulkhead;
