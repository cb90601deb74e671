/**
 * Append-only audit trail with HMAC integrity hashes.
 *
 * <p>Callers describe operations with {@link guardrail.audit.AuditEntry}; the
 * {@link guardrail.audit.AuditTrail} turns each into a signed, immutable
 * {@link guardrail.audit.AuditEvent}, buffers it, and hands batches to an
 * {@link guardrail.audit.AuditSink}. Data-subject identifiers only ever appear as keyed hashes.
 */
package guardrail.audit;
