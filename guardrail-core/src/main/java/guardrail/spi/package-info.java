/**
 * Service provider interfaces implemented outside the core.
 *
 * @see guardrail.spi.MetricsExporter
 * @see guardrail.audit.AuditSink
 */
package guardrail.spi;
