/**
 * Root API for guardrail, a Spring-free resilience and compliance core for calls to
 * unreliable external services.
 *
 * <h2>Core Design</h2>
 * <p>Every external call is an {@link guardrail.AsyncOperation}. A
 * {@linkplain guardrail.bulkhead.BulkheadRegistry bulkhead} per service bounds how many calls
 * run and how many wait; a {@linkplain guardrail.retry.RetryExecutor retry executor} repeats
 * failed calls with exponential backoff and jitter, asking the bulkhead for a slot on every
 * attempt. Sensitive operations are recorded in a signed, append-only
 * {@linkplain guardrail.audit.AuditTrail audit trail}, and callers are gated by a
 * {@linkplain guardrail.session.SessionManager fixed-window session}.
 *
 * <p>All timers (queue wait timeouts, backoff delays, session warnings and expiries) share
 * one {@link guardrail.schedule.DeadlineScheduler}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>guardrail-core</b> - bulkhead, retry, audit, sessions, composite</li>
 *   <li><b>guardrail-micrometer</b> - {@link guardrail.spi.MetricsExporter} on Micrometer</li>
 *   <li><b>guardrail-spring-boot-starter</b> - auto-configuration from {@code guardrail.*}
 *       properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Guardrail guardrail = Guardrail.builder()
 *     .service("registry-lookup", ServiceProfile.NORMAL)
 *     .service("radiography-analysis", ServiceProfile.CRITICAL)
 *     .auditSink(sink)
 *     .auditSecretKey(System.getenv("AUDIT_SECRET_KEY"))
 *     .build()) {
 *   guardrail.start();
 *
 *   CompletableFuture<Report> report = guardrail.execute("radiography-analysis",
 *       () -> client.analyzeAsync(image));
 * }
 * }</pre>
 *
 * @see guardrail.Guardrail
 * @see guardrail.ServiceProfile
 * @see guardrail.AsyncOperation
 */
package guardrail;
