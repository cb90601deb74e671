package guardrail.micrometer;

import guardrail.audit.RiskLevel;
import guardrail.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and distribution summaries with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends. Per-service meters
 * are created on first use and tagged with {@code service} (bulkheads) or {@code operation}
 * (retries).
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code guardrail.bulkhead.admitted} - operations started, tag {@code service}</li>
 *   <li>{@code guardrail.bulkhead.queued} - operations that had to wait</li>
 *   <li>{@code guardrail.bulkhead.rejected} - tags {@code service}, {@code reason}
 *       ({@code queue_full} or {@code timeout})</li>
 *   <li>{@code guardrail.retry.attempts} - retries scheduled, tag {@code operation}</li>
 *   <li>{@code guardrail.retry.exhausted} - operations that ran out of attempts</li>
 *   <li>{@code guardrail.audit.events} - events logged, tag {@code risk}</li>
 *   <li>{@code guardrail.audit.flush.failures} - batches rejected by the sink</li>
 *   <li>{@code guardrail.session.expired} - sessions that reached their expiry</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code guardrail.bulkhead.active} - running operations, tag {@code service}</li>
 *   <li>{@code guardrail.bulkhead.queue.depth} - waiting operations, tag {@code service}</li>
 *   <li>{@code guardrail.audit.buffer.size} - events waiting to be flushed</li>
 *   <li>{@code guardrail.session.active} - sessions that have not expired</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code guardrail.bulkhead.execution.ms} - run time of admitted operations</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<RiskLevel, Counter> auditEvents = new EnumMap<>(RiskLevel.class);
    private final Counter auditFlushFailures;
    private final Counter sessionsExpired;
    private final Gauge auditBufferGauge;
    private final Gauge activeSessionsGauge;
    private final AtomicInteger auditBufferSize = new AtomicInteger();
    private final AtomicInteger activeSessions = new AtomicInteger();

    private final ConcurrentHashMap<String, ServiceMeters> services = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, OperationMeters> operations = new ConcurrentHashMap<>();
    private final List<Meter> dynamicMeters = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "guardrail"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "guardrail");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "imaging.guardrail"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        for (RiskLevel risk : RiskLevel.values()) {
            auditEvents.put(risk, Counter.builder(namePrefix + ".audit.events")
                    .description("Audit events logged")
                    .tag("risk", risk.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.auditFlushFailures = Counter.builder(namePrefix + ".audit.flush.failures")
                .description("Audit batches rejected by the sink and re-buffered")
                .register(registry);
        this.sessionsExpired = Counter.builder(namePrefix + ".session.expired")
                .description("Sessions that reached their fixed expiry")
                .register(registry);
        this.auditBufferGauge = Gauge.builder(namePrefix + ".audit.buffer.size", auditBufferSize,
                        AtomicInteger::get)
                .register(registry);
        this.activeSessionsGauge = Gauge.builder(namePrefix + ".session.active", activeSessions,
                        AtomicInteger::get)
                .register(registry);
    }

    @Override
    public void incrementBulkheadAdmitted(String serviceName) {
        if (closed) return;
        service(serviceName).admitted.increment();
    }

    @Override
    public void incrementBulkheadQueued(String serviceName) {
        if (closed) return;
        service(serviceName).queued.increment();
    }

    @Override
    public void incrementBulkheadQueueFull(String serviceName) {
        if (closed) return;
        service(serviceName).rejectedQueueFull.increment();
    }

    @Override
    public void incrementBulkheadTimeout(String serviceName) {
        if (closed) return;
        service(serviceName).rejectedTimeout.increment();
    }

    @Override
    public void recordBulkheadState(String serviceName, int active, int queued) {
        if (closed) return;
        ServiceMeters meters = service(serviceName);
        meters.active.set(active);
        meters.queueDepth.set(queued);
    }

    @Override
    public void recordBulkheadExecutionMs(String serviceName, long durationMs) {
        if (closed) return;
        service(serviceName).execution.record(durationMs);
    }

    @Override
    public void incrementRetryAttempt(String operationName) {
        if (closed) return;
        operation(operationName).attempts.increment();
    }

    @Override
    public void incrementRetriesExhausted(String operationName) {
        if (closed) return;
        operation(operationName).exhausted.increment();
    }

    @Override
    public void incrementAuditEvent(RiskLevel riskLevel) {
        if (closed) return;
        auditEvents.get(riskLevel).increment();
    }

    @Override
    public void incrementAuditFlushFailure() {
        if (closed) return;
        auditFlushFailures.increment();
    }

    @Override
    public void recordAuditBufferSize(int size) {
        if (closed) return;
        auditBufferSize.set(size);
    }

    @Override
    public void incrementSessionExpired() {
        if (closed) return;
        sessionsExpired.increment();
    }

    @Override
    public void recordActiveSessions(int count) {
        if (closed) return;
        activeSessions.set(count);
    }

    private ServiceMeters service(String serviceName) {
        return services.computeIfAbsent(serviceName, ServiceMeters::new);
    }

    private OperationMeters operation(String operationName) {
        return operations.computeIfAbsent(operationName, OperationMeters::new);
    }

    private <M extends Meter> M track(M meter) {
        dynamicMeters.add(meter);
        return meter;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link guardrail.Guardrail} is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(auditEvents.values());
        meters.add(auditFlushFailures);
        meters.add(sessionsExpired);
        meters.add(auditBufferGauge);
        meters.add(activeSessionsGauge);
        meters.addAll(dynamicMeters);
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    private final class ServiceMeters {
        private final Counter admitted;
        private final Counter queued;
        private final Counter rejectedQueueFull;
        private final Counter rejectedTimeout;
        private final DistributionSummary execution;
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger queueDepth = new AtomicInteger();

        private ServiceMeters(String serviceName) {
            this.admitted = track(Counter.builder(namePrefix + ".bulkhead.admitted")
                    .description("Operations admitted by the bulkhead")
                    .tag("service", serviceName)
                    .register(registry));
            this.queued = track(Counter.builder(namePrefix + ".bulkhead.queued")
                    .description("Operations that waited for a bulkhead slot")
                    .tag("service", serviceName)
                    .register(registry));
            this.rejectedQueueFull = track(Counter.builder(namePrefix + ".bulkhead.rejected")
                    .description("Operations rejected by the bulkhead")
                    .tag("service", serviceName)
                    .tag("reason", "queue_full")
                    .register(registry));
            this.rejectedTimeout = track(Counter.builder(namePrefix + ".bulkhead.rejected")
                    .description("Operations rejected by the bulkhead")
                    .tag("service", serviceName)
                    .tag("reason", "timeout")
                    .register(registry));
            this.execution = track(DistributionSummary.builder(namePrefix + ".bulkhead.execution.ms")
                    .description("Run time of admitted operations in milliseconds")
                    .tag("service", serviceName)
                    .register(registry));
            track(Gauge.builder(namePrefix + ".bulkhead.active", active, AtomicInteger::get)
                    .tag("service", serviceName)
                    .register(registry));
            track(Gauge.builder(namePrefix + ".bulkhead.queue.depth", queueDepth, AtomicInteger::get)
                    .tag("service", serviceName)
                    .register(registry));
        }
    }

    private final class OperationMeters {
        private final Counter attempts;
        private final Counter exhausted;

        private OperationMeters(String operationName) {
            this.attempts = track(Counter.builder(namePrefix + ".retry.attempts")
                    .description("Retries scheduled after a retryable failure")
                    .tag("operation", operationName)
                    .register(registry));
            this.exhausted = track(Counter.builder(namePrefix + ".retry.exhausted")
                    .description("Operations that failed on every permitted attempt")
                    .tag("operation", operationName)
                    .register(registry));
        }
    }
}
