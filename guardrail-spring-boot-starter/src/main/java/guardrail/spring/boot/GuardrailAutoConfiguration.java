package guardrail.spring.boot;

import guardrail.Guardrail;
import guardrail.ServiceProfile;
import guardrail.audit.AuditAlertListener;
import guardrail.audit.AuditSink;
import guardrail.audit.AuditTrail;
import guardrail.bulkhead.BulkheadConfig;
import guardrail.bulkhead.BulkheadListener;
import guardrail.bulkhead.BulkheadRegistry;
import guardrail.retry.ExponentialBackoff;
import guardrail.retry.RetryListener;
import guardrail.retry.RetryPolicy;
import guardrail.session.SessionListener;
import guardrail.session.SessionManager;
import guardrail.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.Map;

/**
 * Auto-configuration for guardrail.
 *
 * <p>Wires a started {@link Guardrail} composite from {@link GuardrailProperties}. Optional
 * beans of type {@link AuditSink}, {@link MetricsExporter}, {@link AuditAlertListener},
 * {@link SessionListener}, {@link BulkheadListener} and {@link RetryListener} are picked up
 * when present.
 *
 * @see GuardrailProperties
 * @see GuardrailMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Guardrail.class)
@EnableConfigurationProperties(GuardrailProperties.class)
public class GuardrailAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Guardrail guardrail(GuardrailProperties props,
                               ObjectProvider<AuditSink> auditSinkProvider,
                               ObjectProvider<MetricsExporter> metricsProvider,
                               ObjectProvider<AuditAlertListener> alertProvider,
                               ObjectProvider<SessionListener> sessionListenerProvider,
                               ObjectProvider<BulkheadListener> bulkheadListenerProvider,
                               ObjectProvider<RetryListener> retryListenerProvider) {

        var audit = props.getAudit();
        var session = props.getSession();
        var builder = Guardrail.builder()
                .defaultProfile(props.getDefaultProfile())
                .metrics(metricsProvider.getIfAvailable())
                .auditSink(auditSinkProvider.getIfAvailable())
                .auditSecretKey(audit.getSecretKey())
                .auditBufferCapacity(audit.getBufferCapacity())
                .auditFlushInterval(audit.getFlushInterval())
                .auditHighWaterMark(audit.getHighWaterMark())
                .auditAlertListener(alertProvider.getIfAvailable())
                .sessionDuration(session.getDuration())
                .sessionWarningLead(session.getWarningLead())
                .sessionExpiredRetention(session.getExpiredRetention())
                .sessionListener(sessionListenerProvider.getIfAvailable())
                .bulkheadListener(bulkheadListenerProvider.getIfAvailable())
                .retryListener(retryListenerProvider.getIfAvailable());

        for (Map.Entry<String, GuardrailProperties.Service> entry : props.getServices().entrySet()) {
            ServiceProfile profile = entry.getValue().getProfile() != null
                    ? entry.getValue().getProfile() : props.getDefaultProfile();
            builder.service(entry.getKey(),
                    bulkheadConfig(profile, entry.getValue()),
                    retryPolicy(profile, entry.getValue()));
        }

        Guardrail guardrail = builder.build();
        guardrail.start();
        return guardrail;
    }

    @Bean
    @ConditionalOnMissingBean
    public BulkheadRegistry bulkheadRegistry(Guardrail guardrail) {
        return guardrail.bulkheads();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrail auditTrail(Guardrail guardrail) {
        return guardrail.auditTrail();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionManager sessionManager(Guardrail guardrail) {
        return guardrail.sessions();
    }

    static BulkheadConfig bulkheadConfig(ServiceProfile profile, GuardrailProperties.Service service) {
        BulkheadConfig base = profile.bulkhead();
        return new BulkheadConfig(
                service.getMaxConcurrency() != null ? service.getMaxConcurrency() : base.maxConcurrency(),
                service.getQueueCapacity() != null ? service.getQueueCapacity() : base.queueCapacity(),
                service.getWaitTimeout() != null ? service.getWaitTimeout() : base.waitTimeout());
    }

    static RetryPolicy retryPolicy(ServiceProfile profile, GuardrailProperties.Service service) {
        RetryPolicy base = profile.retry();
        if (service.getMaxAttempts() == null && service.getBaseDelay() == null
                && service.getMaxDelay() == null && service.getJitter() == null) {
            return base;
        }
        ExponentialBackoff backoff = base.backoff();
        return RetryPolicy.builder()
                .maxAttempts(service.getMaxAttempts() != null
                        ? service.getMaxAttempts() : base.maxAttempts())
                .backoff(
                        orElse(service.getBaseDelay(), backoff.baseDelayMs()),
                        orElse(service.getMaxDelay(), backoff.maxDelayMs()),
                        orElse(service.getJitter(), backoff.jitterMaxMs()))
                .classifier(base.classifier())
                .build();
    }

    private static Duration orElse(Duration value, long fallbackMs) {
        return value != null ? value : Duration.ofMillis(fallbackMs);
    }
}
