package guardrail.spring.boot;

import guardrail.ServiceProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for guardrail.
 *
 * <p>Per-service entries start from their {@code profile} (or {@code default-profile}) and
 * override only the limits that are set:
 *
 * <pre>
 * guardrail.services.pacs.profile=CRITICAL
 * guardrail.services.pacs.max-concurrency=3
 * guardrail.services.pacs.wait-timeout=2s
 * </pre>
 *
 * @see GuardrailAutoConfiguration
 */
@ConfigurationProperties(prefix = "guardrail")
public class GuardrailProperties {

    /**
     * Profile for services without an entry under {@code guardrail.services}.
     */
    private ServiceProfile defaultProfile = ServiceProfile.NORMAL;

    /**
     * Per-service bulkhead and retry settings, keyed by service name.
     */
    private final Map<String, Service> services = new LinkedHashMap<>();

    private final Audit audit = new Audit();
    private final Session session = new Session();
    private final Metrics metrics = new Metrics();

    public ServiceProfile getDefaultProfile() {
        return defaultProfile;
    }

    public void setDefaultProfile(ServiceProfile defaultProfile) {
        this.defaultProfile = defaultProfile;
    }

    public Map<String, Service> getServices() {
        return services;
    }

    public Audit getAudit() {
        return audit;
    }

    public Session getSession() {
        return session;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Overrides for one service. Unset fields keep the value from {@link #getProfile()}.
     */
    public static class Service {
        /**
         * Base profile. Falls back to {@code guardrail.default-profile} when unset.
         */
        private ServiceProfile profile;
        private Integer maxConcurrency;
        private Integer queueCapacity;
        private Duration waitTimeout;
        private Integer maxAttempts;
        private Duration baseDelay;
        private Duration maxDelay;
        private Duration jitter;

        public ServiceProfile getProfile() {
            return profile;
        }

        public void setProfile(ServiceProfile profile) {
            this.profile = profile;
        }

        public Integer getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public Integer getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(Integer queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getJitter() {
            return jitter;
        }

        public void setJitter(Duration jitter) {
            this.jitter = jitter;
        }
    }

    public static class Audit {
        /**
         * HMAC secret for integrity hashes. A random per-process key is used when unset.
         */
        private String secretKey;
        private int bufferCapacity = 100;
        private Duration flushInterval = Duration.ofSeconds(10);
        private int highWaterMark = 1000;

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public int getHighWaterMark() {
            return highWaterMark;
        }

        public void setHighWaterMark(int highWaterMark) {
            this.highWaterMark = highWaterMark;
        }
    }

    public static class Session {
        private Duration duration = Duration.ofMinutes(20);
        private Duration warningLead = Duration.ofMinutes(2);
        private Duration expiredRetention = Duration.ofMinutes(5);

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public Duration getWarningLead() {
            return warningLead;
        }

        public void setWarningLead(Duration warningLead) {
            this.warningLead = warningLead;
        }

        public Duration getExpiredRetention() {
            return expiredRetention;
        }

        public void setExpiredRetention(Duration expiredRetention) {
            this.expiredRetention = expiredRetention;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "guardrail";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
