package guardrail.spring.boot;

import guardrail.Guardrail;
import guardrail.micrometer.MicrometerMetricsExporter;
import guardrail.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GuardrailMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    GuardrailMicrometerAutoConfiguration.class,
                    GuardrailAutoConfiguration.class))
            .withPropertyValues("guardrail.audit.secret-key=test-secret");

    @Test
    void createsMicrometerExporterByDefault() {
        runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void guardrailReportsThroughRegistry() {
        runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
            var guardrail = ctx.getBean(Guardrail.class);
            guardrail.execute("pacs", () -> CompletableFuture.completedFuture("ok")).join();

            var registry = ctx.getBean(MeterRegistry.class);
            var admitted = registry.find("guardrail.bulkhead.admitted").tag("service", "pacs").counter();
            assertNotNull(admitted);
            assertEquals(1.0, admitted.count());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("guardrail.metrics.name-prefix=imaging.guardrail")
                .run(ctx -> {
                    var registry = ctx.getBean(MeterRegistry.class);
                    assertNotNull(registry.find("imaging.guardrail.audit.flush.failures").counter());
                });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("guardrail.metrics.enabled=false")
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerMetricsExporter"));
                    assertTrue(ctx.containsBean("guardrail"));
                });
    }

    @Test
    void skippedWithoutMeterRegistry() {
        runner.run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
            assertTrue(ctx.containsBean("guardrail"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(MeterRegistryConfig.class, CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
