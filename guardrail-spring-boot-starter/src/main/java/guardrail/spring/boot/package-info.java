/**
 * Spring Boot auto-configuration for guardrail.
 *
 * <p>{@link guardrail.spring.boot.GuardrailAutoConfiguration} wires a started
 * {@link guardrail.Guardrail} from {@code guardrail.*} application properties and exposes its
 * bulkhead registry, audit trail and session manager as beans.
 * {@link guardrail.spring.boot.GuardrailMicrometerAutoConfiguration} adds the Micrometer
 * exporter when a {@code MeterRegistry} is present.
 *
 * @see guardrail.spring.boot.GuardrailAutoConfiguration
 * @see guardrail.spring.boot.GuardrailProperties
 */
package guardrail.spring.boot;
