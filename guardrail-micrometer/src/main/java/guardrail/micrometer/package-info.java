/**
 * Micrometer bridge for exporting guardrail metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link guardrail.micrometer.MicrometerMetricsExporter} implements the
 * {@link guardrail.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see guardrail.micrometer.MicrometerMetricsExporter
 */
package guardrail.micrometer;
