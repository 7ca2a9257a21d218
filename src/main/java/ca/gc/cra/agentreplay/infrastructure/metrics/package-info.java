/**
 * OpenTelemetry implementation of {@link ca.gc.cra.agentreplay.application.port.MetricsPort}.
 * <p><strong>Configuration:</strong> Honors {@code otel.*} system properties set by the CLI; exporting is off by
 * default.</p>
 */
package ca.gc.cra.agentreplay.infrastructure.metrics;
