/**
 * Ports consumed by the replay, diff, and recording use cases.
 * <p><strong>Role:</strong> Interfaces implemented by infrastructure adapters (NDJSON store, exporters, metrics).</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.agentreplay.application.port.MetricsPort} names follow the
 * {@code trace.store.*}, {@code diff.*}, and {@code export.*} namespaces.</p>
 */
package ca.gc.cra.agentreplay.application.port;
