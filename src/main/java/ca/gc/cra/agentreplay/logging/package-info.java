/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and shorten payload previews.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.agentreplay.logging;
