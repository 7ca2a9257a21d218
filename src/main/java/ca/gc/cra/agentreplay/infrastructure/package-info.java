/**
 * Adapters implementing application ports: NDJSON persistence, exporters, and OpenTelemetry metrics.
 */
package ca.gc.cra.agentreplay.infrastructure;
