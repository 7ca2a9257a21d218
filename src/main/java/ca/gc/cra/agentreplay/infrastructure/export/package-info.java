/**
 * Exporters rendering traces as standalone JSON and HTML documents.
 * <p><strong>Metrics:</strong> Emits {@code export.json} and {@code export.html} counters.</p>
 */
package ca.gc.cra.agentreplay.infrastructure.export;
