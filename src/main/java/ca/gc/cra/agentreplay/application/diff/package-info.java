/**
 * Positional comparison of two traces.
 * <p><strong>Role:</strong> Produces {@link ca.gc.cra.agentreplay.application.diff.DiffResult} reports consumed by
 * the CLI and JSON output.</p>
 * <p><strong>Metrics:</strong> Emits {@code diff.*} counters and observations.</p>
 */
package ca.gc.cra.agentreplay.application.diff;
