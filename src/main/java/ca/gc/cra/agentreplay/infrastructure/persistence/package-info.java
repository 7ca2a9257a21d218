/**
 * File-backed trace persistence.
 * <p><strong>Role:</strong> Adapter implementing {@link ca.gc.cra.agentreplay.application.port.TraceStore} over
 * NDJSON files.</p>
 * <p><strong>Metrics:</strong> Emits {@code trace.store.*} counters.</p>
 */
package ca.gc.cra.agentreplay.infrastructure.persistence;
