/**
 * Trace data model: traces, spans, events, and their record form.
 * <p><strong>Role:</strong> Domain layer; free of I/O and framework dependencies.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.agentreplay.domain.trace.Trace} and
 * {@link ca.gc.cra.agentreplay.domain.trace.Span} are mutable and not thread-safe; events are immutable.</p>
 * <p><strong>Ordering:</strong> Canonical event order is by timestamp with storage order breaking ties.</p>
 */
package ca.gc.cra.agentreplay.domain.trace;
