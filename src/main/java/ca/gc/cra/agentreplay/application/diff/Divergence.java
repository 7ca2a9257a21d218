package ca.gc.cra.agentreplay.application.diff;

import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import ca.gc.cra.agentreplay.domain.trace.TraceRecords;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One aligned position where two traces differ.
 *
 * @param position zero-based index into both canonical event orders
 * @param description human-readable explanation
 * @param severity classification
 * @param traceASpan name of the span owning the A-side event; empty when there is no A-side event
 * @param traceBSpan name of the span owning the B-side event; empty when there is no B-side event
 * @param traceAEvent A-side event, or {@code null} when trace A is exhausted at {@code position}
 * @param traceBEvent B-side event, or {@code null} when trace B is exhausted at {@code position}
 *
 * @since 0.1.0
 */
public record Divergence(
    int position,
    String description,
    Severity severity,
    String traceASpan,
    String traceBSpan,
    TraceEvent traceAEvent,
    TraceEvent traceBEvent) {

  /** Validates required components and normalizes missing span names to empty strings. */
  public Divergence {
    if (position < 0) {
      throw new IllegalArgumentException("position must be >= 0");
    }
    description = Objects.requireNonNull(description, "description");
    severity = Objects.requireNonNull(severity, "severity");
    traceASpan = traceASpan == null ? "" : traceASpan;
    traceBSpan = traceBSpan == null ? "" : traceBSpan;
    if (traceAEvent == null && traceBEvent == null) {
      throw new IllegalArgumentException("a divergence needs at least one event");
    }
  }

  public Optional<TraceEvent> traceAEventIfPresent() {
    return Optional.ofNullable(traceAEvent);
  }

  public Optional<TraceEvent> traceBEventIfPresent() {
    return Optional.ofNullable(traceBEvent);
  }

  /**
   * Returns the report form of this divergence.
   *
   * @return insertion-ordered map; absent events are {@code null}
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("position", position);
    map.put("description", description);
    map.put("severity", severity.wireValue());
    map.put("trace_a_span", traceASpan);
    map.put("trace_b_span", traceBSpan);
    map.put("trace_a_event", traceAEvent == null ? null : TraceRecords.eventToMap(traceAEvent));
    map.put("trace_b_event", traceBEvent == null ? null : TraceRecords.eventToMap(traceBEvent));
    return map;
  }
}
