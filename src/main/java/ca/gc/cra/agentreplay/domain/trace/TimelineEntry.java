package ca.gc.cra.agentreplay.domain.trace;

import java.util.Objects;

/**
 * One position on a trace's global timeline: an event together with the span that owns it.
 *
 * @param span owning span; never {@code null}
 * @param event recorded event; never {@code null}
 *
 * @since 0.1.0
 */
public record TimelineEntry(Span span, TraceEvent event) {

  /** Validates that both halves are present. */
  public TimelineEntry {
    span = Objects.requireNonNull(span, "span");
    event = Objects.requireNonNull(event, "event");
  }
}
