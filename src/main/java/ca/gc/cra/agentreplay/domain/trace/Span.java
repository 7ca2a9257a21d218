package ca.gc.cra.agentreplay.domain.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Named, time-bounded group of events recorded by one unit of agent work.
 * <p><strong>Why:</strong> Spans give operators a readable grouping (e.g., {@code plan}, {@code search})
 * when replaying or diffing a run.</p>
 * <p><strong>Role:</strong> Domain entity owned by exactly one {@link Trace}. Nesting is expressed through
 * {@link #parentId()} only; the trace stores spans in a flat list and {@link SpanIndex} rebuilds the
 * hierarchy on demand.</p>
 * <p><strong>Lifecycle:</strong> created open by {@link Trace#addSpan(String)}; {@link #close()} stamps the
 * end time. Calling {@code close()} again overwrites the end time. Events may still be appended after
 * close.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one recording session mutates a span at a time.</p>
 *
 * @since 0.1.0
 */
public final class Span {
  private final String name;
  private final String spanId;
  private final String parentId;
  private final double startTime;
  private Double endTime;
  private final List<TraceEvent> events;
  private final Map<String, Object> metadata;
  private final TraceClock clock;

  Span(
      String name,
      String spanId,
      String parentId,
      double startTime,
      Double endTime,
      List<TraceEvent> events,
      Map<String, Object> metadata,
      TraceClock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.spanId = spanId == null || spanId.isBlank() ? TraceIds.newSpanId() : spanId;
    this.parentId = parentId == null || parentId.isBlank() ? null : parentId;
    this.startTime = startTime;
    this.endTime = endTime;
    this.events = events == null ? new ArrayList<>() : new ArrayList<>(events);
    this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends a new event stamped with the current time.
   *
   * @param eventType kind of occurrence
   * @param data payload; {@code null} records an empty payload
   * @return the appended event
   */
  public TraceEvent addEvent(EventType eventType, Map<String, Object> data) {
    TraceEvent event = TraceEvent.of(eventType, clock.nowSeconds(), data);
    events.add(event);
    return event;
  }

  /**
   * Appends a new event with an empty payload.
   *
   * @param eventType kind of occurrence
   * @return the appended event
   */
  public TraceEvent addEvent(EventType eventType) {
    return addEvent(eventType, null);
  }

  /**
   * Stamps the end time with the current time, overwriting any previous end time.
   */
  public void close() {
    endTime = clock.nowSeconds();
  }

  public boolean isClosed() {
    return endTime != null;
  }

  public String name() {
    return name;
  }

  public String spanId() {
    return spanId;
  }

  /**
   * Returns the id of the enclosing span.
   *
   * @return parent span id, or empty for a top-level span
   */
  public Optional<String> parentId() {
    return Optional.ofNullable(parentId);
  }

  public double startTime() {
    return startTime;
  }

  public OptionalDouble endTime() {
    return endTime == null ? OptionalDouble.empty() : OptionalDouble.of(endTime);
  }

  /**
   * Returns {@code endTime - startTime}.
   *
   * @return duration in seconds, or empty while the span is open
   */
  public OptionalDouble duration() {
    return endTime == null ? OptionalDouble.empty() : OptionalDouble.of(endTime - startTime);
  }

  /**
   * Returns the events in recording order.
   *
   * @return read-only view backed by this span
   */
  public List<TraceEvent> events() {
    return Collections.unmodifiableList(events);
  }

  /**
   * Returns the span metadata.
   *
   * @return read-only view backed by this span
   */
  public Map<String, Object> metadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /**
   * Adds or replaces a metadata entry.
   *
   * @param key metadata key; must not be {@code null}
   * @param value JSON-compatible value; may be {@code null}
   */
  public void putMetadata(String key, Object value) {
    metadata.put(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * Checks whether this span owns an event with the given id.
   *
   * @param eventId event id to look for
   * @return {@code true} when one of this span's events carries {@code eventId}
   */
  public boolean contains(String eventId) {
    for (TraceEvent event : events) {
      if (event.eventId().equals(eventId)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Span[" + name + ", id=" + spanId + ", events=" + events.size() + "]";
  }
}
