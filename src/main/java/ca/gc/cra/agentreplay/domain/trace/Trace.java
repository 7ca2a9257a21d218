package ca.gc.cra.agentreplay.domain.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Full recorded history of one agent run.
 * <p><strong>Why:</strong> Acts as the unit that is persisted, replayed, and diffed.</p>
 * <p><strong>Role:</strong> Aggregate root owning every {@link Span} and, transitively, every
 * {@link TraceEvent}.</p>
 * <p><strong>Ordering:</strong> spans keep insertion order in storage. That order is not the replay order;
 * {@link #timeline()} and {@link #allEvents()} sort every event by timestamp and keep storage order
 * (span, then in-span position) for equal timestamps.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Do not share one instance across concurrent writers.</p>
 *
 * @since 0.1.0
 */
public final class Trace {
  /** Name used when none is supplied or persisted. */
  public static final String DEFAULT_NAME = "unnamed";

  private static final Comparator<TimelineEntry> BY_TIMESTAMP =
      Comparator.comparingDouble(entry -> entry.event().timestamp());

  private final String traceId;
  private final String name;
  private final double startTime;
  private Double endTime;
  private final List<Span> spans;
  private final Map<String, Object> metadata;
  private final TraceClock clock;

  /**
   * Starts a new trace using the system clock.
   *
   * @param name trace name; {@code null} or blank becomes {@value #DEFAULT_NAME}
   */
  public Trace(String name) {
    this(name, Map.of(), TraceClock.SYSTEM);
  }

  /**
   * Starts a new trace.
   *
   * @param name trace name; {@code null} or blank becomes {@value #DEFAULT_NAME}
   * @param metadata trace metadata; may be {@code null}
   * @param clock time source for the trace, its spans, and their events
   */
  public Trace(String name, Map<String, Object> metadata, TraceClock clock) {
    this(null, name, Objects.requireNonNull(clock, "clock").nowSeconds(), null, List.of(), metadata, clock);
  }

  Trace(
      String traceId,
      String name,
      double startTime,
      Double endTime,
      List<Span> spans,
      Map<String, Object> metadata,
      TraceClock clock) {
    this.traceId = traceId == null || traceId.isBlank() ? TraceIds.newTraceId() : traceId;
    this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    this.startTime = startTime;
    this.endTime = endTime;
    this.spans = new ArrayList<>(spans);
    this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends a new open top-level span.
   *
   * @param name span label; names need not be unique
   * @return the new span
   */
  public Span addSpan(String name) {
    return addSpan(name, null, null);
  }

  /**
   * Appends a new open span.
   *
   * @param name span label; names need not be unique
   * @param parentId id of the enclosing span, or {@code null} for a top-level span
   * @param metadata span metadata; may be {@code null}
   * @return the new span
   */
  public Span addSpan(String name, String parentId, Map<String, Object> metadata) {
    Span span = new Span(name, null, parentId, clock.nowSeconds(), null, List.of(), metadata, clock);
    spans.add(span);
    return span;
  }

  /**
   * Stamps the trace end time and closes every span that is still open.
   *
   * <p>Calling this twice overwrites the trace end time; spans closed earlier keep their end time.</p>
   */
  public void close() {
    endTime = clock.nowSeconds();
    for (Span span : spans) {
      if (!span.isClosed()) {
        span.close();
      }
    }
  }

  /**
   * Finds a span by id with a linear scan.
   *
   * @param spanId span id to look up
   * @return matching span, if any
   */
  public Optional<Span> findSpan(String spanId) {
    for (Span span : spans) {
      if (span.spanId().equals(spanId)) {
        return Optional.of(span);
      }
    }
    return Optional.empty();
  }

  /**
   * Builds the global timeline of {@code (span, event)} pairs.
   *
   * <p>Every event of every span, sorted ascending by timestamp. The sort is stable, so events with equal
   * timestamps keep the order produced by walking spans in storage order and events in span order.</p>
   *
   * @return new mutable list; O(n log n) in the total number of events
   */
  public List<TimelineEntry> timeline() {
    List<TimelineEntry> entries = new ArrayList<>(eventCount());
    for (Span span : spans) {
      for (TraceEvent event : span.events()) {
        entries.add(new TimelineEntry(span, event));
      }
    }
    // List.sort is a stable merge sort; equal timestamps keep flattening order.
    entries.sort(BY_TIMESTAMP);
    return entries;
  }

  /**
   * Returns every event in canonical order (see {@link #timeline()}).
   *
   * @return new mutable list of events
   */
  public List<TraceEvent> allEvents() {
    List<TimelineEntry> entries = timeline();
    List<TraceEvent> events = new ArrayList<>(entries.size());
    for (TimelineEntry entry : entries) {
      events.add(entry.event());
    }
    return events;
  }

  /**
   * Sums the per-span event counts.
   *
   * @return total number of events
   */
  public int eventCount() {
    int count = 0;
    for (Span span : spans) {
      count += span.events().size();
    }
    return count;
  }

  public String traceId() {
    return traceId;
  }

  public String name() {
    return name;
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
   * @return duration in seconds, or empty while the trace is open
   */
  public OptionalDouble duration() {
    return endTime == null ? OptionalDouble.empty() : OptionalDouble.of(endTime - startTime);
  }

  /**
   * Returns spans in storage (insertion) order.
   *
   * @return read-only view backed by this trace
   */
  public List<Span> spans() {
    return Collections.unmodifiableList(spans);
  }

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

  @Override
  public String toString() {
    return "Trace[" + name + ", id=" + traceId + ", spans=" + spans.size() + ", events=" + eventCount() + "]";
  }
}
