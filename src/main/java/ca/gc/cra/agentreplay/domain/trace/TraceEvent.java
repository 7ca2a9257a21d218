package ca.gc.cra.agentreplay.domain.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one occurrence inside a span.
 *
 * <p>The payload is kept exactly as the recorder supplied it. Values may be any JSON-compatible object
 * (strings, numbers, booleans, {@code null}, nested maps and lists); no schema is imposed.</p>
 *
 * @param eventType kind of occurrence; never {@code null}
 * @param timestamp seconds since epoch at which the event was recorded
 * @param data insertion-ordered payload; {@code null} becomes an empty map
 * @param eventId opaque identifier; {@code null} or blank values are replaced with a generated id
 *
 * @since 0.1.0
 */
public record TraceEvent(EventType eventType, double timestamp, Map<String, Object> data, String eventId) {

  /**
   * Validates invariants and copies the payload into an unmodifiable, order-preserving map.
   */
  public TraceEvent {
    eventType = Objects.requireNonNull(eventType, "eventType");
    data = data == null || data.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    eventId = eventId == null || eventId.isBlank() ? TraceIds.newEventId() : eventId;
  }

  /**
   * Creates an event with a freshly generated id.
   *
   * @param eventType kind of occurrence
   * @param timestamp seconds since epoch
   * @param data payload; may be {@code null}
   * @return new event
   */
  public static TraceEvent of(EventType eventType, double timestamp, Map<String, Object> data) {
    return new TraceEvent(eventType, timestamp, data, null);
  }

  /**
   * Looks up a top-level payload field.
   *
   * @param key payload key
   * @return value when present and non-null
   */
  public Optional<Object> field(String key) {
    return Optional.ofNullable(data.get(key));
  }
}
