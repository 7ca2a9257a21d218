package ca.gc.cra.agentreplay.domain.trace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Converts traces, spans, and events to and from their record form: plain maps and lists
 * keyed by the persisted field names.
 * <p><strong>Why:</strong> The record form is the durable wire contract shared by the NDJSON store, the JSON
 * export, and diff reports.</p>
 * <p><strong>Defaults on read:</strong> missing {@code parent_id} means top-level, missing {@code metadata} is
 * empty, missing {@code end_time} means open, missing {@code events}/{@code data} are empty, missing
 * {@code event_id} is generated.</p>
 * <p><strong>Failures:</strong> missing identifying fields, unknown event kinds, and wrongly typed values raise
 * {@link TraceFormatException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TraceRecords {
  /** Record {@code type} discriminator of the NDJSON header line. */
  public static final String HEADER_TYPE = "trace_header";
  /** Record {@code type} discriminator of an NDJSON span line. */
  public static final String SPAN_TYPE = "span";
  /** Field carrying the record discriminator. */
  public static final String TYPE_FIELD = "type";

  private TraceRecords() {}

  /**
   * Returns the full record form of a trace, spans nested under {@code spans}.
   *
   * @param trace trace to convert
   * @return insertion-ordered map
   */
  public static Map<String, Object> toMap(Trace trace) {
    Objects.requireNonNull(trace, "trace");
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("trace_id", trace.traceId());
    map.put("name", trace.name());
    map.put("start_time", trace.startTime());
    map.put("end_time", trace.endTime().isPresent() ? trace.endTime().getAsDouble() : null);
    List<Object> spans = new ArrayList<>(trace.spans().size());
    for (Span span : trace.spans()) {
      spans.add(spanToMap(span));
    }
    map.put("spans", spans);
    map.put("metadata", new LinkedHashMap<>(trace.metadata()));
    return map;
  }

  /**
   * Returns the NDJSON header record of a trace.
   *
   * @param trace trace to describe
   * @return map starting with {@code "type": "trace_header"}
   */
  public static Map<String, Object> headerRecord(Trace trace) {
    Objects.requireNonNull(trace, "trace");
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TYPE_FIELD, HEADER_TYPE);
    map.put("trace_id", trace.traceId());
    map.put("name", trace.name());
    map.put("start_time", trace.startTime());
    map.put("end_time", trace.endTime().isPresent() ? trace.endTime().getAsDouble() : null);
    map.put("metadata", new LinkedHashMap<>(trace.metadata()));
    return map;
  }

  /**
   * Returns the NDJSON line record of a span.
   *
   * @param span span to describe
   * @return map starting with {@code "type": "span"} followed by {@link #spanToMap(Span)}
   */
  public static Map<String, Object> spanRecord(Span span) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TYPE_FIELD, SPAN_TYPE);
    map.putAll(spanToMap(span));
    return map;
  }

  /**
   * Returns the record form of a span with its events embedded.
   *
   * @param span span to convert
   * @return insertion-ordered map
   */
  public static Map<String, Object> spanToMap(Span span) {
    Objects.requireNonNull(span, "span");
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", span.name());
    map.put("span_id", span.spanId());
    map.put("parent_id", span.parentId().orElse(null));
    map.put("start_time", span.startTime());
    map.put("end_time", span.endTime().isPresent() ? span.endTime().getAsDouble() : null);
    List<Object> events = new ArrayList<>(span.events().size());
    for (TraceEvent event : span.events()) {
      events.add(eventToMap(event));
    }
    map.put("events", events);
    map.put("metadata", new LinkedHashMap<>(span.metadata()));
    return map;
  }

  /**
   * Returns the record form of an event.
   *
   * @param event event to convert
   * @return insertion-ordered map; {@code data} is copied verbatim
   */
  public static Map<String, Object> eventToMap(TraceEvent event) {
    Objects.requireNonNull(event, "event");
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("event_type", event.eventType().wireValue());
    map.put("timestamp", event.timestamp());
    map.put("data", new LinkedHashMap<>(event.data()));
    map.put("event_id", event.eventId());
    return map;
  }

  /**
   * Rebuilds a trace from its full record form using the system clock for later mutations.
   *
   * @param record map produced by {@link #toMap(Trace)} or an equivalent document
   * @return reconstructed trace
   * @throws TraceFormatException when {@code trace_id} or {@code name} is missing or a nested record is malformed
   */
  public static Trace fromMap(Map<String, Object> record) {
    return fromMap(record, TraceClock.SYSTEM);
  }

  /**
   * Rebuilds a trace from its full record form.
   *
   * @param record map produced by {@link #toMap(Trace)} or an equivalent document
   * @param clock clock used for spans and events appended after loading
   * @return reconstructed trace
   * @throws TraceFormatException when {@code trace_id} or {@code name} is missing or a nested record is malformed
   */
  public static Trace fromMap(Map<String, Object> record, TraceClock clock) {
    Objects.requireNonNull(record, "record");
    String traceId = requireString(record, "trace_id", "trace");
    String name = requireString(record, "name", "trace");
    List<Span> spans = new ArrayList<>();
    for (Object raw : optionalList(record, "spans", "trace")) {
      spans.add(spanFromMap(asMap(raw, "span"), clock));
    }
    return new Trace(
        traceId,
        name,
        optionalNumber(record, "start_time", 0.0, "trace"),
        nullableNumber(record, "end_time", "trace"),
        spans,
        optionalMap(record, "metadata", "trace"),
        clock);
  }

  /**
   * Assembles a trace from an NDJSON header record and already decoded spans.
   *
   * <p>The header is tolerant: a {@code null} header, or one missing fields, yields a generated
   * {@code trace_id}, the name {@value Trace#DEFAULT_NAME}, {@code start_time} 0, and empty metadata.</p>
   *
   * @param header header record, or {@code null} when the file had none
   * @param spans spans in file order
   * @param clock clock used for later mutations
   * @return reconstructed trace
   * @throws TraceFormatException when a present header field has the wrong type
   */
  public static Trace fromHeader(Map<String, Object> header, List<Span> spans, TraceClock clock) {
    Map<String, Object> source = header == null ? Map.of() : header;
    return new Trace(
        optionalString(source, "trace_id", "trace_header"),
        optionalString(source, "name", "trace_header"),
        optionalNumber(source, "start_time", 0.0, "trace_header"),
        nullableNumber(source, "end_time", "trace_header"),
        spans,
        optionalMap(source, "metadata", "trace_header"),
        clock);
  }

  /**
   * Rebuilds a span and its events.
   *
   * @param record span record; a {@code type} entry, if present, is ignored
   * @param clock clock used for events appended after loading
   * @return reconstructed span
   * @throws TraceFormatException when {@code name}, {@code span_id}, or {@code start_time} is missing
   */
  public static Span spanFromMap(Map<String, Object> record, TraceClock clock) {
    Objects.requireNonNull(record, "record");
    String name = requireString(record, "name", "span");
    String spanId = requireString(record, "span_id", "span");
    double startTime = requireNumber(record, "start_time", "span");
    List<TraceEvent> events = new ArrayList<>();
    for (Object raw : optionalList(record, "events", "span " + spanId)) {
      events.add(eventFromMap(asMap(raw, "event")));
    }
    return new Span(
        name,
        spanId,
        optionalString(record, "parent_id", "span " + spanId),
        startTime,
        nullableNumber(record, "end_time", "span " + spanId),
        events,
        optionalMap(record, "metadata", "span " + spanId),
        clock);
  }

  /**
   * Rebuilds an event.
   *
   * @param record event record
   * @return reconstructed event; a missing {@code event_id} is generated
   * @throws TraceFormatException when {@code event_type} is missing or unknown, or {@code timestamp} is missing
   */
  public static TraceEvent eventFromMap(Map<String, Object> record) {
    Objects.requireNonNull(record, "record");
    EventType type = EventType.fromWire(requireString(record, "event_type", "event"));
    double timestamp = requireNumber(record, "timestamp", "event");
    return new TraceEvent(
        type,
        timestamp,
        optionalMap(record, "data", "event"),
        optionalString(record, "event_id", "event"));
  }

  /**
   * Casts a decoded JSON value to a string-keyed map.
   *
   * @param value decoded value
   * @param context label used in error messages
   * @return insertion-ordered copy
   * @throws TraceFormatException when {@code value} is not an object with string keys
   */
  public static Map<String, Object> asMap(Object value, String context) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new TraceFormatException(context + " must be a JSON object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new TraceFormatException(context + " contains a non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String requireString(Map<String, Object> record, String field, String context) {
    String value = optionalString(record, field, context);
    if (value == null) {
      throw new TraceFormatException(context + " record is missing required field '" + field + "'");
    }
    return value;
  }

  private static String optionalString(Map<String, Object> record, String field, String context) {
    Object value = record.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new TraceFormatException(context + " field '" + field + "' must be a string");
    }
    return text;
  }

  private static double requireNumber(Map<String, Object> record, String field, String context) {
    Double value = nullableNumber(record, field, context);
    if (value == null) {
      throw new TraceFormatException(context + " record is missing required field '" + field + "'");
    }
    return value;
  }

  private static double optionalNumber(
      Map<String, Object> record, String field, double defaultValue, String context) {
    Double value = nullableNumber(record, field, context);
    return value == null ? defaultValue : value;
  }

  private static Double nullableNumber(Map<String, Object> record, String field, String context) {
    Object value = record.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Number number)) {
      throw new TraceFormatException(context + " field '" + field + "' must be a number");
    }
    return number.doubleValue();
  }

  private static Map<String, Object> optionalMap(Map<String, Object> record, String field, String context) {
    Object value = record.get(field);
    if (value == null) {
      return new LinkedHashMap<>();
    }
    return asMap(value, context + " field '" + field + "'");
  }

  private static List<?> optionalList(Map<String, Object> record, String field, String context) {
    Object value = record.get(field);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new TraceFormatException(context + " field '" + field + "' must be a JSON array");
    }
    return list;
  }
}
