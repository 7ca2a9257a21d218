package ca.gc.cra.agentreplay.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceRecordsTest {

  @Test
  void fullRecordRebuildsEquivalentTrace() {
    Trace original = TraceFixtures.searchRun();

    Trace copy = TraceRecords.fromMap(TraceRecords.toMap(original));

    assertEquals(original.traceId(), copy.traceId());
    assertEquals(original.name(), copy.name());
    assertEquals(original.metadata(), copy.metadata());
    assertEquals(original.spans().size(), copy.spans().size());
    for (int i = 0; i < original.spans().size(); i++) {
      Span expected = original.spans().get(i);
      Span actual = copy.spans().get(i);
      assertEquals(expected.spanId(), actual.spanId());
      assertEquals(expected.parentId(), actual.parentId());
      assertEquals(expected.events(), actual.events());
    }
  }

  @Test
  void spanRecordCarriesTypeDiscriminator() {
    Span span = TraceFixtures.searchRun().spans().get(0);

    Map<String, Object> record = TraceRecords.spanRecord(span);

    assertEquals("span", record.get("type"));
    assertNull(record.get("parent_id"));
    assertEquals(2, ((List<?>) record.get("events")).size());
  }

  @Test
  void missingOptionalFieldsTakeDefaults() {
    Map<String, Object> event = new HashMap<>();
    event.put("event_type", "log");
    event.put("timestamp", 5);
    Map<String, Object> span = new HashMap<>();
    span.put("name", "solo");
    span.put("span_id", "s1");
    span.put("start_time", 1.5);
    span.put("events", List.of(event));

    Span decoded = TraceRecords.spanFromMap(span, TraceClock.SYSTEM);

    assertFalse(decoded.parentId().isPresent());
    assertFalse(decoded.isClosed());
    assertTrue(decoded.metadata().isEmpty());
    TraceEvent only = decoded.events().get(0);
    assertEquals(5.0, only.timestamp());
    assertTrue(only.data().isEmpty());
    assertEquals(12, only.eventId().length());
  }

  @Test
  void fromMapRequiresIdAndName() {
    assertThrows(TraceFormatException.class, () -> TraceRecords.fromMap(Map.of("name", "x")));
    assertThrows(TraceFormatException.class, () -> TraceRecords.fromMap(Map.of("trace_id", "t")));
  }

  @Test
  void fromMapDefaultsStartTimeToZero() {
    Trace trace = TraceRecords.fromMap(Map.of("trace_id", "t1", "name", "n"));

    assertEquals(0.0, trace.startTime());
    assertTrue(trace.spans().isEmpty());
  }

  @Test
  void headerIsTolerant() {
    Trace trace = TraceRecords.fromHeader(null, List.of(), TraceClock.SYSTEM);

    assertEquals(Trace.DEFAULT_NAME, trace.name());
    assertEquals(16, trace.traceId().length());
    assertEquals(0.0, trace.startTime());
  }

  @Test
  void wronglyTypedFieldsAreRejected() {
    Map<String, Object> span = Map.of("name", "x", "span_id", "s", "start_time", "soon");
    TraceFormatException ex =
        assertThrows(TraceFormatException.class, () -> TraceRecords.spanFromMap(span, TraceClock.SYSTEM));
    assertTrue(ex.getMessage().contains("start_time"));

    assertThrows(TraceFormatException.class,
        () -> TraceRecords.eventFromMap(Map.of("event_type", "nope", "timestamp", 1)));
    assertThrows(TraceFormatException.class,
        () -> TraceRecords.eventFromMap(Map.of("event_type", "log")));
  }
}
