package ca.gc.cra.agentreplay.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.application.replay.ReplayEngine;
import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.NotFoundException;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.TimelineEntry;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceClock;
import ca.gc.cra.agentreplay.domain.trace.TraceFormatException;
import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class JsonlTraceStoreTest {
  @TempDir Path tempDir;

  private final JsonlTraceStore store = new JsonlTraceStore(MetricsPort.NO_OP, TraceClock.SYSTEM);
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(JsonlTraceStore.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void saveThenLoadPreservesTrace() throws Exception {
    Trace original = TraceFixtures.searchRun();
    Path file = tempDir.resolve("nested/dir/run.jsonl");

    store.save(original, file);
    Trace loaded = store.load(file);

    assertEquals(original.traceId(), loaded.traceId());
    assertEquals(original.name(), loaded.name());
    assertEquals(original.metadata(), loaded.metadata());
    assertEquals(original.startTime(), loaded.startTime());
    assertEquals(original.endTime(), loaded.endTime());
    assertEquals(original.spans().size(), loaded.spans().size());
    for (int i = 0; i < original.spans().size(); i++) {
      Span expected = original.spans().get(i);
      Span actual = loaded.spans().get(i);
      assertEquals(expected.name(), actual.name());
      assertEquals(expected.parentId(), actual.parentId());
      assertEquals(expected.events().size(), actual.events().size());
      for (int j = 0; j < expected.events().size(); j++) {
        assertEquals(expected.events().get(j).eventType(), actual.events().get(j).eventType());
        assertEquals(expected.events().get(j).data(), actual.events().get(j).data());
        assertEquals(expected.events().get(j).eventId(), actual.events().get(j).eventId());
      }
    }
  }

  @Test
  void writesHeaderThenOneLinePerSpan() throws Exception {
    Path file = store.save(TraceFixtures.searchRun(), tempDir.resolve("run.jsonl"));

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("{\"type\":\"trace_header\""));
    assertTrue(lines.get(1).startsWith("{\"type\":\"span\",\"name\":\"plan\""));
    assertTrue(lines.get(0).contains("\"start_time\":1700000000.0"));
  }

  @Test
  void toleratesBlankLinesUnknownRecordsAndMissingHeader() throws Exception {
    Path file = tempDir.resolve("partial.jsonl");
    Files.writeString(file, String.join("\n",
        "",
        "{\"type\":\"comment\",\"text\":\"hi\"}",
        "{\"type\":\"span\",\"name\":\"s\",\"span_id\":\"s1\",\"start_time\":1.0,"
            + "\"events\":[{\"event_type\":\"log\",\"timestamp\":1.5,\"data\":{\"message\":\"x\"}}]}",
        "   ",
        ""), StandardCharsets.UTF_8);

    Trace trace = store.load(file);

    assertEquals(Trace.DEFAULT_NAME, trace.name());
    assertEquals(0.0, trace.startTime());
    assertEquals(1, trace.eventCount());
    assertEquals(EventType.LOG, trace.allEvents().get(0).eventType());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("type comment")));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("no trace_header")));
  }

  @Test
  void malformedLineFailsWholeLoadNamingLine() throws Exception {
    Path file = tempDir.resolve("broken.jsonl");
    Files.writeString(file, "{\"type\":\"trace_header\",\"trace_id\":\"t\",\"name\":\"n\"}\n{not json\n",
        StandardCharsets.UTF_8);

    TraceFormatException ex = assertThrows(TraceFormatException.class, () -> store.load(file));
    assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
  }

  @Test
  void nonObjectLineIsRejected() throws Exception {
    Path file = tempDir.resolve("array.jsonl");
    Files.writeString(file, "[1,2,3]\n", StandardCharsets.UTF_8);

    TraceFormatException ex = assertThrows(TraceFormatException.class, () -> store.load(file));
    assertTrue(ex.getMessage().contains("line 1"));
  }

  @Test
  void spanMissingRequiredFieldNamesLine() throws Exception {
    Path file = tempDir.resolve("span.jsonl");
    Files.writeString(file, "{\"type\":\"span\",\"name\":\"s\",\"start_time\":1}\n", StandardCharsets.UTF_8);

    TraceFormatException ex = assertThrows(TraceFormatException.class, () -> store.load(file));
    assertTrue(ex.getMessage().contains("line 1"));
    assertTrue(ex.getMessage().contains("span_id"));
  }

  @Test
  void invalidUtf8FailsAsFormatError() throws Exception {
    Path file = tempDir.resolve("latin1.jsonl");
    byte[] header = "{\"type\":\"trace_header\",\"trace_id\":\"t\",\"name\":\"caf_\"}\n"
        .getBytes(StandardCharsets.US_ASCII);
    header[header.length - 4] = (byte) 0xC3;
    Files.write(file, header);

    TraceFormatException ex = assertThrows(TraceFormatException.class, () -> store.load(file));
    assertTrue(ex.getMessage().contains("UTF-8"), ex.getMessage());
    assertTrue(ex.getMessage().contains("line 1"), ex.getMessage());
  }

  @Test
  void reloadedTraceReplaysInSameOrder() throws Exception {
    Trace original = new Trace("ties", null, new TraceFixtures.SteppingClock(TraceFixtures.EPOCH, 0.0));
    Span first = original.addSpan("first");
    first.addEvent(EventType.DECISION, TraceFixtures.data("choice", "a"));
    first.addEvent(EventType.LOG, TraceFixtures.data("message", "picked a"));
    Span second = original.addSpan("second");
    second.addEvent(EventType.TOOL_CALL, TraceFixtures.data("tool", "search"));
    first.addEvent(EventType.STATE_CHANGE, TraceFixtures.data("key", "done"));
    original.close();
    Path file = store.save(original, tempDir.resolve("ties.jsonl"));

    List<TimelineEntry> before = new ReplayEngine(original).tape();
    List<TimelineEntry> after = new ReplayEngine(store.load(file)).tape();

    assertEquals(before.size(), after.size());
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.get(i).span().spanId(), after.get(i).span().spanId(), "span at step " + i);
      assertEquals(before.get(i).event().eventId(), after.get(i).event().eventId(), "event at step " + i);
    }
    assertEquals(List.of(EventType.DECISION, EventType.LOG, EventType.STATE_CHANGE, EventType.TOOL_CALL),
        after.stream().map(entry -> entry.event().eventType()).toList());
  }

  @Test
  void missingFileIsNotFound() {
    assertThrows(NotFoundException.class, () -> store.load(tempDir.resolve("absent.jsonl")));
  }
}
