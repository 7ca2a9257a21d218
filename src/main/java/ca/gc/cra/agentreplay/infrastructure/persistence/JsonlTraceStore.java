package ca.gc.cra.agentreplay.infrastructure.persistence;

import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.application.port.TraceStore;
import ca.gc.cra.agentreplay.domain.trace.NotFoundException;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceClock;
import ca.gc.cra.agentreplay.domain.trace.TraceFormatException;
import ca.gc.cra.agentreplay.domain.trace.TraceRecords;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TraceStore} that writes one trace per NDJSON file.
 * <p><strong>Format:</strong> line 1 is a {@code trace_header} record; every following line is one {@code span}
 * record with its events embedded. UTF-8, one JSON object per line.</p>
 * <p><strong>Tolerance:</strong> blank lines are skipped and records with an unknown or missing {@code type} are
 * ignored. A file without a header still loads, with a generated trace id and the name
 * {@value Trace#DEFAULT_NAME}. Malformed JSON on any line fails the whole load with a
 * {@link TraceFormatException} naming the line, and so do bytes that are not valid UTF-8.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from metrics; concurrent writers of the same path are not
 * coordinated.</p>
 * <p><strong>Metrics:</strong> {@code trace.store.saved}, {@code trace.store.loaded},
 * {@code trace.store.load.events}.</p>
 *
 * @since 0.1.0
 */
public final class JsonlTraceStore implements TraceStore {
  private static final Logger log = LoggerFactory.getLogger(JsonlTraceStore.class);

  private final JsonSupport json = new JsonSupport();
  private final MetricsPort metrics;
  private final TraceClock clock;

  /** Creates a store without metrics that stamps post-load mutations with the system clock. */
  public JsonlTraceStore() {
    this(MetricsPort.NO_OP, TraceClock.SYSTEM);
  }

  /**
   * Creates a store.
   *
   * @param metrics metrics sink
   * @param clock clock handed to loaded traces for later mutations
   */
  public JsonlTraceStore(MetricsPort metrics, TraceClock clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Path save(Trace trace, Path path) throws IOException {
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter out = Files.newBufferedWriter(
        path,
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE)) {
      json.write(out, TraceRecords.headerRecord(trace), false);
      out.newLine();
      for (Span span : trace.spans()) {
        json.write(out, TraceRecords.spanRecord(span), false);
        out.newLine();
      }
    }
    metrics.increment("trace.store.saved");
    log.debug("Wrote trace {} ({} spans, {} events) to {}",
        trace.traceId(), trace.spans().size(), trace.eventCount(), path);
    return path;
  }

  @Override
  public Trace load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw NotFoundException.tracePath(path);
    }
    Map<String, Object> header = null;
    List<Span> spans = new ArrayList<>();
    int lineNumber = 0;
    try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = in.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Map<String, Object> record = parseLine(path, lineNumber, line);
        Object type = record.get(TraceRecords.TYPE_FIELD);
        if (TraceRecords.HEADER_TYPE.equals(type)) {
          header = record;
        } else if (TraceRecords.SPAN_TYPE.equals(type)) {
          spans.add(decodeSpan(path, lineNumber, record));
        } else {
          log.warn("Ignoring record with type {} at {}:{}", type, path, lineNumber);
        }
      }
    } catch (CharacterCodingException ex) {
      // The reader decodes ahead of readLine, so the bad byte is at or after this line.
      throw new TraceFormatException(
          path + ": not valid UTF-8 at or after line " + (lineNumber + 1), ex);
    }
    if (header == null) {
      log.warn("Trace file {} has no trace_header record; using defaults", path);
    }
    Trace trace = TraceRecords.fromHeader(header, spans, clock);
    metrics.increment("trace.store.loaded");
    metrics.observe("trace.store.load.events", trace.eventCount());
    log.debug("Loaded trace {} ({} spans, {} events) from {}",
        trace.traceId(), trace.spans().size(), trace.eventCount(), path);
    return trace;
  }

  private Map<String, Object> parseLine(Path path, int lineNumber, String line) {
    Object value;
    try {
      value = json.parse(line);
    } catch (IllegalArgumentException ex) {
      throw new TraceFormatException(location(path, lineNumber) + ": invalid JSON", ex);
    }
    if (!(value instanceof Map)) {
      throw new TraceFormatException(location(path, lineNumber) + ": expected a JSON object");
    }
    return TraceRecords.asMap(value, location(path, lineNumber));
  }

  private Span decodeSpan(Path path, int lineNumber, Map<String, Object> record) {
    try {
      return TraceRecords.spanFromMap(record, clock);
    } catch (TraceFormatException ex) {
      throw new TraceFormatException(location(path, lineNumber) + ": " + ex.getMessage(), ex);
    }
  }

  private static String location(Path path, int lineNumber) {
    return path + " line " + lineNumber;
  }
}
