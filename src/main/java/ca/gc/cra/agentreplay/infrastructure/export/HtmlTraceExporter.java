package ca.gc.cra.agentreplay.infrastructure.export;

import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.ExportFormat;
import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.application.port.TraceExporter;
import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a trace as a self-contained HTML timeline page.
 * <p><strong>Layout:</strong> a header with the trace id, span count, event count, and duration ({@code running}
 * while the trace is open), then one card per event in storage order (span by span), colored by event kind and
 * showing the owning span, the local wall-clock time, and the indented JSON payload.</p>
 * <p><strong>Security:</strong> every piece of recorded text is HTML-escaped; payloads may contain markup.</p>
 *
 * @since 0.1.0
 */
public final class HtmlTraceExporter implements TraceExporter {
  private static final Logger log = LoggerFactory.getLogger(HtmlTraceExporter.class);
  private static final String FALLBACK_COLOR = "#6b7280";
  private static final Map<EventType, String> COLORS = new EnumMap<>(EventType.class);

  static {
    COLORS.put(EventType.LLM_REQUEST, "#06b6d4");
    COLORS.put(EventType.LLM_RESPONSE, "#22c55e");
    COLORS.put(EventType.TOOL_CALL, "#eab308");
    COLORS.put(EventType.TOOL_RESULT, "#3b82f6");
    COLORS.put(EventType.DECISION, "#a855f7");
    COLORS.put(EventType.STATE_CHANGE, "#6b7280");
    COLORS.put(EventType.ERROR, "#ef4444");
    COLORS.put(EventType.LOG, "#9ca3af");
  }

  private static final String STYLE = """
      * { margin: 0; padding: 0; box-sizing: border-box; }
      body { font-family: 'SF Mono', 'Fira Code', monospace; background: #0d1117; color: #c9d1d9; padding: 2rem; }
      h1 { color: #58a6ff; margin-bottom: 0.5rem; }
      .meta { color: #8b949e; margin-bottom: 2rem; font-size: 0.9rem; }
      .event { background: #161b22; border-radius: 6px; padding: 1rem; margin-bottom: 0.75rem; }
      .event-header { display: flex; gap: 1rem; align-items: center; margin-bottom: 0.5rem; }
      .event-type { font-weight: bold; font-size: 0.85rem; }
      .event-span { color: #e3b341; font-size: 0.8rem; }
      .event-time { color: #8b949e; font-size: 0.8rem; margin-left: auto; }
      .event-data { color: #8b949e; font-size: 0.8rem; white-space: pre-wrap; max-height: 200px; overflow-y: auto; }
      """;

  private final JsonSupport json = new JsonSupport();
  private final MetricsPort metrics;
  private final DateTimeFormatter timeFormat;

  /** Creates an exporter that renders times in the system time zone. */
  public HtmlTraceExporter() {
    this(MetricsPort.NO_OP, ZoneId.systemDefault());
  }

  /**
   * Creates an exporter.
   *
   * @param metrics metrics sink
   * @param zone time zone used for event times
   */
  public HtmlTraceExporter(MetricsPort metrics, ZoneId zone) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss.SSS", Locale.ROOT)
        .withZone(Objects.requireNonNull(zone, "zone"));
  }

  @Override
  public ExportFormat format() {
    return ExportFormat.HTML;
  }

  @Override
  public Path export(Trace trace, Path path) throws IOException {
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(path, "path");
    Files.writeString(path, render(trace), StandardCharsets.UTF_8);
    metrics.increment("export.html");
    log.debug("Exported trace {} as HTML to {}", trace.traceId(), path);
    return path;
  }

  /**
   * Renders the page without writing it.
   *
   * @param trace trace to render
   * @return complete HTML document
   */
  public String render(Trace trace) {
    StringBuilder events = new StringBuilder();
    for (Span span : trace.spans()) {
      for (TraceEvent event : span.events()) {
        appendEvent(events, span, event);
      }
    }
    OptionalDouble duration = trace.duration();
    String durationText = duration.isPresent()
        ? String.format(Locale.ROOT, "%.3fs", duration.getAsDouble())
        : "running";
    String name = escape(trace.name());
    return "<!DOCTYPE html>\n"
        + "<html lang=\"en\">\n"
        + "<head>\n"
        + "<meta charset=\"utf-8\">\n"
        + "<title>Agent Trace: " + name + "</title>\n"
        + "<style>\n" + STYLE + "</style>\n"
        + "</head>\n"
        + "<body>\n"
        + "  <h1>" + name + "</h1>\n"
        + "  <div class=\"meta\">\n"
        + "    ID: " + escape(trace.traceId())
        + " | Spans: " + trace.spans().size()
        + " | Events: " + trace.eventCount()
        + " | Duration: " + durationText + "\n"
        + "  </div>\n"
        + events
        + "</body>\n"
        + "</html>\n";
  }

  private void appendEvent(StringBuilder out, Span span, TraceEvent event) {
    String color = COLORS.getOrDefault(event.eventType(), FALLBACK_COLOR);
    out.append("  <div class=\"event\" style=\"border-left: 4px solid ").append(color).append(";\">\n")
        .append("    <div class=\"event-header\">\n")
        .append("      <span class=\"event-type\" style=\"color: ").append(color).append(";\">")
        .append(event.eventType().label()).append("</span>\n")
        .append("      <span class=\"event-span\">").append(escape(span.name())).append("</span>\n")
        .append("      <span class=\"event-time\">").append(formatTime(event.timestamp())).append("</span>\n")
        .append("    </div>\n")
        .append("    <pre class=\"event-data\">").append(escape(json.toPrettyJson(event.data()))).append("</pre>\n")
        .append("  </div>\n");
  }

  private String formatTime(double epochSeconds) {
    long millis = Math.round(epochSeconds * 1000.0);
    return timeFormat.format(Instant.ofEpochMilli(millis));
  }

  static String escape(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
