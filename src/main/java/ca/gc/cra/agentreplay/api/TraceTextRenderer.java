package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.application.diff.DiffResult;
import ca.gc.cra.agentreplay.application.diff.Divergence;
import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.replay.ReplayEngine;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.SpanIndex;
import ca.gc.cra.agentreplay.domain.trace.TimelineEntry;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import ca.gc.cra.agentreplay.logging.Logs;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * <strong>What:</strong> Renders traces, replay steps, and diff reports as plain-text lines for the terminal.
 * <p><strong>Why:</strong> Every command prints through this renderer; the domain and replay code produce no
 * text.</p>
 * <p><strong>Previews:</strong> payload text is folded to one line and cut to the configured character budget.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
final class TraceTextRenderer {
  static final String END_OF_TRACE = "End of trace";

  private static final String BRANCH = "├── ";
  private static final String LAST_BRANCH = "└── ";
  private static final String PIPE = "│   ";
  private static final String GAP = "    ";

  private final int previewChars;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a renderer.
   *
   * @param previewChars maximum characters of payload text per line
   */
  TraceTextRenderer(int previewChars) {
    if (previewChars <= 0) {
      throw new IllegalArgumentException("previewChars must be positive");
    }
    this.previewChars = previewChars;
  }

  /**
   * Renders the header followed by every span and its events, in storage order, indented by nesting depth.
   *
   * @param trace trace to render
   * @return lines without trailing newlines
   */
  List<String> renderTrace(Trace trace) {
    List<String> lines = new ArrayList<>();
    lines.add("Agent Trace: " + trace.name());
    lines.add("ID: " + trace.traceId());
    lines.add("Spans: " + trace.spans().size() + " | Events: " + trace.eventCount());
    lines.add("Duration: " + formatDuration(trace.duration(), "running"));
    SpanIndex index = SpanIndex.of(trace);
    for (Span span : trace.spans()) {
      String indent = "  ".repeat(index.depth(span));
      String duration = span.duration().isPresent() ? " (" + formatDuration(span.duration(), "") + ")" : "";
      lines.add("");
      lines.add(indent + ">>> " + span.name() + duration);
      for (TraceEvent event : span.events()) {
        lines.add(indent + "  " + describe(event));
      }
    }
    return lines;
  }

  /**
   * Renders the span hierarchy. Each span lists its events first, then its child spans.
   *
   * @param trace trace to render
   * @return lines without trailing newlines
   */
  List<String> renderTree(Trace trace) {
    List<String> lines = new ArrayList<>();
    lines.add(trace.name() + " (" + trace.traceId() + ")");
    SpanIndex index = SpanIndex.of(trace);
    List<Span> roots = index.roots();
    Set<String> visited = new HashSet<>();
    for (int i = 0; i < roots.size(); i++) {
      appendSpan(lines, index, roots.get(i), "", i == roots.size() - 1, visited);
    }
    return lines;
  }

  private void appendSpan(
      List<String> lines, SpanIndex index, Span span, String prefix, boolean last, Set<String> visited) {
    if (!visited.add(span.spanId())) {
      return;
    }
    String duration = span.duration().isPresent() ? " [" + formatDuration(span.duration(), "") + "]" : "";
    lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + span.name() + duration);
    String childPrefix = prefix + (last ? GAP : PIPE);
    List<Span> children = index.children(span.spanId());
    List<TraceEvent> events = span.events();
    for (int i = 0; i < events.size(); i++) {
      boolean lastNode = i == events.size() - 1 && children.isEmpty();
      lines.add(childPrefix + (lastNode ? LAST_BRANCH : BRANCH) + events.get(i).eventType().wireValue());
    }
    for (int i = 0; i < children.size(); i++) {
      appendSpan(lines, index, children.get(i), childPrefix, i == children.size() - 1, visited);
    }
  }

  /**
   * Renders the entry under the replay cursor.
   *
   * @param engine replay session
   * @return {@code [position/total] span kind} plus a payload preview, or {@value #END_OF_TRACE}
   */
  List<String> renderStep(ReplayEngine engine) {
    Optional<TimelineEntry> current = engine.peek();
    if (current.isEmpty()) {
      return List.of(END_OF_TRACE);
    }
    TimelineEntry entry = current.get();
    TraceEvent event = entry.event();
    List<String> lines = new ArrayList<>(2);
    lines.add("[" + (engine.position() + 1) + "/" + engine.totalSteps() + "] "
        + entry.span().name() + " " + event.eventType().wireValue());
    if (!event.data().isEmpty()) {
      lines.add("  " + Logs.preview(json.toJson(event.data()), previewChars));
    }
    return lines;
  }

  /**
   * Renders a diff summary and, when the traces differ, one row per divergence.
   *
   * @param result diff outcome
   * @return lines without trailing newlines
   */
  List<String> renderDiff(DiffResult result) {
    List<String> lines = new ArrayList<>();
    lines.add("Trace Diff");
    lines.add("Trace A: " + result.traceAId());
    lines.add("Trace B: " + result.traceBId());
    lines.add(result.summary());
    if (result.identical()) {
      return lines;
    }
    lines.add("");
    lines.add(String.format(Locale.ROOT, "%-4s %-10s %-8s %s", "#", "SEVERITY", "POSITION", "DESCRIPTION"));
    int row = 1;
    for (Divergence divergence : result.divergences()) {
      lines.add(String.format(Locale.ROOT, "%-4d %-10s %-8d %s",
          row++,
          divergence.severity().wireValue().toUpperCase(Locale.ROOT),
          divergence.position(),
          Logs.preview(divergence.description(), previewChars)));
    }
    return lines;
  }

  /**
   * Renders the {@code info} summary.
   *
   * @param trace trace to summarize
   * @return name line followed by counts, duration, and metadata
   */
  List<String> renderInfo(Trace trace) {
    return List.of(
        trace.name() + " (" + trace.traceId() + ")",
        "  Spans:    " + trace.spans().size(),
        "  Events:   " + trace.eventCount(),
        "  Duration: " + formatDuration(trace.duration(), "N/A"),
        "  Metadata: " + json.toJson(trace.metadata()));
  }

  String describe(TraceEvent event) {
    Map<String, Object> data = event.data();
    String label = event.eventType().label();
    return switch (event.eventType()) {
      case LLM_REQUEST -> label + " model=" + text(data.get("model"))
          + " messages=" + (data.get("messages") instanceof List<?> messages ? messages.size() : 0);
      case LLM_RESPONSE -> label + " \"" + preview(data.get("content")) + "\""
          + (data.get("tokens") == null ? "" : " (" + text(data.get("tokens")) + " tokens)");
      case TOOL_CALL -> label + " " + text(data.get("tool"))
          + "(" + preview(json.toJson(data.getOrDefault("args", Map.of()))) + ")";
      case TOOL_RESULT -> label + " " + text(data.get("tool")) + " -> " + preview(data.get("result"));
      case DECISION -> label + " " + text(data.get("description")) + " -> " + text(data.get("choice"));
      case ERROR -> label + " " + preview(data.get("message"));
      case STATE_CHANGE, LOG -> label + " "
          + preview(data.containsKey("message") ? data.get("message") : json.toJson(data));
    };
  }

  private String preview(Object value) {
    return Logs.preview(text(value), previewChars);
  }

  private String text(Object value) {
    if (value == null) {
      return "";
    }
    return value instanceof String s ? s : json.toJson(value);
  }

  private static String formatDuration(OptionalDouble seconds, String absent) {
    return seconds.isPresent() ? String.format(Locale.ROOT, "%.3fs", seconds.getAsDouble()) : absent;
  }
}
