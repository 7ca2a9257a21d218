package ca.gc.cra.agentreplay.application.recording;

import ca.gc.cra.agentreplay.application.port.TraceStore;
import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Convenience API that records an agent run into a {@link Trace}.
 * <p><strong>Why:</strong> Agents call typed helpers ({@link #toolCall}, {@link #decision}, ...) instead of
 * assembling payload maps and managing span nesting themselves.</p>
 * <p><strong>Spans:</strong> {@link #span(String)} opens a child of the current span and returns a
 * {@link SpanScope}; closing the scope restores the enclosing span. Events recorded outside any span go to a
 * span named {@value #DEFAULT_SPAN}, created on first use.</p>
 * <p><strong>Lifecycle:</strong> {@link #finish()} (or {@link #close()}) closes the trace and, when an output path
 * was configured, saves it through the {@link TraceStore}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one recorder per agent run.</p>
 *
 * @since 0.1.0
 */
public final class Recorder implements AutoCloseable {
  /** Name of the span that receives events recorded outside any explicit span. */
  public static final String DEFAULT_SPAN = "default";
  /** Trace name used when none is given. */
  public static final String DEFAULT_TRACE_NAME = "agent-run";

  private static final Logger log = LoggerFactory.getLogger(Recorder.class);

  private final Trace trace;
  private final Path outputPath;
  private final TraceStore store;
  private Span current;

  /**
   * Records into a new trace that is kept in memory only.
   *
   * @param name trace name
   */
  public Recorder(String name) {
    this(new Trace(name), null, null);
  }

  /**
   * Records into a new trace that is saved on {@link #finish()}.
   *
   * @param name trace name
   * @param metadata trace metadata; may be {@code null}
   * @param outputPath destination, or {@code null} to keep the trace in memory
   * @param store store used to save; required when {@code outputPath} is set
   */
  public Recorder(String name, Map<String, Object> metadata, Path outputPath, TraceStore store) {
    this(newTrace(name, metadata), outputPath, store);
  }

  /**
   * Records into an existing trace.
   *
   * @param trace trace to append to
   * @param outputPath destination, or {@code null} to keep the trace in memory
   * @param store store used to save; required when {@code outputPath} is set
   */
  public Recorder(Trace trace, Path outputPath, TraceStore store) {
    this.trace = Objects.requireNonNull(trace, "trace");
    if (outputPath != null && store == null) {
      throw new IllegalArgumentException("store is required when an output path is set");
    }
    this.outputPath = outputPath;
    this.store = store;
  }

  private static Trace newTrace(String name, Map<String, Object> metadata) {
    Trace trace = new Trace(name == null ? DEFAULT_TRACE_NAME : name);
    if (metadata != null) {
      metadata.forEach(trace::putMetadata);
    }
    return trace;
  }

  /**
   * Runs a body with a fresh recorder and finishes it afterwards, whether the body returns or throws.
   *
   * @param name trace name
   * @param outputPath destination, or {@code null} to keep the trace in memory
   * @param store store used to save; required when {@code outputPath} is set
   * @param body code to record
   * @param <T> result type
   * @return the body's result
   * @throws Exception when the body fails or the trace cannot be saved
   */
  public static <T> T record(String name, Path outputPath, TraceStore store, RecordedBody<T> body)
      throws Exception {
    Objects.requireNonNull(body, "body");
    try (Recorder recorder = new Recorder(name, null, outputPath, store)) {
      return body.run(recorder);
    }
  }

  public Trace trace() {
    return trace;
  }

  public Optional<Path> outputPath() {
    return Optional.ofNullable(outputPath);
  }

  /**
   * Returns the span that receives events right now.
   *
   * @return current span, or empty before any event or span was recorded
   */
  public Optional<Span> currentSpan() {
    return Optional.ofNullable(current);
  }

  /**
   * Closes the trace and its open spans and saves it when an output path is configured.
   *
   * @return the recorded trace
   * @throws IOException when saving fails
   */
  public Trace finish() throws IOException {
    trace.close();
    if (outputPath != null) {
      store.save(trace, outputPath);
      log.debug("Saved trace {} with {} events to {}", trace.traceId(), trace.eventCount(), outputPath);
    }
    return trace;
  }

  @Override
  public void close() throws IOException {
    finish();
  }

  /**
   * Opens a span nested under the current span.
   *
   * @param name span name
   * @return scope that must be closed to end the span
   */
  public SpanScope span(String name) {
    return span(name, null);
  }

  /**
   * Opens a span nested under the current span.
   *
   * @param name span name
   * @param metadata span metadata; may be {@code null}
   * @return scope that must be closed to end the span
   */
  public SpanScope span(String name, Map<String, Object> metadata) {
    String parentId = current == null ? null : current.spanId();
    Span span = trace.addSpan(name, parentId, metadata);
    SpanScope scope = new SpanScope(this, span, current);
    current = span;
    return scope;
  }

  /**
   * Runs {@code body} inside a span that closes when the body returns or throws.
   *
   * @param name span name
   * @param body code to run
   * @param <T> result type
   * @return the body's result
   * @throws Exception whatever {@code body} throws
   */
  public <T> T inSpan(String name, Callable<T> body) throws Exception {
    Objects.requireNonNull(body, "body");
    try (SpanScope ignored = span(name)) {
      return body.call();
    }
  }

  void restoreCurrent(Span previous) {
    current = previous;
  }

  /**
   * Records a raw event in the current span.
   *
   * @param eventType kind of occurrence
   * @param data payload; may be {@code null}
   * @return recorded event
   */
  public TraceEvent event(EventType eventType, Map<String, Object> data) {
    return ensureSpan().addEvent(eventType, data);
  }

  public TraceEvent llmRequest(String model, List<?> messages) {
    return llmRequest(model, messages, null);
  }

  /**
   * Records a prompt sent to a model.
   *
   * @param model model name; {@code null} records an empty string
   * @param messages prompt messages; {@code null} records an empty list
   * @param extra additional payload entries; may be {@code null}
   * @return recorded event
   */
  public TraceEvent llmRequest(String model, List<?> messages, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("model", model == null ? "" : model);
    data.put("messages", messages == null ? List.of() : messages);
    return event(EventType.LLM_REQUEST, withExtra(data, extra));
  }

  public TraceEvent llmResponse(String content, Integer tokens) {
    return llmResponse(content, tokens, null);
  }

  /**
   * Records a model completion.
   *
   * @param content completion text; {@code null} records an empty string
   * @param tokens token count, or {@code null} when unknown
   * @param extra additional payload entries; may be {@code null}
   * @return recorded event
   */
  public TraceEvent llmResponse(String content, Integer tokens, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("content", content == null ? "" : content);
    data.put("tokens", tokens);
    return event(EventType.LLM_RESPONSE, withExtra(data, extra));
  }

  public TraceEvent toolCall(String tool, Map<String, Object> args) {
    return toolCall(tool, args, null);
  }

  /**
   * Records a tool invocation.
   *
   * @param tool tool name
   * @param args tool arguments; {@code null} records an empty map
   * @param extra additional payload entries; may be {@code null}
   * @return recorded event
   */
  public TraceEvent toolCall(String tool, Map<String, Object> args, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("tool", tool);
    data.put("args", args == null ? Map.of() : args);
    return event(EventType.TOOL_CALL, withExtra(data, extra));
  }

  public TraceEvent toolResult(String tool, Object result) {
    return toolResult(tool, result, null);
  }

  public TraceEvent toolResult(String tool, Object result, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("tool", tool);
    data.put("result", result);
    return event(EventType.TOOL_RESULT, withExtra(data, extra));
  }

  public TraceEvent decision(String description, String choice) {
    return decision(description, choice, null);
  }

  /**
   * Records a branching choice made by the agent.
   *
   * @param description what was being decided
   * @param choice chosen option; {@code null} records an empty string
   * @param extra additional payload entries; may be {@code null}
   * @return recorded event
   */
  public TraceEvent decision(String description, String choice, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("description", description);
    data.put("choice", choice == null ? "" : choice);
    return event(EventType.DECISION, withExtra(data, extra));
  }

  public TraceEvent stateChange(String key, Object oldValue, Object newValue) {
    return stateChange(key, oldValue, newValue, null);
  }

  public TraceEvent stateChange(String key, Object oldValue, Object newValue, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("key", key);
    data.put("old", oldValue);
    data.put("new", newValue);
    return event(EventType.STATE_CHANGE, withExtra(data, extra));
  }

  public TraceEvent log(String message) {
    return log(message, "info", null);
  }

  /**
   * Records a free-form log line.
   *
   * @param message log text
   * @param level level label; {@code null} records {@code info}
   * @param extra additional payload entries; may be {@code null}
   * @return recorded event
   */
  public TraceEvent log(String message, String level, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", message);
    data.put("level", level == null ? "info" : level);
    return event(EventType.LOG, withExtra(data, extra));
  }

  public TraceEvent error(String message, String exception) {
    return error(message, exception, null);
  }

  public TraceEvent error(String message, String exception, Map<String, Object> extra) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", message);
    data.put("exception", exception);
    return event(EventType.ERROR, withExtra(data, extra));
  }

  /**
   * Records a failure from a caught exception, storing its type and message.
   *
   * @param message description of what failed
   * @param failure caught exception
   * @return recorded event
   */
  public TraceEvent failure(String message, Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    return error(message, failure.getClass().getSimpleName() + ": " + failure.getMessage(), null);
  }

  private Span ensureSpan() {
    if (current == null) {
      current = trace.addSpan(DEFAULT_SPAN);
    }
    return current;
  }

  private static Map<String, Object> withExtra(Map<String, Object> data, Map<String, Object> extra) {
    if (extra != null) {
      data.putAll(extra);
    }
    return data;
  }

  /**
   * Code recorded by {@link Recorder#record(String, Path, TraceStore, RecordedBody)}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface RecordedBody<T> {
    T run(Recorder recorder) throws Exception;
  }
}
