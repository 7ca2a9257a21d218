package ca.gc.cra.agentreplay.application.recording;

import ca.gc.cra.agentreplay.domain.trace.Span;
import java.util.Objects;

/**
 * Handle for a span opened by {@link Recorder#span(String)}; closing it closes the span and makes the enclosing
 * span current again.
 *
 * <p>Intended for try-with-resources so the span closes on every exit path, including exceptions.
 * Closing twice has no further effect.</p>
 *
 * @since 0.1.0
 */
public final class SpanScope implements AutoCloseable {
  private final Recorder recorder;
  private final Span span;
  private final Span previous;
  private boolean closed;

  SpanScope(Recorder recorder, Span span, Span previous) {
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.span = Objects.requireNonNull(span, "span");
    this.previous = previous;
  }

  public Span span() {
    return span;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    span.close();
    recorder.restoreCurrent(previous);
  }
}
