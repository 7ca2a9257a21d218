package ca.gc.cra.agentreplay.application.replay;

import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.TraceStore;
import ca.gc.cra.agentreplay.domain.trace.TimelineEntry;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Cursor over the global, time-ordered tape of a trace's events.
 * <p><strong>Why:</strong> Lets an operator walk a recorded run forwards, backwards, or to an arbitrary step.</p>
 * <p><strong>Role:</strong> Read-only use case over a {@link Trace}. The tape is a snapshot of
 * {@link Trace#timeline()} taken at construction; later mutations of the trace are not visible.</p>
 * <p><strong>Cursor:</strong> {@link #position()} is always in {@code [0, totalSteps()]}. A position equal to
 * {@code totalSteps()} means the tape is exhausted. Every navigation method returns {@link Optional#empty()}
 * at the boundaries instead of failing, and an out-of-range {@link #jump(int)} leaves the cursor where it
 * was.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the cursor is mutable state owned by one caller.</p>
 *
 * @since 0.1.0
 */
public final class ReplayEngine {
  private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

  private final Trace trace;
  private final List<TimelineEntry> tape;
  private final JsonSupport json = new JsonSupport();
  private int position;

  /**
   * Builds the tape for a trace.
   *
   * @param trace trace to replay; may still be open
   */
  public ReplayEngine(Trace trace) {
    this.trace = Objects.requireNonNull(trace, "trace");
    this.tape = List.copyOf(trace.timeline());
    log.debug("Replay tape built for trace {} with {} steps", trace.traceId(), tape.size());
  }

  /**
   * Loads a trace through a store and builds its tape.
   *
   * @param store trace store
   * @param path trace file
   * @return engine positioned at step 0
   * @throws IOException when the file cannot be read
   */
  public static ReplayEngine fromFile(TraceStore store, Path path) throws IOException {
    return new ReplayEngine(Objects.requireNonNull(store, "store").load(path));
  }

  public Trace trace() {
    return trace;
  }

  /**
   * Returns the replay tape in canonical order.
   *
   * @return read-only list
   */
  public List<TimelineEntry> tape() {
    return tape;
  }

  public int totalSteps() {
    return tape.size();
  }

  public int position() {
    return position;
  }

  public boolean hasNext() {
    return position < tape.size();
  }

  public boolean hasPrevious() {
    return position > 0;
  }

  /**
   * Returns the entry at the cursor and advances by one.
   *
   * @return current entry, or empty when the tape is exhausted (cursor unchanged)
   */
  public Optional<TimelineEntry> step() {
    if (!hasNext()) {
      return Optional.empty();
    }
    return Optional.of(tape.get(position++));
  }

  /**
   * Moves the cursor back by one and returns the entry there.
   *
   * @return previous entry, or empty at position 0 (cursor unchanged)
   */
  public Optional<TimelineEntry> stepBack() {
    if (!hasPrevious()) {
      return Optional.empty();
    }
    return Optional.of(tape.get(--position));
  }

  /**
   * Returns the entry at the cursor without moving it.
   *
   * @return current entry, or empty when the tape is exhausted
   */
  public Optional<TimelineEntry> peek() {
    return hasNext() ? Optional.of(tape.get(position)) : Optional.empty();
  }

  /**
   * Moves the cursor to an absolute, zero-based position.
   *
   * @param target position in {@code [0, totalSteps())}
   * @return entry at {@code target}, or empty when out of range (cursor unchanged)
   */
  public Optional<TimelineEntry> jump(int target) {
    if (target < 0 || target >= tape.size()) {
      log.debug("Ignoring jump to {}; tape has {} steps", target, tape.size());
      return Optional.empty();
    }
    position = target;
    return Optional.of(tape.get(position));
  }

  /** Moves the cursor back to the first step. */
  public void reset() {
    position = 0;
  }

  /**
   * Returns every tape entry that belongs to the span at the cursor.
   *
   * <p>When the cursor is past the end, the span of the last tape entry is used.</p>
   *
   * @return entries in tape order; empty when the tape is empty
   */
  public List<TimelineEntry> currentSpanEvents() {
    if (tape.isEmpty()) {
      return List.of();
    }
    String spanId = tape.get(Math.min(position, tape.size() - 1)).span().spanId();
    List<TimelineEntry> entries = new ArrayList<>();
    for (TimelineEntry entry : tape) {
      if (entry.span().spanId().equals(spanId)) {
        entries.add(entry);
      }
    }
    return Collections.unmodifiableList(entries);
  }

  /**
   * Finds tape positions whose span name, event kind, or payload text contains {@code query}.
   *
   * <p>Matching is a case-insensitive substring test over a linear scan of the tape. The event kind matches both
   * its wire spelling ({@code tool_call}) and its label ({@code TOOL CALL}); the payload is matched as JSON text.</p>
   *
   * @param query text to look for; an empty query matches every position
   * @return ascending zero-based positions
   */
  public List<Integer> search(String query) {
    Objects.requireNonNull(query, "query");
    String needle = query.toLowerCase(Locale.ROOT);
    List<Integer> matches = new ArrayList<>();
    for (int i = 0; i < tape.size(); i++) {
      if (searchableText(tape.get(i)).contains(needle)) {
        matches.add(i);
      }
    }
    return matches;
  }

  private String searchableText(TimelineEntry entry) {
    TraceEvent event = entry.event();
    String text = entry.span().name()
        + ' ' + event.eventType().wireValue()
        + ' ' + event.eventType().label()
        + ' ' + json.toJson(event.data());
    return text.toLowerCase(Locale.ROOT);
  }
}
