package ca.gc.cra.agentreplay.domain.trace;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-side lookup structure that rebuilds span nesting from {@code parent_id} references.
 *
 * <p>Built on demand from a trace snapshot; never stored on the trace. Spans added to the trace after the
 * index was built are not visible. When two spans share an id the first one in storage order wins.</p>
 *
 * @since 0.1.0
 */
public final class SpanIndex {
  private final List<Span> spans;
  private final Map<String, Span> byId = new LinkedHashMap<>();
  private final Map<String, List<Span>> childrenById = new LinkedHashMap<>();

  private SpanIndex(List<Span> spans) {
    this.spans = List.copyOf(spans);
    for (Span span : this.spans) {
      byId.putIfAbsent(span.spanId(), span);
    }
    for (Span span : this.spans) {
      span.parentId().ifPresent(parent ->
          childrenById.computeIfAbsent(parent, key -> new ArrayList<>()).add(span));
    }
  }

  /**
   * Indexes the spans currently stored on a trace.
   *
   * @param trace trace to index
   * @return new index
   */
  public static SpanIndex of(Trace trace) {
    return new SpanIndex(Objects.requireNonNull(trace, "trace").spans());
  }

  public Optional<Span> find(String spanId) {
    return Optional.ofNullable(byId.get(spanId));
  }

  /**
   * Returns the span with the given id.
   *
   * @param spanId span id
   * @return matching span
   * @throws NotFoundException when no span carries {@code spanId}
   */
  public Span require(String spanId) {
    Span span = byId.get(spanId);
    if (span == null) {
      throw NotFoundException.span(spanId);
    }
    return span;
  }

  /**
   * Returns the direct children of a span in storage order.
   *
   * @param spanId parent span id
   * @return children; empty when none
   */
  public List<Span> children(String spanId) {
    return List.copyOf(childrenById.getOrDefault(spanId, List.of()));
  }

  /**
   * Returns top-level spans: those without a parent, or whose parent is not part of the trace.
   *
   * @return roots in storage order
   */
  public List<Span> roots() {
    List<Span> roots = new ArrayList<>();
    for (Span span : spans) {
      Optional<String> parent = span.parentId();
      if (parent.isEmpty() || !byId.containsKey(parent.get())) {
        roots.add(span);
      }
    }
    return roots;
  }

  /**
   * Counts ancestors reachable through {@code parent_id} references.
   *
   * @param span span whose depth is requested
   * @return 0 for a root; stops counting when a reference cycle is detected
   */
  public int depth(Span span) {
    Set<String> seen = new HashSet<>();
    seen.add(span.spanId());
    int depth = 0;
    Optional<String> parent = span.parentId();
    while (parent.isPresent()) {
      Span next = byId.get(parent.get());
      if (next == null || !seen.add(next.spanId())) {
        break;
      }
      depth++;
      parent = next.parentId();
    }
    return depth;
  }

  /**
   * Finds the span that owns an event by searching every span's events for its id.
   *
   * @param event event to locate
   * @return first span in storage order holding an event with the same id
   */
  public Optional<Span> ownerOf(TraceEvent event) {
    Objects.requireNonNull(event, "event");
    for (Span span : spans) {
      if (span.contains(event.eventId())) {
        return Optional.of(span);
      }
    }
    return Optional.empty();
  }
}
