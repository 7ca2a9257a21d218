package ca.gc.cra.agentreplay.application.diff;

import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.SpanIndex;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Compares two traces position by position and reports where they diverge.
 * <p><strong>Why:</strong> Pinpoints the first step where two runs of the same agent task behaved differently.</p>
 * <p><strong>Alignment:</strong> Both traces are reduced to their canonical event order ({@link Trace#allEvents()})
 * and walked in lockstep. The walk never resynchronizes: one inserted event in the middle of a run makes every
 * later position differ.</p>
 * <p><strong>Classification:</strong>
 * <ul>
 *   <li>One side exhausted: {@link Severity#WARNING} naming the extra event's kind.</li>
 *   <li>Different event kinds: {@link Severity#CRITICAL}; payloads are not compared.</li>
 *   <li>Same kind: the kind's {@link PayloadComparison}, if any, decides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; safe to share.</p>
 * <p><strong>Metrics:</strong> {@code diff.run}, {@code diff.divergences}, {@code diff.divergences.critical}.</p>
 *
 * @since 0.1.0
 */
public final class DiffEngine {
  private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);
  private static final String UNKNOWN_SPAN = "unknown";

  private final MetricsPort metrics;

  /** Creates an engine that records no metrics. */
  public DiffEngine() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an engine.
   *
   * @param metrics metrics sink for run and divergence counts
   */
  public DiffEngine(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Compares two traces.
   *
   * @param traceA reference trace
   * @param traceB trace compared against the reference
   * @return divergences in ascending position order, with a summary line
   */
  public DiffResult diff(Trace traceA, Trace traceB) {
    Objects.requireNonNull(traceA, "traceA");
    Objects.requireNonNull(traceB, "traceB");
    List<TraceEvent> eventsA = traceA.allEvents();
    List<TraceEvent> eventsB = traceB.allEvents();
    SpanIndex spansA = SpanIndex.of(traceA);
    SpanIndex spansB = SpanIndex.of(traceB);

    List<Divergence> divergences = new ArrayList<>();
    int length = Math.max(eventsA.size(), eventsB.size());
    for (int i = 0; i < length; i++) {
      TraceEvent a = i < eventsA.size() ? eventsA.get(i) : null;
      TraceEvent b = i < eventsB.size() ? eventsB.get(i) : null;
      compareAt(i, a, b, spansA, spansB).ifPresent(divergences::add);
    }

    DiffResult result = DiffResult.of(traceA.traceId(), traceB.traceId(), divergences);
    metrics.increment("diff.run");
    metrics.observe("diff.divergences", result.divergenceCount());
    metrics.observe("diff.divergences.critical", result.criticalCount());
    log.debug("Diffed trace {} ({} events) against {} ({} events): {}",
        traceA.traceId(), eventsA.size(), traceB.traceId(), eventsB.size(), result.summary());
    return result;
  }

  private static Optional<Divergence> compareAt(
      int position, TraceEvent a, TraceEvent b, SpanIndex spansA, SpanIndex spansB) {
    if (a == null) {
      return Optional.of(new Divergence(position,
          "Trace B has extra event: " + b.eventType().wireValue(),
          Severity.WARNING, "", spanName(spansB, b), null, b));
    }
    if (b == null) {
      return Optional.of(new Divergence(position,
          "Trace A has extra event: " + a.eventType().wireValue(),
          Severity.WARNING, spanName(spansA, a), "", a, null));
    }
    if (a.eventType() != b.eventType()) {
      return Optional.of(new Divergence(position,
          "Event type divergence: " + a.eventType().wireValue() + " vs " + b.eventType().wireValue(),
          Severity.CRITICAL, spanName(spansA, a), spanName(spansB, b), a, b));
    }
    Optional<PayloadComparison> comparison = PayloadComparison.forType(a.eventType());
    if (comparison.isEmpty()) {
      return Optional.empty();
    }
    return comparison.get().compare(a, b).map(description -> new Divergence(position,
        description, comparison.get().severity(), spanName(spansA, a), spanName(spansB, b), a, b));
  }

  private static String spanName(SpanIndex index, TraceEvent event) {
    return index.ownerOf(event).map(Span::name).orElse(UNKNOWN_SPAN);
  }
}
