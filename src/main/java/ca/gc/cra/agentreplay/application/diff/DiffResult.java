package ca.gc.cra.agentreplay.application.diff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of comparing two traces.
 *
 * @param traceAId id of the left-hand trace
 * @param traceBId id of the right-hand trace
 * @param divergences divergences in ascending position order
 * @param summary one-line human summary
 *
 * @since 0.1.0
 */
public record DiffResult(String traceAId, String traceBId, List<Divergence> divergences, String summary) {
  public static final String IDENTICAL_SUMMARY = "Traces are identical in structure and content.";

  /** Copies the divergence list. */
  public DiffResult {
    traceAId = Objects.requireNonNull(traceAId, "traceAId");
    traceBId = Objects.requireNonNull(traceBId, "traceBId");
    divergences = List.copyOf(Objects.requireNonNull(divergences, "divergences"));
    summary = Objects.requireNonNull(summary, "summary");
  }

  /**
   * Builds a result and derives its summary from the divergences.
   *
   * @param traceAId id of the left-hand trace
   * @param traceBId id of the right-hand trace
   * @param divergences divergences in ascending position order
   * @return result with a generated summary
   */
  public static DiffResult of(String traceAId, String traceBId, List<Divergence> divergences) {
    return new DiffResult(traceAId, traceBId, divergences, summarize(divergences));
  }

  public boolean identical() {
    return divergences.isEmpty();
  }

  public int divergenceCount() {
    return divergences.size();
  }

  /**
   * Counts divergences classified {@link Severity#CRITICAL}.
   *
   * @return number of critical divergences
   */
  public int criticalCount() {
    int count = 0;
    for (Divergence divergence : divergences) {
      if (divergence.severity() == Severity.CRITICAL) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the earliest divergence, the point where the two runs first part ways.
   *
   * @return first divergence, or empty when the traces are identical
   */
  public Optional<Divergence> firstDivergence() {
    return divergences.isEmpty() ? Optional.empty() : Optional.of(divergences.get(0));
  }

  /**
   * Returns the report form of this result.
   *
   * @return insertion-ordered map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("trace_a_id", traceAId);
    map.put("trace_b_id", traceBId);
    map.put("identical", identical());
    map.put("divergence_count", divergenceCount());
    map.put("critical_count", criticalCount());
    map.put("summary", summary);
    List<Object> items = new ArrayList<>(divergences.size());
    for (Divergence divergence : divergences) {
      items.add(divergence.toMap());
    }
    map.put("divergences", items);
    return map;
  }

  static String summarize(List<Divergence> divergences) {
    int total = divergences.size();
    if (total == 0) {
      return IDENTICAL_SUMMARY;
    }
    int critical = 0;
    for (Divergence divergence : divergences) {
      if (divergence.severity() == Severity.CRITICAL) {
        critical++;
      }
    }
    return "Found " + total + " divergence(s): " + critical + " critical, "
        + (total - critical) + " informational.";
  }
}
