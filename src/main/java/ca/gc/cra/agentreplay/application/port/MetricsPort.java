package ca.gc.cra.agentreplay.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for trace storage, diffing, and export.
 * <p><strong>Why:</strong> Lets engines and adapters count work without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when metrics are off.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code trace.store.loaded},
 * {@code diff.divergences.critical}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code diff.run}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (event counts, divergence counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
