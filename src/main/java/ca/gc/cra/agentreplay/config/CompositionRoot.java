package ca.gc.cra.agentreplay.config;

import ca.gc.cra.agentreplay.application.diff.DiffEngine;
import ca.gc.cra.agentreplay.application.port.ExportFormat;
import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.application.port.TraceExporter;
import ca.gc.cra.agentreplay.application.port.TraceStore;
import ca.gc.cra.agentreplay.domain.trace.TraceClock;
import ca.gc.cra.agentreplay.infrastructure.export.HtmlTraceExporter;
import ca.gc.cra.agentreplay.infrastructure.export.JsonTraceExporter;
import ca.gc.cra.agentreplay.infrastructure.persistence.JsonlTraceStore;
import java.time.ZoneId;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires application use cases to their adapters for one CLI run.
 * <p><strong>Role:</strong> The only place that names concrete adapter classes; commands ask it for ports.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods allocate new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final TraceClock clock;

  /**
   * Creates a composition root.
   *
   * @param metrics metrics sink shared by every adapter
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, TraceClock.SYSTEM);
  }

  /**
   * Creates a composition root with an explicit clock for traces mutated after loading.
   *
   * @param metrics metrics sink shared by every adapter
   * @param clock trace clock
   */
  public CompositionRoot(MetricsPort metrics, TraceClock clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public TraceStore traceStore() {
    return new JsonlTraceStore(metrics, clock);
  }

  public DiffEngine diffEngine() {
    return new DiffEngine(metrics);
  }

  /**
   * Returns the exporter for a format.
   *
   * @param format requested format
   * @return exporter writing {@code format}
   */
  public TraceExporter exporter(ExportFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case JSON -> new JsonTraceExporter(metrics);
      case HTML -> new HtmlTraceExporter(metrics, ZoneId.systemDefault());
    };
  }
}
