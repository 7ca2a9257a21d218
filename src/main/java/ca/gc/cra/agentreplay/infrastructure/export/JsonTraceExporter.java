package ca.gc.cra.agentreplay.infrastructure.export;

import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.ExportFormat;
import ca.gc.cra.agentreplay.application.port.MetricsPort;
import ca.gc.cra.agentreplay.application.port.TraceExporter;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceRecords;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a trace as one pretty-printed JSON document with spans and events nested.
 *
 * @since 0.1.0
 */
public final class JsonTraceExporter implements TraceExporter {
  private static final Logger log = LoggerFactory.getLogger(JsonTraceExporter.class);

  private final JsonSupport json = new JsonSupport();
  private final MetricsPort metrics;

  public JsonTraceExporter() {
    this(MetricsPort.NO_OP);
  }

  public JsonTraceExporter(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public ExportFormat format() {
    return ExportFormat.JSON;
  }

  @Override
  public Path export(Trace trace, Path path) throws IOException {
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(path, "path");
    try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      json.write(out, TraceRecords.toMap(trace), true);
      out.newLine();
    }
    metrics.increment("export.json");
    log.debug("Exported trace {} as JSON to {}", trace.traceId(), path);
    return path;
  }
}
