package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void movesTelemetryKeysIntoSystemProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "trace", "run.jsonl",
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "team=replay"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals(Map.of("trace", "run.jsonl"), args);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("team=replay", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    Map<String, String> args = new HashMap<>(Map.of("otelEndpoint", "grpc://collector:4317"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
  }
}
