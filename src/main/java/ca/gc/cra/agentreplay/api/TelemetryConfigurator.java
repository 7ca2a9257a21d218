package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings out of the command settings and into the {@code otel.*} system properties read by
 * the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} from {@code args}
   * and applies the non-blank ones.
   *
   * @param args mutable settings map
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = trimmed(args.remove("metricsExporter"));
    String endpoint = trimmed(args.remove("otelEndpoint"));
    String attributes = trimmed(args.remove("otelResourceAttributes"));

    if (!exporter.isEmpty()) {
      String mode = Strings.requireOneOf("metricsExporter", exporter, "none", "none", "otlp");
      log.debug("Metrics exporter: {}", mode);
      System.setProperty("otel.metrics.exporter", mode);
    }
    if (!endpoint.isEmpty()) {
      requireHttpEndpoint(endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
