package ca.gc.cra.agentreplay.infrastructure.metrics;

import ca.gc.cra.agentreplay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Naming:</strong> dotted keys such as {@code trace.store.loaded} become instrument names after
 * lowercasing and replacing unsupported characters; the original key is kept as the
 * {@code agentreplay.metric.key} attribute.</p>
 * <p><strong>Lifecycle:</strong> instruments are created lazily on first use. {@link #close()} flushes and shuts
 * down the meter provider; the CLI calls it before exiting.</p>
 * <p><strong>Thread-safety:</strong> Instrument caches are concurrent maps; safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("agentreplay.metric.key");
  private static final String FALLBACK_METRIC_NAME = "agentreplay.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from {@code otel.*} system properties and {@code OTEL_*} environment
   * variables. Exporting is off unless an exporter is selected.
   *
   * @return adapter; backed by a no-op meter when exporting is disabled or fails to start
   */
  public static OpenTelemetryMetricsAdapter fromEnvironment() {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Reports whether metrics are actually exported.
   *
   * @return {@code true} when backed by a no-op meter
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    Instrument<LongCounter> counter = counters.computeIfAbsent(key, this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(key, this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = metricName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("agent-replay counter for " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = metricName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("agent-replay observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private static String metricName(String key) {
    String sanitized = sanitizeName(key);
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
