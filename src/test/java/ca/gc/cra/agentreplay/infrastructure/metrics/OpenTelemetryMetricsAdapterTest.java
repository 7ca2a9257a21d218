package ca.gc.cra.agentreplay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("trace.store.loaded");
    adapter.increment("trace.store.loaded");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "trace.store.loaded");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("trace.store.loaded",
        point.getAttributes().get(AttributeKey.stringKey("agentreplay.metric.key")));
    assertEquals("agent-replay",
        counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("diff.divergences", 3);
    adapter.observe("diff.divergences", 5);

    MetricData histogram = find(reader.collectAllMetrics(), "diff.divergences");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(8.0, point.getSum());
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("export.html", OpenTelemetryMetricsAdapter.sanitizeName("Export.HTML"));
    assertEquals("m1bad_name", OpenTelemetryMetricsAdapter.sanitizeName("1bad name"));
    assertEquals("agentreplay.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void parsesResourceAttributes() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=replay, env = ci,broken");

    assertEquals("replay", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("ci", attributes.get(AttributeKey.stringKey("env")));
    assertEquals(2, attributes.size());
  }

  @Test
  void noopBootstrapDoesNotExport() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());

    noop.increment("diff.run");
    noop.observe("diff.divergences", 1);
    noop.close();

    assertTrue(noop.isNoop());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
