package ca.gc.cra.qotd.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("qotd.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("qotd.tcp.served");
    adapter.increment("qotd.tcp.served");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "qotd.tcp.served");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("qotd.tcp.served", point.getAttributes().get(METRIC_KEY));
    assertEquals("qotd", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogramWithDerivedUnit() {
    adapter.observe("qotd.broker.waitNanos", 1_500L);
    adapter.observe("qotd.broker.waitNanos", 500L);
    adapter.observe("qotd.quote.bytes", 42L);
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData wait = find(metrics, "qotd.broker.waitnanos");
    assertEquals(MetricDataType.HISTOGRAM, wait.getType());
    assertEquals("ns", wait.getUnit());
    HistogramPointData point = wait.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(2_000d, point.getSum(), 0.0d);
    assertEquals("qotd.broker.waitNanos", point.getAttributes().get(METRIC_KEY));

    assertEquals("By", find(metrics, "qotd.quote.bytes").getUnit());
  }

  @Test
  void unitAndNameDerivation() {
    assertEquals("ns", OpenTelemetryMetricsAdapter.unitFor("qotd.broker.waitNanos"));
    assertEquals("By", OpenTelemetryMetricsAdapter.unitFor("qotd.quote.bytes"));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("qotd.udp.oversize"));
    assertEquals("qotd.tcp.served", OpenTelemetryMetricsAdapter.sanitizeName("qotd.tcp.served"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("qotd.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledExporterYieldsNoopAdapter() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(TelemetrySettings.disabled());

    assertTrue(result.isNoop());
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(result)) {
      noop.increment("qotd.tcp.served");
      noop.observe("qotd.quote.bytes", 10L);
    }
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=test, broken ,team=ops");

    assertEquals(2, attributes.size());
    assertEquals("test", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("ops", attributes.get(AttributeKey.stringKey("team")));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
