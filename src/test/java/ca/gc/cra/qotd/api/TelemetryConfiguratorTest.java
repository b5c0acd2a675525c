package ca.gc.cra.qotd.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.qotd.infrastructure.metrics.TelemetrySettings;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void explicitSettingsAreValidatedAndPassedThrough() {
    TelemetrySettings settings = TelemetryConfigurator.settingsFrom(Map.of(
        "metricsExporter", "NONE",
        "otelEndpoint", "https://collector.example.org:4317",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals(TelemetrySettings.Exporter.NONE, settings.exporter());
    assertEquals("https://collector.example.org:4317", settings.endpoint());
    assertEquals("deployment.environment=test", settings.resourceAttributes());
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settingsFrom(Map.of("metricsExporter", "statsd")));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settingsFrom(Map.of("otelEndpoint", "ftp://collector:4317")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settingsFrom(Map.of("otelEndpoint", "http://")));
  }

  @Test
  void rejectsNonPrintableResourceAttributes() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.settingsFrom(Map.of("otelResourceAttributes", "team=\u00e9quipe")));
  }
}
