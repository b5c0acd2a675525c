package ca.gc.cra.qotd.api;

import ca.gc.cra.qotd.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.qotd.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates telemetry-related settings into {@link TelemetrySettings} for the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Validates {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}; blank
   * values fall back to the {@code OTEL_*} environment variables.
   *
   * @param effective merged configuration
   * @return resolved settings
   * @throws IllegalArgumentException if any value is malformed
   */
  static TelemetrySettings settingsFrom(Map<String, String> effective) {
    String exporter = blankToNull(effective.get("metricsExporter"));
    if (exporter != null) {
      exporter = Strings.requireOneOf("metricsExporter", exporter, "otlp", "none");
    }
    String endpoint = blankToNull(effective.get("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
    }
    String attributes = blankToNull(effective.get("otelResourceAttributes"));
    if (attributes != null) {
      attributes = Strings.requirePrintableAscii(
          "otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings settings = TelemetrySettings.resolve(exporter, endpoint, attributes);
    log.debug("Metrics exporter {} targeting {}", settings.exporter(), settings.endpoint());
    return settings;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
