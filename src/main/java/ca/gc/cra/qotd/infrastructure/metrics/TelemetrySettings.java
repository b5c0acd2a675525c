package ca.gc.cra.qotd.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Metrics export settings resolved from configuration, with the standard {@code OTEL_*} environment
 * variables as fallback.
 *
 * @param exporter exporter selection
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be empty
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum Exporter {
    /** OTLP over gRPC. */
    OTLP,
    /** Metrics discarded. */
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException(
            "metricsExporter must be otlp or none (was " + raw + ")");
      };
    }
  }

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable export.
   *
   * @return exporter {@link Exporter#NONE}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  /**
   * Resolves settings, preferring explicit values over {@code OTEL_METRICS_EXPORTER},
   * {@code OTEL_EXPORTER_OTLP_ENDPOINT} and {@code OTEL_RESOURCE_ATTRIBUTES}.
   *
   * @param exporter explicit exporter name; may be {@code null}
   * @param endpoint explicit endpoint; may be {@code null}
   * @param resourceAttributes explicit attributes; may be {@code null}
   * @return resolved settings
   * @throws IllegalArgumentException if the resolved exporter name is unknown
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    return new TelemetrySettings(
        Exporter.parse(firstNonBlank(exporter, System.getenv("OTEL_METRICS_EXPORTER"), "otlp")),
        firstNonBlank(endpoint, System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT),
        firstNonBlank(resourceAttributes, System.getenv("OTEL_RESOURCE_ATTRIBUTES"), ""));
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }
}
