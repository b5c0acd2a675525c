package ca.gc.cra.qotd.config;

import ca.gc.cra.qotd.application.broker.QuoteBroker;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>Category selection has no default entry here: its absence lets the {@code --all} and
 * {@code --offensive} shortcuts apply, and {@link ServeConfig} falls back to decorous quotes.</p>
 */
public final class DefaultsForMode {
  /** Command name for the server. */
  public static final String SERVE = "serve";
  /** Command name for the client. */
  public static final String CLIENT = "client";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command ({@code serve} or {@code client})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case SERVE -> buildServeDefaults();
      case CLIENT -> buildClientDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("port", Integer.toString(ServeConfig.DEFAULT_PORT));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dir", ServeConfig.DEFAULT_CORPUS_DIR);
    map.put("host", ServeConfig.DEFAULT_HOST);
    map.put("brokerQueueCapacity", Integer.toString(QuoteBroker.DEFAULT_QUEUE_CAPACITY));
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildClientDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("timeoutMillis", Long.toString(ClientConfig.DEFAULT_TIMEOUT.toMillis()));
    map.put("tcp", "false");
    return Map.copyOf(map);
  }
}
