package ca.gc.cra.qotd.config;

import ca.gc.cra.qotd.validation.Net;
import ca.gc.cra.qotd.validation.Numbers;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Validated settings for the {@code client} command.
 *
 * @param host server host; required
 * @param port server port
 * @param tcp {@code true} to fetch over TCP, {@code false} for UDP
 * @param timeout connect and receive timeout
 * @since 0.1.0
 */
public record ClientConfig(String host, int port, boolean tcp, Duration timeout) {
  /** Default connect and receive timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  private static final int MAX_TIMEOUT_MILLIS = 600_000;

  public ClientConfig {
    host = Net.validateHost(host);
    Numbers.requireRange("port", port, Net.MIN_PORT, Net.MAX_PORT);
    Objects.requireNonNull(timeout, "timeout");
    Numbers.requireRange("timeoutMillis", timeout.toMillis(), 1, MAX_TIMEOUT_MILLIS);
  }

  /**
   * Builds a config from a flat key/value map.
   *
   * @param map flat settings with keys {@code host}, {@code port}, {@code tcp}, {@code timeoutMillis}
   * @return validated config
   * @throws IllegalArgumentException if {@code host} is missing or any value is malformed
   */
  public static ClientConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String host = ServeConfig.present(map, "host")
        .orElseThrow(() -> new IllegalArgumentException("host is required"));
    int port = ServeConfig.present(map, "port").map(Net::parsePort).orElse(ServeConfig.DEFAULT_PORT);
    boolean tcp = ServeConfig.flag(map, "tcp");
    Duration timeout = ServeConfig.present(map, "timeoutMillis")
        .map(value -> Duration.ofMillis(Numbers.parseIntInRange("timeoutMillis", value, 1, MAX_TIMEOUT_MILLIS)))
        .orElse(DEFAULT_TIMEOUT);
    return new ClientConfig(host, port, tcp, timeout);
  }

  /**
   * Returns the server address, resolving {@link #host()}.
   *
   * @return server socket address
   */
  public InetSocketAddress serverAddress() {
    return new InetSocketAddress(host, port);
  }
}
