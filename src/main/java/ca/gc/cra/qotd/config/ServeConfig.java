package ca.gc.cra.qotd.config;

import ca.gc.cra.qotd.application.broker.QuoteBroker;
import ca.gc.cra.qotd.domain.quote.AllowedCategories;
import ca.gc.cra.qotd.validation.Net;
import ca.gc.cra.qotd.validation.Numbers;
import ca.gc.cra.qotd.validation.Paths;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for the {@code serve} command.
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param corpusDir root of the quote file tree
 * @param host bind host name or address literal
 * @param port bind port; {@code 0} selects an ephemeral port
 * @param categories categories the corpus may serve
 * @param brokerQueueCapacity number of client requests that may wait for the broker
 * @param logFile optional file receiving a copy of all log output
 * @since 0.1.0
 */
public record ServeConfig(
    Path corpusDir,
    String host,
    int port,
    AllowedCategories categories,
    int brokerQueueCapacity,
    Optional<Path> logFile) {

  /** Well-known QOTD port. */
  public static final int DEFAULT_PORT = 17;
  /** Loopback bind address. */
  public static final String DEFAULT_HOST = "127.0.0.1";
  /** Corpus directory, relative to the working directory. */
  public static final String DEFAULT_CORPUS_DIR = "data";
  /** Upper bound on {@code brokerQueueCapacity}. */
  public static final int MAX_BROKER_QUEUE_CAPACITY = 65_536;

  public ServeConfig {
    Objects.requireNonNull(corpusDir, "corpusDir");
    host = Net.validateHost(host);
    Numbers.requireRange("port", port, Net.MIN_PORT, Net.MAX_PORT);
    Objects.requireNonNull(categories, "categories");
    Numbers.requireRange("brokerQueueCapacity", brokerQueueCapacity, 1, MAX_BROKER_QUEUE_CAPACITY);
    logFile = Objects.requireNonNullElse(logFile, Optional.empty());
  }

  /**
   * Returns the built-in defaults.
   *
   * @return config serving decorous quotes from {@code ./data} on {@code 127.0.0.1:17}
   */
  public static ServeConfig defaults() {
    return new ServeConfig(
        Path.of(DEFAULT_CORPUS_DIR).toAbsolutePath().normalize(),
        DEFAULT_HOST,
        DEFAULT_PORT,
        AllowedCategories.DECOROUS,
        QuoteBroker.DEFAULT_QUEUE_CAPACITY,
        Optional.empty());
  }

  /**
   * Builds a config from a flat key/value map such as {@link ConfigMerger} produces.
   *
   * <p>Recognized keys: {@code dir}, {@code host}, {@code port}, {@code categories}, {@code all},
   * {@code offensive}, {@code brokerQueueCapacity}, {@code logFile}. Missing keys take the defaults.
   * {@code categories} wins over {@code all}, which wins over {@code offensive}.</p>
   *
   * @param map flat settings; must not be {@code null}
   * @return validated config
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static ServeConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    ServeConfig defaults = defaults();
    Path dir = present(map, "dir").map(value -> Paths.parse("dir", value)).orElse(defaults.corpusDir());
    String host = present(map, "host").orElse(defaults.host());
    int port = present(map, "port").map(Net::parsePort).orElse(defaults.port());
    AllowedCategories categories = AllowedCategories.resolve(
        map.get("categories"), flag(map, "all"), flag(map, "offensive"));
    int capacity = present(map, "brokerQueueCapacity")
        .map(value -> Numbers.parseIntInRange("brokerQueueCapacity", value, 1, MAX_BROKER_QUEUE_CAPACITY))
        .orElse(defaults.brokerQueueCapacity());
    Optional<Path> logFile = present(map, "logFile").map(value -> Paths.parse("logFile", value));
    return new ServeConfig(dir, host, port, categories, capacity, logFile);
  }

  /**
   * Returns the socket address to bind, resolving {@link #host()}.
   *
   * @return bind address; unresolved when the host name cannot be resolved
   */
  public InetSocketAddress bindAddress() {
    return new InetSocketAddress(host, port);
  }

  static Optional<String> present(Map<String, String> map, String key) {
    String value = map.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  static boolean flag(Map<String, String> map, String key) {
    return present(map, key).map(Boolean::parseBoolean).orElse(false);
  }
}
