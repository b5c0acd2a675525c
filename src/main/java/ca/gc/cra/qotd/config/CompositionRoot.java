package ca.gc.cra.qotd.config;

import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.application.port.QuoteSourceLoader;
import ca.gc.cra.qotd.application.serve.ServeUseCase;
import ca.gc.cra.qotd.infrastructure.corpus.QuoteCorpus;
import ca.gc.cra.qotd.infrastructure.net.QuoteServer;
import java.io.IOException;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * <strong>What:</strong> Wires the serve use case to the file corpus and the socket server.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI only translates arguments.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances on each call.</p>
 *
 * @since 0.1.0
 * @see ServeUseCase
 */
public final class CompositionRoot {
  private final ServeConfig config;
  private final MetricsPort metrics;
  private final Supplier<RandomGenerator> randomSource;

  /**
   * Creates a composition root whose corpora draw from an unseeded random source.
   *
   * @param config serve settings; must not be {@code null}
   * @param metrics metrics sink shared by all components; must not be {@code null}
   */
  public CompositionRoot(ServeConfig config, MetricsPort metrics) {
    this(config, metrics, SplittableRandom::new);
  }

  /**
   * Creates a composition root with an explicit random source, e.g. a seeded one for tests.
   *
   * @param config serve settings
   * @param metrics metrics sink
   * @param randomSource supplies one generator per corpus
   */
  public CompositionRoot(ServeConfig config, MetricsPort metrics, Supplier<RandomGenerator> randomSource) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
  }

  /**
   * Indexes the configured corpus directory.
   *
   * @return open corpus owned by the caller
   * @throws IOException if indexing fails or no eligible quote file exists
   */
  public QuoteCorpus loadCorpus() throws IOException {
    return QuoteCorpus.build(
        config.corpusDir(), config.categories().categories(), randomSource.get(), metrics);
  }

  /**
   * Returns a loader that indexes the corpus on demand.
   *
   * @return corpus loader
   */
  public QuoteSourceLoader corpusLoader() {
    return this::loadCorpus;
  }

  /**
   * Creates an unbound server.
   *
   * @return new server
   */
  public QuoteServer quoteServer() {
    return new QuoteServer(config.brokerQueueCapacity(), metrics);
  }

  /**
   * Creates the serve use case for the configured address.
   *
   * @return new use case
   */
  public ServeUseCase serveUseCase() {
    return new ServeUseCase(corpusLoader(), quoteServer(), config.bindAddress());
  }
}
