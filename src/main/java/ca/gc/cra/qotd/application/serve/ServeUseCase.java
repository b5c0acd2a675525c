package ca.gc.cra.qotd.application.serve;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.port.QuoteEndpoint;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.application.port.QuoteSourceLoader;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Startup and serving sequence of the quote service.
 * <p><strong>Why:</strong> Fixes the order that makes startup failures cheap: the corpus is indexed before any
 * socket is bound, so a bad corpus never leaves a half-started listener.</p>
 * <p><strong>Role:</strong> Application use case driven by {@code ServeCli}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the quote source; abort on failure.</li>
 *   <li>Bind the endpoint; abort on failure.</li>
 *   <li>Serve until the endpoint is closed or the broker fails, then release the source.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single use; {@link #run()} blocks the calling thread.</p>
 *
 * @since 0.1.0
 */
public final class ServeUseCase {
  private static final Logger log = LoggerFactory.getLogger(ServeUseCase.class);

  private final QuoteSourceLoader sourceLoader;
  private final QuoteEndpoint endpoint;
  private final InetSocketAddress address;

  /**
   * Creates the use case.
   *
   * @param sourceLoader builds the quote source; must not be {@code null}
   * @param endpoint endpoint to bind and serve; must not be {@code null}
   * @param address bind address; must not be {@code null}
   */
  public ServeUseCase(QuoteSourceLoader sourceLoader, QuoteEndpoint endpoint, InetSocketAddress address) {
    this.sourceLoader = Objects.requireNonNull(sourceLoader, "sourceLoader");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.address = Objects.requireNonNull(address, "address");
  }

  /**
   * Indexes, binds and serves.
   *
   * @throws IOException if the source cannot be built or the endpoint cannot bind
   * @throws BrokerUnavailableException if serving stopped because the source failed
   * @throws InterruptedException if the calling thread is interrupted while serving
   */
  public void run() throws IOException, BrokerUnavailableException, InterruptedException {
    try (QuoteSource source = sourceLoader.open()) {
      try {
        endpoint.bind(address);
      } catch (IOException ex) {
        endpoint.close();
        throw ex;
      }
      InetSocketAddress bound = endpoint.localAddress();
      log.info("Now listening on TCP/UDP {}:{}", bound.getHostString(), bound.getPort());
      try {
        endpoint.serve(source);
      } finally {
        endpoint.close();
      }
    }
  }

  /**
   * Requests shutdown of a running {@link #run()} from another thread.
   */
  public void stop() {
    endpoint.close();
  }
}
