package ca.gc.cra.qotd.application.port;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * <strong>What:</strong> Network endpoint answering quote requests from remote clients.
 * <p><strong>Role:</strong> Port implemented by {@code QuoteServer}; driven by {@code ServeUseCase}.</p>
 * <p><strong>Thread-safety:</strong> {@link #close()} may be called from any thread to stop a blocked
 * {@link #serve(QuoteSource)}; the remaining methods are called by the owning thread.</p>
 *
 * @since 0.1.0
 */
public interface QuoteEndpoint extends Closeable {
  /**
   * Binds every listener to {@code address}.
   *
   * @param address bind address; port {@code 0} selects an ephemeral port
   * @throws IOException if any listener fails to bind
   */
  void bind(InetSocketAddress address) throws IOException;

  /**
   * Returns the resolved bound address.
   *
   * @return local address shared by all listeners
   * @throws IllegalStateException if the endpoint is not bound
   */
  InetSocketAddress localAddress();

  /**
   * Answers clients with quotes from {@code source} until closed or the source fails.
   *
   * @param source quote source; used only by the broker worker thread
   * @throws BrokerUnavailableException if the broker stopped because the source failed
   * @throws InterruptedException if the calling thread is interrupted while serving
   */
  void serve(QuoteSource source) throws BrokerUnavailableException, InterruptedException;

  /** Stops serving and releases sockets. Idempotent. */
  @Override
  void close();
}
