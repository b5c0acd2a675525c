package ca.gc.cra.qotd.application.port;

import java.io.Closeable;
import java.io.IOException;

/**
 * <strong>What:</strong> Domain port that produces one randomly selected quote per call.
 * <p><strong>Why:</strong> Decouples the broker's serialization loop from the file-backed corpus so the loop can
 * be exercised with in-memory or failing sources.</p>
 * <p><strong>Role:</strong> Implemented by {@code QuoteCorpus}; consumed exclusively by {@code QuoteBroker}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are <em>not</em> required to be thread-safe. Callers must
 * serialize access; the broker guarantees a single calling thread.</p>
 * <p><strong>Performance:</strong> May block on file I/O.</p>
 *
 * @since 0.1.0
 */
public interface QuoteSource extends Closeable {
  /**
   * Selects and reads one quote.
   *
   * @return decoded quote bytes; never {@code null} or empty
   * @throws IOException if the underlying store cannot be read
   */
  byte[] randomQuote() throws IOException;

  /**
   * Releases resources held by the source. The broker never calls this; the component that opened the
   * source closes it once serving ends.
   *
   * @throws IOException if a resource fails to close
   */
  @Override
  default void close() throws IOException {}
}
