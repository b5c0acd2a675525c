package ca.gc.cra.qotd.application.port;

import java.io.IOException;

/**
 * Opens the quote source used for one serving session.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface QuoteSourceLoader {
  /**
   * Builds a ready-to-use source.
   *
   * @return open source owned by the caller
   * @throws IOException if the source cannot be built; startup must abort
   */
  QuoteSource open() throws IOException;
}
