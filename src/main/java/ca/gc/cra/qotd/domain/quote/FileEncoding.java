package ca.gc.cra.qotd.domain.quote;

import java.util.Optional;

/**
 * <strong>What:</strong> Per-file transform applied to quote bytes before delivery.
 * <p><strong>Why:</strong> Traditional fortune files ship offensive collections rot13-encoded; the marker
 * tokens embedded in their headers tell the indexer which transform applies.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum FileEncoding {
  /** Quote bytes are served as stored. */
  PLAIN,
  /** Alphabetic ASCII bytes are rotated by 13 before serving. */
  ROT13;

  /** Marker token announcing rot13-encoded content. */
  public static final String ROT13_MARKER = "$SerrOFQ$";
  /** Marker token announcing plain content. */
  public static final String PLAIN_MARKER = "$FreeBSD$";

  /**
   * Detects an encoding marker within a single line.
   *
   * <p>When a line carries both markers the rot13 marker wins, matching the order in which the
   * indexer checks them.</p>
   *
   * @param line line text; {@code null} yields empty
   * @return the encoding announced by the line, or empty when it carries no marker
   */
  public static Optional<FileEncoding> detect(String line) {
    if (line == null) {
      return Optional.empty();
    }
    if (line.contains(ROT13_MARKER)) {
      return Optional.of(ROT13);
    }
    if (line.contains(PLAIN_MARKER)) {
      return Optional.of(PLAIN);
    }
    return Optional.empty();
  }
}
