package ca.gc.cra.qotd.domain.quote;

/**
 * <strong>What:</strong> Byte range locating one quote inside the file it was indexed from.
 * <p><strong>Why:</strong> Lets the corpus keep only offsets in memory and read quote bytes on demand.</p>
 * <p><strong>Role:</strong> Domain value object owned by exactly one indexed file.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Performance:</strong> Two primitive fields; spans are stored in compact lists per file.</p>
 * <p><strong>Observability:</strong> Lengths feed the {@code qotd.quote.bytes} histogram.</p>
 *
 * @param offset byte offset of the first quote byte; never negative
 * @param length number of quote bytes; always positive and never covering a delimiter line
 * @since 0.1.0
 */
public record QuoteSpan(long offset, int length) {

  /**
   * Validates span bounds.
   *
   * @throws IllegalArgumentException if {@code offset} is negative or {@code length} is not positive
   */
  public QuoteSpan {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative (was " + offset + ")");
    }
    if (length <= 0) {
      throw new IllegalArgumentException("length must be positive (was " + length + ")");
    }
  }

  /**
   * Returns the offset immediately after the last quote byte.
   *
   * @return exclusive end offset
   */
  public long end() {
    return offset + length;
  }
}
