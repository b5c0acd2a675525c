package ca.gc.cra.qotd.domain.quote;

import java.nio.file.Path;

/**
 * <strong>What:</strong> Coarse content classifier derived from the quote file's name.
 * <p><strong>Why:</strong> Operators choose whether offensive collections are served at all.</p>
 * <p><strong>Role:</strong> Domain enum assigned once at index time and consulted when the corpus is filtered.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum QuoteCategory {
  /** Generally acceptable quotes; the default selection. */
  DECOROUS,
  /** Quotes from files whose name ends with {@link #OFFENSIVE_SUFFIX}. */
  OFFENSIVE;

  /** File name suffix marking an offensive collection. */
  public static final String OFFENSIVE_SUFFIX = "-o";

  /**
   * Classifies a quote file by its name, ignoring any parent directories.
   *
   * @param file quote file path; must not be {@code null}
   * @return {@link #OFFENSIVE} when the last path element ends with {@code -o}, otherwise {@link #DECOROUS}
   */
  public static QuoteCategory fromFileName(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return DECOROUS;
    }
    return name.toString().endsWith(OFFENSIVE_SUFFIX) ? OFFENSIVE : DECOROUS;
  }
}
