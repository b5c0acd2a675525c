package ca.gc.cra.qotd.logging;

import ch.qos.logback.classic.Level;

/**
 * Console verbosity selected on the command line.
 *
 * @since 0.1.0
 */
public enum Verbosity {
  /** {@code --quiet}: errors only. */
  QUIET(Level.ERROR),
  /** No flag: warnings and errors. */
  NORMAL(Level.WARN),
  /** {@code -v}: adds file indexing and per-client events. */
  INFO(Level.INFO),
  /** {@code -vv}: adds broker and quote-size detail. */
  DEBUG(Level.DEBUG),
  /** {@code -vvv}: everything. */
  TRACE(Level.TRACE);

  private final Level level;

  Verbosity(Level level) {
    this.level = level;
  }

  /**
   * Maps CLI flags to a verbosity. {@code --quiet} wins over any number of {@code -v}.
   *
   * @param quiet whether {@code --quiet} was given
   * @param verboseCount number of {@code -v} repetitions (0 when absent)
   * @return selected verbosity
   */
  public static Verbosity from(boolean quiet, int verboseCount) {
    if (quiet) {
      return QUIET;
    }
    return switch (Math.max(0, verboseCount)) {
      case 0 -> NORMAL;
      case 1 -> INFO;
      case 2 -> DEBUG;
      default -> TRACE;
    };
  }

  Level level() {
    return level;
  }
}
