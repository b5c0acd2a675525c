package ca.gc.cra.qotd.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the {@code qotd} commands.
 * <p><strong>Why:</strong> Gives operators and service managers stable process status semantics.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** I/O failure, including an unreadable corpus or a failed bind. */
  IO_ERROR(3),
  /** Configuration was unusable, including a corpus with no eligible quotes. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including the broker stopping while serving. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
