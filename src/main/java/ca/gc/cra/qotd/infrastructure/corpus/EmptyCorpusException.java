package ca.gc.cra.qotd.infrastructure.corpus;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals that a corpus directory produced no file eligible for selection.
 *
 * <p>Raised when every file was filtered out by category, held no quotes, or the tree held no regular
 * files at all. Startup must abort; there is no valid weight distribution to sample from.</p>
 *
 * @since 0.1.0
 */
public final class EmptyCorpusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient Path root;

  /**
   * Creates the exception for a corpus root.
   *
   * @param root directory that was scanned
   * @param message detail message
   */
  public EmptyCorpusException(Path root, String message) {
    super(message);
    this.root = root;
  }

  /**
   * Returns the directory that was scanned.
   *
   * @return corpus root
   */
  public Path root() {
    return root;
  }
}
