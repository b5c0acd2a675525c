package ca.gc.cra.qotd.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the corpus directory and the optional log file.
 * <p><strong>Why:</strong> Turns a missing corpus directory into an argument error before any file is opened.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; results are only as stable as the filesystem.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path string.
   *
   * @param name logical parameter name for diagnostics
   * @param raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, contains control characters, or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(text).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + text, ex);
    }
  }

  /**
   * Validates that {@code path} is an existing readable directory. Symbolic links at the root are followed.
   *
   * @param path candidate directory; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the directory is missing, not a directory, or unreadable
   */
  public static Path validateReadableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("directory does not exist: " + normalized);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("directory is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file can be created or appended at {@code path}.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory or its parent is missing or read-only
   */
  public static Path validateWritableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    if (Files.exists(normalized)) {
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("file is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent directory does not exist for " + normalized);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }
}
