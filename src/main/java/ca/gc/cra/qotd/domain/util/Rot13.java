package ca.gc.cra.qotd.domain.util;

/**
 * <strong>What:</strong> In-place rot13 transform over raw quote bytes.
 * <p><strong>Why:</strong> Rot13-encoded quote files are decoded before delivery.</p>
 * <p><strong>Role:</strong> Domain support function used by the corpus read path.</p>
 * <p><strong>Thread-safety:</strong> Stateless; callers own the arrays they pass.</p>
 * <p><strong>Performance:</strong> Single pass, no allocation.</p>
 *
 * <p>The transform is an involution: applying it twice restores the original bytes. Bytes outside
 * {@code A-Z} and {@code a-z} are left untouched, so multi-byte UTF-8 sequences survive intact.</p>
 *
 * @since 0.1.0
 */
public final class Rot13 {
  private Rot13() {}

  /**
   * Rotates every ASCII letter in {@code bytes} by 13 positions within its case.
   *
   * @param bytes buffer to transform in place; {@code null} is returned unchanged
   * @return the same array, for fluent call sites
   */
  public static byte[] apply(byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = rotate(bytes[i]);
    }
    return bytes;
  }

  /**
   * Rotates a single byte.
   *
   * @param b byte to rotate
   * @return rotated letter, or {@code b} unchanged when it is not an ASCII letter
   */
  public static byte rotate(byte b) {
    if ((b >= 'A' && b <= 'M') || (b >= 'a' && b <= 'm')) {
      return (byte) (b + 13);
    }
    if ((b >= 'N' && b <= 'Z') || (b >= 'n' && b <= 'z')) {
      return (byte) (b - 13);
    }
    return b;
  }
}
