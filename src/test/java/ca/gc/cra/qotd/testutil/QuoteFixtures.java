package ca.gc.cra.qotd.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builders for fortune-style quote files used across tests.
 */
public final class QuoteFixtures {
  private QuoteFixtures() {}

  /**
   * Renders quotes in the delimited format: a leading {@code %} line, then each quote followed by
   * a {@code %} line.
   */
  public static String delimited(String... quotes) {
    StringBuilder text = new StringBuilder("%\n");
    for (String quote : quotes) {
      text.append(quote).append("%\n");
    }
    return text.toString();
  }

  public static Path writeQuotes(Path dir, String name, String... quotes) throws IOException {
    return write(dir.resolve(name), delimited(quotes));
  }

  public static Path write(Path file, String content) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content, StandardCharsets.UTF_8);
  }

  /** Returns {@code count} distinct single-line quotes prefixed with {@code tag}. */
  public static String[] numbered(String tag, int count) {
    String[] quotes = new String[count];
    for (int i = 0; i < count; i++) {
      quotes[i] = tag + " " + i + "\n";
    }
    return quotes;
  }

  public static String utf8(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
