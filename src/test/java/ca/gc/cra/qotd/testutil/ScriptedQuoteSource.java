package ca.gc.cra.qotd.testutil;

import ca.gc.cra.qotd.application.port.QuoteSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Quote source returning scripted quotes in order. Once the script is exhausted it either cycles the
 * last quote or fails, depending on how it was built.
 */
public final class ScriptedQuoteSource implements QuoteSource {
  private final Deque<byte[]> script = new ArrayDeque<>();
  private final AtomicInteger reads = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final int failAfter;
  private byte[] last;

  private ScriptedQuoteSource(int failAfter, String... quotes) {
    this.failAfter = failAfter;
    for (String quote : quotes) {
      script.add(quote.getBytes(StandardCharsets.UTF_8));
    }
  }

  /** Source that repeats its last quote forever once the script runs out. */
  public static ScriptedQuoteSource repeating(String... quotes) {
    return new ScriptedQuoteSource(-1, quotes);
  }

  /** Source whose read number {@code failAfter} (zero-based) and every later read throw. */
  public static ScriptedQuoteSource failingAfter(int failAfter, String... quotes) {
    return new ScriptedQuoteSource(failAfter, quotes);
  }

  @Override
  public synchronized byte[] randomQuote() throws IOException {
    int read = reads.getAndIncrement();
    if (failAfter >= 0 && read >= failAfter) {
      throw new IOException("scripted read failure at read " + read);
    }
    byte[] next = script.poll();
    if (next != null) {
      last = next;
    }
    if (last == null) {
      throw new IOException("no scripted quotes");
    }
    return last.clone();
  }

  public int reads() {
    return reads.get();
  }

  public boolean closed() {
    return closed.get();
  }

  @Override
  public void close() {
    closed.set(true);
  }
}
