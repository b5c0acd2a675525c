package ca.gc.cra.qotd.infrastructure.corpus;

import ca.gc.cra.qotd.domain.quote.FileEncoding;
import ca.gc.cra.qotd.domain.quote.QuoteCategory;
import ca.gc.cra.qotd.domain.quote.QuoteSpan;
import ca.gc.cra.qotd.domain.util.Rot13;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One quote file's in-memory index plus its open backing channel.
 * <p><strong>Why:</strong> Keeps only span offsets in memory; quote bytes are read on demand.</p>
 * <p><strong>Role:</strong> Adapter-side aggregate owned by {@link QuoteCorpus}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. {@link #read(int)} moves the shared channel position,
 * so only one thread may read at a time; the broker worker is that thread while serving.</p>
 * <p><strong>Performance:</strong> One positioned read per quote; the channel stays open for the corpus lifetime.</p>
 *
 * @since 0.1.0
 */
public final class IndexedQuoteFile implements Closeable {
  private final Path path;
  private final FileChannel channel;
  private final List<QuoteSpan> spans;
  private final FileEncoding encoding;
  private final QuoteCategory category;

  IndexedQuoteFile(
      Path path,
      FileChannel channel,
      List<QuoteSpan> spans,
      FileEncoding encoding,
      QuoteCategory category) {
    this.path = Objects.requireNonNull(path, "path");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.spans = List.copyOf(Objects.requireNonNull(spans, "spans"));
    this.encoding = Objects.requireNonNull(encoding, "encoding");
    this.category = Objects.requireNonNull(category, "category");
  }

  /**
   * Reads and decodes the quote at {@code spanIndex}.
   *
   * <p>The channel is repositioned explicitly before every read; its position carries no meaning
   * between reads.</p>
   *
   * @param spanIndex index into {@link #spans()}
   * @return decoded quote bytes of exactly the span's length
   * @throws IOException if seeking or reading fails, including an {@link EOFException} when the file shrank
   * @throws IndexOutOfBoundsException if {@code spanIndex} is out of range
   */
  public byte[] read(int spanIndex) throws IOException {
    QuoteSpan span = spans.get(spanIndex);
    ByteBuffer buffer = ByteBuffer.allocate(span.length());
    channel.position(span.offset());
    while (buffer.hasRemaining()) {
      if (channel.read(buffer) < 0) {
        throw new EOFException("Unexpected end of " + path + " reading " + span);
      }
    }
    byte[] quote = buffer.array();
    if (encoding == FileEncoding.ROT13) {
      Rot13.apply(quote);
    }
    return quote;
  }

  /**
   * Returns the source path.
   *
   * @return path the file was indexed from
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the indexed spans in file order.
   *
   * @return immutable span list
   */
  public List<QuoteSpan> spans() {
    return spans;
  }

  /**
   * Returns the number of quotes in this file.
   *
   * @return span count; doubles as the file's sampling weight
   */
  public int quoteCount() {
    return spans.size();
  }

  /**
   * Returns the detected encoding.
   *
   * @return encoding fixed at index time
   */
  public FileEncoding encoding() {
    return encoding;
  }

  /**
   * Returns the category derived from the file name.
   *
   * @return category fixed at index time
   */
  public QuoteCategory category() {
    return category;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  @Override
  public String toString() {
    return "IndexedQuoteFile{path=" + path
        + ", quotes=" + spans.size()
        + ", encoding=" + encoding
        + ", category=" + category + '}';
  }
}
