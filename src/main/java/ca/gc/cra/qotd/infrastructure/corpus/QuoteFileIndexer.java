package ca.gc.cra.qotd.infrastructure.corpus;

import ca.gc.cra.qotd.domain.quote.FileEncoding;
import ca.gc.cra.qotd.domain.quote.QuoteCategory;
import ca.gc.cra.qotd.domain.quote.QuoteSpan;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Scans one fortune-style text file and records the byte span of every quote.
 * <p><strong>Why:</strong> Serving reads a single quote by offset instead of holding whole files in memory.</p>
 * <p><strong>Role:</strong> Adapter used by {@link QuoteCorpus} during startup.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split the file on lines starting with {@code %} and record the spans between them.</li>
 *   <li>Detect the rot13/plain encoding marker; the first marker in file order wins.</li>
 *   <li>Assign the category from the file name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use on different files.</p>
 * <p><strong>Performance:</strong> Single pass over the channel in fixed-size chunks; lines are only decoded
 * until an encoding marker is found.</p>
 *
 * <p>The start of the file counts as a boundary, so text before the first delimiter line is the
 * file's first quote. Text after the last delimiter line is never a quote: a file that lacks a
 * trailing {@code %} line loses its final quote, as existing quote collections expect.</p>
 *
 * @since 0.1.0
 */
public final class QuoteFileIndexer {
  private static final Logger log = LoggerFactory.getLogger(QuoteFileIndexer.class);
  private static final byte DELIMITER = '%';
  private static final int READ_BUFFER_BYTES = 64 * 1024;

  private QuoteFileIndexer() {}

  /**
   * Indexes {@code file} and returns it with its channel left open.
   *
   * <p>The returned file may hold zero spans; filtering such files is the corpus's concern.</p>
   *
   * @param file quote file to index; must not be {@code null}
   * @return indexed file owning an open read channel
   * @throws IOException if the file cannot be opened or read, or a single quote exceeds {@code Integer.MAX_VALUE} bytes
   */
  public static IndexedQuoteFile index(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    QuoteCategory category = QuoteCategory.fromFileName(file);
    FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
    try {
      LineScanner scanner = new LineScanner(file);
      ByteBuffer chunk = ByteBuffer.allocate(READ_BUFFER_BYTES);
      while (channel.read(chunk) != -1) {
        chunk.flip();
        scanner.accept(chunk.array(), chunk.limit());
        chunk.clear();
      }
      scanner.finish();

      log.debug("Indexed {} bytes of {} into {} spans ({}, {})",
          scanner.offset, file, scanner.spans.size(), scanner.encoding, category);
      return new IndexedQuoteFile(file, channel, scanner.spans, scanner.encoding, category);
    } catch (IOException | RuntimeException ex) {
      try {
        channel.close();
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw ex;
    }
  }

  private static int quoteLength(Path file, long length) throws IOException {
    if (length > Integer.MAX_VALUE) {
      throw new IOException("Quote in " + file + " exceeds " + Integer.MAX_VALUE + " bytes");
    }
    return (int) length;
  }

  /** Splits raw bytes into lines, newline included, and records spans at each delimiter line. */
  private static final class LineScanner {
    private final Path file;
    private final List<QuoteSpan> spans = new ArrayList<>();
    private FileEncoding encoding = FileEncoding.PLAIN;
    private boolean encodingFound;
    private long offset;
    private long lineStart;
    private long lastBoundary;
    private boolean delimiterLine;
    // Current line's bytes; only kept until an encoding marker is found.
    private byte[] line = new byte[256];
    private int lineLength;

    LineScanner(Path file) {
      this.file = file;
    }

    void accept(byte[] data, int length) throws IOException {
      for (int i = 0; i < length; i++) {
        byte b = data[i];
        if (offset == lineStart) {
          delimiterLine = b == DELIMITER;
        }
        if (!encodingFound) {
          if (lineLength == line.length) {
            line = Arrays.copyOf(line, line.length * 2);
          }
          line[lineLength++] = b;
        }
        offset++;
        if (b == '\n') {
          endLine();
        }
      }
    }

    void finish() throws IOException {
      if (offset > lineStart) {
        endLine();
      }
    }

    private void endLine() throws IOException {
      if (!encodingFound) {
        Optional<FileEncoding> marker =
            FileEncoding.detect(new String(line, 0, lineLength, StandardCharsets.ISO_8859_1));
        if (marker.isPresent()) {
          encoding = marker.get();
          encodingFound = true;
          log.trace("Detected {} encoding marker in {} at offset {}", encoding, file, lineStart);
        }
        lineLength = 0;
      }
      if (delimiterLine) {
        if (lineStart > lastBoundary) {
          spans.add(new QuoteSpan(lastBoundary, quoteLength(file, lineStart - lastBoundary)));
        }
        lastBoundary = offset;
      }
      lineStart = offset;
    }
  }
}
