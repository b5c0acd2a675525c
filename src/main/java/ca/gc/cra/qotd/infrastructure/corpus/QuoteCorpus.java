package ca.gc.cra.qotd.infrastructure.corpus;

import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.domain.quote.QuoteCategory;
import ca.gc.cra.qotd.domain.sampling.WeightedIndexSampler;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The indexed, category-filtered set of quote files available for selection.
 * <p><strong>Why:</strong> Gives every quote the same chance of being served regardless of how quotes are
 * spread across files.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link QuoteSource}; owned by the broker while serving.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk a directory tree and index every regular file.</li>
 *   <li>Drop files outside the allowed categories or holding no quotes.</li>
 *   <li>Pick a file weighted by its quote count, then a quote uniformly within it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Reads move shared channel positions; callers serialize
 * access (see {@code QuoteBroker}).</p>
 * <p><strong>Performance:</strong> Selection is O(1) per quote; each quote costs one positioned read.</p>
 * <p><strong>Observability:</strong> Logs each indexed or skipped file at INFO and counts them under
 * {@code qotd.corpus.files.*}.</p>
 *
 * @since 0.1.0
 */
public final class QuoteCorpus implements QuoteSource {
  private static final Logger log = LoggerFactory.getLogger(QuoteCorpus.class);

  private final Path root;
  private final List<IndexedQuoteFile> files;
  private final WeightedIndexSampler sampler;
  private final RandomGenerator random;

  private QuoteCorpus(
      Path root, List<IndexedQuoteFile> files, WeightedIndexSampler sampler, RandomGenerator random) {
    this.root = root;
    this.files = List.copyOf(files);
    this.sampler = sampler;
    this.random = random;
  }

  /**
   * Builds a corpus with an unseeded random source and no metrics.
   *
   * @param root directory to scan recursively
   * @param allowed categories to keep; must not be {@code null}
   * @return corpus holding at least one quote
   * @throws EmptyCorpusException if no eligible file remains after filtering
   * @throws IOException if traversal or any file fails to index
   */
  public static QuoteCorpus build(Path root, Set<QuoteCategory> allowed) throws IOException {
    return build(root, allowed, new SplittableRandom(), MetricsPort.NO_OP);
  }

  /**
   * Builds a corpus with the supplied random source.
   *
   * @param root directory to scan recursively
   * @param allowed categories to keep
   * @param random selection source; a seeded generator makes selection reproducible
   * @return corpus holding at least one quote
   * @throws IOException if traversal or indexing fails, or no eligible file remains
   */
  public static QuoteCorpus build(Path root, Set<QuoteCategory> allowed, RandomGenerator random)
      throws IOException {
    return build(root, allowed, random, MetricsPort.NO_OP);
  }

  /**
   * Builds a corpus by indexing every regular file beneath {@code root}.
   *
   * <p>Directories are visited depth-first in unspecified order. Symbolic links are neither followed
   * nor indexed. Any I/O failure aborts the whole build and releases every channel opened so far; an
   * unreadable file is fatal, never skipped.</p>
   *
   * @param root directory to scan recursively; must not be {@code null}
   * @param allowed categories to keep; must not be {@code null}
   * @param random selection source; must not be {@code null}
   * @param metrics metrics sink for indexed/skipped counts; must not be {@code null}
   * @return corpus holding at least one quote
   * @throws EmptyCorpusException if no eligible file remains after filtering
   * @throws IOException if traversal or any file fails to index
   */
  public static QuoteCorpus build(
      Path root, Set<QuoteCategory> allowed, RandomGenerator random, MetricsPort metrics)
      throws IOException {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(random, "random");
    Objects.requireNonNull(metrics, "metrics");
    Set<QuoteCategory> categories = allowed.isEmpty()
        ? EnumSet.noneOf(QuoteCategory.class)
        : EnumSet.copyOf(allowed);

    List<IndexedQuoteFile> eligible = new ArrayList<>();
    try {
      visit(root, categories, eligible, metrics);
      if (eligible.isEmpty()) {
        throw new EmptyCorpusException(root,
            "No quote files under " + root + " match categories " + categories);
      }
      int[] weights = eligible.stream().mapToInt(IndexedQuoteFile::quoteCount).toArray();
      WeightedIndexSampler sampler = WeightedIndexSampler.of(weights);
      log.info("Corpus {} ready with {} files and {} quotes", root, eligible.size(), sampler.totalWeight());
      return new QuoteCorpus(root, eligible, sampler, random);
    } catch (IOException | RuntimeException ex) {
      closeAll(eligible, ex);
      throw ex;
    }
  }

  private static void visit(
      Path dir, Set<QuoteCategory> allowed, List<IndexedQuoteFile> eligible, MetricsPort metrics)
      throws IOException {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      for (Path entry : entries) {
        BasicFileAttributes attrs =
            Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isDirectory()) {
          visit(entry, allowed, eligible, metrics);
        } else if (attrs.isRegularFile()) {
          admit(QuoteFileIndexer.index(entry), allowed, eligible, metrics);
        }
      }
    }
  }

  private static void admit(
      IndexedQuoteFile file,
      Set<QuoteCategory> allowed,
      List<IndexedQuoteFile> eligible,
      MetricsPort metrics) throws IOException {
    if (!allowed.contains(file.category())) {
      log.info("File \"{}\" is not in allowed categories ({})", file.path(), file.category());
      metrics.increment("qotd.corpus.files.skipped");
      file.close();
      return;
    }
    if (file.quoteCount() == 0) {
      log.info("File \"{}\" contains no delimited quotes", file.path());
      metrics.increment("qotd.corpus.files.skipped");
      file.close();
      return;
    }
    log.info("Indexed file \"{}\" containing {} entries", file.path(), file.quoteCount());
    metrics.increment("qotd.corpus.files.indexed");
    eligible.add(file);
  }

  private static void closeAll(List<IndexedQuoteFile> files, Exception primary) {
    for (IndexedQuoteFile file : files) {
      try {
        file.close();
      } catch (IOException closeFailure) {
        primary.addSuppressed(closeFailure);
      }
    }
  }

  /**
   * Selects a quote so that every quote in the corpus is equally likely.
   *
   * @return decoded quote bytes
   * @throws IOException if the chosen file cannot be read
   */
  @Override
  public byte[] randomQuote() throws IOException {
    int fileIndex = sampler.sample(random);
    int spanIndex = random.nextInt(files.get(fileIndex).quoteCount());
    return readQuote(fileIndex, spanIndex);
  }

  /**
   * Reads one specific quote.
   *
   * @param fileIndex index into {@link #files()}
   * @param spanIndex index into that file's spans
   * @return decoded quote bytes
   * @throws IOException if seeking or reading fails
   * @throws IndexOutOfBoundsException if either index is out of range
   */
  public byte[] readQuote(int fileIndex, int spanIndex) throws IOException {
    return files.get(fileIndex).read(spanIndex);
  }

  /**
   * Returns the eligible files in selection order.
   *
   * @return immutable file list
   */
  public List<IndexedQuoteFile> files() {
    return files;
  }

  /**
   * Returns the total number of selectable quotes.
   *
   * @return quote count across all files
   */
  public long quoteCount() {
    return sampler.totalWeight();
  }

  /**
   * Returns the scanned root directory.
   *
   * @return corpus root
   */
  public Path root() {
    return root;
  }

  /**
   * Closes every retained file channel.
   *
   * @throws IOException if any channel fails to close; later failures are suppressed onto the first
   */
  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (IndexedQuoteFile file : files) {
      try {
        file.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
