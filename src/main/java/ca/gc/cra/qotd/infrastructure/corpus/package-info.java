/**
 * File-backed quote corpus: indexing of fortune-style files and weighted random retrieval.
 * <p><strong>Role:</strong> Adapter layer behind the {@code QuoteSource} port.</p>
 * <p><strong>Concurrency:</strong> Indexing runs once at startup; reads mutate channel positions and must be
 * serialized by the caller.</p>
 * <p><strong>Metrics:</strong> Counts indexed and skipped files under {@code qotd.corpus.files.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.infrastructure.corpus;
