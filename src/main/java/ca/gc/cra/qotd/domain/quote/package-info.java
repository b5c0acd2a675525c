/**
 * Quote value types: spans, per-file encodings and categories.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.domain.quote;
