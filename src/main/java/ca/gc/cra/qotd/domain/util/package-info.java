/**
 * Byte-level helpers shared by the corpus read path.
 * <p><strong>Concurrency:</strong> Stateless static helpers; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.domain.util;
