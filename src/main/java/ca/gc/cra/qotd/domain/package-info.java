/**
 * Core domain model for the quote service.
 * <p><strong>Role:</strong> Domain layer describing quotes, encodings, categories and weighted selection without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code qotd.*} metrics.</p>
 */
package ca.gc.cra.qotd.domain;
