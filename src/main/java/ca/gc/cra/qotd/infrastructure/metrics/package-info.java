/**
 * Metrics adapters that bridge the {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code qotd.*} namespace.</p>
 * <p><strong>Security:</strong> Quote text is never exported; only counts and sizes.</p>
 */
package ca.gc.cra.qotd.infrastructure.metrics;
