/**
 * <strong>Purpose:</strong> Domain ports defining the contracts between the broker, the corpus and observability.
 * <p><strong>Role:</strong> Domain layer; adapters implement these interfaces to integrate external systems.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.application.port;
