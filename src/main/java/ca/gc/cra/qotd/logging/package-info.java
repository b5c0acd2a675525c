/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity, mirror logs to a file and shorten quote
 * previews before emission.
 * <p><strong>Concurrency:</strong> Configuration runs once on the CLI thread; preview helpers are stateless.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.logging;
