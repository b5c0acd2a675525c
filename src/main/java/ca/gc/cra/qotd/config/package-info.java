/**
 * <strong>Purpose:</strong> Configuration loading, merging and wiring for the {@code serve} and {@code client}
 * commands.
 * <p><strong>Precedence:</strong> CLI arguments override YAML, which overrides built-in defaults.</p>
 * <p><strong>Concurrency:</strong> Config records are immutable; loaders run once during startup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.config;
