/**
 * Command-line entry points for the QOTD server and client.
 * <p><strong>Role:</strong> Adapter layer translating arguments, YAML and defaults into validated
 * configuration, then invoking the use case and mapping failures to {@link ca.gc.cra.qotd.api.ExitCode}s.</p>
 * <p><strong>Output:</strong> Program output goes through {@link ca.gc.cra.qotd.api.CliPrinter}; diagnostics go
 * to SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.api;
