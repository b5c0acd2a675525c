package ca.gc.cra.qotd.api;

import ca.gc.cra.qotd.config.ClientConfig;
import ca.gc.cra.qotd.config.DefaultsForMode;
import ca.gc.cra.qotd.infrastructure.net.QuoteClient;
import ca.gc.cra.qotd.logging.LoggingConfigurator;
import ca.gc.cra.qotd.logging.Verbosity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code client} command: fetch one quote from a QOTD server and print it.
 *
 * @since 0.1.0
 */
public final class ClientCli {
  private static final Logger log = LoggerFactory.getLogger(ClientCli.class);
  private static final String SUMMARY_USAGE =
      "usage: qotd client host=HOST [port=N] [--tcp] [timeoutMillis=N] [config=PATH] [--quiet] [-v]";
  private static final String HELP_TEXT = """
      QOTD client

      Usage:
        qotd client host=HOST [options]

      Required:
        host=HOST          Server host name or address

      Optional:
        port=N             Server port (default 17)
        --tcp              Use TCP instead of UDP
        timeoutMillis=N    Connect and receive timeout (default 5000)
        config=PATH        YAML file with common: and client: sections
        --quiet            Log errors only
        -v, -vv, -vvv      Log at INFO, DEBUG or TRACE
        --help             Show this message
      """;

  private ClientCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Fetches and prints one quote.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    LoggingConfigurator.applyVerbosity(Verbosity.from(input.quiet(), input.verbosity()));

    ClientConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.putFlag(input, "--tcp", kv, "tcp");
      config = ClientConfig.fromMap(ConfigCliUtils.effectiveConfig(DefaultsForMode.CLIENT, kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid client arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    QuoteClient client = new QuoteClient(config.timeout());
    String transport = config.tcp() ? "tcp" : "udp";
    try {
      byte[] quote = config.tcp()
          ? client.fetchTcp(config.serverAddress())
          : client.fetchUdp(config.serverAddress());
      log.debug("Received {} bytes over {} from {}:{}", quote.length, transport, config.host(), config.port());
      CliPrinter.println(new String(quote, StandardCharsets.UTF_8).stripTrailing());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to fetch quote over {} from {}:{}: {}",
          transport, config.host(), config.port(), ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in QOTD client", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
