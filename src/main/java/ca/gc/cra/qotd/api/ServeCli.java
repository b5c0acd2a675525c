package ca.gc.cra.qotd.api;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.application.serve.ServeUseCase;
import ca.gc.cra.qotd.config.CompositionRoot;
import ca.gc.cra.qotd.config.DefaultsForMode;
import ca.gc.cra.qotd.config.ServeConfig;
import ca.gc.cra.qotd.infrastructure.corpus.EmptyCorpusException;
import ca.gc.cra.qotd.infrastructure.corpus.IndexedQuoteFile;
import ca.gc.cra.qotd.infrastructure.corpus.QuoteCorpus;
import ca.gc.cra.qotd.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.qotd.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.qotd.logging.LoggingConfigurator;
import ca.gc.cra.qotd.logging.Verbosity;
import ca.gc.cra.qotd.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code serve} command: index a quote corpus and answer QOTD requests over TCP and UDP.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final long SHUTDOWN_GRACE_MILLIS = 5_000L;
  private static final String SUMMARY_USAGE =
      "usage: qotd serve [dir=PATH] [host=HOST] [port=N] [categories=decorous|offensive|all] "
          + "[--all] [--offensive] [brokerQueueCapacity=N] [logFile=PATH] [config=PATH] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] "
          + "[--dry-run] [--quiet] [-v|-vv|-vvv]";
  private static final String HELP_TEXT = """
      QOTD server (RFC 865)

      Usage:
        qotd serve [options]

      Options:
        dir=PATH                   Quote file tree to index (default ./data)
        host=HOST                  Bind address (default 127.0.0.1)
        port=N                     TCP and UDP port, 0-65535 (default 17; 0 picks a free port)
        categories=SELECTOR        decorous, offensive or all (default decorous)
        --all                      Serve every category
        --offensive                Serve offensive quotes only
        brokerQueueCapacity=N      Pending requests allowed before clients wait (default 32)
        logFile=PATH               Append all log output to PATH as well as the console
        config=PATH                YAML file with common: and serve: sections
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Index the corpus, print a summary and exit without binding
        --quiet                    Log errors only
        -v, -vv, -vvv              Log at INFO, DEBUG or TRACE
        --help                     Show this message

      Notes:
        Files whose name ends in -o are offensive. categories= wins over --all, which wins over --offensive.
        Ports below 1024 usually need elevated privileges.
      """;

  private ServeCli() {}

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
   * Executes the serve command and returns its exit code without terminating the JVM.
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

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.putFlag(input, "--all", kv, "all");
    ConfigCliUtils.putFlag(input, "--offensive", kv, "offensive");

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.SERVE, kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");

    ServeConfig config;
    TelemetrySettings telemetry;
    try {
      config = ServeConfig.fromMap(effective);
      Paths.validateReadableDir(config.corpusDir());
      config.logFile().ifPresent(Paths::validateWritableFile);
      telemetry = dryRun ? TelemetrySettings.disabled() : TelemetryConfigurator.settingsFrom(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    config.logFile().ifPresent(LoggingConfigurator::attachFileAppender);

    if (dryRun) {
      return dryRun(config);
    }
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      return serve(config, metrics);
    }
  }

  private static ExitCode dryRun(ServeConfig config) {
    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP);
    try (QuoteCorpus corpus = root.loadCorpus()) {
      printDryRunPlan(config, corpus);
      return ExitCode.SUCCESS;
    } catch (EmptyCorpusException ex) {
      log.error("No quotes to serve: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to index corpus {}", config.corpusDir(), ex);
      return ExitCode.IO_ERROR;
    }
  }

  private static ExitCode serve(ServeConfig config, MetricsPort metrics) {
    ServeUseCase useCase = new CompositionRoot(config, metrics).serveUseCase();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; closing listeners");
      useCase.stop();
      awaitQuietly(finished);
    }, "qotd-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      log.info("Configured QOTD server: dir={}, bind={}:{}, categories={}",
          config.corpusDir(), config.host(), config.port(), config.categories());
      useCase.run();
      log.info("QOTD server stopped");
      return ExitCode.SUCCESS;
    } catch (EmptyCorpusException ex) {
      log.error("No quotes to serve: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("QOTD server I/O failure on {}:{}", config.host(), config.port(), ex);
      return ExitCode.IO_ERROR;
    } catch (BrokerUnavailableException ex) {
      log.error("Quote broker stopped; server shut down", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("QOTD server interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in QOTD server", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void printDryRunPlan(ServeConfig config, QuoteCorpus corpus) {
    CliPrinter.printLines(
        "QOTD serve dry-run",
        "  Corpus: " + corpus.root(),
        "  Categories: " + config.categories().name().toLowerCase(Locale.ROOT),
        "  Files: " + corpus.files().size(),
        "  Quotes: " + corpus.quoteCount(),
        "  Bind: " + config.host() + ":" + config.port() + " (tcp, udp)",
        "  Broker queue capacity: " + config.brokerQueueCapacity());
    for (IndexedQuoteFile file : corpus.files()) {
      CliPrinter.println("    " + file.path() + " quotes=" + file.quoteCount()
          + " encoding=" + file.encoding() + " category=" + file.category());
    }
    config.logFile().map(Path::toString).ifPresent(path -> CliPrinter.println("  Log file: " + path));
  }

  private static void awaitQuietly(CountDownLatch finished) {
    try {
      if (!finished.await(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Server did not finish closing within {} ms", SHUTDOWN_GRACE_MILLIS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for server shutdown");
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook retained");
    }
  }
}
