package ca.gc.cra.qotd.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qotd.logging.LoggingConfigurator;
import ca.gc.cra.qotd.testutil.QuoteFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private Level originalRootLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ServeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    originalRootLevel = rootLogger().getLevel();
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    rootLogger().setLevel(originalRootLevel);
    LoggingConfigurator.detachFileAppender();
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunIndexesCorpusAndPrintsSummary() throws IOException {
    Path corpus = Files.createDirectories(tempDir.resolve("fortunes"));
    QuoteFixtures.writeQuotes(corpus, "art", "a1\n", "a2\n");
    QuoteFixtures.writeQuotes(corpus, "limerick-o", "o1\n");

    ExitCode code = ServeCli.run(new String[] {"dir=" + corpus, "port=0", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("QOTD serve dry-run"), output);
    assertTrue(output.contains("Categories: decorous"), output);
    assertTrue(output.contains("Files: 1"), output);
    assertTrue(output.contains("Quotes: 2"), output);
    assertTrue(output.contains("art quotes=2 encoding=PLAIN category=DECOROUS"), output);
  }

  @Test
  void allFlagWidensCorpus() throws IOException {
    Path corpus = Files.createDirectories(tempDir.resolve("fortunes"));
    QuoteFixtures.writeQuotes(corpus, "art", "a1\n");
    QuoteFixtures.writeQuotes(corpus, "limerick-o", "o1\n", "o2\n");

    ExitCode code = ServeCli.run(new String[] {"dir=" + corpus, "--all", "--offensive", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Quotes: 3"), buffer.toString());
  }

  @Test
  void yamlConfigSuppliesSettingsThatCliOverrides() throws IOException {
    Path corpus = Files.createDirectories(tempDir.resolve("fortunes"));
    QuoteFixtures.writeQuotes(corpus, "limerick-o", "o1\n");
    Path yaml = Files.writeString(tempDir.resolve("qotd.yaml"), """
        serve:
          dir: %s
          categories: offensive
          port: 1717
        """.formatted(corpus));

    ExitCode code = ServeCli.run(new String[] {"config=" + yaml, "port=2727", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Categories: offensive"), output);
    assertTrue(output.contains("Bind: 127.0.0.1:2727"), output);
  }

  @Test
  void emptyCorpusIsAConfigurationError() throws IOException {
    Path corpus = Files.createDirectories(tempDir.resolve("empty"));
    QuoteFixtures.writeQuotes(corpus, "only-o", "o1\n");

    ExitCode code = ServeCli.run(new String[] {"dir=" + corpus, "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().startsWith("No quotes to serve"));
    assertTrue(logged);
  }

  @Test
  void invalidPortPrintsUsage() {
    ExitCode code = ServeCli.run(new String[] {"dir=" + tempDir, "port=70000", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: qotd serve"));
  }

  @Test
  void missingCorpusDirectoryIsInvalid() {
    ExitCode code = ServeCli.run(new String[] {"dir=" + tempDir.resolve("missing"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("directory does not exist"));
    assertTrue(logged);
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = ServeCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unknownCategoryIsInvalid() {
    ExitCode code = ServeCli.run(new String[] {"dir=" + tempDir, "categories=rude", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void logFileReceivesIndexingMessages() throws IOException {
    Path corpus = Files.createDirectories(tempDir.resolve("fortunes"));
    QuoteFixtures.writeQuotes(corpus, "art", "a1\n");
    Path logFile = tempDir.resolve("qotd.log");

    ExitCode code = ServeCli.run(
        new String[] {"dir=" + corpus, "logFile=" + logFile, "-v", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    LoggingConfigurator.detachFileAppender();
    String content = Files.readString(logFile);
    assertTrue(content.contains("Indexed file"), content);
    assertTrue(buffer.toString().contains("Log file: " + logFile), buffer.toString());
  }

  @Test
  void helpPrintsOptions() {
    ExitCode code = ServeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("brokerQueueCapacity=N"));
    assertFalse(buffer.toString().contains("usage: qotd serve"));
  }

  private static Logger rootLogger() {
    return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  }
}
