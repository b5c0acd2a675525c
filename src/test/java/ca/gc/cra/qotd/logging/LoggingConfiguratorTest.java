package ca.gc.cra.qotd.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  private Level originalLevel;

  @BeforeEach
  void setUp() {
    originalLevel = LoggingConfigurator.rootLevel();
  }

  @AfterEach
  void tearDown() {
    LoggingConfigurator.detachFileAppender();
    ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(originalLevel);
  }

  @Test
  void verbosityFlagsMapToRootLevels() {
    LoggingConfigurator.applyVerbosity(Verbosity.from(true, 3));
    assertEquals(Level.ERROR, LoggingConfigurator.rootLevel());

    LoggingConfigurator.applyVerbosity(Verbosity.from(false, 0));
    assertEquals(Level.WARN, LoggingConfigurator.rootLevel());

    LoggingConfigurator.applyVerbosity(Verbosity.from(false, 1));
    assertEquals(Level.INFO, LoggingConfigurator.rootLevel());

    LoggingConfigurator.applyVerbosity(Verbosity.from(false, 2));
    assertEquals(Level.DEBUG, LoggingConfigurator.rootLevel());

    LoggingConfigurator.applyVerbosity(Verbosity.from(false, 5));
    assertEquals(Level.TRACE, LoggingConfigurator.rootLevel());
  }

  @Test
  void fileAppenderMirrorsEventsWithConnectionContext() throws IOException {
    Path logFile = tempDir.resolve("qotd.log");
    LoggingConfigurator.applyVerbosity(Verbosity.INFO);

    assertTrue(LoggingConfigurator.attachFileAppender(logFile));
    Logger log = LoggerFactory.getLogger("ca.gc.cra.qotd.test");
    MDC.put("transport", "udp");
    MDC.put("client", "127.0.0.1:4040");
    try {
      log.info("Served 12 byte quote");
    } finally {
      MDC.clear();
    }
    LoggingConfigurator.detachFileAppender();

    String content = Files.readString(logFile, StandardCharsets.UTF_8);
    assertTrue(content.contains("Served 12 byte quote"), content);
    assertTrue(content.contains("udp 127.0.0.1:4040"), content);
  }
}
