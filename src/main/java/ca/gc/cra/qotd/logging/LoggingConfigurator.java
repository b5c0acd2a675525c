package ca.gc.cra.qotd.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Lets operators raise or lower verbosity and mirror logs into a file without editing
 * {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges CLI flags to the logging backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Set the root level from {@link Verbosity}.</li>
 *   <li>Attach a file appender for {@code logFile=}.</li>
 *   <li>Warn when the backend does not support dynamic changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  static final String FILE_APPENDER_NAME = "QOTD_FILE";
  private static final String FILE_PATTERN =
      "%d{yyyy-MM-dd'T'HH:mm:ss.SSSXXX} %-5level [%thread] %logger{36} %X{transport} %X{client} - %msg%n";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger level for the requested verbosity.
   *
   * @param verbosity selected verbosity; must not be {@code null}
   */
  public static void applyVerbosity(Verbosity verbosity) {
    Objects.requireNonNull(verbosity, "verbosity");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!verbosity.level().equals(root.getLevel())) {
        root.setLevel(verbosity.level());
      }
      return;
    }
    log.warn("Logging level {} requested but backend {} does not support dynamic level updates",
        verbosity, factory.getClass().getName());
  }

  /**
   * Mirrors every log event into {@code file}, appending if it exists. Replaces a file appender attached
   * by an earlier call.
   *
   * @param file destination log file; must not be {@code null}
   * @return {@code true} if the appender was attached
   */
  public static boolean attachFileAppender(Path file) {
    Objects.requireNonNull(file, "file");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Log file {} requested but backend {} does not support programmatic appenders",
          file, factory.getClass().getName());
      return false;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    detachFileAppender();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER_NAME);
    appender.setFile(file.toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);
    appender.start();
    if (!appender.isStarted()) {
      log.warn("Unable to open log file {}; continuing with console logging only", file);
      return false;
    }
    root.addAppender(appender);
    log.debug("Mirroring logs to {}", file);
    return true;
  }

  /**
   * Detaches and stops the file appender, if any.
   */
  public static void detachFileAppender() {
    if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Appender<ILoggingEvent> existing = root.getAppender(FILE_APPENDER_NAME);
      if (existing != null) {
        root.detachAppender(existing);
        existing.stop();
      }
    }
  }

  /**
   * Returns the current root level, or {@code null} for non-Logback backends.
   *
   * @return root level
   */
  static Level rootLevel() {
    if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }
    return null;
  }
}
