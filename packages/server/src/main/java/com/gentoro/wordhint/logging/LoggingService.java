package com.gentoro.wordhint.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying log levels from the application
 * configuration.
 *
 * <p>Levels are read from {@code logging.level.<alias>}, where the alias is one of {@code root},
 * {@code app} or {@code jetty}.
 */
public final class LoggingService {
  private static final Map<String, String> LOGGER_ALIASES =
      Map.of(
          "root", Logger.ROOT_LOGGER_NAME,
          "app", "com.gentoro.wordhint",
          "jetty", "org.eclipse.jetty");

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply configured levels. Unknown level names are reported and ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      // Another SLF4J binding is active, levels are managed elsewhere.
      return;
    }
    Logger log = getLogger(LoggingService.class);
    LOGGER_ALIASES.forEach(
        (alias, loggerName) -> {
          String value = configuration.getString("logging.level." + alias, null);
          if (value == null || value.isBlank()) return;
          Level level = Level.toLevel(value.trim(), null);
          if (level == null) {
            log.warn("Ignoring unknown log level '{}' for logging.level.{}", value, alias);
            return;
          }
          context.getLogger(loggerName).setLevel(level);
          log.trace("Log level for {} set to {}", loggerName, level);
        });
  }
}
