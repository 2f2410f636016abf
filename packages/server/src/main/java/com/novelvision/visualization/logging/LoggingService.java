package com.novelvision.visualization.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Components obtain their logger here so logging levels can be
 * driven from {@code application.yaml}:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.novelvision.visualization.pipeline: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context. Unknown level names are ignored
   * with a warning; a non-Logback SLF4J binding leaves levels untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key);
      // Dotted YAML keys come back with their dots escaped.
      String loggerName = key.replace("..", ".");
      Level level = Level.toLevel(value, null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      String target = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
    }
  }
}
