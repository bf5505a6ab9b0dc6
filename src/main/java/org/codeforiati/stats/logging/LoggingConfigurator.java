package org.codeforiati.stats.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging from engine configuration.
 * <p><strong>Why:</strong> Missing-data fallbacks and version defaults log at DEBUG; operators switch them on with
 * {@code verbose: true} instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded start-up.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Lowers the root logger level to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level.
   *
   * @param level target Logback level
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
        log.debug("Root log level set to {}", level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }

  /** Returns the effective root level, or {@code null} when the backend is not Logback. */
  public static Level rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }
    return null;
  }
}
