package ca.gc.cra.strata.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the verbosity of STRATA's internal diagnostics at runtime.
 * <p><strong>Why:</strong> Lets operators see sink and dispatcher debug output by setting {@code verbose: true}
 * in configuration instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap thread that builds loggers.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String STRATA_LOGGER = "ca.gc.cra.strata";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Sets the level of STRATA's own loggers without touching the host application's loggers.
   *
   * @param levelName Logback level name such as {@code WARN}
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setEngineLevel(String levelName) {
    return setLevel(STRATA_LOGGER, Level.toLevel(levelName, Level.INFO));
  }

  private static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
