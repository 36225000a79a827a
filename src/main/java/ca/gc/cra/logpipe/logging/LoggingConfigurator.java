package ca.gc.cra.logpipe.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback logger levels at runtime.
 * <p><strong>Role:</strong> Used by the pipeline factory to apply the configured sink level before events flow.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded start-up; Logback handles level visibility.</p>
 * <p><strong>Observability:</strong> Warns when the SLF4J backend does not support dynamic level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the level of the named Logback logger.
   *
   * @param loggerName logger to adjust; must not be {@code null}
   * @param level Logback level name such as {@code debug}; must not be {@code null}
   * @return {@code true} when the level was applied
   * @throws IllegalArgumentException when {@code level} is not a Logback level name
   */
  public static boolean setLevel(String loggerName, String level) {
    Objects.requireNonNull(loggerName, "loggerName");
    Objects.requireNonNull(level, "level");
    Level parsed = Level.toLevel(level.trim(), null);
    if (parsed == null) {
      throw new IllegalArgumentException("Unknown Logback level '" + level + "' for logger " + loggerName);
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      logger.setLevel(parsed);
      return true;
    }
    log.warn("Level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
