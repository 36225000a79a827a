package ca.gc.cra.logpipe.domain.log;

import java.util.Locale;

/**
 * Severity of a log event, ordered from least to most severe.
 *
 * <p>Declaration order is the total order used for threshold comparisons:
 * {@code DEBUG < INFO < WARN < ERROR < CRITICAL}.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR,
  CRITICAL;

  /**
   * Returns the canonical lower-case name used in configuration files.
   *
   * @return level name such as {@code "warn"}
   */
  public String levelName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Indicates whether this level sorts strictly below {@code other}.
   *
   * @param other level to compare against; must not be {@code null}
   * @return {@code true} when this level is less severe than {@code other}
   */
  public boolean isBelow(LogLevel other) {
    return compareTo(other) < 0;
  }

  /**
   * Resolves a level from its name, ignoring case and surrounding whitespace.
   *
   * @param name level name such as {@code "debug"}
   * @return matching level
   * @throws InvalidLogLevelException when {@code name} is {@code null} or names no level
   */
  public static LogLevel levelWithName(String name) {
    if (name == null) {
      throw new InvalidLogLevelException("Log level name must not be null");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (LogLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new InvalidLogLevelException("Unknown log level name: " + name);
  }
}
