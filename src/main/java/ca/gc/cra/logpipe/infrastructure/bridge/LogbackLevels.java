package ca.gc.cra.logpipe.infrastructure.bridge;

import ca.gc.cra.logpipe.domain.log.LogLevel;
import ch.qos.logback.classic.Level;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed translation from pipeline severities to Logback levels.
 *
 * <p>Logback has nothing above {@link Level#ERROR}, so {@link LogLevel#CRITICAL} shares it and is told apart
 * by the {@code CRITICAL} marker the bridge attaches.</p>
 *
 * @since 0.1.0
 */
final class LogbackLevels {
  private static final Map<LogLevel, Level> MAPPING;

  static {
    Map<LogLevel, Level> mapping = new EnumMap<>(LogLevel.class);
    mapping.put(LogLevel.DEBUG, Level.DEBUG);
    mapping.put(LogLevel.INFO, Level.INFO);
    mapping.put(LogLevel.WARN, Level.WARN);
    mapping.put(LogLevel.ERROR, Level.ERROR);
    mapping.put(LogLevel.CRITICAL, Level.ERROR);
    MAPPING = Collections.unmodifiableMap(mapping);
  }

  private LogbackLevels() {
    // Utility
  }

  /**
   * Maps a raw event level to Logback.
   *
   * @param rawLevel value of the event's level field; may be {@code null} or of any type
   * @return mapped level, or {@link Level#INFO} for absent and unrecognised values
   */
  static Level toLogback(Object rawLevel) {
    if (rawLevel instanceof LogLevel level) {
      return MAPPING.get(level);
    }
    return Level.INFO;
  }
}
